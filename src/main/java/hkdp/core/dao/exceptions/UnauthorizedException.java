/*
 * This file is part of Bisq.
 *
 * Bisq is free software: you can redistribute it and/or modify it
 * under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or (at
 * your option) any later version.
 *
 * Bisq is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public
 * License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with Bisq. If not, see <http://www.gnu.org/licenses/>.
 */

package hkdp.core.dao.exceptions;

import hkdp.core.dao.Address;

import lombok.Getter;

import javax.annotation.Nullable;

/**
 * Caller lacks the required voting weight or role.
 */
public class UnauthorizedException extends DaoException {
    @Getter
    @Nullable
    private final Address caller;

    public UnauthorizedException(String message, @Nullable Address caller) {
        super(message);
        this.caller = caller;
    }

    public UnauthorizedException(String message) {
        this(message, null);
    }
}

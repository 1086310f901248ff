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

package hkdp.core.dao.governance.proposal;

import lombok.Getter;

/**
 * Each type has exactly one proposal slot, so only one proposal per type can be open at a time.
 */
public enum ProposalType {
    ADD_MERCHANT("Add merchant"),
    MODIFY_MERCHANT("Modify merchant"),
    CHANGE_PARAM("Change majority percentage"),
    WITHDRAW_FUNDS("Withdraw funds");

    @Getter
    private final String displayName;

    ProposalType(String displayName) {
        this.displayName = displayName;
    }
}

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

package hkdp.core.dao.state.events;

import hkdp.core.dao.Address;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

import javax.annotation.concurrent.Immutable;

/**
 * Carries the values of the merchant account after the modification.
 */
@Immutable
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@Value
public class MerchantModifiedEvent extends DaoEvent {
    private final Address merchant;
    private final Address guardian;
    private final boolean frozen;
    private final long printQuota;
    private final int rebate;

    public MerchantModifiedEvent(Address merchant,
                                 Address guardian,
                                 boolean frozen,
                                 long printQuota,
                                 int rebate,
                                 long time) {
        super(time);
        this.merchant = merchant;
        this.guardian = guardian;
        this.frozen = frozen;
        this.printQuota = printQuota;
        this.rebate = rebate;
    }
}

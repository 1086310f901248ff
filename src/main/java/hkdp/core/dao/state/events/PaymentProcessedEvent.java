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
 * {@code burned + rebateAmount == amount}. The rebate amount is not moved, it stays with the payer.
 */
@Immutable
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@Value
public class PaymentProcessedEvent extends DaoEvent {
    private final Address merchant;
    private final Address user;
    private final long amount;
    private final long burned;
    private final long rebateAmount;

    public PaymentProcessedEvent(Address merchant, Address user, long amount, long burned, long rebateAmount, long time) {
        super(time);
        this.merchant = merchant;
        this.user = user;
        this.amount = amount;
        this.burned = burned;
        this.rebateAmount = rebateAmount;
    }
}

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

import hkdp.core.dao.Address;

import lombok.Value;

import javax.annotation.concurrent.Immutable;

/**
 * Outcome of a deposit request. If allowance or balance of the initiator did not cover the requested amount
 * the deposit is recorded with amount 0 and {@code collected=false}, the proposal is opened anyway.
 */
@Immutable
@Value
public class Deposit {
    private final Address asset;
    private final long requestedAmount;
    private final long amount;
    private final boolean collected;

    public static Deposit collected(DepositRequest request) {
        return new Deposit(request.getAsset(), request.getAmount(), request.getAmount(), true);
    }

    public static Deposit notCollected(DepositRequest request) {
        return new Deposit(request.getAsset(), request.getAmount(), 0, false);
    }
}

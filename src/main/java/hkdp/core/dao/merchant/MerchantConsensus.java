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

package hkdp.core.dao.merchant;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.math.LongMath;

import static com.google.common.base.Preconditions.checkArgument;

public class MerchantConsensus {
    public static final int MAX_REBATE = 10;

    public static boolean isRebateValid(int rebate) {
        return rebate >= 0 && rebate <= MAX_REBATE;
    }

    /**
     * The part of a payment which gets burned. The rebate part stays with the payer.
     */
    public static long getBurnAmount(long amount, int rebate) {
        checkArgument(isRebateValid(rebate), "Invalid rebate %s", rebate);
        return getPercentage(amount, 100 - rebate);
    }

    // Result equals floor(amount * percentage / 100) but cannot overflow for percentage <= 100
    @VisibleForTesting
    static long getPercentage(long amount, int percentage) {
        checkArgument(amount >= 0, "amount must not be negative");
        checkArgument(percentage >= 0 && percentage <= 100, "percentage must be in [0, 100]");
        return amount / 100 * percentage + amount % 100 * percentage / 100;
    }

    public static boolean isWithinQuota(long totalCashReceived, long amount, long totalRecycled, long printQuota) {
        // Compared as totalCashReceived - totalRecycled + amount <= printQuota
        long netOutstanding = totalCashReceived - totalRecycled;
        return amount <= LongMath.saturatedSubtract(printQuota, netOutstanding);
    }
}

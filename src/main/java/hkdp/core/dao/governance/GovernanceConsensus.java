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

package hkdp.core.dao.governance;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Rules for passing a proposal. All methods are deterministic and depend only on their arguments.
 */
public class GovernanceConsensus {
    public static final int MAX_MAJORITY_PERCENTAGE = 30;

    public static boolean isValidMajorityPercentage(int majorityPercentage) {
        return majorityPercentage > 0 && majorityPercentage <= MAX_MAJORITY_PERCENTAGE;
    }

    /**
     * Equals floor(totalWeight * majorityPercentage / 100) without the risk of an overflow in the multiplication.
     */
    public static long getThreshold(long totalWeight, int majorityPercentage) {
        checkArgument(totalWeight >= 0, "totalWeight must not be negative");
        checkArgument(majorityPercentage >= 0 && majorityPercentage <= 100,
                "majorityPercentage must be in [0, 100]");
        return totalWeight / 100 * majorityPercentage + totalWeight % 100 * majorityPercentage / 100;
    }

    public static boolean isPassed(long accumulatedPower, long threshold) {
        return accumulatedPower >= threshold;
    }
}

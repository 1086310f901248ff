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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class MerchantConsensusTest {

    @Test
    public void testGetBurnAmount() {
        assertEquals(100, MerchantConsensus.getBurnAmount(100, 0));
        assertEquals(90, MerchantConsensus.getBurnAmount(100, 10));
        // floor(55 * 95 / 100) = floor(52.25)
        assertEquals(52, MerchantConsensus.getBurnAmount(55, 5));
        assertEquals(0, MerchantConsensus.getBurnAmount(1, 10));
        assertEquals(Long.MAX_VALUE / 100 * 90 + Long.MAX_VALUE % 100 * 90 / 100,
                MerchantConsensus.getBurnAmount(Long.MAX_VALUE, 10));
        assertThrows(IllegalArgumentException.class, () -> MerchantConsensus.getBurnAmount(100, 11));
    }

    @Test
    public void testGetPercentage() {
        for (long amount = 0; amount < 1000; amount += 7) {
            for (int percentage = 0; percentage <= 100; percentage += 9)
                assertEquals(amount * percentage / 100, MerchantConsensus.getPercentage(amount, percentage));
        }
    }

    @Test
    public void testIsRebateValid() {
        assertTrue(MerchantConsensus.isRebateValid(0));
        assertTrue(MerchantConsensus.isRebateValid(10));
        assertFalse(MerchantConsensus.isRebateValid(11));
        assertFalse(MerchantConsensus.isRebateValid(-1));
    }

    @Test
    public void testIsWithinQuota() {
        assertTrue(MerchantConsensus.isWithinQuota(0, 100, 0, 100));
        assertFalse(MerchantConsensus.isWithinQuota(100, 1, 0, 100));
        assertTrue(MerchantConsensus.isWithinQuota(100, 50, 50, 100));
        assertFalse(MerchantConsensus.isWithinQuota(100, 51, 50, 100));
        // More recycled than minted leaves extra room
        assertTrue(MerchantConsensus.isWithinQuota(10, 105, 15, 100));
        assertFalse(MerchantConsensus.isWithinQuota(0, Long.MAX_VALUE, 0, 100));
        assertTrue(MerchantConsensus.isWithinQuota(0, Long.MAX_VALUE, 0, Long.MAX_VALUE));
    }
}

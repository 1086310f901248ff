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

package hkdp.core.dao.token;

import org.junit.Test;

import static hkdp.core.dao.DaoAddresses.ALICE;
import static hkdp.core.dao.DaoAddresses.BOB;
import static hkdp.core.dao.DaoAddresses.SHARE_TOKEN;
import static org.junit.Assert.assertEquals;

public class TokenVotingPowerSourceTest {

    @Test
    public void testWeightIsLiveBalance() {
        InMemoryToken shareToken = new InMemoryToken(SHARE_TOKEN, "SHARE");
        TokenVotingPowerSource votingPowerSource = new TokenVotingPowerSource(shareToken);
        assertEquals(0, votingPowerSource.weight(ALICE));
        assertEquals(0, votingPowerSource.totalWeight());

        shareToken.mint(ALICE, 100);
        shareToken.mint(BOB, 50);
        assertEquals(100, votingPowerSource.weight(ALICE));
        assertEquals(150, votingPowerSource.totalWeight());

        shareToken.transfer(ALICE, BOB, 40);
        assertEquals(60, votingPowerSource.weight(ALICE));
        assertEquals(90, votingPowerSource.weight(BOB));
        assertEquals(150, votingPowerSource.totalWeight());
    }
}

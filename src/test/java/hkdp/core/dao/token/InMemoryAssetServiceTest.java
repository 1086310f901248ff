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

import hkdp.core.dao.Address;

import org.junit.Before;
import org.junit.Test;

import static hkdp.core.dao.DaoAddresses.ALICE;
import static hkdp.core.dao.DaoAddresses.BOB;
import static hkdp.core.dao.DaoAddresses.CURRENCY_TOKEN;
import static hkdp.core.dao.DaoAddresses.LEDGER;
import static hkdp.core.dao.DaoAddresses.SHARE_TOKEN;
import static hkdp.core.dao.DaoAddresses.address;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class InMemoryAssetServiceTest {
    private InMemoryToken shareToken;
    private InMemoryToken currencyToken;
    private InMemoryAssetService assetService;

    @Before
    public void setup() {
        shareToken = new InMemoryToken(SHARE_TOKEN, "SHARE");
        currencyToken = new InMemoryToken(CURRENCY_TOKEN, "HKDP");
        assetService = new InMemoryAssetService(shareToken, currencyToken);
    }

    @Test
    public void testTokenRouting() {
        currencyToken.mint(ALICE, 10);
        assertEquals(10, assetService.balanceOf(CURRENCY_TOKEN, ALICE));
        assertEquals(0, assetService.balanceOf(SHARE_TOKEN, ALICE));

        currencyToken.approve(ALICE, LEDGER, 5);
        assertEquals(5, assetService.allowance(CURRENCY_TOKEN, ALICE, LEDGER));
        assertTrue(assetService.transferFrom(CURRENCY_TOKEN, LEDGER, ALICE, LEDGER, 5));
        assertEquals(5, currencyToken.balanceOf(LEDGER));

        assertTrue(assetService.transfer(CURRENCY_TOKEN, LEDGER, BOB, 5));
        assertEquals(5, currencyToken.balanceOf(BOB));
    }

    @Test
    public void testNative() {
        assetService.creditNative(LEDGER, 7);
        assertEquals(7, assetService.balanceOf(Address.NATIVE, LEDGER));
        assertEquals(0, assetService.allowance(Address.NATIVE, LEDGER, ALICE));
        assertFalse(assetService.transferFrom(Address.NATIVE, ALICE, LEDGER, ALICE, 1));

        assertFalse(assetService.transfer(Address.NATIVE, LEDGER, ALICE, 8));
        assertTrue(assetService.transfer(Address.NATIVE, LEDGER, ALICE, 7));
        assertEquals(0, assetService.balanceOf(Address.NATIVE, LEDGER));
        assertEquals(7, assetService.balanceOf(Address.NATIVE, ALICE));
    }

    @Test
    public void testUnknownAsset() {
        Address unknown = address(0xdead);
        assertEquals(0, assetService.balanceOf(unknown, ALICE));
        assertFalse(assetService.transfer(unknown, ALICE, BOB, 1));

        InMemoryToken other = new InMemoryToken(unknown, "OTHER");
        other.mint(ALICE, 3);
        assetService.addToken(other);
        assertEquals(3, assetService.balanceOf(unknown, ALICE));

        assertThrows(IllegalArgumentException.class,
                () -> assetService.addToken(new InMemoryToken(Address.ZERO, "ZERO")));
    }

    @Test
    public void testRevertJournal() {
        assetService.creditNative(LEDGER, 7);
        currencyToken.mint(ALICE, 10);

        assetService.beginJournal();
        assertTrue(assetService.transfer(Address.NATIVE, LEDGER, ALICE, 7));
        assertTrue(assetService.transfer(CURRENCY_TOKEN, ALICE, BOB, 10));
        assetService.creditNative(BOB, 3);
        assetService.revertJournal();

        assertEquals(7, assetService.balanceOf(Address.NATIVE, LEDGER));
        assertEquals(0, assetService.balanceOf(Address.NATIVE, ALICE));
        assertEquals(0, assetService.balanceOf(Address.NATIVE, BOB));
        assertEquals(10, currencyToken.balanceOf(ALICE));
        assertEquals(0, currencyToken.balanceOf(BOB));
    }

    @Test
    public void testNoTokenAddedWhileJournalIsActive() {
        assetService.beginJournal();
        assertThrows(IllegalStateException.class,
                () -> assetService.addToken(new InMemoryToken(address(0xbeef), "OTHER")));
        assetService.commitJournal();
        assetService.addToken(new InMemoryToken(address(0xbeef), "OTHER"));
    }
}


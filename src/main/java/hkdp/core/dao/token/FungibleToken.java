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

/**
 * Minimal fungible token as seen by the DAO. Transfers report failure by returning false, mint and burn are
 * only called after the ledger has checked their preconditions and throw on violation.
 */
public interface FungibleToken extends Revertible {

    Address getAddress();

    String getSymbol();

    long balanceOf(Address account);

    long totalSupply();

    long allowance(Address owner, Address spender);

    void approve(Address owner, Address spender, long amount);

    boolean transfer(Address from, Address to, long amount);

    /**
     * Moves {@code amount} from {@code from} to {@code to} using the allowance {@code from} has given to
     * {@code spender}.
     */
    boolean transferFrom(Address spender, Address from, Address to, long amount);

    void mint(Address to, long amount);

    void burn(Address from, long amount);
}

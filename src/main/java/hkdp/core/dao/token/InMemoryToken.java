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

import com.google.common.math.LongMath;

import java.util.HashMap;
import java.util.Map;

import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Balance and allowance book keeping of a fungible token held in memory.
 */
@Slf4j
public class InMemoryToken implements FungibleToken {
    @Value
    private static class AllowanceKey {
        Address owner;
        Address spender;
    }

    @Getter
    private final Address address;
    @Getter
    private final String symbol;

    private final Map<Address, Long> balances = new HashMap<>();
    private final Map<AllowanceKey, Long> allowances = new HashMap<>();
    private long totalSupply;

    private final ValueJournal<Address, Long> balanceJournal = new ValueJournal<>(balances);
    private final ValueJournal<AllowanceKey, Long> allowanceJournal = new ValueJournal<>(allowances);
    private long journaledTotalSupply;

    public InMemoryToken(Address address, String symbol) {
        this.address = checkNotNull(address, "address must not be null");
        this.symbol = checkNotNull(symbol, "symbol must not be null");
    }

    @Override
    public synchronized long balanceOf(Address account) {
        return balances.getOrDefault(account, 0L);
    }

    @Override
    public synchronized long totalSupply() {
        return totalSupply;
    }

    @Override
    public synchronized long allowance(Address owner, Address spender) {
        return allowances.getOrDefault(new AllowanceKey(owner, spender), 0L);
    }

    @Override
    public synchronized void approve(Address owner, Address spender, long amount) {
        checkArgument(amount >= 0, "amount must not be negative");
        setAllowance(new AllowanceKey(owner, spender), amount);
    }

    @Override
    public synchronized boolean transfer(Address from, Address to, long amount) {
        if (amount < 0 || from == null || to == null || balanceOf(from) < amount)
            return false;

        move(from, to, amount);
        return true;
    }

    @Override
    public synchronized boolean transferFrom(Address spender, Address from, Address to, long amount) {
        long allowance = allowance(from, spender);
        if (allowance < amount || !transfer(from, to, amount))
            return false;

        setAllowance(new AllowanceKey(from, spender), allowance - amount);
        return true;
    }

    @Override
    public synchronized void mint(Address to, long amount) {
        checkNotNull(to, "to must not be null");
        checkArgument(amount > 0, "amount must be positive");
        totalSupply = LongMath.checkedAdd(totalSupply, amount);
        setBalance(to, balanceOf(to) + amount);
        log.debug("Minted {} {} to {}", amount, symbol, to);
    }

    @Override
    public synchronized void burn(Address from, long amount) {
        checkArgument(amount >= 0, "amount must not be negative");
        long balance = balanceOf(from);
        checkState(balance >= amount, "Burn exceeds balance. balance=%s, amount=%s", balance, amount);
        setBalance(from, balance - amount);
        totalSupply -= amount;
        log.debug("Burned {} {} from {}", amount, symbol, from);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Revertible
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Override
    public synchronized void beginJournal() {
        balanceJournal.begin();
        allowanceJournal.begin();
        journaledTotalSupply = totalSupply;
    }

    @Override
    public synchronized void commitJournal() {
        balanceJournal.commit();
        allowanceJournal.commit();
    }

    @Override
    public synchronized void revertJournal() {
        if (!balanceJournal.isActive())
            return;

        balanceJournal.revert();
        allowanceJournal.revert();
        totalSupply = journaledTotalSupply;
        log.debug("Reverted journal of {}", symbol);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Private
    ///////////////////////////////////////////////////////////////////////////////////////////

    private void move(Address from, Address to, long amount) {
        setBalance(from, balanceOf(from) - amount);
        setBalance(to, LongMath.checkedAdd(balanceOf(to), amount));
    }

    private void setBalance(Address account, long balance) {
        balanceJournal.record(account);
        balances.put(account, balance);
    }

    private void setAllowance(AllowanceKey key, long amount) {
        allowanceJournal.record(key);
        allowances.put(key, amount);
    }

    @Override
    public String toString() {
        return "InMemoryToken{" +
                "\n     symbol='" + symbol + '\'' +
                ",\n     address=" + address +
                ",\n     totalSupply=" + totalSupply +
                "\n}";
    }
}

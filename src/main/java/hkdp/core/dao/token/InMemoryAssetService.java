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
import hkdp.core.dao.DaoOptionKeys;

import com.google.common.math.LongMath;

import javax.inject.Inject;
import javax.inject.Named;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Routes asset operations to the registered tokens and keeps native currency balances itself.
 */
@Slf4j
public class InMemoryAssetService implements AssetService {
    private final Map<Address, FungibleToken> tokens = new HashMap<>();
    private final Map<Address, Long> nativeBalances = new HashMap<>();
    private final ValueJournal<Address, Long> nativeJournal = new ValueJournal<>(nativeBalances);

    @Inject
    public InMemoryAssetService(@Named(DaoOptionKeys.SHARE_TOKEN) FungibleToken shareToken,
                                @Named(DaoOptionKeys.CURRENCY_TOKEN) FungibleToken currencyToken) {
        addToken(shareToken);
        addToken(currencyToken);
    }

    public synchronized void addToken(FungibleToken token) {
        checkArgument(!token.getAddress().isZero(), "The zero address is reserved for the native currency");
        checkState(!nativeJournal.isActive(), "Tokens cannot be added while a journal is active");
        tokens.put(token.getAddress(), token);
    }

    public synchronized void creditNative(Address holder, long amount) {
        checkArgument(amount > 0, "amount must be positive");
        setNativeBalance(holder, LongMath.checkedAdd(nativeBalances.getOrDefault(holder, 0L), amount));
    }

    @Override
    public synchronized long balanceOf(Address asset, Address holder) {
        if (asset.isZero())
            return nativeBalances.getOrDefault(holder, 0L);

        return getToken(asset).map(token -> token.balanceOf(holder)).orElse(0L);
    }

    @Override
    public synchronized long allowance(Address asset, Address owner, Address spender) {
        if (asset.isZero())
            return 0;

        return getToken(asset).map(token -> token.allowance(owner, spender)).orElse(0L);
    }

    @Override
    public synchronized boolean transfer(Address asset, Address from, Address to, long amount) {
        if (asset.isZero()) {
            long balance = nativeBalances.getOrDefault(from, 0L);
            if (amount < 0 || balance < amount)
                return false;
            setNativeBalance(from, balance - amount);
            setNativeBalance(to, LongMath.checkedAdd(nativeBalances.getOrDefault(to, 0L), amount));
            return true;
        }

        Optional<FungibleToken> token = getToken(asset);
        if (!token.isPresent()) {
            log.warn("Transfer of unknown asset requested. asset={}", asset);
            return false;
        }
        return token.get().transfer(from, to, amount);
    }

    @Override
    public synchronized boolean transferFrom(Address asset, Address spender, Address from, Address to, long amount) {
        if (asset.isZero())
            return false;

        return getToken(asset).map(token -> token.transferFrom(spender, from, to, amount)).orElse(false);
    }



    ///////////////////////////////////////////////////////////////////////////////////////////
    // Revertible
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Override
    public synchronized void beginJournal() {
        nativeJournal.begin();
        tokens.values().forEach(FungibleToken::beginJournal);
    }

    @Override
    public synchronized void commitJournal() {
        nativeJournal.commit();
        tokens.values().forEach(FungibleToken::commitJournal);
    }

    @Override
    public synchronized void revertJournal() {
        nativeJournal.revert();
        tokens.values().forEach(FungibleToken::revertJournal);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Private
    ///////////////////////////////////////////////////////////////////////////////////////////

    private void setNativeBalance(Address holder, long balance) {
        nativeJournal.record(holder);
        nativeBalances.put(holder, balance);
    }

    private Optional<FungibleToken> getToken(Address asset) {
        return Optional.ofNullable(tokens.get(asset));
    }
}

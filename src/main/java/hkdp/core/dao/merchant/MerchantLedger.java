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

import hkdp.core.dao.Address;
import hkdp.core.dao.DaoOptionKeys;
import hkdp.core.dao.exceptions.DuplicateMerchantException;
import hkdp.core.dao.exceptions.FrozenException;
import hkdp.core.dao.exceptions.InvalidAmountException;
import hkdp.core.dao.exceptions.NotRegisteredMerchantException;
import hkdp.core.dao.exceptions.RebateOutOfRangeException;
import hkdp.core.dao.exceptions.TransferFailedException;
import hkdp.core.dao.exceptions.UnauthorizedException;
import hkdp.core.dao.exceptions.ValidationException;
import hkdp.core.dao.state.StateService;
import hkdp.core.dao.state.events.DaoEventService;
import hkdp.core.dao.state.events.FundsWithdrawnEvent;
import hkdp.core.dao.state.events.MerchantAddedEvent;
import hkdp.core.dao.state.events.MerchantFrozenEvent;
import hkdp.core.dao.state.events.MerchantModifiedEvent;
import hkdp.core.dao.state.events.MerchantRemovedEvent;
import hkdp.core.dao.state.events.MerchantUnfrozenEvent;
import hkdp.core.dao.state.events.MintedToUserEvent;
import hkdp.core.dao.state.events.PaymentProcessedEvent;
import hkdp.core.dao.token.AssetService;
import hkdp.core.dao.token.FungibleToken;

import com.google.common.math.LongMath;

import javax.inject.Inject;
import javax.inject.Named;

import java.time.Clock;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.apache.commons.lang3.Validate.notEmpty;

/**
 * Merchant accounts and the currency token supply they are allowed to mint. A merchant can mint currency to users
 * as long as the minted amount minus what got recycled through payments stays within its print quota. Payments
 * burn the paid amount less the merchant's rebate.
 * <p>
 * Token effects are always the last step of an operation.
 */
@Slf4j
public class MerchantLedger {
    private final StateService stateService;
    private final FungibleToken currencyToken;
    private final AssetService assetService;
    private final DaoEventService daoEventService;
    private final Clock clock;
    private final Address ownerAddress;
    private final Address governanceAddress;
    private final Address ledgerAddress;
    private final long registrationReward;


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Inject
    public MerchantLedger(StateService stateService,
                          @Named(DaoOptionKeys.CURRENCY_TOKEN) FungibleToken currencyToken,
                          AssetService assetService,
                          DaoEventService daoEventService,
                          Clock clock,
                          @Named(DaoOptionKeys.OWNER_ADDRESS) Address ownerAddress,
                          @Named(DaoOptionKeys.GOVERNANCE_ADDRESS) Address governanceAddress,
                          @Named(DaoOptionKeys.LEDGER_ADDRESS) Address ledgerAddress,
                          @Named(DaoOptionKeys.REGISTRATION_REWARD) long registrationReward) {
        checkArgument(registrationReward >= 0, "registrationReward must not be negative");
        this.stateService = stateService;
        this.currencyToken = currencyToken;
        this.assetService = assetService;
        this.daoEventService = daoEventService;
        this.clock = clock;
        this.ownerAddress = ownerAddress;
        this.governanceAddress = governanceAddress;
        this.ledgerAddress = ledgerAddress;
        this.registrationReward = registrationReward;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Administration
    ///////////////////////////////////////////////////////////////////////////////////////////

    public void addMerchant(Address authority, Address merchant, String name, long quota, Address guardian)
            throws UnauthorizedException, DuplicateMerchantException, ValidationException {
        requireOwnerOrGovernance(authority);
        checkNotNull(merchant, "merchant must not be null");
        checkNotNull(guardian, "guardian must not be null");
        try {
            notEmpty(name, "name must not be empty");
            checkArgument(quota >= 0, "quota must not be negative");
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ValidationException(e);
        }
        if (stateService.isMerchant(merchant))
            throw new DuplicateMerchantException("Merchant is already registered. merchant=" + merchant);

        long now = now();
        stateService.addMerchant(new MerchantAccount(merchant, name, quota, guardian, now));
        log.info("Merchant added. merchant={}, name={}, quota={}, guardian={}", merchant, name, quota, guardian);
        daoEventService.emit(new MerchantAddedEvent(merchant, name, quota, guardian, now));

        if (registrationReward > 0) {
            log.info("Mint registration reward of {} {} to {}", registrationReward, currencyToken.getSymbol(),
                    guardian);
            currencyToken.mint(guardian, registrationReward);
        }
    }

    /**
     * Updates freeze state, quota and rebate of a merchant. The owner, governance and the merchant's guardian can
     * do that, only owner and governance can set a different guardian.
     *
     * @param newGuardian null keeps the current guardian
     */
    public void modifyMerchant(Address caller,
                               Address merchant,
                               @Nullable Address newGuardian,
                               boolean freeze,
                               long quota,
                               int rebate)
            throws NotRegisteredMerchantException, RebateOutOfRangeException, UnauthorizedException,
            ValidationException {
        checkNotNull(caller, "caller must not be null");
        MerchantAccount account = getAccount(merchant);
        if (!MerchantConsensus.isRebateValid(rebate))
            throw new RebateOutOfRangeException(rebate, MerchantConsensus.MAX_REBATE);

        boolean isOwnerOrGovernance = isOwnerOrGovernance(caller);
        if (!isOwnerOrGovernance && !caller.equals(account.getGuardian()))
            throw new UnauthorizedException("Caller is neither owner, governance nor guardian of " + merchant,
                    caller);

        if (newGuardian != null && !newGuardian.equals(account.getGuardian()) && !isOwnerOrGovernance)
            throw new UnauthorizedException("Only owner or governance can change the guardian", caller);

        if (quota < 0)
            throw new ValidationException("quota must not be negative. quota=" + quota);

        long now = now();
        if (newGuardian != null)
            account.setGuardian(newGuardian);
        account.setPrintQuota(quota);
        account.setRebate(rebate);
        if (freeze != account.isFrozen()) {
            account.setFrozen(freeze);
            if (freeze)
                daoEventService.emit(new MerchantFrozenEvent(merchant, now));
            else
                daoEventService.emit(new MerchantUnfrozenEvent(merchant, now));
        }
        log.info("Merchant modified. {}", account);
        daoEventService.emit(new MerchantModifiedEvent(merchant, account.getGuardian(), account.isFrozen(),
                account.getPrintQuota(), account.getRebate(), now));
    }

    public void removeMerchant(Address caller, Address merchant)
            throws UnauthorizedException, NotRegisteredMerchantException {
        requireOwnerOrGovernance(caller);
        MerchantAccount account = getAccount(merchant);
        if (account.getTotalCashReceived() != 0 || account.getTotalRecycled() != 0)
            log.warn("Removing merchant with non zero counters. totalCashReceived={}, totalRecycled={}, " +
                    "netOutstanding={}", account.getTotalCashReceived(), account.getTotalRecycled(),
                    account.getNetOutstanding());

        stateService.removeMerchant(merchant);
        log.info("Merchant removed. merchant={}", merchant);
        daoEventService.emit(new MerchantRemovedEvent(merchant, now()));
    }

    /**
     * Transfers the whole balance the ledger holds of {@code asset} to {@code beneficiary}.
     */
    public void withdraw(Address authority, Address asset, Address beneficiary)
            throws UnauthorizedException, InvalidAmountException, TransferFailedException {
        requireOwnerOrGovernance(authority);
        checkNotNull(asset, "asset must not be null");
        checkNotNull(beneficiary, "beneficiary must not be null");
        long balance = assetService.balanceOf(asset, ledgerAddress);
        if (balance <= 0)
            throw new InvalidAmountException("Ledger has no balance of asset " + asset, balance);

        log.info("Withdraw {} of asset {} to {}", balance, asset, beneficiary);
        daoEventService.emit(new FundsWithdrawnEvent(asset, beneficiary, balance, now()));
        if (!assetService.transfer(asset, ledgerAddress, beneficiary, balance))
            throw new TransferFailedException("Withdrawal failed", asset, balance);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Mint and pay
    ///////////////////////////////////////////////////////////////////////////////////////////

    /**
     * Mints {@code amount} currency to {@code user} against the print quota of {@code merchant}.
     */
    public void mint(Address merchant, Address user, long amount)
            throws NotRegisteredMerchantException, FrozenException, InvalidAmountException {
        checkNotNull(user, "user must not be null");
        MerchantAccount account = getAccount(merchant);
        if (account.isFrozen())
            throw new FrozenException(merchant);

        if (amount <= 0)
            throw new InvalidAmountException("Amount must be positive", amount);

        if (!MerchantConsensus.isWithinQuota(account.getTotalCashReceived(), amount, account.getTotalRecycled(),
                account.getPrintQuota()))
            throw new InvalidAmountException("Amount exceeds the print quota. remainingQuota=" +
                    account.getRemainingQuota(), amount);

        try {
            account.setTotalCashReceived(LongMath.checkedAdd(account.getTotalCashReceived(), amount));
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("totalCashReceived overflows", amount, e);
        }
        log.info("Mint {} {} to {} by merchant {}", amount, currencyToken.getSymbol(), user, merchant);
        daoEventService.emit(new MintedToUserEvent(merchant, user, amount, now()));
        currencyToken.mint(user, amount);
    }

    /**
     * {@code user} pays {@code amount} to {@code merchant}. The amount less the merchant's rebate is burned from
     * the user's balance and counted as recycled, the rebate stays with the user.
     */
    public void pay(Address merchant, Address user, long amount)
            throws NotRegisteredMerchantException, FrozenException, InvalidAmountException {
        checkNotNull(user, "user must not be null");
        MerchantAccount account = getAccount(merchant);
        if (account.isFrozen())
            throw new FrozenException(merchant);

        if (amount <= 0)
            throw new InvalidAmountException("Amount must be positive", amount);

        long balance = currencyToken.balanceOf(user);
        if (balance < amount)
            throw new InvalidAmountException("Insufficient balance. balance=" + balance, amount);

        long burnAmount = MerchantConsensus.getBurnAmount(amount, account.getRebate());
        long rebateAmount = amount - burnAmount;
        try {
            account.setTotalRecycled(LongMath.checkedAdd(account.getTotalRecycled(), burnAmount));
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("totalRecycled overflows", amount, e);
        }
        log.info("Payment of {} from {} to merchant {}. burned={}, rebate={}", amount, user, merchant, burnAmount,
                rebateAmount);
        daoEventService.emit(new PaymentProcessedEvent(merchant, user, amount, burnAmount, rebateAmount, now()));
        if (burnAmount > 0)
            currencyToken.burn(user, burnAmount);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Getters
    ///////////////////////////////////////////////////////////////////////////////////////////

    public boolean isMerchant(Address address) {
        return stateService.isMerchant(address);
    }

    public Optional<MerchantAccount> getMerchant(Address address) {
        return stateService.getMerchant(address).map(MerchantAccount::getClone);
    }

    public List<MerchantAccount> getMerchants() {
        return stateService.getMerchants().stream()
                .map(MerchantAccount::getClone)
                .collect(Collectors.toList());
    }

    public boolean isOwnerOrGovernance(Address address) {
        return ownerAddress.equals(address) || governanceAddress.equals(address);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Private
    ///////////////////////////////////////////////////////////////////////////////////////////

    private MerchantAccount getAccount(Address merchant) throws NotRegisteredMerchantException {
        checkNotNull(merchant, "merchant must not be null");
        return stateService.getMerchant(merchant)
                .orElseThrow(() -> new NotRegisteredMerchantException("Not a registered merchant. merchant=" +
                        merchant));
    }

    private void requireOwnerOrGovernance(Address caller) throws UnauthorizedException {
        if (!isOwnerOrGovernance(caller))
            throw new UnauthorizedException("Only owner or governance are allowed", caller);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}

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

package hkdp.core.dao;

import hkdp.core.dao.exceptions.DaoException;
import hkdp.core.dao.governance.GovernanceService;
import hkdp.core.dao.governance.proposal.AddMerchantPayload;
import hkdp.core.dao.governance.proposal.ChangeParamPayload;
import hkdp.core.dao.governance.proposal.DepositRequest;
import hkdp.core.dao.governance.proposal.ModifyMerchantPayload;
import hkdp.core.dao.governance.proposal.ProposalSlot;
import hkdp.core.dao.governance.proposal.ProposalType;
import hkdp.core.dao.governance.proposal.WithdrawFundsPayload;
import hkdp.core.dao.merchant.MerchantAccount;
import hkdp.core.dao.merchant.MerchantLedger;
import hkdp.core.dao.param.ParamChange;
import hkdp.core.dao.param.ParamService;
import hkdp.core.dao.state.CallGuard;
import hkdp.core.dao.state.events.DaoEvent;
import hkdp.core.dao.state.events.DaoEventListener;
import hkdp.core.dao.state.events.DaoEventService;

import javax.inject.Inject;

import java.util.List;
import java.util.Optional;

import javax.annotation.Nullable;

/**
 * Provides a facade to interact with the Dao domain. Every mutating method runs as one atomic call: if it throws
 * nothing has changed and no event got delivered. Reads wait for a call in progress and return copies.
 * <p>
 * The caller address passed to the methods is trusted, authenticating it is up to the client.
 */
public class DaoFacade {
    private final GovernanceService governanceService;
    private final MerchantLedger merchantLedger;
    private final ParamService paramService;
    private final DaoEventService daoEventService;
    private final CallGuard callGuard;

    @Inject
    public DaoFacade(GovernanceService governanceService,
                     MerchantLedger merchantLedger,
                     ParamService paramService,
                     DaoEventService daoEventService,
                     CallGuard callGuard) {
        this.governanceService = governanceService;
        this.merchantLedger = merchantLedger;
        this.paramService = paramService;
        this.daoEventService = daoEventService;
        this.callGuard = callGuard;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Use case: Initiate proposals
    ///////////////////////////////////////////////////////////////////////////////////////////

    public ProposalSlot initiateAddMerchant(Address caller,
                                            Address merchant,
                                            String name,
                                            long quota,
                                            @Nullable DepositRequest depositRequest) throws DaoException {
        return callGuard.execute("initiateAddMerchant",
                () -> governanceService.initiate(new AddMerchantPayload(merchant, name, quota), caller,
                        depositRequest));
    }

    public ProposalSlot initiateModifyMerchant(Address caller,
                                               Address merchant,
                                               @Nullable Address newGuardian,
                                               boolean freeze,
                                               long quota,
                                               int rebate,
                                               @Nullable DepositRequest depositRequest) throws DaoException {
        return callGuard.execute("initiateModifyMerchant",
                () -> governanceService.initiate(new ModifyMerchantPayload(merchant, newGuardian, freeze, quota,
                        rebate), caller, depositRequest));
    }

    public ProposalSlot initiateChangeParam(Address caller,
                                            int majorityPercentage,
                                            @Nullable DepositRequest depositRequest) throws DaoException {
        return callGuard.execute("initiateChangeParam",
                () -> governanceService.initiate(new ChangeParamPayload(majorityPercentage), caller,
                        depositRequest));
    }

    public ProposalSlot initiateWithdrawFunds(Address caller,
                                              Address asset,
                                              @Nullable DepositRequest depositRequest) throws DaoException {
        return callGuard.execute("initiateWithdrawFunds",
                () -> governanceService.initiate(new WithdrawFundsPayload(asset), caller, depositRequest));
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Use case: Vote
    ///////////////////////////////////////////////////////////////////////////////////////////

    public ProposalSlot vote(ProposalType type, Address caller) throws DaoException {
        return callGuard.execute("vote", () -> governanceService.vote(type, caller));
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Use case: Merchant operations
    ///////////////////////////////////////////////////////////////////////////////////////////

    // Called by the merchant
    public void mint(Address merchant, Address user, long amount) throws DaoException {
        callGuard.execute("mint", () -> {
            merchantLedger.mint(merchant, user, amount);
            return null;
        });
    }

    public void pay(Address merchant, Address user, long amount) throws DaoException {
        callGuard.execute("pay", () -> {
            merchantLedger.pay(merchant, user, amount);
            return null;
        });
    }

    public void modifyMerchant(Address caller,
                               Address merchant,
                               @Nullable Address newGuardian,
                               boolean freeze,
                               long quota,
                               int rebate) throws DaoException {
        callGuard.execute("modifyMerchant", () -> {
            merchantLedger.modifyMerchant(caller, merchant, newGuardian, freeze, quota, rebate);
            return null;
        });
    }

    public void removeMerchant(Address caller, Address merchant) throws DaoException {
        callGuard.execute("removeMerchant", () -> {
            merchantLedger.removeMerchant(caller, merchant);
            return null;
        });
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Use case: Present state
    ///////////////////////////////////////////////////////////////////////////////////////////

    public ProposalSlot getProposal(ProposalType type) {
        return callGuard.read(() -> governanceService.getProposal(type));
    }

    public boolean isProposalActive(ProposalType type) {
        return callGuard.read(() -> governanceService.isActive(type));
    }

    public boolean hasVoted(ProposalType type, Address voter) {
        return callGuard.read(() -> governanceService.hasVoted(type, voter));
    }

    public long getThreshold() {
        return callGuard.read(governanceService::getThreshold);
    }

    public int getMajorityPercentage() {
        return callGuard.read(paramService::getMajorityPercentage);
    }

    public List<ParamChange> getParamChanges() {
        return callGuard.read(paramService::getParamChanges);
    }

    public boolean isMerchant(Address address) {
        return callGuard.read(() -> merchantLedger.isMerchant(address));
    }

    public Optional<MerchantAccount> getMerchant(Address address) {
        return callGuard.read(() -> merchantLedger.getMerchant(address));
    }

    public List<MerchantAccount> getMerchants() {
        return callGuard.read(merchantLedger::getMerchants);
    }

    public List<DaoEvent> getEventLog() {
        return daoEventService.getEventLog();
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Listeners
    ///////////////////////////////////////////////////////////////////////////////////////////

    public void addListener(DaoEventListener listener) {
        daoEventService.addListener(listener);
    }

    public void removeListener(DaoEventListener listener) {
        daoEventService.removeListener(listener);
    }
}

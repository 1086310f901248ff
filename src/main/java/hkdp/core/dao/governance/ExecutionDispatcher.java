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

import hkdp.core.dao.Address;
import hkdp.core.dao.DaoOptionKeys;
import hkdp.core.dao.exceptions.DaoException;
import hkdp.core.dao.governance.proposal.AddMerchantPayload;
import hkdp.core.dao.governance.proposal.ChangeParamPayload;
import hkdp.core.dao.governance.proposal.ModifyMerchantPayload;
import hkdp.core.dao.governance.proposal.ProposalPayload;
import hkdp.core.dao.governance.proposal.WithdrawFundsPayload;
import hkdp.core.dao.merchant.MerchantLedger;
import hkdp.core.dao.param.ParamService;

import javax.inject.Inject;
import javax.inject.Named;

import lombok.extern.slf4j.Slf4j;

/**
 * Applies the payload of a passed proposal. Acts with the governance address as authority, the payload gets
 * passed on as it is.
 */
@Slf4j
public class ExecutionDispatcher {
    private final MerchantLedger merchantLedger;
    private final ParamService paramService;
    private final Address governanceAddress;

    @Inject
    public ExecutionDispatcher(MerchantLedger merchantLedger,
                               ParamService paramService,
                               @Named(DaoOptionKeys.GOVERNANCE_ADDRESS) Address governanceAddress) {
        this.merchantLedger = merchantLedger;
        this.paramService = paramService;
        this.governanceAddress = governanceAddress;
    }

    public void dispatch(ProposalPayload payload, Address initiator) throws DaoException {
        log.info("Execute {} proposal of {}", payload.getType().getDisplayName(), initiator);
        switch (payload.getType()) {
            case ADD_MERCHANT:
                AddMerchantPayload addMerchantPayload = (AddMerchantPayload) payload;
                merchantLedger.addMerchant(governanceAddress,
                        addMerchantPayload.getMerchant(),
                        addMerchantPayload.getName(),
                        addMerchantPayload.getQuota(),
                        initiator);
                break;
            case MODIFY_MERCHANT:
                ModifyMerchantPayload modifyMerchantPayload = (ModifyMerchantPayload) payload;
                merchantLedger.modifyMerchant(governanceAddress,
                        modifyMerchantPayload.getMerchant(),
                        modifyMerchantPayload.getNewGuardian(),
                        modifyMerchantPayload.isFreeze(),
                        modifyMerchantPayload.getQuota(),
                        modifyMerchantPayload.getRebate());
                break;
            case CHANGE_PARAM:
                paramService.changeMajorityPercentage(((ChangeParamPayload) payload).getMajorityPercentage());
                break;
            case WITHDRAW_FUNDS:
                merchantLedger.withdraw(governanceAddress, ((WithdrawFundsPayload) payload).getAsset(), initiator);
                break;
            default:
                throw new IllegalArgumentException("Unsupported proposal type " + payload.getType());
        }
    }
}

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

package hkdp.core.dao.governance.proposal;

import hkdp.core.dao.exceptions.RebateOutOfRangeException;
import hkdp.core.dao.exceptions.ValidationException;
import hkdp.core.dao.governance.GovernanceConsensus;
import hkdp.core.dao.merchant.MerchantConsensus;

import lombok.extern.slf4j.Slf4j;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.apache.commons.lang3.Validate.notEmpty;

@Slf4j
public class ProposalValidator {

    public boolean areDataFieldsValid(ProposalPayload payload) {
        try {
            validateDataFields(payload);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    public void validateDataFields(ProposalPayload payload) throws ValidationException {
        if (payload instanceof ModifyMerchantPayload) {
            int rebate = ((ModifyMerchantPayload) payload).getRebate();
            if (!MerchantConsensus.isRebateValid(rebate))
                throw new RebateOutOfRangeException(rebate, MerchantConsensus.MAX_REBATE);
        }

        try {
            checkNotNull(payload, "payload must not be null");
            switch (payload.getType()) {
                case ADD_MERCHANT:
                    AddMerchantPayload addMerchantPayload = (AddMerchantPayload) payload;
                    checkNotNull(addMerchantPayload.getMerchant(), "merchant must not be null");
                    checkArgument(!addMerchantPayload.getMerchant().isZero(), "merchant must not be the zero address");
                    notEmpty(addMerchantPayload.getName(), "name must not be empty");
                    checkArgument(addMerchantPayload.getQuota() >= 0, "quota must not be negative");
                    break;
                case MODIFY_MERCHANT:
                    ModifyMerchantPayload modifyMerchantPayload = (ModifyMerchantPayload) payload;
                    checkNotNull(modifyMerchantPayload.getMerchant(), "merchant must not be null");
                    checkArgument(modifyMerchantPayload.getQuota() >= 0, "quota must not be negative");
                    break;
                case CHANGE_PARAM:
                    int majorityPercentage = ((ChangeParamPayload) payload).getMajorityPercentage();
                    checkArgument(GovernanceConsensus.isValidMajorityPercentage(majorityPercentage),
                            "majorityPercentage must be in (0, %s]. majorityPercentage=%s",
                            GovernanceConsensus.MAX_MAJORITY_PERCENTAGE, majorityPercentage);
                    break;
                case WITHDRAW_FUNDS:
                    checkNotNull(((WithdrawFundsPayload) payload).getAsset(), "asset must not be null");
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported proposal type " + payload.getType());
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("Invalid proposal data. payload={}, error={}", payload, e.getMessage());
            throw new ValidationException(e);
        }
    }
}

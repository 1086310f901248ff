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

package hkdp.core.dao.state;

import hkdp.core.dao.Address;
import hkdp.core.dao.DaoOptionKeys;
import hkdp.core.dao.governance.GovernanceConsensus;
import hkdp.core.dao.governance.proposal.ProposalSlot;
import hkdp.core.dao.governance.proposal.ProposalType;
import hkdp.core.dao.merchant.MerchantAccount;
import hkdp.core.dao.merchant.MerchantIndex;
import hkdp.core.dao.param.ParamChange;

import javax.inject.Inject;
import javax.inject.Named;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Root class for mutable state of the DAO: proposal slots with their current voters, the majority percentage and the
 * merchant accounts.
 */
public class DaoState {
    @Getter
    private final Map<ProposalType, ProposalSlot> proposalSlots;
    @Getter
    @Setter
    private int majorityPercentage;
    @Getter
    private final List<ParamChange> paramChanges;
    @Getter
    private final Map<Address, MerchantAccount> merchants;
    @Getter
    private final MerchantIndex merchantIndex;


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Inject
    public DaoState(@Named(DaoOptionKeys.DEFAULT_MAJORITY_PERCENTAGE) int majorityPercentage) {
        checkArgument(GovernanceConsensus.isValidMajorityPercentage(majorityPercentage),
                "Invalid default majority percentage %s", majorityPercentage);
        this.proposalSlots = new EnumMap<>(ProposalType.class);
        for (ProposalType type : ProposalType.values())
            proposalSlots.put(type, new ProposalSlot(type));

        this.majorityPercentage = majorityPercentage;
        this.paramChanges = new ArrayList<>();
        this.merchants = new HashMap<>();
        this.merchantIndex = new MerchantIndex();
    }

    private DaoState(DaoState other) {
        this.proposalSlots = new EnumMap<>(ProposalType.class);
        other.proposalSlots.forEach((type, slot) -> proposalSlots.put(type, slot.getClone()));

        this.majorityPercentage = other.majorityPercentage;
        this.paramChanges = new ArrayList<>(other.paramChanges);
        this.merchants = new HashMap<>();
        other.merchants.forEach((address, account) -> merchants.put(address, account.getClone()));
        this.merchantIndex = other.merchantIndex.getClone();
    }

    public DaoState getClone() {
        return new DaoState(this);
    }
}

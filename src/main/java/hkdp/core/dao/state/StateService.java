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
import hkdp.core.dao.governance.proposal.ProposalSlot;
import hkdp.core.dao.governance.proposal.ProposalType;
import hkdp.core.dao.merchant.MerchantAccount;
import hkdp.core.dao.param.ParamChange;

import com.google.common.collect.ImmutableList;

import javax.inject.Inject;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Access to the DAO state. All writes to {@link DaoState} go through this class.
 */
@Slf4j
public class StateService {
    // Swapped on snapshot restore
    private volatile DaoState state;


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Inject
    public StateService(DaoState state) {
        this.state = state;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Snapshot
    ///////////////////////////////////////////////////////////////////////////////////////////

    public DaoState getClone() {
        return state.getClone();
    }

    public void applySnapshot(DaoState snapshot) {
        checkNotNull(snapshot, "snapshot must not be null");
        this.state = snapshot;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Proposal slots
    ///////////////////////////////////////////////////////////////////////////////////////////

    public ProposalSlot getProposalSlot(ProposalType type) {
        return state.getProposalSlots().get(type);
    }



    ///////////////////////////////////////////////////////////////////////////////////////////
    // Param
    ///////////////////////////////////////////////////////////////////////////////////////////

    public int getMajorityPercentage() {
        return state.getMajorityPercentage();
    }

    public void setMajorityPercentage(ParamChange paramChange) {
        state.setMajorityPercentage(paramChange.getNewValue());
        state.getParamChanges().add(paramChange);
    }

    public List<ParamChange> getParamChanges() {
        return ImmutableList.copyOf(state.getParamChanges());
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Merchants
    ///////////////////////////////////////////////////////////////////////////////////////////

    public boolean isMerchant(Address address) {
        return state.getMerchants().containsKey(address);
    }

    public Optional<MerchantAccount> getMerchant(Address address) {
        return Optional.ofNullable(state.getMerchants().get(address));
    }

    public void addMerchant(MerchantAccount account) {
        checkArgument(!isMerchant(account.getAddress()), "Merchant exists already. address=%s",
                account.getAddress());
        state.getMerchants().put(account.getAddress(), account);
        state.getMerchantIndex().add(account.getAddress());
    }

    public void removeMerchant(Address address) {
        state.getMerchants().remove(address);
        state.getMerchantIndex().remove(address);
    }

    // In index order which changes on removal
    public List<MerchantAccount> getMerchants() {
        return state.getMerchantIndex().getAddresses().stream()
                .map(address -> state.getMerchants().get(address))
                .collect(Collectors.toList());
    }
}

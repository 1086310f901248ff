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

import javax.inject.Inject;
import javax.inject.Named;

/**
 * Voting weight is the current balance of the share token, total weight its current total supply.
 * There are no balance snapshots, a transferred balance can be used again for voting by the receiver.
 */
public class TokenVotingPowerSource implements VotingPowerSource {
    private final FungibleToken shareToken;

    @Inject
    public TokenVotingPowerSource(@Named(DaoOptionKeys.SHARE_TOKEN) FungibleToken shareToken) {
        this.shareToken = shareToken;
    }

    @Override
    public long weight(Address account) {
        return shareToken.balanceOf(account);
    }

    @Override
    public long totalWeight() {
        return shareToken.totalSupply();
    }
}

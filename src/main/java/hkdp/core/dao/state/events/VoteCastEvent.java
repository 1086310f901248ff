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

package hkdp.core.dao.state.events;

import hkdp.core.dao.Address;
import hkdp.core.dao.governance.proposal.ProposalType;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

import javax.annotation.concurrent.Immutable;

/**
 * Emitted for every counted vote including the implicit vote of the initiator.
 */
@Immutable
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@Value
public class VoteCastEvent extends DaoEvent {
    private final ProposalType type;
    private final int roundId;
    private final Address voter;
    private final long weight;
    private final long accumulatedPower;

    public VoteCastEvent(ProposalType type, int roundId, Address voter, long weight, long accumulatedPower, long time) {
        super(time);
        this.type = type;
        this.roundId = roundId;
        this.voter = voter;
        this.weight = weight;
        this.accumulatedPower = accumulatedPower;
    }
}

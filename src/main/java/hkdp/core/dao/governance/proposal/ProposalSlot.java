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

import hkdp.core.dao.Address;

import com.google.common.math.LongMath;

import java.time.Instant;

import java.util.HashSet;
import java.util.Set;

import lombok.AccessLevel;
import lombok.Getter;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * The single container for proposals of one type. The slot is reused for every round, the round id grows with
 * each initiation and is never reused. Only the voters of the current round are kept.
 */
@Getter
public class ProposalSlot {
    private final ProposalType type;
    private int roundId;
    private boolean active;
    private long accumulatedPower;
    @Nullable
    private ProposalPayload payload;
    @Nullable
    private Address initiator;
    // Epoch seconds
    private long initiationTime;
    private long deadline;
    @Nullable
    private Deposit deposit;
    @Getter(AccessLevel.NONE)
    private final Set<Address> voters;

    public ProposalSlot(ProposalType type) {
        this.type = checkNotNull(type, "type must not be null");
        this.voters = new HashSet<>();
    }

    private ProposalSlot(ProposalSlot other) {
        this.type = other.type;
        this.roundId = other.roundId;
        this.active = other.active;
        this.accumulatedPower = other.accumulatedPower;
        this.payload = other.payload;
        this.initiator = other.initiator;
        this.initiationTime = other.initiationTime;
        this.deadline = other.deadline;
        this.deposit = other.deposit;
        this.voters = new HashSet<>(other.voters);
    }

    public ProposalSlot getClone() {
        return new ProposalSlot(this);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Transitions
    ///////////////////////////////////////////////////////////////////////////////////////////

    public void open(ProposalPayload payload,
                     Address initiator,
                     long initiatorWeight,
                     long now,
                     long deadline,
                     @Nullable Deposit deposit) {
        checkState(!active, "Slot must be closed before a new round is opened");
        checkArgument(payload.getType() == type, "Payload of type %s does not fit slot %s", payload.getType(), type);
        checkArgument(deadline >= now, "deadline must not be before now");
        roundId++;
        active = true;
        accumulatedPower = initiatorWeight;
        this.payload = payload;
        this.initiator = initiator;
        this.initiationTime = now;
        this.deadline = deadline;
        this.deposit = deposit;
        voters.clear();
        voters.add(checkNotNull(initiator, "initiator must not be null"));
    }

    /**
     * Counts the vote of {@code voter} in the current round.
     *
     * @throws ArithmeticException if the accumulated power overflows, nothing is changed in that case
     */
    public void addVote(Address voter, long weight) {
        checkState(active, "Cannot add voting power to an inactive slot");
        checkArgument(weight > 0, "weight must be positive");
        checkArgument(!voters.contains(voter), "%s has voted already in round %s", voter, roundId);
        accumulatedPower = LongMath.checkedAdd(accumulatedPower, weight);
        voters.add(voter);
    }

    public void close() {
        active = false;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Getters
    ///////////////////////////////////////////////////////////////////////////////////////////

    public boolean isExpired(long now) {
        return now > deadline;
    }

    // Refers to the current round only
    public boolean hasVoted(Address voter) {
        return roundId > 0 && voters.contains(voter);
    }

    public int getNumVoters() {
        return voters.size();
    }

    // Active and not past its deadline
    public boolean isOpen(long now) {
        return active && !isExpired(now);
    }

    @Override
    public String toString() {
        return "ProposalSlot{" +
                "\n     type=" + type +
                ",\n     roundId=" + roundId +
                ",\n     active=" + active +
                ",\n     accumulatedPower=" + accumulatedPower +
                ",\n     payload=" + payload +
                ",\n     initiator=" + initiator +
                ",\n     initiationTime=" + Instant.ofEpochSecond(initiationTime) +
                ",\n     deadline=" + Instant.ofEpochSecond(deadline) +
                ",\n     deposit=" + deposit +
                ",\n     numVoters=" + voters.size() +
                "\n}";
    }
}

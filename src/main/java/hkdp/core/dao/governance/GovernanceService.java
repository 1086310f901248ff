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
import hkdp.core.dao.exceptions.AlreadyVotedException;
import hkdp.core.dao.exceptions.DaoException;
import hkdp.core.dao.exceptions.InvalidAmountException;
import hkdp.core.dao.exceptions.NoActiveProposalException;
import hkdp.core.dao.exceptions.ProposalAlreadyActiveException;
import hkdp.core.dao.exceptions.ProposalExpiredException;
import hkdp.core.dao.exceptions.TransferFailedException;
import hkdp.core.dao.exceptions.UnauthorizedException;
import hkdp.core.dao.governance.proposal.Deposit;
import hkdp.core.dao.governance.proposal.DepositRequest;
import hkdp.core.dao.governance.proposal.ProposalPayload;
import hkdp.core.dao.governance.proposal.ProposalSlot;
import hkdp.core.dao.governance.proposal.ProposalType;
import hkdp.core.dao.governance.proposal.ProposalValidator;
import hkdp.core.dao.state.StateService;
import hkdp.core.dao.state.events.DaoEventService;
import hkdp.core.dao.state.events.DepositCollectedEvent;
import hkdp.core.dao.state.events.ProposalEndedEvent;
import hkdp.core.dao.state.events.ProposalExecutedEvent;
import hkdp.core.dao.state.events.ProposalInitiatedEvent;
import hkdp.core.dao.state.events.VoteCastEvent;
import hkdp.core.dao.token.AssetService;
import hkdp.core.dao.token.VotingPowerSource;

import com.google.common.math.LongMath;

import javax.inject.Inject;
import javax.inject.Named;

import java.time.Clock;

import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Proposal life cycle: initiation, weighted voting and execution once the accumulated voting power reaches the
 * threshold. There is one slot per proposal type. Expired rounds are not closed by a timer but at the next
 * initiation of that type.
 * <p>
 * Voting weight is read from the {@link VotingPowerSource} at the time of the vote and the threshold is evaluated
 * against the total weight at the time of evaluation.
 */
@Slf4j
public class GovernanceService {
    private final StateService stateService;
    private final VotingPowerSource votingPowerSource;
    private final ProposalValidator proposalValidator;
    private final ExecutionDispatcher executionDispatcher;
    private final AssetService assetService;
    private final DaoEventService daoEventService;
    private final Clock clock;
    private final long votingWindowSec;
    private final Address ledgerAddress;


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Inject
    public GovernanceService(StateService stateService,
                             VotingPowerSource votingPowerSource,
                             ProposalValidator proposalValidator,
                             ExecutionDispatcher executionDispatcher,
                             AssetService assetService,
                             DaoEventService daoEventService,
                             Clock clock,
                             @Named(DaoOptionKeys.VOTING_WINDOW_SEC) long votingWindowSec,
                             @Named(DaoOptionKeys.LEDGER_ADDRESS) Address ledgerAddress) {
        checkArgument(votingWindowSec > 0, "votingWindowSec must be positive");
        this.stateService = stateService;
        this.votingPowerSource = votingPowerSource;
        this.proposalValidator = proposalValidator;
        this.executionDispatcher = executionDispatcher;
        this.assetService = assetService;
        this.daoEventService = daoEventService;
        this.clock = clock;
        this.votingWindowSec = votingWindowSec;
        this.ledgerAddress = ledgerAddress;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // API
    ///////////////////////////////////////////////////////////////////////////////////////////

    /**
     * Opens a new round for the type of the payload with the vote of the initiator and executes it right away if
     * the initiator's weight already reaches the threshold.
     *
     * @param depositRequest Optional deposit. It gets transferred from the initiator to the ledger if allowance
     *                       and balance cover it, otherwise the proposal is opened without deposit.
     * @return A copy of the slot after initiation.
     */
    public ProposalSlot initiate(ProposalPayload payload,
                                 Address initiator,
                                 @Nullable DepositRequest depositRequest) throws DaoException {
        checkNotNull(initiator, "initiator must not be null");
        proposalValidator.validateDataFields(payload);

        ProposalType type = payload.getType();
        long weight = votingPowerSource.weight(initiator);
        if (weight <= 0)
            throw new UnauthorizedException("Initiator has no voting weight", initiator);

        long now = now();
        ProposalSlot slot = stateService.getProposalSlot(type);
        if (slot.isActive()) {
            if (!slot.isExpired(now))
                throw new ProposalAlreadyActiveException("A proposal of type " + type + " is open until " +
                        slot.getDeadline());

            closeExpired(slot, now);
        }

        Deposit deposit = depositRequest != null ? evaluateDeposit(depositRequest, initiator) : null;
        slot.open(payload, initiator, weight, now, getDeadline(now), deposit);
        log.info("Proposal initiated. type={}, roundId={}, initiator={}, weight={}",
                type, slot.getRoundId(), initiator, weight);
        daoEventService.emit(new ProposalInitiatedEvent(type, slot.getRoundId(), payload, initiator,
                slot.getDeadline(), now));
        daoEventService.emit(new VoteCastEvent(type, slot.getRoundId(), initiator, weight,
                slot.getAccumulatedPower(), now));

        // Deposit is in the ledger before a possible execution
        if (deposit != null && deposit.isCollected())
            collectDeposit(slot, initiator, deposit, now);

        // Might execute and end the round already
        tryExecute(slot, now);

        return slot.getClone();
    }

    /**
     * Adds the current weight of the voter to the open round of {@code type} and executes the proposal if the
     * threshold is reached.
     *
     * @return A copy of the slot after the vote.
     */
    public ProposalSlot vote(ProposalType type, Address voter) throws DaoException {
        checkNotNull(type, "type must not be null");
        checkNotNull(voter, "voter must not be null");
        ProposalSlot slot = stateService.getProposalSlot(type);
        long now = now();
        if (!slot.isActive())
            throw new NoActiveProposalException("No open proposal of type " + type);

        if (slot.isExpired(now))
            throw new ProposalExpiredException("Proposal of type " + type + " expired at " + slot.getDeadline());

        long weight = votingPowerSource.weight(voter);
        if (weight <= 0)
            throw new UnauthorizedException("Voter has no voting weight", voter);

        if (slot.hasVoted(voter))
            throw new AlreadyVotedException(voter + " has already voted in round " + slot.getRoundId() +
                    " of " + type);

        try {
            slot.addVote(voter, weight);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("Accumulated voting power overflows", weight, e);
        }
        log.debug("Vote counted. type={}, roundId={}, voter={}, weight={}, accumulatedPower={}",
                type, slot.getRoundId(), voter, weight, slot.getAccumulatedPower());
        daoEventService.emit(new VoteCastEvent(type, slot.getRoundId(), voter, weight,
                slot.getAccumulatedPower(), now));

        tryExecute(slot, now);
        return slot.getClone();
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Getters
    ///////////////////////////////////////////////////////////////////////////////////////////

    public long getThreshold() {
        return GovernanceConsensus.getThreshold(votingPowerSource.totalWeight(),
                stateService.getMajorityPercentage());
    }

    public ProposalSlot getProposal(ProposalType type) {
        return stateService.getProposalSlot(type).getClone();
    }

    public boolean isActive(ProposalType type) {
        return stateService.getProposalSlot(type).isOpen(now());
    }

    // Refers to the current round only
    public boolean hasVoted(ProposalType type, Address voter) {
        return stateService.getProposalSlot(type).hasVoted(voter);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Private
    ///////////////////////////////////////////////////////////////////////////////////////////

    private void tryExecute(ProposalSlot slot, long now) throws DaoException {
        if (!slot.isActive() || slot.isExpired(now))
            return;

        long threshold = getThreshold();
        if (!GovernanceConsensus.isPassed(slot.getAccumulatedPower(), threshold)) {
            log.debug("Threshold not reached yet. type={}, accumulatedPower={}, threshold={}",
                    slot.getType(), slot.getAccumulatedPower(), threshold);
            return;
        }

        ProposalPayload payload = checkNotNull(slot.getPayload(), "payload of active slot must not be null");
        Address initiator = checkNotNull(slot.getInitiator(), "initiator of active slot must not be null");
        executionDispatcher.dispatch(payload, initiator);
        slot.close();
        log.info("Proposal executed. type={}, roundId={}, accumulatedPower={}, threshold={}",
                slot.getType(), slot.getRoundId(), slot.getAccumulatedPower(), threshold);
        daoEventService.emit(new ProposalExecutedEvent(slot.getType(), slot.getRoundId(), payload,
                slot.getAccumulatedPower(), threshold, now));
        daoEventService.emit(new ProposalEndedEvent(slot.getType(), slot.getRoundId(), true, now));
    }

    private void closeExpired(ProposalSlot slot, long now) {
        slot.close();
        log.info("Expired proposal closed without execution. type={}, roundId={}", slot.getType(),
                slot.getRoundId());
        daoEventService.emit(new ProposalEndedEvent(slot.getType(), slot.getRoundId(), false, now));
    }

    private Deposit evaluateDeposit(DepositRequest depositRequest, Address initiator) {
        Address asset = checkNotNull(depositRequest.getAsset(), "deposit asset must not be null");
        long amount = depositRequest.getAmount();
        long allowance = assetService.allowance(asset, initiator, ledgerAddress);
        long balance = assetService.balanceOf(asset, initiator);
        if (amount > 0 && allowance >= amount && balance >= amount)
            return Deposit.collected(depositRequest);

        log.warn("Deposit not collected. initiator={}, asset={}, amount={}, allowance={}, balance={}",
                initiator, asset, amount, allowance, balance);
        return Deposit.notCollected(depositRequest);
    }

    private void collectDeposit(ProposalSlot slot, Address initiator, Deposit deposit, long now)
            throws TransferFailedException {
        daoEventService.emit(new DepositCollectedEvent(slot.getType(), slot.getRoundId(), initiator,
                deposit.getAsset(), deposit.getAmount(), now));
        if (!assetService.transferFrom(deposit.getAsset(), ledgerAddress, initiator, ledgerAddress,
                deposit.getAmount()))
            throw new TransferFailedException("Deposit transfer failed", deposit.getAsset(), deposit.getAmount());
    }

    private long getDeadline(long now) throws InvalidAmountException {
        try {
            return LongMath.checkedAdd(now, votingWindowSec);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("Deadline overflows", votingWindowSec, e);
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}

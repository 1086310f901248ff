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

import hkdp.core.dao.MutableClock;
import hkdp.core.dao.exceptions.AlreadyVotedException;
import hkdp.core.dao.exceptions.NoActiveProposalException;
import hkdp.core.dao.exceptions.NotRegisteredMerchantException;
import hkdp.core.dao.exceptions.ProposalAlreadyActiveException;
import hkdp.core.dao.exceptions.ProposalExpiredException;
import hkdp.core.dao.exceptions.TransferFailedException;
import hkdp.core.dao.exceptions.UnauthorizedException;
import hkdp.core.dao.exceptions.ValidationException;
import hkdp.core.dao.governance.proposal.AddMerchantPayload;
import hkdp.core.dao.governance.proposal.ChangeParamPayload;
import hkdp.core.dao.governance.proposal.DepositRequest;
import hkdp.core.dao.governance.proposal.ModifyMerchantPayload;
import hkdp.core.dao.governance.proposal.ProposalSlot;
import hkdp.core.dao.governance.proposal.ProposalType;
import hkdp.core.dao.governance.proposal.ProposalValidator;
import hkdp.core.dao.governance.proposal.WithdrawFundsPayload;
import hkdp.core.dao.state.DaoState;
import hkdp.core.dao.state.StateService;
import hkdp.core.dao.state.events.DaoEvent;
import hkdp.core.dao.state.events.DaoEventService;
import hkdp.core.dao.state.events.DepositCollectedEvent;
import hkdp.core.dao.state.events.ProposalEndedEvent;
import hkdp.core.dao.state.events.ProposalExecutedEvent;
import hkdp.core.dao.state.events.ProposalInitiatedEvent;
import hkdp.core.dao.state.events.VoteCastEvent;
import hkdp.core.dao.token.AssetService;
import hkdp.core.dao.token.VotingPowerSource;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.mockito.InOrder;

import org.junit.Before;
import org.junit.Test;

import static hkdp.core.dao.DaoAddresses.ALICE;
import static hkdp.core.dao.DaoAddresses.BOB;
import static hkdp.core.dao.DaoAddresses.CAROL;
import static hkdp.core.dao.DaoAddresses.CURRENCY_TOKEN;
import static hkdp.core.dao.DaoAddresses.LEDGER;
import static hkdp.core.dao.DaoAddresses.MERCHANT;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class GovernanceServiceTest {
    private static final long T0 = 1_600_000_000L;
    private static final long VOTING_WINDOW = 7 * 24 * 60 * 60;

    private final VotingPowerSource votingPowerSource = mock(VotingPowerSource.class);
    private final ExecutionDispatcher executionDispatcher = mock(ExecutionDispatcher.class);
    private final AssetService assetService = mock(AssetService.class);
    private MutableClock clock;
    private StateService stateService;
    private DaoEventService daoEventService;
    private GovernanceService service;

    private final AddMerchantPayload addMerchantPayload = new AddMerchantPayload(MERCHANT, "Tea house", 100);

    @Before
    public void setup() {
        clock = new MutableClock(T0);
        stateService = new StateService(new DaoState(15));
        daoEventService = new DaoEventService();
        service = new GovernanceService(stateService, votingPowerSource, new ProposalValidator(),
                executionDispatcher, assetService, daoEventService, clock, VOTING_WINDOW, LEDGER);

        when(votingPowerSource.totalWeight()).thenReturn(1000L);
        when(votingPowerSource.weight(ALICE)).thenReturn(100L);
        when(votingPowerSource.weight(BOB)).thenReturn(60L);
    }

    private List<Class<?>> getEventTypes() {
        return daoEventService.getEventLog().stream().map(DaoEvent::getClass).collect(Collectors.toList());
    }

    @Test
    public void testExecutesWhenThresholdReached() throws Exception {
        ProposalSlot slot = service.initiate(addMerchantPayload, ALICE, null);
        assertTrue(slot.isActive());
        assertEquals(1, slot.getRoundId());
        assertEquals(100, slot.getAccumulatedPower());
        assertEquals(T0 + VOTING_WINDOW, slot.getDeadline());
        assertEquals(150, service.getThreshold());
        assertTrue(service.hasVoted(ProposalType.ADD_MERCHANT, ALICE));
        verify(executionDispatcher, never()).dispatch(any(), any());

        slot = service.vote(ProposalType.ADD_MERCHANT, BOB);
        assertEquals(160, slot.getAccumulatedPower());
        assertFalse(slot.isActive());
        assertFalse(service.isActive(ProposalType.ADD_MERCHANT));
        verify(executionDispatcher).dispatch(addMerchantPayload, ALICE);

        assertEquals(Arrays.asList(ProposalInitiatedEvent.class, VoteCastEvent.class, VoteCastEvent.class,
                ProposalExecutedEvent.class, ProposalEndedEvent.class), getEventTypes());
        ProposalEndedEvent endedEvent = (ProposalEndedEvent) daoEventService.getEventLog().get(4);
        assertTrue(endedEvent.isExecuted());
    }

    @Test
    public void testInitiatorAloneCanReachThreshold() throws Exception {
        when(votingPowerSource.weight(CAROL)).thenReturn(150L);
        ProposalSlot slot = service.initiate(new ChangeParamPayload(20), CAROL, null);
        assertFalse(slot.isActive());
        verify(executionDispatcher).dispatch(new ChangeParamPayload(20), CAROL);
    }

    @Test
    public void testThresholdUsesLiveTotalWeight() throws Exception {
        service.initiate(addMerchantPayload, ALICE, null);
        // Supply shrinks after initiation
        when(votingPowerSource.totalWeight()).thenReturn(500L);
        assertEquals(75, service.getThreshold());
        service.vote(ProposalType.ADD_MERCHANT, BOB);
        verify(executionDispatcher).dispatch(addMerchantPayload, ALICE);
    }

    @Test
    public void testExpiry() throws Exception {
        service.initiate(addMerchantPayload, ALICE, null);

        clock.setEpochSecond(T0 + VOTING_WINDOW + 1);
        assertFalse(service.isActive(ProposalType.ADD_MERCHANT));
        assertThrows(ProposalExpiredException.class, () -> service.vote(ProposalType.ADD_MERCHANT, BOB));
        assertEquals(100, service.getProposal(ProposalType.ADD_MERCHANT).getAccumulatedPower());

        ProposalSlot slot = service.initiate(addMerchantPayload, BOB, null);
        assertEquals(2, slot.getRoundId());
        assertEquals(60, slot.getAccumulatedPower());
        assertEquals(T0 + VOTING_WINDOW + 1 + VOTING_WINDOW, slot.getDeadline());
        assertEquals(BOB, slot.getInitiator());
        assertEquals(1, slot.getNumVoters());
        // The vote of the old round does not count in the new one
        assertFalse(service.hasVoted(ProposalType.ADD_MERCHANT, ALICE));
        service.vote(ProposalType.ADD_MERCHANT, ALICE);
        verify(executionDispatcher).dispatch(addMerchantPayload, BOB);

        List<ProposalEndedEvent> endedEvents = daoEventService.getEventLog().stream()
                .filter(e -> e instanceof ProposalEndedEvent)
                .map(e -> (ProposalEndedEvent) e)
                .collect(Collectors.toList());
        assertEquals(2, endedEvents.size());
        assertFalse(endedEvents.get(0).isExecuted());
        assertEquals(1, endedEvents.get(0).getRoundId());
        assertTrue(endedEvents.get(1).isExecuted());
    }

    @Test
    public void testVoteAtDeadlineIsValid() throws Exception {
        service.initiate(addMerchantPayload, ALICE, null);
        clock.setEpochSecond(T0 + VOTING_WINDOW);
        assertTrue(service.isActive(ProposalType.ADD_MERCHANT));
        service.vote(ProposalType.ADD_MERCHANT, BOB);
        verify(executionDispatcher).dispatch(addMerchantPayload, ALICE);
    }

    @Test
    public void testExpiredSlotStaysUntilNextInitiation() throws Exception {
        service.initiate(addMerchantPayload, ALICE, null);
        clock.setEpochSecond(T0 + VOTING_WINDOW + 1);
        assertThrows(ProposalExpiredException.class, () -> service.vote(ProposalType.ADD_MERCHANT, BOB));
        assertThrows(ProposalExpiredException.class, () -> service.vote(ProposalType.ADD_MERCHANT, BOB));
        ProposalSlot slot = service.getProposal(ProposalType.ADD_MERCHANT);
        assertTrue(slot.isActive());
        assertEquals(1, slot.getRoundId());
        assertEquals(2, daoEventService.getEventLog().size());
    }

    @Test
    public void testSingleActiveProposalPerType() throws Exception {
        service.initiate(addMerchantPayload, ALICE, null);
        assertThrows(ProposalAlreadyActiveException.class,
                () -> service.initiate(new AddMerchantPayload(CAROL, "Bakery", 5), BOB, null));
        assertEquals(addMerchantPayload, service.getProposal(ProposalType.ADD_MERCHANT).getPayload());

        // Other types are independent
        ProposalSlot slot = service.initiate(new ChangeParamPayload(20), BOB, null);
        assertTrue(slot.isActive());
        assertEquals(ProposalType.CHANGE_PARAM, slot.getType());
    }

    @Test
    public void testNoDoubleVoting() throws Exception {
        service.initiate(addMerchantPayload, ALICE, null);
        assertThrows(AlreadyVotedException.class, () -> service.vote(ProposalType.ADD_MERCHANT, ALICE));
        assertEquals(100, service.getProposal(ProposalType.ADD_MERCHANT).getAccumulatedPower());
    }

    @Test
    public void testVoteChecks() throws Exception {
        assertThrows(NoActiveProposalException.class, () -> service.vote(ProposalType.WITHDRAW_FUNDS, ALICE));

        service.initiate(addMerchantPayload, ALICE, null);
        assertThrows(UnauthorizedException.class, () -> service.vote(ProposalType.ADD_MERCHANT, CAROL));

        when(votingPowerSource.weight(CAROL)).thenReturn(10L);
        service.vote(ProposalType.ADD_MERCHANT, CAROL);
        assertTrue(service.hasVoted(ProposalType.ADD_MERCHANT, CAROL));
        assertEquals(110, service.getProposal(ProposalType.ADD_MERCHANT).getAccumulatedPower());
    }

    @Test
    public void testInitiateChecks() {
        assertThrows(UnauthorizedException.class, () -> service.initiate(addMerchantPayload, CAROL, null));
        assertThrows(ValidationException.class, () -> service.initiate(new ChangeParamPayload(31), ALICE, null));
        assertThrows(ValidationException.class,
                () -> service.initiate(new ModifyMerchantPayload(MERCHANT, null, false, 10, 11), ALICE, null));
        assertFalse(service.getProposal(ProposalType.ADD_MERCHANT).isActive());
        assertEquals(0, service.getProposal(ProposalType.ADD_MERCHANT).getRoundId());
        assertTrue(daoEventService.getEventLog().isEmpty());
    }

    @Test
    public void testDispatchFailurePropagates() throws Exception {
        doThrow(new NotRegisteredMerchantException("unknown"))
                .when(executionDispatcher).dispatch(any(), any());
        service.initiate(new ModifyMerchantPayload(MERCHANT, null, true, 10, 0), ALICE, null);
        assertThrows(NotRegisteredMerchantException.class, () -> service.vote(ProposalType.MODIFY_MERCHANT, BOB));
    }

    @Test
    public void testDepositCollected() throws Exception {
        when(assetService.allowance(CURRENCY_TOKEN, ALICE, LEDGER)).thenReturn(50L);
        when(assetService.balanceOf(CURRENCY_TOKEN, ALICE)).thenReturn(80L);
        when(assetService.transferFrom(CURRENCY_TOKEN, LEDGER, ALICE, LEDGER, 50L)).thenReturn(true);

        ProposalSlot slot = service.initiate(addMerchantPayload, ALICE, new DepositRequest(CURRENCY_TOKEN, 50));
        assertTrue(slot.getDeposit().isCollected());
        assertEquals(50, slot.getDeposit().getAmount());
        verify(assetService).transferFrom(CURRENCY_TOKEN, LEDGER, ALICE, LEDGER, 50L);
        assertEquals(Arrays.asList(ProposalInitiatedEvent.class, VoteCastEvent.class, DepositCollectedEvent.class),
                getEventTypes());
    }

    @Test
    public void testDepositCollectedBeforeExecution() throws Exception {
        when(votingPowerSource.weight(CAROL)).thenReturn(150L);
        when(assetService.allowance(CURRENCY_TOKEN, CAROL, LEDGER)).thenReturn(50L);
        when(assetService.balanceOf(CURRENCY_TOKEN, CAROL)).thenReturn(80L);
        when(assetService.transferFrom(CURRENCY_TOKEN, LEDGER, CAROL, LEDGER, 50L)).thenReturn(true);

        WithdrawFundsPayload payload = new WithdrawFundsPayload(CURRENCY_TOKEN);
        ProposalSlot slot = service.initiate(payload, CAROL, new DepositRequest(CURRENCY_TOKEN, 50));
        assertFalse(slot.isActive());

        InOrder inOrder = inOrder(assetService, executionDispatcher);
        inOrder.verify(assetService).transferFrom(CURRENCY_TOKEN, LEDGER, CAROL, LEDGER, 50L);
        inOrder.verify(executionDispatcher).dispatch(payload, CAROL);
        assertEquals(Arrays.asList(ProposalInitiatedEvent.class, VoteCastEvent.class, DepositCollectedEvent.class,
                ProposalExecutedEvent.class, ProposalEndedEvent.class), getEventTypes());
    }

    @Test
    public void testFailedDepositTransferSkipsExecution() {
        when(votingPowerSource.weight(CAROL)).thenReturn(150L);
        when(assetService.allowance(CURRENCY_TOKEN, CAROL, LEDGER)).thenReturn(50L);
        when(assetService.balanceOf(CURRENCY_TOKEN, CAROL)).thenReturn(80L);
        when(assetService.transferFrom(eq(CURRENCY_TOKEN), any(), any(), any(), anyLong())).thenReturn(false);

        assertThrows(TransferFailedException.class, () -> service.initiate(new WithdrawFundsPayload(CURRENCY_TOKEN),
                CAROL, new DepositRequest(CURRENCY_TOKEN, 50)));
        verifyNoInteractions(executionDispatcher);
    }

    @Test
    public void testDepositNotCoveredStillOpensProposal() throws Exception {
        when(assetService.allowance(CURRENCY_TOKEN, ALICE, LEDGER)).thenReturn(10L);
        when(assetService.balanceOf(CURRENCY_TOKEN, ALICE)).thenReturn(80L);

        ProposalSlot slot = service.initiate(addMerchantPayload, ALICE, new DepositRequest(CURRENCY_TOKEN, 50));
        assertTrue(slot.isActive());
        assertFalse(slot.getDeposit().isCollected());
        assertEquals(0, slot.getDeposit().getAmount());
        assertEquals(50, slot.getDeposit().getRequestedAmount());
        verify(assetService, never()).transferFrom(any(), any(), any(), any(), anyLong());
    }

    @Test
    public void testDepositTransferFailure() {
        when(assetService.allowance(CURRENCY_TOKEN, ALICE, LEDGER)).thenReturn(50L);
        when(assetService.balanceOf(CURRENCY_TOKEN, ALICE)).thenReturn(80L);
        when(assetService.transferFrom(eq(CURRENCY_TOKEN), any(), any(), any(), anyLong())).thenReturn(false);

        assertThrows(TransferFailedException.class,
                () -> service.initiate(addMerchantPayload, ALICE, new DepositRequest(CURRENCY_TOKEN, 50)));
    }

    @Test
    public void testNoDeposit() throws Exception {
        ProposalSlot slot = service.initiate(addMerchantPayload, ALICE, null);
        assertNull(slot.getDeposit());
        verify(assetService, never()).allowance(any(), any(), any());
    }
}

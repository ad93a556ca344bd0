package com.flagship.spv_ledger.spv;

import com.flagship.spv_ledger.config.NetworkConstants;
import com.flagship.spv_ledger.config.NetworkProperties;
import com.flagship.spv_ledger.crypto.TransactionDecodeException;
import com.flagship.spv_ledger.ledger.WalletManager;
import com.flagship.spv_ledger.observability.RebuildMetrics;
import com.flagship.spv_ledger.spv.phase.BlockRewardsPhase;
import com.flagship.spv_ledger.spv.phase.DelegatesPhase;
import com.flagship.spv_ledger.spv.phase.LastForgedBlocksPhase;
import com.flagship.spv_ledger.spv.phase.MultiSignaturesPhase;
import com.flagship.spv_ledger.spv.phase.ReceivedTransfersPhase;
import com.flagship.spv_ledger.spv.phase.RebuildPhase;
import com.flagship.spv_ledger.spv.phase.SecondSignaturesPhase;
import com.flagship.spv_ledger.spv.phase.SentTransactionsPhase;
import com.flagship.spv_ledger.spv.phase.VotesPhase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Phase sequencing and failure handling with the phases mocked out.
 */
class SpvRebuildServiceOrchestrationTest {

    private static final List<String> PHASE_NAMES = List.of(
        "Received Transactions", "Block Rewards", "Last Forged Blocks", "Sent Transactions",
        "Second Signatures", "Delegates", "Votes", "MultiSignatures");

    private ReceivedTransfersPhase received;
    private BlockRewardsPhase rewards;
    private LastForgedBlocksPhase lastForged;
    private SentTransactionsPhase sent;
    private SecondSignaturesPhase secondSignatures;
    private DelegatesPhase delegates;
    private VotesPhase votes;
    private MultiSignaturesPhase multiSignatures;

    private ProgressTracker progressTracker;
    private SimpleMeterRegistry meterRegistry;
    private SpvRebuildService service;

    @BeforeEach
    void setUp() {
        received = named(ReceivedTransfersPhase.class, 0);
        rewards = named(BlockRewardsPhase.class, 1);
        lastForged = named(LastForgedBlocksPhase.class, 2);
        sent = named(SentTransactionsPhase.class, 3);
        secondSignatures = named(SecondSignaturesPhase.class, 4);
        delegates = named(DelegatesPhase.class, 5);
        votes = named(VotesPhase.class, 6);
        multiSignatures = named(MultiSignaturesPhase.class, 7);

        NetworkProperties properties = new NetworkProperties();
        NetworkProperties.Milestone first = new NetworkProperties.Milestone();
        first.setHeight(1);
        first.setActiveDelegates(21);
        NetworkProperties.Milestone later = new NetworkProperties.Milestone();
        later.setHeight(100);
        later.setActiveDelegates(51);
        properties.setMilestones(List.of(first, later));

        WalletManager walletManager = mock(WalletManager.class);
        when(walletManager.countWallets()).thenReturn(3);
        when(walletManager.countDelegates()).thenReturn(1);

        meterRegistry = new SimpleMeterRegistry();
        RebuildMetrics metrics = new RebuildMetrics(meterRegistry, walletManager);
        progressTracker = mock(ProgressTracker.class);

        service = new SpvRebuildService(received, rewards, lastForged, sent, secondSignatures, delegates, votes,
            multiSignatures, walletManager, new NetworkConstants(properties), progressTracker,
            new RebuildDiagnostics(metrics), metrics);
    }

    private <T extends RebuildPhase> T named(Class<T> type, int index) {
        T phase = mock(type);
        when(phase.getName()).thenReturn(PHASE_NAMES.get(index));
        return phase;
    }

    @Test
    @DisplayName("Phases run once each in the fixed order with one progress step per phase")
    void testBuild_RunsPhasesInOrder() {
        RebuildResult result = service.build(150);

        RebuildContext expected = new RebuildContext(150, 51);
        InOrder order = inOrder(received, rewards, lastForged, sent, secondSignatures, delegates, votes, multiSignatures);
        order.verify(received).apply(expected);
        order.verify(rewards).apply(expected);
        order.verify(lastForged).apply(expected);
        order.verify(sent).apply(expected);
        order.verify(secondSignatures).apply(expected);
        order.verify(delegates).apply(expected);
        order.verify(votes).apply(expected);
        order.verify(multiSignatures).apply(expected);

        InOrder progress = inOrder(progressTracker);
        progress.verify(progressTracker).start("SPV Building", 8);
        for (int i = 0; i < PHASE_NAMES.size(); i++) {
            progress.verify(progressTracker).advance("SPV Building", i + 1, 8, PHASE_NAMES.get(i));
        }
        progress.verify(progressTracker).stop("SPV Building", 8, 8);

        assertEquals(RebuildStatus.COMPLETED, result.getStatus());
        assertEquals(51, result.getActiveDelegates());
        assertEquals(3, result.getWallets());
        assertEquals(1, result.getDelegates());
        assertEquals(1.0, meterRegistry.get("spv.rebuild.completed").counter().count());
        assertEquals(8, meterRegistry.find("spv.rebuild.phase.duration").timers().size());
    }

    @Test
    @DisplayName("A storage failure aborts the pass and skips every later phase")
    void testBuild_StorageFailureAborts() {
        doThrow(new DataAccessResourceFailureException("connection reset")).when(sent).apply(any());

        RebuildException exception = assertThrows(RebuildException.class, () -> service.build(10));

        assertEquals("Sent Transactions", exception.getPhase());
        assertEquals(10, exception.getHeight());
        assertTrue(exception.getMessage().contains("connection reset"));
        verify(secondSignatures, never()).apply(any());
        verify(multiSignatures, never()).apply(any());
        verify(progressTracker).stop("SPV Building", 4, 8);

        RebuildResult last = service.getLastResult().orElseThrow();
        assertEquals(RebuildStatus.FAILED, last.getStatus());
        assertEquals(21, last.getActiveDelegates());
        assertEquals(1.0, meterRegistry.get("spv.rebuild.failed").tag("phase", "sent_transactions").counter().count());
        assertFalse(service.isRunning());
    }

    @Test
    @DisplayName("A decode failure is wrapped with the phase that hit it")
    void testBuild_DecodeFailureWrapped() {
        doThrow(new TransactionDecodeException("bad marker")).when(votes).apply(any());

        RebuildException exception = assertThrows(RebuildException.class, () -> service.build(1));

        assertEquals("Votes", exception.getPhase());
        assertInstanceOf(TransactionDecodeException.class, exception.getCause());
    }

    @Test
    @DisplayName("Unexpected errors propagate unchanged but still mark the pass failed")
    void testBuild_UnexpectedErrorPropagates() {
        doThrow(new IllegalStateException("boom")).when(delegates).apply(any());

        IllegalStateException exception = assertThrows(IllegalStateException.class, () -> service.build(1));

        assertEquals("boom", exception.getMessage());
        assertEquals(RebuildStatus.FAILED, service.getLastResult().orElseThrow().getStatus());
        assertEquals("Delegates", service.getLastResult().orElseThrow().getFailedPhase());
    }

    @Test
    @DisplayName("A second build while one is running is rejected")
    void testBuild_RejectsConcurrentRun() {
        doAnswer(invocation -> {
            assertTrue(service.isRunning());
            assertThrows(IllegalStateException.class, () -> service.build(1));
            return null;
        }).when(received).apply(any());

        assertTrue(service.build(1).isCompleted());
        assertFalse(service.isRunning());
    }

    @Test
    @DisplayName("No result is reported before the first pass")
    void testGetLastResult_EmptyBeforeFirstRun() {
        assertTrue(service.getLastResult().isEmpty());
        assertEquals(PHASE_NAMES, service.getPhases().stream().map(RebuildPhase::getName).toList());
    }
}

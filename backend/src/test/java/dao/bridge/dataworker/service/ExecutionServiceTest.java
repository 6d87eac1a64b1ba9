package dao.bridge.dataworker.service;

import dao.bridge.dataworker.DataworkerTestContext;
import dao.bridge.dataworker.exception.BundleStateException;
import dao.bridge.dataworker.model.BundleStatus;
import dao.bridge.dataworker.model.Deposit;
import dao.bridge.dataworker.model.ExecutionReport;
import dao.bridge.dataworker.model.LeafStatus;
import dao.bridge.dataworker.model.LocalBundle;
import dao.bridge.dataworker.model.RelayData;
import dao.bridge.dataworker.model.RootType;
import dao.bridge.dataworker.model.StoredLeaf;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static dao.bridge.dataworker.BridgeFixtures.CHAIN_A;
import static dao.bridge.dataworker.BridgeFixtures.CHAIN_B;
import static dao.bridge.dataworker.BridgeFixtures.CHAIN_C;
import static dao.bridge.dataworker.BridgeFixtures.RELAYER_R;
import static dao.bridge.dataworker.BridgeFixtures.deposit;
import static dao.bridge.dataworker.BridgeFixtures.fill;
import static dao.bridge.dataworker.BridgeFixtures.range;
import static dao.bridge.dataworker.DataworkerTestContext.RELAYED_ROOT_BUNDLE_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutionServiceTest {

    private DataworkerTestContext ctx;
    private LocalBundle bundle;

    @BeforeEach
    void setUp() {
        ctx = new DataworkerTestContext();

        // three unfilled deposits A -> B (slow relay leaves 0..2); one fill repaid on B
        ctx.spokeA.addDeposit(deposit(1, CHAIN_A, CHAIN_B, 100, 10));
        ctx.spokeA.addDeposit(deposit(2, CHAIN_A, CHAIN_B, 200, 11));
        ctx.spokeA.addDeposit(deposit(3, CHAIN_A, CHAIN_B, 300, 12));
        Deposit filled = deposit(4, CHAIN_A, CHAIN_C, 60, 13);
        ctx.spokeA.addDeposit(filled);
        ctx.spokeC.addFill(fill(filled, 60, 60, RELAYER_R, CHAIN_B, 20));

        bundle = ctx.bundleService.propose(range(0, 100, 0, 100, 0, 100));
        assertTrue(ctx.bundleService.validate(bundle.getLocalId()).isValid());
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    @DisplayName("Test executeAll submits every leaf, pool rebalance first, then closes the bundle")
    void testExecuteAllClosesBundle() {
        // Act
        List<ExecutionReport> reports = ctx.executionService.executeAll(bundle.getLocalId());

        // Assert
        assertEquals(List.of(RootType.POOL_REBALANCE, RootType.RELAYER_REFUND, RootType.SLOW_RELAY),
                reports.stream().map(ExecutionReport::rootType).toList());
        assertTrue(reports.stream().allMatch(ExecutionReport::isComplete));
        assertEquals(List.of(0, 1, 2), reports.get(2).executedLeaves());

        assertEquals(BundleStatus.CLOSED, bundle.getStatus());
        assertEquals(Map.of(CHAIN_B, RELAYED_ROOT_BUNDLE_ID), bundle.getRelayedRootBundleIds());
        assertTrue(bundle.allLeavesExecuted());
        for (StoredLeaf<RelayData> leaf : bundle.getSlowRelayRoot().getLeaves()) {
            assertNotNull(leaf.getExecutionTxId());
        }

        InOrder order = inOrder(ctx.hubClient, ctx.spokeClient);
        order.verify(ctx.hubClient).executeRootBundle(any(), anyList());
        order.verify(ctx.spokeClient).executeRelayerRefundLeaf(eq(RELAYED_ROOT_BUNDLE_ID), any(), anyList());
        order.verify(ctx.spokeClient, times(3)).executeSlowRelayLeaf(eq(RELAYED_ROOT_BUNDLE_ID), any(), anyList());
    }

    @Test
    @DisplayName("Test submitted proofs verify against the proposed roots")
    void testSubmittedProofsVerify() {
        ctx.executionService.execute(bundle.getLocalId(), RootType.SLOW_RELAY);

        for (StoredLeaf<RelayData> leaf : bundle.getSlowRelayRoot().getLeaves()) {
            verify(ctx.spokeClient).executeSlowRelayLeaf(RELAYED_ROOT_BUNDLE_ID, leaf.getLeaf(), leaf.getProof());
            assertTrue(ctx.merkleTreeService.verifyProof(ctx.leafCodec.hashRelayData(leaf.getLeaf()),
                    leaf.getProof(), bundle.getSlowRelayRoot().getRootHex()));
        }
    }

    @Test
    @DisplayName("Test re-running execution skips leaves it already executed")
    void testExecutionIsIdempotent() {
        ExecutionReport first = ctx.executionService.execute(bundle.getLocalId(), RootType.SLOW_RELAY);
        ExecutionReport second = ctx.executionService.execute(bundle.getLocalId(), RootType.SLOW_RELAY);

        assertEquals(List.of(0, 1, 2), first.executedLeaves());
        assertTrue(second.executedLeaves().isEmpty());
        assertEquals(List.of(0, 1, 2), second.skippedLeaves());
        verify(ctx.spokeClient, times(3)).executeSlowRelayLeaf(anyLong(), any(), anyList());
        assertEquals(BundleStatus.EXECUTING, bundle.getStatus(), "Other roots are still pending");
    }

    @Test
    @DisplayName("Test leaf already executed on-chain is skipped without error")
    void testOnChainExecutedLeafSkipped() {
        when(ctx.hubClient.isPoolRebalanceLeafExecuted(bundle.getPoolRebalanceRoot().getRootHex(), 0)).thenReturn(true);

        ExecutionReport report = ctx.executionService.execute(bundle.getLocalId(), RootType.POOL_REBALANCE);

        assertTrue(report.isComplete());
        assertEquals(List.of(0), report.skippedLeaves());
        verify(ctx.hubClient, never()).executeRootBundle(any(), anyList());
        assertEquals(LeafStatus.EXECUTED, bundle.getPoolRebalanceRoot().getLeaves().get(0).getStatus());
    }

    @Test
    @DisplayName("Test one failing leaf is reported while the others execute, and succeeds on retry")
    void testPerLeafFailure() {
        // Arrange: deposit 2 (leaf 1) reverts once
        doAnswer(inv -> {
            RelayData leaf = inv.getArgument(1);
            if (leaf.depositId() == 2) {
                throw new IllegalStateException("execution reverted");
            }
            return "slow-" + leaf.depositId();
        }).when(ctx.spokeClient).executeSlowRelayLeaf(anyLong(), any(), anyList());

        // Act
        ExecutionReport report = ctx.executionService.execute(bundle.getLocalId(), RootType.SLOW_RELAY);

        // Assert
        assertFalse(report.isComplete());
        assertEquals(List.of(0, 2), report.executedLeaves());
        assertEquals(Map.of(1, "execution reverted"), report.failedLeaves());
        assertEquals(LeafStatus.PENDING, bundle.getSlowRelayRoot().getLeaves().get(1).getStatus());

        // Retry
        doReturn("slow-retry").when(ctx.spokeClient).executeSlowRelayLeaf(anyLong(), any(), anyList());
        ExecutionReport retry = ctx.executionService.execute(bundle.getLocalId(), RootType.SLOW_RELAY);

        assertEquals(List.of(1), retry.executedLeaves());
        assertEquals(List.of(0, 2), retry.skippedLeaves());
        assertTrue(retry.isComplete());
    }

    @Test
    @DisplayName("Test proofs that do not match the stored root are never submitted")
    void testTamperedRootFailsEveryLeaf() {
        bundle.getSlowRelayRoot().setRootHex("0x" + "12".repeat(32));

        ExecutionReport report = ctx.executionService.execute(bundle.getLocalId(), RootType.SLOW_RELAY);

        assertEquals(List.of(0, 1, 2), List.copyOf(report.failedLeaves().keySet()));
        assertTrue(report.failedLeaves().get(0).contains("proof does not verify"));
        assertTrue(report.executedLeaves().isEmpty());
        verify(ctx.spokeClient, never()).executeSlowRelayLeaf(anyLong(), any(), anyList());
    }

    @Test
    @DisplayName("Test only validated or executing bundles can be executed")
    void testExecuteRequiresValidatedBundle() {
        ctx.bundleService.dispute(bundle.getLocalId());

        BundleStateException e = assertThrows(BundleStateException.class,
                () -> ctx.executionService.execute(bundle.getLocalId(), RootType.SLOW_RELAY));

        assertEquals(BundleStatus.DISPUTED, e.getStatus());
        verify(ctx.spokeClient, never()).executeSlowRelayLeaf(anyLong(), any(), anyList());
    }

    @Test
    @DisplayName("Test refund leaves use the id the spoke gave this bundle, not an earlier bundle's")
    void testRelayedRootBundleIdFromSpoke() {
        // Arrange: the spoke on B relayed this bundle as 5; leaf 0 of its bundle 0 was executed long ago
        when(ctx.spokeClient.findRelayedRootBundleId(CHAIN_B,
                bundle.getRelayerRefundRoot().getRootHex(), bundle.getSlowRelayRoot().getRootHex()))
                .thenReturn(OptionalLong.of(5));
        when(ctx.spokeClient.isRelayerRefundLeafExecuted(CHAIN_B, 0L, 0)).thenReturn(true);

        // Act
        ExecutionReport refunds = ctx.executionService.execute(bundle.getLocalId(), RootType.RELAYER_REFUND);
        ctx.executionService.execute(bundle.getLocalId(), RootType.SLOW_RELAY);

        // Assert
        assertEquals(List.of(0), refunds.executedLeaves());
        assertTrue(refunds.skippedLeaves().isEmpty());
        verify(ctx.spokeClient).isRelayerRefundLeafExecuted(CHAIN_B, 5L, 0);
        verify(ctx.spokeClient).executeRelayerRefundLeaf(eq(5L), any(), anyList());
        verify(ctx.spokeClient, never()).executeRelayerRefundLeaf(eq(0L), any(), anyList());
        verify(ctx.spokeClient, times(3)).executeSlowRelayLeaf(eq(5L), any(), anyList());
        assertEquals(Map.of(CHAIN_B, 5L), bundle.getRelayedRootBundleIds());
        verify(ctx.spokeClient, times(1)).findRelayedRootBundleId(anyInt(), anyString(), anyString());
    }

    @Test
    @DisplayName("Test leaves stay pending until the bundle is relayed to their chain")
    void testLeavesWaitForRelay() {
        doReturn(OptionalLong.empty()).when(ctx.spokeClient).findRelayedRootBundleId(anyInt(), anyString(), anyString());

        ExecutionReport report = ctx.executionService.execute(bundle.getLocalId(), RootType.RELAYER_REFUND);

        assertTrue(report.failedLeaves().get(0).contains("not relayed to chain " + CHAIN_B));
        assertEquals(LeafStatus.PENDING, bundle.getRelayerRefundRoot().getLeaves().get(0).getStatus());
        verify(ctx.spokeClient, never()).executeRelayerRefundLeaf(anyLong(), any(), anyList());
        assertTrue(bundle.getRelayedRootBundleIds().isEmpty());

        // Hub relays the bundle
        doReturn(OptionalLong.of(9)).when(ctx.spokeClient).findRelayedRootBundleId(anyInt(), anyString(), anyString());
        ExecutionReport retry = ctx.executionService.execute(bundle.getLocalId(), RootType.RELAYER_REFUND);

        assertEquals(List.of(0), retry.executedLeaves());
        verify(ctx.spokeClient).executeRelayerRefundLeaf(eq(9L), any(), anyList());
    }

    @Test
    @DisplayName("Test a stored root without its leaves is reported as failed and keeps the bundle open")
    void testRootWithoutLeavesFails() {
        bundle.getSlowRelayRoot().setLeaves(new ArrayList<>());

        List<ExecutionReport> reports = ctx.executionService.executeAll(bundle.getLocalId());

        ExecutionReport slow = reports.get(2);
        assertFalse(slow.isComplete());
        assertTrue(slow.failedLeaves().get(ExecutionReport.WHOLE_ROOT).contains("no persisted leaves"));
        verify(ctx.spokeClient, never()).executeSlowRelayLeaf(anyLong(), any(), anyList());
        assertTrue(reports.get(0).isComplete());
        assertEquals(BundleStatus.EXECUTING, bundle.getStatus());
        assertFalse(bundle.allLeavesExecuted());
    }
}

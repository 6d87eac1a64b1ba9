package dao.bridge.dataworker.scheduler;

import dao.bridge.dataworker.client.InMemorySpokePoolClient;
import dao.bridge.dataworker.client.SpokePoolClients;
import dao.bridge.dataworker.config.SchedulerProperties;
import dao.bridge.dataworker.model.BundleBlockRange;
import dao.bridge.dataworker.model.BundleStatus;
import dao.bridge.dataworker.model.LocalBundle;
import dao.bridge.dataworker.service.BundleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static dao.bridge.dataworker.BridgeFixtures.CHAIN_A;
import static dao.bridge.dataworker.BridgeFixtures.CHAIN_B;
import static dao.bridge.dataworker.BridgeFixtures.CHAIN_C;
import static dao.bridge.dataworker.BridgeFixtures.range;
import static dao.bridge.dataworker.BridgeFixtures.updatedClient;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProposalSchedulerTest {

    private InMemorySpokePoolClient spokeA;
    private InMemorySpokePoolClient spokeB;
    private InMemorySpokePoolClient spokeC;
    private BundleService bundleService;
    private SchedulerProperties schedulerProps;
    private ProposalScheduler scheduler;

    @BeforeEach
    void setUp() {
        spokeA = updatedClient(CHAIN_A);
        spokeB = updatedClient(CHAIN_B);
        spokeC = updatedClient(CHAIN_C);
        spokeA.setLatestBlockNumber(100);
        spokeB.setLatestBlockNumber(200);
        spokeC.setLatestBlockNumber(300);

        bundleService = mock(BundleService.class);
        when(bundleService.getLatestActiveBundle()).thenReturn(Optional.empty());
        schedulerProps = new SchedulerProperties();
        schedulerProps.getProposal().setEnabled(true);
        scheduler = new ProposalScheduler(bundleService, SpokePoolClients.of(spokeA, spokeB, spokeC), schedulerProps);
    }

    @Test
    @DisplayName("Test first bundle covers every chain from block 0 to its latest block")
    void testFirstRange() {
        Optional<BundleBlockRange> next = scheduler.nextBlockRange();

        assertEquals(range(0, 100, 0, 200, 0, 300), next.orElseThrow());
    }

    @Test
    @DisplayName("Test next bundle starts one block after the previous active bundle")
    void testRangeContinuesPreviousBundle() {
        when(bundleService.getLatestActiveBundle()).thenReturn(Optional.of(bundle(range(0, 90, 0, 150, 0, 299))));

        assertEquals(range(91, 100, 151, 200, 300, 300), scheduler.nextBlockRange().orElseThrow());
    }

    @Test
    @DisplayName("Test no range while any chain has not advanced or none advanced enough")
    void testNoRangeWithoutProgress() {
        when(bundleService.getLatestActiveBundle()).thenReturn(Optional.of(bundle(range(0, 100, 0, 150, 0, 250))));
        assertTrue(scheduler.nextBlockRange().isEmpty(), "Chain A has no new blocks");

        when(bundleService.getLatestActiveBundle()).thenReturn(Optional.of(bundle(range(0, 95, 0, 195, 0, 295))));
        schedulerProps.getProposal().setMinBlocksPerBundle(10);
        assertTrue(scheduler.nextBlockRange().isEmpty(), "Every chain advanced fewer than 10 blocks");
    }

    @Test
    @DisplayName("Test scheduled proposal runs only when enabled and nothing is pending")
    void testMaybeProposeBundle() {
        schedulerProps.getProposal().setEnabled(false);
        scheduler.maybeProposeBundle();
        verify(bundleService, never()).propose(any());

        schedulerProps.getProposal().setEnabled(true);
        when(bundleService.hasPendingBundle()).thenReturn(true);
        scheduler.maybeProposeBundle();
        verify(bundleService, never()).propose(any());

        when(bundleService.hasPendingBundle()).thenReturn(false);
        when(bundleService.propose(any())).thenReturn(bundle(range(0, 100, 0, 200, 0, 300)));
        scheduler.maybeProposeBundle();
        verify(bundleService).propose(range(0, 100, 0, 200, 0, 300));
    }

    private static LocalBundle bundle(BundleBlockRange range) {
        LocalBundle b = new LocalBundle();
        b.setLocalId(1);
        b.setBlockRange(range);
        b.setStatus(BundleStatus.CLOSED);
        return b;
    }
}

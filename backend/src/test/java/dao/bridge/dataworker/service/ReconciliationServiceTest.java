package dao.bridge.dataworker.service;

import dao.bridge.dataworker.client.InMemorySpokePoolClient;
import dao.bridge.dataworker.client.SpokePoolClients;
import dao.bridge.dataworker.config.BundleProperties;
import dao.bridge.dataworker.exception.ReconciliationAbortedException;
import dao.bridge.dataworker.exception.StaleChainStateException;
import dao.bridge.dataworker.model.Deposit;
import dao.bridge.dataworker.model.Fill;
import dao.bridge.dataworker.model.ReconciledBundleData;
import dao.bridge.dataworker.model.UnfilledDeposit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static dao.bridge.dataworker.BridgeFixtures.CHAIN_A;
import static dao.bridge.dataworker.BridgeFixtures.CHAIN_B;
import static dao.bridge.dataworker.BridgeFixtures.CHAIN_C;
import static dao.bridge.dataworker.BridgeFixtures.RELAYER_R;
import static dao.bridge.dataworker.BridgeFixtures.RELAYER_S;
import static dao.bridge.dataworker.BridgeFixtures.big;
import static dao.bridge.dataworker.BridgeFixtures.deposit;
import static dao.bridge.dataworker.BridgeFixtures.fill;
import static dao.bridge.dataworker.BridgeFixtures.range;
import static dao.bridge.dataworker.BridgeFixtures.slowFill;
import static dao.bridge.dataworker.BridgeFixtures.updatedClient;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconciliationServiceTest {

    private InMemorySpokePoolClient spokeA;
    private InMemorySpokePoolClient spokeB;
    private InMemorySpokePoolClient spokeC;
    private ReconciliationService reconciliationService;

    @BeforeEach
    void setUp() {
        spokeA = updatedClient(CHAIN_A);
        spokeB = updatedClient(CHAIN_B);
        spokeC = updatedClient(CHAIN_C);
        reconciliationService = newService(1);
    }

    @AfterEach
    void tearDown() {
        reconciliationService.shutdown();
    }

    private ReconciliationService newService(int maxParallel) {
        BundleProperties props = new BundleProperties();
        props.setReconciliationMaxParallel(maxParallel);
        return new ReconciliationService(SpokePoolClients.of(spokeA, spokeB, spokeC), props);
    }

    @Test
    @DisplayName("Test deposit with no fills is fully unfilled under its destination")
    void testDepositWithoutFillsIsUnfilled() {
        // Arrange
        Deposit d = deposit(1, CHAIN_A, CHAIN_B, 100, 10);
        spokeA.addDeposit(d);

        // Act
        ReconciledBundleData data = reconciliationService.loadData();

        // Assert
        assertEquals(List.of(CHAIN_B), List.copyOf(data.unfilledDeposits().keySet()));
        List<UnfilledDeposit> unfilled = data.unfilledDeposits().get(CHAIN_B);
        assertEquals(1, unfilled.size());
        assertEquals(d, unfilled.get(0).deposit());
        assertEquals(big(100), unfilled.get(0).unfilledAmount());
        assertTrue(data.fillsToRefund().isEmpty());
    }

    @Test
    @DisplayName("Test full fill is refunded on the repayment chain and leaves nothing unfilled")
    void testFullFillRefundedOnRepaymentChain() {
        // Arrange
        Deposit d = deposit(1, CHAIN_A, CHAIN_B, 100, 10);
        Fill f = fill(d, 100, 100, RELAYER_R, CHAIN_C, 20);
        spokeA.addDeposit(d);
        spokeB.addFill(f);

        // Act
        ReconciledBundleData data = reconciliationService.loadData();

        // Assert
        assertTrue(data.unfilledDeposits().isEmpty());
        assertEquals(List.of(CHAIN_C), data.fillsToRefund().repaymentChainIds());
        assertEquals(List.of(f), data.fillsToRefund().get(CHAIN_C, RELAYER_R));
    }

    @Test
    @DisplayName("Test relayer key lookup ignores address case")
    void testRelayerKeyIsCaseInsensitive() {
        Deposit d = deposit(1, CHAIN_A, CHAIN_B, 100, 10);
        spokeA.addDeposit(d);
        spokeB.addFill(fill(d, 100, 100, "0xAbCdEf000000000000000000000000000000aBcD", CHAIN_C, 20));

        ReconciledBundleData data = reconciliationService.loadData();

        assertEquals(1, data.fillsToRefund().get(CHAIN_C, "0xabcdef000000000000000000000000000000abcd").size());
        assertEquals(List.of("0xabcdef000000000000000000000000000000abcd"),
                List.copyOf(data.fillsToRefund().forRepaymentChain(CHAIN_C).keySet()));
    }

    @Test
    @DisplayName("Test fills by one relayer on one repayment chain accumulate")
    void testFillsAccumulatePerRelayerAndChain() {
        // Arrange
        Deposit d = deposit(1, CHAIN_A, CHAIN_B, 100, 10);
        Fill first = fill(d, 30, 30, RELAYER_R, CHAIN_C, 20);
        Fill second = fill(d, 70, 100, RELAYER_R, CHAIN_C, 21);
        spokeA.addDeposit(d);
        spokeB.addFill(second);
        spokeB.addFill(first);

        // Act
        ReconciledBundleData data = reconciliationService.loadData();

        // Assert
        List<Fill> fills = data.fillsToRefund().get(CHAIN_C, RELAYER_R);
        assertEquals(List.of(first, second), fills);
        assertTrue(data.unfilledDeposits().isEmpty());
    }

    @Test
    @DisplayName("Test partial fill leaves the remainder unfilled and conserves the deposit amount")
    void testPartialFillConservesAmount() {
        Deposit d = deposit(1, CHAIN_A, CHAIN_B, 100, 10);
        spokeA.addDeposit(d);
        spokeB.addFill(fill(d, 40, 40, RELAYER_R, CHAIN_A, 20));
        spokeB.addFill(fill(d, 25, 65, RELAYER_S, CHAIN_B, 21));

        ReconciledBundleData data = reconciliationService.loadData();

        BigInteger refunded = data.fillsToRefund().allFills().stream()
                .map(Fill::fillAmount)
                .reduce(BigInteger.ZERO, BigInteger::add);
        BigInteger unfilled = data.unfilledDeposits().get(CHAIN_B).get(0).unfilledAmount();
        assertEquals(big(35), unfilled);
        assertEquals(d.amount(), refunded.add(unfilled));
    }

    @Test
    @DisplayName("Test slow relay fill never counts as filled and is never refunded")
    void testSlowRelayFillExcluded() {
        // Arrange
        Deposit d = deposit(1, CHAIN_A, CHAIN_B, 100, 10);
        spokeA.addDeposit(d);
        spokeB.addFill(slowFill(d, 20));

        // Act
        ReconciledBundleData data = reconciliationService.loadData();

        // Assert
        assertEquals(big(100), data.unfilledDeposits().get(CHAIN_B).get(0).unfilledAmount());
        assertTrue(data.fillsToRefund().isEmpty());
    }

    @Test
    @DisplayName("Test fill whose economic fields differ from the deposit is dropped")
    void testMismatchedFillDropped() {
        Deposit d = deposit(1, CHAIN_A, CHAIN_B, 100, 10);
        Fill wrongFee = fill(d, 100, 100, RELAYER_R, CHAIN_C, 20).toBuilder()
                .relayerFeePct(d.relayerFeePct().add(BigInteger.ONE))
                .build();
        Fill unknownDeposit = fill(deposit(99, CHAIN_A, CHAIN_B, 100, 10), 100, 100, RELAYER_S, CHAIN_C, 20);
        spokeA.addDeposit(d);
        spokeB.addFill(wrongFee);
        spokeB.addFill(unknownDeposit);

        ReconciledBundleData data = reconciliationService.loadData();

        assertTrue(data.fillsToRefund().isEmpty());
        assertEquals(big(100), data.unfilledDeposits().get(CHAIN_B).get(0).unfilledAmount());
    }

    @Test
    @DisplayName("Test a chain that is not updated aborts the pass and is named")
    void testStaleChainRejected() {
        spokeA.addDeposit(deposit(1, CHAIN_A, CHAIN_B, 100, 10));
        spokeC.setUpdated(false);

        StaleChainStateException e = assertThrows(StaleChainStateException.class,
                () -> reconciliationService.loadData());

        assertEquals(CHAIN_C, e.getChainId());
    }

    @Test
    @DisplayName("Test abort request stops the pass without output")
    void testAbortStopsPass() {
        spokeA.addDeposit(deposit(1, CHAIN_A, CHAIN_B, 100, 10));
        AtomicInteger polls = new AtomicInteger();

        assertThrows(ReconciliationAbortedException.class,
                () -> reconciliationService.loadData(range(0, 100, 0, 100, 0, 100), () -> polls.incrementAndGet() > 2));
    }

    @Test
    @DisplayName("Test block range scopes deposits by origin blocks and fills by destination blocks")
    void testBlockRangeScoping() {
        // Arrange: deposit 1 is from an earlier bundle, deposit 2 is in range
        Deposit older = deposit(1, CHAIN_A, CHAIN_B, 100, 5);
        Deposit current = deposit(2, CHAIN_A, CHAIN_B, 50, 15);
        Deposit future = deposit(3, CHAIN_A, CHAIN_B, 80, 30);
        spokeA.addDeposit(older);
        spokeA.addDeposit(current);
        spokeA.addDeposit(future);
        Fill olderFill = fill(older, 100, 100, RELAYER_R, CHAIN_C, 115);
        Fill lateFill = fill(current, 50, 50, RELAYER_S, CHAIN_C, 130);
        spokeB.addFill(olderFill);
        spokeB.addFill(lateFill);

        // Act
        ReconciledBundleData data = reconciliationService.loadData(range(10, 20, 110, 120, 0, 100));

        // Assert: a fill in range may satisfy an older deposit; the late fill is outside B's range
        assertEquals(List.of(olderFill), data.fillsToRefund().allFills());
        List<UnfilledDeposit> unfilled = data.unfilledDeposits().get(CHAIN_B);
        assertEquals(1, unfilled.size());
        assertEquals(current, unfilled.get(0).deposit());
        assertEquals(big(50), unfilled.get(0).unfilledAmount());
    }

    @Test
    @DisplayName("Test output does not depend on event insertion order or parallelism")
    void testOrderIndependence() {
        Deposit d1 = deposit(1, CHAIN_A, CHAIN_B, 100, 10);
        Deposit d2 = deposit(2, CHAIN_A, CHAIN_C, 60, 11);
        Deposit d3 = deposit(1, CHAIN_B, CHAIN_A, 40, 12);
        Fill f1 = fill(d1, 30, 30, RELAYER_R, CHAIN_C, 20);
        Fill f2 = fill(d1, 70, 100, RELAYER_R, CHAIN_C, 21);
        Fill f3 = fill(d3, 10, 10, RELAYER_S, CHAIN_A, 22);

        spokeA.addDeposit(d1);
        spokeA.addDeposit(d2);
        spokeB.addDeposit(d3);
        spokeB.addFill(f1);
        spokeB.addFill(f2);
        spokeA.addFill(f3);
        ReconciledBundleData first = reconciliationService.loadData();

        // same events, reversed
        spokeA = updatedClient(CHAIN_A);
        spokeB = updatedClient(CHAIN_B);
        spokeC = updatedClient(CHAIN_C);
        spokeA.addFill(f3);
        spokeB.addFill(f2);
        spokeB.addFill(f1);
        spokeB.addDeposit(d3);
        spokeA.addDeposit(d2);
        spokeA.addDeposit(d1);
        ReconciliationService parallel = newService(4);
        try {
            ReconciledBundleData second = parallel.loadData();

            assertEquals(first.unfilledDeposits(), second.unfilledDeposits());
            assertEquals(first.fillsToRefund(), second.fillsToRefund());
        } finally {
            parallel.shutdown();
        }
    }
}

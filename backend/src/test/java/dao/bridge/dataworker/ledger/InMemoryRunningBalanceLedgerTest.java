package dao.bridge.dataworker.ledger;

import dao.bridge.dataworker.model.BalanceKey;
import dao.bridge.dataworker.model.RunningBalanceEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static dao.bridge.dataworker.BridgeFixtures.CHAIN_B;
import static dao.bridge.dataworker.BridgeFixtures.CHAIN_C;
import static dao.bridge.dataworker.BridgeFixtures.USDC_L1;
import static dao.bridge.dataworker.BridgeFixtures.WETH_L1;
import static dao.bridge.dataworker.BridgeFixtures.big;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryRunningBalanceLedgerTest {

    private static final BalanceKey B_WETH = new BalanceKey(CHAIN_B, WETH_L1);
    private static final BalanceKey C_USDC = new BalanceKey(CHAIN_C, USDC_L1);

    private InMemoryRunningBalanceLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryRunningBalanceLedger();
    }

    @Test
    @DisplayName("Test latest balances follow the highest committed version")
    void testLatestBalances() {
        ledger.commit(1, List.of(entry(B_WETH, 0, 100, 100), entry(C_USDC, 0, 20, 20)));
        ledger.commit(2, List.of(entry(B_WETH, 100, 50, 150)));

        Map<BalanceKey, BigInteger> latest = ledger.latestBalances();

        assertEquals(big(150), latest.get(B_WETH));
        assertEquals(big(20), latest.get(C_USDC));
    }

    @Test
    @DisplayName("Test balances before a version ignore that version and later ones")
    void testBalancesBefore() {
        ledger.commit(1, List.of(entry(B_WETH, 0, 100, 100)));
        ledger.commit(2, List.of(entry(B_WETH, 100, 50, 150), entry(C_USDC, 0, 20, 20)));
        ledger.commit(3, List.of(entry(B_WETH, 150, 10, 160)));

        Map<BalanceKey, BigInteger> beforeTwo = ledger.balancesBefore(2);

        assertEquals(Map.of(B_WETH, big(100)), beforeTwo);
        assertTrue(ledger.balancesBefore(1).isEmpty());
    }

    @Test
    @DisplayName("Test revert drops a version and restores the previous balances")
    void testRevert() {
        ledger.commit(1, List.of(entry(B_WETH, 0, 100, 100)));
        ledger.commit(2, List.of(entry(B_WETH, 100, 50, 150), entry(C_USDC, 0, 20, 20)));

        List<RunningBalanceEntry> dropped = ledger.revert(2);

        assertEquals(2, dropped.size());
        assertEquals(Map.of(B_WETH, big(100)), ledger.latestBalances());
        assertTrue(ledger.revert(2).isEmpty(), "Second revert is a no-op");
    }

    @Test
    @DisplayName("Test committing a version twice is rejected without partial writes")
    void testDuplicateVersionRejected() {
        ledger.commit(1, List.of(entry(B_WETH, 0, 100, 100)));

        assertThrows(IllegalStateException.class,
                () -> ledger.commit(1, List.of(entry(C_USDC, 0, 5, 5), entry(B_WETH, 100, 1, 101))));

        assertEquals(Map.of(B_WETH, big(100)), ledger.latestBalances());
    }

    @Test
    @DisplayName("Test history lists versions ascending and accepts any token case")
    void testHistory() {
        ledger.commit(1, List.of(entry(B_WETH, 0, 100, 100)));
        ledger.commit(4, List.of(entry(B_WETH, 100, 50, 0)));

        List<RunningBalanceEntry> history = ledger.history(CHAIN_B, WETH_L1.toUpperCase().replace("0X", "0x"));

        assertEquals(List.of(1L, 4L), history.stream().map(RunningBalanceEntry::version).toList());
        assertTrue(ledger.history(CHAIN_C, WETH_L1).isEmpty());
    }

    private static RunningBalanceEntry entry(BalanceKey key, long prior, long bundleAmount, long newBalance) {
        BigInteger netSend = big(prior + bundleAmount - newBalance);
        // version is stamped by commit
        return new RunningBalanceEntry(key, 0, big(prior), big(bundleAmount), BigInteger.ZERO, netSend, big(newBalance));
    }
}

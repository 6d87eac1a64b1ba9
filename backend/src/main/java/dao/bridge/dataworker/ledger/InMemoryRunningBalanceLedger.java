package dao.bridge.dataworker.ledger;

import dao.bridge.dataworker.model.BalanceKey;
import dao.bridge.dataworker.model.RunningBalanceEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedMap;
import java.util.TreeMap;

@Slf4j
@Repository
public class InMemoryRunningBalanceLedger implements RunningBalanceLedger {

    // key -> version -> entry
    private final Map<BalanceKey, NavigableMap<Long, RunningBalanceEntry>> entries = new TreeMap<>();

    @Override
    public synchronized SortedMap<BalanceKey, BigInteger> latestBalances() {
        SortedMap<BalanceKey, BigInteger> out = new TreeMap<>();
        entries.forEach((key, versions) -> {
            if (!versions.isEmpty()) {
                out.put(key, versions.lastEntry().getValue().newBalance());
            }
        });
        return out;
    }

    @Override
    public synchronized SortedMap<BalanceKey, BigInteger> balancesBefore(long version) {
        SortedMap<BalanceKey, BigInteger> out = new TreeMap<>();
        entries.forEach((key, versions) -> {
            Map.Entry<Long, RunningBalanceEntry> e = versions.lowerEntry(version);
            if (e != null) {
                out.put(key, e.getValue().newBalance());
            }
        });
        return out;
    }

    @Override
    public synchronized void commit(long version, List<RunningBalanceEntry> newEntries) {
        for (RunningBalanceEntry e : newEntries) {
            NavigableMap<Long, RunningBalanceEntry> versions = entries.get(e.key());
            if (versions != null && versions.containsKey(version)) {
                throw new IllegalStateException("Ledger version " + version + " already committed for " + e.key());
            }
        }
        for (RunningBalanceEntry e : newEntries) {
            RunningBalanceEntry stored = e.version() == version ? e : e.withVersion(version);
            entries.computeIfAbsent(stored.key(), k -> new TreeMap<>()).put(version, stored);
            log.info("Ledger commit v{}: chainId={}, l1Token={}, {} -> {} (netSend={})",
                    version, stored.key().chainId(), stored.key().l1Token(),
                    stored.priorBalance(), stored.newBalance(), stored.netSendAmount());
        }
    }

    @Override
    public synchronized List<RunningBalanceEntry> revert(long version) {
        List<RunningBalanceEntry> dropped = new ArrayList<>();
        for (NavigableMap<Long, RunningBalanceEntry> versions : entries.values()) {
            RunningBalanceEntry removed = versions.remove(version);
            if (removed != null) {
                dropped.add(removed);
            }
        }
        entries.values().removeIf(Map::isEmpty);
        if (!dropped.isEmpty()) {
            log.info("Ledger revert v{}: {} entries dropped", version, dropped.size());
        }
        return dropped;
    }

    @Override
    public synchronized List<RunningBalanceEntry> history(int chainId, String l1Token) {
        NavigableMap<Long, RunningBalanceEntry> versions = entries.get(new BalanceKey(chainId, l1Token));
        return versions == null ? List.of() : List.copyOf(versions.values());
    }
}

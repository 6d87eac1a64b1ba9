package dao.bridge.dataworker.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Valid fills keyed by (repaymentChainId, relayer). Fills for the same key accumulate.
 * Relayer addresses are keyed lower-case.
 */
public class FillsToRefund {

    private final SortedMap<Integer, SortedMap<String, List<Fill>>> fills = new TreeMap<>();

    public void add(Fill fill) {
        fills.computeIfAbsent(fill.repaymentChainId(), k -> new TreeMap<>())
                .computeIfAbsent(normalize(fill.relayer()), k -> new ArrayList<>())
                .add(fill);
    }

    public List<Fill> get(int repaymentChainId, String relayer) {
        SortedMap<String, List<Fill>> byRelayer = fills.get(repaymentChainId);
        if (byRelayer == null) return List.of();
        List<Fill> list = byRelayer.get(normalize(relayer));
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    public List<Integer> repaymentChainIds() {
        return List.copyOf(fills.keySet());
    }

    public SortedMap<String, List<Fill>> forRepaymentChain(int repaymentChainId) {
        SortedMap<String, List<Fill>> byRelayer = fills.get(repaymentChainId);
        return byRelayer == null ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(byRelayer);
    }

    public List<Fill> allFills() {
        List<Fill> out = new ArrayList<>();
        fills.values().forEach(byRelayer -> byRelayer.values().forEach(out::addAll));
        return out;
    }

    public boolean isEmpty() {
        return fills.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FillsToRefund other)) return false;
        return fills.equals(other.fills);
    }

    @Override
    public int hashCode() {
        return fills.hashCode();
    }

    @Override
    public String toString() {
        return "FillsToRefund" + fills;
    }

    private static String normalize(String address) {
        return address == null ? "" : address.toLowerCase(Locale.ROOT);
    }
}

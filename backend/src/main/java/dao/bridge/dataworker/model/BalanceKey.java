package dao.bridge.dataworker.model;

import java.util.Comparator;
import java.util.Locale;

/**
 * Running-balance ledger key. l1Token is kept lower-case so ordering is case-independent.
 */
public record BalanceKey(int chainId, String l1Token) implements Comparable<BalanceKey> {

    private static final Comparator<BalanceKey> ORDER = Comparator
            .comparingInt(BalanceKey::chainId)
            .thenComparing(BalanceKey::l1Token);

    public BalanceKey {
        if (l1Token == null || l1Token.isBlank()) {
            throw new IllegalArgumentException("l1Token is required");
        }
        l1Token = l1Token.toLowerCase(Locale.ROOT);
    }

    @Override
    public int compareTo(BalanceKey other) {
        return ORDER.compare(this, other);
    }
}

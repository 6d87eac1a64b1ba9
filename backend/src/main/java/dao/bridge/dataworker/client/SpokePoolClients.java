package dao.bridge.dataworker.client;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The active chain set: one spoke pool client per chain id, iterated in ascending chain-id order.
 */
public class SpokePoolClients {

    private final SortedMap<Integer, SpokePoolClient> clients;

    public SpokePoolClients(Map<Integer, ? extends SpokePoolClient> clients) {
        this.clients = new TreeMap<>(clients);
    }

    public static SpokePoolClients of(SpokePoolClient... clients) {
        SortedMap<Integer, SpokePoolClient> map = new TreeMap<>();
        for (SpokePoolClient c : clients) {
            if (map.put(c.getChainId(), c) != null) {
                throw new IllegalArgumentException("Duplicate spoke pool client for chain " + c.getChainId());
            }
        }
        return new SpokePoolClients(map);
    }

    public List<Integer> chainIds() {
        return List.copyOf(clients.keySet());
    }

    public SpokePoolClient get(int chainId) {
        SpokePoolClient c = clients.get(chainId);
        if (c == null) {
            throw new IllegalArgumentException("No spoke pool client for chain " + chainId);
        }
        return c;
    }

    public Collection<SpokePoolClient> all() {
        return clients.values();
    }
}

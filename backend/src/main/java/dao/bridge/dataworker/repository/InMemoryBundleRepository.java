package dao.bridge.dataworker.repository;

import dao.bridge.dataworker.model.BundleStatus;
import dao.bridge.dataworker.model.LocalBundle;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
public class InMemoryBundleRepository implements BundleRepository {

    // key: localId
    private final Map<Long, LocalBundle> bundlesByLocalId = new ConcurrentHashMap<>();

    private final AtomicLong localIdSeq = new AtomicLong(1);

    @Override
    public long reserveLocalId() {
        return localIdSeq.getAndIncrement();
    }

    @Override
    public synchronized void save(LocalBundle bundle) {
        // assign localId if new
        if (bundle.getLocalId() == 0L) {
            bundle.setLocalId(reserveLocalId());
        }

        bundlesByLocalId.put(bundle.getLocalId(), bundle);
    }

    @Override
    public List<LocalBundle> findAll() {
        List<LocalBundle> out = new ArrayList<>(bundlesByLocalId.values());
        out.sort(Comparator.comparingLong(LocalBundle::getLocalId));
        return out;
    }

    @Override
    public Optional<LocalBundle> findByLocalId(long localId) {
        return Optional.ofNullable(bundlesByLocalId.get(localId));
    }

    @Override
    public Optional<LocalBundle> findLatestActive() {
        return bundlesByLocalId.values().stream()
                .filter(b -> b.getStatus() != BundleStatus.DISPUTED)
                .max(Comparator.comparingLong(LocalBundle::getLocalId));
    }
}

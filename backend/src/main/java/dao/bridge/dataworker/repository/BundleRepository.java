package dao.bridge.dataworker.repository;

import dao.bridge.dataworker.model.LocalBundle;

import java.util.List;
import java.util.Optional;

public interface BundleRepository {

    /**
     * Next local id. Reserved once the hub has accepted a proposal, so failed proposals leave no gaps.
     */
    long reserveLocalId();

    void save(LocalBundle bundle);

    List<LocalBundle> findAll();

    Optional<LocalBundle> findByLocalId(long localId);

    /**
     * Most recent bundle that was not disputed, if any.
     */
    Optional<LocalBundle> findLatestActive();
}

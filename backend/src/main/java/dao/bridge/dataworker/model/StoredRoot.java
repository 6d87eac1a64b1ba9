package dao.bridge.dataworker.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A persisted root plus the ordered leaves needed to rebuild proofs.
 * An absent root is stored explicitly with {@code empty = true} and no leaves.
 */
@Data
public class StoredRoot<L> {

    private RootType rootType;
    private boolean empty;
    /** 0x-prefixed root; the zero root when empty. */
    private String rootHex;
    private List<StoredLeaf<L>> leaves = new ArrayList<>();

    /**
     * False for a non-empty root whose leaves were lost: it can never be executed.
     */
    public boolean allExecuted() {
        if (!empty && leaves.isEmpty()) return false;
        return leaves.stream().allMatch(StoredLeaf::isExecuted);
    }

    public long executedCount() {
        return leaves.stream().filter(StoredLeaf::isExecuted).count();
    }
}

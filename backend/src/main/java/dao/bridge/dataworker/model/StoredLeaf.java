package dao.bridge.dataworker.model;

import lombok.Data;

import java.util.List;

@Data
public class StoredLeaf<L> {

    private int leafId;
    private L leaf;
    private List<String> proof;         // hex-encoded bytes32[]
    private LeafStatus status = LeafStatus.PENDING;
    /** Transaction id of the settlement call that executed this leaf (if executed by us). */
    private String executionTxId;

    public boolean isExecuted() {
        return status == LeafStatus.EXECUTED;
    }
}

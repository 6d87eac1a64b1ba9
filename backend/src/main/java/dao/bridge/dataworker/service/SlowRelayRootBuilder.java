package dao.bridge.dataworker.service;

import dao.bridge.dataworker.model.RelayData;
import dao.bridge.dataworker.model.UnfilledDeposit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * One slow-relay leaf per unfilled deposit, ordered by (originChainId, depositId).
 */
@Slf4j
@Service
public class SlowRelayRootBuilder {

    private final MerkleTreeService merkleTreeService;
    private final LeafCodec leafCodec;

    public SlowRelayRootBuilder(MerkleTreeService merkleTreeService, LeafCodec leafCodec) {
        this.merkleTreeService = merkleTreeService;
        this.leafCodec = leafCodec;
    }

    public RootBuildResult<RelayData> build(Map<Integer, List<UnfilledDeposit>> unfilledDeposits) {
        List<RelayData> leaves = new ArrayList<>();
        for (Collection<UnfilledDeposit> perDestination : unfilledDeposits.values()) {
            for (UnfilledDeposit u : perDestination) {
                leaves.add(RelayData.from(u));
            }
        }

        if (leaves.isEmpty()) {
            log.debug("No unfilled deposits, slow relay root is empty");
            return RootBuildResult.empty();
        }

        leaves.sort(RelayData.LEAF_ORDER);
        MerkleTree<RelayData> tree = merkleTreeService.build(leaves, leafCodec::hashRelayData);
        log.debug("Slow relay root built: leaves={}, root={}", leaves.size(), tree.getRootHex());
        return RootBuildResult.of(tree);
    }
}

package dao.bridge.dataworker.service;

import java.util.List;
import java.util.Optional;

/**
 * Output of one root builder. No leaves means no tree; the root is then submitted as
 * {@link MerkleTreeService#EMPTY_ROOT}.
 */
public record RootBuildResult<L>(Optional<MerkleTree<L>> tree, List<L> leaves) {

    public RootBuildResult {
        leaves = List.copyOf(leaves);
    }

    public static <L> RootBuildResult<L> empty() {
        return new RootBuildResult<>(Optional.empty(), List.of());
    }

    public static <L> RootBuildResult<L> of(MerkleTree<L> tree) {
        return new RootBuildResult<>(Optional.of(tree), tree.getLeaves());
    }

    public boolean isEmpty() {
        return tree.isEmpty();
    }

    public String rootHex() {
        return tree.map(MerkleTree::getRootHex).orElse(MerkleTreeService.EMPTY_ROOT);
    }
}

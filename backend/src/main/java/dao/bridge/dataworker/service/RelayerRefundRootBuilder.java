package dao.bridge.dataworker.service;

import dao.bridge.dataworker.model.Fill;
import dao.bridge.dataworker.model.FillsToRefund;
import dao.bridge.dataworker.model.RelayerRefund;
import dao.bridge.dataworker.model.RelayerRefundLeaf;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One relayer-refund leaf per repayment chain. Inside a leaf, refunds are grouped by
 * (relayer, refund token) and ordered by both ascending.
 */
@Slf4j
@Service
public class RelayerRefundRootBuilder {

    private final MerkleTreeService merkleTreeService;
    private final LeafCodec leafCodec;
    private final TokenRouteResolver tokenRoutes;

    public RelayerRefundRootBuilder(MerkleTreeService merkleTreeService,
                                    LeafCodec leafCodec,
                                    TokenRouteResolver tokenRoutes) {
        this.merkleTreeService = merkleTreeService;
        this.leafCodec = leafCodec;
        this.tokenRoutes = tokenRoutes;
    }

    /**
     * @throws IllegalStateException if a fill's token has no route to its repayment chain
     */
    public RootBuildResult<RelayerRefundLeaf> build(FillsToRefund fillsToRefund) {
        if (fillsToRefund.isEmpty()) {
            log.debug("No fills to refund, relayer refund root is empty");
            return RootBuildResult.empty();
        }

        List<RelayerRefundLeaf> leaves = new ArrayList<>();
        for (Integer repaymentChainId : fillsToRefund.repaymentChainIds()) {
            // relayer -> refund token -> fill amounts
            SortedMap<String, SortedMap<String, List<BigInteger>>> grouped = new TreeMap<>();
            for (Map.Entry<String, List<Fill>> e : fillsToRefund.forRepaymentChain(repaymentChainId).entrySet()) {
                for (Fill fill : e.getValue()) {
                    String refundToken = refundTokenFor(fill, repaymentChainId);
                    grouped.computeIfAbsent(e.getKey(), k -> new TreeMap<>())
                            .computeIfAbsent(refundToken, k -> new ArrayList<>())
                            .add(fill.fillAmount());
                }
            }

            List<RelayerRefund> refunds = new ArrayList<>();
            grouped.forEach((relayer, byToken) -> byToken.forEach((token, amounts) -> {
                List<BigInteger> sorted = amounts.stream().sorted().toList();
                BigInteger total = sorted.stream().reduce(BigInteger.ZERO, BigInteger::add);
                refunds.add(new RelayerRefund(relayer, token, total, sorted));
            }));

            leaves.add(new RelayerRefundLeaf(leaves.size(), repaymentChainId, BigInteger.ZERO, refunds));
        }

        MerkleTree<RelayerRefundLeaf> tree = merkleTreeService.build(leaves, leafCodec::hashRelayerRefundLeaf);
        log.debug("Relayer refund root built: leaves={}, root={}", leaves.size(), tree.getRootHex());
        return RootBuildResult.of(tree);
    }

    private String refundTokenFor(Fill fill, int repaymentChainId) {
        String l1Token = tokenRoutes.l1TokenFor(fill.destinationChainId(), fill.destinationToken());
        return tokenRoutes.l2TokenFor(l1Token, repaymentChainId).toLowerCase(Locale.ROOT);
    }
}

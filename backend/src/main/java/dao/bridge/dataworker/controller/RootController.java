package dao.bridge.dataworker.controller;

import dao.bridge.dataworker.ledger.RunningBalanceLedger;
import dao.bridge.dataworker.model.BundleBlockRange;
import dao.bridge.dataworker.model.ProposeBundleRequest;
import dao.bridge.dataworker.model.RootType;
import dao.bridge.dataworker.service.MerkleTree;
import dao.bridge.dataworker.service.PoolRebalanceRoot;
import dao.bridge.dataworker.service.RootBuildResult;
import dao.bridge.dataworker.service.RootBundleService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only previews: a single root for a block range, and running-balance history.
 */
@RestController
@RequestMapping("/api")
public class RootController {

    private final RootBundleService rootBundleService;
    private final RunningBalanceLedger ledger;

    public RootController(RootBundleService rootBundleService, RunningBalanceLedger ledger) {
        this.rootBundleService = rootBundleService;
        this.ledger = ledger;
    }

    /**
     * POST /api/roots/{rootType}
     * Nothing is proposed or committed.
     */
    @PostMapping("/roots/{rootType}")
    public ResponseEntity<Map<String, Object>> previewRoot(@PathVariable RootType rootType,
                                                           @Valid @RequestBody ProposeBundleRequest request) {
        BundleBlockRange range = request.toBlockRange();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("rootType", rootType);

        switch (rootType) {
            case SLOW_RELAY -> putResult(response, rootBundleService.buildSlowRelayRoot(range));
            case RELAYER_REFUND -> putResult(response, rootBundleService.buildRelayerRefundRoot(range));
            case POOL_REBALANCE -> {
                PoolRebalanceRoot root = rootBundleService.buildPoolRebalanceRoot(range);
                putResult(response, root.result());
                response.put("runningBalances", root.entries());
            }
        }
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/ledger/{chainId}/{l1Token}
     */
    @GetMapping("/ledger/{chainId}/{l1Token}")
    public ResponseEntity<Map<String, Object>> ledgerHistory(@PathVariable int chainId, @PathVariable String l1Token) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("chainId", chainId);
        response.put("l1Token", l1Token.toLowerCase());
        response.put("entries", ledger.history(chainId, l1Token));
        return ResponseEntity.ok(response);
    }

    private static <L> void putResult(Map<String, Object> response, RootBuildResult<L> result) {
        response.put("root", result.rootHex());
        response.put("empty", result.isEmpty());
        List<Map<String, Object>> leaves = new ArrayList<>();
        if (result.tree().isPresent()) {
            MerkleTree<L> tree = result.tree().get();
            for (int i = 0; i < tree.size(); i++) {
                Map<String, Object> l = new LinkedHashMap<>();
                l.put("index", i);
                l.put("leaf", tree.getLeaves().get(i));
                l.put("proof", tree.proofFor(i));
                leaves.add(l);
            }
        }
        response.put("leaves", leaves);
    }
}

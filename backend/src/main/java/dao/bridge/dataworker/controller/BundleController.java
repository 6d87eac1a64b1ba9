package dao.bridge.dataworker.controller;

import dao.bridge.dataworker.model.BundleValidationResult;
import dao.bridge.dataworker.model.ExecutionReport;
import dao.bridge.dataworker.model.LocalBundle;
import dao.bridge.dataworker.model.ProposeBundleRequest;
import dao.bridge.dataworker.model.RootType;
import dao.bridge.dataworker.model.StoredLeaf;
import dao.bridge.dataworker.model.StoredRoot;
import dao.bridge.dataworker.model.ValidateRootsRequest;
import dao.bridge.dataworker.service.BundleService;
import dao.bridge.dataworker.service.ExecutionService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator endpoints for the bundle lifecycle.
 */
@Slf4j
@RestController
@RequestMapping("/api/bundles")
public class BundleController {

    private final BundleService bundleService;
    private final ExecutionService executionService;

    public BundleController(BundleService bundleService, ExecutionService executionService) {
        this.bundleService = bundleService;
        this.executionService = executionService;
    }

    /**
     * GET /api/bundles
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> getBundles() {
        List<LocalBundle> bundles = bundleService.getBundles();
        List<Map<String, Object>> infos = new ArrayList<>();
        for (LocalBundle b : bundles) {
            infos.add(buildBundleInfo(b, false));
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("totalBundles", bundles.size());
        response.put("bundles", infos);
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/bundles/{id}?includeLeaves=true
     */
    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getBundle(@PathVariable long id,
                                                         @RequestParam(defaultValue = "true") boolean includeLeaves) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("bundle", buildBundleInfo(bundleService.getBundle(id), includeLeaves));
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/bundles/propose
     */
    @PostMapping("/propose")
    public ResponseEntity<Map<String, Object>> propose(@Valid @RequestBody ProposeBundleRequest request) {
        LocalBundle bundle = bundleService.propose(request.toBlockRange());
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("bundle", buildBundleInfo(bundle, false));
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/bundles/{id}/validate
     */
    @PostMapping("/{id}/validate")
    public ResponseEntity<Map<String, Object>> validate(@PathVariable long id) {
        BundleValidationResult result = bundleService.validate(id);
        Map<String, Object> response = validationResponse(result);
        response.put("bundleStatus", bundleService.getBundle(id).getStatus());
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/bundles/validate
     * Validate roots claimed by another proposer.
     */
    @PostMapping("/validate")
    public ResponseEntity<Map<String, Object>> validateClaimed(@Valid @RequestBody ValidateRootsRequest request) {
        BundleValidationResult result = bundleService.validate(
                request.getRange().toBlockRange(),
                request.getPoolRebalanceRoot(),
                request.getRelayerRefundRoot(),
                request.getSlowRelayRoot());
        return ResponseEntity.ok(validationResponse(result));
    }

    /**
     * POST /api/bundles/{id}/dispute
     */
    @PostMapping("/{id}/dispute")
    public ResponseEntity<Map<String, Object>> dispute(@PathVariable long id) {
        LocalBundle bundle = bundleService.dispute(id);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("bundle", buildBundleInfo(bundle, false));
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/bundles/{id}/execute/{rootType}
     */
    @PostMapping("/{id}/execute/{rootType}")
    public ResponseEntity<Map<String, Object>> execute(@PathVariable long id, @PathVariable RootType rootType) {
        ExecutionReport report = executionService.execute(id, rootType);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", report.isComplete() ? "SUCCESS" : "PARTIAL");
        response.put("report", report);
        response.put("bundleStatus", bundleService.getBundle(id).getStatus());
        return ResponseEntity.ok(response);
    }

    private static Map<String, Object> validationResponse(BundleValidationResult result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("valid", result.isValid());
        response.put("mismatchedRoots", result.mismatchedRoots());
        response.put("comparisons", result.comparisons());
        return response;
    }

    private Map<String, Object> buildBundleInfo(LocalBundle bundle, boolean includeLeaves) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("localId", bundle.getLocalId());
        info.put("relayedRootBundleIds", bundle.getRelayedRootBundleIds());
        info.put("status", bundle.getStatus());
        info.put("blockRange", bundle.getBlockRange().ranges());
        info.put("proposeTxId", bundle.getProposeTxId());
        info.put("proposedAt", bundle.getProposedAt());
        info.put("challengePeriodEnd", bundle.getChallengePeriodEnd());

        Map<String, Object> roots = new LinkedHashMap<>();
        for (RootType type : RootType.values()) {
            StoredRoot<?> root = bundle.root(type);
            if (root == null) continue;
            Map<String, Object> r = new LinkedHashMap<>();
            r.put("root", root.getRootHex());
            r.put("empty", root.isEmpty());
            r.put("leafCount", root.getLeaves().size());
            r.put("executedLeaves", root.executedCount());
            if (includeLeaves) {
                List<Map<String, Object>> leaves = new ArrayList<>();
                for (StoredLeaf<?> leaf : root.getLeaves()) {
                    Map<String, Object> l = new LinkedHashMap<>();
                    l.put("leafId", leaf.getLeafId());
                    l.put("status", leaf.getStatus());
                    l.put("executionTxId", leaf.getExecutionTxId());
                    l.put("leaf", leaf.getLeaf());
                    l.put("proof", leaf.getProof());
                    leaves.add(l);
                }
                r.put("leaves", leaves);
            }
            roots.put(type.name(), r);
        }
        info.put("roots", roots);
        return info;
    }
}

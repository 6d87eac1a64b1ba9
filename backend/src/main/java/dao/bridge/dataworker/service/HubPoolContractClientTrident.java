package dao.bridge.dataworker.service;

import dao.bridge.dataworker.config.HubProperties;
import dao.bridge.dataworker.event.ProposeRootBundleEventReader;
import dao.bridge.dataworker.event.RootBundleProposedEvent;
import dao.bridge.dataworker.model.PoolRebalanceLeaf;
import dao.bridge.dataworker.util.HexUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.tron.trident.abi.FunctionEncoder;
import org.tron.trident.abi.FunctionReturnDecoder;
import org.tron.trident.abi.TypeReference;
import org.tron.trident.abi.datatypes.Address;
import org.tron.trident.abi.datatypes.DynamicArray;
import org.tron.trident.abi.datatypes.Function;
import org.tron.trident.abi.datatypes.Type;
import org.tron.trident.abi.datatypes.generated.Bytes32;
import org.tron.trident.abi.datatypes.generated.Int256;
import org.tron.trident.abi.datatypes.generated.Uint256;
import org.tron.trident.abi.datatypes.generated.Uint32;
import org.tron.trident.abi.datatypes.generated.Uint8;
import org.tron.trident.core.ApiWrapper;
import org.tron.trident.core.NodeType;
import org.tron.trident.proto.Chain;
import org.tron.trident.proto.Response;
import org.tron.trident.utils.Numeric;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * HubPool client for a hub hosted on TRON.
 */
@Slf4j
@Service
public class HubPoolContractClientTrident implements HubPoolContractClient {

    private final ApiWrapper wrapper;
    @Getter
    private final String proposerAddress;
    private final String contractAddress;
    private final ProposeRootBundleEventReader eventReader;
    private final HubProperties.Polling polling;
    private final long feeLimit;
    /**
     * Guard signing/broadcasting so concurrent execution doesn't trip over non-thread-safe internals.
     * Receipt polling is done outside this lock.
     */
    private final Object broadcastLock = new Object();

    public HubPoolContractClientTrident(HubProperties props, ProposeRootBundleEventReader eventReader) {
        this.contractAddress = props.getContractAddress();
        this.eventReader = eventReader;
        this.polling = props.getPolling();
        this.feeLimit = props.getFeeLimit();

        String privateKey = props.getPrivateKey();
        if (privateKey == null || privateKey.isEmpty() || privateKey.equals("YOUR_PRIVATE_KEY_HERE")) {
            log.warn("No valid hub private key configured. Set HUB_PRIVATE_KEY to enable hub operations.");
            this.wrapper = null;
            this.proposerAddress = "NOT_CONFIGURED";
            return;
        }

        if (privateKey.length() % 2 != 0) {
            log.error("Invalid hub private key format: odd-length hex string");
            this.wrapper = null;
            this.proposerAddress = "INVALID_KEY_FORMAT";
            return;
        }

        ApiWrapper tempWrapper;
        String tempProposerAddress;

        try {
            if (props.getNodeEndpoint() == null || props.getNodeEndpoint().isBlank()) {
                tempWrapper = ApiWrapper.ofNile(privateKey);
            } else {
                tempWrapper = new ApiWrapper(props.getNodeEndpoint(), props.getSolidityNodeEndpoint(), privateKey);
            }
            tempProposerAddress = tempWrapper.keyPair.toBase58CheckAddress();
            log.info("HubPoolContractClientTrident initialized: proposer={}, contract={}",
                    tempProposerAddress, contractAddress);
        } catch (Exception e) {
            log.error("Failed to initialize hub client: {}", e.getMessage());
            tempWrapper = null;
            tempProposerAddress = "INIT_FAILED";
        }

        this.wrapper = tempWrapper;
        this.proposerAddress = tempProposerAddress;
    }

    @Override
    public ProposalSubmission proposeRootBundle(List<BigInteger> bundleEvaluationBlockNumbers,
                                                int poolRebalanceLeafCount,
                                                String poolRebalanceRoot,
                                                String relayerRefundRoot,
                                                String slowRelayRoot) {
        try {
            List<Uint256> blocks = new ArrayList<>();
            for (BigInteger b : bundleEvaluationBlockNumbers) {
                blocks.add(new Uint256(b));
            }

            Function proposeFn = new Function(
                    "proposeRootBundle",
                    Arrays.asList(
                            new DynamicArray<>(Uint256.class, blocks),
                            new Uint8(BigInteger.valueOf(poolRebalanceLeafCount)),
                            bytes32(poolRebalanceRoot),
                            bytes32(relayerRefundRoot),
                            bytes32(slowRelayRoot)
                    ),
                    Collections.emptyList()
            );

            String txId = triggerAndConfirm("proposeRootBundle", FunctionEncoder.encode(proposeFn));

            // Prefer event parsing (source of truth for the challenge window)
            var evOpt = eventReader.readWithTimeout(
                    wrapper,
                    txId,
                    Duration.ofSeconds(polling.getProposalEventTimeoutSeconds()),
                    Duration.ofMillis(polling.getProposalEventPollInitialMs())
            );
            long now = System.currentTimeMillis() / 1000L;
            if (evOpt.isPresent()) {
                RootBundleProposedEvent ev = evOpt.get();
                if (!ev.poolRebalanceRoot().equalsIgnoreCase(HexUtil.normalizeHex32(poolRebalanceRoot))) {
                    log.warn("ProposeRootBundle poolRebalanceRoot mismatch: expected={}, got={}", poolRebalanceRoot, ev.poolRebalanceRoot());
                }
                if (ev.poolRebalanceLeafCount() != poolRebalanceLeafCount) {
                    log.warn("ProposeRootBundle leafCount mismatch: expected={}, got={}", poolRebalanceLeafCount, ev.poolRebalanceLeafCount());
                }
                return new ProposalSubmission(txId, ev.poolRebalanceRoot(), ev.relayerRefundRoot(), ev.slowRelayRoot(),
                        ev.poolRebalanceLeafCount(), now, ev.challengePeriodEndTimestamp());
            }

            // Fallback: read the pending proposal directly
            PendingProposal p = getRootBundleProposal();
            if (!p.poolRebalanceRoot().equalsIgnoreCase(HexUtil.normalizeHex32(poolRebalanceRoot))) {
                throw new RuntimeException("proposeRootBundle: pending proposal does not carry our root. txId=" + txId);
            }
            return new ProposalSubmission(txId, poolRebalanceRoot, relayerRefundRoot, slowRelayRoot,
                    poolRebalanceLeafCount, now, p.challengePeriodEnd());
        } catch (Exception e) {
            log.error("proposeRootBundle failed", e);
            throw new RuntimeException("proposeRootBundle failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String disputeRootBundle() {
        try {
            Function disputeFn = new Function("disputeRootBundle", Collections.emptyList(), Collections.emptyList());
            String txId = triggerAndConfirm("disputeRootBundle", FunctionEncoder.encode(disputeFn));
            log.info("disputeRootBundle SUCCESS: txId={}", txId);
            return txId;
        } catch (Exception e) {
            log.error("disputeRootBundle failed", e);
            throw new RuntimeException("disputeRootBundle failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String executeRootBundle(PoolRebalanceLeaf leaf, List<String> proof) {
        try {
            List<Uint256> fees = new ArrayList<>();
            leaf.bundleLpFees().forEach(v -> fees.add(new Uint256(v)));
            List<Int256> netSends = new ArrayList<>();
            leaf.netSendAmounts().forEach(v -> netSends.add(new Int256(v)));
            List<Int256> balances = new ArrayList<>();
            leaf.runningBalances().forEach(v -> balances.add(new Int256(v)));
            List<Address> tokens = new ArrayList<>();
            leaf.l1Tokens().forEach(t -> tokens.add(new Address(t)));
            List<Bytes32> proofElems = new ArrayList<>();
            for (String hex : proof) {
                proofElems.add(bytes32(hex));
            }

            Function execFn = new Function(
                    "executeRootBundle",
                    Arrays.asList(
                            new Uint256(BigInteger.valueOf(leaf.chainId())),
                            new Uint256(BigInteger.valueOf(leaf.groupIndex())),
                            new DynamicArray<>(Uint256.class, fees),
                            new DynamicArray<>(Int256.class, netSends),
                            new DynamicArray<>(Int256.class, balances),
                            new Uint8(BigInteger.valueOf(leaf.leafId())),
                            new DynamicArray<>(Address.class, tokens),
                            new DynamicArray<>(Bytes32.class, proofElems)
                    ),
                    Collections.emptyList()
            );

            String txId = triggerAndConfirm("executeRootBundle", FunctionEncoder.encode(execFn));
            log.info("executeRootBundle SUCCESS: chainId={}, leafId={}, txId={}", leaf.chainId(), leaf.leafId(), txId);
            return txId;
        } catch (Exception e) {
            log.error("executeRootBundle failed for leaf {}", leaf.leafId(), e);
            throw new RuntimeException("executeRootBundle failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isPoolRebalanceLeafExecuted(String poolRebalanceRoot, int leafId) {
        try {
            return leafExecuted(getRootBundleProposal(), poolRebalanceRoot, leafId);
        } catch (Exception e) {
            log.error("isPoolRebalanceLeafExecuted failed", e);
            throw new RuntimeException("isPoolRebalanceLeafExecuted failed: " + e.getMessage(), e);
        }
    }

    private String triggerAndConfirm(String method, String encodedHex) throws Exception {
        if (wrapper == null) {
            throw new IllegalStateException("Hub client not configured (" + proposerAddress + ")");
        }

        Response.TransactionExtention txnExt = wrapper.triggerContract(
                proposerAddress,
                contractAddress,
                encodedHex,
                0L,
                0L,
                null,
                feeLimit
        );

        if (!txnExt.getResult().getResult()) {
            String msg = txnExt.getResult().getMessage().toStringUtf8();
            throw new RuntimeException(method + " trigger failed: " + msg);
        }

        String txId;
        synchronized (broadcastLock) {
            Chain.Transaction signed = wrapper.signTransaction(txnExt);
            txId = wrapper.broadcastTransaction(signed);
        }

        // Make failures explicit (revert/OUT_OF_ENERGY/etc.) rather than timing out later.
        Response.TransactionInfo txInfo = waitForTxInfo(
                txId,
                Duration.ofSeconds(polling.getTxInfoTimeoutSeconds()),
                Duration.ofMillis(polling.getTxInfoPollInitialMs()),
                Duration.ofMillis(polling.getTxInfoPollMaxMs())
        );
        if (txInfo == null) {
            throw new RuntimeException(method + " failed: no TransactionInfo after timeout. txId=" + txId);
        }
        if (txInfo.getResult() != Response.TransactionInfo.code.SUCESS) {
            String errorMsg = txInfo.getResMessage() != null ? txInfo.getResMessage().toStringUtf8() : "Unknown error";
            throw new RuntimeException(method + " failed on-chain: " + errorMsg + ". txId=" + txId);
        }
        return txId;
    }

    private Response.TransactionInfo waitForTxInfo(String txId, Duration timeout, Duration pollInitial, Duration pollMax) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        long sleepMs = Math.max(100, pollInitial.toMillis());
        long maxSleepMs = Math.max(sleepMs, pollMax.toMillis());
        while (System.currentTimeMillis() < deadline) {
            try {
                Response.TransactionInfo info = wrapper.getTransactionInfoById(txId);
                if (info != null) return info;
            } catch (Exception e) {
                log.debug("txInfo not available yet for {}: {}", txId, e.getMessage());
            }
            try {
                long jitter = ThreadLocalRandom.current().nextLong(0, 150);
                Thread.sleep(sleepMs + jitter);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return null;
            }
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }
        return null;
    }

    record PendingProposal(String poolRebalanceRoot, BigInteger claimedBitMap, long challengePeriodEnd) {}

    static boolean leafExecuted(PendingProposal p, String poolRebalanceRoot, int leafId) {
        if (!p.poolRebalanceRoot().equalsIgnoreCase(HexUtil.normalizeHex32(poolRebalanceRoot))) {
            // also the case after a dispute, which the hub does not tell apart from full execution
            log.warn("Hub pending root {} differs from {}; treating leaf {} as executed. Check the bundle was not disputed",
                    p.poolRebalanceRoot(), poolRebalanceRoot, leafId);
            return true;
        }
        return p.claimedBitMap().testBit(leafId);
    }

    /**
     * rootBundleProposal() returns (bytes32 poolRebalanceRoot, bytes32 relayerRefundRoot, bytes32 slowRelayRoot,
     * uint256 claimedBitMap, address proposer, uint8 unclaimedPoolRebalanceLeafCount, uint32 challengePeriodEndTimestamp)
     */
    private PendingProposal getRootBundleProposal() {
        if (wrapper == null) {
            throw new IllegalStateException("Hub client not configured (" + proposerAddress + ")");
        }

        Function fn = new Function(
                "rootBundleProposal",
                Collections.emptyList(),
                Arrays.asList(
                        new TypeReference<Bytes32>() {},
                        new TypeReference<Bytes32>() {},
                        new TypeReference<Bytes32>() {},
                        new TypeReference<Uint256>() {},
                        new TypeReference<Address>() {},
                        new TypeReference<Uint8>() {},
                        new TypeReference<Uint32>() {}
                )
        );

        Response.TransactionExtention txn = wrapper.triggerConstantContract(
                proposerAddress,
                contractAddress,
                FunctionEncoder.encode(fn),
                NodeType.SOLIDITY_NODE
        );
        if (!txn.getResult().getResult() || txn.getConstantResultCount() == 0) {
            throw new RuntimeException("rootBundleProposal query failed");
        }
        String resultHex = Numeric.toHexString(txn.getConstantResult(0).toByteArray());
        @SuppressWarnings("rawtypes")
        List<Type> decoded = FunctionReturnDecoder.decode(resultHex, fn.getOutputParameters());
        if (decoded.size() != 7) {
            throw new IllegalStateException("Unexpected rootBundleProposal outputs=" + decoded.size());
        }
        Bytes32 root = (Bytes32) decoded.get(0);
        Uint256 bitmap = (Uint256) decoded.get(3);
        Uint32 challengeEnd = (Uint32) decoded.get(6);
        return new PendingProposal(
                HexUtil.toHex0x(root.getValue()),
                bitmap.getValue(),
                challengeEnd.getValue().longValue()
        );
    }

    private static Bytes32 bytes32(String hex) {
        byte[] b = Numeric.hexStringToByteArray(HexUtil.cleanHex(hex));
        if (b.length != 32) {
            throw new IllegalArgumentException("Expected bytes32, got " + b.length + " bytes: " + hex);
        }
        return new Bytes32(b);
    }
}

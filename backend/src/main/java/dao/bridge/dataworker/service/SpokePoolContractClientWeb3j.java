package dao.bridge.dataworker.service;

import dao.bridge.dataworker.config.ChainProperties;
import dao.bridge.dataworker.model.RelayData;
import dao.bridge.dataworker.model.RelayerRefund;
import dao.bridge.dataworker.model.RelayerRefundLeaf;
import dao.bridge.dataworker.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicStruct;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.StaticStruct;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Executes relayer-refund and slow-relay leaves on EVM spoke pools.
 */
@Slf4j
@Service
public class SpokePoolContractClientWeb3j implements SpokePoolContractClient {

    private static final long RECEIPT_POLL_MS = 1000L;
    private static final int RECEIPT_POLL_ATTEMPTS = 120;

    // RelayedRootBundle(uint32 indexed rootBundleId, bytes32 indexed relayerRefundRoot, bytes32 indexed slowRelayRoot)
    static final String RELAYED_ROOT_BUNDLE_TOPIC = EventEncoder.encode(new Event("RelayedRootBundle", Arrays.asList(
            new TypeReference<Uint32>(true) {},
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Bytes32>(true) {})));

    private record SpokeConnection(int chainId, Web3j web3j, RawTransactionManager txManager,
                                   String spokePoolAddress, BigInteger gasLimit, long deploymentBlock) {}

    private final Map<Integer, SpokeConnection> spokes = new TreeMap<>();
    private final LeafCodec leafCodec;

    public SpokePoolContractClientWeb3j(ChainProperties chainProps, LeafCodec leafCodec) {
        this.leafCodec = leafCodec;

        String privateKey = chainProps.getExecutorPrivateKey();
        if (privateKey == null || privateKey.isBlank() || privateKey.equals("YOUR_PRIVATE_KEY_HERE")) {
            log.warn("No executor private key configured. Set EXECUTOR_PRIVATE_KEY to enable spoke leaf execution.");
            return;
        }

        Credentials credentials = Credentials.create(privateKey);
        chainProps.getSpokes().forEach((chainId, spoke) -> {
            if (spoke.getRpcUrl() == null || spoke.getRpcUrl().isBlank()) {
                log.warn("Spoke {} has no rpc-url; leaf execution disabled for it", chainId);
                return;
            }
            Web3j web3j = Web3j.build(new HttpService(spoke.getRpcUrl()));
            spokes.put(chainId, new SpokeConnection(
                    chainId,
                    web3j,
                    new RawTransactionManager(web3j, credentials, chainId),
                    spoke.getSpokePoolAddress(),
                    BigInteger.valueOf(spoke.getExecutionGasLimit()),
                    spoke.getDeploymentBlock()
            ));
        });
        log.info("SpokePoolContractClientWeb3j initialized: executor={}, chains={}",
                credentials.getAddress(), spokes.keySet());
    }

    @Override
    public String executeRelayerRefundLeaf(long rootBundleId, RelayerRefundLeaf leaf, List<String> proof) {
        SpokeConnection spoke = connection(leaf.chainId());
        try {
            List<Uint256> amounts = new ArrayList<>();
            List<Address> tokens = new ArrayList<>();
            List<Address> relayers = new ArrayList<>();
            for (RelayerRefund r : leaf.refunds()) {
                amounts.add(new Uint256(r.amount()));
                tokens.add(new Address(r.refundToken()));
                relayers.add(new Address(r.relayer()));
            }

            DynamicStruct leafTuple = new DynamicStruct(
                    new Uint256(leaf.amountToReturn()),
                    new Uint256(BigInteger.valueOf(leaf.chainId())),
                    new Uint32(BigInteger.valueOf(leaf.leafId())),
                    new DynamicArray<>(Uint256.class, amounts),
                    new DynamicArray<>(Address.class, tokens),
                    new DynamicArray<>(Address.class, relayers)
            );

            Function execFn = new Function(
                    "executeRelayerRefundLeaf",
                    Arrays.asList(new Uint32(BigInteger.valueOf(rootBundleId)), leafTuple, proofArray(proof)),
                    Collections.emptyList()
            );

            String txHash = sendAndConfirm(spoke, "executeRelayerRefundLeaf", FunctionEncoder.encode(execFn));
            log.info("executeRelayerRefundLeaf SUCCESS: chainId={}, rootBundleId={}, leafId={}, tx={}",
                    leaf.chainId(), rootBundleId, leaf.leafId(), txHash);
            return txHash;
        } catch (Exception e) {
            log.error("executeRelayerRefundLeaf failed: chainId={}, leafId={}", leaf.chainId(), leaf.leafId(), e);
            throw new RuntimeException("executeRelayerRefundLeaf failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String executeSlowRelayLeaf(long rootBundleId, RelayData leaf, List<String> proof) {
        SpokeConnection spoke = connection(leaf.destinationChainId());
        try {
            Function execFn = new Function(
                    "executeSlowRelayLeaf",
                    Arrays.asList(relayDataTuple(leaf), new Uint32(BigInteger.valueOf(rootBundleId)), proofArray(proof)),
                    Collections.emptyList()
            );

            String txHash = sendAndConfirm(spoke, "executeSlowRelayLeaf", FunctionEncoder.encode(execFn));
            log.info("executeSlowRelayLeaf SUCCESS: origin={}, depositId={}, tx={}",
                    leaf.originChainId(), leaf.depositId(), txHash);
            return txHash;
        } catch (Exception e) {
            log.error("executeSlowRelayLeaf failed: origin={}, depositId={}", leaf.originChainId(), leaf.depositId(), e);
            throw new RuntimeException("executeSlowRelayLeaf failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isRelayerRefundLeafExecuted(int chainId, long rootBundleId, int leafId) {
        SpokeConnection spoke = connection(chainId);
        Function fn = new Function(
                "isRelayerRefundLeafExecuted",
                Arrays.asList(new Uint32(BigInteger.valueOf(rootBundleId)), new Uint32(BigInteger.valueOf(leafId))),
                Collections.singletonList(new TypeReference<Bool>() {})
        );
        @SuppressWarnings("rawtypes")
        List<Type> decoded = call(spoke, fn);
        return !decoded.isEmpty() && ((Bool) decoded.get(0)).getValue();
    }

    @Override
    public boolean isSlowRelayLeafExecuted(RelayData leaf) {
        SpokeConnection spoke = connection(leaf.destinationChainId());
        Function fn = new Function(
                "relayFills",
                Collections.singletonList(new Bytes32(leafCodec.hashRelayData(leaf))),
                Collections.singletonList(new TypeReference<Uint256>() {})
        );
        @SuppressWarnings("rawtypes")
        List<Type> decoded = call(spoke, fn);
        if (decoded.isEmpty()) return false;
        BigInteger filled = ((Uint256) decoded.get(0)).getValue();
        return filled.compareTo(leaf.amount()) >= 0;
    }

    @Override
    public OptionalLong findRelayedRootBundleId(int chainId, String relayerRefundRoot, String slowRelayRoot) {
        SpokeConnection spoke = connection(chainId);
        EthFilter filter = new EthFilter(
                DefaultBlockParameter.valueOf(BigInteger.valueOf(spoke.deploymentBlock())),
                DefaultBlockParameterName.LATEST,
                spoke.spokePoolAddress());
        filter.addSingleTopic(RELAYED_ROOT_BUNDLE_TOPIC);
        filter.addNullTopic();
        filter.addSingleTopic(HexUtil.normalizeHex32(relayerRefundRoot));
        filter.addSingleTopic(HexUtil.normalizeHex32(slowRelayRoot));
        try {
            EthLog resp = spoke.web3j().ethGetLogs(filter).send();
            if (resp.hasError()) {
                throw new RuntimeException("RelayedRootBundle lookup failed on chain " + chainId + ": " + resp.getError().getMessage());
            }
            List<Log> logs = new ArrayList<>();
            for (EthLog.LogResult<?> r : resp.getLogs()) {
                if (r instanceof EthLog.LogObject obj) {
                    logs.add(obj);
                }
            }
            return latestRootBundleId(logs);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("RelayedRootBundle lookup failed on chain " + chainId + ": " + e.getMessage(), e);
        }
    }

    /**
     * The same roots can be relayed again after a re-proposal; the newest relay wins.
     */
    static OptionalLong latestRootBundleId(List<Log> logs) {
        OptionalLong latest = OptionalLong.empty();
        for (Log l : logs) {
            List<String> topics = l.getTopics();
            if (topics == null || topics.size() < 2 || !RELAYED_ROOT_BUNDLE_TOPIC.equalsIgnoreCase(topics.get(0))) {
                continue;
            }
            long id = Numeric.toBigInt(topics.get(1)).longValueExact();
            if (latest.isEmpty() || id > latest.getAsLong()) {
                latest = OptionalLong.of(id);
            }
        }
        return latest;
    }

    private static StaticStruct relayDataTuple(RelayData d) {
        return new StaticStruct(
                new Address(d.depositor()),
                new Address(d.recipient()),
                new Address(d.destinationToken()),
                new Uint256(d.amount()),
                new Uint256(BigInteger.valueOf(d.originChainId())),
                new Uint256(BigInteger.valueOf(d.destinationChainId())),
                new Uint64(d.realizedLpFeePct()),
                new Uint64(d.relayerFeePct()),
                new Uint32(BigInteger.valueOf(d.depositId()))
        );
    }

    private static DynamicArray<Bytes32> proofArray(List<String> proof) {
        List<Bytes32> elems = new ArrayList<>();
        for (String hex : proof) {
            elems.add(new Bytes32(HexUtil.toBytes32(hex)));
        }
        return new DynamicArray<>(Bytes32.class, elems);
    }

    private String sendAndConfirm(SpokeConnection spoke, String method, String data) throws Exception {
        BigInteger gasPrice = spoke.web3j().ethGasPrice().send().getGasPrice();
        EthSendTransaction sent = spoke.txManager().sendTransaction(
                gasPrice, spoke.gasLimit(), spoke.spokePoolAddress(), data, BigInteger.ZERO);
        if (sent.hasError()) {
            throw new RuntimeException(method + " rejected: " + sent.getError().getMessage());
        }

        String txHash = sent.getTransactionHash();
        TransactionReceipt receipt = new PollingTransactionReceiptProcessor(
                spoke.web3j(), RECEIPT_POLL_MS, RECEIPT_POLL_ATTEMPTS).waitForTransactionReceipt(txHash);
        if (!receipt.isStatusOK()) {
            throw new RuntimeException(method + " reverted on chain " + spoke.chainId() + ". tx=" + txHash);
        }
        return txHash;
    }

    @SuppressWarnings("rawtypes")
    private static List<Type> call(SpokeConnection spoke, Function fn) {
        try {
            String data = FunctionEncoder.encode(fn);
            Transaction tx = Transaction.createEthCallTransaction(null, spoke.spokePoolAddress(), data);
            EthCall resp = spoke.web3j().ethCall(tx, DefaultBlockParameterName.LATEST).send();
            if (resp.hasError() || resp.isReverted()) {
                throw new RuntimeException(fn.getName() + " call failed on chain " + spoke.chainId() + ": "
                        + (resp.hasError() ? resp.getError().getMessage() : resp.getRevertReason()));
            }
            return FunctionReturnDecoder.decode(resp.getValue(), fn.getOutputParameters());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException(fn.getName() + " call failed on chain " + spoke.chainId() + ": " + e.getMessage(), e);
        }
    }

    private SpokeConnection connection(int chainId) {
        SpokeConnection spoke = spokes.get(chainId);
        if (spoke == null) {
            throw new IllegalStateException("No spoke pool connection for chain " + chainId);
        }
        return spoke;
    }
}

package dao.bridge.dataworker.event;

import dao.bridge.dataworker.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.tron.trident.core.ApiWrapper;
import org.tron.trident.proto.Response;
import org.tron.trident.utils.Numeric;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Hash;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Reads the HubPool ProposeRootBundle event from TRON tx receipt logs.
 * <p>
 * - poll ApiWrapper.getTransactionInfoById(txid)
 * - scan TransactionInfo.log[] for topic0 == keccak256(EVENT_SIGNATURE)
 * - indexed params come from topics, the rest from log.data
 */
@Slf4j
@Service
public class ProposeRootBundleEventReader {

    public static final String EVENT_SIGNATURE =
            "ProposeRootBundle(uint32,uint8,uint256[],bytes32,bytes32,bytes32,address)";

    // topic0 = keccak256(eventSignature)
    private static final String TOPIC0_NORM32 =
            HexUtil.normalizeHex32(Hash.sha3String(EVENT_SIGNATURE)).toLowerCase(Locale.ROOT);

    public Optional<RootBundleProposedEvent> readWithTimeout(ApiWrapper wrapper, String txId,
                                                             Duration timeout, Duration pollInterval) {
        if (wrapper == null) return Optional.empty();
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        long sleepMs = Math.max(200, pollInterval.toMillis());
        long maxSleepMs = Math.max(sleepMs * 5, 3000L);

        while (System.currentTimeMillis() < deadline) {
            Response.TransactionInfo info;
            try {
                info = wrapper.getTransactionInfoById(txId);
            } catch (Exception e) {
                log.debug("txInfo not available yet for {}: {}", txId, e.getMessage());
                info = null;
            }

            if (info != null) {
                Optional<RootBundleProposedEvent> ev = findEventInTxInfo(info);
                if (ev.isPresent()) return ev;
            }

            // Backoff + jitter
            long jitter = ThreadLocalRandom.current().nextLong(0, 150);
            if (!sleepQuietly(sleepMs + jitter)) return Optional.empty();
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }

        return Optional.empty();
    }

    public Optional<RootBundleProposedEvent> findEventInTxInfo(Response.TransactionInfo info) {
        if (info == null || info.getLogCount() == 0) return Optional.empty();

        for (int i = 0; i < info.getLogCount(); i++) {
            Response.TransactionInfo.Log l = info.getLog(i);
            if (l.getTopicsCount() < 4) continue;

            String topic0 = Numeric.toHexString(l.getTopics(0).toByteArray());
            if (!HexUtil.normalizeHex32(topic0).equalsIgnoreCase(TOPIC0_NORM32)) {
                continue;
            }

            try {
                return Optional.of(decodeLog(
                        Numeric.toHexString(l.getTopics(1).toByteArray()),
                        Numeric.toHexString(l.getTopics(2).toByteArray()),
                        Numeric.toHexString(l.getTopics(3).toByteArray()),
                        Numeric.toHexString(l.getData().toByteArray())
                ));
            } catch (Exception e) {
                log.warn("Failed to decode ProposeRootBundle log for tx {}: {}", info.getId(), e.getMessage());
            }
        }

        return Optional.empty();
    }

    /**
     * topics[1] = bytes32 poolRebalanceRoot
     * topics[2] = bytes32 relayerRefundRoot
     * topics[3] = address proposer (left padded to 32 bytes)
     * data      = abi.encode(uint32 challengePeriodEndTimestamp, uint8 poolRebalanceLeafCount,
     *                        uint256[] bundleEvaluationBlockNumbers, bytes32 slowRelayRoot)
     */
    public static RootBundleProposedEvent decodeLog(String topicPoolRebalanceRoot,
                                                    String topicRelayerRefundRoot,
                                                    String topicProposer,
                                                    String dataHex) {
        List<Type<?>> decoded = decodeWeb3Abi(
                dataHex,
                new TypeReference<Uint32>() {},
                new TypeReference<Uint8>() {},
                new TypeReference<DynamicArray<Uint256>>() {},
                new TypeReference<Bytes32>() {}
        );
        if (decoded.size() != 4) {
            throw new IllegalStateException("Unexpected decoded outputs=" + decoded.size() + ", expected=4");
        }

        Uint32 challengePeriodEnd = (Uint32) decoded.get(0);
        Uint8 leafCount = (Uint8) decoded.get(1);
        @SuppressWarnings("unchecked")
        DynamicArray<Uint256> blocks = (DynamicArray<Uint256>) decoded.get(2);
        Bytes32 slowRelayRoot = (Bytes32) decoded.get(3);

        List<Long> blockNumbers = new ArrayList<>();
        for (Uint256 b : blocks.getValue()) {
            blockNumbers.add(b.getValue().longValueExact());
        }

        String proposerHex = HexUtil.cleanHex(HexUtil.normalizeHex32(topicProposer)).substring(24);

        return new RootBundleProposedEvent(
                challengePeriodEnd.getValue().longValue(),
                leafCount.getValue().intValue(),
                blockNumbers,
                HexUtil.normalizeHex32(topicPoolRebalanceRoot),
                HexUtil.normalizeHex32(topicRelayerRefundRoot),
                HexUtil.toHex0x(slowRelayRoot.getValue()),
                "0x" + proposerHex
        );
    }

    private static boolean sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static List<Type<?>> decodeWeb3Abi(String dataHex, TypeReference<?>... outputs) {
        String hex = HexUtil.ensure0x(dataHex);

        @SuppressWarnings({"rawtypes", "unchecked"})
        List<TypeReference<Type>> typed = (List) Arrays.asList(outputs);

        @SuppressWarnings({"rawtypes", "unchecked"})
        List<Type<?>> decoded = (List) FunctionReturnDecoder.decode(hex, typed);
        return decoded;
    }
}

package dao.bridge.dataworker.service;

import dao.bridge.dataworker.model.PoolRebalanceLeaf;
import dao.bridge.dataworker.model.RelayData;
import dao.bridge.dataworker.model.RelayerRefund;
import dao.bridge.dataworker.model.RelayerRefundLeaf;
import dao.bridge.dataworker.util.HexUtil;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Leaf hashing: keccak256(abi.encode(leaf)) with the struct layouts the hub and spoke
 * pools verify against.
 *
 * RelayData is a static tuple, so its encoding is the plain sequence of words.
 * The two leaf types with arrays are dynamic tuples: abi.encode prefixes them with a
 * 0x20 offset word, then a head of static words / array offsets, then the array tails.
 */
@Service
public class LeafCodec {

    private static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
    private static final BigInteger INT256_MIN = BigInteger.ONE.shiftLeft(255).negate();
    private static final BigInteger INT256_MAX = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);

    /**
     * struct RelayData { address depositor; address recipient; address destinationToken;
     * uint256 amount; uint256 originChainId; uint256 destinationChainId;
     * uint64 realizedLpFeePct; uint64 relayerFeePct; uint32 depositId; }
     */
    public byte[] hashRelayData(RelayData d) {
        return MerkleTreeService.keccak256(encodeRelayData(d));
    }

    /**
     * struct RelayerRefundLeaf { uint256 amountToReturn; uint256 chainId; uint32 leafId;
     * uint256[] refundAmounts; address[] refundTokens; address[] refundAddresses; }
     */
    public byte[] hashRelayerRefundLeaf(RelayerRefundLeaf leaf) {
        return MerkleTreeService.keccak256(encodeRelayerRefundLeaf(leaf));
    }

    /**
     * struct PoolRebalanceLeaf { uint256 chainId; uint256 groupIndex; uint8 leafId;
     * uint256[] bundleLpFees; int256[] netSendAmounts; int256[] runningBalances; address[] l1Tokens; }
     */
    public byte[] hashPoolRebalanceLeaf(PoolRebalanceLeaf leaf) {
        return MerkleTreeService.keccak256(encodePoolRebalanceLeaf(leaf));
    }

    byte[] encodeRelayData(RelayData d) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(9 * 32);
        out.writeBytes(addressWord(d.depositor()));
        out.writeBytes(addressWord(d.recipient()));
        out.writeBytes(addressWord(d.destinationToken()));
        out.writeBytes(uintWord(d.amount()));
        out.writeBytes(uintWord(BigInteger.valueOf(d.originChainId())));
        out.writeBytes(uintWord(BigInteger.valueOf(d.destinationChainId())));
        out.writeBytes(uintWord(d.realizedLpFeePct()));
        out.writeBytes(uintWord(d.relayerFeePct()));
        out.writeBytes(uintWord(BigInteger.valueOf(d.depositId())));
        return out.toByteArray();
    }

    byte[] encodeRelayerRefundLeaf(RelayerRefundLeaf leaf) {
        List<byte[]> amounts = new ArrayList<>();
        List<byte[]> tokens = new ArrayList<>();
        List<byte[]> relayers = new ArrayList<>();
        for (RelayerRefund r : leaf.refunds()) {
            amounts.add(uintWord(r.amount()));
            tokens.add(addressWord(r.refundToken()));
            relayers.add(addressWord(r.relayer()));
        }

        List<Object> fields = List.of(
                uintWord(leaf.amountToReturn()),
                uintWord(BigInteger.valueOf(leaf.chainId())),
                uintWord(BigInteger.valueOf(leaf.leafId())),
                amounts,
                tokens,
                relayers
        );
        return encodeDynamicTuple(fields);
    }

    byte[] encodePoolRebalanceLeaf(PoolRebalanceLeaf leaf) {
        int n = leaf.l1Tokens().size();
        if (leaf.bundleLpFees().size() != n || leaf.netSendAmounts().size() != n || leaf.runningBalances().size() != n) {
            throw new IllegalArgumentException("Pool rebalance leaf " + leaf.leafId() + " has mismatched array lengths");
        }

        List<byte[]> fees = new ArrayList<>(n);
        List<byte[]> netSends = new ArrayList<>(n);
        List<byte[]> balances = new ArrayList<>(n);
        List<byte[]> tokens = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            fees.add(uintWord(leaf.bundleLpFees().get(i)));
            netSends.add(intWord(leaf.netSendAmounts().get(i)));
            balances.add(intWord(leaf.runningBalances().get(i)));
            tokens.add(addressWord(leaf.l1Tokens().get(i)));
        }

        List<Object> fields = List.of(
                uintWord(BigInteger.valueOf(leaf.chainId())),
                uintWord(BigInteger.valueOf(leaf.groupIndex())),
                uintWord(BigInteger.valueOf(leaf.leafId())),
                fees,
                netSends,
                balances,
                tokens
        );
        return encodeDynamicTuple(fields);
    }

    /**
     * Each field is either a 32-byte word (static) or a list of words (dynamic array of static elements).
     */
    @SuppressWarnings("unchecked")
    private static byte[] encodeDynamicTuple(List<Object> fields) {
        ByteArrayOutputStream head = new ByteArrayOutputStream();
        ByteArrayOutputStream tail = new ByteArrayOutputStream();
        long headSize = 32L * fields.size();

        for (Object field : fields) {
            if (field instanceof byte[] word) {
                head.writeBytes(word);
            } else {
                List<byte[]> words = (List<byte[]>) field;
                head.writeBytes(uintWord(BigInteger.valueOf(headSize + tail.size())));
                tail.writeBytes(uintWord(BigInteger.valueOf(words.size())));
                words.forEach(tail::writeBytes);
            }
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(32 + head.size() + tail.size());
        // abi.encode(struct) of a dynamic struct starts with the offset of the tuple itself
        out.writeBytes(uintWord(BigInteger.valueOf(32)));
        out.writeBytes(head.toByteArray());
        out.writeBytes(tail.toByteArray());
        return out.toByteArray();
    }

    static byte[] uintWord(BigInteger value) {
        if (value == null || value.signum() < 0 || value.compareTo(UINT256_MAX) > 0) {
            throw new IllegalArgumentException("Value out of uint256 range: " + value);
        }
        return leftPad(value.toByteArray(), (byte) 0);
    }

    static byte[] intWord(BigInteger value) {
        if (value == null || value.compareTo(INT256_MIN) < 0 || value.compareTo(INT256_MAX) > 0) {
            throw new IllegalArgumentException("Value out of int256 range: " + value);
        }
        return leftPad(value.toByteArray(), value.signum() < 0 ? (byte) 0xff : (byte) 0);
    }

    static byte[] addressWord(String address) {
        byte[] raw = HexUtil.toBytes(address);
        if (raw.length != 20) {
            throw new IllegalArgumentException("Address must be 20 bytes: " + address);
        }
        return leftPad(raw, (byte) 0);
    }

    private static byte[] leftPad(byte[] bytes, byte fill) {
        // BigInteger.toByteArray may carry one extra sign byte
        int start = bytes.length > 32 ? bytes.length - 32 : 0;
        int len = bytes.length - start;
        byte[] out = new byte[32];
        for (int i = 0; i < 32 - len; i++) out[i] = fill;
        System.arraycopy(bytes, start, out, 32 - len, len);
        return out;
    }
}

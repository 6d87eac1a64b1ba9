package dao.bridge.dataworker;

import dao.bridge.dataworker.client.InMemorySpokePoolClient;
import dao.bridge.dataworker.config.TokenProperties;
import dao.bridge.dataworker.model.BundleBlockRange;
import dao.bridge.dataworker.model.Deposit;
import dao.bridge.dataworker.model.Fill;

import java.math.BigInteger;
import java.util.Map;
import java.util.TreeMap;

/**
 * Shared chains, tokens and event builders for the dataworker tests.
 */
public final class BridgeFixtures {
    private BridgeFixtures() {}

    public static final int CHAIN_A = 10;
    public static final int CHAIN_B = 137;
    public static final int CHAIN_C = 42161;

    public static final String WETH_L1 = "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2";
    public static final String WETH_A = "0x4200000000000000000000000000000000000006";
    public static final String WETH_B = "0x7ceb23fd6bc0add59e62ac25578270cff1b9f619";
    public static final String WETH_C = "0x82af49447d8a07e3bd95bd0d56f35241523fbab1";

    public static final String USDC_L1 = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";
    public static final String USDC_A = "0x7f5c764cbc14f9669b88837ca1490cca17c31607";
    public static final String USDC_B = "0x2791bca1f2de4661ed88a30c99a7a9449aa84174";
    public static final String USDC_C = "0xff970a61a04b1ca14834a43f5de4533ebddb5cc8";

    public static final String DEPOSITOR = "0x1111111111111111111111111111111111111111";
    public static final String RECIPIENT = "0x2222222222222222222222222222222222222222";
    public static final String RELAYER_R = "0x3333333333333333333333333333333333333333";
    public static final String RELAYER_S = "0x4444444444444444444444444444444444444444";

    /** 10% */
    public static final BigInteger LP_FEE_PCT = new BigInteger("100000000000000000");
    /** 1% */
    public static final BigInteger RELAYER_FEE_PCT = new BigInteger("10000000000000000");

    public static TokenProperties tokenProperties() {
        return tokenProperties(BigInteger.ZERO, BigInteger.ZERO);
    }

    public static TokenProperties tokenProperties(BigInteger wethThreshold, BigInteger usdcThreshold) {
        TokenProperties props = new TokenProperties();
        props.getL1Tokens().add(l1Token(WETH_L1, wethThreshold, WETH_A, WETH_B, WETH_C));
        props.getL1Tokens().add(l1Token(USDC_L1, usdcThreshold, USDC_A, USDC_B, USDC_C));
        return props;
    }

    private static TokenProperties.L1Token l1Token(String address, BigInteger threshold,
                                                   String onA, String onB, String onC) {
        TokenProperties.L1Token t = new TokenProperties.L1Token();
        t.setAddress(address);
        t.setTransferThreshold(threshold);
        Map<Integer, String> routes = new TreeMap<>();
        routes.put(CHAIN_A, onA);
        routes.put(CHAIN_B, onB);
        routes.put(CHAIN_C, onC);
        t.setRoutes(routes);
        return t;
    }

    public static String weth(int chainId) {
        return switch (chainId) {
            case CHAIN_A -> WETH_A;
            case CHAIN_B -> WETH_B;
            case CHAIN_C -> WETH_C;
            default -> throw new IllegalArgumentException("No WETH on chain " + chainId);
        };
    }

    public static String usdc(int chainId) {
        return switch (chainId) {
            case CHAIN_A -> USDC_A;
            case CHAIN_B -> USDC_B;
            case CHAIN_C -> USDC_C;
            default -> throw new IllegalArgumentException("No USDC on chain " + chainId);
        };
    }

    public static InMemorySpokePoolClient updatedClient(int chainId) {
        InMemorySpokePoolClient client = new InMemorySpokePoolClient(chainId);
        client.setUpdated(true);
        return client;
    }

    /** WETH deposit with the default fees. */
    public static Deposit deposit(long depositId, int origin, int destination, long amount, long blockNumber) {
        return Deposit.builder()
                .depositId(depositId)
                .originChainId(origin)
                .destinationChainId(destination)
                .depositor(DEPOSITOR)
                .recipient(RECIPIENT)
                .originToken(weth(origin))
                .destinationToken(weth(destination))
                .amount(BigInteger.valueOf(amount))
                .relayerFeePct(RELAYER_FEE_PCT)
                .realizedLpFeePct(LP_FEE_PCT)
                .quoteTimestamp(1_700_000_000L)
                .blockNumber(blockNumber)
                .build();
    }

    public static Deposit usdcDeposit(long depositId, int origin, int destination, long amount, long blockNumber) {
        return deposit(depositId, origin, destination, amount, blockNumber).toBuilder()
                .originToken(usdc(origin))
                .destinationToken(usdc(destination))
                .build();
    }

    /** A fill carrying the deposit's economic fields unchanged. */
    public static Fill fill(Deposit d, long fillAmount, long totalFilled, String relayer,
                            int repaymentChainId, long blockNumber) {
        return Fill.builder()
                .depositId(d.depositId())
                .originChainId(d.originChainId())
                .destinationChainId(d.destinationChainId())
                .depositor(d.depositor())
                .recipient(d.recipient())
                .destinationToken(d.destinationToken())
                .amount(d.amount())
                .relayerFeePct(d.relayerFeePct())
                .realizedLpFeePct(d.realizedLpFeePct())
                .fillAmount(BigInteger.valueOf(fillAmount))
                .totalFilledAmount(BigInteger.valueOf(totalFilled))
                .repaymentChainId(repaymentChainId)
                .relayer(relayer)
                .isSlowRelay(false)
                .blockNumber(blockNumber)
                .build();
    }

    public static Fill slowFill(Deposit d, long blockNumber) {
        return fill(d, d.amount().longValueExact(), d.amount().longValueExact(), RELAYER_R,
                d.destinationChainId(), blockNumber).toBuilder()
                .isSlowRelay(true)
                .build();
    }

    public static BundleBlockRange range(long startA, long endA, long startB, long endB, long startC, long endC) {
        Map<Integer, BundleBlockRange.BlockRange> ranges = new TreeMap<>();
        ranges.put(CHAIN_A, new BundleBlockRange.BlockRange(startA, endA));
        ranges.put(CHAIN_B, new BundleBlockRange.BlockRange(startB, endB));
        ranges.put(CHAIN_C, new BundleBlockRange.BlockRange(startC, endC));
        return BundleBlockRange.of(ranges);
    }

    public static BigInteger big(long v) {
        return BigInteger.valueOf(v);
    }
}

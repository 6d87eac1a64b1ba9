package dao.bridge.dataworker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.TreeMap;

@Configuration
@ConfigurationProperties(prefix = "chain")
@Data
public class ChainProperties {

    /**
     * Private key (hex) used to sign leaf executions on EVM spoke pools.
     */
    private String executorPrivateKey;

    /**
     * Spoke pools keyed by chain id.
     */
    private Map<Integer, Spoke> spokes = new TreeMap<>();

    @Data
    public static class Spoke {
        /**
         * JSON-RPC endpoint
         * Example: https://mainnet.optimism.io
         */
        private String rpcUrl;

        /**
         * SpokePool contract address (0x-prefixed)
         */
        private String spokePoolAddress;

        /**
         * Gas limit for executeRelayerRefundLeaf / executeSlowRelayLeaf.
         */
        private long executionGasLimit = 1_500_000L;

        /**
         * First block searched for RelayedRootBundle events. Usually the SpokePool deployment block.
         */
        private long deploymentBlock = 0L;
    }
}

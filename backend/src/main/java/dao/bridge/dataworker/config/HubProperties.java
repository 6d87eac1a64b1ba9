package dao.bridge.dataworker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "hub")
@Data
public class HubProperties {

    /**
     * gRPC endpoint for the TRON node hosting the hub pool
     * Example: grpc.nile.trongrid.io:50051
     */
    private String nodeEndpoint;

    /**
     * gRPC endpoint of the solidity node used for constant calls.
     * Example: grpc.nile.trongrid.io:50061
     * Both endpoints empty means the public Nile endpoints.
     */
    private String solidityNodeEndpoint;

    /**
     * HubPool contract address (base58 format)
     * Example: TAhZaywaWM1zAQPADJA39FyoQk8cokRLCd
     */
    private String contractAddress;

    /**
     * Proposer private key (hex format, 64 characters)
     */
    private String privateKey;

    /**
     * Fee limit (sun) for hub pool transactions.
     */
    private long feeLimit = 100_000_000L;

    /**
     * Transaction polling settings (to reduce RPC load).
     */
    private Polling polling = new Polling();

    @Data
    public static class Polling {
        /**
         * Timeout for getting TransactionInfo after broadcasting a tx.
         */
        private long txInfoTimeoutSeconds = 60;
        /**
         * Initial poll interval for TransactionInfo.
         */
        private long txInfoPollInitialMs = 250;
        /**
         * Maximum poll interval for TransactionInfo (backoff cap).
         */
        private long txInfoPollMaxMs = 2000;

        /**
         * Timeout for reading the ProposeRootBundle event.
         */
        private long proposalEventTimeoutSeconds = 60;
        /**
         * Initial poll interval for the ProposeRootBundle event.
         */
        private long proposalEventPollInitialMs = 500;
    }
}

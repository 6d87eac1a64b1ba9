package dao.bridge.dataworker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "bundle")
@Data
public class BundleProperties {

    /**
     * Maximum number of L1 tokens in one pool-rebalance leaf. A chain with more tokens
     * is split into several leaves with increasing groupIndex.
     * Default: 25
     */
    private int maxL1TokensPerPoolRebalanceLeaf = 25;

    /**
     * Max number of origin chains reconciled concurrently.
     * Default: 4 (1 = sequential)
     */
    private int reconciliationMaxParallel = 4;
}

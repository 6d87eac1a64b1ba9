package dao.bridge.dataworker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private ProposalConfig proposal = new ProposalConfig();
    private ExecutionConfig execution = new ExecutionConfig();

    @Data
    public static class ProposalConfig {
        /**
         * Enable/disable automatic proposals
         * Default: false (a node usually only validates and executes)
         */
        private boolean enabled = false;

        /**
         * How often to check whether a new bundle can be proposed (in milliseconds)
         * Default: 60000ms
         */
        private long checkIntervalMs = 60_000;

        /**
         * Do not propose until at least one chain advanced this many blocks past the last bundle.
         * Default: 1
         */
        private long minBlocksPerBundle = 1;
    }

    @Data
    public static class ExecutionConfig {
        /**
         * How often to check for bundles past their challenge period (in milliseconds)
         * Default: 5000ms (5 seconds)
         */
        private long checkIntervalMs = 5000;

        /**
         * Enable/disable automatic validation + execution
         * Default: true
         */
        private boolean enabled = true;

        /**
         * Max number of leaves to execute concurrently per root.
         * Default: 3 (bounded parallelism; gentle on public nodes).
         */
        private int maxParallel = 3;

        /**
         * Dispute a local proposal whose recomputed roots do not match.
         * Default: true
         */
        private boolean disputeOnMismatch = true;
    }
}

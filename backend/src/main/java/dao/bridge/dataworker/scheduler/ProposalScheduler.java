package dao.bridge.dataworker.scheduler;

import dao.bridge.dataworker.client.SpokePoolClient;
import dao.bridge.dataworker.client.SpokePoolClients;
import dao.bridge.dataworker.config.SchedulerProperties;
import dao.bridge.dataworker.exception.StaleChainStateException;
import dao.bridge.dataworker.model.BundleBlockRange;
import dao.bridge.dataworker.model.LocalBundle;
import dao.bridge.dataworker.service.BundleService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Slf4j
@Component
public class ProposalScheduler {

    private final BundleService bundleService;
    private final SpokePoolClients spokePoolClients;
    private final SchedulerProperties schedulerProps;

    public ProposalScheduler(BundleService bundleService,
                             SpokePoolClients spokePoolClients,
                             SchedulerProperties schedulerProps) {
        this.bundleService = bundleService;
        this.spokePoolClients = spokePoolClients;
        this.schedulerProps = schedulerProps;
    }

    @Scheduled(fixedDelayString = "${scheduler.proposal.check-interval-ms:60000}")
    public void maybeProposeBundle() {
        if (!schedulerProps.getProposal().isEnabled()) {
            return;
        }
        if (bundleService.hasPendingBundle()) {
            log.debug("Previous bundle still pending, not proposing");
            return;
        }

        Optional<BundleBlockRange> range = nextBlockRange();
        if (range.isEmpty()) return;

        try {
            LocalBundle bundle = bundleService.propose(range.get());
            log.info("Scheduled proposal done: bundle={}, range={}", bundle.getLocalId(), range.get().ranges());
        } catch (StaleChainStateException e) {
            log.info("Spoke chain {} not updated yet, retrying next tick", e.getChainId());
        } catch (Exception e) {
            log.error("Scheduled proposal failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Each chain continues one block after the latest active bundle and ends at the client's latest block.
     * Empty unless every chain advanced and at least one advanced {@code min-blocks-per-bundle}.
     */
    Optional<BundleBlockRange> nextBlockRange() {
        Optional<LocalBundle> previous = bundleService.getLatestActiveBundle();
        long minBlocks = Math.max(1, schedulerProps.getProposal().getMinBlocksPerBundle());

        Map<Integer, BundleBlockRange.BlockRange> ranges = new TreeMap<>();
        boolean advancedEnough = false;
        for (SpokePoolClient client : spokePoolClients.all()) {
            int chainId = client.getChainId();
            long start = previous
                    .map(b -> b.getBlockRange().ranges().get(chainId))
                    .map(r -> r.endBlock() + 1)
                    .orElse(0L);
            long end = client.getLatestBlockNumber();
            if (end < start) {
                log.debug("Chain {} has not advanced past block {}", chainId, start - 1);
                return Optional.empty();
            }
            if (end - start + 1 >= minBlocks) {
                advancedEnough = true;
            }
            ranges.put(chainId, new BundleBlockRange.BlockRange(start, end));
        }

        if (ranges.isEmpty() || !advancedEnough) {
            return Optional.empty();
        }
        return Optional.of(BundleBlockRange.of(ranges));
    }
}

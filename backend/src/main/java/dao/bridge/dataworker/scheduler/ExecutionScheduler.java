package dao.bridge.dataworker.scheduler;

import dao.bridge.dataworker.config.SchedulerProperties;
import dao.bridge.dataworker.exception.StaleChainStateException;
import dao.bridge.dataworker.model.BundleStatus;
import dao.bridge.dataworker.model.BundleValidationResult;
import dao.bridge.dataworker.model.LocalBundle;
import dao.bridge.dataworker.service.BundleService;
import dao.bridge.dataworker.service.ExecutionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class ExecutionScheduler {

    private final BundleService bundleService;
    private final ExecutionService executionService;
    private final SchedulerProperties schedulerProps;

    public ExecutionScheduler(BundleService bundleService,
                              ExecutionService executionService,
                              SchedulerProperties schedulerProps) {
        this.bundleService = bundleService;
        this.executionService = executionService;
        this.schedulerProps = schedulerProps;
    }

    /**
     * Validate proposed bundles while their challenge window is open; execute validated ones once it has passed.
     */
    @Scheduled(fixedDelayString = "${scheduler.execution.check-interval-ms:5000}")
    public void validateAndExecute() {
        if (!schedulerProps.getExecution().isEnabled()) {
            return;
        }

        long now = System.currentTimeMillis() / 1000L;
        List<LocalBundle> bundles = bundleService.getBundles();

        for (LocalBundle bundle : bundles) {
            try {
                if (bundle.getStatus() == BundleStatus.PROPOSED) {
                    validateOrDispute(bundle, now);
                }

                if (bundle.getStatus() != BundleStatus.VALIDATED && bundle.getStatus() != BundleStatus.EXECUTING) {
                    continue;
                }
                if (now < bundle.getChallengePeriodEnd()) {
                    continue;
                }

                log.info("Executing bundle {} (challenge period ended at {})", bundle.getLocalId(), bundle.getChallengePeriodEnd());
                executionService.executeAll(bundle.getLocalId());
            } catch (StaleChainStateException e) {
                log.info("Bundle {}: spoke chain {} not updated yet, retrying next tick", bundle.getLocalId(), e.getChainId());
            } catch (Exception e) {
                log.error("Bundle {} processing failed: {}", bundle.getLocalId(), e.getMessage(), e);
            }
        }
    }

    private void validateOrDispute(LocalBundle bundle, long now) {
        BundleValidationResult result = bundleService.validate(bundle.getLocalId());
        if (result.isValid()) {
            return;
        }
        if (!schedulerProps.getExecution().isDisputeOnMismatch()) {
            log.warn("Bundle {} roots {} mismatch; auto-dispute disabled", bundle.getLocalId(), result.mismatchedRoots());
            return;
        }
        if (now >= bundle.getChallengePeriodEnd()) {
            log.error("Bundle {} roots {} mismatch but challenge period already ended", bundle.getLocalId(), result.mismatchedRoots());
            return;
        }
        bundleService.dispute(bundle.getLocalId());
    }
}

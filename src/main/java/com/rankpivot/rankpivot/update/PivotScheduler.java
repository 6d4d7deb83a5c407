package com.rankpivot.rankpivot.update;

import com.rankpivot.rankpivot.plan.UpdateDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs periodic table updates for every country based on the cron expression in configuration.
 */
@Component
public class PivotScheduler {

    private static final Logger log = LoggerFactory.getLogger(PivotScheduler.class);

    private final PivotUpdateService pivotUpdateService;
    private final PivotProperties pivotProperties;

    public PivotScheduler(PivotUpdateService pivotUpdateService, PivotProperties pivotProperties) {
        this.pivotUpdateService = pivotUpdateService;
        this.pivotProperties = pivotProperties;
    }

    @Scheduled(cron = "${pivot.cron}")
    public void scheduledUpdate() {
        UpdateDecision decision = UpdateDecision.parse(pivotProperties.getScheduledDecision());
        List<UpdateResult> results = pivotUpdateService.updateAllCountries(decision);
        long failed = results.stream()
                .filter(result -> PivotConstants.RUN_STATUS_FAILED.equals(result.status()))
                .count();
        log.info("Pivot update complete. decision={}, countries={}, failed={}", decision, results.size(), failed);
    }
}

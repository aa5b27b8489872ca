package com.flowpulse.trigger.job;

import com.flowpulse.domain.state.model.valobj.StateCleanupResult;
import com.flowpulse.trigger.application.command.WorkflowStateCommandService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 终态快照保留期清理作业。
 */
@Slf4j
@Component
public class StateRetentionJob {

    private final WorkflowStateCommandService workflowStateCommandService;
    private final boolean enabled;
    private final int daysOld;

    public StateRetentionJob(WorkflowStateCommandService workflowStateCommandService,
                             @Value("${workflow.state.retention.enabled:false}") boolean enabled,
                             @Value("${workflow.state.retention.days-old:30}") int daysOld) {
        this.workflowStateCommandService = workflowStateCommandService;
        this.enabled = enabled;
        this.daysOld = Math.max(daysOld, 0);
    }

    @Scheduled(
            fixedDelayString = "${workflow.state.retention.interval-ms:3600000}",
            scheduler = "daemonScheduler"
    )
    public void purgeTerminalStates() {
        if (!enabled) {
            return;
        }
        StateCleanupResult result = workflowStateCommandService.purgeTerminalStates(daysOld, null);
        if (result.deletedCount() > 0) {
            log.info("State retention purge removed terminal states. daysOld={}, cutoff={}, deleted={}",
                    daysOld, result.cutoffDate(), result.deletedCount());
        }
    }
}

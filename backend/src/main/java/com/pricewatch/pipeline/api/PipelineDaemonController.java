package com.pricewatch.pipeline.api;

import com.pricewatch.pipeline.model.PipelineStatusResponse;
import com.pricewatch.pipeline.model.RetentionRunSummary;
import com.pricewatch.pipeline.model.RetentionSweepResult;
import com.pricewatch.pipeline.model.SchedulerTickSummary;
import com.pricewatch.pipeline.model.WebhookDelivery;
import com.pricewatch.pipeline.retention.RetentionManagerService;
import com.pricewatch.pipeline.service.JobSchedulerService;
import com.pricewatch.pipeline.webhook.WebhookDispatcherService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/pipeline")
public class PipelineDaemonController {
    private final JobSchedulerService schedulerService;
    private final WebhookDispatcherService dispatcher;
    private final RetentionManagerService retentionManager;

    public PipelineDaemonController(
        JobSchedulerService schedulerService,
        WebhookDispatcherService dispatcher,
        RetentionManagerService retentionManager
    ) {
        this.schedulerService = schedulerService;
        this.dispatcher = dispatcher;
        this.retentionManager = retentionManager;
    }

    @GetMapping("/status")
    public PipelineStatusResponse status() {
        return schedulerService.getStatus();
    }

    @PostMapping("/scheduler/start")
    public PipelineStatusResponse start() {
        schedulerService.start();
        return schedulerService.getStatus();
    }

    @PostMapping("/scheduler/stop")
    public PipelineStatusResponse stop() {
        schedulerService.stop();
        return schedulerService.getStatus();
    }

    @PostMapping("/scheduler/tick")
    public SchedulerTickSummary tick() {
        return schedulerService.tick();
    }

    @GetMapping("/webhooks/dead-letters")
    public List<WebhookDelivery> deadLetters(
        @RequestParam(name = "tenantId", required = false) String tenantId,
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        return dispatcher.findDeadLetters(tenantId, Math.max(1, Math.min(limit, 500)));
    }

    @PostMapping("/retention/run")
    public RetentionRunSummary runRetention() {
        return retentionManager.sweepAll();
    }

    @PostMapping("/retention/run/{tenantId}")
    public RetentionSweepResult runRetentionForTenant(@PathVariable("tenantId") String tenantId) {
        return retentionManager.sweepTenant(tenantId);
    }
}

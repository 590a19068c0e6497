package com.pricewatch.pipeline.api;

import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.JobDefinitionRequest;
import com.pricewatch.pipeline.model.JobRun;
import com.pricewatch.pipeline.model.RetentionPolicy;
import com.pricewatch.pipeline.model.RetentionPolicyRequest;
import com.pricewatch.pipeline.service.JobConfigurationService;
import com.pricewatch.pipeline.service.JobSchedulerService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class JobController {
    private final JobConfigurationService configurationService;
    private final JobSchedulerService schedulerService;

    public JobController(JobConfigurationService configurationService, JobSchedulerService schedulerService) {
        this.configurationService = configurationService;
        this.schedulerService = schedulerService;
    }

    @PostMapping("/jobs")
    @ResponseStatus(HttpStatus.CREATED)
    public Job createJob(@RequestBody JobDefinitionRequest request) {
        return configurationService.createJob(request);
    }

    @PutMapping("/jobs/{jobId}")
    public Job updateJob(@PathVariable("jobId") long jobId, @RequestBody JobDefinitionRequest request) {
        return configurationService.updateJob(jobId, request);
    }

    @GetMapping("/jobs/{jobId}")
    public Job getJob(@PathVariable("jobId") long jobId) {
        return configurationService.getJob(jobId);
    }

    @GetMapping("/jobs")
    public List<Job> listJobs(@RequestParam(name = "tenantId") String tenantId) {
        return configurationService.listJobs(tenantId);
    }

    @PostMapping("/jobs/{jobId}/pause")
    public Job pauseJob(@PathVariable("jobId") long jobId) {
        return configurationService.pauseJob(jobId);
    }

    @PostMapping("/jobs/{jobId}/resume")
    public Job resumeJob(@PathVariable("jobId") long jobId) {
        return configurationService.resumeJob(jobId);
    }

    @PostMapping("/jobs/{jobId}/archive")
    public Job archiveJob(@PathVariable("jobId") long jobId) {
        return configurationService.archiveJob(jobId);
    }

    @GetMapping("/jobs/{jobId}/runs")
    public List<JobRun> listRuns(
        @PathVariable("jobId") long jobId,
        @RequestParam(name = "limit", required = false, defaultValue = "20") int limit
    ) {
        return configurationService.listRuns(jobId, limit);
    }

    @PostMapping("/jobs/{jobId}/trigger")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public JobRun triggerJob(@PathVariable("jobId") long jobId) {
        return schedulerService.triggerManually(jobId);
    }

    @PutMapping("/retention/policies/{tenantId}")
    public RetentionPolicy upsertRetentionPolicy(
        @PathVariable("tenantId") String tenantId,
        @RequestBody RetentionPolicyRequest request
    ) {
        return configurationService.upsertRetentionPolicy(tenantId, request);
    }
}

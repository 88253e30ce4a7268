package com.kreasipositif.baiprocessor.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.explore.JobExplorer;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * REST API for triggering and monitoring the bank-file ingest and cash-application jobs.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/batch")
@Tag(name = "Batch Jobs", description = "Ingest BAI2 bank files and apply their credits to open invoices")
public class JobController {

    private final JobLauncher asyncJobLauncher;
    private final Job bankFileIngestJob;
    private final Job cashApplicationJob;
    private final JobExplorer jobExplorer;

    @Value("${bai.input-file:classpath:data/sample.bai}")
    private String defaultInputFile;

    @Value("${bai.output-dir:${java.io.tmpdir}/bai-output}")
    private String defaultOutputDir;

    @Value("${bai.cash-application.output-file:${java.io.tmpdir}/bai-output/cash_application.csv}")
    private String defaultCashApplicationFile;

    public JobController(@Qualifier("asyncJobLauncher") JobLauncher asyncJobLauncher,
                         @Qualifier("bankFileIngestJob") Job bankFileIngestJob,
                         @Qualifier("cashApplicationJob") Job cashApplicationJob,
                         JobExplorer jobExplorer) {
        this.asyncJobLauncher = asyncJobLauncher;
        this.bankFileIngestJob = bankFileIngestJob;
        this.cashApplicationJob = cashApplicationJob;
        this.jobExplorer = jobExplorer;
    }

    // ─── POST /api/v1/batch/ingest ────────────────────────────────────────────

    @PostMapping("/ingest")
    @Operation(
            summary = "Ingest a BAI2 bank file",
            description = "Launches `bankFileIngestJob` **asynchronously**: the file is decoded and written as "
                    + "`<base>_balances.csv` and `<base>_transactions.csv` into the output directory. "
                    + "Poll `GET /api/v1/batch/status/{jobExecutionId}` to track progress.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Job accepted and started in the background",
                            content = @Content(schema = @Schema(implementation = JobStartResponse.class))),
                    @ApiResponse(responseCode = "500", description = "Failed to launch job",
                            content = @Content(schema = @Schema(implementation = Map.class)))
            })
    public ResponseEntity<?> ingest(
            @Parameter(description = "Filesystem path or Spring resource location of the BAI2 file. "
                    + "Leave blank to use the default configured in application.yml.",
                    example = "classpath:data/sample.bai")
            @RequestParam(value = "inputFile", required = false) String inputFile,
            @Parameter(description = "Directory the two CSV files are written to.")
            @RequestParam(value = "outputDir", required = false) String outputDir) {

        String resolvedInput = orDefault(inputFile, defaultInputFile);
        String resolvedOutputDir = orDefault(outputDir, defaultOutputDir);
        log.info("Starting bankFileIngestJob with inputFile='{}', outputDir='{}'", resolvedInput, resolvedOutputDir);

        JobParameters params = new JobParametersBuilder()
                .addString("inputFile", resolvedInput)
                .addString("outputDir", resolvedOutputDir)
                .addLong("startedAt", Instant.now().toEpochMilli())   // ensures unique run
                .toJobParameters();
        return launch(bankFileIngestJob, params, resolvedInput);
    }

    // ─── POST /api/v1/batch/match ─────────────────────────────────────────────

    @PostMapping("/match")
    @Operation(
            summary = "Apply transaction credits to open invoices",
            description = "Launches `cashApplicationJob` **asynchronously**: every row of the transactions CSV "
                    + "not yet present in the cash-application file is matched against the open invoices and "
                    + "appended to it.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Job accepted and started in the background",
                            content = @Content(schema = @Schema(implementation = JobStartResponse.class))),
                    @ApiResponse(responseCode = "500", description = "Failed to launch job",
                            content = @Content(schema = @Schema(implementation = Map.class)))
            })
    public ResponseEntity<?> match(
            @Parameter(description = "Transactions CSV written by the ingest job.", required = true,
                    example = "/tmp/bai-output/sample_transactions.csv")
            @RequestParam("transactionsFile") String transactionsFile,
            @Parameter(description = "Cash-application CSV to append to. "
                    + "Leave blank to use the default configured in application.yml.")
            @RequestParam(value = "outputFile", required = false) String outputFile) {

        String resolvedOutput = orDefault(outputFile, defaultCashApplicationFile);
        log.info("Starting cashApplicationJob with transactionsFile='{}', outputFile='{}'",
                transactionsFile, resolvedOutput);

        JobParameters params = new JobParametersBuilder()
                .addString("transactionsFile", transactionsFile)
                .addString("outputFile", resolvedOutput)
                .addLong("startedAt", Instant.now().toEpochMilli())
                .toJobParameters();
        return launch(cashApplicationJob, params, transactionsFile);
    }

    // ─── GET /api/v1/batch/status/{jobExecutionId} ───────────────────────────

    @GetMapping("/status/{jobExecutionId}")
    @Operation(
            summary = "Get job execution status",
            description = "Returns the current status of a job execution by its ID, with per-step counts.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Job execution found",
                            content = @Content(schema = @Schema(implementation = JobStatusResponse.class))),
                    @ApiResponse(responseCode = "404", description = "Job execution not found")
            })
    public ResponseEntity<?> getStatus(
            @Parameter(name = "jobExecutionId", description = "The job execution ID returned by /ingest or /match",
                    required = true)
            @PathVariable("jobExecutionId") Long jobExecutionId) {

        JobExecution execution = jobExplorer.getJobExecution(jobExecutionId);
        if (execution == null) {
            return ResponseEntity.notFound().build();
        }

        String jobName = execution.getJobInstance() != null
                ? execution.getJobInstance().getJobName() : null;
        String exitCode = execution.getExitStatus() != null
                ? execution.getExitStatus().getExitCode() : null;
        LocalDateTime startTime = execution.getStartTime();
        LocalDateTime endTime = execution.getEndTime();

        String elapsed = null;
        if (startTime != null) {
            LocalDateTime until = (endTime != null) ? endTime : LocalDateTime.now();
            elapsed = Duration.between(startTime, until).toSeconds() + "s";
        }

        List<StepDetail> steps = execution.getStepExecutions().stream()
                .sorted(Comparator.comparing(StepExecution::getId))
                .map(se -> new StepDetail(
                        se.getStepName(),
                        se.getStatus().name(),
                        se.getReadCount(),
                        se.getWriteCount(),
                        se.getFilterCount(),
                        se.getSkipCount(),
                        se.getStartTime() != null ? se.getStartTime().toString() : null,
                        se.getEndTime() != null ? se.getEndTime().toString() : null))
                .toList();

        List<String> failures = execution.getAllFailureExceptions().stream()
                .map(Throwable::getMessage)
                .toList();

        return ResponseEntity.ok(new JobStatusResponse(
                jobExecutionId,
                jobName,
                execution.getStatus().name(),
                exitCode,
                startTime != null ? startTime.toString() : null,
                endTime != null ? endTime.toString() : null,
                elapsed,
                steps,
                failures));
    }

    // ─── helpers ─────────────────────────────────────────────────────────────

    private ResponseEntity<?> launch(Job job, JobParameters params, String input) {
        try {
            // asyncJobLauncher returns immediately; the job runs in the background
            JobExecution execution = asyncJobLauncher.run(job, params);
            return ResponseEntity.accepted().body(new JobStartResponse(
                    execution.getId(),
                    job.getName(),
                    execution.getStatus().name(),
                    input,
                    execution.getStartTime() != null ? execution.getStartTime().toString() : null));
        } catch (Exception e) {
            log.error("Failed to start {}: {}", job.getName(), e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to start job: " + e.getMessage()));
        }
    }

    private static String orDefault(String value, String fallback) {
        return (value != null && !value.isBlank()) ? value : fallback;
    }

    // ─── Response records ─────────────────────────────────────────────────────

    public record JobStartResponse(Long jobExecutionId, String jobName, String status, String input,
                                   String startTime) {}

    /**
     * @param steps    per-step breakdown, in execution order
     * @param failures messages of every exception that failed the job or one of its steps
     */
    public record JobStatusResponse(
            Long jobExecutionId,
            String jobName,
            String status,
            String exitCode,
            String startTime,
            String endTime,
            String elapsed,
            List<StepDetail> steps,
            List<String> failures) {}

    /**
     * @param filterCount rows dropped by the processor, i.e. already present in the cash-application file
     */
    public record StepDetail(
            String step,
            String status,
            long readCount,
            long writeCount,
            long filterCount,
            long skipCount,
            String startTime,
            String endTime) {}
}

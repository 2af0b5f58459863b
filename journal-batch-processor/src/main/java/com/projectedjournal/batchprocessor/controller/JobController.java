package com.projectedjournal.batchprocessor.controller;

import com.projectedjournal.batchprocessor.batch.JournalExportTasklet;
import com.projectedjournal.batchprocessor.config.BatchConfig;
import com.projectedjournal.batchprocessor.config.JournalProperties;
import com.projectedjournal.batchprocessor.report.ErrorReport;
import com.projectedjournal.batchprocessor.report.ErrorReportFactory;
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
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * REST API for triggering and monitoring projected journal runs.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/journal")
@Tag(name = "Projected Journal", description = "Generate the projected journal and monitor its runs")
public class JobController {

    private final JobLauncher asyncJobLauncher;
    private final Job projectedJournalJob;
    private final JobExplorer jobExplorer;
    private final JournalProperties properties;
    private final ErrorReportFactory errorReportFactory;

    public JobController(@Qualifier("asyncJobLauncher") JobLauncher asyncJobLauncher,
                         Job projectedJournalJob,
                         JobExplorer jobExplorer,
                         JournalProperties properties,
                         ErrorReportFactory errorReportFactory) {
        this.asyncJobLauncher = asyncJobLauncher;
        this.projectedJournalJob = projectedJournalJob;
        this.jobExplorer = jobExplorer;
        this.properties = properties;
        this.errorReportFactory = errorReportFactory;
    }

    // ─── POST /api/v1/journal/start ───────────────────────────────────────────

    @PostMapping("/start")
    @Operation(
            summary = "Start a projected journal run",
            description = "Launches the journal job **asynchronously**. "
                    + "The HTTP response is returned immediately with `STARTING` status and a `jobExecutionId`. "
                    + "Poll `GET /api/v1/journal/status/{jobExecutionId}` to track progress. "
                    + "Any workbook path left blank falls back to `journal.inputs.*` in application.yml.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Job accepted and started in the background",
                            content = @Content(schema = @Schema(implementation = JobStartResponse.class))),
                    @ApiResponse(responseCode = "500", description = "Failed to launch job",
                            content = @Content(schema = @Schema(implementation = Map.class)))
            })
    public ResponseEntity<?> startJob(
            @Parameter(description = "Path to the AP Cash Grid workbook", example = "data/AP Cash Grid.xlsx")
            @RequestParam(value = "apGrid", required = false) String apGrid,
            @Parameter(description = "Worksheet of the AP Cash Grid; first sheet when blank")
            @RequestParam(value = "apSheet", required = false) String apSheet,
            @Parameter(description = "Path to the beginning balance sheet workbook")
            @RequestParam(value = "balanceSheet", required = false) String balanceSheet,
            @Parameter(description = "Path to the GAAP mapping workbook")
            @RequestParam(value = "gaapMapping", required = false) String gaapMapping,
            @Parameter(description = "Path to the cash-flow mapping workbook")
            @RequestParam(value = "cashflowMapping", required = false) String cashflowMapping,
            @Parameter(description = "Where to write the projected journal", example = "out/Projected_Journal.xlsx")
            @RequestParam(value = "outputFile", required = false) String outputFile) {

        JournalProperties.Inputs defaults = properties.getInputs();
        String resolvedApGrid = orDefault(apGrid, defaults.getApGrid());
        String resolvedOutput = orDefault(outputFile, defaults.getOutputFile());
        log.info("Starting {} with apGrid='{}', outputFile='{}'", BatchConfig.JOB_NAME, resolvedApGrid, resolvedOutput);

        try {
            JobParametersBuilder builder = new JobParametersBuilder()
                    .addString("apGrid", resolvedApGrid)
                    .addString("balanceSheet", orDefault(balanceSheet, defaults.getBalanceSheet()))
                    .addString("gaapMapping", orDefault(gaapMapping, defaults.getGaapMapping()))
                    .addString("cashflowMapping", orDefault(cashflowMapping, defaults.getCashflowMapping()))
                    .addString("outputFile", resolvedOutput)
                    .addLong("startedAt", Instant.now().toEpochMilli());   // ensures unique run
            String resolvedSheet = orDefault(apSheet, defaults.getApSheet());
            if (resolvedSheet != null) {
                builder.addString("apSheet", resolvedSheet);
            }
            JobParameters params = builder.toJobParameters();

            // asyncJobLauncher returns immediately; the job runs in the background
            JobExecution execution = asyncJobLauncher.run(projectedJournalJob, params);

            return ResponseEntity.accepted().body(new JobStartResponse(
                    execution.getId(),
                    execution.getStatus().name(),
                    resolvedApGrid,
                    resolvedOutput,
                    execution.getStartTime() != null ? execution.getStartTime().toString() : null));

        } catch (Exception e) {
            log.error("Failed to start job: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to start job: " + e.getMessage()));
        }
    }

    // ─── GET /api/v1/journal/status/{jobExecutionId} ─────────────────────────

    @GetMapping("/status/{jobExecutionId}")
    @Operation(
            summary = "Get journal run status",
            description = "Returns the status, step counts and, for failed runs, the structured error report.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Job execution found",
                            content = @Content(schema = @Schema(implementation = JobStatusResponse.class))),
                    @ApiResponse(responseCode = "404", description = "Job execution not found")
            })
    public ResponseEntity<?> getStatus(
            @Parameter(name = "jobExecutionId", description = "The job execution ID returned by /start", required = true)
            @PathVariable("jobExecutionId") Long jobExecutionId) {

        JobExecution execution = jobExplorer.getJobExecution(jobExecutionId);
        if (execution == null) {
            return ResponseEntity.notFound().build();
        }

        String exitCode = execution.getExitStatus() != null ? execution.getExitStatus().getExitCode() : null;
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

        Integer entries = execution.getExecutionContext().containsKey(JournalExportTasklet.ENTRY_COUNT_KEY)
                ? execution.getExecutionContext().getInt(JournalExportTasklet.ENTRY_COUNT_KEY)
                : null;

        List<Throwable> failures = execution.getAllFailureExceptions();
        ErrorReport errors = failures.isEmpty() ? null
                : errorReportFactory.fromFailures(failures, apGridLabel(execution));

        return ResponseEntity.ok(new JobStatusResponse(
                jobExecutionId,
                execution.getJobInstance() != null ? execution.getJobInstance().getJobName() : BatchConfig.JOB_NAME,
                execution.getStatus().name(),
                exitCode,
                startTime != null ? startTime.toString() : null,
                endTime != null ? endTime.toString() : null,
                elapsed,
                execution.getJobParameters().getString("outputFile"),
                entries,
                steps,
                errors));
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private static String orDefault(String value, String fallback) {
        if (value != null && !value.isBlank()) {
            return value;
        }
        return fallback != null && !fallback.isBlank() ? fallback : null;
    }

    private static String apGridLabel(JobExecution execution) {
        String apGrid = execution.getJobParameters().getString("apGrid");
        return apGrid != null ? Path.of(apGrid).getFileName().toString() : null;
    }

    // ─── Response records ─────────────────────────────────────────────────────

    public record JobStartResponse(Long jobExecutionId, String status, String apGrid, String outputFile,
                                   String startTime) {}

    /**
     * @param entries number of journal lines written; {@code null} until the export step has run
     * @param errors  structured failure report; {@code null} unless the run failed
     */
    public record JobStatusResponse(
            Long jobExecutionId,
            String jobName,
            String status,
            String exitCode,
            String startTime,
            String endTime,
            String elapsed,
            String outputFile,
            Integer entries,
            List<StepDetail> steps,
            ErrorReport errors) {}

    /**
     * Per-step counts. For {@code journalStep} the filter count is the number of AP/AR
     * transactions outside the projection horizon.
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

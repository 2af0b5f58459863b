package com.projectedjournal.batchprocessor.config;

import com.projectedjournal.batchprocessor.batch.InputPreparationTasklet;
import com.projectedjournal.batchprocessor.batch.JournalExportTasklet;
import com.projectedjournal.batchprocessor.batch.JournalItemProcessor;
import com.projectedjournal.batchprocessor.batch.JournalLineWriter;
import com.projectedjournal.batchprocessor.batch.JournalRunContext;
import com.projectedjournal.batchprocessor.batch.JournalSource;
import com.projectedjournal.batchprocessor.domain.JournalLine;
import com.projectedjournal.batchprocessor.service.InputPaths;
import com.projectedjournal.batchprocessor.service.JournalInputService;
import com.projectedjournal.batchprocessor.workbook.JournalWorkbookExporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.launch.support.TaskExecutorJobLauncher;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.item.support.ListItemReader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Spring Batch configuration for the projected journal.
 *
 * <h3>Architecture</h3>
 * <pre>
 *  projectedJournalJob
 *      │
 *      ├── prepareInputsStep  (tasklet: load + validate workbooks, normalise the AP Cash Grid)
 *      │
 *      ├── journalStep        (chunk-oriented)
 *      │        ├── ListItemReader        (opening balances, then AP/AR transactions by date)
 *      │        ├── JournalItemProcessor  (one journal line per source, horizon filter)
 *      │        └── JournalLineWriter     (collects lines in the job-scoped run context)
 *      │
 *      └── exportJournalStep  (tasklet: writes the Projected Journal workbook)
 * </pre>
 *
 * The workbook is only written once every line has been produced, so a failed run never leaves a
 * partial journal behind.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class BatchConfig {

    public static final String JOB_NAME = "projectedJournalJob";

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final JournalProperties properties;

    // ─── Job ─────────────────────────────────────────────────────────────────

    @Bean
    public Job projectedJournalJob(Step prepareInputsStep, Step journalStep, Step exportJournalStep) {
        return new JobBuilder(JOB_NAME, jobRepository)
                .start(prepareInputsStep)
                .next(journalStep)
                .next(exportJournalStep)
                .build();
    }

    // ─── Async JobLauncher ────────────────────────────────────────────────────

    /**
     * An async {@link JobLauncher} for the REST trigger.
     *
     * <p>{@code asyncJobLauncher.run(...)} returns immediately with {@code STARTING} status;
     * callers poll {@code GET /api/v1/journal/status/{id}}. It is not a default autowire candidate,
     * so the command line and the tests keep Boot's synchronous {@code jobLauncher}.
     */
    @Bean(name = "asyncJobLauncher", defaultCandidate = false)
    public JobLauncher asyncJobLauncher() throws Exception {
        TaskExecutorJobLauncher launcher = new TaskExecutorJobLauncher();
        launcher.setJobRepository(jobRepository);
        launcher.setTaskExecutor(new SimpleAsyncTaskExecutor("journal-job-"));
        launcher.afterPropertiesSet();
        return launcher;
    }

    // ─── Steps ───────────────────────────────────────────────────────────────

    @Bean
    public Step prepareInputsStep(InputPreparationTasklet inputPreparationTasklet) {
        return new StepBuilder("prepareInputsStep", jobRepository)
                .tasklet(inputPreparationTasklet, transactionManager)
                .build();
    }

    @Bean
    public Step journalStep(ListItemReader<JournalSource> journalSourceReader,
                            JournalItemProcessor journalItemProcessor,
                            JournalLineWriter journalLineWriter) {
        return new StepBuilder("journalStep", jobRepository)
                .<JournalSource, JournalLine>chunk(properties.getChunkSize(), transactionManager)
                .reader(journalSourceReader)
                .processor(journalItemProcessor)
                .writer(journalLineWriter)
                .build();
    }

    @Bean
    public Step exportJournalStep(JournalExportTasklet journalExportTasklet) {
        return new StepBuilder("exportJournalStep", jobRepository)
                .tasklet(journalExportTasklet, transactionManager)
                .build();
    }

    // ─── Step-scoped components ──────────────────────────────────────────────

    /**
     * Workbook paths come from the job parameters and fall back to {@code journal.inputs.*}.
     */
    @Bean
    @StepScope
    public InputPreparationTasklet inputPreparationTasklet(
            JournalInputService inputService,
            JournalRunContext runContext,
            Clock journalClock,
            @Value("#{jobParameters['apGrid'] ?: '${journal.inputs.ap-grid:}'}") String apGrid,
            @Value("#{jobParameters['apSheet'] ?: '${journal.inputs.ap-sheet:}'}") String apSheet,
            @Value("#{jobParameters['balanceSheet'] ?: '${journal.inputs.balance-sheet:}'}") String balanceSheet,
            @Value("#{jobParameters['gaapMapping'] ?: '${journal.inputs.gaap-mapping:}'}") String gaapMapping,
            @Value("#{jobParameters['cashflowMapping'] ?: '${journal.inputs.cashflow-mapping:}'}") String cashflowMapping) {

        InputPaths paths = new InputPaths(
                Path.of(apGrid),
                apSheet == null || apSheet.isBlank() ? null : apSheet,
                Path.of(balanceSheet),
                Path.of(gaapMapping),
                Path.of(cashflowMapping));
        return new InputPreparationTasklet(inputService, runContext, journalClock, paths);
    }

    @Bean
    @StepScope
    public ListItemReader<JournalSource> journalSourceReader(JournalRunContext runContext) {
        return new ListItemReader<>(runContext.sources());
    }

    @Bean
    @StepScope
    public JournalExportTasklet journalExportTasklet(
            JournalWorkbookExporter exporter,
            JournalRunContext runContext,
            @Value("#{jobParameters['outputFile'] ?: '${journal.inputs.output-file:}'}") String outputFile) {
        return new JournalExportTasklet(exporter, runContext, Path.of(outputFile));
    }
}

package com.projectedjournal.batchprocessor.batch;

import com.projectedjournal.batchprocessor.service.InputPaths;
import com.projectedjournal.batchprocessor.service.JournalInputService;
import com.projectedjournal.batchprocessor.domain.InputBundle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * First step of the journal job: prepares the inputs and fixes the run's as-of date.
 *
 * <p>Not a {@code @Component}; created as a {@code @StepScope} bean in
 * {@link com.projectedjournal.batchprocessor.config.BatchConfig} so the workbook paths come from
 * the job parameters.
 */
@Slf4j
public class InputPreparationTasklet implements Tasklet {

    private final JournalInputService inputService;
    private final JournalRunContext runContext;
    private final Clock clock;
    private final InputPaths paths;

    public InputPreparationTasklet(JournalInputService inputService, JournalRunContext runContext,
                                   Clock clock, InputPaths paths) {
        this.inputService = inputService;
        this.runContext = runContext;
        this.clock = clock;
        this.paths = paths;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        // single clock read so the grid anchor and the horizon share one date
        LocalDateTime runTimestamp = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        LocalDate asOf = runTimestamp.toLocalDate();
        log.info("Preparing journal inputs — {}", paths);
        InputBundle inputs = inputService.prepare(paths, asOf);
        runContext.start(inputs, asOf, runTimestamp);
        log.info("Journal as-of date {}", asOf);
        return RepeatStatus.FINISHED;
    }
}

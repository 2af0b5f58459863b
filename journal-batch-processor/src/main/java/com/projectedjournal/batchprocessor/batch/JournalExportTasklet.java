package com.projectedjournal.batchprocessor.batch;

import com.projectedjournal.batchprocessor.domain.JournalLine;
import com.projectedjournal.batchprocessor.workbook.JournalWorkbookExporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

import java.nio.file.Path;
import java.util.List;

/**
 * Last step of the journal job: writes the collected lines to the output workbook and records the
 * entry count under {@value #ENTRY_COUNT_KEY} in the job execution context.
 */
@Slf4j
public class JournalExportTasklet implements Tasklet {

    public static final String ENTRY_COUNT_KEY = "journal.entryCount";

    private final JournalWorkbookExporter exporter;
    private final JournalRunContext runContext;
    private final Path outputFile;

    public JournalExportTasklet(JournalWorkbookExporter exporter, JournalRunContext runContext, Path outputFile) {
        this.exporter = exporter;
        this.runContext = runContext;
        this.outputFile = outputFile;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        List<JournalLine> lines = runContext.getLines();
        exporter.export(lines, outputFile);
        contribution.incrementWriteCount(lines.size());
        chunkContext.getStepContext().getStepExecution().getJobExecution()
                .getExecutionContext().putInt(ENTRY_COUNT_KEY, lines.size());
        log.info("Journal with {} entries written to {}", lines.size(), outputFile.toAbsolutePath());
        return RepeatStatus.FINISHED;
    }
}

package com.projectedjournal.batchprocessor.batch;

import com.projectedjournal.batchprocessor.domain.JournalLine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ItemWriter;
import org.springframework.stereotype.Component;

/**
 * Collects journal lines into the run context. The workbook is written once, by the export step,
 * after every chunk has committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JournalLineWriter implements ItemWriter<JournalLine> {

    private final JournalRunContext runContext;

    @Override
    public void write(Chunk<? extends JournalLine> chunk) {
        runContext.addLines(chunk.getItems());
        log.debug("Buffered {} journal lines", chunk.size());
    }
}

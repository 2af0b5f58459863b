package com.projectedjournal.batchprocessor.batch;

import com.projectedjournal.batchprocessor.domain.InputBundle;
import com.projectedjournal.batchprocessor.domain.JournalLine;
import com.projectedjournal.cashgrid.canonical.CanonicalTransaction;
import org.springframework.batch.core.configuration.annotation.JobScope;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State shared by the steps of one job execution.
 *
 * <p>The prepared inputs are plain objects that do not belong in the persisted execution context,
 * so they live in this job-scoped bean instead. Each job execution gets a fresh instance, which also
 * restarts the journal sequence at 1.
 */
@Component
@JobScope
public class JournalRunContext {

    private InputBundle inputs;
    private LocalDate asOfDate;
    private LocalDateTime runTimestamp;
    private final AtomicInteger sequence = new AtomicInteger();
    private final List<JournalLine> lines = Collections.synchronizedList(new ArrayList<>());

    public void start(InputBundle inputs, LocalDate asOfDate, LocalDateTime runTimestamp) {
        this.inputs = inputs;
        this.asOfDate = asOfDate;
        this.runTimestamp = runTimestamp;
    }

    public InputBundle getInputs() {
        requireStarted();
        return inputs;
    }

    public LocalDate getAsOfDate() {
        requireStarted();
        return asOfDate;
    }

    public LocalDateTime getRunTimestamp() {
        requireStarted();
        return runTimestamp;
    }

    public int nextSequence() {
        return sequence.incrementAndGet();
    }

    /**
     * Opening balances in balance-sheet order, then AP/AR transactions by scheduled date. Ties keep
     * the order of the normalised grid.
     */
    public List<JournalSource> sources() {
        requireStarted();
        List<JournalSource> sources = new ArrayList<>();
        inputs.balanceSheet().forEach(entry -> sources.add(JournalSource.opening(entry)));
        inputs.cashGrid().rows().stream()
                .sorted(Comparator.comparing(CanonicalTransaction::scheduledDate))
                .forEach(txn -> sources.add(JournalSource.cash(txn)));
        return sources;
    }

    public void addLines(List<? extends JournalLine> written) {
        lines.addAll(written);
    }

    public List<JournalLine> getLines() {
        synchronized (lines) {
            return List.copyOf(lines);
        }
    }

    private void requireStarted() {
        if (inputs == null) {
            throw new IllegalStateException("Journal inputs have not been prepared for this job execution");
        }
    }
}

package com.projectedjournal.batchprocessor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Binds the {@code journal} section from application.yml.
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "journal")
public class JournalProperties {

    /** The only currency inputs may carry and the journal is written in. */
    @NotBlank
    private String currency = "USD";

    /** Length of the projection window, starting at the as-of date. */
    @Positive
    private int horizonWeeks = 13;

    /** GAAP control account that AP cash lines are posted to. */
    @NotBlank
    private String payableAccount = "2000";

    /** GAAP control account that AR cash lines are posted to. */
    @NotBlank
    private String receivableAccount = "1200";

    /** Cash-flow section for accounts absent from the cash-flow mapping. */
    @NotBlank
    private String unscheduledCashSection = "Unscheduled Cash";

    /** Fixes "today" for reproducible runs; the system clock is used when unset. */
    private LocalDate asOfDate;

    /** Upper bound on a single cash-grid normalisation. */
    @NotNull
    private Duration normalisationTimeout = Duration.ofSeconds(30);

    @Positive
    private int chunkSize = 100;

    @Valid
    private Inputs inputs = new Inputs();

    /**
     * Default workbook locations used when the REST trigger omits a path.
     */
    @Getter
    @Setter
    public static class Inputs {
        private String apGrid;
        /** Worksheet of the AP grid; first sheet when blank. */
        private String apSheet;
        private String balanceSheet;
        private String gaapMapping;
        private String cashflowMapping;
        private String outputFile;
    }
}

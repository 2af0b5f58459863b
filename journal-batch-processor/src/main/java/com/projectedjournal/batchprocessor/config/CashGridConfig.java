package com.projectedjournal.batchprocessor.config;

import com.projectedjournal.cashgrid.CashGridNormaliser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the cash-grid normaliser and the clock that defines "today" for a run.
 *
 * <p>Both the normaliser (wide-grid anchoring) and the journal (horizon, opening-balance date)
 * read the same {@link Clock}, so they always agree on the as-of date.
 */
@Slf4j
@Configuration
public class CashGridConfig {

    @Bean
    public Clock journalClock(JournalProperties properties) {
        if (properties.getAsOfDate() == null) {
            return Clock.systemDefaultZone();
        }
        ZoneId zone = ZoneId.systemDefault();
        log.info("Journal clock fixed at as-of date {}", properties.getAsOfDate());
        return Clock.fixed(properties.getAsOfDate().atStartOfDay(zone).toInstant(), zone);
    }

    @Bean
    public CashGridNormaliser cashGridNormaliser(Clock journalClock) {
        return new CashGridNormaliser(journalClock);
    }
}

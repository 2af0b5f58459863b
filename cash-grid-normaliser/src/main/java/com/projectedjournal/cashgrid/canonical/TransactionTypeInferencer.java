package com.projectedjournal.cashgrid.canonical;

import com.projectedjournal.cashgrid.layout.GridLine;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Labels every grid line as payable or receivable.
 *
 * <p>A sheet-name hint decides for the whole grid when it names a side: {@code payable} or the
 * whole token {@code ap} → AP, else {@code receivable} or the whole token {@code ar} → AR.
 * Without a usable hint each line is labelled by its sign: negative → AP, zero or positive → AR.
 */
@Slf4j
public class TransactionTypeInferencer {

    public List<GridLine> assign(List<GridLine> lines, String sheetHint) {
        Optional<TxnType> fromHint = fromSheetHint(sheetHint);
        if (fromHint.isPresent()) {
            log.info("Sheet '{}' marks all {} lines as {}", sheetHint, lines.size(), fromHint.get());
            lines.forEach(line -> line.setTxnType(fromHint.get()));
        } else {
            lines.forEach(line -> line.setTxnType(fromSign(line)));
            log.debug("No usable sheet hint ('{}') — transaction types inferred from amount sign", sheetHint);
        }
        return lines;
    }

    static Optional<TxnType> fromSheetHint(String sheetHint) {
        if (sheetHint == null || sheetHint.isBlank()) {
            return Optional.empty();
        }
        String lower = sheetHint.toLowerCase(Locale.ROOT);
        List<String> tokens = Arrays.asList(lower.split("[^a-z0-9]+"));
        if (lower.contains("payable") || tokens.contains("ap")) {
            return Optional.of(TxnType.AP);
        }
        if (lower.contains("receivable") || tokens.contains("ar")) {
            return Optional.of(TxnType.AR);
        }
        return Optional.empty();
    }

    private static TxnType fromSign(GridLine line) {
        return line.getAmount() != null && line.getAmount().signum() < 0 ? TxnType.AP : TxnType.AR;
    }
}

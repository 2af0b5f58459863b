package com.projectedjournal.batchprocessor.workbook;

import com.projectedjournal.batchprocessor.domain.JournalLine;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.util.AreaReference;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFTable;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Writes the projected journal to a single-sheet {@code .xlsx} workbook.
 *
 * <p>Layout: sheet {@value #SHEET_NAME}, bold centred header, frozen header row, column widths
 * fitted to content (at most {@value #MAX_COLUMN_CHARS} characters). When there is at least one
 * line the range is formatted as an Excel table.
 */
@Slf4j
@Component
public class JournalWorkbookExporter {

    public static final String SHEET_NAME = "Journal";
    static final String TABLE_STYLE = "TableStyleMedium9";
    static final int MAX_COLUMN_CHARS = 50;

    private static final String DATE_FORMAT = "yyyy-mm-dd";
    private static final String TIMESTAMP_FORMAT = "yyyy-mm-dd hh:mm:ss";
    private static final String AMOUNT_FORMAT = "#,##0.00";

    /**
     * Builds the workbook in a temporary file next to {@code outputFile} and moves it into place, so
     * a failed write never leaves a truncated workbook at the target path.
     */
    public void export(List<JournalLine> lines, Path outputFile) throws IOException {
        Path target = outputFile.toAbsolutePath();
        Path parent = target.getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, target.getFileName() + ".", ".tmp");
        try {
            write(lines, temp);
            moveIntoPlace(temp, target);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        log.info("Exported {} journal lines to {}", lines.size(), outputFile);
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private void write(List<JournalLine> lines, Path file) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            XSSFSheet sheet = workbook.createSheet(SHEET_NAME);
            Styles styles = new Styles(workbook);
            int[] widths = new int[JournalLine.COLUMNS.size()];

            XSSFRow header = sheet.createRow(0);
            for (int c = 0; c < JournalLine.COLUMNS.size(); c++) {
                String name = JournalLine.COLUMNS.get(c);
                XSSFCell cell = header.createCell(c);
                cell.setCellValue(name);
                cell.setCellStyle(styles.header);
                widths[c] = name.length();
            }

            for (int r = 0; r < lines.size(); r++) {
                XSSFRow row = sheet.createRow(r + 1);
                List<Object> values = lines.get(r).values();
                for (int c = 0; c < values.size(); c++) {
                    if (values.get(c) != null) {
                        widths[c] = Math.max(widths[c], writeCell(row.createCell(c), values.get(c), styles));
                    }
                }
            }

            sheet.createFreezePane(0, 1);
            for (int c = 0; c < widths.length; c++) {
                sheet.setColumnWidth(c, (Math.min(widths[c], MAX_COLUMN_CHARS) + 2) * 256);
            }
            if (!lines.isEmpty()) {
                addTable(sheet, lines.size());
            }

            try (OutputStream out = Files.newOutputStream(file)) {
                workbook.write(out);
            }
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /** Writes one value and returns its display width in characters. */
    private int writeCell(XSSFCell cell, Object value, Styles styles) {
        if (value instanceof BigDecimal amount) {
            cell.setCellValue(amount.doubleValue());
            cell.setCellStyle(styles.amount);
            return String.format("%,.2f", amount).length();
        }
        if (value instanceof LocalDateTime timestamp) {
            cell.setCellValue(timestamp);
            cell.setCellStyle(styles.timestamp);
            return TIMESTAMP_FORMAT.length();
        }
        if (value instanceof LocalDate date) {
            cell.setCellValue(date);
            cell.setCellStyle(styles.date);
            return DATE_FORMAT.length();
        }
        String text = value.toString();
        cell.setCellValue(text);
        return text.length();
    }

    private void addTable(XSSFSheet sheet, int lineCount) {
        AreaReference area = new AreaReference(
                new CellReference(0, 0),
                new CellReference(lineCount, JournalLine.COLUMNS.size() - 1),
                SpreadsheetVersion.EXCEL2007);
        XSSFTable table = sheet.createTable(area);
        table.setName("ProjectedJournal");
        table.setDisplayName("ProjectedJournal");
        table.setStyleName(TABLE_STYLE);
    }

    private static final class Styles {
        final CellStyle header;
        final CellStyle date;
        final CellStyle timestamp;
        final CellStyle amount;

        Styles(XSSFWorkbook workbook) {
            CreationHelper helper = workbook.getCreationHelper();

            Font bold = workbook.createFont();
            bold.setBold(true);
            header = workbook.createCellStyle();
            header.setFont(bold);
            header.setAlignment(HorizontalAlignment.CENTER);

            date = workbook.createCellStyle();
            date.setDataFormat(helper.createDataFormat().getFormat(DATE_FORMAT));

            timestamp = workbook.createCellStyle();
            timestamp.setDataFormat(helper.createDataFormat().getFormat(TIMESTAMP_FORMAT));

            amount = workbook.createCellStyle();
            amount.setDataFormat(helper.createDataFormat().getFormat(AMOUNT_FORMAT));
        }
    }
}

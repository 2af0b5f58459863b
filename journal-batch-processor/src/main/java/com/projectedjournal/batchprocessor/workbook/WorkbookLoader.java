package com.projectedjournal.batchprocessor.workbook;

import com.projectedjournal.batchprocessor.validation.InputSchemaException;
import com.projectedjournal.batchprocessor.validation.ValidationIssue;
import com.projectedjournal.cashgrid.grid.CellValues;
import com.projectedjournal.cashgrid.grid.RawGrid;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads one worksheet of an {@code .xlsx}/{@code .xls} workbook into a {@link RawGrid}.
 *
 * <ul>
 *   <li>The first row with any non-blank cell is the header; columns with a blank header are skipped.</li>
 *   <li>Data rows whose kept cells are all blank are skipped.</li>
 *   <li>Cells: text → trimmed string (blank → null), date-formatted numbers → {@code LocalDate},
 *       other numbers → {@code BigDecimal}, booleans → {@code Boolean}, formulas → cached result,
 *       errors → null.</li>
 * </ul>
 */
@Slf4j
@Component
public class WorkbookLoader {

    /**
     * @param sheetName worksheet to read; the first sheet when {@code null} or blank
     * @throws InputSchemaException if the file is missing or unreadable, the sheet does not exist,
     *                              or it has no header or no data rows
     */
    public LoadedSheet load(Path path, String sheetName) {
        String fileLabel = path.getFileName().toString();
        if (!Files.isRegularFile(path)) {
            throw new InputSchemaException(ValidationIssue.ofFile(fileLabel,
                    "Input file not found: " + path, "Check the path and file name."));
        }

        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            Sheet sheet = selectSheet(workbook, sheetName, fileLabel);
            LoadedSheet loaded = readSheet(sheet, fileLabel);
            log.info("Loaded '{}' sheet '{}' — {} data rows, columns {}",
                    fileLabel, sheet.getSheetName(), loaded.grid().getRowCount(), loaded.grid().getColumnNames());
            return loaded;
        } catch (IOException | EncryptedDocumentException | IllegalArgumentException e) {
            log.warn("Cannot read workbook '{}': {}", path, e.getMessage());
            throw new InputSchemaException(ValidationIssue.ofFile(fileLabel,
                    "Cannot read workbook: " + e.getMessage(), "Save the file as an unencrypted .xlsx workbook."));
        }
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private Sheet selectSheet(Workbook workbook, String sheetName, String fileLabel) {
        if (sheetName == null || sheetName.isBlank()) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new InputSchemaException(ValidationIssue.ofFile(fileLabel,
                        "Workbook has no worksheets", "Add a worksheet with a header row and data."));
            }
            return workbook.getSheetAt(0);
        }
        Sheet sheet = workbook.getSheet(sheetName);
        if (sheet == null) {
            List<String> available = new ArrayList<>();
            workbook.forEach(s -> available.add(s.getSheetName()));
            throw new InputSchemaException(ValidationIssue.ofFile(fileLabel,
                    "Worksheet '" + sheetName + "' not found", "Available worksheets: " + available));
        }
        return sheet;
    }

    private LoadedSheet readSheet(Sheet sheet, String fileLabel) {
        Row header = findHeaderRow(sheet);
        if (header == null) {
            throw new InputSchemaException(ValidationIssue.ofFile(fileLabel,
                    "Worksheet '" + sheet.getSheetName() + "' is empty", "Add a header row followed by data rows."));
        }

        List<Integer> columnIndexes = new ArrayList<>();
        List<String> columnNames = new ArrayList<>();
        for (int c = 0; c < header.getLastCellNum(); c++) {
            String name = CellValues.toText(cellValue(header.getCell(c)));
            if (name == null) {
                continue;
            }
            if (columnNames.contains(name)) {
                throw new InputSchemaException(new ValidationIssue(fileLabel, header.getRowNum() + 1,
                        "Duplicate column header '" + name + "'", "Give every column a unique header."));
            }
            columnIndexes.add(c);
            columnNames.add(name);
        }

        List<List<Object>> rows = new ArrayList<>();
        List<Integer> rowNumbers = new ArrayList<>();
        for (int r = header.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            List<Object> values = new ArrayList<>(columnIndexes.size());
            boolean blank = true;
            for (int c : columnIndexes) {
                Object value = cellValue(row.getCell(c));
                values.add(value);
                blank &= CellValues.isBlank(value);
            }
            if (!blank) {
                rows.add(values);
                rowNumbers.add(r + 1);
            }
        }

        if (rows.isEmpty()) {
            throw new InputSchemaException(ValidationIssue.ofFile(fileLabel,
                    "Worksheet '" + sheet.getSheetName() + "' has no data rows", "Add at least one data row below the header."));
        }
        return new LoadedSheet(fileLabel, sheet.getSheetName(), RawGrid.ofRows(columnNames, rows), rowNumbers);
    }

    private static Row findHeaderRow(Sheet sheet) {
        for (Row row : sheet) {
            for (Cell cell : row) {
                if (!CellValues.isBlank(cellValue(cell))) {
                    return row;
                }
            }
        }
        return null;
    }

    static Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case STRING -> {
                String text = cell.getStringCellValue().trim();
                yield text.isEmpty() ? null : text;
            }
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? cell.getLocalDateTimeCellValue().toLocalDate()
                    : BigDecimal.valueOf(cell.getNumericCellValue());
            case BOOLEAN -> cell.getBooleanCellValue();
            default -> null;
        };
    }
}

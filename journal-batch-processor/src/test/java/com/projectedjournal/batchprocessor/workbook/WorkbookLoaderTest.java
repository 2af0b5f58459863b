package com.projectedjournal.batchprocessor.workbook;

import com.projectedjournal.batchprocessor.WorkbookFixtures;
import com.projectedjournal.batchprocessor.validation.InputSchemaException;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static com.projectedjournal.batchprocessor.WorkbookFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkbookLoaderTest {

    private final WorkbookLoader loader = new WorkbookLoader();

    @TempDir Path dir;

    @Test
    @DisplayName("Cells map to String, BigDecimal, LocalDate and Boolean; blanks to null")
    void load_mapsCellTypes() throws Exception {
        Path file = WorkbookFixtures.write(dir.resolve("grid.xlsx"), "Data",
                List.of("Name", "Amount", "Due", "Paid"), List.of(
                        row("  Acme  ", 12.5, LocalDate.of(2025, 3, 1), true),
                        row("Globex", null, null, false)));

        LoadedSheet sheet = loader.load(file, null);

        assertThat(sheet.fileLabel()).isEqualTo("grid.xlsx");
        assertThat(sheet.sheetName()).isEqualTo("Data");
        assertThat(sheet.grid().getColumnNames()).containsExactly("Name", "Amount", "Due", "Paid");
        assertThat(sheet.grid().cell(0, "Name")).isEqualTo("Acme");
        assertThat((BigDecimal) sheet.grid().cell(0, "Amount")).isEqualByComparingTo("12.5");
        assertThat(sheet.grid().cell(0, "Due")).isEqualTo(LocalDate.of(2025, 3, 1));
        assertThat(sheet.grid().cell(0, "Paid")).isEqualTo(true);
        assertThat(sheet.grid().cell(1, "Amount")).isNull();
        assertThat(sheet.rowNumbers()).containsExactly(2, 3);
    }

    @Test
    @DisplayName("Header is the first non-blank row; blank rows and blank-header columns are skipped")
    void load_skipsLeadingBlankRowsAndBlankHeaders() throws Exception {
        Path file = dir.resolve("offset.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Grid");
            Row header = sheet.createRow(2);
            header.createCell(0).setCellValue("Vendor");
            header.createCell(2).setCellValue("Amount");
            Row first = sheet.createRow(3);
            first.createCell(0).setCellValue("Acme");
            first.createCell(1).setCellValue("ignored");
            first.createCell(2).setCellValue(10);
            sheet.createRow(4).createCell(0).setCellValue(" ");
            Row second = sheet.createRow(5);
            second.createCell(0).setCellValue("Globex");
            second.createCell(2).setCellValue(20);
            try (OutputStream out = Files.newOutputStream(file)) {
                workbook.write(out);
            }
        }

        LoadedSheet sheet = loader.load(file, null);

        assertThat(sheet.grid().getColumnNames()).containsExactly("Vendor", "Amount");
        assertThat(sheet.grid().getRowCount()).isEqualTo(2);
        assertThat(sheet.rowNumbers()).containsExactly(4, 6);
    }

    @Test
    void load_missingFile() {
        Path missing = dir.resolve("nope.xlsx");

        assertThatThrownBy(() -> loader.load(missing, null))
                .isInstanceOf(InputSchemaException.class)
                .satisfies(e -> assertThat(((InputSchemaException) e).getIssues()).singleElement()
                        .satisfies(issue -> assertThat(issue.issue()).isEqualTo("Input file not found: " + missing)));
    }

    @Test
    void load_notAWorkbook() throws Exception {
        Path file = Files.writeString(dir.resolve("text.xlsx"), "just text");

        assertThatThrownBy(() -> loader.load(file, null))
                .isInstanceOf(InputSchemaException.class)
                .hasMessageContaining("Cannot read workbook");
    }

    @Test
    void load_unknownSheetListsAvailableSheets() throws Exception {
        Path file = WorkbookFixtures.write(dir.resolve("grid.xlsx"), "Payables", List.of("A"), List.of(row("x")));

        assertThatThrownBy(() -> loader.load(file, "Receivables"))
                .isInstanceOf(InputSchemaException.class)
                .satisfies(e -> assertThat(((InputSchemaException) e).getIssues().get(0).hint()).contains("Payables"));
    }

    @Test
    void load_headerOnlySheetHasNoDataRows() throws Exception {
        Path file = WorkbookFixtures.write(dir.resolve("grid.xlsx"), "Empty", List.of("Date", "Amount"), List.of());

        assertThatThrownBy(() -> loader.load(file, null))
                .isInstanceOf(InputSchemaException.class)
                .hasMessageContaining("has no data rows");
    }

    @Test
    void load_duplicateHeader() throws Exception {
        Path file = WorkbookFixtures.write(dir.resolve("grid.xlsx"), "Dup", List.of("Amount", "Amount"), List.of(row(1, 2)));

        assertThatThrownBy(() -> loader.load(file, null))
                .isInstanceOf(InputSchemaException.class)
                .hasMessageContaining("Duplicate column header 'Amount'");
    }
}

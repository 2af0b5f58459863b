package com.projectedjournal.batchprocessor.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectedjournal.batchprocessor.validation.InputSchemaException;
import com.projectedjournal.batchprocessor.validation.MappingConflictException;
import com.projectedjournal.batchprocessor.validation.ValidationIssue;
import com.projectedjournal.cashgrid.GridSchemaException;
import com.projectedjournal.cashgrid.UnsupportedGridFormatException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorReportFactoryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ErrorReportFactory factory = new ErrorReportFactory(objectMapper);

    @Test
    void schemaIssues_keepFileRowAndHint() {
        InputSchemaException failure = new InputSchemaException(List.of(
                new ValidationIssue("bs.xlsx", 3, "Balance 'x' is not a number", "Enter a number"),
                ValidationIssue.ofFile("bs.xlsx", "Balance sheet does not balance", "Check totals")));

        ErrorReport report = factory.fromFailure(failure, "AP Cash Grid.xlsx");

        assertThat(report.status()).isEqualTo("error");
        assertThat(report.errors()).containsExactly(
                new ErrorReport.Entry("SchemaError", "bs.xlsx", 3, "Balance 'x' is not a number", "Enter a number"),
                new ErrorReport.Entry("SchemaError", "bs.xlsx", null, "Balance sheet does not balance", "Check totals"));
    }

    @Test
    void wrappedFailures_areUnwrapped() {
        RuntimeException wrapped = new RuntimeException("step failed",
                new MappingConflictException(List.of(new ValidationIssue("bs.xlsx", 5, "GAAPAccount 3000 missing in mapping", "Add it"))));

        ErrorReport report = factory.fromFailure(wrapped, "AP Cash Grid.xlsx");

        assertThat(report.errors()).singleElement()
                .satisfies(entry -> assertThat(entry.type()).isEqualTo("MappingConflict"));
    }

    @Test
    void gridFailures_areReportedAgainstTheApGrid() {
        ErrorReport report = factory.fromFailures(List.of(
                new UnsupportedGridFormatException("Unsupported AP Cash Grid format"),
                new GridSchemaException("Cannot normalise an empty AP Cash Grid")), "AP Cash Grid.xlsx");

        assertThat(report.errors()).extracting(ErrorReport.Entry::type, ErrorReport.Entry::file)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple("UnsupportedGridFormat", "AP Cash Grid.xlsx"),
                        org.assertj.core.groups.Tuple.tuple("SchemaError", "AP Cash Grid.xlsx"));
    }

    @Test
    void unknownFailure_isUnexpectedErrorWithRootMessage() {
        Exception failure = new IllegalStateException("wrapper", new TimeoutException("TimeLimiter 'cashGridNormaliser' recorded a timeout"));

        ErrorReport report = factory.fromFailure(failure, "AP Cash Grid.xlsx");

        assertThat(report.errors()).singleElement().satisfies(entry -> {
            assertThat(entry.type()).isEqualTo("UnexpectedError");
            assertThat(entry.issue()).contains("timeout");
            assertThat(entry.hint()).contains("--verbose");
        });
    }

    @Test
    void toJson_matchesReportShape() throws Exception {
        String json = factory.toJson(factory.fromIssues(ErrorType.SchemaError,
                List.of(ValidationIssue.ofFile("a.xlsx", "Input file not found: a.xlsx", "Check the path"))));

        JsonNode node = objectMapper.readTree(json);
        assertThat(node.get("status").asText()).isEqualTo("error");
        JsonNode entry = node.get("errors").get(0);
        assertThat(entry.get("type").asText()).isEqualTo("SchemaError");
        assertThat(entry.get("file").asText()).isEqualTo("a.xlsx");
        assertThat(entry.get("row").isNull()).isTrue();
        assertThat(entry.get("issue").asText()).isEqualTo("Input file not found: a.xlsx");
        assertThat(entry.get("hint").asText()).isEqualTo("Check the path");
    }
}

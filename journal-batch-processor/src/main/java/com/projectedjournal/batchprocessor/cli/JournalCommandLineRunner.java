package com.projectedjournal.batchprocessor.cli;

import com.projectedjournal.batchprocessor.batch.JournalExportTasklet;
import com.projectedjournal.batchprocessor.report.ErrorReport;
import com.projectedjournal.batchprocessor.report.ErrorReportFactory;
import com.projectedjournal.batchprocessor.report.ErrorType;
import com.projectedjournal.batchprocessor.validation.ValidationIssue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One-shot command-line mode.
 *
 * <pre>
 *   java -jar journal-batch-processor.jar \
 *     --ap-grid "data/AP Cash Grid.xlsx" --bs "data/Beginning Balance Sheet.xlsx" \
 *     --gaap-map "data/GAAP Mapping.xlsx" --cf-map "data/Cashflow Mapping.xlsx" \
 *     --out out/Projected_Journal.xlsx [--ap-sheet Payables] [--verbose]
 * </pre>
 *
 * Options take their value either as the next argument or after {@code =}. The job runs on Boot's
 * synchronous {@link JobLauncher}; the exit code is 0 on success and 1 on any failure, with a JSON
 * {@link ErrorReport} on stderr. Does nothing when the application is started as a web service.
 */
@Slf4j
@Component
public class JournalCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String AP_GRID = "ap-grid";
    static final String AP_SHEET = "ap-sheet";
    static final String BALANCE_SHEET = "bs";
    static final String GAAP_MAP = "gaap-map";
    static final String CASHFLOW_MAP = "cf-map";
    static final String OUT = "out";
    static final String VERBOSE = "verbose";
    static final String HELP = "help";

    static final String USAGE = """
            Generate projected journal from input workbooks

            Options:
              --ap-grid <path>    Path to AP Cash Grid.xlsx
              --ap-sheet <name>   Worksheet of the AP Cash Grid (default: first sheet)
              --bs <path>         Path to Beginning Balance Sheet.xlsx
              --gaap-map <path>   Path to GAAP Mapping.xlsx
              --cf-map <path>     Path to Cashflow Mapping.xlsx
              --out <path>        Output path for generated Projected_Journal.xlsx
              --verbose           Enable verbose logging
              --help              Show this message
            """;

    private final JobLauncher jobLauncher;
    private final Job projectedJournalJob;
    private final ErrorReportFactory errorReportFactory;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = 0;

    @Autowired
    public JournalCommandLineRunner(JobLauncher jobLauncher, Job projectedJournalJob,
                                    ErrorReportFactory errorReportFactory) {
        this(jobLauncher, projectedJournalJob, errorReportFactory, System.out, System.err);
    }

    JournalCommandLineRunner(JobLauncher jobLauncher, Job projectedJournalJob, ErrorReportFactory errorReportFactory,
                             PrintStream out, PrintStream err) {
        this.jobLauncher = jobLauncher;
        this.projectedJournalJob = projectedJournalJob;
        this.errorReportFactory = errorReportFactory;
        this.out = out;
        this.err = err;
    }

    // ─── entry-point helpers ─────────────────────────────────────────────────

    public static boolean isCommandLineMode(String[] args) {
        Map<String, String> options = parseOptions(args);
        return options.containsKey(AP_GRID) || options.containsKey(HELP);
    }

    /**
     * Appends the logging defaults of command-line mode: application logs at WARN, or INFO with
     * {@code --verbose}, and no banner. Appended last so they win over application.yml.
     */
    public static String[] withCliDefaults(String[] args) {
        String appLevel = parseOptions(args).containsKey(VERBOSE) ? "INFO" : "WARN";
        List<String> all = new ArrayList<>(Arrays.asList(args));
        all.add("--logging.level.root=WARN");
        all.add("--logging.level.com.projectedjournal=" + appLevel);
        all.add("--spring.main.banner-mode=off");
        return all.toArray(new String[0]);
    }

    /**
     * Parses {@code --name value}, {@code --name=value} and bare {@code --flag} options. Arguments
     * not starting with {@code --} that do not follow an option are ignored.
     */
    static Map<String, String> parseOptions(String[] args) {
        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                continue;
            }
            String body = arg.substring(2);
            int eq = body.indexOf('=');
            if (eq >= 0) {
                options.put(body.substring(0, eq), body.substring(eq + 1));
            } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                options.put(body, args[++i]);
            } else {
                options.put(body, "");
            }
        }
        return options;
    }

    // ─── ApplicationRunner ───────────────────────────────────────────────────

    @Override
    public void run(ApplicationArguments args) {
        String[] sourceArgs = args.getSourceArgs();
        if (!isCommandLineMode(sourceArgs)) {
            return;
        }
        Map<String, String> options = parseOptions(sourceArgs);
        if (options.containsKey(HELP)) {
            out.print(USAGE);
            return;
        }

        List<ValidationIssue> issues = checkInputs(options);
        if (!issues.isEmpty()) {
            fail(errorReportFactory.fromIssues(ErrorType.SchemaError, issues));
            return;
        }

        String apGrid = options.get(AP_GRID);
        String outputFile = options.get(OUT);
        JobParametersBuilder params = new JobParametersBuilder()
                .addString("apGrid", apGrid)
                .addString("balanceSheet", options.get(BALANCE_SHEET))
                .addString("gaapMapping", options.get(GAAP_MAP))
                .addString("cashflowMapping", options.get(CASHFLOW_MAP))
                .addString("outputFile", outputFile)
                .addLong("startedAt", Instant.now().toEpochMilli());
        String apSheet = options.get(AP_SHEET);
        if (apSheet != null && !apSheet.isBlank()) {
            params.addString("apSheet", apSheet);
        }

        String apGridLabel = Path.of(apGrid).getFileName().toString();
        try {
            JobExecution execution = jobLauncher.run(projectedJournalJob, params.toJobParameters());
            if (execution.getStatus() == BatchStatus.COMPLETED) {
                int entries = execution.getExecutionContext().getInt(JournalExportTasklet.ENTRY_COUNT_KEY, 0);
                out.println("Successfully generated journal: " + outputFile);
                out.println("Journal contains " + entries + " entries");
            } else {
                log.error("Journal job ended with status {}", execution.getStatus());
                fail(errorReportFactory.fromFailures(execution.getAllFailureExceptions(), apGridLabel));
            }
        } catch (Exception e) {
            log.error("Failed to run journal job: {}", e.getMessage(), e);
            fail(errorReportFactory.fromFailure(e, apGridLabel));
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private List<ValidationIssue> checkInputs(Map<String, String> options) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (String name : List.of(AP_GRID, BALANCE_SHEET, GAAP_MAP, CASHFLOW_MAP, OUT)) {
            String value = options.get(name);
            if (value == null || value.isBlank()) {
                issues.add(ValidationIssue.ofFile(null, "Missing required option --" + name,
                        "Run with --help to list the options"));
            } else if (!OUT.equals(name) && !Files.exists(Path.of(value))) {
                issues.add(ValidationIssue.ofFile(Path.of(value).getFileName().toString(),
                        "Input file not found: " + value, "Check the path passed to --" + name));
            }
        }
        return issues;
    }

    private void fail(ErrorReport report) {
        err.println(errorReportFactory.toJson(report));
        exitCode = 1;
    }
}

package com.projectedjournal.batchprocessor.service;

import com.projectedjournal.batchprocessor.config.Resilience4jConfig;
import com.projectedjournal.batchprocessor.domain.BalanceSheetEntry;
import com.projectedjournal.batchprocessor.domain.CashflowMapping;
import com.projectedjournal.batchprocessor.domain.GaapMapping;
import com.projectedjournal.batchprocessor.domain.InputBundle;
import com.projectedjournal.batchprocessor.validation.BalanceSheetValidator;
import com.projectedjournal.batchprocessor.validation.CashflowMappingValidator;
import com.projectedjournal.batchprocessor.validation.GaapMappingValidator;
import com.projectedjournal.batchprocessor.validation.MappingCoverageValidator;
import com.projectedjournal.batchprocessor.workbook.LoadedSheet;
import com.projectedjournal.batchprocessor.workbook.WorkbookLoader;
import com.projectedjournal.cashgrid.CashGridNormaliser;
import com.projectedjournal.cashgrid.canonical.CanonicalTable;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Loads, validates and normalises the four input workbooks of a run.
 *
 * <h3>Order</h3>
 * <ol>
 *   <li>Balance sheet, GAAP mapping and cash-flow mapping are loaded and validated against their
 *       fixed schemas.</li>
 *   <li>GAAP coverage of the balance sheet and the control accounts is checked.</li>
 *   <li>The AP/AR grid is loaded and normalised on the normalisation pool, bounded by the
 *       {@code cashGridNormaliser} {@link TimeLimiter}. The worksheet name is passed as the AP/AR
 *       hint.</li>
 * </ol>
 * The first failing stage ends the run; its exception propagates unchanged.
 */
@Slf4j
@Service
public class JournalInputService {

    private final WorkbookLoader workbookLoader;
    private final BalanceSheetValidator balanceSheetValidator;
    private final GaapMappingValidator gaapMappingValidator;
    private final CashflowMappingValidator cashflowMappingValidator;
    private final MappingCoverageValidator coverageValidator;
    private final CashGridNormaliser normaliser;
    private final TimeLimiter timeLimiter;
    private final ExecutorService normalisationExecutor;

    public JournalInputService(
            WorkbookLoader workbookLoader,
            BalanceSheetValidator balanceSheetValidator,
            GaapMappingValidator gaapMappingValidator,
            CashflowMappingValidator cashflowMappingValidator,
            MappingCoverageValidator coverageValidator,
            CashGridNormaliser normaliser,
            @Qualifier(Resilience4jConfig.CASH_GRID_NORMALISER) TimeLimiter timeLimiter,
            @Qualifier("normalisationExecutor") ExecutorService normalisationExecutor) {
        this.workbookLoader = workbookLoader;
        this.balanceSheetValidator = balanceSheetValidator;
        this.gaapMappingValidator = gaapMappingValidator;
        this.cashflowMappingValidator = cashflowMappingValidator;
        this.coverageValidator = coverageValidator;
        this.normaliser = normaliser;
        this.timeLimiter = timeLimiter;
        this.normalisationExecutor = normalisationExecutor;
    }

    /**
     * @param asOfDate the run's as-of date; wide AP/AR grids are anchored to it
     * @throws com.projectedjournal.batchprocessor.validation.JournalValidationException for invalid workbooks
     * @throws com.projectedjournal.cashgrid.CashGridException                           if the AP/AR grid cannot be normalised
     * @throws java.util.concurrent.TimeoutException                                     if normalisation exceeds its time limit
     */
    public InputBundle prepare(InputPaths paths, LocalDate asOfDate) throws Exception {
        LoadedSheet balanceSheetSheet = workbookLoader.load(paths.balanceSheet(), null);
        LoadedSheet gaapSheet = workbookLoader.load(paths.gaapMapping(), null);
        LoadedSheet cashflowSheet = workbookLoader.load(paths.cashflowMapping(), null);

        List<BalanceSheetEntry> balanceSheet = balanceSheetValidator.validate(balanceSheetSheet);
        Map<String, GaapMapping> gaapMappings = gaapMappingValidator.validate(gaapSheet);
        Map<String, CashflowMapping> cashflowMappings = cashflowMappingValidator.validate(cashflowSheet);
        coverageValidator.check(balanceSheet, balanceSheetSheet.fileLabel(),
                gaapMappings, gaapSheet.fileLabel(), cashflowMappings);

        LoadedSheet apSheet = workbookLoader.load(paths.apGrid(), paths.apSheet());
        CanonicalTable cashGrid = timeLimiter.executeFutureSupplier(() -> normalisationExecutor.submit(
                () -> normaliser.normalise(apSheet.grid(), apSheet.sheetName(), asOfDate)));

        log.info("Inputs ready — {} balance lines, {} GAAP accounts, {} cash-flow accounts, {} AP/AR transactions",
                balanceSheet.size(), gaapMappings.size(), cashflowMappings.size(), cashGrid.size());
        return new InputBundle(balanceSheet, gaapMappings, cashflowMappings, cashGrid);
    }
}

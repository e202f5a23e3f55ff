package com.example.sheetconsolidator.service;

import com.example.sheetconsolidator.config.ConsolidatorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one consolidation: resolves the sheet range, reads and transforms each target sheet in
 * order, tags rows with their sheet, concatenates them and writes the result. A sheet that fails
 * is skipped; failures before the first sheet or while writing end the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SheetConsolidationService {
    private final WorkbookIo workbookIo;
    private final SheetRangeParser rangeParser;
    private final ColumnTransformer columnTransformer;
    private final ConsolidatorProperties properties;

    public ConsolidationResult consolidate(ConsolidationRequest request) {
        return consolidate(request, ConsolidationListener.NONE, new CancellationToken());
    }

    public ConsolidationResult consolidate(ConsolidationRequest request,
                                           ConsolidationListener listener,
                                           CancellationToken cancellation) {
        listener.onStateChanged(ConsolidationState.IDLE);
        try {
            ConsolidationResult result = run(request, listener, cancellation);
            listener.onStateChanged(ConsolidationState.DONE);
            return result;
        } catch (ConsolidationInterruptedException e) {
            listener.onStateChanged(ConsolidationState.INTERRUPTED);
            throw e;
        } catch (RuntimeException e) {
            listener.onStateChanged(ConsolidationState.FAILED);
            throw e;
        }
    }

    private ConsolidationResult run(ConsolidationRequest request,
                                    ConsolidationListener listener,
                                    CancellationToken cancellation) {
        listener.onStateChanged(ConsolidationState.VALIDATING);
        validateFiles(request.inputFile(), request.outputFile());

        listener.onStateChanged(ConsolidationState.RANGE_RESOLVING);
        List<String> sheetNames = workbookIo.listSheetNames(request.inputFile());
        List<Integer> targets = rangeParser.parse(request.sheetRange(), sheetNames.size());
        List<String> targetNames = targets.stream().map(sheetNames::get).toList();
        log.info("Processing {} of {} sheets from {}", targetNames.size(), sheetNames.size(), request.inputFile());
        listener.onSheetsResolved(sheetNames.size(), targetNames);

        listener.onStateChanged(ConsolidationState.PROCESSING);
        List<SheetTable> tables = new ArrayList<>();
        List<String> processed = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<ConsolidationIssue> issues = new ArrayList<>();
        for (int i = 0; i < targetNames.size(); i++) {
            checkCancelled(cancellation, processed.size(), targetNames.size());
            String sheetName = targetNames.get(i);
            try {
                SheetTable table = workbookIo.readSheet(request.inputFile(), sheetName);
                if (!request.columnConfig().isEmpty()) {
                    columnTransformer.apply(table, request.columnConfig(), sheetName, issues);
                }
                table.fillColumn(properties.getSourceColumn(), sheetName);
                tables.add(table);
                processed.add(sheetName);
                listener.onSheetProcessed(i + 1, targetNames.size(), sheetName, table.rowCount());
            } catch (RuntimeException e) {
                log.warn("Failed to process sheet '{}': {}", sheetName, e.getMessage());
                log.debug("Sheet failure", e);
                failed.add(sheetName);
                issues.add(new ConsolidationIssue(sheetName, null, "Failed to process sheet: " + e.getMessage()));
                listener.onSheetFailed(i + 1, targetNames.size(), sheetName, e);
            }
        }

        checkCancelled(cancellation, processed.size(), targetNames.size());
        listener.onStateChanged(ConsolidationState.COMBINING);
        if (tables.isEmpty()) {
            throw new NoDataProcessedException(targetNames.size());
        }
        listener.onCombining(tables.size());
        SheetTable combined = SheetTable.concat(tables);

        checkCancelled(cancellation, processed.size(), targetNames.size());
        listener.onStateChanged(ConsolidationState.WRITING);
        listener.onWriting(request.outputFile());
        workbookIo.writeTable(combined, request.outputFile(), properties.getOutputSheetName());
        log.info("Consolidated {} rows from {} sheets into {}", combined.rowCount(), processed.size(), request.outputFile());

        return new ConsolidationResult(
                request.outputFile(),
                List.copyOf(processed),
                List.copyOf(failed),
                combined.rowCount(),
                combined.columns(),
                List.copyOf(issues)
        );
    }

    private void checkCancelled(CancellationToken cancellation, int processedSheets, int targetedSheets) {
        if (cancellation.isCancelled()) {
            throw new ConsolidationInterruptedException(processedSheets, targetedSheets);
        }
    }

    private void validateFiles(Path inputFile, Path outputFile) {
        if (!Files.exists(inputFile)) {
            throw new InputNotFoundException(inputFile);
        }
        Path outputDirectory = outputFile.toAbsolutePath().getParent();
        if (outputDirectory != null && !Files.isDirectory(outputDirectory)) {
            try {
                Files.createDirectories(outputDirectory);
            } catch (IOException e) {
                throw new OutputWriteException("Cannot create output directory " + outputDirectory + ": " + e.getMessage(), e);
            }
        }
    }
}

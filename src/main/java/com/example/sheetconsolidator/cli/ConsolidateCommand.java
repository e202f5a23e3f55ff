package com.example.sheetconsolidator.cli;

import com.example.sheetconsolidator.service.ColumnConfig;
import com.example.sheetconsolidator.service.ColumnConfigLoader;
import com.example.sheetconsolidator.service.ConfigTemplateGenerator;
import com.example.sheetconsolidator.service.ConsolidationException;
import com.example.sheetconsolidator.service.ConsolidationInterruptedException;
import com.example.sheetconsolidator.service.ConsolidationRequest;
import com.example.sheetconsolidator.service.ConsolidationResult;
import com.example.sheetconsolidator.service.SheetConsolidationService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Component
@RequiredArgsConstructor
@Command(
        name = "sheet-consolidator",
        description = "Consolidates a range of sheets from an Excel workbook into a single sheet.",
        mixinStandardHelpOptions = true,
        version = "sheet-consolidator 0.0.1",
        exitCodeOnInvalidInput = 1,
        exitCodeOnExecutionException = 1,
        footer = {
                "",
                "Examples:",
                "  sheet-consolidator input.xlsx output.xlsx 1-5",
                "  sheet-consolidator data.xlsx consolidated.xlsx 1,3,5,7 --config columns.json",
                "  sheet-consolidator input.xlsx output.xlsx 1-3 --create-template",
                "",
                "Column configuration JSON:",
                "  { \"Name\": { \"word_count\": true, \"dtype\": \"string\" } }",
                "Supported dtypes: string, int, float, bool, date, category"
        }
)
public class ConsolidateCommand implements Callable<Integer> {
    private final SheetConsolidationService consolidationService;
    private final ConfigTemplateGenerator templateGenerator;
    private final ColumnConfigLoader configLoader;
    private final InterruptHandler interruptHandler;
    private final FileOpener fileOpener;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "input_file", description = "Path to the input Excel file")
    Path inputFile;

    @Parameters(index = "1", paramLabel = "output_file", description = "Path to the output Excel file")
    Path outputFile;

    @Parameters(index = "2", paramLabel = "sheet_range", description = "Sheet range, e.g. 1-5 or 1,3,5")
    String sheetRange;

    @Option(names = "--config", paramLabel = "<path>", description = "Column configuration JSON file")
    Path configFile;

    @Option(names = "--create-template", description = "Create a column configuration template and exit")
    boolean createTemplate;

    @Option(names = "--no-open", description = "Don't open the output file after completion")
    boolean noOpen;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            if (createTemplate) {
                Path template = interruptHandler.runInterruptibly(
                        token -> templateGenerator.createTemplate(inputFile, sheetRange));
                out.println("Created column configuration template: " + template);
                out.println("Edit this file and use it with --config option");
                out.flush();
                return 0;
            }

            ConsoleProgressReporter reporter = new ConsoleProgressReporter(out);
            ConsolidationResult result = interruptHandler.runInterruptibly(token -> {
                ColumnConfig config = ColumnConfig.empty();
                if (configFile != null) {
                    config = configLoader.load(configFile);
                    reporter.printColumnConfig(configFile, config);
                }
                ConsolidationRequest request = new ConsolidationRequest(inputFile, outputFile, sheetRange, config);
                reporter.printHeader(request);
                return consolidationService.consolidate(request, reporter, token);
            });

            out.println();
            out.println("SUCCESS!");
            out.println("Consolidated " + result.processedSheets().size() + " sheets (" + result.rowCount()
                    + " rows) into: " + result.outputFile());
            if (!result.failedSheets().isEmpty()) {
                out.println("Skipped sheets: " + String.join(", ", result.failedSheets()));
            }
            if (noOpen) {
                out.println("Output saved to: " + result.outputFile());
            } else {
                fileOpener.open(result.outputFile(), out);
            }
            out.flush();
            return 0;
        } catch (ConsolidationInterruptedException e) {
            err.println();
            err.println(e.getMessage());
            err.flush();
            return 1;
        } catch (ConsolidationException e) {
            err.println();
            err.println("ERROR: " + e.getMessage());
            err.println("FAILED!");
            err.flush();
            return 1;
        }
    }
}

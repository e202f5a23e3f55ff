package com.example.sheetconsolidator.service;

import com.example.sheetconsolidator.config.ConsolidatorProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a column configuration skeleton listing every column of the first sheet in a range.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfigTemplateGenerator {
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final WorkbookIo workbookIo;
    private final SheetRangeParser rangeParser;
    private final ObjectMapper objectMapper;
    private final ConsolidatorProperties properties;
    private final Clock clock;

    /**
     * @return the written template file
     */
    public Path createTemplate(Path inputFile, String sheetRange) {
        if (!Files.exists(inputFile)) {
            throw new InputNotFoundException(inputFile);
        }
        List<String> sheetNames = workbookIo.listSheetNames(inputFile);
        if (sheetNames.isEmpty()) {
            throw new WorkbookReadException("Workbook " + inputFile + " contains no sheets");
        }
        List<Integer> targets = rangeParser.parse(sheetRange, sheetNames.size());
        String sampleSheet = sheetNames.get(targets.get(0));
        SheetTable sample = workbookIo.readSheet(inputFile, sampleSheet, properties.getTemplateSampleRows());

        Map<String, ColumnSpec> template = new LinkedHashMap<>();
        for (String column : sample.columns()) {
            template.put(column, ColumnSpec.template(column));
        }

        Path templateFile = properties.getTemplateDirectory()
                .resolve("column_config_template_" + LocalDateTime.now(clock).format(FILE_TIMESTAMP) + ".json");
        try {
            Files.createDirectories(properties.getTemplateDirectory());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(templateFile.toFile(), template);
        } catch (IOException e) {
            throw new OutputWriteException("Failed to write config template " + templateFile + ": " + e.getMessage(), e);
        }
        log.info("Created template for {} columns of sheet '{}' at {}", template.size(), sampleSheet, templateFile);
        return templateFile;
    }
}

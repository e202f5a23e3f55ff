package com.example.sheetconsolidator.service;

import com.example.sheetconsolidator.config.ConsolidatorProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigTemplateGeneratorTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ConfigTemplateGenerator generator;
    private Path templateDir;

    @BeforeEach
    void setUp() {
        templateDir = tempDir.resolve("templates");
        ConsolidatorProperties properties = new ConsolidatorProperties();
        properties.setTemplateDirectory(templateDir);
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T09:30:15Z"), ZoneOffset.UTC);
        generator = new ConfigTemplateGenerator(new WorkbookIo(), new SheetRangeParser(), objectMapper, properties, clock);
    }

    @Test
    void writesOneEntryPerColumnOfFirstTargetSheet() throws IOException {
        Map<String, List<List<Object>>> sheets = new LinkedHashMap<>();
        sheets.put("Skipped", List.of(List.of("X", "Y", "Z"), List.of(1, 2, 3)));
        sheets.put("Sampled", List.of(List.of("A", "B"), List.of("a", "b")));
        Path input = TestWorkbooks.create(tempDir.resolve("in.xlsx"), sheets);

        Path template = generator.createTemplate(input, "2,1");

        assertThat(template).isEqualTo(templateDir.resolve("column_config_template_20240601_093015.json"));
        JsonNode root = objectMapper.readTree(template.toFile());
        assertThat(root.fieldNames()).toIterable().containsExactly("A", "B");
        assertThat(root.get("A")).isEqualTo(objectMapper.readTree(
                "{\"word_count\": false, \"dtype\": \"auto\", \"description\": \"Column: A\"}"));
        assertThat(root.get("B").get("description").asText()).isEqualTo("Column: B");
    }

    @Test
    void templateLoadsAsConfigWithoutTransforms() throws IOException {
        Path input = TestWorkbooks.create(tempDir.resolve("in.xlsx"), Map.of("Only", TestWorkbooks.namedRows("Only", 20)));

        Path template = generator.createTemplate(input, "1");
        ColumnConfig config = new ColumnConfigLoader(objectMapper).load(template);

        assertThat(config.columns().keySet()).containsExactly("Name", "Amount");
        assertThat(config.columns().values()).noneMatch(ColumnSpec::hasTransform);
    }

    @Test
    void unreadableWorkbookFails() throws IOException {
        Path input = Files.writeString(tempDir.resolve("broken.xlsx"), "not a workbook");

        assertThatThrownBy(() -> generator.createTemplate(input, "1"))
                .isInstanceOf(WorkbookReadException.class);
        assertThat(templateDir).doesNotExist();
    }

    @Test
    void invalidRangeFails() throws IOException {
        Path input = TestWorkbooks.create(tempDir.resolve("in.xlsx"), Map.of("Only", TestWorkbooks.namedRows("Only", 1)));

        assertThatThrownBy(() -> generator.createTemplate(input, "2-3"))
                .isInstanceOf(InvalidRangeException.class);
    }
}

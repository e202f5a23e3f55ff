package com.example.sheetconsolidator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads and validates a column configuration file. The whole file is checked up front so that a
 * malformed entry fails the run before any sheet is read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ColumnConfigLoader {
    private final ObjectMapper objectMapper;

    public ColumnConfig load(Path configFile) {
        JsonNode root;
        try (InputStream input = Files.newInputStream(configFile)) {
            root = objectMapper.readTree(input);
        } catch (NoSuchFileException e) {
            throw new ConfigLoadException("Column config file not found: " + configFile, e);
        } catch (JsonProcessingException e) {
            throw new ConfigLoadException("Invalid JSON in config file " + configFile + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigLoadException("Error loading config file " + configFile + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigLoadException("Config file " + configFile + " must contain a JSON object of columns");
        }

        Map<String, ColumnSpec> columns = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            columns.put(field.getKey(), toSpec(configFile, field.getKey(), field.getValue()));
        }
        log.info("Loaded column configuration from {} ({} columns)", configFile, columns.size());
        return new ColumnConfig(columns);
    }

    private ColumnSpec toSpec(Path configFile, String column, JsonNode node) {
        if (!node.isObject()) {
            throw invalid(configFile, column, "entry must be an object");
        }
        JsonNode wordCount = node.get("word_count");
        if (wordCount != null && !wordCount.isNull() && !wordCount.isBoolean()) {
            throw invalid(configFile, column, "'word_count' must be true or false");
        }
        String dtype = optionalText(configFile, column, node, "dtype");
        String description = optionalText(configFile, column, node, "description");
        if (dtype != null && !dtype.isBlank() && ColumnDtype.fromToken(dtype).isEmpty()) {
            log.warn("Unrecognized dtype '{}' for column '{}'; the column will be left unchanged", dtype, column);
        }
        return new ColumnSpec(wordCount != null && wordCount.asBoolean(), dtype, description);
    }

    private String optionalText(Path configFile, String column, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw invalid(configFile, column, "'" + field + "' must be a string");
        }
        return value.asText();
    }

    private ConfigLoadException invalid(Path configFile, String column, String reason) {
        return new ConfigLoadException("Invalid entry for column '" + column + "' in " + configFile + ": " + reason);
    }
}

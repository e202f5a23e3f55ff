package com.example.sheetconsolidator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings bound from the {@code consolidator.*} keys of {@code application.yml}.
 */
@Data
@ConfigurationProperties(prefix = "consolidator")
public class ConsolidatorProperties {
    /** Name of the single sheet in the output workbook. */
    private String outputSheetName = "Consolidated_Data";
    /** Column recording which input sheet a row came from. */
    private String sourceColumn = "_Source_Sheet";
    /** Data rows read from the sampled sheet when generating a template. */
    private int templateSampleRows = 5;
    /** Directory configuration templates are written to. */
    private Path templateDirectory = Path.of(".");
    /** How long an interrupt waits for the current sheet to finish before the process exits. */
    private Duration interruptGracePeriod = Duration.ofSeconds(30);
}

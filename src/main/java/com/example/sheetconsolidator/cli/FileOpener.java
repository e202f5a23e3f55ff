package com.example.sheetconsolidator.cli;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Opens a file with the operating system's default application. Failing to do so is reported and
 * otherwise ignored.
 */
@Slf4j
@Component
public class FileOpener {

    public void open(Path file, PrintWriter out) {
        try {
            new ProcessBuilder(openCommand(file.toAbsolutePath().toString())).inheritIO().start();
            out.println("Opening output file...");
        } catch (IOException | RuntimeException e) {
            log.debug("Could not open {}", file, e);
            out.println("Note: Could not open file automatically: " + e.getMessage());
            out.println("File saved at: " + file.toAbsolutePath());
        }
    }

    List<String> openCommand(String path) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return List.of("rundll32", "url.dll,FileProtocolHandler", path);
        }
        if (os.contains("mac")) {
            return List.of("open", path);
        }
        return List.of("xdg-open", path);
    }
}

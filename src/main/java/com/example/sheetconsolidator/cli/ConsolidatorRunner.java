package com.example.sheetconsolidator.cli;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

@Component
@RequiredArgsConstructor
public class ConsolidatorRunner implements CommandLineRunner, ExitCodeGenerator {
    private final ConsolidateCommand command;

    private int exitCode;

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(command).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

package com.example.sheetconsolidator.cli;

import com.example.sheetconsolidator.config.ConsolidatorProperties;
import com.example.sheetconsolidator.service.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Function;

/**
 * Turns Ctrl+C into a cancellation request. While a task runs, a shutdown hook cancels its token,
 * waits for it to stop at the next sheet boundary and exits with status 1.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InterruptHandler {
    static final int INTERRUPTED_EXIT_CODE = 1;

    private final ConsolidatorProperties properties;

    public <T> T runInterruptibly(Function<CancellationToken, T> task) {
        CancellationToken token = new CancellationToken();
        Thread hook = new Thread(() -> onShutdown(token), "consolidation-interrupt");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return task.apply(token);
        } finally {
            token.settle();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown in progress, interrupt hook left in place");
            }
        }
    }

    void onShutdown(CancellationToken token) {
        if (token.isSettled()) {
            return;
        }
        log.warn("Operation interrupted by user! Stopping after the current sheet, no output will be written");
        token.cancel();
        try {
            if (!token.awaitSettled(properties.getInterruptGracePeriod())) {
                log.warn("Current sheet did not finish within {}, exiting", properties.getInterruptGracePeriod());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        Runtime.getRuntime().halt(INTERRUPTED_EXIT_CODE);
    }
}

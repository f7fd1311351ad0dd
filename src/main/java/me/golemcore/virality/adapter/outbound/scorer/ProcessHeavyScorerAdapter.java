/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.virality.adapter.outbound.scorer;

import me.golemcore.virality.domain.exception.ExternalProcessException;
import me.golemcore.virality.domain.model.AnalysisReport;
import me.golemcore.virality.infrastructure.config.ViralityProperties;
import me.golemcore.virality.port.outbound.HeavyScorerPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the heavy scorer as a child process: the configured command with the
 * post text appended as the final argument, a JSON document on stdout.
 *
 * <p>
 * Each invocation runs on the adapter's own pool, never on the caller's
 * thread. A process that outlives {@code virality.scorer.timeout-ms} is killed
 * and reaped; no child is left running on any path.
 */
@Component
@Slf4j
public class ProcessHeavyScorerAdapter implements HeavyScorerPort {

    private static final long OUTPUT_DRAIN_TIMEOUT_MS = 1000;
    private static final long REAP_TIMEOUT_MS = 2000;

    private final ViralityProperties.ScorerProperties config;
    private final HeavyScorerResponseParser parser;
    private final ExecutorService executor;

    public ProcessHeavyScorerAdapter(ViralityProperties properties, HeavyScorerResponseParser parser) {
        this.config = properties.getScorer();
        this.parser = parser;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "heavy-scorer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Scorer] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public long getTimeoutMs() {
        return config.getTimeoutMs();
    }

    @Override
    public boolean isAvailable() {
        return config.isEnabled() && config.getCommand() != null && !config.getCommand().isEmpty();
    }

    @Override
    public CompletableFuture<AnalysisReport> score(String text) {
        if (!isAvailable()) {
            return CompletableFuture.failedFuture(new ExternalProcessException(
                    ExternalProcessException.Kind.NOT_CONFIGURED, "Heavy scorer is disabled or has no command"));
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                String stdout = run(text);
                return parser.parse(stdout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(new ExternalProcessException(
                        ExternalProcessException.Kind.INTERRUPTED, "Interrupted while running heavy scorer", e));
            }
        }, executor);
    }

    private String run(String text) throws InterruptedException {
        List<String> command = new ArrayList<>(config.getCommand());
        command.add(text);

        ProcessBuilder pb = new ProcessBuilder(command);
        if (config.getWorkingDirectory() != null && !config.getWorkingDirectory().isBlank()) {
            pb.directory(new File(config.getWorkingDirectory()));
        }

        long startTime = System.currentTimeMillis();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ExternalProcessException(ExternalProcessException.Kind.SPAWN_FAILED,
                    "Failed to start heavy scorer: " + e.getMessage(), e);
        }

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("[Scorer] Could not close child stdin: {}", e.getMessage());
        }

        try {
            Future<String> stdoutFuture = executor.submit(() -> drain(process.getInputStream()));
            Future<String> stderrFuture = executor.submit(() -> drain(process.getErrorStream()));

            boolean completed = process.waitFor(config.getTimeoutMs(), TimeUnit.MILLISECONDS);
            if (!completed) {
                throw new ExternalProcessException(ExternalProcessException.Kind.TIMEOUT,
                        "Heavy scorer timed out after " + config.getTimeoutMs() + "ms");
            }

            String stdout = collect(stdoutFuture);
            String stderr = collect(stderrFuture);
            int exitCode = process.exitValue();
            log.debug("[Scorer] Exited with {} in {}ms", exitCode, System.currentTimeMillis() - startTime);

            if (exitCode != 0) {
                throw new ExternalProcessException(ExternalProcessException.Kind.NON_ZERO_EXIT,
                        "Heavy scorer failed with code " + exitCode + ": " + truncate(stderr.trim(), 500));
            }
            return stdout;
        } finally {
            terminate(process);
        }
    }

    private String drain(InputStream stream) throws IOException {
        int limit = config.getMaxOutputChars();
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            char[] buffer = new char[4096];
            int read = reader.read(buffer);
            while (read != -1) {
                int room = limit - output.length();
                if (room > 0) {
                    output.append(buffer, 0, Math.min(read, room));
                }
                read = reader.read(buffer);
            }
        }
        return output.toString();
    }

    private static String collect(Future<String> future) throws InterruptedException {
        try {
            return future.get(OUTPUT_DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return "";
        } catch (ExecutionException e) {
            log.debug("[Scorer] Error reading output: {}", e.getCause() != null ? e.getCause().getMessage() : "");
            return "";
        }
    }

    private static void terminate(Process process) {
        if (!process.isAlive()) {
            return;
        }
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(REAP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("[Scorer] Process {} did not exit after kill", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String truncate(String text, int maxLen) {
        return text.length() <= maxLen ? text : text.substring(0, maxLen) + "...";
    }
}

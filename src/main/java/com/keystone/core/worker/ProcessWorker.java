package com.keystone.core.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * {@link Worker} backed by an external command: the request is written to the process's stdin
 * as JSON and the response is read from its stdout as JSON.
 */
public class ProcessWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(ProcessWorker.class);

    private final String role;
    private final List<String> command;
    private final long timeoutSeconds;
    private final ObjectMapper mapper;

    public ProcessWorker(String role, List<String> command, long timeoutSeconds, ObjectMapper mapper) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Worker command for role " + role + " is empty");
        }
        this.role = role;
        this.command = List.copyOf(command);
        this.timeoutSeconds = timeoutSeconds;
        this.mapper = mapper;
    }

    @Override
    public String role() {
        return role;
    }

    @Override
    public WorkerResponse execute(WorkerRequest request) {
        log.debug("Running worker command for {}: {}", role, command);
        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(false).start();
        } catch (IOException e) {
            throw new WorkerUnavailableException(role, "cannot start " + command.get(0), e);
        }
        try {
            try (OutputStream stdin = process.getOutputStream()) {
                mapper.writeValue(stdin, request);
            }
            // drain stderr so the process never blocks on a full pipe
            Thread stderrPump = new Thread(() -> pump(process), "worker-stderr-" + role);
            stderrPump.setDaemon(true);
            stderrPump.start();

            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process));
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return WorkerResponse.failed("worker timed out after " + timeoutSeconds + "s");
            }
            if (process.exitValue() != 0) {
                return WorkerResponse.failed("worker exited with code " + process.exitValue());
            }
            String response = stdout.join();
            if (response.isBlank()) {
                return WorkerResponse.failed("worker produced no response");
            }
            return mapper.readValue(response, WorkerResponse.class);
        } catch (IOException | CompletionException e) {
            log.warn("Worker {} I/O failure: {}", role, e.getMessage());
            return WorkerResponse.failed("worker I/O failure: " + e.getMessage());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new WorkerUnavailableException(role, "interrupted", e);
        }
    }

    private static String readAll(Process process) {
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void pump(Process process) {
        try (var reader = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("{}: {}", role, line);
            }
        } catch (IOException e) {
            log.debug("stderr of {} closed: {}", role, e.getMessage());
        }
    }
}

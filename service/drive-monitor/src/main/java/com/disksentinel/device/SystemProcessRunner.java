package com.disksentinel.device;

import com.disksentinel.exception.ToolExecutionException;
import com.disksentinel.exception.ToolUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class SystemProcessRunner implements ProcessRunner {

    @Override
    public ProcessResult run(List<String> command, Duration timeout) {
        String tool = command.get(0);
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            log.warn("Failed to start {}: {}", tool, e.getMessage());
            throw new ToolUnavailableException(tool, e);
        }
        closeQuietly(process.getOutputStream()); // stdin 不使用

        // stdout/stderr 并行读取，避免管道写满导致子进程阻塞
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("{} timed out after {} ms, killed", tool, timeout.toMillis());
                throw new ToolExecutionException(null, tool, tool + " timed out after " + timeout.toMillis() + " ms");
            }
            return new ProcessResult(process.exitValue(), stdout.get(), stderr.get());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ToolExecutionException(null, tool, tool + " interrupted");
        } catch (ExecutionException e) {
            throw new ToolExecutionException(null, tool, "Failed to read output of " + tool + ": " + e.getCause().getMessage());
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void closeQuietly(OutputStream out) {
        try {
            out.close();
        } catch (IOException e) {
            log.debug("close stdin failed: {}", e.getMessage());
        }
    }
}

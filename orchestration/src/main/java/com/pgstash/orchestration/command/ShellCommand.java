package com.pgstash.orchestration.command;

import com.pgstash.orchestration.exception.CommandFailedException;
import com.pgstash.orchestration.model.CommandResult;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs external programs and captures their output.
 */
@Slf4j
@ApplicationScoped
public class ShellCommand {

    /**
     * Runs the command and waits for it, whatever the exit code.
     *
     * @param stdin text written to the standard input of the process, may be null
     * @throws CommandFailedException if the process could not be started or the wait was interrupted
     */
    public CommandResult run(List<String> commandLine, String stdin) throws CommandFailedException {
        log.debug("Executing: {}", commandLine);

        Process process;
        try {
            ProcessBuilder processBuilder = new ProcessBuilder();
            processBuilder.command(commandLine);
            process = processBuilder.start();
        } catch (IOException e) {
            throw new CommandFailedException("Failed to execute " + commandLine.get(0), e);
        }

        CompletableFuture<String> stderrFuture = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));

        try {
            try (OutputStream processStdin = process.getOutputStream()) {
                if (stdin != null) {
                    processStdin.write(stdin.getBytes(StandardCharsets.UTF_8));
                }
            }
            String stdout = readFully(process.getInputStream());
            int returnCode = process.waitFor();
            String stderr = stderrFuture.get();

            log.debug("Command {} exited with code {}", commandLine.get(0), returnCode);

            return CommandResult.builder()
                    .returnCode(returnCode)
                    .stdout(stdout)
                    .stderr(stderr)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new CommandFailedException("Interrupted while waiting for " + commandLine.get(0), e);
        } catch (IOException | UncheckedIOException | ExecutionException e) {
            process.destroy();
            throw new CommandFailedException("Failed to communicate with " + commandLine.get(0), e);
        }
    }

    /**
     * Runs the command and fails unless it exits with one of the allowed codes.
     */
    public CommandResult runChecked(List<String> commandLine, String stdin, Collection<Integer> allowedExitCodes) throws CommandFailedException {
        CommandResult result = run(commandLine, stdin);
        if (!allowedExitCodes.contains(result.getReturnCode())) {
            throw new CommandFailedException(
                    String.format("%s returned %d: %s", commandLine.get(0), result.getReturnCode(), result.getStderr().trim()),
                    result.getReturnCode(),
                    result.getStdout(),
                    result.getStderr()
            );
        }
        return result;
    }

    /**
     * Starts the command without waiting for it. Output of the process is appended to {@code logFile}.
     */
    public Process startInBackground(List<String> commandLine, Path logFile) throws CommandFailedException {
        log.debug("Starting in background: {}", commandLine);
        try {
            if (logFile.getParent() != null) {
                Files.createDirectories(logFile.getParent());
            }
            ProcessBuilder processBuilder = new ProcessBuilder();
            processBuilder.command(commandLine);
            processBuilder.redirectErrorStream(true);
            processBuilder.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
            processBuilder.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
            return processBuilder.start();
        } catch (IOException e) {
            throw new CommandFailedException("Failed to start " + commandLine.get(0), e);
        }
    }

    private static File nullDevice() {
        return new File(System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");
    }

    private static String readFully(InputStream inputStream) {
        try {
            return IOUtils.toString(inputStream, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

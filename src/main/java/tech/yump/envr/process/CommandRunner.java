package tech.yump.envr.process;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.envr.store.BackendUnavailableException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs an external command to completion, optionally feeding it stdin, and captures its output.
 * Arguments are passed as a list and never go through a shell.
 */
@Slf4j
@Component
public class CommandRunner {

    /**
     * @param command executable and arguments
     * @param stdin   text written to the process's stdin; null for none
     * @return the exit code and output; a non-zero exit code is not an error here
     * @throws BackendUnavailableException if the executable cannot be started
     */
    public CommandResult run(List<String> command, String stdin) {
        log.debug("Running command: {}", command.get(0));
        ProcessBuilder pb = new ProcessBuilder(command);
        Process p;
        try {
            p = pb.start();
        } catch (IOException e) {
            log.error("Failed to start command '{}': {}", command.get(0), e.getMessage());
            throw new BackendUnavailableException("Command '" + command.get(0) + "' is not available: " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(p.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(p.getErrorStream()));

        try (OutputStream in = p.getOutputStream()) {
            if (stdin != null) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            p.destroy();
            throw new BackendUnavailableException("Failed to write input to command '" + command.get(0) + "'", e);
        }

        try {
            int exitCode = p.waitFor();
            CommandResult result = new CommandResult(exitCode, stdout.join(), stderr.join());
            log.debug("Command '{}' exited with code {}", command.get(0), exitCode);
            return result;
        } catch (InterruptedException e) {
            p.destroy();
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException("Interrupted while waiting for command '" + command.get(0) + "'", e);
        }
    }

    public CommandResult run(List<String> command) {
        return run(command, null);
    }

    private static String drain(InputStream stream) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (InputStream in = stream) {
            in.transferTo(buffer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }
}

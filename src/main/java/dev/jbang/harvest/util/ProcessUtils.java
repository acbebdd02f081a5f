package dev.jbang.harvest.util;

import dev.jbang.harvest.error.RepositoryException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utility class for running external commands */
public class ProcessUtils {
	private static final Logger logger = LoggerFactory.getLogger(ProcessUtils.class);

	/**
	 * Run a command and return everything it wrote to stdout.
	 *
	 * <p>The command runs with {@code LC_ALL=C} so diagnostics are stable, and with terminal prompts
	 * disabled so a command asking for credentials fails instead of hanging.
	 *
	 * @param workingDir The directory to run in, or null for the current directory
	 * @param command The command and its arguments
	 * @return The raw stdout bytes
	 * @throws RepositoryException If the command cannot be started or exits with a non-zero status.
	 *     The message holds the command's stderr verbatim.
	 */
	public static byte[] exec(Path workingDir, List<String> command) {
		return exec(workingDir, command, ProcessUtils::readAll);
	}

	/**
	 * As {@link #exec(Path, List)}, reading stdout with the given function. The process is destroyed
	 * if its output cannot be read.
	 */
	static byte[] exec(Path workingDir, List<String> command, Function<InputStream, byte[]> stdoutReader) {
		logger.debug("Running {} in {}", command, workingDir);
		ProcessBuilder pb = new ProcessBuilder(command)
				.redirectOutput(ProcessBuilder.Redirect.PIPE)
				.redirectError(ProcessBuilder.Redirect.PIPE);
		if (workingDir != null) {
			pb.directory(workingDir.toFile());
		}
		pb.environment().put("LC_ALL", "C");
		pb.environment().put("GIT_TERMINAL_PROMPT", "0");

		Process process;
		try {
			process = pb.start();
		} catch (IOException e) {
			throw new RepositoryException("Failed to run " + String.join(" ", command) + ": " + e.getMessage(), e);
		}

		// stderr is drained on its own thread so a chatty command cannot block on a full pipe
		CompletableFuture<byte[]> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
		try {
			byte[] stdout = stdoutReader.apply(process.getInputStream());
			int exitCode = process.waitFor();
			String errorOutput = new String(stderr.get(), StandardCharsets.UTF_8).trim();
			if (exitCode != 0) {
				throw new RepositoryException(
						errorOutput.isEmpty()
								? String.join(" ", command) + " failed with exit code " + exitCode
								: errorOutput);
			}
			return stdout;
		} catch (UncheckedIOException e) {
			process.destroy();
			throw new RepositoryException("Failed to read output of " + String.join(" ", command), e.getCause());
		} catch (ExecutionException e) {
			process.destroy();
			throw new RepositoryException("Failed to read output of " + String.join(" ", command), e.getCause());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			process.destroy();
			throw new RepositoryException("Interrupted while running " + String.join(" ", command), e);
		}
	}

	private static byte[] readAll(InputStream in) {
		try (in) {
			return in.readAllBytes();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}

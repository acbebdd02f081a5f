package dev.jbang.harvest.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;

/** Utility class for file operations */
public class FileUtils {

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/**
	 * Replace {@code target} with a copy of {@code source}. The copy is written next to the target
	 * first and then moved over it, so readers never see a half-written target.
	 */
	public static void copyReplacing(Path source, Path target) throws IOException {
		ensureDirectory(target.toAbsolutePath().getParent());
		Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
		Files.copy(source, tmp, StandardCopyOption.REPLACE_EXISTING);
		try {
			Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		} catch (IOException e) {
			Files.deleteIfExists(tmp);
			throw e;
		}
	}

	/** Recursively delete a directory and all its contents */
	public static void deleteDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			return;
		}
		try (Stream<Path> paths = Files.walk(directory)) {
			// delete children before parents
			for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
				Files.delete(path);
			}
		}
	}
}

package dev.jbang.harvest.backends.gitblame;

import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Builds throwaway git repositories with fixed authors and commit times */
class GitTestRepository {
	static final long FIRST_COMMIT_TIME = 1_344_967_441L;
	static final long SECOND_COMMIT_TIME = 1_392_185_366L;

	private final Path path;

	private GitTestRepository(Path path) {
		this.path = path;
	}

	/** Skip the calling test when no git executable is available */
	static void assumeGitAvailable() {
		boolean available;
		try {
			Process process = new ProcessBuilder("git", "--version")
					.redirectErrorStream(true)
					.start();
			process.getInputStream().readAllBytes();
			available = process.waitFor() == 0;
		} catch (IOException e) {
			available = false;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			available = false;
		}
		assumeTrue(available, "git is not available");
	}

	static GitTestRepository init(Path path) throws Exception {
		Files.createDirectories(path);
		GitTestRepository repo = new GitTestRepository(path);
		repo.git(0, "init", "-q");
		repo.git(0, "symbolic-ref", "HEAD", "refs/heads/main");
		return repo;
	}

	/**
	 * Repository with two commits: the first adds {@code a.txt} (two lines) and {@code dir/b.txt},
	 * the second appends a third line to {@code a.txt}.
	 */
	static GitTestRepository withHistory(Path path) throws Exception {
		GitTestRepository repo = init(path);
		repo.write("a.txt", "one\ntwo\n");
		repo.write("dir/b.txt", "bee\n");
		repo.commit("Add files", FIRST_COMMIT_TIME);
		repo.write("a.txt", "one\ntwo\nthree\n");
		repo.commit("Extend a", SECOND_COMMIT_TIME);
		return repo;
	}

	Path path() {
		return path;
	}

	String uri() {
		return path.toAbsolutePath().toString();
	}

	void write(String file, String content) throws IOException {
		Path target = path.resolve(file);
		Files.createDirectories(target.getParent());
		Files.writeString(target, content, StandardCharsets.UTF_8);
	}

	/** Commit every change in the working tree and return the new commit's hash */
	String commit(String message, long epochSeconds) throws Exception {
		git(epochSeconds, "add", "-A");
		return commitIndex(message, epochSeconds);
	}

	/** Record a submodule entry pointing at {@code commit} and commit it */
	String commitSubmodule(String file, String commit, long epochSeconds) throws Exception {
		git(epochSeconds, "update-index", "--add", "--cacheinfo", "160000", commit, file);
		return commitIndex("Add submodule " + file, epochSeconds);
	}

	/** Rename a file, keeping its content, and commit the rename */
	String commitRename(String from, String to, long epochSeconds) throws Exception {
		git(epochSeconds, "mv", from, to);
		return commitIndex("Rename " + from, epochSeconds);
	}

	private String commitIndex(String message, long epochSeconds) throws Exception {
		git(epochSeconds, "-c", "user.name=Jane Doe", "-c", "user.email=jane@example.com", "commit", "-q", "-m", message);
		return head();
	}

	String head() throws Exception {
		return git(0, "rev-parse", "HEAD").trim();
	}

	private String git(long epochSeconds, String... args) throws Exception {
		List<String> command = new ArrayList<>();
		command.add("git");
		command.addAll(Arrays.asList(args));
		ProcessBuilder pb = new ProcessBuilder(command)
				.directory(path.toFile())
				.redirectErrorStream(true);
		if (epochSeconds > 0) {
			String date = epochSeconds + " +0000";
			pb.environment().put("GIT_AUTHOR_DATE", date);
			pb.environment().put("GIT_COMMITTER_DATE", date);
		}
		Process process = pb.start();
		String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
		if (process.waitFor() != 0) {
			throw new IllegalStateException(String.join(" ", command) + " failed: " + output);
		}
		return output;
	}
}

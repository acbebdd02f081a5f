package dev.jbang.harvest.backends.gitblame;

import dev.jbang.harvest.error.RepositoryException;
import dev.jbang.harvest.util.ProcessUtils;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle on a local, non-bare git working tree. Every operation runs the {@code git} executable and
 * fails with a {@link RepositoryException} holding git's own message when the command fails.
 */
public class GitRepository {
	private static final Logger logger = LoggerFactory.getLogger(GitRepository.class);

	static final String GIT = "git";
	static final String BLOB = "blob";

	private final String uri;
	private final Path path;

	private GitRepository(String uri, Path path) {
		this.uri = uri;
		this.path = path;
	}

	/**
	 * Open an existing working tree.
	 *
	 * @param uri The URI the working tree was cloned from
	 * @param path Root of the working tree
	 * @throws RepositoryException If {@code path} does not hold a git working tree
	 */
	public static GitRepository open(String uri, Path path) {
		if (!Files.isDirectory(path) || !Files.exists(path.resolve(".git"))) {
			throw new RepositoryException("git repository '" + path + "' does not exist");
		}
		return new GitRepository(uri, path);
	}

	/**
	 * Clone a repository into a new working tree.
	 *
	 * @throws RepositoryException If {@code path} already exists and is not empty, or {@code uri}
	 *     cannot be cloned
	 */
	public static GitRepository clone(String uri, Path path) {
		logger.info("Cloning {} into {}", uri, path);
		ProcessUtils.exec(null, List.of(GIT, "clone", uri, path.toAbsolutePath().toString()));
		logger.info("Repository {} cloned into {}", uri, path);
		return open(uri, path);
	}

	public String uri() {
		return uri;
	}

	public Path path() {
		return path;
	}

	/**
	 * Bring the working tree to the current state of the remote's default branch. Local commits and
	 * uncommitted changes are discarded.
	 */
	public void pull() {
		logger.info("Updating {} from {}", path, uri);
		git("fetch", "origin");
		String remoteHead = output(git("rev-parse", "--abbrev-ref", "origin/HEAD"));
		String branch = remoteHead.substring(remoteHead.indexOf('/') + 1);
		git("checkout", "-f", "-B", branch, remoteHead);
		git("clean", "-fd");
		logger.info("Repository {} is at {}", path, head());
	}

	/**
	 * Move the working tree to a revision.
	 *
	 * @param revision A symbolic reference like {@code HEAD} or a commit hash
	 */
	public void checkout(String revision) {
		logger.debug("Checking out {} in {}", revision, path);
		git("checkout", "-q", "-f", revision);
	}

	/**
	 * Run blame on a file of the checked out revision.
	 *
	 * @param file Path relative to the root of the working tree
	 * @return Incremental blame output, or no bytes if the file does not exist in this revision
	 */
	public byte[] blame(String file) {
		if (!Files.exists(path.resolve(file))) {
			logger.debug("Skipping blame of {}: not found in {}", file, path);
			return new byte[0];
		}
		return git("blame", "--incremental", "-M", "HEAD", "--", file);
	}

	/**
	 * Paths of the files tracked in the checked out revision. Only blobs are listed: submodules
	 * (gitlinks) have no content to blame.
	 */
	public List<String> trackedFiles() {
		// <mode> SP <type> SP <object> TAB <path>, NUL terminated
		String listing = new String(git("ls-tree", "-r", "-z", "HEAD"), StandardCharsets.UTF_8);
		List<String> files = new ArrayList<>();
		for (String entry : listing.split("\0")) {
			int tab = entry.indexOf('\t');
			if (tab < 0) {
				continue;
			}
			String[] info = entry.substring(0, tab).split(" ");
			if (info.length == 3 && BLOB.equals(info[1])) {
				files.add(entry.substring(tab + 1));
			} else {
				logger.debug("Skipping {} entry {}", info.length > 1 ? info[1] : "unknown", entry.substring(tab + 1));
			}
		}
		return files;
	}

	/** Hash of the checked out commit */
	public String head() {
		return output(git("rev-parse", "HEAD"));
	}

	private byte[] git(String... args) {
		List<String> command = new ArrayList<>(args.length + 1);
		command.add(GIT);
		command.addAll(Arrays.asList(args));
		return ProcessUtils.exec(path, command);
	}

	private static String output(byte[] bytes) {
		return new String(bytes, StandardCharsets.UTF_8).trim();
	}

	@Override
	public String toString() {
		return "GitRepository[" + uri + " at " + path + "]";
	}
}

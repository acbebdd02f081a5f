package dev.jbang.harvest.error;

/** The local working copy is invalid or an external VCS command failed. */
public class RepositoryException extends HarvestException {

	public RepositoryException(String message) {
		super(message);
	}

	public RepositoryException(String message, Throwable cause) {
		super(message, cause);
	}
}

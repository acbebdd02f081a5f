package dev.jbang.harvest.error;

/** Malformed input handed to a parser. */
public class ParseException extends HarvestException {
	private final int lineNumber;

	public ParseException(String message, int lineNumber) {
		super(message + " (line " + lineNumber + ")");
		this.lineNumber = lineNumber;
	}

	public int lineNumber() {
		return lineNumber;
	}
}

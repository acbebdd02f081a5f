package dev.jbang.harvest.error;

/** A record is missing a field the connector needs to stamp it, or the field has an invalid value. */
public class MalformedRecordException extends HarvestException {

	public MalformedRecordException(String message) {
		super(message);
	}

	public MalformedRecordException(String message, Throwable cause) {
		super(message, cause);
	}
}

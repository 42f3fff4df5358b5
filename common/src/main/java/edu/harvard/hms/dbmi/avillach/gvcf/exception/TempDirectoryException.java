package edu.harvard.hms.dbmi.avillach.gvcf.exception;

public class TempDirectoryException extends RuntimeException {

	private static final long serialVersionUID = 1843208911730946521L;

	public TempDirectoryException(String message) {
		super(message);
	}

	public TempDirectoryException(String message, Throwable cause) {
		super(message, cause);
	}
}

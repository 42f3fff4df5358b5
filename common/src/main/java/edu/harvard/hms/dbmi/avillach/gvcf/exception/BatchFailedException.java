package edu.harvard.hms.dbmi.avillach.gvcf.exception;

public class BatchFailedException extends RuntimeException {

	private static final long serialVersionUID = -6220739409468130227L;

	private final int batchNumber;

	public BatchFailedException(int batchNumber, Throwable cause) {
		super("Worker failed while processing batch " + batchNumber + ", aborting the whole run: "
				+ (cause == null ? "unknown cause" : cause.getMessage()), cause);
		this.batchNumber = batchNumber;
	}

	public int getBatchNumber() {
		return batchNumber;
	}
}

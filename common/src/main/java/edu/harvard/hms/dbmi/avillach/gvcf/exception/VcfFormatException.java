package edu.harvard.hms.dbmi.avillach.gvcf.exception;

/**
 * Thrown when the (G)VCF stream is structurally broken: wrong number of columns,
 * missing mandatory FORMAT keys, a genotype that cannot be split, a bad header line.
 * These always abort the run, there is nothing sensible to salvage.
 */
public class VcfFormatException extends RuntimeException {

	private static final long serialVersionUID = 4127360553907213815L;

	private final long lineNumber;

	public VcfFormatException(String message) {
		this(message, -1);
	}

	public VcfFormatException(String message, long lineNumber) {
		super(lineNumber < 0 ? message : message + " (input line " + lineNumber + ")");
		this.lineNumber = lineNumber;
	}

	/**
	 * @return the 1-based line number in the input stream, or -1 if unknown
	 */
	public long getLineNumber() {
		return lineNumber;
	}
}

package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import com.google.common.base.Joiner;

/**
 * Who is running and how it was invoked. Passed to whatever writes provenance
 * header lines or user-facing messages.
 *
 * @param programName short name of the running stage, e.g. {@code filterBadCalls}
 * @param commandLine the full invocation, recorded verbatim in the output header
 */
public record RunContext(String programName, String commandLine) {

	public static RunContext of(String programName, String... args) {
		return new RunContext(programName, args.length == 0 ? programName : programName + " " + Joiner.on(' ').join(args));
	}

	/**
	 * @return e.g. {@code ##filterBadCalls=<commandLine="...">}
	 */
	public String provenanceLine() {
		return "##" + programName + "=<commandLine=\"" + commandLine.replace("\"", "\\\"") + "\">";
	}

	public String describe(String message) {
		return programName + ": " + message;
	}
}

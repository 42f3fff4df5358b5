package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

public record RunSummary(int batches, long linesRead, long recordsWritten, CallFixCounters counters) {

	@Override
	public String toString() {
		return batches + " batches, " + linesRead + " data lines read, " + recordsWritten + " records written, " + counters;
	}
}

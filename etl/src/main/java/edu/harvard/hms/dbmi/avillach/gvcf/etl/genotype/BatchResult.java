package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

public record BatchResult(int batchNumber, long linesRead, long recordsWritten, CallFixCounters counters) {
}

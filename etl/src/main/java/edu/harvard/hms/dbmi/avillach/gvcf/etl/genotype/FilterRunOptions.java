package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.nio.file.Path;
import java.util.Objects;

/**
 * @param samplesFile       sample metadata table, null to keep every sample of the input
 * @param samplesOfInterest comma-separated sample IDs, null or empty for all
 * @param keepHR            produce a GVCF: keep records whose only calls are 0/0
 * @param tmpDir            must not exist, created and removed by the run
 * @param jobs              total threads, one of them reserved for ordered output
 * @param batchSize         lines per batch, 0 for the adaptive strategy
 * @param verbose           0 quiet, 1 per-batch counters, 2 every fixed call
 */
public record FilterRunOptions(CallFilterParams params, Path samplesFile, String samplesOfInterest, boolean keepHR, Path tmpDir,
		int jobs, int batchSize, int verbose, long pollIntervalMillis) {

	public FilterRunOptions {
		Objects.requireNonNull(params, "params");
		Objects.requireNonNull(tmpDir, "tmpDir");
		if (jobs < 2) {
			throw new IllegalArgumentException("jobs must be at least 2, got " + jobs);
		}
		if (batchSize < 0) {
			throw new IllegalArgumentException("batchSize cannot be negative, got " + batchSize);
		}
	}

	public boolean hasSamplesOfInterest() {
		return samplesOfInterest != null && !samplesOfInterest.isBlank();
	}
}

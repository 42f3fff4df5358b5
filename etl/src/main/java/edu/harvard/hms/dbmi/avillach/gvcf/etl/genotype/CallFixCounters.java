package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Diagnostics only, never read back by the filtering logic. One instance per
 * batch, merged by the workers into the run's instance once the batch is done.
 */
public class CallFixCounters {

	private final AtomicLong fixedToHV = new AtomicLong();
	private final AtomicLong fixedToHET = new AtomicLong();
	private final AtomicLong fixedDP = new AtomicLong();

	public void incrementFixedToHV() {
		fixedToHV.incrementAndGet();
	}

	public void incrementFixedToHET() {
		fixedToHET.incrementAndGet();
	}

	public void incrementFixedDP() {
		fixedDP.incrementAndGet();
	}

	public long getFixedToHV() {
		return fixedToHV.get();
	}

	public long getFixedToHET() {
		return fixedToHET.get();
	}

	public long getFixedDP() {
		return fixedDP.get();
	}

	public void add(CallFixCounters other) {
		fixedToHV.addAndGet(other.getFixedToHV());
		fixedToHET.addAndGet(other.getFixedToHET());
		fixedDP.addAndGet(other.getFixedDP());
	}

	@Override
	public String toString() {
		return "fixedToHV=" + fixedToHV + ", fixedToHET=" + fixedToHET + ", fixedDP=" + fixedDP;
	}
}

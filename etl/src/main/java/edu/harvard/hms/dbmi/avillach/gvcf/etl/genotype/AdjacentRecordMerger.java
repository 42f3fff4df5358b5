package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.util.function.Consumer;

import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.VariantRecord;

/**
 * Holds back one record so it can be compared with the next one. Works around
 * a Strelka quirk: an indel at POS can be preceded by an HR call at the same
 * POS, or by a non-variant block whose END= is that POS, both claiming the
 * indel's anchor base.
 *
 * One instance per batch, call {@link #flush()} at the end of the batch.
 */
public class AdjacentRecordMerger {

	private final Consumer<VariantRecord> sink;

	private VariantRecord buffered;
	private long discarded;
	private long endsDecremented;
	private long swapped;

	public AdjacentRecordMerger(Consumer<VariantRecord> sink) {
		this.sink = sink;
	}

	public void accept(VariantRecord current) {
		if (buffered == null) {
			buffered = current;
			return;
		}
		if (!buffered.chrom().equals(current.chrom())) {
			emitAndBuffer(current);
			return;
		}
		if (buffered.pos() == current.pos()) {
			boolean bufferedNonVariant = buffered.isNonVariant();
			boolean currentNonVariant = current.isNonVariant();
			if (bufferedNonVariant && !currentNonVariant) {
				discarded++;
				buffered = current;
			} else if (currentNonVariant && !bufferedNonVariant) {
				discarded++;
			} else {
				emitAndBuffer(current);
			}
			return;
		}
		if (buffered.pos() > current.pos()) {
			// left-trimming moved the buffered record past this one
			VariantRecord moved = buffered;
			buffered = current;
			current = moved;
			swapped++;
		}
		if (buffered.isNonVariant() && buffered.end() == current.pos()) {
			buffered.setEnd(current.pos() - 1);
			endsDecremented++;
		}
		emitAndBuffer(current);
	}

	private void emitAndBuffer(VariantRecord current) {
		sink.accept(buffered);
		buffered = current;
	}

	public void flush() {
		if (buffered != null) {
			sink.accept(buffered);
			buffered = null;
		}
	}

	public long getDiscarded() {
		return discarded;
	}

	public long getEndsDecremented() {
		return endsDecremented;
	}

	public long getSwapped() {
		return swapped;
	}
}

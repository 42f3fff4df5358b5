package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.Allele;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.SampleCall;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.VariantRecord;

/**
 * Runs the whole per-record pipeline over one batch: clean every call, drop
 * records without any interesting call, renumber alleles, normalize, then pass
 * through the one-record lookahead before writing.
 *
 * Stateless, a single instance is shared by all workers.
 */
public class BatchProcessor {

	private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

	private final CallFilterParams params;
	private final SampleColumnSelector columns;
	private final boolean keepHR;
	private final int verbose;

	public BatchProcessor(CallFilterParams params, SampleColumnSelector columns, boolean keepHR, int verbose) {
		this.params = params;
		this.columns = columns;
		this.keepHR = keepHR;
		this.verbose = verbose;
	}

	public BatchResult process(Batch batch, Writer out) {
		CallFixCounters counters = new CallFixCounters();
		GenotypeCleaner cleaner = new GenotypeCleaner(params, counters, verbose);
		AlleleRenumberer renumberer = new AlleleRenumberer();
		VariantNormalizer normalizer = new VariantNormalizer();
		long[] written = {0};
		AdjacentRecordMerger merger = new AdjacentRecordMerger(record -> {
			try {
				out.write(record.toLine());
				out.write('\n');
				written[0]++;
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		});

		long lineNumber = batch.firstLineNumber();
		for (String line : batch.lines()) {
			long current = lineNumber++;
			if (line.isEmpty()) {
				continue;
			}
			VariantRecord record = cleanRecord(line, current, cleaner);
			if (record == null) {
				continue;
			}
			renumberer.renumber(record);
			normalizer.normalize(record);
			merger.accept(record);
		}
		merger.flush();

		if (verbose >= 1) {
			log.info("batch {}: {} lines read, {} written, {}, {} HR records dropped before an indel", batch.number(),
					batch.lines().size(), written[0], counters, merger.getDiscarded());
		}
		return new BatchResult(batch.number(), batch.lines().size(), written[0], counters);
	}

	/**
	 * @return the record with cleaned calls, or null if it must be skipped
	 */
	VariantRecord cleanRecord(String line, long lineNumber, GenotypeCleaner cleaner) {
		String[] fields = columns.select(line, lineNumber);
		if (!keepHR && (".".equals(fields[VariantRecord.ALT]) || Allele.NON_REF.equals(fields[VariantRecord.ALT]))) {
			return null;
		}
		VariantRecord record = new VariantRecord(fields, lineNumber);
		record.format().requireFilterKeys(lineNumber);
		record.setQual(".");
		if (!record.info().startsWith("END=")) {
			record.setInfo(".");
		}

		boolean keepLine = false;
		List<SampleCall> cleaned = new ArrayList<>(record.samples().size());
		for (int i = 0; i < record.samples().size(); i++) {
			SampleCall call = cleaner.clean(record, i);
			cleaned.add(call);
			if (!call.isNoCall() && (keepHR || !call.genotype().isHomRef())) {
				keepLine = true;
			}
		}
		if (!keepLine) {
			return null;
		}
		record.setSamples(cleaned);
		return record;
	}
}

package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntSupplier;

import com.google.common.base.Splitter;

import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.Allele;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.AlleleSet;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.VariantRecord;

/**
 * Cuts the data lines of a VCF into numbered batches that can be processed
 * independently.
 *
 * A batch is closed once it holds at least the requested number of lines, but
 * only in front of a line that cannot interact with the previous batch: the
 * line must not be an indel candidate itself, and it must lie beyond the
 * furthest position any earlier indel could move to when normalized
 * ({@code POS + min(len(REF), longest ALT) - 1}). Records whose POS may shift
 * therefore always end up in the same batch as their neighbours, so the
 * lookahead merge and local swaps never need to cross a batch boundary.
 *
 * Lines are not validated here; a line that cannot be read as a VCF record
 * never closes a batch and is left for the worker to reject.
 */
public class LineBatcher {

	private static final Splitter TAB = Splitter.on('\t').limit(VariantRecord.QUAL + 1);

	private final BufferedReader reader;
	private final IntSupplier batchSize;

	private long lineNumber;
	private int batchNumber = 0;
	private String pending;
	private long pendingLineNumber;
	private boolean exhausted = false;

	private String reachChrom;
	private int reach;

	/**
	 * @param reader positioned on the first data line
	 * @param firstLineNumber input line number of the first data line
	 * @param batchSize asked before every batch, so the size can be adapted while
	 *                  reading
	 */
	public LineBatcher(BufferedReader reader, long firstLineNumber, IntSupplier batchSize) {
		this.reader = reader;
		this.lineNumber = firstLineNumber - 1;
		this.batchSize = batchSize;
	}

	/**
	 * @return the next batch, or null when the input is exhausted
	 */
	public Batch next() throws IOException {
		if (exhausted && pending == null) {
			return null;
		}
		int target = Math.max(1, batchSize.getAsInt());
		List<String> lines = new ArrayList<>(Math.min(target, 1 << 16) + 16);
		long first = lineNumber + 1;
		if (pending != null) {
			first = pendingLineNumber;
			add(lines, pending, site(pending));
			pending = null;
		}
		String line;
		while (!exhausted) {
			line = reader.readLine();
			if (line == null) {
				exhausted = true;
				break;
			}
			lineNumber++;
			Site site = site(line);
			if (lines.size() >= target && canStartBatch(site)) {
				pending = line;
				pendingLineNumber = lineNumber;
				break;
			}
			add(lines, line, site);
		}
		if (lines.isEmpty()) {
			return null;
		}
		return new Batch(++batchNumber, first, lines);
	}

	/**
	 * @return number of the last batch handed out so far
	 */
	public int getBatchCount() {
		return batchNumber;
	}

	boolean canStartBatch(Site site) {
		if (site == null || site.indelCandidate()) {
			return false;
		}
		return reachChrom == null || !reachChrom.equals(site.chrom()) || site.pos() > reach;
	}

	private void add(List<String> lines, String line, Site site) {
		lines.add(line);
		if (site == null || !site.indelCandidate()) {
			return;
		}
		if (site.chrom().equals(reachChrom)) {
			reach = Math.max(reach, site.reach());
		} else {
			reachChrom = site.chrom();
			reach = site.reach();
		}
	}

	/**
	 * @return the position data of a line, or null if it has none
	 */
	static Site site(String line) {
		if (line.isEmpty()) {
			return null;
		}
		List<String> fields = TAB.splitToList(line);
		if (fields.size() <= VariantRecord.ALT) {
			return null;
		}
		int pos;
		try {
			pos = Integer.parseInt(fields.get(VariantRecord.POS));
		} catch (NumberFormatException e) {
			return null;
		}
		AlleleSet alleles = AlleleSet.parse(fields.get(VariantRecord.REF), fields.get(VariantRecord.ALT));
		if (!alleles.isIndelCandidate()) {
			return new Site(fields.get(VariantRecord.CHR), pos, false, pos);
		}
		int longestAlt = 0;
		for (Allele alt : alleles.alts()) {
			if (!alt.isSymbolic()) {
				longestAlt = Math.max(longestAlt, alt.length());
			}
		}
		int reach = longestAlt == 0 ? pos : pos + Math.min(alleles.ref().length(), longestAlt) - 1;
		return new Site(fields.get(VariantRecord.CHR), pos, true, reach);
	}

	record Site(String chrom, int pos, boolean indelCandidate, int reach) {
	}
}

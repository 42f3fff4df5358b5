package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.VariantRecord;
import edu.harvard.hms.dbmi.avillach.gvcf.exception.VcfFormatException;

/**
 * Reads the header of a VCF and writes the header of each stage's output.
 */
public class VcfHeaderRewriter {

	public static final String GENOS_FORMAT_LINE = "##FORMAT=<ID=GENOS,Number=.,Type=String,Description=\"pipe-separated list "
			+ "of genotypes called at this position, with all corresponding sample identifiers for each genotype (with [DP:AF] "
			+ "for HET and HV SNVs/short-indels, and [BF:RR] or [GQ:FR:BP] for CNVs)\">";

	public static final List<String> GENOS_COLUMNS = List.of("HV", "HET", "OTHER", "HR");

	private static final Joiner TAB_JOINER = Joiner.on('\t');

	private final RunContext context;

	public VcfHeaderRewriter(RunContext context) {
		this.context = context;
	}

	/**
	 * Consumes {@code ##} lines up to and including the {@code #CHROM} line.
	 *
	 * @throws VcfFormatException on any other line before {@code #CHROM}, on a
	 *                            {@code #CHROM} line without samples, or if the
	 *                            input ends before it
	 */
	public VcfHeader read(BufferedReader in) throws IOException {
		List<String> metaLines = new ArrayList<>();
		long lineNumber = 0;
		String line;
		while ((line = in.readLine()) != null) {
			lineNumber++;
			if (line.startsWith("##")) {
				metaLines.add(line);
			} else if (line.startsWith("#CHROM")) {
				List<String> columns = Splitter.on('\t').splitToList(line);
				if (columns.size() <= VariantRecord.DATA) {
					throw new VcfFormatException(context.describe("no sample IDs in #CHROM line"), lineNumber);
				}
				return new VcfHeader(metaLines, columns, lineNumber);
			} else {
				throw new VcfFormatException(context.describe("bad line while parsing the header: " + line), lineNumber);
			}
		}
		throw new VcfFormatException(context.describe("input ended before the #CHROM line"), lineNumber);
	}

	/**
	 * @param retained which sample IDs are kept
	 */
	public SampleColumnSelector selectSamples(VcfHeader header, Predicate<String> retained) {
		List<Integer> kept = new ArrayList<>();
		List<String> keptSamples = new ArrayList<>();
		for (int i = 0; i < header.columns().size(); i++) {
			if (i < VariantRecord.DATA) {
				kept.add(i);
			} else if (retained.test(header.columns().get(i))) {
				kept.add(i);
				keptSamples.add(header.columns().get(i));
			}
		}
		return new SampleColumnSelector(header.columns().size(), kept.stream().mapToInt(Integer::intValue).toArray(), keptSamples);
	}

	/**
	 * Meta lines unchanged, provenance line, then {@code #CHROM} with only the
	 * retained samples.
	 */
	public void writeFilterHeader(VcfHeader header, SampleColumnSelector columns, Writer out) throws IOException {
		for (String meta : header.metaLines()) {
			writeLine(out, meta);
		}
		writeLine(out, context.provenanceLine());
		List<String> chrom = new ArrayList<>(header.columns().subList(0, VariantRecord.DATA));
		chrom.addAll(columns.keptSamples());
		writeLine(out, TAB_JOINER.join(chrom));
	}

	/**
	 * Meta lines without the FORMAT descriptions, provenance and GENOS
	 * description, then {@code #CHROM} with the four genotype columns instead of
	 * the samples.
	 */
	public void writeGenosHeader(VcfHeader header, Writer out) throws IOException {
		for (String meta : header.metaLines()) {
			if (!meta.startsWith("##FORMAT=")) {
				writeLine(out, meta);
			}
		}
		writeLine(out, context.provenanceLine());
		writeLine(out, GENOS_FORMAT_LINE);
		List<String> chrom = new ArrayList<>(header.columns().subList(0, VariantRecord.DATA));
		chrom.addAll(GENOS_COLUMNS);
		writeLine(out, TAB_JOINER.join(chrom));
	}

	private static void writeLine(Writer out, String line) throws IOException {
		out.write(line);
		out.write('\n');
	}
}

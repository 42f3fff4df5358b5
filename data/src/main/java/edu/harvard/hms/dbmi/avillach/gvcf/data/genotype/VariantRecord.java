package edu.harvard.hms.dbmi.avillach.gvcf.data.genotype;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import edu.harvard.hms.dbmi.avillach.gvcf.exception.VcfFormatException;

/**
 * One VCF data line. Parsed once, then cleaned, renumbered and normalized in
 * place before being rendered back with {@link #toLine()}.
 */
public class VariantRecord {

	public static final int CHR = 0, POS = 1, ID = 2, REF = 3, ALT = 4, QUAL = 5, FILTER = 6, INFO = 7, FORMAT = 8, DATA = 9;

	private static final Pattern END_PATTERN = Pattern.compile("(^|;)END=(\\d+)(;|$)");

	private final long lineNumber;
	private String chrom;
	private int pos;
	private String id;
	private AlleleSet alleles;
	private String qual;
	private String filter;
	private String info;
	private final FormatKeys format;
	private List<SampleCall> samples;

	public VariantRecord(String[] fields, long lineNumber) {
		if (fields.length <= DATA) {
			throw new VcfFormatException("no sample data in line, only " + fields.length + " columns", lineNumber);
		}
		this.lineNumber = lineNumber;
		this.chrom = fields[CHR];
		try {
			this.pos = Integer.parseInt(fields[POS]);
		} catch (NumberFormatException e) {
			throw new VcfFormatException("POS is not an integer: " + fields[POS], lineNumber);
		}
		this.id = fields[ID];
		this.alleles = AlleleSet.parse(fields[REF], fields[ALT]);
		this.qual = fields[QUAL];
		this.filter = fields[FILTER];
		this.info = fields[INFO];
		this.format = new FormatKeys(fields[FORMAT]);
		this.samples = new ArrayList<>(fields.length - DATA);
		for (int i = DATA; i < fields.length; i++) {
			samples.add(new SampleCall(fields[i]));
		}
	}

	/**
	 * @param expectedSamples number of sample columns declared by the #CHROM line
	 */
	public static VariantRecord parse(String line, long lineNumber, int expectedSamples) {
		String[] fields = line.split("\t", -1);
		if (fields.length != DATA + expectedSamples) {
			throw new VcfFormatException("expected " + (DATA + expectedSamples) + " columns but found " + fields.length, lineNumber);
		}
		return new VariantRecord(fields, lineNumber);
	}

	public long lineNumber() {
		return lineNumber;
	}

	public String chrom() {
		return chrom;
	}

	public int pos() {
		return pos;
	}

	public void setPos(int pos) {
		this.pos = pos;
	}

	public String id() {
		return id;
	}

	public AlleleSet alleles() {
		return alleles;
	}

	public void setAlleles(AlleleSet alleles) {
		this.alleles = alleles;
	}

	public String qual() {
		return qual;
	}

	public void setQual(String qual) {
		this.qual = qual;
	}

	public String filter() {
		return filter;
	}

	public String info() {
		return info;
	}

	public void setInfo(String info) {
		this.info = info;
	}

	public FormatKeys format() {
		return format;
	}

	public List<SampleCall> samples() {
		return samples;
	}

	public void setSamples(List<SampleCall> samples) {
		this.samples = samples;
	}

	/**
	 * @return the END= of a non-variant block, or -1
	 */
	public int end() {
		Matcher m = END_PATTERN.matcher(info);
		return m.find() ? Integer.parseInt(m.group(2)) : -1;
	}

	public void setEnd(int end) {
		Matcher m = END_PATTERN.matcher(info);
		if (!m.find()) {
			throw new IllegalStateException("no END= in INFO of " + specNotation());
		}
		info = info.substring(0, m.start(2)) + end + info.substring(m.end(2));
	}

	/**
	 * HR call or non-variant block: nothing but REF and symbolic alleles.
	 */
	public boolean isNonVariant() {
		return !alleles.hasVariantAlt();
	}

	public String specNotation() {
		return chrom + ":" + pos + " " + alleles;
	}

	/**
	 * Renders the record with the cleaned FORMAT layout.
	 */
	public String toLine() {
		StringBuilder sb = new StringBuilder(256);
		sb.append(chrom).append('\t').append(pos).append('\t').append(id).append('\t')
			.append(alleles.ref()).append('\t').append(alleles.altColumn()).append('\t')
			.append(qual).append('\t').append(filter).append('\t').append(info).append('\t')
			.append(format.outputColumn());
		for (SampleCall call : samples) {
			sb.append('\t').append(format.render(call));
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return specNotation();
	}
}

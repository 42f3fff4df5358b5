package edu.harvard.hms.dbmi.avillach.gvcf.data.genotype;

import java.util.Arrays;

/**
 * One sample column of a record: the raw colon-separated values, in the
 * record's FORMAT order, plus what the call filter derived from them.
 */
public class SampleCall {

	private String[] values;
	private Genotype genotype;
	private String af = ".";
	private String insertedDp;

	public SampleCall(String rawField) {
		this(rawField.split(":", -1), null);
	}

	private SampleCall(String[] values, Genotype genotype) {
		this.values = values;
		this.genotype = genotype;
	}

	public static SampleCall noCall() {
		return new SampleCall(new String[] {Genotype.NOCALL}, null);
	}

	public boolean isNoCall() {
		return genotype == null;
	}

	public Genotype genotype() {
		return genotype;
	}

	public SampleCall setGenotype(Genotype genotype) {
		this.genotype = genotype;
		return this;
	}

	/**
	 * @return the value at a FORMAT position, or null if the key is absent or
	 * the sample field was truncated before it
	 */
	public String value(int index) {
		if (index < 0 || index >= values.length) {
			return null;
		}
		return values[index];
	}

	/**
	 * Like {@link #value(int)} but also maps the VCF missing value {@code .} and
	 * the empty string to null.
	 */
	public String definedValue(int index) {
		String value = value(index);
		return value == null || value.isEmpty() || ".".equals(value) ? null : value;
	}

	public void setValue(int index, String value) {
		if (index >= values.length) {
			String[] grown = Arrays.copyOf(values, index + 1);
			Arrays.fill(grown, values.length, index, ".");
			values = grown;
		}
		values[index] = value;
	}

	public String af() {
		return af;
	}

	public void setAf(String af) {
		this.af = af;
	}

	public String insertedDp() {
		return insertedDp;
	}

	public void setInsertedDp(String insertedDp) {
		this.insertedDp = insertedDp;
	}

	public String raw() {
		return String.join(":", values);
	}

	@Override
	public String toString() {
		return isNoCall() ? Genotype.NOCALL : genotype + " " + raw();
	}
}

package edu.harvard.hms.dbmi.avillach.gvcf.data.genotype;

import edu.harvard.hms.dbmi.avillach.gvcf.exception.VcfFormatException;

/**
 * An unphased diploid genotype as a pair of allele indexes, 0 being REF.
 */
public record Genotype(int first, int second) implements Comparable<Genotype> {

	public static final String NOCALL = "./.";

	public enum Zygosity {
		/** 0/0 */
		HR,
		/** 0/x with x>0 */
		HET,
		/** x/x with x>0 */
		HV,
		/** x/y with x,y>0 and x!=y */
		OTHER
	}

	public Genotype {
		if (first < 0 || second < 0) {
			throw new IllegalArgumentException("allele indexes cannot be negative: " + first + "/" + second);
		}
	}

	/**
	 * @return true for {@code .}, {@code ./.} and {@code .|.}
	 */
	public static boolean isNoCall(String gt) {
		return gt == null || gt.isEmpty() || ".".equals(gt) || "./.".equals(gt) || ".|.".equals(gt);
	}

	/**
	 * Parses a GT value: phased calls are unphased and a single allele {@code x}
	 * (hemizygous) becomes {@code x/x}. Allele order is kept as written.
	 *
	 * @throws VcfFormatException if the value is not one or two integers
	 */
	public static Genotype parse(String gt) {
		String unphased = gt.replace('|', '/');
		int slash = unphased.indexOf('/');
		try {
			if (slash < 0) {
				int allele = Integer.parseInt(unphased);
				return new Genotype(allele, allele);
			}
			if (unphased.indexOf('/', slash + 1) >= 0) {
				throw new VcfFormatException("genotype is not diploid: " + gt);
			}
			return new Genotype(Integer.parseInt(unphased.substring(0, slash)), Integer.parseInt(unphased.substring(slash + 1)));
		} catch (IllegalArgumentException e) {
			throw new VcfFormatException("genotype cannot be split into two allele indexes: " + gt);
		}
	}

	public Genotype sorted() {
		return first <= second ? this : new Genotype(second, first);
	}

	public boolean isHomRef() {
		return first == 0 && second == 0;
	}

	public Zygosity zygosity() {
		if (first == 0 && second == 0) {
			return Zygosity.HR;
		}
		if (first == second) {
			return Zygosity.HV;
		}
		if (first == 0 || second == 0) {
			return Zygosity.HET;
		}
		return Zygosity.OTHER;
	}

	/**
	 * @return the higher allele index, ie the VAR allele of a sorted 0/x or x/x call
	 */
	public int varAllele() {
		return Math.max(first, second);
	}

	public boolean references(int allele) {
		return first == allele || second == allele;
	}

	@Override
	public int compareTo(Genotype o) {
		int ret = Integer.compare(first, o.first);
		return ret != 0 ? ret : Integer.compare(second, o.second);
	}

	@Override
	public String toString() {
		return first + "/" + second;
	}
}

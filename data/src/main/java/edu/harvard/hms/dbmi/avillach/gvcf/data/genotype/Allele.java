package edu.harvard.hms.dbmi.avillach.gvcf.data.genotype;

import java.util.Objects;

/**
 * One allele of a VCF record. Index 0 of an {@link AlleleSet} is always the REF.
 */
public record Allele(Kind kind, String bases) {

	public static final String STAR = "*";
	public static final String NON_REF = "<NON_REF>";

	public enum Kind {
		REF,
		ALT,
		/** GATK spanning-deletion allele, {@code *} */
		STAR,
		/** GVCF catch-all allele, {@code <NON_REF>} */
		NON_REF
	}

	public Allele {
		Objects.requireNonNull(kind);
		Objects.requireNonNull(bases);
	}

	public static Allele ref(String bases) {
		return new Allele(Kind.REF, bases);
	}

	public static Allele alt(String bases) {
		if (STAR.equals(bases)) {
			return new Allele(Kind.STAR, bases);
		}
		if (NON_REF.equals(bases)) {
			return new Allele(Kind.NON_REF, bases);
		}
		return new Allele(Kind.ALT, bases);
	}

	/**
	 * Symbolic alleles are never purged by renumbering and never take part in
	 * REF/ALT trimming.
	 */
	public boolean isSymbolic() {
		return kind == Kind.STAR || kind == Kind.NON_REF;
	}

	public int length() {
		return bases.length();
	}

	@Override
	public String toString() {
		return bases;
	}
}

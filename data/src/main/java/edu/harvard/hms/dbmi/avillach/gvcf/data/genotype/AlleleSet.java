package edu.harvard.hms.dbmi.avillach.gvcf.data.genotype;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

/**
 * REF (index 0) plus the ALTs of a record (indexes 1..N), each tagged as called
 * or not. Calls are marked by the cleaning step, read by the renumbering step.
 */
public class AlleleSet {

	private static final Splitter ALT_SPLITTER = Splitter.on(',');
	private static final Joiner ALT_JOINER = Joiner.on(',');

	private final List<Allele> alleles;
	private final BitSet called = new BitSet();

	public AlleleSet(Allele ref, List<Allele> alts) {
		List<Allele> all = new ArrayList<>(alts.size() + 1);
		all.add(ref);
		all.addAll(alts);
		this.alleles = Collections.unmodifiableList(all);
	}

	/**
	 * @param ref the REF column
	 * @param alt the ALT column, {@code .} meaning no ALT at all
	 */
	public static AlleleSet parse(String ref, String alt) {
		List<Allele> alts = new ArrayList<>();
		if (!".".equals(alt)) {
			for (String a : ALT_SPLITTER.split(alt)) {
				alts.add(Allele.alt(a));
			}
		}
		return new AlleleSet(Allele.ref(ref), alts);
	}

	public Allele get(int index) {
		return alleles.get(index);
	}

	public Allele ref() {
		return alleles.get(0);
	}

	public List<Allele> alts() {
		return alleles.subList(1, alleles.size());
	}

	/** REF plus ALTs */
	public int size() {
		return alleles.size();
	}

	public int altCount() {
		return alleles.size() - 1;
	}

	/**
	 * @return index of the {@code *} allele, or -1 if there is none
	 */
	public int starIndex() {
		for (int i = 1; i < alleles.size(); i++) {
			if (alleles.get(i).kind() == Allele.Kind.STAR) {
				return i;
			}
		}
		return -1;
	}

	public boolean isSymbolic(int index) {
		return alleles.get(index).isSymbolic();
	}

	public void markCalled(int index) {
		if (index < 0 || index >= alleles.size()) {
			throw new IndexOutOfBoundsException("allele " + index + " does not exist, record has " + altCount() + " ALT(s)");
		}
		called.set(index);
	}

	public boolean isCalled(int index) {
		return called.get(index);
	}

	/**
	 * @return true if at least one ALT is a real (non-symbolic) allele
	 */
	public boolean hasVariantAlt() {
		return alleles.stream().skip(1).anyMatch(a -> !a.isSymbolic());
	}

	/**
	 * A record with this REF and ALTs could shift its POS when trimmed, or
	 * describes more than a single base.
	 */
	public boolean isIndelCandidate() {
		if (ref().length() >= 2) {
			return true;
		}
		return alleles.stream().skip(1).anyMatch(a -> !a.isSymbolic() && a.length() >= 2);
	}

	public String altColumn() {
		return alleles.size() == 1 ? "." : ALT_JOINER.join(alts());
	}

	@Override
	public String toString() {
		return ref() + ">" + altColumn();
	}
}

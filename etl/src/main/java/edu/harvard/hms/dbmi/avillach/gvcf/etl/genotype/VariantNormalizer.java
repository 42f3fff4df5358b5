package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.util.ArrayList;
import java.util.List;

import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.Allele;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.AlleleSet;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.VariantRecord;

/**
 * Trims bases shared by REF and every real ALT: trailing bases first, then
 * leading bases (moving POS one base right per trimmed base). At least one base
 * is always kept in REF and in every ALT.
 *
 * This is not left-alignment. Two records whose REFs overlapped in the input
 * may still overlap, or even collide on POS, afterwards.
 */
public class VariantNormalizer {

	/**
	 * @return true if POS, REF or any ALT changed
	 */
	public boolean normalize(VariantRecord record) {
		AlleleSet alleles = record.alleles();
		String ref = alleles.ref().bases();
		if (ref.length() < 2) {
			return false;
		}
		List<Integer> comparable = new ArrayList<>();
		String[] bases = new String[alleles.size()];
		for (int i = 1; i < alleles.size(); i++) {
			bases[i] = alleles.get(i).bases();
			if (!alleles.isSymbolic(i)) {
				comparable.add(i);
			}
		}
		if (comparable.isEmpty()) {
			return false;
		}

		int trimmedEnd = 0;
		while (ref.length() - trimmedEnd >= 2) {
			char last = ref.charAt(ref.length() - 1 - trimmedEnd);
			boolean shared = true;
			for (int i : comparable) {
				String alt = bases[i];
				if (alt.length() - trimmedEnd < 2 || alt.charAt(alt.length() - 1 - trimmedEnd) != last) {
					shared = false;
					break;
				}
			}
			if (!shared) {
				break;
			}
			trimmedEnd++;
		}
		ref = ref.substring(0, ref.length() - trimmedEnd);
		for (int i : comparable) {
			bases[i] = bases[i].substring(0, bases[i].length() - trimmedEnd);
		}

		int trimmedStart = 0;
		while (ref.length() - trimmedStart >= 2) {
			char first = ref.charAt(trimmedStart);
			boolean shared = true;
			for (int i : comparable) {
				String alt = bases[i];
				if (alt.length() - trimmedStart < 2 || alt.charAt(trimmedStart) != first) {
					shared = false;
					break;
				}
			}
			if (!shared) {
				break;
			}
			trimmedStart++;
		}
		if (trimmedEnd == 0 && trimmedStart == 0) {
			return false;
		}
		ref = ref.substring(trimmedStart);
		List<Allele> alts = new ArrayList<>(alleles.altCount());
		for (int i = 1; i < alleles.size(); i++) {
			alts.add(alleles.isSymbolic(i) ? alleles.get(i) : Allele.alt(bases[i].substring(trimmedStart)));
		}
		AlleleSet normalized = new AlleleSet(Allele.ref(ref), alts);
		for (int i = 0; i < alleles.size(); i++) {
			if (alleles.isCalled(i)) {
				normalized.markCalled(i);
			}
		}
		record.setAlleles(normalized);
		record.setPos(record.pos() + trimmedStart);
		return true;
	}
}

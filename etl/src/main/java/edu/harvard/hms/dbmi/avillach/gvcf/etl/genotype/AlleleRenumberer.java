package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.Allele;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.AlleleSet;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.FormatKeys;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.Genotype;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.SampleCall;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.VariantRecord;
import edu.harvard.hms.dbmi.avillach.gvcf.exception.VcfFormatException;

/**
 * Removes the ALTs that no surviving call uses, renumbers the genotypes and
 * reindexes the per-allele (AD, ADF, ADR) and per-genotype (PL) arrays.
 * Symbolic alleles ({@code *}, {@code <NON_REF>}) are always kept, after the
 * real ALTs.
 */
public class AlleleRenumberer {

	private static final String MISSING = ".";

	/**
	 * @return true if the record was modified
	 */
	public boolean renumber(VariantRecord record) {
		AlleleSet alleles = record.alleles();
		for (SampleCall call : record.samples()) {
			if (!call.isNoCall()) {
				alleles.markCalled(call.genotype().first());
				alleles.markCalled(call.genotype().second());
			}
		}

		int[] newToOld = keptAlleles(alleles);
		if (isIdentity(newToOld, alleles.size())) {
			return false;
		}
		int[] oldToNew = new int[alleles.size()];
		Arrays.fill(oldToNew, -1);
		List<Allele> newAlts = new ArrayList<>(newToOld.length - 1);
		for (int newIndex = 0; newIndex < newToOld.length; newIndex++) {
			oldToNew[newToOld[newIndex]] = newIndex;
			if (newIndex > 0) {
				newAlts.add(alleles.get(newToOld[newIndex]));
			}
		}
		AlleleSet renumbered = new AlleleSet(alleles.ref(), newAlts);

		FormatKeys format = record.format();
		for (SampleCall call : record.samples()) {
			if (call.isNoCall()) {
				continue;
			}
			call.setGenotype(remap(call.genotype(), oldToNew, record));
			reindexField(call, format.ad, values -> reindexPerAllele(values, newToOld));
			reindexField(call, format.adf, values -> reindexPerAllele(values, newToOld));
			reindexField(call, format.adr, values -> reindexPerAllele(values, newToOld));
			// a haploid PL is short for the diploid GT written out, so it ends up all-missing
			reindexField(call, format.pl, values -> reindexPerGenotype(values, newToOld));
		}
		for (int i = 0; i < renumbered.size(); i++) {
			if (alleles.isCalled(newToOld[i])) {
				renumbered.markCalled(i);
			}
		}
		record.setAlleles(renumbered);
		return true;
	}

	/**
	 * @return old indexes of the kept alleles, in their new order: REF, called
	 * real ALTs, then symbolic ALTs
	 */
	static int[] keptAlleles(AlleleSet alleles) {
		List<Integer> kept = new ArrayList<>(alleles.size());
		kept.add(0);
		for (int i = 1; i < alleles.size(); i++) {
			if (!alleles.isSymbolic(i) && alleles.isCalled(i)) {
				kept.add(i);
			}
		}
		for (int i = 1; i < alleles.size(); i++) {
			if (alleles.isSymbolic(i)) {
				kept.add(i);
			}
		}
		return kept.stream().mapToInt(Integer::intValue).toArray();
	}

	private static boolean isIdentity(int[] newToOld, int size) {
		if (newToOld.length != size) {
			return false;
		}
		for (int i = 0; i < newToOld.length; i++) {
			if (newToOld[i] != i) {
				return false;
			}
		}
		return true;
	}

	private static Genotype remap(Genotype genotype, int[] oldToNew, VariantRecord record) {
		int first = oldToNew[genotype.first()];
		int second = oldToNew[genotype.second()];
		if (first < 0 || second < 0) {
			throw new IllegalStateException("genotype " + genotype + " uses an allele that was never seen as called at "
					+ record.specNotation());
		}
		return new Genotype(first, second).sorted();
	}

	private interface Reindexer {
		String[] apply(String[] values);
	}

	private static void reindexField(SampleCall call, int index, Reindexer reindexer) {
		String value = call.definedValue(index);
		if (value == null) {
			return;
		}
		call.setValue(index, String.join(",", reindexer.apply(value.split(",", -1))));
	}

	/**
	 * One value per allele (AD, ADF, ADR): keep REF and the kept ALTs, in their
	 * new order. Positions missing from a short source array become {@code .}.
	 */
	public static String[] reindexPerAllele(String[] values, int[] newToOld) {
		String[] reindexed = new String[newToOld.length];
		for (int i = 0; i < newToOld.length; i++) {
			reindexed[i] = newToOld[i] < values.length ? values[newToOld[i]] : MISSING;
		}
		return reindexed;
	}

	/**
	 * One value per unordered genotype x/y (PL), at position x + y*(y+1)/2 for
	 * x &lt;= y. If any value needed for a kept genotype is absent or missing in
	 * the source, every value of the result is missing: a shifted PL is worse
	 * than no PL.
	 */
	public static String[] reindexPerGenotype(String[] values, int[] newToOld) {
		String[] reindexed = new String[triangular(newToOld.length)];
		for (int y = 0; y < newToOld.length; y++) {
			for (int x = 0; x <= y; x++) {
				int oldX = newToOld[x];
				int oldY = newToOld[y];
				int oldIndex = genotypeIndex(Math.min(oldX, oldY), Math.max(oldX, oldY));
				if (oldIndex >= values.length || MISSING.equals(values[oldIndex]) || values[oldIndex].isEmpty()) {
					Arrays.fill(reindexed, MISSING);
					return reindexed;
				}
				reindexed[genotypeIndex(x, y)] = values[oldIndex];
			}
		}
		return reindexed;
	}

	/**
	 * VCF ordering of genotype likelihoods, x &lt;= y.
	 */
	public static int genotypeIndex(int x, int y) {
		if (x > y) {
			throw new VcfFormatException("genotype index needs x <= y, got " + x + "/" + y);
		}
		return x + y * (y + 1) / 2;
	}

	/**
	 * @return number of unordered diploid genotypes over {@code alleleCount} alleles
	 */
	public static int triangular(int alleleCount) {
		return alleleCount * (alleleCount + 1) / 2;
	}
}

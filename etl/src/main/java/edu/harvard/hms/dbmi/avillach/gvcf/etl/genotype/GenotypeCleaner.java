package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.FormatKeys;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.Genotype;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.SampleCall;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.VariantRecord;
import edu.harvard.hms.dbmi.avillach.gvcf.exception.VcfFormatException;

/**
 * Decides, for one sample of one record, whether the call is kept or becomes
 * NOCALL, computes its AF and fixes blatantly miscalled HET/HV genotypes.
 *
 * Not thread-safe: create one per batch.
 */
public class GenotypeCleaner {

	private static final Logger log = LoggerFactory.getLogger(GenotypeCleaner.class);

	private static final Pattern AD_PATTERN = Pattern.compile("^[\\d,]+$");

	private final CallFilterParams params;
	private final CallFixCounters counters;
	private final int verbose;

	public GenotypeCleaner(CallFilterParams params, CallFixCounters counters, int verbose) {
		this.params = params;
		this.counters = counters;
		this.verbose = verbose;
	}

	/**
	 * @param record the record, its FORMAT already checked with
	 *               {@link FormatKeys#requireFilterKeys(long)}
	 * @param sampleIndex 0-based index among the retained sample columns
	 * @return the cleaned call, or a NOCALL
	 */
	public SampleCall clean(VariantRecord record, int sampleIndex) {
		FormatKeys format = record.format();
		SampleCall call = record.samples().get(sampleIndex);

		String rawGt = call.value(format.gt);
		if (Genotype.isNoCall(rawGt)) {
			return SampleCall.noCall();
		}
		Genotype genotype;
		try {
			genotype = Genotype.parse(rawGt);
		} catch (VcfFormatException e) {
			throw new VcfFormatException("sample " + sampleIndex + ": " + e.getMessage() + " at " + record.specNotation(),
					record.lineNumber());
		}

		// hemizygous calls under a deletion are x/* or */x, */* is useless
		int star = record.alleles().starIndex();
		if (star > 0 && genotype.references(star)) {
			if (genotype.first() == star && genotype.second() == star) {
				return SampleCall.noCall();
			}
			int other = genotype.first() == star ? genotype.second() : genotype.first();
			genotype = new Genotype(other, other);
		}
		genotype = genotype.sorted();
		if (genotype.varAllele() >= record.alleles().size()) {
			throw new VcfFormatException("sample " + sampleIndex + " has genotype " + rawGt + " but record only has "
					+ record.alleles().altCount() + " ALT(s) at " + record.specNotation(), record.lineNumber());
		}

		double gq = Math.max(parseOrMissing(call.definedValue(format.gq)), parseOrMissing(call.definedValue(format.gqx)));
		if (gq < 0 || gq < params.minGq()) {
			return SampleCall.noCall();
		}

		int depth = depth(record, call, format);
		// zero depth carries no allele fraction, whatever MIN_DP says
		if (depth <= 0 || depth < params.minDp()) {
			return SampleCall.noCall();
		}

		String af = reusedAlleleFraction(record, call.definedValue(format.af), genotype.varAllele(), sampleIndex);
		if (af == null) {
			if (genotype.zygosity() == Genotype.Zygosity.HET || genotype.zygosity() == Genotype.Zygosity.HV) {
				af = alleleFraction(record, call, format, genotype.varAllele(), depth, sampleIndex);
			} else {
				af = ".";
			}
		}
		double afValue = ".".equals(af) ? -1 : Double.parseDouble(af);
		if (afValue >= 0 && afValue < params.minAf()) {
			return SampleCall.noCall();
		}

		if (afValue >= 0 && genotype.zygosity() == Genotype.Zygosity.HET && depth >= params.minDpHv()
				&& afValue >= params.minAfHv()) {
			genotype = new Genotype(genotype.varAllele(), genotype.varAllele());
			counters.incrementFixedToHV();
			logFix("HV", record, sampleIndex, depth, af);
		} else if (afValue >= 0 && genotype.first() != 0 && depth >= params.minDpHet() && afValue >= params.minAfHet()
				&& afValue <= params.maxAfHet()) {
			genotype = new Genotype(0, genotype.varAllele());
			counters.incrementFixedToHET();
			logFix("HET", record, sampleIndex, depth, af);
		}

		call.setGenotype(genotype);
		call.setAf(af);
		if (!format.has(format.dp)) {
			call.setInsertedDp(Integer.toString(depth));
		}
		return call;
	}

	/**
	 * max(DP, DPI, sumOfADs), unless MIN_DP is there, which then wins. A DP lower
	 * than sumOfADs is a caller bug and gets corrected in place.
	 *
	 * @return the depth, or -1 if none of the depth fields is defined
	 */
	int depth(VariantRecord record, SampleCall call, FormatKeys format) {
		int dp = (int) parseOrMissing(call.definedValue(format.dp));
		int depth = dp;
		int dpi = (int) parseOrMissing(call.definedValue(format.dpi));
		depth = Math.max(depth, dpi);
		String ad = call.definedValue(format.ad);
		if (ad != null && AD_PATTERN.matcher(ad).matches()) {
			int sumOfADs = 0;
			for (String count : ad.split(",")) {
				if (!count.isEmpty()) {
					sumOfADs += Integer.parseInt(count);
				}
			}
			depth = Math.max(depth, sumOfADs);
			if (dp >= 0 && dp < sumOfADs) {
				call.setValue(format.dp, Integer.toString(sumOfADs));
				counters.incrementFixedDP();
			}
		}
		String minDp = call.definedValue(format.minDp);
		if (minDp != null) {
			depth = (int) parseOrMissing(minDp);
		}
		return depth;
	}

	private String alleleFraction(VariantRecord record, SampleCall call, FormatKeys format, int varAllele, int depth, int sampleIndex) {
		String ad = call.definedValue(format.ad);
		if (ad == null || !AD_PATTERN.matcher(ad).matches()) {
			throw new VcfFormatException("sample " + sampleIndex + " is HET or HV but has no usable AD (" + ad + ") at "
					+ record.specNotation(), record.lineNumber());
		}
		String[] ads = ad.split(",");
		if (varAllele >= ads.length) {
			throw new VcfFormatException("sample " + sampleIndex + " AD " + ad + " has no value for allele " + varAllele + " at "
					+ record.specNotation(), record.lineNumber());
		}
		// MIN_DP may be lower than AD[x], AF stays within [0, 1]
		return roundFraction(Math.min(Integer.parseInt(ads[varAllele]), depth), depth);
	}

	/**
	 * An AF already in the FORMAT is kept. Callers writing it with Number=A
	 * give one value per ALT, the one of the variant allele is used (the first
	 * one for a HR call).
	 *
	 * @return the AF value, {@code .} if missing, or null if the field is absent
	 */
	private static String reusedAlleleFraction(VariantRecord record, String af, int varAllele, int sampleIndex) {
		if (af == null) {
			return null;
		}
		String[] values = af.split(",", -1);
		int index = values.length == 1 ? 0 : Math.max(varAllele - 1, 0);
		if (index >= values.length) {
			throw new VcfFormatException("sample " + sampleIndex + " AF " + af + " has no value for allele " + varAllele + " at "
					+ record.specNotation(), record.lineNumber());
		}
		String value = values[index];
		if (".".equals(value)) {
			return value;
		}
		try {
			Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new VcfFormatException("sample " + sampleIndex + " has unusable AF " + af + " at " + record.specNotation(),
					record.lineNumber());
		}
		return value;
	}

	/**
	 * Rounds to 2 decimals the same way printf("%.2f") does, ie on the exact
	 * binary value of the double.
	 */
	static String roundFraction(int numerator, int denominator) {
		double fraction = (double) numerator / denominator;
		return new BigDecimal(fraction).setScale(2, RoundingMode.HALF_EVEN).toPlainString();
	}

	private static double parseOrMissing(String value) {
		if (value == null) {
			return -1;
		}
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			return -1;
		}
	}

	private void logFix(String fixedTo, VariantRecord record, int sampleIndex, int depth, String af) {
		if (verbose >= 2) {
			log.info("fix to {}, {}:{} {} > {} sample {} DP={} AF={}", fixedTo, record.chrom(), record.pos(), record.alleles().ref(),
					record.alleles().altColumn(), sampleIndex, depth, af);
		}
	}
}

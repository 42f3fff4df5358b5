package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.common.base.Joiner;

import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.FormatKeys;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.Genotype;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.Genotype.Zygosity;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.SampleCall;
import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.VariantRecord;
import edu.harvard.hms.dbmi.avillach.gvcf.exception.VcfFormatException;

/**
 * Groups the samples of a cleaned record by genotype: HV (x/x), HET (0/x),
 * OTHER (x/y) and HR (0/0), genotypes in numeric order within each group.
 *
 * HET and HV samples carry an annotation whose content depends on which caller
 * produced the record, see {@link Dialect}.
 */
public class GenoColumnBuilder {

	private static final Joiner GENO_JOINER = Joiner.on('|');
	private static final Joiner SAMPLE_JOINER = Joiner.on(',');

	public enum Dialect {
		/** SNVs and short indels, FORMAT starts with GT:AF and has DP: [DP:AF] */
		SNV,
		/** CNVs, FORMAT starts with GT:RR and has BF: [BF:RR] */
		CNV_BF_RR,
		/** CNVs, FORMAT starts with GT:GQ:FR, maybe with BP: [GQ:FR:BP] or [GQ:FR] */
		CNV_GQ_FR;

		public static Dialect of(FormatKeys format, long lineNumber) {
			List<String> keys = format.keys();
			if (keys.size() >= 2 && FormatKeys.GT.equals(keys.get(0)) && FormatKeys.AF.equals(keys.get(1))) {
				if (format.dp < 0) {
					throw new VcfFormatException("FORMAT " + format + " starts with GT:AF but has no DP", lineNumber);
				}
				return SNV;
			}
			if (keys.size() >= 2 && FormatKeys.GT.equals(keys.get(0)) && FormatKeys.RR.equals(keys.get(1))) {
				if (format.bf < 0) {
					throw new VcfFormatException("FORMAT " + format + " starts with GT:RR but has no BF", lineNumber);
				}
				return CNV_BF_RR;
			}
			if (keys.size() >= 3 && FormatKeys.GT.equals(keys.get(0)) && FormatKeys.GQ.equals(keys.get(1))
					&& FormatKeys.FR.equals(keys.get(2))) {
				return CNV_GQ_FR;
			}
			throw new VcfFormatException("FORMAT " + format + " doesn't begin with GT:AF, GT:RR or GT:GQ:FR", lineNumber);
		}
	}

	/**
	 * @param sampleIds names of the sample columns, in column order
	 */
	public GenoGroupColumns build(VariantRecord record, List<String> sampleIds) {
		if (record.samples().size() != sampleIds.size()) {
			throw new VcfFormatException("record has " + record.samples().size() + " sample columns but the header names "
					+ sampleIds.size() + " samples", record.lineNumber());
		}
		Dialect dialect = Dialect.of(record.format(), record.lineNumber());
		Map<Zygosity, TreeMap<Genotype, List<String>>> groups = new EnumMap<>(Zygosity.class);
		for (Zygosity zygosity : Zygosity.values()) {
			groups.put(zygosity, new TreeMap<>());
		}

		for (int i = 0; i < sampleIds.size(); i++) {
			SampleCall call = record.samples().get(i);
			String gt = call.value(record.format().gt);
			if (Genotype.isNoCall(gt)) {
				continue;
			}
			Genotype genotype;
			try {
				genotype = Genotype.parse(gt).sorted();
			} catch (VcfFormatException e) {
				throw new VcfFormatException("sample " + i + ": " + e.getMessage(), record.lineNumber());
			}
			Zygosity zygosity = genotype.zygosity();
			String sample = sampleIds.get(i);
			if (zygosity == Zygosity.HET || zygosity == Zygosity.HV) {
				sample += annotation(dialect, record.format(), call, i, record.lineNumber());
			}
			groups.get(zygosity).computeIfAbsent(genotype, g -> new ArrayList<>()).add(sample);
		}

		return new GenoGroupColumns(render(groups.get(Zygosity.HV)), render(groups.get(Zygosity.HET)),
				render(groups.get(Zygosity.OTHER)), render(groups.get(Zygosity.HR)));
	}

	/**
	 * @return the bracketed annotation, empty when the call has no AF/RR/FR
	 */
	static String annotation(Dialect dialect, FormatKeys format, SampleCall call, int sampleIndex, long lineNumber) {
		switch (dialect) {
		case SNV:
			return annotate(call.definedValue(format.dp), call.definedValue(format.af), "DP", "AF", sampleIndex, lineNumber);
		case CNV_BF_RR:
			return annotate(call.definedValue(format.bf), call.definedValue(format.rr), "BF", "RR", sampleIndex, lineNumber);
		case CNV_GQ_FR:
			String fr = call.definedValue(format.fr);
			if (fr == null) {
				return "";
			}
			String gq = call.definedValue(format.gq);
			if (gq == null) {
				throw new VcfFormatException("sample " + sampleIndex + " has FR " + fr + " but no GQ", lineNumber);
			}
			String bp = call.definedValue(format.bp);
			return bp == null ? "[" + gq + ":" + fr + "]" : "[" + gq + ":" + fr + ":" + bp + "]";
		default:
			throw new IllegalStateException("unknown dialect " + dialect);
		}
	}

	private static String annotate(String depth, String fraction, String depthKey, String fractionKey, int sampleIndex,
			long lineNumber) {
		if (fraction == null) {
			return "";
		}
		if (depth == null) {
			throw new VcfFormatException("sample " + sampleIndex + " has " + fractionKey + " " + fraction + " but no " + depthKey,
					lineNumber);
		}
		return "[" + depth + ":" + fraction + "]";
	}

	private static String render(TreeMap<Genotype, List<String>> group) {
		List<String> genos = new ArrayList<>(group.size());
		for (Map.Entry<Genotype, List<String>> e : group.entrySet()) {
			genos.add(e.getKey() + "~" + SAMPLE_JOINER.join(e.getValue()));
		}
		return GENO_JOINER.join(genos);
	}
}

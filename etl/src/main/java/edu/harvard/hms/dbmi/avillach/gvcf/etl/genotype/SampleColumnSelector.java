package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.util.List;

import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.VariantRecord;
import edu.harvard.hms.dbmi.avillach.gvcf.exception.VcfFormatException;

/**
 * Which columns of the input survive: the 9 fixed VCF columns plus the retained
 * sample columns, in input order.
 */
public class SampleColumnSelector {

	private final int inputColumns;
	private final int[] keptColumns;
	private final List<String> keptSamples;

	public SampleColumnSelector(int inputColumns, int[] keptColumns, List<String> keptSamples) {
		this.inputColumns = inputColumns;
		this.keptColumns = keptColumns;
		this.keptSamples = List.copyOf(keptSamples);
	}

	public String[] select(String line, long lineNumber) {
		String[] fields = line.split("\t", -1);
		if (fields.length != inputColumns) {
			throw new VcfFormatException("expected " + inputColumns + " columns as in the #CHROM line but found " + fields.length,
					lineNumber);
		}
		if (keptColumns.length == inputColumns) {
			return fields;
		}
		String[] selected = new String[keptColumns.length];
		for (int i = 0; i < keptColumns.length; i++) {
			selected[i] = fields[keptColumns[i]];
		}
		return selected;
	}

	public int inputColumns() {
		return inputColumns;
	}

	public int sampleCount() {
		return keptColumns.length - VariantRecord.DATA;
	}

	public List<String> keptSamples() {
		return keptSamples;
	}
}

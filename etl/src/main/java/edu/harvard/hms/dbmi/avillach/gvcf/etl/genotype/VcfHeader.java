package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.util.List;

import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.VariantRecord;

/**
 * @param metaLines the {@code ##} lines, in input order
 * @param columns   the fields of the {@code #CHROM} line
 * @param lineCount number of input lines consumed, {@code #CHROM} included
 */
public record VcfHeader(List<String> metaLines, List<String> columns, long lineCount) {

	public List<String> sampleIds() {
		return columns.subList(VariantRecord.DATA, columns.size());
	}

	public long firstDataLineNumber() {
		return lineCount + 1;
	}
}

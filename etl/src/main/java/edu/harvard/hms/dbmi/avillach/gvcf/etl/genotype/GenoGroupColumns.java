package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

/**
 * The four GENOS columns of a record, each {@code geno~sample,sample|geno~sample}
 * or empty.
 */
public record GenoGroupColumns(String hv, String het, String other, String hr) {

	public String toColumns() {
		return hv + '\t' + het + '\t' + other + '\t' + hr;
	}
}

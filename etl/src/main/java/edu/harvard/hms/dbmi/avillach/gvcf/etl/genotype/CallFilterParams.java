package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

/**
 * Thresholds for cleaning genotype calls. Depth below means max(DP,DPI,sumOfADs).
 * <ul>
 * <li>depth &lt; minDp: NOCALL</li>
 * <li>max(GQ,GQX) &lt; minGq: NOCALL</li>
 * <li>AF &lt; minAf on a REF/VAR or VAR/VAR call: NOCALL</li>
 * <li>depth &gt;= minDpHv and AF &gt;= minAfHv: call becomes HV</li>
 * <li>depth &gt;= minDpHet and minAfHet &lt;= AF &lt;= maxAfHet: call becomes HET</li>
 * </ul>
 */
public record CallFilterParams(int minDp, double minGq, double minAf, int minDpHv, double minAfHv, int minDpHet, double minAfHet,
		double maxAfHet) {

	public CallFilterParams {
		if (minDp < 0 || minGq < 0 || minDpHv < 0 || minDpHet < 0) {
			throw new IllegalArgumentException("depth and quality thresholds cannot be negative");
		}
		checkFraction("minAF", minAf);
		checkFraction("minAF_HV", minAfHv);
		checkFraction("minAF_HET", minAfHet);
		checkFraction("maxAF_HET", maxAfHet);
		if (minAfHet > maxAfHet) {
			throw new IllegalArgumentException("minAF_HET (" + minAfHet + ") is greater than maxAF_HET (" + maxAfHet + ")");
		}
	}

	private static void checkFraction(String name, double value) {
		if (value < 0 || value > 1) {
			throw new IllegalArgumentException(name + " must be between 0 and 1, got " + value);
		}
	}
}

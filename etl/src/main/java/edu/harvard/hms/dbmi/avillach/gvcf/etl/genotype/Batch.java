package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.util.List;

/**
 * @param number 1-based, batches are written to the output in this order
 * @param firstLineNumber input line number of {@code lines.get(0)}
 */
public record Batch(int number, long firstLineNumber, List<String> lines) {
}

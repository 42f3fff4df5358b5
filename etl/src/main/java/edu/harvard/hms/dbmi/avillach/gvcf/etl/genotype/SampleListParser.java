package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Supplier;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;

/**
 * Reads the sample metadata table: tab-separated, with a header row that has a
 * {@code sampleID} column. Other columns are ignored. Rows whose sampleID is
 * {@code none} are placeholders and skipped.
 */
public class SampleListParser {

	public static final String SAMPLE_ID_COLUMN = "sampleID";
	public static final String NO_SAMPLE = "none";

	private final Logger log;

	public SampleListParser() {
		log = LoggerFactory.getLogger(SampleListParser.class);
	}

	// For testing only
	public SampleListParser(Logger log) {
		this.log = log;
	}

	/**
	 * @return the sample IDs in file order
	 * @throws IllegalArgumentException if the file has no sampleID column, or
	 *                                  lists a sample twice
	 */
	public Set<String> parse(Path samplesFile) {
		CSVFormat format = CSVFormat.DEFAULT.builder().setDelimiter('\t').setHeader().setSkipHeaderRecord(true)
				.setIgnoreEmptyLines(true).setTrim(true).build();
		Set<String> samples = new LinkedHashSet<>();
		try (Reader reader = Files.newBufferedReader(samplesFile, StandardCharsets.UTF_8);
				CSVParser parser = CSVParser.parse(reader, format)) {
			if (!parser.getHeaderMap().containsKey(SAMPLE_ID_COLUMN)) {
				throw new IllegalArgumentException("no column titled " + SAMPLE_ID_COLUMN + " in samples file " + samplesFile
						+ ", found " + parser.getHeaderNames());
			}
			int column = parser.getHeaderMap().get(SAMPLE_ID_COLUMN);
			for (CSVRecord r : parser) {
				String sample = runWithLogging(() -> requireValue(r.get(SAMPLE_ID_COLUMN)), r, column);
				if (NO_SAMPLE.equals(sample)) {
					continue;
				}
				if (!samples.add(sample)) {
					throw new IllegalArgumentException("Sample " + sample + " appears twice in samples file, second time on line "
							+ (r.getRecordNumber() + 1) + ", column " + (column + 1));
				}
			}
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		log.info("{} samples listed in {}", samples.size(), samplesFile);
		return samples;
	}

	/**
	 * Keeps only the samples of interest.
	 *
	 * @param samplesOfInterest comma-separated sample IDs, every one of them must
	 *                          be a known sample
	 */
	public Set<String> restrict(Set<String> samples, String samplesOfInterest) {
		Set<String> kept = new LinkedHashSet<>();
		for (String soi : Splitter.on(',').trimResults().omitEmptyStrings().split(samplesOfInterest)) {
			if (!samples.contains(soi)) {
				throw new IllegalArgumentException("sample of interest " + soi + " does not exist in the samples file");
			}
			if (!kept.add(soi)) {
				log.warn("sample of interest {} was specified twice, is that a typo?", soi);
			}
		}
		return kept;
	}

	private static String requireValue(String value) {
		if (value.isEmpty()) {
			throw new IllegalArgumentException("empty sampleID");
		}
		return value;
	}

	private <T> T runWithLogging(Supplier<T> supplier, CSVRecord r, int columnNumber) {
		try {
			return supplier.get();
		} catch (RuntimeException e) {
			String value = r.isSet(columnNumber) ? r.get(columnNumber) : "";
			throw new IllegalArgumentException("Exception parsing samples file on line " + (r.getRecordNumber() + 1) + ", column "
					+ (columnNumber + 1) + ". Value = \"" + value + "\"", e);
		}
	}
}

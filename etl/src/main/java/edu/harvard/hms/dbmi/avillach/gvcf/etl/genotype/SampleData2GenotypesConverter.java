package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;

import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.VariantRecord;

/**
 * The sampleData2genotypes stage: replaces the sample columns of a cleaned VCF
 * by the four GENOS columns HV, HET, OTHER and HR. {@code <NON_REF>} is dropped
 * from ALT, other columns up to INFO are copied.
 *
 * Runs sequentially, there is no per-record work worth parallelizing.
 */
public class SampleData2GenotypesConverter {

	private static final Logger log = LoggerFactory.getLogger(SampleData2GenotypesConverter.class);

	public static final String PROGRAM_NAME = "sampleData2genotypes";
	public static final String GENOS = "GENOS";

	private final RunContext context;
	private final GenoColumnBuilder builder = new GenoColumnBuilder();

	public SampleData2GenotypesConverter(RunContext context) {
		this.context = context;
	}

	/**
	 * @return the number of data lines converted
	 */
	public long convert(BufferedReader in, Writer out) throws IOException {
		Stopwatch stopwatch = Stopwatch.createStarted();
		log.info("{} starting", context.programName());
		VcfHeaderRewriter headerRewriter = new VcfHeaderRewriter(context);
		VcfHeader header = headerRewriter.read(in);
		headerRewriter.writeGenosHeader(header, out);

		long lineNumber = header.lineCount();
		long converted = 0;
		String line;
		while ((line = in.readLine()) != null) {
			lineNumber++;
			if (line.isEmpty()) {
				continue;
			}
			VariantRecord record = VariantRecord.parse(line, lineNumber, header.sampleIds().size());
			GenoGroupColumns genos = builder.build(record, header.sampleIds());

			String[] fields = line.split("\t", VariantRecord.FORMAT + 1);
			fields[VariantRecord.ALT] = fields[VariantRecord.ALT].replace(",<NON_REF>", "");
			for (int i = 0; i < VariantRecord.FORMAT; i++) {
				out.write(fields[i]);
				out.write('\t');
			}
			out.write(GENOS);
			out.write('\t');
			out.write(genos.toColumns());
			out.write('\n');
			converted++;
		}
		out.flush();
		log.info("{} done in {}, {} records converted", context.programName(), stopwatch, converted);
		return converted;
	}
}

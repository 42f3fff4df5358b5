package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;

/**
 * The filterBadCalls stage: reads a (G)VCF, writes it back with bad calls
 * turned into NOCALLs, blatantly wrong calls fixed, unused ALTs removed,
 * alleles trimmed and records without any remaining call dropped.
 */
public class FilterBadCallsRunner {

	private static final Logger log = LoggerFactory.getLogger(FilterBadCallsRunner.class);

	public static final String PROGRAM_NAME = "filterBadCalls";

	private final FilterRunOptions options;
	private final RunContext context;
	private final SampleListParser sampleListParser;

	public FilterBadCallsRunner(FilterRunOptions options, RunContext context) {
		this(options, context, new SampleListParser());
	}

	FilterBadCallsRunner(FilterRunOptions options, RunContext context, SampleListParser sampleListParser) {
		this.options = options;
		this.context = context;
		this.sampleListParser = sampleListParser;
	}

	public RunSummary run(InputStream in, OutputStream out) throws IOException, InterruptedException {
		Stopwatch stopwatch = Stopwatch.createStarted();
		log.info("{} starting, {} jobs, thresholds {}", context.programName(), options.jobs(), options.params());

		BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), 1 << 16);
		VcfHeaderRewriter headerRewriter = new VcfHeaderRewriter(context);
		VcfHeader header = headerRewriter.read(reader);

		Set<String> retained = retainedSamples(header);
		SampleColumnSelector columns = headerRewriter.selectSamples(header, retained::contains);
		if (columns.sampleCount() == 0) {
			throw new IllegalArgumentException(context.describe("none of the " + header.sampleIds().size()
					+ " samples of the input is retained, nothing to do"));
		}
		log.info("keeping {} of {} sample columns", columns.sampleCount(), header.sampleIds().size());

		Writer headerOut = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
		headerRewriter.writeFilterHeader(header, columns, headerOut);
		headerOut.flush();

		BatchProcessor processor = new BatchProcessor(options.params(), columns, options.keepHR(), options.verbose());
		BatchOrchestrator orchestrator = new BatchOrchestrator(processor, options.jobs(), options.tmpDir(),
				options.pollIntervalMillis());
		LineBatcher batcher = new LineBatcher(reader, header.firstDataLineNumber(),
				AdaptiveBatchSizer.forConfig(options.batchSize(), orchestrator.getWorkerCount()));

		RunSummary summary = orchestrator.run(batcher, out);
		out.flush();
		log.info("{} done in {}: {}", context.programName(), stopwatch, summary);
		return summary;
	}

	Set<String> retainedSamples(VcfHeader header) {
		Set<String> samples = options.samplesFile() == null
				? new LinkedHashSet<>(header.sampleIds())
				: sampleListParser.parse(options.samplesFile());
		if (options.hasSamplesOfInterest()) {
			samples = sampleListParser.restrict(samples, options.samplesOfInterest());
		}
		return samples;
	}
}

package edu.harvard.hms.dbmi.avillach.gvcf.service;

import edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype.FilterBadCallsRunner;
import edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype.RunContext;
import edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype.RunSummary;
import edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype.SampleData2GenotypesConverter;
import edu.harvard.hms.dbmi.avillach.gvcf.service.config.FilterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FileDescriptor;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * (G)VCF genotype-call filter.
 *
 * Reads a VCF on stdin and writes the result on stdout, logs go to stderr.
 *
 * Run with:
 * java -jar filter-service.jar --filter.samples-file=samples.tsv --filter.tmp-dir=/mnt/ramdisk/tmp_filter \
 *   --filter.jobs=16 [--filter.keep-hr=true] < in.g.vcf > out.g.vcf
 * java -jar filter-service.jar --filter.mode=SAMPLE_DATA_2_GENOTYPES < out.vcf > genos.vcf
 */
@SpringBootApplication
@ConfigurationPropertiesScan("edu.harvard.hms.dbmi.avillach.gvcf.service.config")
public class FilterServiceApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(FilterServiceApplication.class);

    private final FilterConfig config;

    public FilterServiceApplication(FilterConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(FilterServiceApplication.class);
        app.run(args);
    }

    @Override
    public void run(String... args) throws Exception {
        InputStream in = new FileInputStream(FileDescriptor.in);
        OutputStream out = new BufferedOutputStream(new FileOutputStream(FileDescriptor.out), 1 << 16);
        try {
            run(in, out, args);
        } finally {
            out.flush();
        }
    }

    void run(InputStream in, OutputStream out, String... args) throws Exception {
        switch (config.getMode()) {
            case FILTER_BAD_CALLS -> {
                RunContext context = RunContext.of(FilterBadCallsRunner.PROGRAM_NAME, args);
                RunSummary summary = new FilterBadCallsRunner(config.toFilterRunOptions(), context).run(in, out);
                log.info("=== FILTER COMPLETE ===");
                log.info("Batches: {}", summary.batches());
                log.info("Data lines read: {}", summary.linesRead());
                log.info("Records written: {}", summary.recordsWritten());
                log.info("Calls fixed to HV: {}", summary.counters().getFixedToHV());
                log.info("Calls fixed to HET: {}", summary.counters().getFixedToHET());
                log.info("DP values fixed: {}", summary.counters().getFixedDP());
            }
            case SAMPLE_DATA_2_GENOTYPES -> {
                RunContext context = RunContext.of(SampleData2GenotypesConverter.PROGRAM_NAME, args);
                BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), 1 << 16);
                Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
                long converted = new SampleData2GenotypesConverter(context).convert(reader, writer);
                log.info("=== CONVERSION COMPLETE, {} records ===", converted);
            }
        }
    }
}

package edu.harvard.hms.dbmi.avillach.gvcf.service.config;

import edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype.CallFilterParams;
import edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype.FilterRunOptions;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the call filter.
 *
 * Uses Spring Boot property binding with fail-fast validation.
 * All properties use the "filter.*" prefix, defaults are in application.properties.
 */
@ConfigurationProperties(prefix = "filter")
@Validated
public class FilterConfig {
    private static final Logger log = LoggerFactory.getLogger(FilterConfig.class);

    public enum Mode {
        FILTER_BAD_CALLS,
        SAMPLE_DATA_2_GENOTYPES
    }

    private Mode mode = Mode.FILTER_BAD_CALLS;

    // filterBadCalls only
    private String samplesFile; // null = keep every sample of the input
    private String samplesOfInterest;
    private boolean keepHr = false;
    private String tmpDir;
    private int jobs;
    private int batchSize; // 0 = adaptive
    private int verbose;
    private long pollIntervalMillis;

    // thresholds, no defaults here
    private Integer minDp;
    private Double minGq;
    private Double minAf;
    private Integer minDpHv;
    private Double minAfHv;
    private Integer minDpHet;
    private Double minAfHet;
    private Double maxAfHet;

    @PostConstruct
    public void validateAndLog() {
        log.info("=== VALIDATING CONFIGURATION ===");

        List<String> errors = new ArrayList<>();
        if (mode == null) {
            errors.add("filter.mode is required");
        }
        if (mode == Mode.FILTER_BAD_CALLS) {
            validateFilterProperties(errors);
        }

        if (!errors.isEmpty()) {
            String errorMsg = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        log.info("=== EFFECTIVE CONFIGURATION ===");
        log.info("Mode: {}", mode);
        if (mode == Mode.FILTER_BAD_CALLS) {
            log.info("Samples file: {}", samplesFile != null ? samplesFile : "(none - every sample is kept)");
            log.info("Samples of interest: {}", samplesOfInterest != null && !samplesOfInterest.isBlank() ? samplesOfInterest : "(all)");
            log.info("Keep HR: {}", keepHr);
            log.info("Tmp dir: {}", tmpDir);
            log.info("Jobs: {}", jobs);
            log.info("Batch size: {}", batchSize == 0 ? "adaptive" : batchSize);
            log.info("Thresholds: {}", toCallFilterParams());
        }
        log.info("================================");
    }

    private void validateFilterProperties(List<String> errors) {
        if (tmpDir == null || tmpDir.isBlank()) {
            errors.add("filter.tmp-dir is required");
        } else if (Files.exists(Path.of(tmpDir))) {
            errors.add("Tmp dir already exists, remove it or choose another one: " + tmpDir);
        }
        if (jobs < 2) {
            errors.add("filter.jobs must be at least 2 (one job only writes the output), got " + jobs);
        }
        if (batchSize < 0) {
            errors.add("filter.batch-size must be 0 (adaptive) or positive, got " + batchSize);
        }
        if (pollIntervalMillis < 1) {
            errors.add("filter.poll-interval-millis must be positive, got " + pollIntervalMillis);
        }
        if (verbose < 0) {
            errors.add("filter.verbose cannot be negative, got " + verbose);
        }
        if (samplesFile != null && !samplesFile.isBlank() && !Files.isRegularFile(Path.of(samplesFile))) {
            errors.add("Samples file not found: " + samplesFile);
        }

        List<String> missing = new ArrayList<>();
        if (minDp == null) missing.add("filter.min-dp");
        if (minGq == null) missing.add("filter.min-gq");
        if (minAf == null) missing.add("filter.min-af");
        if (minDpHv == null) missing.add("filter.min-dp-hv");
        if (minAfHv == null) missing.add("filter.min-af-hv");
        if (minDpHet == null) missing.add("filter.min-dp-het");
        if (minAfHet == null) missing.add("filter.min-af-het");
        if (maxAfHet == null) missing.add("filter.max-af-het");
        if (!missing.isEmpty()) {
            errors.add("Missing thresholds: " + String.join(", ", missing));
            return;
        }
        try {
            toCallFilterParams();
        } catch (IllegalArgumentException e) {
            errors.add("Invalid thresholds: " + e.getMessage());
        }
    }

    public CallFilterParams toCallFilterParams() {
        return new CallFilterParams(minDp, minGq, minAf, minDpHv, minAfHv, minDpHet, minAfHet, maxAfHet);
    }

    public FilterRunOptions toFilterRunOptions() {
        return new FilterRunOptions(
            toCallFilterParams(),
            samplesFile == null || samplesFile.isBlank() ? null : Path.of(samplesFile),
            samplesOfInterest,
            keepHr,
            Path.of(tmpDir),
            jobs,
            batchSize,
            verbose,
            pollIntervalMillis
        );
    }

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public String getSamplesFile() {
        return samplesFile;
    }

    public void setSamplesFile(String samplesFile) {
        this.samplesFile = samplesFile;
    }

    public String getSamplesOfInterest() {
        return samplesOfInterest;
    }

    public void setSamplesOfInterest(String samplesOfInterest) {
        this.samplesOfInterest = samplesOfInterest;
    }

    public boolean isKeepHr() {
        return keepHr;
    }

    public void setKeepHr(boolean keepHr) {
        this.keepHr = keepHr;
    }

    public String getTmpDir() {
        return tmpDir;
    }

    public void setTmpDir(String tmpDir) {
        this.tmpDir = tmpDir;
    }

    public int getJobs() {
        return jobs;
    }

    public void setJobs(int jobs) {
        this.jobs = jobs;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getVerbose() {
        return verbose;
    }

    public void setVerbose(int verbose) {
        this.verbose = verbose;
    }

    public long getPollIntervalMillis() {
        return pollIntervalMillis;
    }

    public void setPollIntervalMillis(long pollIntervalMillis) {
        this.pollIntervalMillis = pollIntervalMillis;
    }

    public Integer getMinDp() {
        return minDp;
    }

    public void setMinDp(Integer minDp) {
        this.minDp = minDp;
    }

    public Double getMinGq() {
        return minGq;
    }

    public void setMinGq(Double minGq) {
        this.minGq = minGq;
    }

    public Double getMinAf() {
        return minAf;
    }

    public void setMinAf(Double minAf) {
        this.minAf = minAf;
    }

    public Integer getMinDpHv() {
        return minDpHv;
    }

    public void setMinDpHv(Integer minDpHv) {
        this.minDpHv = minDpHv;
    }

    public Double getMinAfHv() {
        return minAfHv;
    }

    public void setMinAfHv(Double minAfHv) {
        this.minAfHv = minAfHv;
    }

    public Integer getMinDpHet() {
        return minDpHet;
    }

    public void setMinDpHet(Integer minDpHet) {
        this.minDpHet = minDpHet;
    }

    public Double getMinAfHet() {
        return minAfHet;
    }

    public void setMinAfHet(Double minAfHet) {
        this.minAfHet = minAfHet;
    }

    public Double getMaxAfHet() {
        return maxAfHet;
    }

    public void setMaxAfHet(Double maxAfHet) {
        this.maxAfHet = maxAfHet;
    }
}

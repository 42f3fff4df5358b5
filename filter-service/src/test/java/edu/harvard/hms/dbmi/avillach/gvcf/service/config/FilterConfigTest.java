package edu.harvard.hms.dbmi.avillach.gvcf.service.config;

import edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype.FilterRunOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FilterConfigTest {

    @TempDir
    Path workDir;

    private FilterConfig config;

    static FilterConfig validConfig(Path tmpDir) {
        FilterConfig config = new FilterConfig();
        config.setTmpDir(tmpDir.toString());
        config.setJobs(4);
        config.setBatchSize(0);
        config.setPollIntervalMillis(50);
        config.setMinDp(10);
        config.setMinGq(20.0);
        config.setMinAf(0.15);
        config.setMinDpHv(20);
        config.setMinAfHv(0.85);
        config.setMinDpHet(20);
        config.setMinAfHet(0.25);
        config.setMaxAfHet(0.75);
        return config;
    }

    @BeforeEach
    public void setup() {
        config = validConfig(workDir.resolve("tmp_filter"));
    }

    @Test
    public void validateAndLog_valid() {
        config.validateAndLog();

        FilterRunOptions options = config.toFilterRunOptions();
        assertEquals(4, options.jobs());
        assertEquals(0.85, options.params().minAfHv());
        assertNull(options.samplesFile());
        assertFalse(options.hasSamplesOfInterest());
        assertFalse(options.keepHR());
    }

    @Test
    public void validateAndLog_oneJob() {
        config.setJobs(1);
        IllegalStateException e = assertThrows(IllegalStateException.class, config::validateAndLog);
        assertTrue(e.getMessage().contains("filter.jobs"));
    }

    @Test
    public void validateAndLog_existingTmpDir() throws IOException {
        Path existing = Files.createDirectory(workDir.resolve("existing"));
        config.setTmpDir(existing.toString());
        IllegalStateException e = assertThrows(IllegalStateException.class, config::validateAndLog);
        assertTrue(e.getMessage().contains("already exists"));
    }

    @Test
    public void validateAndLog_missingSamplesFile() {
        config.setSamplesFile(workDir.resolve("nope.tsv").toString());
        IllegalStateException e = assertThrows(IllegalStateException.class, config::validateAndLog);
        assertTrue(e.getMessage().contains("Samples file not found"));
    }

    @Test
    public void validateAndLog_missingThresholds() {
        config.setMinAfHet(null);
        config.setMinDp(null);
        IllegalStateException e = assertThrows(IllegalStateException.class, config::validateAndLog);
        assertTrue(e.getMessage().contains("filter.min-dp"));
        assertTrue(e.getMessage().contains("filter.min-af-het"));
    }

    @Test
    public void validateAndLog_invalidThresholds() {
        config.setMinAfHet(0.8);
        IllegalStateException e = assertThrows(IllegalStateException.class, config::validateAndLog);
        assertTrue(e.getMessage().contains("Invalid thresholds"));
    }

    @Test
    public void validateAndLog_collectsEveryError() {
        config.setJobs(0);
        config.setBatchSize(-1);
        config.setTmpDir(null);
        IllegalStateException e = assertThrows(IllegalStateException.class, config::validateAndLog);
        assertTrue(e.getMessage().contains("filter.tmp-dir"));
        assertTrue(e.getMessage().contains("filter.jobs"));
        assertTrue(e.getMessage().contains("filter.batch-size"));
    }

    @Test
    public void validateAndLog_genotypesModeSkipsFilterProperties() {
        FilterConfig genos = new FilterConfig();
        genos.setMode(FilterConfig.Mode.SAMPLE_DATA_2_GENOTYPES);
        assertDoesNotThrow(genos::validateAndLog);
    }
}

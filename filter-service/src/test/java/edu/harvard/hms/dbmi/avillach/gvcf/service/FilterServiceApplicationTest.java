package edu.harvard.hms.dbmi.avillach.gvcf.service;

import edu.harvard.hms.dbmi.avillach.gvcf.service.config.FilterConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FilterServiceApplicationTest {

    private static final String INPUT = String.join("\n",
            "##fileformat=VCFv4.2",
            "#CHROM\tPOS\tID\tREF\tALT\tQUAL\tFILTER\tINFO\tFORMAT\tS1\tS2",
            "chr1\t100\t.\tA\tG,<NON_REF>\t50\tPASS\tMQ=60\tGT:DP:AD:GQ\t0/1:30:15,15,0:50\t0/0:30:30,0,0:50",
            "chr1\t200\t.\tC\tT,<NON_REF>\t50\tPASS\tMQ=60\tGT:DP:AD:GQ\t0/1:5:3,2,0:50\t0/0:30:30,0,0:50",
            "");

    @TempDir
    Path workDir;

    private FilterConfig config(FilterConfig.Mode mode) {
        FilterConfig config = new FilterConfig();
        config.setMode(mode);
        config.setTmpDir(workDir.resolve("tmp_filter").toString());
        config.setJobs(2);
        config.setPollIntervalMillis(5);
        config.setMinDp(10);
        config.setMinGq(20.0);
        config.setMinAf(0.15);
        config.setMinDpHv(20);
        config.setMinAfHv(0.85);
        config.setMinDpHet(20);
        config.setMinAfHet(0.25);
        config.setMaxAfHet(0.75);
        config.validateAndLog();
        return config;
    }

    private String run(FilterConfig.Mode mode, String input) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new FilterServiceApplication(config(mode)).run(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out,
                "--filter.jobs=2");
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void filterThenGenotypes() throws Exception {
        String filtered = run(FilterConfig.Mode.FILTER_BAD_CALLS, INPUT);
        assertEquals(String.join("\n",
                "##fileformat=VCFv4.2",
                "##filterBadCalls=<commandLine=\"filterBadCalls --filter.jobs=2\">",
                "#CHROM\tPOS\tID\tREF\tALT\tQUAL\tFILTER\tINFO\tFORMAT\tS1\tS2",
                "chr1\t100\t.\tA\tG,<NON_REF>\t.\tPASS\t.\tGT:AF:DP:AD:GQ\t0/1:0.50:30:15,15,0:50\t0/0:.:30:30,0,0:50",
                ""), filtered);
        assertFalse(Files.exists(workDir.resolve("tmp_filter")));

        String genos = run(FilterConfig.Mode.SAMPLE_DATA_2_GENOTYPES, filtered);
        assertTrue(genos.contains("##sampleData2genotypes=<commandLine=\"sampleData2genotypes --filter.jobs=2\">\n"));
        assertTrue(genos.endsWith("chr1\t100\t.\tA\tG\t.\tPASS\t.\tGENOS\t\t0/1~S1[30:0.50]\t\t0/0~S2\n"));
    }
}

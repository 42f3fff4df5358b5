package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import edu.harvard.hms.dbmi.avillach.gvcf.data.genotype.VariantRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdjacentRecordMergerTest {

    private List<VariantRecord> emitted;
    private AdjacentRecordMerger merger;

    @BeforeEach
    public void setup() {
        emitted = new ArrayList<>();
        merger = new AdjacentRecordMerger(emitted::add);
    }

    private static VariantRecord record(String chrom, int pos, String ref, String alt, String info) {
        String line = chrom + "\t" + pos + "\t.\t" + ref + "\t" + alt + "\t.\t.\t" + info + "\tGT:DP:GQ\t0/1:30:50";
        return VariantRecord.parse(line, pos, 1);
    }

    private List<String> positions() {
        List<String> positions = new ArrayList<>();
        for (VariantRecord record : emitted) {
            positions.add(record.chrom() + ":" + record.pos() + " " + record.alleles());
        }
        return positions;
    }

    @Test
    public void homRefBeforeIndelAtSamePosIsDiscarded() {
        merger.accept(record("chr1", 100, "A", "<NON_REF>", "."));
        merger.accept(record("chr1", 100, "AT", "A,<NON_REF>", "."));
        merger.flush();
        assertEquals(List.of("chr1:100 AT>A,<NON_REF>"), positions());
        assertEquals(1, merger.getDiscarded());
    }

    @Test
    public void homRefAfterVariantAtSamePosIsDiscarded() {
        merger.accept(record("chr1", 100, "AT", "A", "."));
        merger.accept(record("chr1", 100, "A", ".", "."));
        merger.flush();
        assertEquals(List.of("chr1:100 AT>A"), positions());
        assertEquals(1, merger.getDiscarded());
    }

    @Test
    public void twoVariantsAtSamePosAreBothKept() {
        merger.accept(record("chr1", 100, "A", "G", "."));
        merger.accept(record("chr1", 100, "AT", "A", "."));
        merger.flush();
        assertEquals(List.of("chr1:100 A>G", "chr1:100 AT>A"), positions());
        assertEquals(0, merger.getDiscarded());
    }

    @Test
    public void blockEndingOnIndelIsShortened() {
        VariantRecord block = record("chr1", 100, "C", "<NON_REF>", "END=105;BLOCKAVG_min30p3a");
        merger.accept(block);
        merger.accept(record("chr1", 105, "AT", "A", "."));
        merger.flush();
        assertEquals(2, emitted.size());
        assertEquals(104, block.end());
        assertEquals("END=104;BLOCKAVG_min30p3a", block.info());
        assertEquals(1, merger.getEndsDecremented());
    }

    @Test
    public void blockEndingBeforeIsUntouched() {
        VariantRecord block = record("chr1", 100, "C", "<NON_REF>", "END=104");
        merger.accept(block);
        merger.accept(record("chr1", 105, "AT", "A", "."));
        merger.flush();
        assertEquals(104, block.end());
        assertEquals(0, merger.getEndsDecremented());
    }

    @Test
    public void outOfOrderRecordsAreSwapped() {
        merger.accept(record("chr1", 200, "T", "G", "."));
        merger.accept(record("chr1", 199, "C", "A", "."));
        merger.accept(record("chr1", 300, "C", "A", "."));
        merger.flush();
        assertEquals(List.of("chr1:199 C>A", "chr1:200 T>G", "chr1:300 C>A"), positions());
        assertEquals(1, merger.getSwapped());
    }

    @Test
    public void chromosomeChange() {
        merger.accept(record("chr1", 500, "A", "<NON_REF>", "."));
        merger.accept(record("chr2", 500, "AT", "A", "."));
        merger.flush();
        assertEquals(List.of("chr1:500 A><NON_REF>", "chr2:500 AT>A"), positions());
    }

    @Test
    public void flushEmptyAndTwice() {
        merger.flush();
        merger.accept(record("chr1", 1, "A", "G", "."));
        merger.flush();
        merger.flush();
        assertEquals(1, emitted.size());
    }
}

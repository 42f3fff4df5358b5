package edu.harvard.hms.dbmi.avillach.gvcf.data.genotype;

import edu.harvard.hms.dbmi.avillach.gvcf.exception.VcfFormatException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VariantRecordTest {

    private static final String LINE = "chr1\t1000\trs1\tA\tG,<NON_REF>\t55.2\tPASS\tEND=1005;BLOCKAVG=1\tGT:DP:GQ\t0/0:30:50\t./.";

    @Test
    public void parse() {
        VariantRecord record = VariantRecord.parse(LINE, 7, 2);
        assertEquals("chr1", record.chrom());
        assertEquals(1000, record.pos());
        assertEquals("rs1", record.id());
        assertEquals("A", record.alleles().ref().bases());
        assertEquals(2, record.alleles().altCount());
        assertEquals(2, record.samples().size());
        assertEquals(1005, record.end());
        assertEquals(7, record.lineNumber());
        assertFalse(record.isNonVariant());
    }

    @Test
    public void parse_wrongColumnCount() {
        VcfFormatException e = assertThrows(VcfFormatException.class, () -> VariantRecord.parse(LINE, 7, 3));
        assertTrue(e.getMessage().contains("input line 7"));
    }

    @Test
    public void parse_badPos() {
        assertThrows(VcfFormatException.class, () -> VariantRecord.parse(LINE.replace("1000", "10x0"), 1, 2));
    }

    @Test
    public void setEnd_keepsOtherInfo() {
        VariantRecord record = VariantRecord.parse(LINE, 7, 2);
        record.setEnd(1004);
        assertEquals("END=1004;BLOCKAVG=1", record.info());
        assertEquals(1004, record.end());
    }

    @Test
    public void end_absent() {
        VariantRecord record = VariantRecord.parse(LINE.replace("END=1005;BLOCKAVG=1", "DP=30"), 7, 2);
        assertEquals(-1, record.end());
        assertThrows(IllegalStateException.class, () -> record.setEnd(3));
    }

    @Test
    public void isNonVariant() {
        assertTrue(VariantRecord.parse(LINE.replace("G,<NON_REF>", "<NON_REF>"), 1, 2).isNonVariant());
        assertTrue(VariantRecord.parse(LINE.replace("G,<NON_REF>", "."), 1, 2).isNonVariant());
    }

    @Test
    public void toLine() {
        VariantRecord record = VariantRecord.parse(LINE, 7, 2);
        record.samples().get(0).setGenotype(new Genotype(0, 0));
        record.setQual(".");
        assertEquals("chr1\t1000\trs1\tA\tG,<NON_REF>\t.\tPASS\tEND=1005;BLOCKAVG=1\tGT:AF:DP:GQ\t0/0:.:30:50\t./.", record.toLine());
    }
}

package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntSupplier;

import static org.junit.jupiter.api.Assertions.*;

class LineBatcherTest {

    static String line(String chrom, int pos, String ref, String alt) {
        return chrom + "\t" + pos + "\t.\t" + ref + "\t" + alt + "\t.\tPASS\t.\tGT:DP\t0/1:30";
    }

    private static LineBatcher batcher(IntSupplier size, String... lines) {
        return new LineBatcher(new BufferedReader(new StringReader(String.join("\n", lines))), 101, size);
    }

    private static List<Batch> drain(LineBatcher batcher) throws IOException {
        List<Batch> batches = new ArrayList<>();
        Batch batch;
        while ((batch = batcher.next()) != null) {
            batches.add(batch);
        }
        return batches;
    }

    @Test
    public void fixedSizeOverSnvs() throws IOException {
        String[] lines = new String[5];
        for (int i = 0; i < lines.length; i++) {
            lines[i] = line("chr1", i + 1, "A", "G");
        }
        LineBatcher batcher = batcher(() -> 2, lines);
        List<Batch> batches = drain(batcher);

        assertEquals(3, batches.size());
        assertEquals(List.of(lines[0], lines[1]), batches.get(0).lines());
        assertEquals(List.of(lines[2], lines[3]), batches.get(1).lines());
        assertEquals(List.of(lines[4]), batches.get(2).lines());
        assertEquals(1, batches.get(0).number());
        assertEquals(3, batches.get(2).number());
        assertEquals(101, batches.get(0).firstLineNumber());
        assertEquals(103, batches.get(1).firstLineNumber());
        assertEquals(105, batches.get(2).firstLineNumber());
        assertEquals(3, batcher.getBatchCount());
    }

    @Test
    public void indelKeepsItsReachTogether() throws IOException {
        String[] lines = {
                line("chr1", 1, "A", "G"),
                line("chr1", 2, "C", "T"),
                line("chr1", 3, "AT", "ATTT"),
                line("chr1", 4, "T", "C"),
                line("chr1", 5, "G", "A"),
                line("chr1", 6, "G", "A"),
        };
        List<Batch> batches = drain(batcher(() -> 2, lines));

        assertEquals(2, batches.size());
        assertEquals(4, batches.get(0).lines().size());
        assertEquals(List.of(lines[4], lines[5]), batches.get(1).lines());
        assertEquals(105, batches.get(1).firstLineNumber());
    }

    @Test
    public void indelNeverStartsABatch() throws IOException {
        String[] lines = {
                line("chr1", 1, "A", "G"),
                line("chr1", 10, "AT", "A"),
                line("chr1", 20, "A", "AT"),
                line("chr1", 30, "G", "A"),
        };
        List<Batch> batches = drain(batcher(() -> 1, lines));

        assertEquals(2, batches.size());
        assertEquals(List.of(lines[0], lines[1], lines[2]), batches.get(0).lines());
        assertEquals(List.of(lines[3]), batches.get(1).lines());
    }

    @Test
    public void chromosomeChangeResetsReach() throws IOException {
        String[] lines = {
                line("chr1", 100, "ATTTT", "ATTTA"),
                line("chr1", 102, "C", "G"),
                line("chr2", 50, "C", "G"),
                line("chr2", 101, "C", "G"),
        };
        List<Batch> batches = drain(batcher(() -> 1, lines));

        assertEquals(3, batches.size());
        assertEquals(List.of(lines[0], lines[1]), batches.get(0).lines());
        assertEquals(List.of(lines[2]), batches.get(1).lines());
        assertEquals(List.of(lines[3]), batches.get(2).lines());
    }

    @Test
    public void unreadableLinesNeverCloseABatch() throws IOException {
        String[] lines = {
                line("chr1", 10, "A", "G"),
                "garbage",
                "chr1\tten\t.\tA\tG\t.\tPASS\t.\tGT\t0/1",
                "",
                line("chr1", 20, "A", "G"),
        };
        List<Batch> batches = drain(batcher(() -> 1, lines));

        assertEquals(2, batches.size());
        assertEquals(List.of(lines[0], lines[1], lines[2], lines[3]), batches.get(0).lines());
        assertEquals(List.of(lines[4]), batches.get(1).lines());
        assertEquals(105, batches.get(1).firstLineNumber());
    }

    @Test
    public void sizeIsAskedPerBatch() throws IOException {
        String[] lines = new String[6];
        for (int i = 0; i < lines.length; i++) {
            lines[i] = line("chr1", i + 1, "A", "G");
        }
        int[] sizes = {1, 3, 5};
        int[] asked = {0};
        List<Batch> batches = drain(batcher(() -> sizes[asked[0]++], lines));

        assertEquals(3, batches.size());
        assertEquals(1, batches.get(0).lines().size());
        assertEquals(3, batches.get(1).lines().size());
        assertEquals(2, batches.get(2).lines().size());
    }

    @Test
    public void emptyInput() throws IOException {
        LineBatcher batcher = new LineBatcher(new BufferedReader(new StringReader("")), 1, () -> 10);
        assertNull(batcher.next());
        assertNull(batcher.next());
        assertEquals(0, batcher.getBatchCount());
    }

    @Test
    public void siteReach() {
        LineBatcher.Site snv = LineBatcher.site(line("chr1", 7, "A", "G"));
        assertFalse(snv.indelCandidate());
        assertEquals(7, snv.reach());

        assertEquals(9, LineBatcher.site(line("chr1", 7, "ATT", "ATTTT,A")).reach());
        assertEquals(7, LineBatcher.site(line("chr1", 7, "AT", "<NON_REF>")).reach());
        assertTrue(LineBatcher.site(line("chr1", 7, "AT", "<NON_REF>")).indelCandidate());
        assertFalse(LineBatcher.site(line("chr1", 7, "A", "<NON_REF>")).indelCandidate());
        assertNull(LineBatcher.site("chr1\t7\t."));
        assertNull(LineBatcher.site(""));
    }
}

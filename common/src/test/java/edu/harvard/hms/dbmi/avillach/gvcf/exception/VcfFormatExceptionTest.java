package edu.harvard.hms.dbmi.avillach.gvcf.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VcfFormatExceptionTest {

    @Test
    public void lineNumberInMessage() {
        VcfFormatException e = new VcfFormatException("bad GT", 42);
        assertEquals("bad GT (input line 42)", e.getMessage());
        assertEquals(42, e.getLineNumber());
    }

    @Test
    public void unknownLineNumber() {
        VcfFormatException e = new VcfFormatException("bad GT");
        assertEquals("bad GT", e.getMessage());
        assertEquals(-1, e.getLineNumber());
    }

    @Test
    public void batchFailureKeepsCause() {
        VcfFormatException cause = new VcfFormatException("bad GT", 42);
        BatchFailedException e = new BatchFailedException(3, cause);
        assertSame(cause, e.getCause());
        assertEquals(3, e.getBatchNumber());
        assertTrue(e.getMessage().contains("batch 3"));
        assertTrue(e.getMessage().contains("input line 42"));
    }
}

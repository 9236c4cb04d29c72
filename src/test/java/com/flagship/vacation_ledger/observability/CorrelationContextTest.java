package com.flagship.vacation_ledger.observability;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationContextTest {

    @Test
    void keepsWellFormedCallerId() {
        assertEquals("trace-123", CorrelationContext.acceptOrGenerate(" trace-123 "));
    }

    @Test
    void replacesMissingOrUnsafeIds() {
        assertEquals(8, CorrelationContext.acceptOrGenerate(null).length());
        assertEquals(8, CorrelationContext.acceptOrGenerate("  ").length());
        assertNotEquals("bad id\nforged log line",
            CorrelationContext.acceptOrGenerate("bad id\nforged log line"));
        assertEquals(8, CorrelationContext.acceptOrGenerate("x".repeat(65)).length());
    }
}

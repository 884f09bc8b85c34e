package io.clype.reactorpubsub.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LogSanitizerTest {

    @Test
    void testReplacesLineBreaksAndEscapes() {
        assertEquals("key_injected_[31m", LogSanitizer.sanitize("key\ninjected\u001b[31m"));
    }

    @Test
    void testLeavesPrintableTextUntouched() {
        assertEquals("order-123 ü", LogSanitizer.sanitize("order-123 ü"));
    }

    @Test
    void testNullBecomesLiteral() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }
}

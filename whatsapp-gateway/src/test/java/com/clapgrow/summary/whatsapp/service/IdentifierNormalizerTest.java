package com.clapgrow.summary.whatsapp.service;

import com.clapgrow.summary.whatsapp.exception.GatewayErrorCode;
import com.clapgrow.summary.whatsapp.exception.GatewayException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierNormalizerTest {

    @ParameterizedTest
    @CsvSource({
        "15551234567, 15551234567@c.us",
        "15551234567@c.us, 15551234567@c.us",
        "123456789-1234567890, 123456789-1234567890@g.us",
        "123456789-1234567890@g.us, 123456789-1234567890@g.us",
        "'  15551234567  ', 15551234567@c.us"
    })
    void testNormalize(String raw, String expected) {
        assertEquals(expected, IdentifierNormalizer.normalize(raw));
    }

    @ParameterizedTest
    @ValueSource(strings = {"15551234567", "123-456", "123-456@g.us", "abc@c.us"})
    void testNormalize_IsIdempotent(String raw) {
        String once = IdentifierNormalizer.normalize(raw);
        assertEquals(once, IdentifierNormalizer.normalize(once));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void testNormalize_BlankInput_ThrowsInvalidIdentifier(String raw) {
        GatewayException exception = assertThrows(GatewayException.class, () -> IdentifierNormalizer.normalize(raw));
        assertEquals(GatewayErrorCode.INVALID_IDENTIFIER, exception.getErrorCode());
    }

    @Test
    void testIsGroupChatId() {
        assertTrue(IdentifierNormalizer.isGroupChatId("123456789-1234567890@g.us"));
        assertFalse(IdentifierNormalizer.isGroupChatId("123456789-1234567890"));
        assertFalse(IdentifierNormalizer.isGroupChatId("1234567890@g.us"));
        assertFalse(IdentifierNormalizer.isGroupChatId("15551234567@c.us"));
        assertFalse(IdentifierNormalizer.isGroupChatId(null));
    }
}

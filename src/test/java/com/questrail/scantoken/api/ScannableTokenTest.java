package com.questrail.scantoken.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ScannableTokenTest
{
    private static final String ZEROS = "0".repeat(27);

    @Test
    void assemblesWireForm()
    {
        ScannableToken token = new ScannableToken("sample", ZEROS, "2MvMGi");

        assertEquals("asf", token.prefix());
        assertEquals("asf_sample_" + ZEROS + "2MvMGi", token.value());
        assertEquals(44, token.length());
        assertEquals(token.value().length(), token.length());
    }

    @Test
    void lengthTracksComponentLength()
    {
        assertEquals(41, new ScannableToken("abc", ZEROS, "2MvMGi").length());
        assertEquals(44, new ScannableToken("abcdef", ZEROS, "2MvMGi").length());
    }

    @Test
    void toStringNeverRevealsEntropy()
    {
        String entropy = "AbCdEfGhIjKlMnOpQrStUvWxYz0";
        ScannableToken token = new ScannableToken("tool", entropy, "3yruMJ");

        assertEquals("asf_tool_***3yruMJ", token.redacted());
        assertFalse(token.toString().contains(entropy));
    }

    @Test
    void equalityIsByValue()
    {
        ScannableToken a = new ScannableToken("sample", ZEROS, "2MvMGi");
        ScannableToken b = new ScannableToken("sample", ZEROS, "2MvMGi");
        ScannableToken c = new ScannableToken("samplf", ZEROS, "2MvMGi");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void rejectsMalformedSegments()
    {
        assertThrows(IllegalArgumentException.class, () -> new ScannableToken("ab", ZEROS, "2MvMGi"));
        assertThrows(IllegalArgumentException.class, () -> new ScannableToken("abcdefg", ZEROS, "2MvMGi"));
        assertThrows(IllegalArgumentException.class, () -> new ScannableToken("sample", ZEROS + "0", "2MvMGi"));
        assertThrows(IllegalArgumentException.class, () -> new ScannableToken("sample", "0".repeat(26) + "-", "2MvMGi"));
        assertThrows(IllegalArgumentException.class, () -> new ScannableToken("sample", ZEROS, "5MvMGi"));
        assertThrows(IllegalArgumentException.class, () -> new ScannableToken("sample", ZEROS, "2MvMG"));
        assertThrows(NullPointerException.class, () -> new ScannableToken(null, ZEROS, "2MvMGi"));
    }
}

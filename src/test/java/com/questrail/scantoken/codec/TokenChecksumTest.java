package com.questrail.scantoken.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TokenChecksumTest
{
    @Test
    void computesKnownChecksums()
    {
        assertEquals("2MvMGi", TokenChecksum.compute("0".repeat(27)));
        assertEquals("13hv5A", TokenChecksum.compute("z".repeat(27)));
    }

    @Test
    void checksumIsAlwaysSixCharactersWithLowLeadingDigit()
    {
        String entropy = "0".repeat(25) + "A";
        for (char c : "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz".toCharArray()) {
            String checksum = TokenChecksum.compute(entropy + c);
            assertEquals(6, checksum.length());
            assertTrue(checksum.charAt(0) >= '0' && checksum.charAt(0) <= '4', checksum);
        }
    }

    @Test
    void matchesComparesAgainstRecomputedValue()
    {
        assertTrue(TokenChecksum.matches("0".repeat(27), "2MvMGi"));
        assertFalse(TokenChecksum.matches("0".repeat(27), "2MvMGj"));
        assertFalse(TokenChecksum.matches("0".repeat(27), "2MvMG"));
    }
}

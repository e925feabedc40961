package com.questrail.scantoken.codec;

import java.util.Objects;

/**
 * Crc32
 * -----------------------------------------------------------------------------
 * IEEE 802.3 CRC-32, bit-compatible with zlib and {@link java.util.zip.CRC32}.
 *
 * <p>Token checksums must be reproducible by any standard CRC-32
 * implementation, so the parameters below are fixed.</p>
 */
public final class Crc32
{
    /*
     * CRC-32 (IEEE 802.3, reflected algorithm)
     * -------------------------------------------------------------------------
     *   • Width: 32
     *   • Polynomial (normal): 0x04C11DB7
     *   • Reflected polynomial: 0xEDB88320
     *   • Initial value (INIT): 0xFFFFFFFF
     *   • Input reflected: true
     *   • Output reflected: true
     *   • XOROUT: 0xFFFFFFFF
     *   • Check ("123456789"): 0xCBF43926
     */

    private static final int REFLECTED_POLY = 0xEDB88320;
    private static final int INIT = 0xFFFFFFFF;
    private static final int XOROUT = 0xFFFFFFFF;

    private static final int[] TABLE = new int[256];

    static {
        for (int n = 0; n < 256; n++) {
            int c = n;
            for (int b = 0; b < 8; b++) {
                if ((c & 1) != 0) {
                    c = (c >>> 1) ^ REFLECTED_POLY;
                } else {
                    c = (c >>> 1);
                }
            }
            TABLE[n] = c;
        }
    }

    private Crc32() {}

    /**
     * Computes the CRC-32 of {@code data}.
     *
     * @return the checksum as an unsigned value in {@code [0, 0xFFFFFFFF]}
     */
    public static long compute(byte[] data)
    {
        Objects.requireNonNull(data, "data");
        return compute(data, 0, data.length);
    }

    public static long compute(byte[] data, int off, int len)
    {
        Objects.checkFromIndexSize(off, len, data.length);

        int crc = INIT;
        for (int i = off; i < off + len; i++) {
            crc = (crc >>> 8) ^ TABLE[(crc ^ data[i]) & 0xFF];
        }
        return Integer.toUnsignedLong(crc ^ XOROUT);
    }

    /**
     * Computes the CRC-32 over the ASCII code points of {@code text}, in order.
     *
     * <p>Each character contributes exactly one byte: its code point. This is
     * the form used for token entropy segments, which are always ASCII.</p>
     *
     * @throws IllegalArgumentException if {@code text} contains a non-ASCII character
     */
    public static long computeAscii(CharSequence text)
    {
        Objects.requireNonNull(text, "text");

        int crc = INIT;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c > 0x7F) {
                throw new IllegalArgumentException("Non-ASCII character at index " + i);
            }
            crc = (crc >>> 8) ^ TABLE[(crc ^ c) & 0xFF];
        }
        return Integer.toUnsignedLong(crc ^ XOROUT);
    }
}

/**
 * Token Codec Primitives
 * =============================================================================
 *
 * <p>This package holds the two numeric building blocks of the token format and
 * the composition that turns them into a checksum segment:</p>
 *
 * <ul>
 *   <li>{@link com.questrail.scantoken.codec.Base62} - fixed-width integer/text conversion</li>
 *   <li>{@link com.questrail.scantoken.codec.Crc32} - IEEE 802.3 CRC-32</li>
 *   <li>{@link com.questrail.scantoken.codec.TokenChecksum} - CRC-32 of the entropy text, rendered in 6 Base62 digits</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   entropy (27 chars)
 *        → Crc32.computeAscii        (one byte per character)
 *            → Base62.encode(width 6)
 *                → checksum (6 chars, first digit 0-4)
 * </pre>
 *
 * <p>This layer is pure and semantics-free: it knows nothing about components,
 * registries, or the token grammar. Misuse (negative values, values that do
 * not fit the requested width, characters outside the alphabet) raises an
 * unchecked {@link java.lang.IllegalArgumentException} subtype.</p>
 */
package com.questrail.scantoken.codec;

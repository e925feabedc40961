/**
 * Token Grammar
 * =============================================================================
 *
 * <p>Structural recognition of token strings, independent of checksum and
 * registry checks.</p>
 *
 * <pre>
 *   candidate string
 *        → TokenParser.parse     (anchored: whole input must be one token)
 *            → ParseResult.Accepted(TokenMatch) | ParseResult.Rejected(state, reason, offset)
 *
 *   free text
 *        → TokenScanner.over     (unanchored, lazy, non-overlapping)
 *            → TokenMatch, TokenMatch, ...
 * </pre>
 *
 * <p>Both entry points drive the same explicit
 * {@link com.questrail.scantoken.grammar.TokenStateMachine}; no regex engine is
 * involved. Every class here is pure; only the state machine itself carries
 * mutable state, and a new one is created per attempt.</p>
 */
package com.questrail.scantoken.grammar;

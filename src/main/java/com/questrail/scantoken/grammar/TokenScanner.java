package com.questrail.scantoken.grammar;

import com.questrail.scantoken.api.TokenFormat;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * TokenScanner
 * -----------------------------------------------------------------------------
 * Unanchored scan for structurally valid tokens embedded in free text.
 *
 * <h2>Matching rules</h2>
 * <ul>
 *   <li>Candidates start at every occurrence of {@code asf_}; no word boundary
 *       is required on either side.</li>
 *   <li>Matches are reported left to right and never overlap: after a match,
 *       scanning resumes at its end.</li>
 *   <li>A failed candidate advances the scan by one character, so a token
 *       that begins inside a rejected near-miss is still found.</li>
 *   <li>Characters following a complete token do not affect the match.</li>
 * </ul>
 *
 * <p>These rules produce the same spans as a regex engine running
 * {@link TokenFormat#PUBLISHED_PATTERN} with find-next semantics.</p>
 *
 * <h2>Laziness</h2>
 * <p>Work is done only as matches are requested. Each call to
 * {@link #iterator()} restarts from the configured offset, so a scanner can be
 * iterated more than once. The text must not change while it is scanned.</p>
 *
 * <p>Matches are structural only; checksum confirmation belongs to the
 * detector.</p>
 */
public final class TokenScanner implements Iterable<TokenMatch>
{
    private final CharSequence text;
    private final int from;

    private TokenScanner(CharSequence text, int from)
    {
        this.text = text;
        this.from = from;
    }

    public static TokenScanner over(CharSequence text)
    {
        return over(text, 0);
    }

    /**
     * Scans {@code text} starting at offset {@code from}.
     */
    public static TokenScanner over(CharSequence text, int from)
    {
        Objects.requireNonNull(text, "text");
        if (from < 0 || from > text.length()) {
            throw new IndexOutOfBoundsException("from=" + from + ", length=" + text.length());
        }
        return new TokenScanner(text, from);
    }

    /**
     * Attempts a match beginning exactly at {@code start}; trailing text is
     * ignored.
     */
    public static Optional<TokenMatch> matchAt(CharSequence text, int start)
    {
        Objects.requireNonNull(text, "text");

        final TokenStateMachine machine = new TokenStateMachine();
        for (int i = start; i < text.length(); i++) {
            final ParserState state = machine.advance(text.charAt(i));
            if (state == ParserState.ACCEPT) {
                return Optional.of(TokenMatch.slice(text, start, machine.componentLength()));
            }
            if (state == ParserState.REJECT) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    @Override
    public Iterator<TokenMatch> iterator()
    {
        return new MatchIterator();
    }

    public Stream<TokenMatch> stream()
    {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    private final class MatchIterator implements Iterator<TokenMatch>
    {
        private int cursor = from;
        private TokenMatch pending;

        @Override
        public boolean hasNext()
        {
            if (pending == null) {
                pending = findNext();
            }
            return pending != null;
        }

        @Override
        public TokenMatch next()
        {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            final TokenMatch match = pending;
            pending = null;
            return match;
        }

        private TokenMatch findNext()
        {
            final int lastStart = text.length() - TokenFormat.MIN_TOKEN_LENGTH;
            while (cursor <= lastStart) {
                final int candidate = indexOfPrefix(cursor, lastStart);
                if (candidate < 0) {
                    cursor = text.length();
                    return null;
                }
                final Optional<TokenMatch> match = matchAt(text, candidate);
                if (match.isPresent()) {
                    cursor = match.get().end();
                    return match.get();
                }
                cursor = candidate + 1;
            }
            return null;
        }

        private int indexOfPrefix(int fromIndex, int lastStart)
        {
            final String prefix = TokenFormat.PREFIX_WITH_SEPARATOR;
            outer:
            for (int i = fromIndex; i <= lastStart; i++) {
                for (int k = 0; k < prefix.length(); k++) {
                    if (text.charAt(i + k) != prefix.charAt(k)) {
                        continue outer;
                    }
                }
                return i;
            }
            return -1;
        }
    }
}

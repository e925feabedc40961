package com.questrail.scantoken.grammar;

import com.questrail.scantoken.api.TokenFormat;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TokenScannerTest
 * -----------------------------------------------------------------------------
 * Unit tests for unanchored scanning via {@link TokenScanner}.
 */
final class TokenScannerTest
{
    private static final String TOKEN = "asf_sample_" + "0".repeat(27) + "2MvMGi";
    private static final String OTHER = "asf_tool_" + "AbCdEfGhIjKlMnOpQrStUvWxYz0" + "3yruMJ";

    @Test
    void findsTokenEmbeddedInLogLine()
    {
        String text = "2026-01-01 INFO auth header=Bearer " + TOKEN + " status=200";

        List<TokenMatch> matches = scan(text);

        assertEquals(1, matches.size());
        TokenMatch match = matches.get(0);
        assertEquals(text.indexOf(TOKEN), match.start());
        assertEquals(text.indexOf(TOKEN) + TOKEN.length(), match.end());
        assertEquals(TOKEN, text.substring(match.start(), match.end()));
    }

    @Test
    void findsNothingInPlainText()
    {
        assertTrue(scan("nothing to see here, not even asf_ on its own").isEmpty());
        assertTrue(scan("").isEmpty());
    }

    @Test
    void adjacentTokensDoNotOverlap()
    {
        List<TokenMatch> matches = scan(TOKEN + OTHER);

        assertEquals(2, matches.size());
        assertEquals(0, matches.get(0).start());
        assertEquals(TOKEN.length(), matches.get(1).start());
        assertEquals("tool", matches.get(1).component());
    }

    @Test
    void trailingCharactersDoNotPreventMatch()
    {
        List<TokenMatch> matches = scan(TOKEN + "EXTRA");
        assertEquals(1, matches.size());
        assertEquals(TOKEN.length(), matches.get(0).end());
    }

    @Test
    void noWordBoundaryRequired()
    {
        List<TokenMatch> matches = scan("xx" + TOKEN);
        assertEquals(1, matches.size());
        assertEquals(2, matches.get(0).start());
    }

    @Test
    void recoversFromRejectedCandidate()
    {
        String text = "asf_asf_sample_00000" + TOKEN;

        List<TokenMatch> matches = scan(text);

        assertEquals(1, matches.size());
        assertEquals(text.indexOf(TOKEN), matches.get(0).start());
    }

    @Test
    void reportsStructurallyValidNearMiss()
    {
        String nearMiss = "asf_sample_" + "0".repeat(27) + "2MvMGj";
        List<TokenMatch> matches = scan(TOKEN + " " + nearMiss);
        assertEquals(2, matches.size());
        assertEquals("2MvMGj", matches.get(1).checksum());
    }

    @Test
    void scanFromOffsetSkipsEarlierTokens()
    {
        String text = TOKEN + " " + OTHER;
        List<TokenMatch> matches = TokenScanner.over(text, 1).stream().collect(Collectors.toList());

        assertEquals(1, matches.size());
        assertEquals("tool", matches.get(0).component());
    }

    @Test
    void iterationIsRestartable()
    {
        TokenScanner scanner = TokenScanner.over(TOKEN + OTHER);

        List<TokenMatch> first = new ArrayList<>();
        scanner.forEach(first::add);
        List<TokenMatch> second = new ArrayList<>();
        scanner.forEach(second::add);

        assertEquals(2, first.size());
        assertEquals(first, second);
    }

    @Test
    void iteratorIsExhaustedCleanly()
    {
        Iterator<TokenMatch> it = TokenScanner.over(TOKEN).iterator();
        assertTrue(it.hasNext());
        assertTrue(it.hasNext());
        it.next();
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void scanningIsLazy()
    {
        CharSequence text = new TrapAfter(TOKEN, 10_000);

        TokenMatch first = TokenScanner.over(text).stream().findFirst().orElseThrow();

        assertEquals(0, first.start());
    }

    @Test
    void rejectsOffsetOutsideText()
    {
        assertThrows(IndexOutOfBoundsException.class, () -> TokenScanner.over("abc", 4));
        assertThrows(IndexOutOfBoundsException.class, () -> TokenScanner.over("abc", -1));
    }

    @Test
    void agreesWithPublishedPatternOnRandomText()
    {
        Pattern pattern = Pattern.compile(TokenFormat.PUBLISHED_PATTERN);
        String[] pieces = {
                TOKEN, OTHER, "asf_", "_", "asf_ab_", "asf_abcdefg_", " ", "\n", "zz", "09", "AZ",
                "0".repeat(27), "2MvMGi", "5MvMGi", "asf_asf_", "sample",
        };
        Random random = new Random(1234);

        for (int round = 0; round < 500; round++) {
            StringBuilder text = new StringBuilder();
            int count = 1 + random.nextInt(12);
            for (int i = 0; i < count; i++) {
                text.append(pieces[random.nextInt(pieces.length)]);
            }

            List<String> expected = new ArrayList<>();
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                expected.add(m.start() + ":" + m.end());
            }

            List<String> actual = TokenScanner.over(text).stream()
                    .map(t -> t.start() + ":" + t.end())
                    .collect(Collectors.toList());

            assertEquals(expected, actual, text.toString());
        }
    }

    private static List<TokenMatch> scan(String text)
    {
        return TokenScanner.over(text).stream().collect(Collectors.toList());
    }

    /**
     * CharSequence that fails if read past the end of its real content.
     */
    private static final class TrapAfter implements CharSequence
    {
        private final String content;
        private final int length;

        TrapAfter(String content, int length)
        {
            this.content = content;
            this.length = length;
        }

        @Override
        public int length()
        {
            return length;
        }

        @Override
        public char charAt(int index)
        {
            if (index >= content.length()) {
                throw new AssertionError("scanner read index " + index);
            }
            return content.charAt(index);
        }

        @Override
        public CharSequence subSequence(int start, int end)
        {
            if (end > content.length()) {
                throw new AssertionError("scanner sliced up to " + end);
            }
            return content.subSequence(start, end);
        }

        @Override
        public String toString()
        {
            return content;
        }
    }
}

package com.questrail.scantoken.validate;

import com.questrail.scantoken.api.ComponentRegistry;
import com.questrail.scantoken.api.ScannableToken;
import com.questrail.scantoken.api.TokenFormat;
import com.questrail.scantoken.entropy.FixedEntropySource;
import com.questrail.scantoken.error.ChecksumMismatchException;
import com.questrail.scantoken.error.MalformedTokenException;
import com.questrail.scantoken.error.RegistryUnavailableException;
import com.questrail.scantoken.error.ScannableTokenException;
import com.questrail.scantoken.error.TokenErrorKind;
import com.questrail.scantoken.error.UnallocatedComponentException;
import com.questrail.scantoken.generate.TokenGenerator;
import com.questrail.scantoken.grammar.ParserState;
import com.questrail.scantoken.grammar.RejectReason;
import com.questrail.scantoken.observability.RecordingObservabilitySink;
import com.questrail.scantoken.observability.TokenErrorEvent;
import com.questrail.scantoken.observability.ValidationFailureEvent;
import com.questrail.scantoken.registry.StaticComponentRegistry;
import com.questrail.scantoken.time.ManualWallClock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TokenValidatorTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link TokenValidator}: grammar, checksum and registry tiers,
 * and the distinct error kind each one reports.
 */
final class TokenValidatorTest
{
    private static final String FIRST_VECTOR = "asf_sample_0000000000000000000000000002MvMGi";
    private static final String SECOND_VECTOR = "asf_sample_zzzzzzzzzzzzzzzzzzzzzzzzzzz13hv5A";

    private final StaticComponentRegistry registry = StaticComponentRegistry.of("sample");
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final TokenValidator validator = new TokenValidator(sink, new ManualWallClock());

    // ---------------------------------------------------------------------
    // Known vectors
    // ---------------------------------------------------------------------

    @Test
    void firstVectorValidates() throws Exception
    {
        ScannableToken token = validator.validate(FIRST_VECTOR, registry);

        assertEquals("sample", token.component());
        assertEquals("0".repeat(27), token.entropy());
        assertEquals("2MvMGi", token.checksum());
        assertEquals(FIRST_VECTOR, token.value());
    }

    @Test
    void secondVectorValidates() throws Exception
    {
        ScannableToken token = validator.validate(SECOND_VECTOR, registry);
        assertEquals("13hv5A", token.checksum());
    }

    @Test
    void offlineValidationSkipsRegistry() throws Exception
    {
        String unregistered = "asf_other_" + "0".repeat(27) + "2MvMGi";
        assertEquals("other", validator.validate(unregistered).component());
    }

    // ---------------------------------------------------------------------
    // Round trip
    // ---------------------------------------------------------------------

    @Test
    void generatedTokensValidateToEqualValue() throws Exception
    {
        StaticComponentRegistry components = StaticComponentRegistry.of("abc", "sample", "abcdef");
        for (int fill = 0; fill < 62; fill += 7) {
            TokenGenerator generator = new TokenGenerator(components, FixedEntropySource.scripted(fill, 1, 20, 40, fill + 3));
            for (String component : components.allocatedComponents()) {
                ScannableToken generated = generator.generate(component);
                assertEquals(generated, validator.validate(generated.value(), components));
            }
        }
    }

    // ---------------------------------------------------------------------
    // Grammar tier
    // ---------------------------------------------------------------------

    @Test
    void malformedCandidateCarriesFailingState()
    {
        MalformedTokenException e = assertThrows(MalformedTokenException.class,
                () -> validator.validate("asf_sample_" + "0".repeat(27) + "5MvMGi"));

        assertEquals(TokenErrorKind.MALFORMED_TOKEN, e.kind());
        assertEquals(ParserState.CHECKSUM, e.failedState());
        assertEquals(RejectReason.CHECKSUM_LEADING_DIGIT_OUT_OF_RANGE, e.reason());
        assertEquals(38, e.offset());
    }

    @Test
    void leadingDigitAboveFourIsMalformedEvenIfOtherwiseValid()
    {
        for (char lead : "56789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz".toCharArray()) {
            String candidate = "asf_sample_" + "0".repeat(27) + lead + "MvMGi";
            assertThrows(MalformedTokenException.class, () -> validator.validate(candidate, registry), candidate);
        }
    }

    @Test
    void wrongLengthsAndSeparatorsAreMalformed()
    {
        List<String> candidates = List.of(
                "",
                "asf_sample",
                FIRST_VECTOR.substring(1),
                FIRST_VECTOR + "0",
                FIRST_VECTOR.replace("asf_", "asf-"),
                FIRST_VECTOR.replace("sample_", "sample-"),
                " " + FIRST_VECTOR,
                FIRST_VECTOR.toUpperCase());

        for (String candidate : candidates) {
            assertThrows(MalformedTokenException.class, () -> validator.validate(candidate), candidate);
        }
    }

    @Test
    void grammarIsCheckedBeforeRegistry()
    {
        ComponentRegistry failing = component -> {
            throw new AssertionError("registry must not be consulted");
        };
        assertThrows(MalformedTokenException.class, () -> validator.validate("asf_sample_x", failing));
    }

    // ---------------------------------------------------------------------
    // Checksum tier
    // ---------------------------------------------------------------------

    @Test
    void everySingleCharacterEntropyCorruptionIsDetected()
    {
        String prefix = "asf_sample_";
        String entropy = "0".repeat(27);

        for (int i = 0; i < TokenFormat.ENTROPY_LENGTH; i++) {
            for (char replacement : TokenFormat.BASE62_ALPHABET.toCharArray()) {
                if (replacement == entropy.charAt(i)) {
                    continue;
                }
                String corrupted = prefix
                        + entropy.substring(0, i) + replacement + entropy.substring(i + 1)
                        + "2MvMGi";

                ChecksumMismatchException e = assertThrows(ChecksumMismatchException.class,
                        () -> validator.validate(corrupted, registry), corrupted);
                assertEquals(TokenErrorKind.CHECKSUM_MISMATCH, e.kind());
                assertEquals("2MvMGi", e.actual());
            }
        }
    }

    @Test
    void checksumMismatchReportsBothValues()
    {
        ChecksumMismatchException e = assertThrows(ChecksumMismatchException.class,
                () -> validator.validate("asf_sample_" + "z".repeat(27) + "2MvMGi"));

        assertEquals("13hv5A", e.expected());
        assertEquals("2MvMGi", e.actual());
        assertFalse(e.getMessage().contains("z".repeat(27)));
    }

    @Test
    void checksumIsCheckedBeforeRegistry()
    {
        ComponentRegistry failing = component -> {
            throw new AssertionError("registry must not be consulted");
        };
        assertThrows(ChecksumMismatchException.class,
                () -> validator.validate("asf_sample_" + "0".repeat(27) + "2MvMGj", failing));
    }

    // ---------------------------------------------------------------------
    // Registry tier
    // ---------------------------------------------------------------------

    @Test
    void unallocatedComponentFailsDistinctly()
    {
        String unregistered = "asf_other_" + "0".repeat(27) + "2MvMGi";

        UnallocatedComponentException e = assertThrows(UnallocatedComponentException.class,
                () -> validator.validate(unregistered, registry));

        assertEquals(TokenErrorKind.UNALLOCATED_COMPONENT, e.kind());
        assertEquals("other", e.component());
    }

    @Test
    void registryOutageIsNotReportedAsUnallocated()
    {
        ComponentRegistry down = component -> {
            throw new RegistryUnavailableException("lookup failed");
        };

        RegistryUnavailableException e = assertThrows(RegistryUnavailableException.class,
                () -> validator.validate(FIRST_VECTOR, down));

        assertEquals(TokenErrorKind.REGISTRY_UNAVAILABLE, e.kind());
        assertTrue(sink.hasEventOfType(TokenErrorEvent.class));
        assertFalse(sink.hasEventOfType(ValidationFailureEvent.class));
    }

    // ---------------------------------------------------------------------
    // Observability
    // ---------------------------------------------------------------------

    @Test
    void failuresAreReportedByKind()
    {
        expectFailure(() -> validator.validate("nope"));
        expectFailure(() -> validator.validate("asf_sample_" + "0".repeat(27) + "2MvMGj"));
        expectFailure(() -> validator.validate("asf_other_" + "0".repeat(27) + "2MvMGi", registry));

        List<ValidationFailureEvent> events = sink.eventsOfType(ValidationFailureEvent.class);
        assertEquals(3, events.size());
        assertEquals(TokenErrorKind.MALFORMED_TOKEN, events.get(0).kind());
        assertEquals(TokenErrorKind.CHECKSUM_MISMATCH, events.get(1).kind());
        assertEquals(TokenErrorKind.UNALLOCATED_COMPONENT, events.get(2).kind());
    }

    @Test
    void successIsSilent() throws Exception
    {
        validator.validate(FIRST_VECTOR, registry);
        assertTrue(sink.getAllEvents().isEmpty());
    }

    private interface Attempt
    {
        void run() throws ScannableTokenException;
    }

    private static void expectFailure(Attempt attempt)
    {
        assertThrows(ScannableTokenException.class, attempt::run);
    }
}

package com.questrail.scantoken.error;

/**
 * Distinct, caller-branchable failure kinds reported by the token codec.
 *
 * <p>Every {@link ScannableTokenException} carries exactly one kind. Scanning
 * tools and registry-enforcement callers switch on this value rather than on
 * exception messages.</p>
 */
public enum TokenErrorKind
{
    /** Component is not 3-6 lowercase ASCII letters. */
    INVALID_COMPONENT_FORMAT,

    /** Component is well-formed but not present in the registry. */
    UNALLOCATED_COMPONENT,

    /** Candidate string does not satisfy the token grammar. */
    MALFORMED_TOKEN,

    /** Candidate is well-formed but its checksum does not match its entropy. */
    CHECKSUM_MISMATCH,

    /** The secure random source could not supply bytes. */
    ENTROPY_SOURCE_FAILURE,

    /** The registry could not give a definitive allocated/unallocated answer. */
    REGISTRY_UNAVAILABLE
}

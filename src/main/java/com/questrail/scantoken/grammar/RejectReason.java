package com.questrail.scantoken.grammar;

/**
 * Why the token state machine entered {@link ParserState#REJECT}.
 */
public enum RejectReason
{
    PREFIX_MISMATCH("input does not start with asf_"),
    INVALID_COMPONENT_CHARACTER("component contains a character other than a-z"),
    COMPONENT_TOO_SHORT("component is shorter than 3 letters"),
    COMPONENT_TOO_LONG("component is longer than 6 letters"),
    INVALID_ENTROPY_CHARACTER("entropy contains a non-base62 character"),
    CHECKSUM_LEADING_DIGIT_OUT_OF_RANGE("checksum does not start with 0-4"),
    INVALID_CHECKSUM_CHARACTER("checksum contains a non-base62 character"),
    PREMATURE_END("input ended before the token was complete"),
    TRAILING_INPUT("input continues after a complete token");

    private final String description;

    RejectReason(String description)
    {
        this.description = description;
    }

    public String description()
    {
        return description;
    }
}

package com.questrail.scantoken.error;

import com.questrail.scantoken.api.TokenFormat;

/**
 * Raised when a component name is not 3-6 lowercase ASCII letters.
 */
public final class InvalidComponentFormatException extends ScannableTokenException
{
    private final String component;

    public InvalidComponentFormatException(String component)
    {
        super(TokenErrorKind.INVALID_COMPONENT_FORMAT,
                "Component must be " + TokenFormat.MIN_COMPONENT_LENGTH + "-"
                        + TokenFormat.MAX_COMPONENT_LENGTH
                        + " lowercase ASCII letters (was \"" + component + "\")");
        this.component = component;
    }

    public String component()
    {
        return component;
    }
}

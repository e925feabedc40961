package com.questrail.scantoken.error;

/**
 * Raised when a syntactically valid component is not present in the registry.
 */
public final class UnallocatedComponentException extends ScannableTokenException
{
    private final String component;

    public UnallocatedComponentException(String component)
    {
        super(TokenErrorKind.UNALLOCATED_COMPONENT,
                "Component is not allocated: " + component);
        this.component = component;
    }

    public String component()
    {
        return component;
    }
}

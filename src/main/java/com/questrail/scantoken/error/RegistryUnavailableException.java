package com.questrail.scantoken.error;

/**
 * Raised when the component registry cannot give a definitive answer, for
 * example because a remote lookup failed.
 *
 * <p>Distinct from {@link UnallocatedComponentException}: the component may
 * well be allocated.</p>
 */
public final class RegistryUnavailableException extends ScannableTokenException
{
    public RegistryUnavailableException(String message)
    {
        super(TokenErrorKind.REGISTRY_UNAVAILABLE, message);
    }

    public RegistryUnavailableException(String message, Throwable cause)
    {
        super(TokenErrorKind.REGISTRY_UNAVAILABLE, message, cause);
    }
}

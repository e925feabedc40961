package com.questrail.scantoken.api;

import com.questrail.scantoken.error.RegistryUnavailableException;

/**
 * ComponentRegistry
 * -----------------------------------------------------------------------------
 * Membership check against the externally maintained list of allocated token
 * components (issuer namespaces).
 *
 * <p>This is an injected capability, not global state. Implementations may be
 * backed by a static list, a remote service, or a cache in front of either.</p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Must be safe to call concurrently from multiple threads.</li>
 *   <li>Returns a definitive answer or throws
 *       {@link RegistryUnavailableException}. A lookup that could not be
 *       completed must never be reported as "not allocated".</li>
 *   <li>Callers only pass syntactically valid component names.</li>
 * </ul>
 */
@FunctionalInterface
public interface ComponentRegistry
{
    /**
     * Returns true if {@code component} is currently allocated.
     *
     * @param component a syntactically valid component (3-6 lowercase letters)
     * @throws RegistryUnavailableException if the registry could not give a
     *         definitive answer
     */
    boolean isAllocated(String component) throws RegistryUnavailableException;
}

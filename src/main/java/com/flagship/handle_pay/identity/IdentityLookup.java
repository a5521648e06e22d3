package com.flagship.handle_pay.identity;

import com.flagship.handle_pay.asset.Address;

import java.util.Optional;

/**
 * Read-only view of the external handle registry.
 *
 * Callers must not cache results across calls: ownership is checked at the
 * moment each operation runs.
 */
public interface IdentityLookup {

    /**
     * @return the address currently owning {@code handle}, or empty if unregistered
     */
    Optional<Address> resolve(String handle);
}

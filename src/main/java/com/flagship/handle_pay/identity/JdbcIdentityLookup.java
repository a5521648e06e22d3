package com.flagship.handle_pay.identity;

import com.flagship.handle_pay.asset.Address;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Resolves handles against the {@code handle_registrations} table, which the
 * external registry keeps up to date. This service only reads it.
 */
@Component
public class JdbcIdentityLookup implements IdentityLookup {

    private final JdbcTemplate jdbcTemplate;

    public JdbcIdentityLookup(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Address> resolve(String handle) {
        List<String> owners = jdbcTemplate.queryForList(
            "SELECT owner FROM handle_registrations WHERE handle = ?",
            String.class,
            handle
        );
        // A registry row pointing at the zero address counts as unregistered
        return owners.stream()
            .findFirst()
            .map(Address::of)
            .filter(owner -> !owner.isZero());
    }
}

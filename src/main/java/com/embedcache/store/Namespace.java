package com.embedcache.store;

import java.util.regex.Pattern;

/**
 * A cache partition. The name doubles as the backing table name, so it is restricted to
 * lowercase SQL identifiers of at most 63 characters.
 */
public record Namespace(String name) {
    private static final Pattern VALID_NAME = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    public Namespace {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid namespace name: " + name);
        }
    }

    @Override
    public String toString() {
        return name;
    }
}

package com.pypack.licensing;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Set of license identifiers (SPDX) that may be linked into a binary whose distributor wants to
 * avoid copyleft obligations. Membership is exact and case-sensitive, as SPDX identifiers are.
 */
@FunctionalInterface
public interface LicenseAllowList {

    boolean contains(String licenseId);

    /** True if every identifier is allowed. An empty collection is trivially allowed. */
    default boolean containsAll(Collection<String> licenseIds) {
        for (String id : licenseIds) {
            if (!contains(id)) return false;
        }
        return true;
    }

    /** Allow-list over exactly the given identifiers. */
    static LicenseAllowList of(String... licenseIds) {
        Set<String> ids = Set.of(licenseIds);
        return id -> id != null && ids.contains(id);
    }

    static LicenseAllowList of(Collection<String> licenseIds) {
        Set<String> ids = Set.copyOf(Objects.requireNonNull(licenseIds, "licenseIds"));
        return id -> id != null && ids.contains(id);
    }
}

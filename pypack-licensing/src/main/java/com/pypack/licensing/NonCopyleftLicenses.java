package com.pypack.licensing;

import java.util.Set;

/**
 * Built-in allow-list of SPDX identifiers for licenses without copyleft terms.
 * No GPL, LGPL or AGPL identifier is ever listed; an unknown identifier is not allowed.
 */
public final class NonCopyleftLicenses implements LicenseAllowList {

    private static final NonCopyleftLicenses INSTANCE = new NonCopyleftLicenses();

    private static final Set<String> LICENSES = Set.of(
            "0BSD",
            "AFL-3.0",
            "Apache-1.0",
            "Apache-1.1",
            "Apache-2.0",
            "Artistic-2.0",
            "BSD-1-Clause",
            "BSD-2-Clause",
            "BSD-2-Clause-Patent",
            "BSD-3-Clause",
            "BSD-3-Clause-Clear",
            "BSD-4-Clause",
            "BSL-1.0",
            "bzip2-1.0.6",
            "CC-BY-4.0",
            "CC0-1.0",
            "curl",
            "ECL-2.0",
            "EFL-2.0",
            "FTL",
            "HPND",
            "ICU",
            "IJG",
            "ISC",
            "Libpng",
            "libtiff",
            "MIT",
            "MIT-0",
            "MIT-CMU",
            "MPL-2.0",
            "MS-PL",
            "NCSA",
            "OpenSSL",
            "PHP-3.01",
            "PostgreSQL",
            "PSF-2.0",
            "Python-2.0",
            "Ruby",
            "Sleepycat",
            "TCL",
            "Unicode-DFS-2016",
            "Unlicense",
            "UPL-1.0",
            "W3C",
            "X11",
            "Zlib",
            "zlib-acknowledgement",
            "ZPL-2.1"
    );

    public static NonCopyleftLicenses getInstance() {
        return INSTANCE;
    }

    private NonCopyleftLicenses() {
    }

    @Override
    public boolean contains(String licenseId) {
        return licenseId != null && LICENSES.contains(licenseId);
    }

    /** All identifiers on the list (unmodifiable). */
    public Set<String> getLicenses() {
        return LICENSES;
    }
}

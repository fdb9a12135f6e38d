/**
 * License allow-lists consulted when a packaging policy excludes copyleft-licensed extension modules.
 * {@link com.pypack.licensing.NonCopyleftLicenses} is the built-in list; callers may supply their own
 * {@link com.pypack.licensing.LicenseAllowList}.
 */
package com.pypack.licensing;

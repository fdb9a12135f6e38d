/**
 * JSON configuration documents for {@link com.pypack.policy.PythonPackagingPolicy}:
 * {@link com.pypack.policy.load.PackagingPolicyConfig} (the document) and
 * {@link com.pypack.policy.load.PackagingPolicyConfigLoader} (read from string or file, write back).
 */
package com.pypack.policy.load;

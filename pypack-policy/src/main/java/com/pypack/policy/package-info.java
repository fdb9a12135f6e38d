/**
 * Packaging policy for embedding a Python distribution in a standalone binary.
 * <ul>
 *   <li>{@link com.pypack.policy.PythonPackagingPolicy} – the policy; decides resource inclusion and resolves extension module variants per target</li>
 *   <li>{@link com.pypack.policy.PythonResourcesPolicy} – where resources are loaded from at run time</li>
 *   <li>{@link com.pypack.policy.ExtensionModuleFilter} – which extension modules are included</li>
 *   <li>{@link com.pypack.policy.InvalidPolicyValueException}, {@link com.pypack.policy.InvalidFilterValueException} – rejected configuration values</li>
 * </ul>
 * Configuration documents are read by {@link com.pypack.policy.load.PackagingPolicyConfigLoader}.
 */
package com.pypack.policy;

/**
 * Resources found in a Python distribution that a packaging policy decides on.
 * <ul>
 *   <li>{@link com.pypack.resource.PythonResource} – common contract; {@link com.pypack.resource.ResourceKind} is the tag</li>
 *   <li>Module resources: {@link com.pypack.resource.PythonModuleSource}, {@link com.pypack.resource.PythonModuleBytecodeRequest}, {@link com.pypack.resource.PythonModuleBytecode}</li>
 *   <li>Data resources: {@link com.pypack.resource.PythonPackageResource}, {@link com.pypack.resource.PythonPackageDistributionResource}, {@link com.pypack.resource.PythonPathExtension}, {@link com.pypack.resource.PythonEggFile}</li>
 *   <li>{@link com.pypack.resource.PythonExtensionModule} – one variant of a native extension; variants of one extension are grouped in {@link com.pypack.resource.ExtensionModuleVariants}</li>
 * </ul>
 */
package com.pypack.resource;

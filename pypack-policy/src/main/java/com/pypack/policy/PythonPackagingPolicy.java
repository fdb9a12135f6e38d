package com.pypack.policy;

import com.pypack.licensing.LicenseAllowList;
import com.pypack.licensing.NonCopyleftLicenses;
import com.pypack.resource.ExtensionModuleVariants;
import com.pypack.resource.PythonExtensionModule;
import com.pypack.resource.PythonResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Defines how Python resources are packaged into a binary: which resources are included, where
 * they are loaded from, and which extension module variants are chosen.
 * <p>
 * Build the policy with the setters, then use it read-only: {@link #filterPythonResource(PythonResource)}
 * and {@link #resolvePythonExtensionModules(Iterable, String)} do not mutate it and may be called from
 * several threads as long as no thread calls a setter meanwhile. Setters are not synchronized;
 * {@link #copy()} gives an independent snapshot.
 */
public final class PythonPackagingPolicy {

    private static final Logger log = LoggerFactory.getLogger(PythonPackagingPolicy.class);

    private ExtensionModuleFilter extensionModuleFilter = ExtensionModuleFilter.ALL;

    /** extension name → preferred variant name */
    private final Map<String, String> preferredExtensionModuleVariants = new LinkedHashMap<>();

    private PythonResourcesPolicy resourcesPolicy = PythonResourcesPolicy.inMemoryOnly();

    private boolean includeDistributionSources = true;

    private boolean includeDistributionResources = false;

    private boolean includeTest = false;

    /** target triple → extensions that don't work on that target */
    private final Map<String, List<String>> brokenExtensions = new LinkedHashMap<>();

    private LicenseAllowList licenseAllowList = NonCopyleftLicenses.getInstance();

    /** Policy with defaults: all extensions, in-memory only, distribution sources included, resources and tests excluded. */
    public PythonPackagingPolicy() {
    }

    /** Independent copy; later changes to either policy do not affect the other. */
    public PythonPackagingPolicy copy() {
        PythonPackagingPolicy c = new PythonPackagingPolicy();
        c.extensionModuleFilter = extensionModuleFilter;
        c.preferredExtensionModuleVariants.putAll(preferredExtensionModuleVariants);
        c.resourcesPolicy = resourcesPolicy;
        c.includeDistributionSources = includeDistributionSources;
        c.includeDistributionResources = includeDistributionResources;
        c.includeTest = includeTest;
        brokenExtensions.forEach((triple, names) -> c.brokenExtensions.put(triple, new ArrayList<>(names)));
        c.licenseAllowList = licenseAllowList;
        return c;
    }

    public ExtensionModuleFilter getExtensionModuleFilter() {
        return extensionModuleFilter;
    }

    public void setExtensionModuleFilter(ExtensionModuleFilter filter) {
        this.extensionModuleFilter = Objects.requireNonNull(filter, "filter");
    }

    /** Unmodifiable view of extension name → preferred variant name. */
    public Map<String, String> getPreferredExtensionModuleVariants() {
        return Collections.unmodifiableMap(preferredExtensionModuleVariants);
    }

    /**
     * Denotes the preferred variant of an extension module. The named variant is chosen when present.
     * Replaces any earlier preference for the same extension.
     */
    public void setPreferredExtensionModuleVariant(String extension, String variant) {
        preferredExtensionModuleVariants.put(
                Objects.requireNonNull(extension, "extension"),
                Objects.requireNonNull(variant, "variant"));
    }

    public PythonResourcesPolicy getResourcesPolicy() {
        return resourcesPolicy;
    }

    public void setResourcesPolicy(PythonResourcesPolicy policy) {
        this.resourcesPolicy = Objects.requireNonNull(policy, "policy");
    }

    public boolean isIncludeDistributionSources() {
        return includeDistributionSources;
    }

    /** Whether to include module source code from the Python distribution. */
    public void setIncludeDistributionSources(boolean include) {
        this.includeDistributionSources = include;
    }

    public boolean isIncludeDistributionResources() {
        return includeDistributionResources;
    }

    /** Whether to include non-code package resources from the Python distribution. */
    public void setIncludeDistributionResources(boolean include) {
        this.includeDistributionResources = include;
    }

    public boolean isIncludeTest() {
        return includeTest;
    }

    /** Whether to include modules and resources that only exist for tests. */
    public void setIncludeTest(boolean include) {
        this.includeTest = include;
    }

    public LicenseAllowList getLicenseAllowList() {
        return licenseAllowList;
    }

    /** Allow-list consulted by {@link ExtensionModuleFilter#NO_GPL}. */
    public void setLicenseAllowList(LicenseAllowList licenseAllowList) {
        this.licenseAllowList = Objects.requireNonNull(licenseAllowList, "licenseAllowList");
    }

    /**
     * Marks an extension as broken on a target, so it is never selected for that target.
     * Registering the same extension twice is harmless.
     */
    public void registerBrokenExtension(String targetTriple, String extension) {
        Objects.requireNonNull(targetTriple, "targetTriple");
        Objects.requireNonNull(extension, "extension");
        brokenExtensions.computeIfAbsent(targetTriple, k -> new ArrayList<>()).add(extension);
    }

    /** Extensions registered broken for the target, in registration order (unmodifiable, may repeat). */
    public List<String> getBrokenExtensions(String targetTriple) {
        List<String> names = brokenExtensions.get(targetTriple);
        return names != null ? Collections.unmodifiableList(names) : List.of();
    }

    /** Unmodifiable view of target triple → broken extension names. */
    public Map<String, List<String>> getBrokenExtensions() {
        Map<String, List<String>> view = new LinkedHashMap<>();
        brokenExtensions.forEach((triple, names) -> view.put(triple, Collections.unmodifiableList(names)));
        return Collections.unmodifiableMap(view);
    }

    public boolean isBrokenExtension(String targetTriple, String extension) {
        List<String> names = brokenExtensions.get(targetTriple);
        return names != null && names.contains(extension);
    }

    /**
     * Determines whether a resource meets the inclusion requirements of this policy.
     * Extension modules are never accepted here; they go through
     * {@link #resolvePythonExtensionModules(Iterable, String)}.
     *
     * @param resource resource discovered in the distribution
     * @return true if the resource should be included
     */
    public boolean filterPythonResource(PythonResource resource) {
        Objects.requireNonNull(resource, "resource");
        return switch (resource.kind()) {
            case MODULE_SOURCE -> includeDistributionSources && (includeTest || !resource.isTest());
            case MODULE_BYTECODE_REQUEST -> includeTest || !resource.isTest();
            case RESOURCE -> includeDistributionResources && (includeTest || !resource.isTest());
            case MODULE_BYTECODE,
                    DISTRIBUTION_RESOURCE,
                    EXTENSION_MODULE_DYNAMIC_LIBRARY,
                    EXTENSION_MODULE_STATICALLY_LINKED,
                    PATH_EXTENSION,
                    EGG_FILE -> false;
        };
    }

    /**
     * Resolves the extension modules to package for a target.
     * <p>
     * Per group, in input order: a group registered broken for {@code targetTriple} contributes nothing.
     * Otherwise a minimally required variant, if any, is always added first. Then the
     * {@link ExtensionModuleFilter} may add one more variant. Under {@link ExtensionModuleFilter#ALL}
     * that second entry is added even when it is the variant already added as minimally required,
     * so a group can appear twice in the result.
     *
     * @param extensionsVariants groups of interchangeable variants, one group per extension
     * @param targetTriple       target the binary is built for (e.g. {@code x86_64-unknown-linux-gnu})
     * @return chosen variants in group order
     */
    public List<PythonExtensionModule> resolvePythonExtensionModules(
            Iterable<ExtensionModuleVariants> extensionsVariants,
            String targetTriple) {
        Objects.requireNonNull(extensionsVariants, "extensionsVariants");
        List<PythonExtensionModule> res = new ArrayList<>();

        for (ExtensionModuleVariants variants : extensionsVariants) {
            if (variants.isEmpty()) continue;
            String name = variants.defaultVariant().getName();

            if (isBrokenExtension(targetTriple, name)) {
                log.debug("Skipping extension {}: registered broken on {}", name, targetTriple);
                continue;
            }

            // The interpreter does not start without these.
            chooseFrom(variants.filter(PythonExtensionModule::isMinimallyRequired)).ifPresent(res::add);

            Optional<PythonExtensionModule> chosen = switch (extensionModuleFilter) {
                case MINIMAL -> Optional.empty();
                case ALL -> chooseFrom(variants);
                case NO_LIBRARIES -> chooseFrom(variants.filter(em -> !em.requiresLibraries()));
                case NO_GPL -> chooseFrom(variants.filter(this::isLicenseAdmitted));
            };
            chosen.ifPresent(res::add);
        }

        log.debug("Resolved {} extension module entries for {} with filter {}",
                res.size(), targetTriple, extensionModuleFilter.toValue());
        return res;
    }

    /**
     * Whether a variant may be linked under {@link ExtensionModuleFilter#NO_GPL}. First match wins:
     * no linked libraries, admitted; public domain, admitted; declared licenses, admitted iff every one
     * is on the allow-list; no license information, excluded.
     */
    public boolean isLicenseAdmitted(PythonExtensionModule em) {
        if (em.getLinkLibraries().isEmpty()) {
            return true;
        }
        if (em.getLicensePublicDomain().orElse(false)) {
            return true;
        }
        Optional<List<String>> licenses = em.getLicenses();
        if (licenses.isPresent()) {
            boolean admitted = licenseAllowList.containsAll(licenses.get());
            if (!admitted) {
                log.debug("Excluding {}: licenses {} not all on the allow-list", em, licenses.get());
            }
            return admitted;
        }
        // Without evidence otherwise, assume copyleft.
        log.debug("Excluding {}: links libraries but declares no license", em);
        return false;
    }

    private Optional<PythonExtensionModule> chooseFrom(ExtensionModuleVariants candidates) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.chooseVariant(preferredExtensionModuleVariants));
    }
}

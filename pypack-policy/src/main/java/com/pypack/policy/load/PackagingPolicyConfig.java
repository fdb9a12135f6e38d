package com.pypack.policy.load;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pypack.policy.ExtensionModuleFilter;
import com.pypack.policy.PythonPackagingPolicy;
import com.pypack.policy.PythonResourcesPolicy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Packaging policy configuration document. Every field is optional; an absent field leaves the
 * policy default in place. Enum-like values use their textual form
 * ({@code "no-gpl"}, {@code "filesystem-relative-only:lib"}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PackagingPolicyConfig {

    private final ExtensionModuleFilter extensionModuleFilter;
    private final PythonResourcesPolicy resourcesPolicy;
    private final Boolean includeDistributionSources;
    private final Boolean includeDistributionResources;
    private final Boolean includeTest;
    private final Map<String, String> preferredExtensionModuleVariants;
    private final Map<String, List<String>> brokenExtensions;

    @JsonCreator
    public PackagingPolicyConfig(
            @JsonProperty("extensionModuleFilter") ExtensionModuleFilter extensionModuleFilter,
            @JsonProperty("resourcesPolicy") PythonResourcesPolicy resourcesPolicy,
            @JsonProperty("includeDistributionSources") Boolean includeDistributionSources,
            @JsonProperty("includeDistributionResources") Boolean includeDistributionResources,
            @JsonProperty("includeTest") Boolean includeTest,
            @JsonProperty("preferredExtensionModuleVariants") Map<String, String> preferredExtensionModuleVariants,
            @JsonProperty("brokenExtensions") Map<String, List<String>> brokenExtensions) {
        this.extensionModuleFilter = extensionModuleFilter;
        this.resourcesPolicy = resourcesPolicy;
        this.includeDistributionSources = includeDistributionSources;
        this.includeDistributionResources = includeDistributionResources;
        this.includeTest = includeTest;
        this.preferredExtensionModuleVariants = preferredExtensionModuleVariants != null
                ? new LinkedHashMap<>(preferredExtensionModuleVariants) : Map.of();
        Map<String, List<String>> broken = new LinkedHashMap<>();
        if (brokenExtensions != null) {
            brokenExtensions.forEach((triple, names) -> broken.put(triple, names != null ? List.copyOf(names) : List.of()));
        }
        this.brokenExtensions = broken;
    }

    /** Document describing every setting of {@code policy} (except the license allow-list, which is code). */
    public static PackagingPolicyConfig from(PythonPackagingPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        return new PackagingPolicyConfig(
                policy.getExtensionModuleFilter(),
                policy.getResourcesPolicy(),
                policy.isIncludeDistributionSources(),
                policy.isIncludeDistributionResources(),
                policy.isIncludeTest(),
                policy.getPreferredExtensionModuleVariants(),
                policy.getBrokenExtensions());
    }

    /** New policy: defaults overridden by the fields present in this document. */
    public PythonPackagingPolicy toPolicy() {
        PythonPackagingPolicy policy = new PythonPackagingPolicy();
        applyTo(policy);
        return policy;
    }

    /** Applies the fields present in this document to {@code policy}. */
    public void applyTo(PythonPackagingPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        if (extensionModuleFilter != null) policy.setExtensionModuleFilter(extensionModuleFilter);
        if (resourcesPolicy != null) policy.setResourcesPolicy(resourcesPolicy);
        if (includeDistributionSources != null) policy.setIncludeDistributionSources(includeDistributionSources);
        if (includeDistributionResources != null) policy.setIncludeDistributionResources(includeDistributionResources);
        if (includeTest != null) policy.setIncludeTest(includeTest);
        preferredExtensionModuleVariants.forEach(policy::setPreferredExtensionModuleVariant);
        brokenExtensions.forEach((triple, names) -> {
            for (String name : names) policy.registerBrokenExtension(triple, name);
        });
    }

    public ExtensionModuleFilter getExtensionModuleFilter() {
        return extensionModuleFilter;
    }

    public PythonResourcesPolicy getResourcesPolicy() {
        return resourcesPolicy;
    }

    public Boolean getIncludeDistributionSources() {
        return includeDistributionSources;
    }

    public Boolean getIncludeDistributionResources() {
        return includeDistributionResources;
    }

    public Boolean getIncludeTest() {
        return includeTest;
    }

    public Map<String, String> getPreferredExtensionModuleVariants() {
        return preferredExtensionModuleVariants;
    }

    public Map<String, List<String>> getBrokenExtensions() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        brokenExtensions.forEach((triple, names) -> copy.put(triple, new ArrayList<>(names)));
        return copy;
    }
}

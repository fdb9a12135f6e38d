package com.pypack.policy.load;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pypack.policy.PackagingPolicyException;
import com.pypack.policy.PythonPackagingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link PackagingPolicyConfig} JSON documents.
 * <p>
 * A rejected policy value ({@link com.pypack.policy.InvalidPolicyValueException},
 * {@link com.pypack.policy.InvalidFilterValueException}) is rethrown as is, even though Jackson wraps it;
 * any other malformed input is reported as {@link UncheckedIOException}.
 */
public final class PackagingPolicyConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PackagingPolicyConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private PackagingPolicyConfigLoader() {
    }

    /**
     * Parses a configuration document.
     *
     * @throws com.pypack.policy.PackagingPolicyException if a policy value is invalid
     * @throws UncheckedIOException on any other parse failure
     */
    public static PackagingPolicyConfig parseConfig(String json) {
        try {
            return MAPPER.readValue(json, PackagingPolicyConfig.class);
        } catch (IOException e) {
            throw rethrow(e);
        }
    }

    /** Builds a policy from a JSON document. */
    public static PythonPackagingPolicy fromJson(String json) {
        return parseConfig(json).toPolicy();
    }

    /** Builds a policy from a JSON file. */
    public static PythonPackagingPolicy fromPath(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            log.warn("Failed to read packaging policy file {}: {}", file, e.getMessage());
            throw new UncheckedIOException(e);
        }
        PythonPackagingPolicy policy = fromJson(json);
        log.info("Packaging policy loaded from file: {} (filter={}, resources={})",
                file, policy.getExtensionModuleFilter().toValue(), policy.getResourcesPolicy());
        return policy;
    }

    /** Serializes every setting of {@code policy} as a configuration document. */
    public static String toJson(PythonPackagingPolicy policy) {
        try {
            return MAPPER.writeValueAsString(PackagingPolicyConfig.from(policy));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static RuntimeException rethrow(IOException e) {
        for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
            if (t instanceof PackagingPolicyException ppe) throw ppe;
        }
        throw new UncheckedIOException(e);
    }
}

package com.finopsguard.parser;

import com.finopsguard.domain.model.CanonicalResource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared building blocks for extractors.
 */
public final class Resources {

    private Resources() {
    }

    /**
     * Builder pre-filled with the name, region, count and tags of the block.
     * The source type or module is recorded in metadata as {@code source_type}.
     */
    public static CanonicalResource.CanonicalResourceBuilder resource(ResourceBlock block, String type, String size) {
        return CanonicalResource.builder()
                .type(type)
                .name(block.getName())
                .region(block.region())
                .size(size)
                .count(block.count())
                .tags(block.tags())
                .metadata(metadata("source_type", block.getType()));
    }

    /**
     * Type-specific instance count multiplied by the block's {@code count} meta-argument.
     */
    public static int scaled(ResourceBlock block, int perInstance) {
        return block.count() * perInstance;
    }

    /**
     * Typed registry entry, so extractor lambdas get their target type.
     */
    public static Map.Entry<String, ResourceExtractor> extractor(String type, ResourceExtractor extractor) {
        return Map.entry(type, extractor);
    }

    /**
     * Metadata map from alternating keys and values; null values are dropped.
     */
    public static Map<String, Object> metadata(Object... keysAndValues) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                metadata.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
            }
        }
        return metadata;
    }

    /**
     * Last path segment of a value such as {@code zones/us-central1-a/machineTypes/n1-standard-1}.
     */
    public static String lastSegment(String value) {
        int slash = value.lastIndexOf('/');
        return slash >= 0 ? value.substring(slash + 1) : value;
    }
}

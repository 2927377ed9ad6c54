package com.finopsguard.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cloud- and format-agnostic description of one declared resource.
 *
 * Every parser emits this shape so that pricing and policy evaluation never
 * see provider or format specifics. The {@code type} keeps a cloud prefix
 * ({@code aws_}, {@code gcp_}, {@code azure_}); the {@code size} is the provider
 * SKU or tier string used for pricing.
 *
 * Metadata carries descriptive attributes (memory, runtime, capacity) that are
 * reported but never priced. When no id is given it is derived as
 * {@code <type>.<name>-<size>-<region>}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class CanonicalResource {

    private final String id;
    private final String type;
    private final String name;
    private final String region;
    private final String size;
    private final int count;
    private final Map<String, String> tags;
    private final Map<String, Object> metadata;

    @Builder(toBuilder = true)
    private CanonicalResource(String id, String type, String name, String region, String size,
                              Integer count, Map<String, String> tags, Map<String, Object> metadata) {
        this.id = id != null ? id : type + "." + name + "-" + size + "-" + region;
        this.type = type;
        this.name = name;
        this.region = region;
        this.size = size;
        this.count = count == null || count < 1 ? 1 : count;
        this.tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Cloud this resource belongs to, derived from the type prefix.
     */
    public CloudProvider getCloud() {
        if (type.startsWith("gcp_")) {
            return CloudProvider.GCP;
        }
        if (type.startsWith("azure_")) {
            return CloudProvider.AZURE;
        }
        return CloudProvider.AWS;
    }
}

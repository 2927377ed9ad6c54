package com.finopsguard.parser;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.IacFormat;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One resource declaration as read from IaC text, before extraction.
 *
 * Terraform blocks and Ansible module arguments are both reduced to a nested
 * attribute map so that extractors can read either format through the same
 * dotted-path accessors. Nested blocks declared more than once are lists; a
 * path step through a list reads its first element.
 *
 * Only literal values are returned. Expressions, references and template
 * strings are reported as absent so that callers fall back to their defaults.
 */
@Getter
public class ResourceBlock {

    private static final Pattern GCP_ZONE = Pattern.compile("^[a-z]+-[a-z]+\\d+-[a-z]$");
    private static final Pattern AWS_AVAILABILITY_ZONE = Pattern.compile("^[a-z]{2}-[a-z]+-\\d[a-z]$");

    private final IacFormat format;
    private final CloudProvider cloud;
    private final String type;
    private final String name;
    private final Map<String, Object> attributes;
    private final String defaultRegion;

    public ResourceBlock(IacFormat format, CloudProvider cloud, String type, String name,
                         Map<String, Object> attributes, String defaultRegion) {
        this.format = format;
        this.cloud = cloud;
        this.type = type;
        this.name = name;
        this.attributes = attributes == null ? Map.of() : attributes;
        this.defaultRegion = defaultRegion == null ? cloud.getFallbackRegion() : defaultRegion;
    }

    /**
     * Raw value at a dotted path, e.g. {@code default_node_pool.vm_size}.
     */
    public Optional<Object> value(String path) {
        Object current = attributes;
        for (String step : path.split("\\.")) {
            current = unwrapList(current);
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(step);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    public Optional<String> string(String path) {
        return value(path).map(ResourceBlock::asLiteralString);
    }

    public String string(String path, String defaultValue) {
        return string(path).orElse(defaultValue);
    }

    /**
     * First literal string found among the given paths.
     */
    public Optional<String> firstString(String... paths) {
        for (String path : paths) {
            Optional<String> value = string(path);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public Optional<Integer> integer(String path) {
        return value(path).map(ResourceBlock::asInteger);
    }

    public int integer(String path, int defaultValue) {
        return integer(path).orElse(defaultValue);
    }

    public Optional<Integer> firstInteger(String... paths) {
        for (String path : paths) {
            Optional<Integer> value = integer(path);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public boolean bool(String path, boolean defaultValue) {
        return value(path)
                .map(ResourceBlock::asLiteralString)
                .map(v -> v.equalsIgnoreCase("true") || v.equalsIgnoreCase("yes"))
                .orElse(defaultValue);
    }

    /**
     * Literal {@code count}; anything that is not a positive integer literal counts as one.
     */
    public int count() {
        return integer("count").filter(c -> c > 0).orElse(1);
    }

    /**
     * Resource tags. GCP resources call them labels.
     */
    public Map<String, String> tags() {
        Object raw = value("tags").or(() -> value("labels")).orElse(null);
        Map<String, String> tags = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((k, v) -> {
                String literal = asLiteralString(v);
                if (k != null && literal != null) {
                    tags.put(String.valueOf(k), literal);
                }
            });
        }
        return tags;
    }

    /**
     * Region of this resource: explicit region, then location, then zone,
     * then the provider default.
     */
    public String region() {
        Optional<String> explicit = firstString("region", "location");
        if (explicit.isPresent()) {
            return normalizeRegion(explicit.get());
        }
        Optional<String> zone = firstString("zone", "availability_zone");
        if (zone.isPresent()) {
            return zoneToRegion(zone.get());
        }
        return defaultRegion;
    }

    private String normalizeRegion(String region) {
        String trimmed = region.trim();
        if (cloud == CloudProvider.AZURE) {
            return trimmed.replace(" ", "").toLowerCase(Locale.ROOT);
        }
        if (GCP_ZONE.matcher(trimmed).matches() || AWS_AVAILABILITY_ZONE.matcher(trimmed).matches()) {
            return zoneToRegion(trimmed);
        }
        return trimmed;
    }

    /**
     * GCP zones drop their last segment (us-central1-a to us-central1);
     * AWS availability zones drop the trailing letter (us-east-1a to us-east-1).
     */
    public static String zoneToRegion(String zone) {
        String trimmed = zone.trim();
        if (AWS_AVAILABILITY_ZONE.matcher(trimmed).matches()) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        int lastDash = trimmed.lastIndexOf('-');
        return lastDash > 0 ? trimmed.substring(0, lastDash) : trimmed;
    }

    private static Object unwrapList(Object value) {
        if (value instanceof List<?> list) {
            return list.isEmpty() ? null : list.get(0);
        }
        return value;
    }

    static String asLiteralString(Object value) {
        value = unwrapList(value);
        if (value instanceof String s) {
            if (s.contains("${") || s.contains("{{")) {
                return null;
            }
            return s;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return null;
    }

    static Integer asInteger(Object value) {
        value = unwrapList(value);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}

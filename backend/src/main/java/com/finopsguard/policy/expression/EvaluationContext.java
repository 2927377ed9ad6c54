package com.finopsguard.policy.expression;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Values a rule can reference, addressed by dotted paths.
 *
 * A path is first looked up as a literal key, then walked segment by segment
 * through nested maps (and lists by numeric index), so {@code resource.tags.env}
 * reaches the {@code env} tag of the current resource. Within a map the longest
 * matching dotted key wins, so tag keys may themselves contain dots.
 */
public final class EvaluationContext {

    private final Map<String, Object> values;

    private EvaluationContext(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static EvaluationContext of(Map<String, ?> values) {
        return new EvaluationContext(new LinkedHashMap<>(values));
    }

    public static EvaluationContext empty() {
        return new EvaluationContext(new LinkedHashMap<>());
    }

    /**
     * A copy of this context with {@code key} bound to {@code value}.
     */
    public EvaluationContext with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new EvaluationContext(copy);
    }

    public Optional<Object> lookup(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        if (values.containsKey(path)) {
            return Optional.ofNullable(values.get(path));
        }
        String[] segments = path.split("\\.");
        Object current = values;
        int i = 0;
        while (i < segments.length) {
            if (current instanceof Map<?, ?> map) {
                int end = longestKey(map, segments, i);
                if (end < 0) {
                    return Optional.empty();
                }
                current = map.get(String.join(".", Arrays.asList(segments).subList(i, end)));
                i = end;
            } else if (current instanceof List<?> list && isIndex(segments[i], list.size())) {
                current = list.get(Integer.parseInt(segments[i]));
                i++;
            } else {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(current);
    }

    /**
     * End index of the longest run of segments from {@code start} that is a key of {@code map},
     * so dotted keys such as {@code app.kubernetes.io/name} resolve; -1 when none is.
     */
    private static int longestKey(Map<?, ?> map, String[] segments, int start) {
        for (int end = segments.length; end > start; end--) {
            if (map.containsKey(String.join(".", Arrays.asList(segments).subList(start, end)))) {
                return end;
            }
        }
        return -1;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private static boolean isIndex(String segment, int size) {
        if (segment.isEmpty() || segment.length() > 9 || !segment.chars().allMatch(Character::isDigit)) {
            return false;
        }
        return Integer.parseInt(segment) < size;
    }

    @Override
    public String toString() {
        return "EvaluationContext" + values;
    }
}

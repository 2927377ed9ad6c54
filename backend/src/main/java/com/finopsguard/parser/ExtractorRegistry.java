package com.finopsguard.parser;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.IacFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup table from (format, cloud, resource type) to extractor.
 *
 * Adding support for a resource type means adding an entry to one of the
 * extractor sets; the parsers never branch on resource types themselves.
 */
@Component
@Slf4j
public class ExtractorRegistry {

    private final Map<ExtractorKey, ResourceExtractor> extractors = new HashMap<>();

    public ExtractorRegistry(List<ExtractorSet> extractorSets) {
        for (ExtractorSet set : extractorSets) {
            set.getExtractors().forEach((type, extractor) -> {
                ExtractorKey key = new ExtractorKey(set.getFormat(), set.getProvider(), type);
                if (extractors.putIfAbsent(key, extractor) != null) {
                    throw new IllegalStateException("Duplicate extractor registered for " + key);
                }
            });
        }
        log.info("Registered {} resource extractors", extractors.size());
    }

    public Optional<ResourceExtractor> find(IacFormat format, CloudProvider cloud, String type) {
        return Optional.ofNullable(extractors.get(new ExtractorKey(format, cloud, type)));
    }

    public boolean supports(IacFormat format, CloudProvider cloud, String type) {
        return extractors.containsKey(new ExtractorKey(format, cloud, type));
    }

    public int size() {
        return extractors.size();
    }

    record ExtractorKey(IacFormat format, CloudProvider cloud, String type) {}
}

package com.finopsguard.recommendation;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Groups machine SKUs into families whose members differ only in size, so a
 * cheaper member is a like-for-like downsize.
 *
 * t3.large and t3.small share {@code t3.*}; e2-standard-8 and e2-standard-2
 * share {@code e2-standard-*}; Standard_D4s_v3 and Standard_D2s_v3 share
 * {@code Standard_D*s_v3}.
 */
final class SkuFamilies {

    private static final List<FamilyPattern> PATTERNS = List.of(
            // AWS: db.t3.medium, cache.m5.large, t3.small.search
            new FamilyPattern(Pattern.compile("(?<=\\.)(nano|micro|small|medium|\\d*xlarge|large)(?=\\.|$)"), "*"),
            // Azure: Standard_D4s_v3
            new FamilyPattern(Pattern.compile("^(Standard_[A-Z]+)\\d+(.*)$"), "$1*$2"),
            // GCP: e2-standard-4, db-n1-standard-2
            new FamilyPattern(Pattern.compile("^(.+-)\\d+$"), "$1*"),
            // GCP shared core: e2-micro, e2-small, e2-medium
            new FamilyPattern(Pattern.compile("^([a-z]\\d[a-z]?-)(micro|small|medium)$"), "$1*")
    );

    private SkuFamilies() {
    }

    static Optional<String> familyOf(String sku) {
        if (sku == null || sku.isBlank()) {
            return Optional.empty();
        }
        for (FamilyPattern pattern : PATTERNS) {
            var matcher = pattern.pattern().matcher(sku);
            if (matcher.find()) {
                return Optional.of(matcher.replaceFirst(pattern.replacement()));
            }
        }
        return Optional.empty();
    }

    private record FamilyPattern(Pattern pattern, String replacement) {}
}

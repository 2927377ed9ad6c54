package com.finopsguard.recommendation;

/**
 * Cost optimization hint for one resource.
 */
public record Recommendation(
        String id,
        RecommendationType type,
        String resourceId,
        String summary,
        String details,
        double estimatedSavingsMonthly
) {
    public enum RecommendationType {
        RIGHT_SIZE("right_size"),
        SPOT("spot"),
        RESERVED("reserved"),
        SCHEDULE("schedule");

        private final String value;

        RecommendationType(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }
}

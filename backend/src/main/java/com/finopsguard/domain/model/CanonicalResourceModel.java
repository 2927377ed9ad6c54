package com.finopsguard.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered collection of canonical resources produced by one parse.
 *
 * Order is parse order. Ids are unique within a model: a resource whose id
 * collides with an earlier one is renamed with a numeric suffix.
 */
public final class CanonicalResourceModel {

    private final List<CanonicalResource> resources;

    private CanonicalResourceModel(List<CanonicalResource> resources) {
        this.resources = Collections.unmodifiableList(resources);
    }

    public static CanonicalResourceModel empty() {
        return new CanonicalResourceModel(List.of());
    }

    public static CanonicalResourceModel of(List<CanonicalResource> resources) {
        Builder builder = builder();
        resources.forEach(builder::add);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<CanonicalResource> getResources() {
        return resources;
    }

    public int size() {
        return resources.size();
    }

    public boolean isEmpty() {
        return resources.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalResourceModel other)) return false;
        return resources.equals(other.resources);
    }

    @Override
    public int hashCode() {
        return resources.hashCode();
    }

    @Override
    public String toString() {
        return "CanonicalResourceModel(resources=" + resources + ")";
    }

    public static final class Builder {

        private final List<CanonicalResource> resources = new ArrayList<>();
        private final Set<String> ids = new HashSet<>();

        public Builder add(CanonicalResource resource) {
            String id = resource.getId();
            if (!ids.add(id)) {
                int suffix = 2;
                while (!ids.add(id + "-" + suffix)) {
                    suffix++;
                }
                resource = resource.toBuilder().id(id + "-" + suffix).build();
            }
            resources.add(resource);
            return this;
        }

        public CanonicalResourceModel build() {
            return new CanonicalResourceModel(new ArrayList<>(resources));
        }
    }
}

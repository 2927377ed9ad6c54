package com.finopsguard.parser;

import com.finopsguard.domain.model.CanonicalResource;

/**
 * Turns one resource declaration of a known type into its canonical form.
 */
@FunctionalInterface
public interface ResourceExtractor {

    CanonicalResource extract(ResourceBlock block);
}

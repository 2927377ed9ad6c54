package com.finopsguard.parser;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.IacFormat;

import java.util.Map;

/**
 * Extractors contributed for one (format, cloud) pair, keyed by the
 * Terraform resource type or Ansible module name they handle.
 */
public interface ExtractorSet {

    IacFormat getFormat();

    CloudProvider getProvider();

    Map<String, ResourceExtractor> getExtractors();
}

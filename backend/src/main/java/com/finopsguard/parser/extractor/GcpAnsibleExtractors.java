package com.finopsguard.parser.extractor;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.IacFormat;
import com.finopsguard.parser.ExtractorSet;
import com.finopsguard.parser.ResourceExtractor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

import static com.finopsguard.parser.Resources.extractor;
import static com.finopsguard.parser.Resources.lastSegment;
import static com.finopsguard.parser.Resources.resource;

/**
 * Extractors for modules of the {@code google.cloud} collection.
 */
@Component
public class GcpAnsibleExtractors implements ExtractorSet {

    private static final Map<String, ResourceExtractor> EXTRACTORS = Map.ofEntries(
            extractor("gcp_compute_instance", block -> resource(block, "gcp_compute_instance",
                    lastSegment(block.string("machine_type", "n1-standard-1"))).build()),
            extractor("gcp_compute_instance_group_manager", block -> resource(block, "gcp_compute_instance_group",
                    lastSegment(block.string("template.machine_type", "n1-standard-1")))
                    .count(block.integer("target_size", 1))
                    .build()),
            extractor("gcp_container_cluster", block -> resource(block, "gcp_container_cluster",
                    block.bool("autopilot.enabled", false) ? "autopilot_cluster" : "standard_cluster").build()),
            extractor("gcp_container_node_pool", block -> resource(block, "gcp_container_node_pool",
                    block.string("config.machine_type", "e2-medium"))
                    .count(block.integer("initial_node_count", 1))
                    .build()),
            extractor("gcp_cloudfunctions_cloud_function", block -> resource(block, "gcp_cloudfunctions_function",
                    block.string("runtime", "python39")).build()),
            extractor("gcp_sql_instance", block -> resource(block, "gcp_sql_database_instance",
                    block.string("settings.tier", "db-f1-micro")).build()),
            extractor("gcp_storage_bucket", block -> resource(block, "gcp_storage_bucket",
                    block.string("storage_class", "STANDARD").toLowerCase(Locale.ROOT))
                    .region(block.string("location", "US"))
                    .build()),
            extractor("gcp_pubsub_topic", block -> resource(block, "gcp_pubsub_topic", "standard").build()),
            extractor("gcp_pubsub_subscription", block -> resource(block, "gcp_pubsub_subscription", "standard")
                    .build()),
            extractor("gcp_redis_instance", block -> resource(block, "gcp_redis_instance",
                    block.string("tier", "BASIC").toUpperCase(Locale.ROOT) + "-" + block.integer("memory_size_gb", 1) + "GB")
                    .build()),
            extractor("gcp_spanner_instance", block -> resource(block, "gcp_spanner_instance", "regional")
                    .count(block.integer("node_count", 1))
                    .build()),
            extractor("gcp_bigquery_dataset", block -> resource(block, "gcp_bigquery_dataset", "standard").build())
    );

    @Override
    public IacFormat getFormat() {
        return IacFormat.ANSIBLE;
    }

    @Override
    public CloudProvider getProvider() {
        return CloudProvider.GCP;
    }

    @Override
    public Map<String, ResourceExtractor> getExtractors() {
        return EXTRACTORS;
    }
}

package com.finopsguard.parser.extractor;

import com.finopsguard.domain.model.CanonicalResource;
import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.IacFormat;
import com.finopsguard.parser.ExtractorSet;
import com.finopsguard.parser.ResourceBlock;
import com.finopsguard.parser.ResourceExtractor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

import static com.finopsguard.parser.Resources.extractor;
import static com.finopsguard.parser.Resources.lastSegment;
import static com.finopsguard.parser.Resources.metadata;
import static com.finopsguard.parser.Resources.resource;
import static com.finopsguard.parser.Resources.scaled;

/**
 * Extractors for Google Cloud Terraform resources ({@code google_*} to {@code gcp_*}).
 *
 * Regions come from {@code region}, {@code location} or a {@code zone}
 * (us-central1-a becomes us-central1). Multi-region locations such as
 * {@code US} are kept as written.
 */
@Component
public class GcpTerraformExtractors implements ExtractorSet {

    private static final ResourceExtractor LOAD_BALANCER = block -> resource(block, "gcp_load_balancer",
            block.getType().contains("https") || block.getType().contains("ssl") ? "ssl_lb" : "http_lb").build();

    private static final ResourceExtractor CLOUD_RUN = block -> resource(block, "gcp_cloud_run_service", "serverless")
            .metadata(metadata("source_type", block.getType(),
                    "cpu", block.firstString("template.spec.containers.resources.limits.cpu",
                            "template.containers.resources.limits.cpu").orElse(null)))
            .build();

    private static final ResourceExtractor CLOUD_FUNCTION = block -> resource(block, "gcp_cloudfunctions_function",
            block.firstString("runtime", "build_config.runtime").orElse("python39"))
            .metadata(metadata("source_type", block.getType(),
                    "memory_mb", block.integer("available_memory_mb").orElse(null)))
            .build();

    private static final Map<String, ResourceExtractor> EXTRACTORS = Map.ofEntries(
            // Compute
            extractor("google_compute_instance", block -> resource(block, "gcp_compute_instance",
                    lastSegment(block.string("machine_type", "e2-micro"))).build()),
            extractor("google_compute_instance_template", block -> resource(block, "gcp_instance_template",
                    lastSegment(block.string("machine_type", "e2-micro"))).build()),
            extractor("google_compute_instance_group_manager", block -> resource(block, "gcp_compute_instance_group",
                    "e2-medium")
                    .count(scaled(block, block.integer("target_size", 1)))
                    .build()),
            extractor("google_cloud_run_service", CLOUD_RUN),
            extractor("google_cloud_run_v2_service", CLOUD_RUN),
            extractor("google_cloudfunctions_function", CLOUD_FUNCTION),
            extractor("google_cloudfunctions2_function", CLOUD_FUNCTION),
            extractor("google_notebooks_instance", block -> resource(block, "gcp_notebooks_instance",
                    lastSegment(block.string("machine_type", "n1-standard-4"))).build()),

            // Kubernetes
            extractor("google_container_cluster", block -> resource(block, "gcp_container_cluster",
                    block.bool("enable_autopilot", false) ? "autopilot_cluster" : "standard_cluster")
                    .metadata(metadata("source_type", block.getType(),
                            "initial_node_count", block.integer("initial_node_count").orElse(null)))
                    .build()),
            extractor("google_container_node_pool", block -> resource(block, "gcp_container_node_pool",
                    block.string("node_config.machine_type", "e2-medium"))
                    .count(scaled(block, block.firstInteger("node_count", "initial_node_count").orElse(1)))
                    .build()),

            // Databases and caches
            extractor("google_sql_database_instance", block -> resource(block, "gcp_sql_database_instance",
                    block.string("settings.tier", "db-f1-micro"))
                    .metadata(metadata("source_type", block.getType(),
                            "database_version", block.string("database_version").orElse(null)))
                    .build()),
            extractor("google_redis_instance", block -> resource(block, "gcp_redis_instance",
                    block.string("tier", "BASIC").toUpperCase(Locale.ROOT) + "-" + block.integer("memory_size_gb", 1) + "GB")
                    .build()),
            extractor("google_spanner_instance", GcpTerraformExtractors::spannerInstance),
            extractor("google_bigquery_dataset", block -> resource(block, "gcp_bigquery_dataset", "standard").build()),

            // Storage
            extractor("google_storage_bucket", block -> resource(block, "gcp_storage_bucket",
                    block.string("storage_class", "STANDARD").toLowerCase(Locale.ROOT))
                    .region(block.string("location", "US"))
                    .build()),
            extractor("google_compute_disk", block -> resource(block, "gcp_compute_disk",
                    block.string("type", "pd-standard") + "-" + block.integer("size", 10) + "GB").build()),
            extractor("google_filestore_instance", block -> resource(block, "gcp_filestore_instance",
                    block.string("tier", "BASIC_HDD").toUpperCase(Locale.ROOT)).build()),

            // Networking
            extractor("google_compute_global_forwarding_rule", LOAD_BALANCER),
            extractor("google_compute_forwarding_rule", LOAD_BALANCER),
            extractor("google_compute_url_map", LOAD_BALANCER),
            extractor("google_compute_target_http_proxy", LOAD_BALANCER),
            extractor("google_compute_target_https_proxy", LOAD_BALANCER),
            extractor("google_compute_security_policy", block -> resource(block, "gcp_cloud_armor", "policy")
                    .region("global")
                    .build()),

            // Messaging and data processing
            extractor("google_pubsub_topic", block -> resource(block, "gcp_pubsub_topic", "standard").build()),
            extractor("google_pubsub_subscription", block -> resource(block, "gcp_pubsub_subscription", "standard").build()),
            extractor("google_dataflow_job", block -> resource(block, "gcp_dataflow_job",
                    block.string("machine_type", "n1-standard-1"))
                    .count(scaled(block, block.integer("max_workers", 1)))
                    .build()),
            extractor("google_dataproc_cluster", GcpTerraformExtractors::dataprocCluster),
            extractor("google_composer_environment", block -> resource(block, "gcp_composer_environment",
                    block.string("config.environment_size", "ENVIRONMENT_SIZE_SMALL").toUpperCase(Locale.ROOT)).build())
    );

    @Override
    public IacFormat getFormat() {
        return IacFormat.TERRAFORM;
    }

    @Override
    public CloudProvider getProvider() {
        return CloudProvider.GCP;
    }

    @Override
    public Map<String, ResourceExtractor> getExtractors() {
        return EXTRACTORS;
    }

    private static CanonicalResource spannerInstance(ResourceBlock block) {
        int nodes = block.integer("num_nodes")
                .orElseGet(() -> Math.max(1, (block.integer("processing_units", 1000) + 999) / 1000));
        return resource(block, "gcp_spanner_instance", "regional")
                .region(block.string("config").map(GcpTerraformExtractors::spannerRegion).orElse(block.region()))
                .count(scaled(block, nodes))
                .build();
    }

    private static String spannerRegion(String config) {
        return config.startsWith("regional-") ? config.substring("regional-".length()) : config;
    }

    private static CanonicalResource dataprocCluster(ResourceBlock block) {
        String masterType = block.string("cluster_config.master_config.machine_type", "n1-standard-4");
        int masters = block.integer("cluster_config.master_config.num_instances", 1);
        int workers = block.integer("cluster_config.worker_config.num_instances", 2);
        return resource(block, "gcp_dataproc_cluster", masterType)
                .count(scaled(block, masters + workers))
                .metadata(metadata("source_type", block.getType(),
                        "worker_machine_type", block.string("cluster_config.worker_config.machine_type").orElse(null),
                        "worker_count", workers))
                .build();
    }
}

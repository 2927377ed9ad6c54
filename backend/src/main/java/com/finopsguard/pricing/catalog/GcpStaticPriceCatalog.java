package com.finopsguard.pricing.catalog;

import com.finopsguard.domain.model.CloudProvider;
import org.springframework.stereotype.Component;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Google Cloud on-demand list prices, us-central1.
 */
@Component
public class GcpStaticPriceCatalog implements StaticPriceCatalog {

    private static final Map<String, Double> PRICES = Map.ofEntries(
            entry("e2-micro", 0.006),
            entry("e2-small", 0.012),
            entry("e2-medium", 0.024),
            entry("e2-standard-2", 0.067),
            entry("e2-standard-4", 0.134),
            entry("e2-standard-8", 0.268),
            entry("e2-standard-16", 0.536),
            entry("n1-standard-1", 0.0475),
            entry("n1-standard-2", 0.095),
            entry("n1-standard-4", 0.19),
            entry("n1-standard-8", 0.38),
            entry("n2-standard-2", 0.0971),
            entry("n2-standard-4", 0.1942),
            entry("n2-standard-8", 0.3885),
            entry("c2-standard-4", 0.208),
            entry("c2-standard-8", 0.416),
            entry("c2-standard-16", 0.832),
            entry("c2-standard-30", 1.56),
            entry("a2-highgpu-1g", 3.67),
            // Cloud SQL tiers
            entry("db-f1-micro", 0.017),
            entry("db-g1-small", 0.025),
            entry("db-n1-standard-1", 0.041),
            entry("db-n1-standard-2", 0.082),
            entry("db-n1-standard-4", 0.164),
            entry("db-n1-standard-8", 0.328),
            entry("db-n1-standard-16", 0.656),
            // Tiered services
            entry("gcp_container_cluster:standard_cluster", 0.10),
            entry("gcp_container_cluster:autopilot_cluster", 0.10),
            entry("gcp_load_balancer:http_lb", 0.025),
            entry("gcp_load_balancer:ssl_lb", 0.025),
            entry("gcp_load_balancer:tcp_lb", 0.025),
            entry("gcp_redis_instance:BASIC-1GB", 0.049),
            entry("gcp_redis_instance:BASIC-5GB", 0.245),
            entry("gcp_redis_instance:STANDARD_HA-1GB", 0.064),
            entry("gcp_redis_instance:STANDARD_HA-5GB", 0.32),
            entry("gcp_filestore_instance:BASIC_HDD", 0.28),
            entry("gcp_filestore_instance:BASIC_SSD", 1.03),
            entry("gcp_composer_environment:ENVIRONMENT_SIZE_SMALL", 0.35),
            entry("gcp_composer_environment:ENVIRONMENT_SIZE_MEDIUM", 0.70),
            entry("gcp_composer_environment:ENVIRONMENT_SIZE_LARGE", 1.40),
            entry("gcp_storage_bucket:standard", 0.0),
            entry("gcp_storage_bucket:nearline", 0.0),
            entry("gcp_storage_bucket:coldline", 0.0),
            entry("gcp_storage_bucket:archive", 0.0),
            // Flat and usage-based services
            entry("gcp_spanner_instance", 0.90),
            entry("gcp_cloud_armor", 0.0068),
            entry("gcp_cloud_run_service", 0.0),
            entry("gcp_cloudfunctions_function", 0.0),
            entry("gcp_bigquery_dataset", 0.0),
            entry("gcp_compute_disk", 0.0),
            entry("gcp_pubsub_topic", 0.0),
            entry("gcp_pubsub_subscription", 0.0)
    );

    private static final Map<String, Double> REGION_OVERRIDES = Map.ofEntries(
            entry("europe-west1/e2-medium", 0.0264),
            entry("europe-west1/n1-standard-1", 0.0523),
            entry("asia-east1/e2-medium", 0.0276),
            entry("asia-east1/n1-standard-1", 0.0551)
    );

    @Override
    public CloudProvider getProvider() {
        return CloudProvider.GCP;
    }

    @Override
    public Map<String, Double> getHourlyPrices() {
        return PRICES;
    }

    @Override
    public Map<String, Double> getRegionOverrides() {
        return REGION_OVERRIDES;
    }
}

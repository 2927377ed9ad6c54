package com.finopsguard.simulation;

import com.finopsguard.domain.model.CanonicalResource;
import org.springframework.stereotype.Component;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Maps canonical resources to the SKU string used for price lookups.
 *
 * STRATEGIES:
 * - SIZE: machine-sized resources are priced by their size ({@code t3.medium})
 * - TYPE: flat or usage-based services are priced by their type ({@code aws_eks_cluster})
 * - TYPE_AND_SIZE: tiered services are priced by {@code type:size}
 *   ({@code aws_load_balancer:application})
 *
 * Types missing from the table are priced by size.
 */
@Component
public class PricingSkuMapper {

    enum SkuStrategy {
        SIZE,
        TYPE,
        TYPE_AND_SIZE
    }

    private static final Map<String, SkuStrategy> STRATEGIES = Map.ofEntries(
            // AWS
            entry("aws_load_balancer", SkuStrategy.TYPE_AND_SIZE),
            entry("aws_ecs_service", SkuStrategy.TYPE_AND_SIZE),
            entry("aws_kinesis_stream", SkuStrategy.TYPE_AND_SIZE),
            entry("aws_dynamodb_table", SkuStrategy.TYPE_AND_SIZE),
            entry("aws_neptune_cluster", SkuStrategy.TYPE_AND_SIZE),
            entry("aws_docdb_cluster", SkuStrategy.TYPE_AND_SIZE),
            entry("aws_apprunner_service", SkuStrategy.TYPE_AND_SIZE),
            entry("aws_eks_cluster", SkuStrategy.TYPE),
            entry("aws_nat_gateway", SkuStrategy.TYPE),
            entry("aws_ecs_cluster", SkuStrategy.TYPE),
            entry("aws_ecs_task_definition", SkuStrategy.TYPE),
            entry("aws_lambda_function", SkuStrategy.TYPE),
            entry("aws_s3_bucket", SkuStrategy.TYPE),
            entry("aws_ebs_volume", SkuStrategy.TYPE),
            entry("aws_cloudfront_distribution", SkuStrategy.TYPE),
            entry("aws_api_gateway", SkuStrategy.TYPE),
            entry("aws_sns_topic", SkuStrategy.TYPE),
            entry("aws_sqs_queue", SkuStrategy.TYPE),
            entry("aws_sfn_state_machine", SkuStrategy.TYPE),
            entry("aws_glue", SkuStrategy.TYPE),
            entry("aws_athena_workgroup", SkuStrategy.TYPE),
            // GCP
            entry("gcp_container_cluster", SkuStrategy.TYPE_AND_SIZE),
            entry("gcp_load_balancer", SkuStrategy.TYPE_AND_SIZE),
            entry("gcp_redis_instance", SkuStrategy.TYPE_AND_SIZE),
            entry("gcp_filestore_instance", SkuStrategy.TYPE_AND_SIZE),
            entry("gcp_composer_environment", SkuStrategy.TYPE_AND_SIZE),
            entry("gcp_storage_bucket", SkuStrategy.TYPE_AND_SIZE),
            entry("gcp_spanner_instance", SkuStrategy.TYPE),
            entry("gcp_cloud_armor", SkuStrategy.TYPE),
            entry("gcp_cloud_run_service", SkuStrategy.TYPE),
            entry("gcp_cloudfunctions_function", SkuStrategy.TYPE),
            entry("gcp_bigquery_dataset", SkuStrategy.TYPE),
            entry("gcp_compute_disk", SkuStrategy.TYPE),
            entry("gcp_pubsub_topic", SkuStrategy.TYPE),
            entry("gcp_pubsub_subscription", SkuStrategy.TYPE),
            // Azure
            entry("azure_sql_database", SkuStrategy.TYPE_AND_SIZE),
            entry("azure_sql_managed_instance", SkuStrategy.TYPE_AND_SIZE),
            entry("azure_app_service_plan", SkuStrategy.TYPE_AND_SIZE),
            entry("azure_load_balancer", SkuStrategy.TYPE_AND_SIZE),
            entry("azure_application_gateway", SkuStrategy.TYPE_AND_SIZE),
            entry("azure_vpn_gateway", SkuStrategy.TYPE_AND_SIZE),
            entry("azure_public_ip", SkuStrategy.TYPE_AND_SIZE),
            entry("azure_redis_cache", SkuStrategy.TYPE_AND_SIZE),
            entry("azure_postgresql_server", SkuStrategy.TYPE_AND_SIZE),
            entry("azure_mysql_server", SkuStrategy.TYPE_AND_SIZE),
            entry("azure_eventhub_namespace", SkuStrategy.TYPE_AND_SIZE),
            entry("azure_container_group", SkuStrategy.TYPE_AND_SIZE),
            entry("azure_storage_account", SkuStrategy.TYPE_AND_SIZE),
            entry("azure_cosmosdb_account", SkuStrategy.TYPE),
            entry("azure_sql_server", SkuStrategy.TYPE),
            entry("azure_web_app", SkuStrategy.TYPE),
            entry("azure_function_app", SkuStrategy.TYPE),
            entry("azure_managed_disk", SkuStrategy.TYPE),
            entry("azure_data_factory", SkuStrategy.TYPE),
            entry("azure_synapse_workspace", SkuStrategy.TYPE)
    );

    public String toSku(CanonicalResource resource) {
        return switch (strategyFor(resource.getType())) {
            case SIZE -> resource.getSize();
            case TYPE -> resource.getType();
            case TYPE_AND_SIZE -> resource.getType() + ":" + resource.getSize();
        };
    }

    /**
     * Whether the resource is priced by its machine size, which makes it a
     * candidate for right-sizing.
     */
    public boolean isSizePriced(String type) {
        return strategyFor(type) == SkuStrategy.SIZE;
    }

    SkuStrategy strategyFor(String type) {
        return STRATEGIES.getOrDefault(type, SkuStrategy.SIZE);
    }
}

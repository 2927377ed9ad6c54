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
import static com.finopsguard.parser.Resources.metadata;
import static com.finopsguard.parser.Resources.resource;
import static com.finopsguard.parser.Resources.scaled;

/**
 * Extractors for AWS Terraform resources.
 *
 * Several Terraform types collapse onto one canonical type (every load
 * balancer flavour becomes {@code aws_load_balancer}); sizing attributes fall
 * back to the smallest common SKU when absent or not literal.
 */
@Component
public class AwsTerraformExtractors implements ExtractorSet {

    private static final ResourceExtractor LOAD_BALANCER = block -> resource(block, "aws_load_balancer",
            block.string("load_balancer_type", "application")).build();

    private static final ResourceExtractor OPENSEARCH = block -> resource(block, "aws_opensearch_domain",
            block.firstString("cluster_config.instance_type", "instance_type").orElse("t3.small.search"))
            .count(scaled(block, block.firstInteger("cluster_config.instance_count", "instance_count").orElse(1)))
            .build();

    private static final ResourceExtractor API_GATEWAY = block -> resource(block, "aws_api_gateway",
            block.string("protocol_type", "REST").toUpperCase(Locale.ROOT)).build();

    private static final ResourceExtractor GLUE = block -> resource(block, "aws_glue",
            block.getType().endsWith("crawler") ? "crawler" : "job").build();

    private static final Map<String, ResourceExtractor> EXTRACTORS = Map.ofEntries(
            // Compute
            extractor("aws_instance", block -> resource(block, "aws_instance",
                    block.string("instance_type", "t3.micro"))
                    .metadata(metadata("source_type", block.getType(), "ami", block.string("ami").orElse(null)))
                    .build()),
            extractor("aws_autoscaling_group", AwsTerraformExtractors::autoscalingGroup),
            extractor("aws_lambda_function", AwsTerraformExtractors::lambdaFunction),
            extractor("aws_apprunner_service", block -> resource(block, "aws_apprunner_service",
                    block.string("instance_configuration.cpu", "1024") + "-"
                            + block.string("instance_configuration.memory", "2048")).build()),

            // Containers
            extractor("aws_eks_cluster", block -> resource(block, "aws_eks_cluster", "cluster").build()),
            extractor("aws_eks_node_group", block -> resource(block, "aws_eks_node_group",
                    block.string("instance_types", "t3.medium"))
                    .count(scaled(block, block.integer("scaling_config.desired_size", 1)))
                    .build()),
            extractor("aws_ecs_cluster", block -> resource(block, "aws_ecs_cluster", "cluster").build()),
            extractor("aws_ecs_service", block -> resource(block, "aws_ecs_service",
                    block.string("launch_type", "FARGATE").toUpperCase(Locale.ROOT))
                    .count(scaled(block, block.integer("desired_count", 1)))
                    .build()),
            extractor("aws_ecs_task_definition", block -> resource(block, "aws_ecs_task_definition",
                    block.string("cpu", "256") + "cpu-" + block.string("memory", "512") + "mb").build()),

            // Databases
            extractor("aws_db_instance", block -> resource(block, "aws_db_instance",
                    block.string("instance_class", "db.t3.micro"))
                    .metadata(metadata("source_type", block.getType(),
                            "engine", block.string("engine").orElse(null),
                            "allocated_storage", block.integer("allocated_storage").orElse(null)))
                    .build()),
            extractor("aws_rds_cluster", block -> resource(block, "aws_rds_cluster",
                    block.string("db_cluster_instance_class", "db.r5.large"))
                    .metadata(metadata("source_type", block.getType(), "engine", block.string("engine").orElse(null)))
                    .build()),
            extractor("aws_dynamodb_table", AwsTerraformExtractors::dynamoDbTable),
            extractor("aws_redshift_cluster", block -> resource(block, "aws_redshift_cluster",
                    block.string("node_type", "dc2.large"))
                    .count(scaled(block, block.integer("number_of_nodes", 1)))
                    .build()),
            extractor("aws_neptune_cluster", block -> resource(block, "aws_neptune_cluster",
                    block.string("instance_class", "db.t3.medium")).build()),
            extractor("aws_docdb_cluster", block -> resource(block, "aws_docdb_cluster",
                    block.string("instance_class", "db.t3.medium")).build()),
            extractor("aws_elasticache_cluster", block -> resource(block, "aws_elasticache_cluster",
                    block.string("node_type", "cache.t3.micro"))
                    .count(scaled(block, block.integer("num_cache_nodes", 1)))
                    .build()),
            extractor("aws_elasticache_replication_group", block -> resource(block, "aws_elasticache_cluster",
                    block.string("node_type", "cache.t3.micro"))
                    .count(scaled(block, block.firstInteger("num_cache_clusters", "number_cache_clusters").orElse(2)))
                    .build()),
            extractor("aws_opensearch_domain", OPENSEARCH),
            extractor("aws_elasticsearch_domain", OPENSEARCH),

            // Storage
            extractor("aws_s3_bucket", block -> resource(block, "aws_s3_bucket",
                    block.string("storage_class", "STANDARD")).build()),
            extractor("aws_ebs_volume", block -> resource(block, "aws_ebs_volume",
                    block.string("type", "gp3") + "-" + block.integer("size", 8) + "GB").build()),

            // Networking
            extractor("aws_lb", LOAD_BALANCER),
            extractor("aws_alb", LOAD_BALANCER),
            extractor("aws_lb_listener", block -> resource(block, "aws_load_balancer", "application").build()),
            extractor("aws_nat_gateway", block -> resource(block, "aws_nat_gateway", "nat").build()),
            extractor("aws_cloudfront_distribution", block -> resource(block, "aws_cloudfront_distribution",
                    block.string("price_class", "PriceClass_All"))
                    .region("global")
                    .build()),
            extractor("aws_api_gateway_rest_api", API_GATEWAY),
            extractor("aws_apigatewayv2_api", API_GATEWAY),

            // Messaging and streaming
            extractor("aws_sns_topic", block -> resource(block, "aws_sns_topic",
                    block.bool("fifo_topic", false) ? "fifo" : "standard").build()),
            extractor("aws_sqs_queue", block -> resource(block, "aws_sqs_queue",
                    block.bool("fifo_queue", false) ? "fifo" : "standard").build()),
            extractor("aws_kinesis_stream", block -> resource(block, "aws_kinesis_stream",
                    block.string("stream_mode_details.stream_mode", "PROVISIONED").toUpperCase(Locale.ROOT))
                    .count(scaled(block, block.integer("shard_count", 1)))
                    .build()),
            extractor("aws_msk_cluster", block -> resource(block, "aws_msk_cluster",
                    block.string("broker_node_group_info.instance_type", "kafka.t3.small"))
                    .count(scaled(block, block.integer("number_of_broker_nodes", 3)))
                    .build()),
            extractor("aws_sfn_state_machine", block -> resource(block, "aws_sfn_state_machine",
                    block.string("type", "STANDARD").toUpperCase(Locale.ROOT)).build()),

            // Analytics
            extractor("aws_emr_cluster", AwsTerraformExtractors::emrCluster),
            extractor("aws_glue_job", GLUE),
            extractor("aws_glue_crawler", GLUE),
            extractor("aws_athena_workgroup", block -> resource(block, "aws_athena_workgroup", "workgroup").build())
    );

    @Override
    public IacFormat getFormat() {
        return IacFormat.TERRAFORM;
    }

    @Override
    public CloudProvider getProvider() {
        return CloudProvider.AWS;
    }

    @Override
    public Map<String, ResourceExtractor> getExtractors() {
        return EXTRACTORS;
    }

    private static CanonicalResource autoscalingGroup(ResourceBlock block) {
        int capacity = block.firstInteger("desired_capacity", "min_size").orElse(1);
        return resource(block, "aws_autoscaling_group", block.string("instance_type", "t3.micro"))
                .count(scaled(block, Math.max(capacity, 1)))
                .metadata(metadata("source_type", block.getType(),
                        "min_size", block.integer("min_size").orElse(null),
                        "max_size", block.integer("max_size").orElse(null)))
                .build();
    }

    private static CanonicalResource lambdaFunction(ResourceBlock block) {
        int memory = block.integer("memory_size", 128);
        String runtime = block.string("runtime", "python3.9");
        return resource(block, "aws_lambda_function", memory + "MB-" + runtime)
                .metadata(metadata("source_type", block.getType(), "memory_mb", memory, "runtime", runtime))
                .build();
    }

    private static CanonicalResource dynamoDbTable(ResourceBlock block) {
        String billingMode = block.string("billing_mode", "PAY_PER_REQUEST").toUpperCase(Locale.ROOT);
        return resource(block, "aws_dynamodb_table", billingMode)
                .metadata(metadata("source_type", block.getType(),
                        "read_capacity", block.integer("read_capacity").orElse(null),
                        "write_capacity", block.integer("write_capacity").orElse(null)))
                .build();
    }

    private static CanonicalResource emrCluster(ResourceBlock block) {
        String masterType = block.firstString("master_instance_group.instance_type", "master_instance_type")
                .orElse("m5.xlarge");
        int coreCount = block.firstInteger("core_instance_group.instance_count", "core_instance_count").orElse(0);
        return resource(block, "aws_emr_cluster", masterType)
                .count(scaled(block, 1 + coreCount))
                .metadata(metadata("source_type", block.getType(),
                        "release_label", block.string("release_label").orElse(null),
                        "core_instance_count", coreCount))
                .build();
    }
}

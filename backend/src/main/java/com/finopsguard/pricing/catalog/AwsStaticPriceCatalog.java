package com.finopsguard.pricing.catalog;

import com.finopsguard.domain.model.CloudProvider;
import org.springframework.stereotype.Component;

import java.util.Map;

import static java.util.Map.entry;

/**
 * AWS on-demand list prices, us-east-1, Linux.
 */
@Component
public class AwsStaticPriceCatalog implements StaticPriceCatalog {

    private static final Map<String, Double> PRICES = Map.ofEntries(
            // EC2
            entry("t2.micro", 0.0116),
            entry("t2.small", 0.023),
            entry("t2.medium", 0.0464),
            entry("t3.nano", 0.0052),
            entry("t3.micro", 0.0104),
            entry("t3.small", 0.0208),
            entry("t3.medium", 0.0416),
            entry("t3.large", 0.0832),
            entry("t3.xlarge", 0.1664),
            entry("t3.2xlarge", 0.3328),
            entry("t3a.micro", 0.0094),
            entry("t3a.small", 0.0188),
            entry("t3a.medium", 0.0376),
            entry("t3a.large", 0.0752),
            entry("m5.large", 0.096),
            entry("m5.xlarge", 0.192),
            entry("m5.2xlarge", 0.384),
            entry("m5.4xlarge", 0.768),
            entry("m6i.large", 0.096),
            entry("m6i.xlarge", 0.192),
            entry("c5.large", 0.085),
            entry("c5.xlarge", 0.17),
            entry("c5.2xlarge", 0.34),
            entry("c6g.large", 0.068),
            entry("c7g.large", 0.072),
            entry("r5.large", 0.126),
            entry("r5.xlarge", 0.252),
            entry("g4dn.xlarge", 0.526),
            entry("p3.2xlarge", 3.06),
            // RDS, Neptune and DocumentDB instance classes
            entry("db.t3.micro", 0.017),
            entry("db.t3.small", 0.034),
            entry("db.t3.medium", 0.068),
            entry("db.t3.large", 0.136),
            entry("db.m5.large", 0.171),
            entry("db.m5.xlarge", 0.342),
            entry("db.r5.large", 0.25),
            entry("db.r5.xlarge", 0.50),
            // ElastiCache
            entry("cache.t3.micro", 0.017),
            entry("cache.t3.small", 0.034),
            entry("cache.t3.medium", 0.068),
            entry("cache.m5.large", 0.156),
            entry("cache.r5.large", 0.216),
            // Redshift
            entry("dc2.large", 0.25),
            entry("dc2.8xlarge", 4.80),
            entry("ra3.xlplus", 1.086),
            entry("ra3.4xlarge", 3.26),
            // OpenSearch
            entry("t3.small.search", 0.036),
            entry("t3.medium.search", 0.073),
            entry("m5.large.search", 0.142),
            entry("r5.large.search", 0.186),
            // MSK
            entry("kafka.t3.small", 0.0456),
            entry("kafka.m5.large", 0.21),
            // Tiered services
            entry("aws_load_balancer:application", 0.0225),
            entry("aws_load_balancer:network", 0.0225),
            entry("aws_load_balancer:gateway", 0.0125),
            entry("aws_ecs_service:FARGATE", 0.0123),
            entry("aws_ecs_service:EC2", 0.0),
            entry("aws_kinesis_stream:PROVISIONED", 0.015),
            entry("aws_kinesis_stream:ON_DEMAND", 0.04),
            entry("aws_dynamodb_table:PROVISIONED", 0.0039),
            entry("aws_dynamodb_table:PAY_PER_REQUEST", 0.0),
            entry("aws_neptune_cluster:db.t3.medium", 0.098),
            entry("aws_neptune_cluster:db.r5.large", 0.348),
            entry("aws_docdb_cluster:db.t3.medium", 0.078),
            entry("aws_docdb_cluster:db.r5.large", 0.277),
            entry("aws_apprunner_service:1024-2048", 0.078),
            entry("aws_apprunner_service:2048-4096", 0.156),
            // Flat and usage-based services
            entry("aws_eks_cluster", 0.10),
            entry("aws_nat_gateway", 0.045),
            entry("aws_ecs_cluster", 0.0),
            entry("aws_ecs_task_definition", 0.0),
            entry("aws_lambda_function", 0.0),
            entry("aws_s3_bucket", 0.0),
            entry("aws_ebs_volume", 0.0),
            entry("aws_cloudfront_distribution", 0.0),
            entry("aws_api_gateway", 0.0),
            entry("aws_lb_listener", 0.0),
            entry("aws_sns_topic", 0.0),
            entry("aws_sqs_queue", 0.0),
            entry("aws_sfn_state_machine", 0.0),
            entry("aws_glue", 0.0),
            entry("aws_athena_workgroup", 0.0)
    );

    private static final Map<String, Double> REGION_OVERRIDES = Map.ofEntries(
            entry("eu-west-1/t3.micro", 0.0114),
            entry("eu-west-1/t3.medium", 0.0456),
            entry("eu-west-1/m5.large", 0.107),
            entry("eu-central-1/t3.micro", 0.012),
            entry("eu-central-1/t3.medium", 0.048),
            entry("eu-central-1/m5.large", 0.115),
            entry("ap-southeast-1/t3.micro", 0.0132),
            entry("ap-southeast-1/t3.medium", 0.0528),
            entry("ap-southeast-1/m5.large", 0.12)
    );

    @Override
    public CloudProvider getProvider() {
        return CloudProvider.AWS;
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

package com.finopsguard.parser.extractor;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.IacFormat;
import com.finopsguard.parser.ExtractorSet;
import com.finopsguard.parser.ResourceExtractor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

import static com.finopsguard.parser.Resources.extractor;
import static com.finopsguard.parser.Resources.metadata;
import static com.finopsguard.parser.Resources.resource;

/**
 * Extractors for modules of the {@code amazon.aws} and {@code community.aws} collections.
 *
 * Canonical types match the Terraform extractors so that pricing and
 * policies treat both formats alike.
 */
@Component
public class AwsAnsibleExtractors implements ExtractorSet {

    private static final ResourceExtractor EC2_INSTANCE = block -> resource(block, "aws_instance",
            block.string("instance_type", "t3.micro"))
            .count(block.firstInteger("exact_count", "count").orElse(1))
            .metadata(metadata("source_type", block.getType(), "image_id", block.string("image_id").orElse(null)))
            .build();

    private static final ResourceExtractor LAMBDA = block -> resource(block, "aws_lambda_function",
            block.integer("memory_size", 128) + "MB-" + block.string("runtime", "python3.9")).build();

    private static final Map<String, ResourceExtractor> EXTRACTORS = Map.ofEntries(
            extractor("ec2_instance", EC2_INSTANCE),
            extractor("ec2", EC2_INSTANCE),
            extractor("ec2_asg", block -> resource(block, "aws_autoscaling_group",
                    block.string("instance_type", "t3.micro"))
                    .count(block.firstInteger("desired_capacity", "min_size").orElse(1))
                    .build()),
            extractor("eks_cluster", block -> resource(block, "aws_eks_cluster", "cluster").build()),
            extractor("lambda", LAMBDA),
            extractor("lambda_function", LAMBDA),
            extractor("ecs_cluster", block -> resource(block, "aws_ecs_cluster", "cluster").build()),
            extractor("ecs_service", block -> resource(block, "aws_ecs_service",
                    block.string("launch_type", "FARGATE").toUpperCase(Locale.ROOT))
                    .count(block.integer("desired_count", 1))
                    .build()),
            extractor("rds_instance", block -> resource(block, "aws_db_instance",
                    block.firstString("db_instance_class", "instance_type").orElse("db.t3.micro"))
                    .metadata(metadata("source_type", block.getType(), "engine", block.string("engine").orElse(null)))
                    .build()),
            extractor("dynamodb_table", block -> resource(block, "aws_dynamodb_table",
                    block.string("billing_mode", "PAY_PER_REQUEST").toUpperCase(Locale.ROOT))
                    .count(1)
                    .metadata(metadata("source_type", block.getType(),
                            "read_capacity", block.integer("read_capacity").orElse(null),
                            "write_capacity", block.integer("write_capacity").orElse(null)))
                    .build()),
            extractor("s3_bucket", block -> resource(block, "aws_s3_bucket", "STANDARD").build()),
            extractor("elb_application_lb", block -> resource(block, "aws_load_balancer", "application").build()),
            extractor("elb_network_lb", block -> resource(block, "aws_load_balancer", "network").build()),
            extractor("sns_topic", block -> resource(block, "aws_sns_topic",
                    "FIFO".equalsIgnoreCase(block.string("topic_type", "standard")) ? "fifo" : "standard").build()),
            extractor("sqs_queue", block -> resource(block, "aws_sqs_queue",
                    "fifo".equalsIgnoreCase(block.string("queue_type", "standard")) ? "fifo" : "standard").build()),
            extractor("elasticache", block -> resource(block, "aws_elasticache_cluster",
                    block.string("node_type", "cache.t3.micro"))
                    .count(block.integer("num_nodes", 1))
                    .build()),
            extractor("kinesis_stream", block -> resource(block, "aws_kinesis_stream", "PROVISIONED")
                    .count(block.integer("shards", 1))
                    .build()),
            extractor("cloudfront_distribution", block -> resource(block, "aws_cloudfront_distribution",
                    block.string("price_class", "PriceClass_All"))
                    .region("global")
                    .build())
    );

    @Override
    public IacFormat getFormat() {
        return IacFormat.ANSIBLE;
    }

    @Override
    public CloudProvider getProvider() {
        return CloudProvider.AWS;
    }

    @Override
    public Map<String, ResourceExtractor> getExtractors() {
        return EXTRACTORS;
    }
}

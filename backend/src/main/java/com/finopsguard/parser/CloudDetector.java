package com.finopsguard.parser;

import com.finopsguard.domain.model.CloudProvider;

import java.util.List;
import java.util.Optional;

/**
 * Determines the cloud of a resource from its Terraform type or Ansible module name.
 */
public final class CloudDetector {

    private static final List<String> AWS_ANSIBLE_PREFIXES = List.of(
            "ec2_", "aws_", "rds_", "s3_", "lambda", "elb_", "ecs_", "eks_", "sns_", "sqs_",
            "dynamodb_", "elasticache", "kinesis_", "cloudfront_", "route53", "cloudformation",
            "iam_", "efs", "redshift", "stepfunctions_", "api_gateway"
    );

    private CloudDetector() {
    }

    public static Optional<CloudProvider> fromTerraformType(String type) {
        if (type == null) {
            return Optional.empty();
        }
        if (type.startsWith("aws_")) {
            return Optional.of(CloudProvider.AWS);
        }
        if (type.startsWith("google_")) {
            return Optional.of(CloudProvider.GCP);
        }
        if (type.startsWith("azurerm_")) {
            return Optional.of(CloudProvider.AZURE);
        }
        return Optional.empty();
    }

    /**
     * Detects the cloud of an Ansible module. Collection-qualified names such as
     * {@code amazon.aws.ec2_instance} must be reduced to the module name first.
     */
    public static Optional<CloudProvider> fromAnsibleModule(String module) {
        if (module == null) {
            return Optional.empty();
        }
        if (module.startsWith("gcp_") || module.startsWith("gce")) {
            return Optional.of(CloudProvider.GCP);
        }
        if (module.startsWith("azure_") || module.startsWith("azurerm_")) {
            return Optional.of(CloudProvider.AZURE);
        }
        for (String prefix : AWS_ANSIBLE_PREFIXES) {
            if (module.startsWith(prefix)) {
                return Optional.of(CloudProvider.AWS);
            }
        }
        return Optional.empty();
    }
}

package com.finopsguard.parser.terraform;

import com.finopsguard.domain.model.CanonicalResource;
import com.finopsguard.domain.model.CanonicalResourceModel;
import com.finopsguard.parser.ParseException;
import com.finopsguard.parser.ParserFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class TerraformParserTest {

    private TerraformParser parser;

    @BeforeEach
    void setUp() {
        parser = new TerraformParser(ParserFixtures.registry());
    }

    @Nested
    @DisplayName("Resource Extraction Tests")
    class ResourceExtractionTests {

        @Test
        @DisplayName("Should extract a counted EC2 instance on a single line")
        void shouldExtractCountedInstance() {
            // Given
            String hcl = "resource \"aws_instance\" \"web\" { instance_type = \"t3.medium\" count = 3 }";

            // When
            CanonicalResourceModel model = parser.parse(hcl);

            // Then
            assertThat(model.size()).isEqualTo(1);
            CanonicalResource resource = model.getResources().get(0);
            assertThat(resource.getType()).isEqualTo("aws_instance");
            assertThat(resource.getName()).isEqualTo("web");
            assertThat(resource.getSize()).isEqualTo("t3.medium");
            assertThat(resource.getCount()).isEqualTo(3);
            assertThat(resource.getRegion()).isEqualTo("us-east-1");
            assertThat(resource.getId()).isEqualTo("aws_instance.web-t3.medium-us-east-1");
        }

        @Test
        @DisplayName("Should skip unknown resource types without failing")
        void shouldSkipUnknownTypes() {
            // Given
            String hcl = """
                    resource "aws_made_up_service" "x" {
                      size = "huge"
                    }
                    resource "aws_instance" "app" {
                      instance_type = "t3.small"
                    }
                    """;

            // When
            CanonicalResourceModel model = parser.parse(hcl);

            // Then
            assertThat(model.getResources())
                    .extracting(CanonicalResource::getType)
                    .containsExactly("aws_instance");
        }

        @Test
        @DisplayName("Should count non-literal count expressions as one")
        void shouldDefaultNonLiteralCount() {
            // Given
            String hcl = """
                    resource "aws_instance" "web" {
                      instance_type = "t3.medium"
                      count         = var.enabled ? 2 : 0
                    }
                    """;

            // When
            CanonicalResourceModel model = parser.parse(hcl);

            // Then
            assertThat(model.getResources().get(0).getCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should fall back to default size when the size is an interpolation")
        void shouldIgnoreInterpolatedSize() {
            // Given
            String hcl = """
                    resource "aws_instance" "web" {
                      instance_type = "${var.size}"
                    }
                    """;

            // When
            CanonicalResourceModel model = parser.parse(hcl);

            // Then
            assertThat(model.getResources().get(0).getSize()).isEqualTo("t3.micro");
        }

        @Test
        @DisplayName("Should read nested blocks and tags")
        void shouldReadNestedBlocksAndTags() {
            // Given
            String hcl = """
                    resource "google_sql_database_instance" "main" {
                      region = "europe-west1"
                      settings {
                        tier = "db-custom-2-7680"
                      }
                    }
                    resource "aws_instance" "tagged" {
                      instance_type = "m5.large"
                      tags = {
                        Team = "payments"
                        Env  = "prod"
                      }
                    }
                    """;

            // When
            CanonicalResourceModel model = parser.parse(hcl);

            // Then
            CanonicalResource sql = model.getResources().get(0);
            assertThat(sql.getType()).isEqualTo("gcp_sql_database_instance");
            assertThat(sql.getSize()).isEqualTo("db-custom-2-7680");
            assertThat(sql.getRegion()).isEqualTo("europe-west1");
            assertThat(model.getResources().get(1).getTags())
                    .containsEntry("Team", "payments")
                    .containsEntry("Env", "prod");
        }

        @Test
        @DisplayName("Should keep parse order across clouds")
        void shouldKeepParseOrder() {
            // Given
            String hcl = """
                    resource "azurerm_linux_virtual_machine" "vm" {
                      size     = "Standard_B2s"
                      location = "West Europe"
                    }
                    resource "google_compute_instance" "gce" {
                      machine_type = "zones/us-central1-a/machineTypes/n1-standard-2"
                      zone         = "us-central1-a"
                    }
                    resource "aws_s3_bucket" "logs" {
                      bucket = "logs"
                    }
                    """;

            // When
            CanonicalResourceModel model = parser.parse(hcl);

            // Then
            assertThat(model.getResources())
                    .extracting(CanonicalResource::getType)
                    .containsExactly("azure_virtual_machine", "gcp_compute_instance", "aws_s3_bucket");
            assertThat(model.getResources().get(0).getRegion()).isEqualTo("westeurope");
            assertThat(model.getResources().get(1).getSize()).isEqualTo("n1-standard-2");
            assertThat(model.getResources().get(1).getRegion()).isEqualTo("us-central1");
        }

        @Test
        @DisplayName("Should multiply type-specific counts by the count meta-argument")
        void shouldMultiplyCountMetaArgument() {
            // Given
            String hcl = """
                    resource "aws_redshift_cluster" "warehouse" {
                      node_type       = "dc2.large"
                      number_of_nodes = 2
                      count           = 3
                    }
                    resource "aws_dynamodb_table" "sessions" {
                      billing_mode = "PROVISIONED"
                      count        = 3
                    }
                    resource "aws_autoscaling_group" "workers" {
                      instance_type    = "t3.small"
                      desired_capacity = 2
                      count            = 3
                    }
                    resource "aws_elasticache_cluster" "cache" {
                      node_type       = "cache.t3.micro"
                      num_cache_nodes = 2
                      count           = 3
                    }
                    """;

            // When
            CanonicalResourceModel model = parser.parse(hcl);

            // Then
            assertThat(model.getResources())
                    .extracting(CanonicalResource::getType, CanonicalResource::getCount)
                    .containsExactly(
                            tuple("aws_redshift_cluster", 6),
                            tuple("aws_dynamodb_table", 3),
                            tuple("aws_autoscaling_group", 6),
                            tuple("aws_elasticache_cluster", 6));
        }

        @Test
        @DisplayName("Should give distinct ids to resources of different types sharing a name")
        void shouldIncludeTypeInId() {
            // Given
            String hcl = """
                    resource "aws_eks_cluster" "main" { name = "main" }
                    resource "aws_ecs_cluster" "main" { name = "main" }
                    """;

            // When
            CanonicalResourceModel model = parser.parse(hcl);

            // Then
            assertThat(model.getResources())
                    .extracting(CanonicalResource::getId)
                    .containsExactly("aws_eks_cluster.main-cluster-us-east-1", "aws_ecs_cluster.main-cluster-us-east-1");
        }
    }

    @Nested
    @DisplayName("Provider Default Tests")
    class ProviderDefaultTests {

        @Test
        @DisplayName("Should use provider region when a resource has none")
        void shouldUseProviderRegion() {
            // Given
            String hcl = """
                    provider "aws" {
                      region = "eu-west-1"
                    }
                    provider "aws" {
                      alias  = "us"
                      region = "us-west-2"
                    }
                    resource "aws_instance" "web" {
                      instance_type = "t3.medium"
                    }
                    """;

            // When
            CanonicalResourceModel model = parser.parse(hcl);

            // Then
            assertThat(model.getResources().get(0).getRegion()).isEqualTo("eu-west-1");
        }

        @Test
        @DisplayName("Should derive a GCP region from the provider zone")
        void shouldDeriveRegionFromZone() {
            // Given
            String hcl = """
                    provider "google" {
                      zone = "europe-west4-b"
                    }
                    resource "google_compute_instance" "vm" {
                      machine_type = "e2-medium"
                    }
                    """;

            // When
            CanonicalResourceModel model = parser.parse(hcl);

            // Then
            assertThat(model.getResources().get(0).getRegion()).isEqualTo("europe-west4");
        }
    }

    @Nested
    @DisplayName("Malformed Input Tests")
    class MalformedInputTests {

        @Test
        @DisplayName("Should fail on an unclosed resource block naming the resource")
        void shouldFailOnUnbalancedBraces() {
            // Given
            String hcl = """
                    resource "aws_instance" "broken" {
                      instance_type = "t3.medium"
                    """;

            // When / Then
            assertThatThrownBy(() -> parser.parse(hcl))
                    .isInstanceOf(ParseException.class)
                    .satisfies(e -> assertThat(((ParseException) e).getResourceName())
                            .isEqualTo("aws_instance.broken"));
        }

        @Test
        @DisplayName("Should name the preceding resource on a stray closing brace")
        void shouldNamePrecedingResourceOnStrayBrace() {
            // Given
            String hcl = """
                    resource "aws_instance" "web" {
                      instance_type = "t3.medium"
                    }
                    }
                    """;

            // When / Then
            assertThatThrownBy(() -> parser.parse(hcl))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Unexpected '}'")
                    .satisfies(e -> assertThat(((ParseException) e).getResourceName())
                            .isEqualTo("aws_instance.web"));
        }

        @Test
        @DisplayName("Should return an empty model for text without resources")
        void shouldReturnEmptyModel() {
            // When
            CanonicalResourceModel model = parser.parse("variable \"region\" {\n  default = \"us-east-1\"\n}\n");

            // Then
            assertThat(model.isEmpty()).isTrue();
        }
    }
}

package com.finopsguard.parser.extractor;

import com.finopsguard.domain.model.CanonicalResource;
import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.IacFormat;
import com.finopsguard.parser.ExtractorSet;
import com.finopsguard.parser.ResourceBlock;
import com.finopsguard.parser.ResourceExtractor;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.finopsguard.parser.Resources.extractor;
import static com.finopsguard.parser.Resources.metadata;
import static com.finopsguard.parser.Resources.resource;
import static com.finopsguard.parser.Resources.scaled;

/**
 * Extractors for Azure Terraform resources ({@code azurerm_*} to {@code azure_*}).
 *
 * The azurerm provider has no default region, so every resource reads its own
 * {@code location} and otherwise lands in eastus. Display names such as
 * "East US" are normalized to eastus.
 */
@Component
public class AzureTerraformExtractors implements ExtractorSet {

    private static final ResourceExtractor VIRTUAL_MACHINE = block -> resource(block, "azure_virtual_machine",
            block.firstString("size", "vm_size").orElse("Standard_B1s"))
            .metadata(metadata("source_type", block.getType(),
                    "os", block.getType().contains("windows") ? "windows" : "linux"))
            .build();

    private static final ResourceExtractor SCALE_SET = block -> resource(block, "azure_vm_scale_set",
            block.firstString("sku", "sku.name").orElse("Standard_B1s"))
            .count(scaled(block, block.firstInteger("instances", "sku.capacity").orElse(1)))
            .build();

    private static final ResourceExtractor SQL_SERVER = block -> resource(block, "azure_sql_server",
            "v" + block.string("version", "12.0")).build();

    private static final ResourceExtractor SQL_DATABASE = block -> resource(block, "azure_sql_database",
            block.firstString("sku_name", "requested_service_objective_name").orElse("S0")).build();

    private static final ResourceExtractor WEB_APP = block -> resource(block, "azure_web_app", "app").build();

    private static final ResourceExtractor FUNCTION_APP = block -> resource(block, "azure_function_app", "consumption")
            .build();

    private static final Map<String, ResourceExtractor> EXTRACTORS = Map.ofEntries(
            // Compute
            extractor("azurerm_linux_virtual_machine", VIRTUAL_MACHINE),
            extractor("azurerm_windows_virtual_machine", VIRTUAL_MACHINE),
            extractor("azurerm_virtual_machine", VIRTUAL_MACHINE),
            extractor("azurerm_linux_virtual_machine_scale_set", SCALE_SET),
            extractor("azurerm_windows_virtual_machine_scale_set", SCALE_SET),
            extractor("azurerm_virtual_machine_scale_set", SCALE_SET),
            extractor("azurerm_kubernetes_cluster", AzureTerraformExtractors::kubernetesCluster),
            extractor("azurerm_container_group", AzureTerraformExtractors::containerGroup),

            // App Service
            extractor("azurerm_service_plan", AzureTerraformExtractors::appServicePlan),
            extractor("azurerm_app_service_plan", AzureTerraformExtractors::appServicePlan),
            extractor("azurerm_linux_web_app", WEB_APP),
            extractor("azurerm_windows_web_app", WEB_APP),
            extractor("azurerm_app_service", WEB_APP),
            extractor("azurerm_linux_function_app", FUNCTION_APP),
            extractor("azurerm_windows_function_app", FUNCTION_APP),
            extractor("azurerm_function_app", FUNCTION_APP),

            // Databases
            extractor("azurerm_mssql_server", SQL_SERVER),
            extractor("azurerm_sql_server", SQL_SERVER),
            extractor("azurerm_mssql_database", SQL_DATABASE),
            extractor("azurerm_sql_database", SQL_DATABASE),
            extractor("azurerm_mssql_managed_instance", block -> resource(block, "azure_sql_managed_instance",
                    block.string("sku_name", "GP_Gen5"))
                    .metadata(metadata("source_type", block.getType(), "vcores", block.integer("vcores").orElse(null)))
                    .build()),
            extractor("azurerm_postgresql_flexible_server", block -> resource(block, "azure_postgresql_server",
                    block.string("sku_name", "B_Standard_B1ms")).build()),
            extractor("azurerm_postgresql_server", block -> resource(block, "azure_postgresql_server",
                    block.string("sku_name", "B_Gen5_1")).build()),
            extractor("azurerm_mysql_flexible_server", block -> resource(block, "azure_mysql_server",
                    block.string("sku_name", "B_Standard_B1ms")).build()),
            extractor("azurerm_cosmosdb_account", block -> resource(block, "azure_cosmosdb_account",
                    block.string("consistency_policy.consistency_level", "Session")).build()),
            extractor("azurerm_redis_cache", block -> resource(block, "azure_redis_cache",
                    block.string("sku_name", "Standard") + "_" + block.string("family", "C")
                            + block.integer("capacity", 1)).build()),

            // Storage
            extractor("azurerm_storage_account", block -> resource(block, "azure_storage_account",
                    block.string("account_tier", "Standard") + "_" + block.string("account_replication_type", "LRS"))
                    .build()),
            extractor("azurerm_managed_disk", block -> resource(block, "azure_managed_disk",
                    block.string("storage_account_type", "Standard_LRS") + "-" + block.integer("disk_size_gb", 32) + "GB")
                    .build()),

            // Networking
            extractor("azurerm_lb", block -> resource(block, "azure_load_balancer",
                    block.string("sku", "Basic")).build()),
            extractor("azurerm_application_gateway", block -> resource(block, "azure_application_gateway",
                    block.string("sku.name", "Standard_v2"))
                    .count(scaled(block, block.integer("sku.capacity", 1)))
                    .build()),
            extractor("azurerm_virtual_network_gateway", block -> resource(block, "azure_vpn_gateway",
                    block.string("sku", "VpnGw1")).build()),
            extractor("azurerm_public_ip", block -> resource(block, "azure_public_ip",
                    block.string("sku", "Basic")).build()),

            // Analytics and messaging
            extractor("azurerm_data_factory", block -> resource(block, "azure_data_factory", "pipeline").build()),
            extractor("azurerm_synapse_workspace", block -> resource(block, "azure_synapse_workspace", "workspace")
                    .build()),
            extractor("azurerm_eventhub_namespace", block -> resource(block, "azure_eventhub_namespace",
                    block.string("sku", "Standard"))
                    .count(scaled(block, block.integer("capacity", 1)))
                    .build())
    );

    @Override
    public IacFormat getFormat() {
        return IacFormat.TERRAFORM;
    }

    @Override
    public CloudProvider getProvider() {
        return CloudProvider.AZURE;
    }

    @Override
    public Map<String, ResourceExtractor> getExtractors() {
        return EXTRACTORS;
    }

    private static CanonicalResource kubernetesCluster(ResourceBlock block) {
        int nodeCount = block.firstInteger("default_node_pool.node_count", "default_node_pool.min_count").orElse(3);
        return resource(block, "azure_kubernetes_cluster", block.string("default_node_pool.vm_size", "Standard_DS2_v2"))
                .count(scaled(block, nodeCount))
                .metadata(metadata("source_type", block.getType(),
                        "node_pool", block.string("default_node_pool.name").orElse(null),
                        "sku_tier", block.string("sku_tier", "Free")))
                .build();
    }

    private static CanonicalResource containerGroup(ResourceBlock block) {
        String cpu = block.string("container.cpu", "1");
        String memory = block.string("container.memory", "1.5");
        return resource(block, "azure_container_group", cpu + "cpu-" + memory + "gb")
                .metadata(metadata("source_type", block.getType(), "os_type", block.string("os_type").orElse(null)))
                .build();
    }

    private static CanonicalResource appServicePlan(ResourceBlock block) {
        String sku = block.firstString("sku_name", "sku.size").orElse("B1");
        return resource(block, "azure_app_service_plan", sku)
                .count(scaled(block, block.firstInteger("worker_count", "sku.capacity").orElse(1)))
                .metadata(metadata("source_type", block.getType(),
                        "os_type", block.firstString("os_type", "kind").orElse(null)))
                .build();
    }
}

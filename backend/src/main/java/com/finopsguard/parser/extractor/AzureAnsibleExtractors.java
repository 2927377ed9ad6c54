package com.finopsguard.parser.extractor;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.IacFormat;
import com.finopsguard.parser.ExtractorSet;
import com.finopsguard.parser.ResourceExtractor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

import static com.finopsguard.parser.Resources.extractor;
import static com.finopsguard.parser.Resources.resource;

/**
 * Extractors for modules of the {@code azure.azcollection} collection ({@code azure_rm_*}).
 */
@Component
public class AzureAnsibleExtractors implements ExtractorSet {

    private static final Map<String, ResourceExtractor> EXTRACTORS = Map.ofEntries(
            extractor("azure_rm_virtualmachine", block -> resource(block, "azure_virtual_machine",
                    block.string("vm_size", "Standard_B1s")).build()),
            extractor("azure_rm_virtualmachinescaleset", block -> resource(block, "azure_vm_scale_set",
                    block.string("vm_size", "Standard_B1s"))
                    .count(block.integer("capacity", 1))
                    .build()),
            extractor("azure_rm_aks", block -> resource(block, "azure_kubernetes_cluster",
                    block.string("agent_pool_profiles.vm_size", "Standard_DS2_v2"))
                    .count(block.integer("agent_pool_profiles.count", 3))
                    .build()),
            extractor("azure_rm_containerinstance", block -> resource(block, "azure_container_group",
                    block.string("containers.cpu", "1") + "cpu-" + block.string("containers.memory", "1.5") + "gb")
                    .build()),
            extractor("azure_rm_appserviceplan", block -> resource(block, "azure_app_service_plan",
                    block.string("sku", "B1"))
                    .count(block.integer("number_of_workers", 1))
                    .build()),
            extractor("azure_rm_webapp", block -> resource(block, "azure_web_app", "app").build()),
            extractor("azure_rm_functionapp", block -> resource(block, "azure_function_app", "consumption").build()),
            extractor("azure_rm_sqlserver", block -> resource(block, "azure_sql_server",
                    "v" + block.string("version", "12.0")).build()),
            extractor("azure_rm_sqldatabase", block -> resource(block, "azure_sql_database",
                    block.firstString("sku.name", "edition").orElse("S0")).build()),
            extractor("azure_rm_storageaccount", block -> resource(block, "azure_storage_account",
                    block.string("account_type", "Standard_LRS")).build()),
            extractor("azure_rm_loadbalancer", block -> resource(block, "azure_load_balancer",
                    block.string("sku", "Basic")).build()),
            extractor("azure_rm_rediscache", block -> resource(block, "azure_redis_cache",
                    capitalize(block.string("sku.name", "standard")) + "_" + block.string("sku.size", "C1"))
                    .build()),
            extractor("azure_rm_cosmosdbaccount", block -> resource(block, "azure_cosmosdb_account",
                    block.string("consistency_policy.default_consistency_level", "Session")).build()),
            extractor("azure_rm_eventhub", block -> resource(block, "azure_eventhub_namespace",
                    block.string("sku", "Standard")).build())
    );

    @Override
    public IacFormat getFormat() {
        return IacFormat.ANSIBLE;
    }

    @Override
    public CloudProvider getProvider() {
        return CloudProvider.AZURE;
    }

    @Override
    public Map<String, ResourceExtractor> getExtractors() {
        return EXTRACTORS;
    }

    private static String capitalize(String value) {
        if (value.isEmpty()) {
            return value;
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1).toLowerCase(Locale.ROOT);
    }
}

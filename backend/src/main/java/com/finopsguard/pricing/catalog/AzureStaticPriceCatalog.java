package com.finopsguard.pricing.catalog;

import com.finopsguard.domain.model.CloudProvider;
import org.springframework.stereotype.Component;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Azure pay-as-you-go list prices, East US, Linux.
 */
@Component
public class AzureStaticPriceCatalog implements StaticPriceCatalog {

    private static final Map<String, Double> PRICES = Map.ofEntries(
            // Virtual machine sizes
            entry("Standard_B1s", 0.0104),
            entry("Standard_B1ms", 0.0207),
            entry("Standard_B2s", 0.0416),
            entry("Standard_B2ms", 0.0832),
            entry("Standard_B4ms", 0.166),
            entry("Standard_B8ms", 0.333),
            entry("Standard_D2s_v3", 0.096),
            entry("Standard_D4s_v3", 0.192),
            entry("Standard_D8s_v3", 0.384),
            entry("Standard_D16s_v3", 0.768),
            entry("Standard_D32s_v3", 1.536),
            entry("Standard_DS2_v2", 0.146),
            entry("Standard_DS3_v2", 0.293),
            entry("Standard_E2s_v3", 0.126),
            entry("Standard_E4s_v3", 0.252),
            entry("Standard_E8s_v3", 0.504),
            entry("Standard_F2s_v2", 0.085),
            entry("Standard_F4s_v2", 0.169),
            entry("Standard_F8s_v2", 0.338),
            entry("Standard_NC6s_v3", 3.06),
            // SQL Database
            entry("azure_sql_database:Basic", 0.0068),
            entry("azure_sql_database:S0", 0.0203),
            entry("azure_sql_database:S1", 0.0406),
            entry("azure_sql_database:S2", 0.102),
            entry("azure_sql_database:S3", 0.203),
            entry("azure_sql_database:P1", 0.625),
            entry("azure_sql_database:P2", 1.25),
            entry("azure_sql_database:P4", 2.50),
            entry("azure_sql_managed_instance:GP_Gen5", 1.008),
            entry("azure_sql_managed_instance:BC_Gen5", 2.72),
            // App Service plans
            entry("azure_app_service_plan:F1", 0.0),
            entry("azure_app_service_plan:Y1", 0.0),
            entry("azure_app_service_plan:B1", 0.075),
            entry("azure_app_service_plan:B2", 0.15),
            entry("azure_app_service_plan:B3", 0.30),
            entry("azure_app_service_plan:S1", 0.10),
            entry("azure_app_service_plan:S2", 0.20),
            entry("azure_app_service_plan:S3", 0.40),
            entry("azure_app_service_plan:P1v2", 0.20),
            entry("azure_app_service_plan:P2v2", 0.40),
            entry("azure_app_service_plan:P3v2", 0.80),
            entry("azure_app_service_plan:EP1", 0.173),
            entry("azure_app_service_plan:EP2", 0.346),
            // Networking
            entry("azure_load_balancer:Basic", 0.0),
            entry("azure_load_balancer:Standard", 0.025),
            entry("azure_application_gateway:Standard_Small", 0.025),
            entry("azure_application_gateway:Standard_Medium", 0.07),
            entry("azure_application_gateway:Standard_v2", 0.246),
            entry("azure_application_gateway:WAF_v2", 0.443),
            entry("azure_vpn_gateway:Basic", 0.04),
            entry("azure_vpn_gateway:VpnGw1", 0.19),
            entry("azure_vpn_gateway:VpnGw2", 0.49),
            entry("azure_vpn_gateway:VpnGw3", 1.25),
            entry("azure_public_ip:Basic", 0.004),
            entry("azure_public_ip:Standard", 0.005),
            // Cache and databases
            entry("azure_redis_cache:Basic_C0", 0.022),
            entry("azure_redis_cache:Basic_C1", 0.055),
            entry("azure_redis_cache:Standard_C0", 0.055),
            entry("azure_redis_cache:Standard_C1", 0.139),
            entry("azure_redis_cache:Standard_C2", 0.225),
            entry("azure_redis_cache:Premium_P1", 0.554),
            entry("azure_postgresql_server:B_Standard_B1ms", 0.017),
            entry("azure_postgresql_server:B_Standard_B2s", 0.068),
            entry("azure_postgresql_server:GP_Standard_D2s_v3", 0.178),
            entry("azure_postgresql_server:B_Gen5_1", 0.034),
            entry("azure_postgresql_server:GP_Gen5_2", 0.176),
            entry("azure_mysql_server:B_Standard_B1ms", 0.017),
            entry("azure_mysql_server:B_Standard_B2s", 0.068),
            entry("azure_mysql_server:GP_Standard_D2ds_v4", 0.137),
            // Messaging and containers
            entry("azure_eventhub_namespace:Basic", 0.015),
            entry("azure_eventhub_namespace:Standard", 0.03),
            entry("azure_eventhub_namespace:Premium", 1.233),
            entry("azure_container_group:0.5cpu-1gb", 0.0247),
            entry("azure_container_group:1cpu-1.5gb", 0.0472),
            entry("azure_container_group:2cpu-4gb", 0.0988),
            entry("azure_storage_account:Standard_LRS", 0.0),
            entry("azure_storage_account:Standard_GRS", 0.0),
            entry("azure_storage_account:Standard_ZRS", 0.0),
            entry("azure_storage_account:Premium_LRS", 0.0),
            // Flat and usage-based services
            entry("azure_cosmosdb_account", 0.032),
            entry("azure_sql_server", 0.0),
            entry("azure_web_app", 0.0),
            entry("azure_managed_disk", 0.0),
            entry("azure_function_app", 0.0),
            entry("azure_data_factory", 0.0),
            entry("azure_synapse_workspace", 0.0)
    );

    private static final Map<String, Double> REGION_OVERRIDES = Map.ofEntries(
            entry("westeurope/Standard_B2s", 0.048),
            entry("westeurope/Standard_D2s_v3", 0.115),
            entry("northeurope/Standard_B2s", 0.0456),
            entry("northeurope/Standard_D2s_v3", 0.107)
    );

    @Override
    public CloudProvider getProvider() {
        return CloudProvider.AZURE;
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

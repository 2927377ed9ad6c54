package com.finopsguard.parser.terraform;

import com.finopsguard.domain.model.CanonicalResourceModel;
import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.IacFormat;
import com.finopsguard.parser.CloudDetector;
import com.finopsguard.parser.ExtractorRegistry;
import com.finopsguard.parser.IacFormatParser;
import com.finopsguard.parser.ResourceBlock;
import com.finopsguard.parser.ResourceExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Terraform (HCL) parser.
 *
 * PROCESSING:
 * 1. Read the block structure of the whole file
 * 2. Collect default regions from {@code provider} blocks (aliased providers are ignored)
 * 3. Route every {@code resource} block to the extractor registered for its type
 *
 * Data sources, modules, variables and outputs are read but not interpreted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TerraformParser implements IacFormatParser {

    private static final Map<String, CloudProvider> PROVIDER_NAMES = Map.of(
            "aws", CloudProvider.AWS,
            "google", CloudProvider.GCP,
            "google-beta", CloudProvider.GCP,
            "azurerm", CloudProvider.AZURE
    );

    private final ExtractorRegistry extractorRegistry;

    @Override
    public IacFormat getFormat() {
        return IacFormat.TERRAFORM;
    }

    @Override
    public CanonicalResourceModel parse(String rawText) {
        List<HclBlock> blocks = new HclReader(rawText).readBlocks();
        Map<CloudProvider, String> defaultRegions = providerDefaults(blocks);

        CanonicalResourceModel.Builder model = CanonicalResourceModel.builder();
        for (HclBlock block : blocks) {
            if (!"resource".equals(block.type()) || block.labels().size() < 2) {
                continue;
            }
            String type = block.label(0);
            String name = block.label(1);
            Optional<CloudProvider> cloud = CloudDetector.fromTerraformType(type);
            Optional<ResourceExtractor> extractor = cloud.flatMap(c -> extractorRegistry.find(IacFormat.TERRAFORM, c, type));
            if (extractor.isEmpty()) {
                log.debug("Skipping unsupported Terraform resource type: {}.{}", type, name);
                continue;
            }
            ResourceBlock resourceBlock = new ResourceBlock(IacFormat.TERRAFORM, cloud.get(), type, name,
                    block.toAttributeMap(), defaultRegions.get(cloud.get()));
            model.add(extractor.get().extract(resourceBlock));
        }
        return model.build();
    }

    private Map<CloudProvider, String> providerDefaults(List<HclBlock> blocks) {
        Map<CloudProvider, String> defaults = new EnumMap<>(CloudProvider.class);
        for (HclBlock block : blocks) {
            if (!"provider".equals(block.type()) || block.labels().isEmpty()) {
                continue;
            }
            CloudProvider cloud = PROVIDER_NAMES.get(block.label(0));
            if (cloud == null || block.attributes().containsKey("alias") || defaults.containsKey(cloud)) {
                continue;
            }
            ResourceBlock provider = new ResourceBlock(IacFormat.TERRAFORM, cloud, "provider", block.label(0),
                    block.toAttributeMap(), null);
            Optional<String> region = provider.string("region")
                    .or(() -> provider.string("zone").map(ResourceBlock::zoneToRegion));
            region.ifPresent(r -> defaults.put(cloud, r));
        }
        return defaults;
    }
}

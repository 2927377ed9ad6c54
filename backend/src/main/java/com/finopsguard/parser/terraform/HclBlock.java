package com.finopsguard.parser.terraform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A block of HCL: {@code <type> "<label>"... { attributes and nested blocks }}.
 */
public record HclBlock(String type, List<String> labels, Map<String, Object> attributes, List<HclBlock> blocks) {

    public String label(int index) {
        return index < labels.size() ? labels.get(index) : null;
    }

    /**
     * Attributes and nested blocks merged into one map. Nested blocks are
     * grouped by type into lists so that repeated blocks keep their order.
     */
    public Map<String, Object> toAttributeMap() {
        Map<String, Object> result = new LinkedHashMap<>(attributes);
        for (HclBlock block : blocks) {
            Object existing = result.get(block.type());
            List<Object> group;
            if (existing instanceof HclBlockList list) {
                group = list;
            } else {
                group = new HclBlockList();
                result.put(block.type(), group);
            }
            group.add(block.toAttributeMap());
        }
        return result;
    }

    /**
     * Marker list type for nested blocks, so an attribute list is never mistaken for one.
     */
    static final class HclBlockList extends ArrayList<Object> {
    }
}

package com.finopsguard.parser.ansible;

import com.finopsguard.domain.model.CanonicalResource;
import com.finopsguard.domain.model.CanonicalResourceModel;
import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.IacFormat;
import com.finopsguard.parser.CloudDetector;
import com.finopsguard.parser.ExtractorRegistry;
import com.finopsguard.parser.IacFormatParser;
import com.finopsguard.parser.ParseException;
import com.finopsguard.parser.ResourceBlock;
import com.finopsguard.parser.ResourceExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ansible playbook parser.
 *
 * INPUT SHAPES:
 * - A playbook: list of plays, each with {@code tasks}, {@code pre_tasks},
 *   {@code post_tasks} and {@code handlers}
 * - A task file: list of tasks
 * - A single play as a mapping
 *
 * Each task's module is the first key that is not a task keyword. Module
 * arguments become the resource attributes; {@code {{ var }}} references are
 * substituted from play vars when the variable is defined there and left
 * untouched otherwise.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnsibleParser implements IacFormatParser {

    private static final Set<String> TASK_KEYWORDS = Set.of(
            "name", "vars", "when", "loop", "with_items", "with_dict", "loop_control", "register", "tags",
            "become", "become_user", "notify", "delegate_to", "ignore_errors", "changed_when", "failed_when",
            "until", "retries", "delay", "environment", "no_log", "run_once", "check_mode", "args", "listen"
    );

    private static final List<String> TASK_SECTIONS = List.of("pre_tasks", "tasks", "post_tasks", "handlers");

    private static final Pattern VARIABLE = Pattern.compile("\\{\\{\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*}}");

    private static final Map<CloudProvider, List<String>> REGION_VARIABLES = Map.of(
            CloudProvider.AWS, List.of("aws_region", "region", "AWS_DEFAULT_REGION"),
            CloudProvider.GCP, List.of("gcp_region", "region", "gcp_zone", "zone"),
            CloudProvider.AZURE, List.of("azure_location", "location")
    );

    private final ExtractorRegistry extractorRegistry;

    @Override
    public IacFormat getFormat() {
        return IacFormat.ANSIBLE;
    }

    @Override
    public CanonicalResourceModel parse(String rawText) {
        Object root = loadYaml(rawText);
        CanonicalResourceModel.Builder model = CanonicalResourceModel.builder();
        for (Map<String, Object> play : plays(root)) {
            Map<String, Object> vars = asMap(play.get("vars"));
            Map<CloudProvider, String> defaultRegions = defaultRegions(vars);
            List<Map<String, Object>> tasks = new ArrayList<>();
            if (TASK_SECTIONS.stream().anyMatch(play::containsKey)) {
                TASK_SECTIONS.forEach(section -> collectTasks(play.get(section), tasks));
            } else {
                tasks.add(play);
            }
            for (int i = 0; i < tasks.size(); i++) {
                parseTask(tasks.get(i), vars, defaultRegions, i).ifPresent(model::add);
            }
        }
        return model.build();
    }

    private Object loadYaml(String rawText) {
        try {
            return new Yaml(new SafeConstructor(new LoaderOptions())).load(rawText);
        } catch (YAMLException e) {
            throw new ParseException("Malformed Ansible YAML: " + e.getMessage(), null, e);
        }
    }

    private List<Map<String, Object>> plays(Object root) {
        List<Map<String, Object>> plays = new ArrayList<>();
        if (root instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?>) {
                    plays.add(asMap(item));
                }
            }
        } else if (root instanceof Map<?, ?>) {
            plays.add(asMap(root));
        }
        return plays;
    }

    /**
     * Flattens task lists, descending into {@code block}/{@code rescue}/{@code always}.
     */
    private void collectTasks(Object section, List<Map<String, Object>> tasks) {
        if (!(section instanceof List<?> list)) {
            return;
        }
        for (Object item : list) {
            Map<String, Object> task = asMap(item);
            if (task.containsKey("block")) {
                collectTasks(task.get("block"), tasks);
                collectTasks(task.get("rescue"), tasks);
                collectTasks(task.get("always"), tasks);
            } else if (!task.isEmpty()) {
                tasks.add(task);
            }
        }
    }

    private Optional<CanonicalResource> parseTask(
            Map<String, Object> task, Map<String, Object> playVars,
            Map<CloudProvider, String> defaultRegions, int index) {
        Optional<String> moduleKey = task.keySet().stream()
                .filter(key -> !TASK_KEYWORDS.contains(key))
                .findFirst();
        if (moduleKey.isEmpty()) {
            return Optional.empty();
        }
        String module = moduleName(moduleKey.get());
        Optional<CloudProvider> cloud = CloudDetector.fromAnsibleModule(module);
        Optional<ResourceExtractor> extractor = cloud.flatMap(c -> extractorRegistry.find(IacFormat.ANSIBLE, c, module));
        if (extractor.isEmpty()) {
            log.debug("Skipping unsupported Ansible module: {}", moduleKey.get());
            return Optional.empty();
        }

        Map<String, Object> vars = new LinkedHashMap<>(playVars);
        vars.putAll(asMap(task.get("vars")));
        Map<String, Object> args = asMap(substitute(moduleArguments(task.get(moduleKey.get())), vars));

        String name = Optional.ofNullable(args.get("name"))
                .or(() -> Optional.ofNullable(task.get("name")))
                .map(String::valueOf)
                .map(AnsibleParser::slug)
                .orElse(module + "-" + index);

        ResourceBlock block = new ResourceBlock(IacFormat.ANSIBLE, cloud.get(), module, name, args,
                defaultRegions.get(cloud.get()));
        return Optional.of(extractor.get().extract(block));
    }

    static String moduleName(String key) {
        int dot = key.lastIndexOf('.');
        return dot >= 0 ? key.substring(dot + 1) : key;
    }

    /**
     * Module arguments as a map. Free-form {@code key=value key2=value2}
     * strings are split on whitespace.
     */
    private static Object moduleArguments(Object raw) {
        if (raw instanceof Map<?, ?>) {
            return raw;
        }
        Map<String, Object> args = new LinkedHashMap<>();
        if (raw instanceof String s) {
            for (String token : s.trim().split("\\s+")) {
                int eq = token.indexOf('=');
                if (eq > 0) {
                    args.put(token.substring(0, eq), token.substring(eq + 1));
                }
            }
        }
        return args;
    }

    private Map<CloudProvider, String> defaultRegions(Map<String, Object> vars) {
        Map<CloudProvider, String> defaults = new EnumMap<>(CloudProvider.class);
        REGION_VARIABLES.forEach((cloud, names) -> names.stream()
                .map(vars::get)
                .filter(v -> v instanceof String s && !s.contains("{{"))
                .map(String::valueOf)
                .findFirst()
                .ifPresent(region -> defaults.put(cloud, normalizeDefault(cloud, region))));
        return defaults;
    }

    private static String normalizeDefault(CloudProvider cloud, String region) {
        return switch (cloud) {
            case AZURE -> region.replace(" ", "").toLowerCase(Locale.ROOT);
            case GCP -> region.matches("^[a-z]+-[a-z]+\\d+-[a-z]$") ? ResourceBlock.zoneToRegion(region) : region;
            case AWS -> region;
        };
    }

    /**
     * Replaces {@code {{ var }}} references with play variables. A value that
     * is exactly one reference takes the variable's own type.
     */
    static Object substitute(Object value, Map<String, Object> vars) {
        if (value instanceof String s) {
            Matcher whole = VARIABLE.matcher(s.trim());
            if (whole.matches() && vars.containsKey(whole.group(1))) {
                Object resolved = vars.get(whole.group(1));
                return resolved instanceof String ? substitute(resolved, withoutKey(vars, whole.group(1))) : resolved;
            }
            Matcher matcher = VARIABLE.matcher(s);
            StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                Object resolved = vars.get(matcher.group(1));
                String replacement = resolved == null ? matcher.group() : String.valueOf(resolved);
                matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
            }
            matcher.appendTail(sb);
            return sb.toString();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> result.put(String.valueOf(k), substitute(v, vars)));
            return result;
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>();
            list.forEach(item -> result.add(substitute(item, vars)));
            return result;
        }
        return value;
    }

    private static Map<String, Object> withoutKey(Map<String, Object> vars, String key) {
        Map<String, Object> copy = new LinkedHashMap<>(vars);
        copy.remove(key);
        return copy;
    }

    private static Map<String, Object> asMap(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static String slug(String name) {
        String slug = name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]+", "-").replaceAll("(^-+|-+$)", "");
        return slug.isEmpty() ? "task" : slug;
    }
}

package com.mco.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mco.core.metrics.McoMetrics;
import com.mco.core.model.ContextBlock;
import com.mco.core.model.CoreConfig;
import com.mco.core.model.FeatureSet;
import com.mco.core.model.Step;
import com.mco.core.model.StyleSet;
import com.mco.core.model.SuccessCriteria;
import com.mco.core.model.WorkflowConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Loads a workflow directory into an immutable {@link WorkflowConfig}.
 * <p>
 * {@code mco.core} and {@code mco.sc} are required; {@code mco.features} and
 * {@code mco.styles} are optional and default to empty sets. Parsed configs are cached
 * per normalized directory so every orchestration started from the same directory
 * shares one instance.
 */
@Service
public class WorkflowConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowConfigLoader.class);

    public static final String CORE_FILE = "mco.core";
    public static final String CRITERIA_FILE = "mco.sc";
    public static final String FEATURES_FILE = "mco.features";
    public static final String STYLES_FILE = "mco.styles";

    private static final Pattern NUMBERED_CRITERION = Pattern.compile("success_criteria_\\d+");

    private final McoDocumentParser parser;
    private final McoProperties properties;
    private final McoMetrics metrics;

    private final ConcurrentHashMap<Path, WorkflowConfig> cache = new ConcurrentHashMap<>();

    public WorkflowConfigLoader(ObjectMapper objectMapper, McoProperties properties, McoMetrics metrics) {
        this.parser = new McoDocumentParser(objectMapper);
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Loads (or returns the cached) config for {@code configDir}.
     *
     * @throws ConfigException if the directory or a required document is missing or unreadable
     */
    public WorkflowConfig load(String configDir) {
        if (configDir == null || configDir.isBlank()) {
            throw new ConfigException("Configuration directory is required");
        }
        Path dir;
        try {
            dir = Path.of(configDir);
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid configuration directory: " + configDir, e);
        }
        return load(dir);
    }

    public WorkflowConfig load(Path configDir) {
        Path dir = configDir.toAbsolutePath().normalize();
        if (properties.isWorkflowCacheEnabled()) {
            WorkflowConfig cached = cache.get(dir);
            if (cached != null) {
                log.debug("Using cached workflow config for {}", dir);
                return cached;
            }
        }

        long start = System.currentTimeMillis();
        try {
            WorkflowConfig config = loadUncached(dir);
            metrics.recordConfigLoad(true, System.currentTimeMillis() - start);
            if (properties.isWorkflowCacheEnabled()) {
                WorkflowConfig raced = cache.putIfAbsent(dir, config);
                if (raced != null) {
                    return raced;
                }
            }
            return config;
        } catch (ConfigException e) {
            metrics.recordConfigLoad(false, System.currentTimeMillis() - start);
            throw e;
        }
    }

    /** Drops the cached config for {@code configDir} so the next load re-reads the files. */
    public void evict(Path configDir) {
        cache.remove(configDir.toAbsolutePath().normalize());
    }

    public void clearCache() {
        cache.clear();
    }

    private WorkflowConfig loadUncached(Path dir) {
        if (!Files.isDirectory(dir)) {
            throw new ConfigException("Configuration directory does not exist: " + dir);
        }

        ParsedDocument core = readDocument(dir.resolve(CORE_FILE), true).orElseThrow();
        ParsedDocument criteria = readDocument(dir.resolve(CRITERIA_FILE), true).orElseThrow();
        Optional<ParsedDocument> features = readDocument(dir.resolve(FEATURES_FILE), false);
        Optional<ParsedDocument> styles = readDocument(dir.resolve(STYLES_FILE), false);

        var config = new WorkflowConfig(
                dir,
                toCoreConfig(core, dir),
                toSuccessCriteria(criteria),
                new FeatureSet(features.map(d -> toBlocks(d, "feature", "features")).orElse(List.of())),
                new StyleSet(styles.map(d -> toBlocks(d, "style", "styles")).orElse(List.of())));

        log.info("Loaded workflow '{}' from {} ({} steps, {} criteria, {} features, {} styles)",
                config.core().name(), dir, config.totalSteps(),
                config.successCriteria().criteria().size(),
                config.features().blocks().size(), config.styles().blocks().size());
        return config;
    }

    private Optional<ParsedDocument> readDocument(Path file, boolean required) {
        if (!Files.isRegularFile(file)) {
            if (required) {
                throw new ConfigException("Required workflow document not found: " + file);
            }
            log.debug("Optional workflow document {} not present", file.getFileName());
            return Optional.empty();
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            ParsedDocument document = parser.parse(content);
            log.debug("Parsed {} ({} sections)", file.getFileName(), document.sections().size());
            return Optional.of(document);
        } catch (IOException e) {
            if (required) {
                throw new ConfigException("Failed to read workflow document " + file + ": " + e.getMessage(), e);
            }
            log.warn("Skipping unreadable optional document {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    // -- core ------------------------------------------------------------

    private CoreConfig toCoreConfig(ParsedDocument doc, Path dir) {
        String name = doc.text("workflow")
                .or(() -> doc.text("name"))
                .orElse(String.valueOf(dir.getFileName()));
        Map<String, Object> data = doc.first("data")
                .map(ParsedSection::body)
                .filter(Map.class::isInstance)
                .map(WorkflowConfigLoader::stringKeyed)
                .orElse(Map.of());

        return new CoreConfig(
                name,
                doc.text("description").orElse(null),
                doc.text("version").orElse(null),
                data,
                extractSteps(doc));
    }

    private List<Step> extractSteps(ParsedDocument doc) {
        Optional<Object> declared = doc.first("workflow_steps").map(ParsedSection::body)
                .or(() -> doc.first("steps").map(ParsedSection::body));
        if (declared.isPresent()) {
            return stepsFrom(declared.get());
        }
        Optional<Object> agents = doc.first("agents").map(ParsedSection::body);
        if (agents.isPresent() && agents.get() instanceof Map<?, ?> agentMap) {
            return stepsFromAgents(agentMap);
        }
        log.warn("Workflow declares no steps (expected @workflow_steps, @steps or @agents)");
        return List.of();
    }

    private static List<Step> stepsFrom(Object body) {
        if (body instanceof Map<?, ?> map && map.get("items") instanceof List<?> items) {
            return stepsFrom(items);
        }
        List<Step> steps = new ArrayList<>();
        if (body instanceof Map<?, ?> map) {
            map.forEach((id, value) -> steps.add(toStep(String.valueOf(id), value)));
        } else if (body instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                Object item = list.get(i);
                String id = item instanceof Map<?, ?> m && m.get("id") != null
                        ? String.valueOf(m.get("id"))
                        : "step_" + (i + 1);
                steps.add(toStep(id, item));
            }
        } else if (body instanceof String text && !text.isBlank()) {
            steps.add(new Step("step_1", text.strip(), null));
        }
        return steps;
    }

    private static List<Step> stepsFromAgents(Map<?, ?> agents) {
        List<Step> steps = new ArrayList<>();
        agents.forEach((agent, definition) -> {
            Object agentSteps = definition instanceof Map<?, ?> def ? def.get("steps") : definition;
            if (agentSteps instanceof List<?> list) {
                for (int i = 0; i < list.size(); i++) {
                    steps.add(toStep(agent + "_step_" + i, list.get(i)));
                }
            }
        });
        return steps;
    }

    private static Step toStep(String id, Object value) {
        if (value instanceof Map<?, ?> map) {
            Object task = map.get("task") != null ? map.get("task") : map.get("description");
            Object type = map.get("type");
            return new Step(id,
                    task == null ? "" : String.valueOf(task),
                    type == null ? null : String.valueOf(type));
        }
        return new Step(id, value == null ? "" : String.valueOf(value), null);
    }

    // -- success criteria ---------------------------------------------------

    private SuccessCriteria toSuccessCriteria(ParsedDocument doc) {
        List<String> criteria = new ArrayList<>();
        doc.first("success_criteria").ifPresent(section -> criteria.addAll(criteriaFrom(section)));
        for (ParsedSection section : doc.sections()) {
            if (NUMBERED_CRITERION.matcher(section.name()).matches() && section.textValue() != null) {
                criteria.add(section.textValue().strip());
            }
        }
        return new SuccessCriteria(
                doc.text("goal").orElse(""),
                criteria,
                doc.text("target_audience").orElse(null),
                doc.text("developer_vision").orElse(null));
    }

    private static List<String> criteriaFrom(ParsedSection section) {
        Object value = section.value();
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            list.forEach(item -> result.add(criterionText(item)));
        } else if (value instanceof Map<?, ?> map && map.get("items") instanceof List<?> items) {
            items.forEach(item -> result.add(criterionText(item)));
        } else if (value instanceof String text) {
            text.lines().map(String::strip).filter(l -> !l.isEmpty()).forEach(result::add);
        }
        return result;
    }

    private static String criterionText(Object item) {
        if (item instanceof Map<?, ?> map) {
            for (String key : List.of("description", "text", "criterion", "id")) {
                if (map.get(key) != null) {
                    return String.valueOf(map.get(key));
                }
            }
        }
        return String.valueOf(item);
    }

    // -- features / styles ----------------------------------------------------

    private static List<ContextBlock> toBlocks(ParsedDocument doc, String singular, String plural) {
        List<ContextBlock> blocks = new ArrayList<>();
        int n = 0;
        for (ParsedSection section : doc.sections()) {
            if (section.name().equals(singular)) {
                n++;
                String title = section.inlineValue() != null ? section.inlineValue() : capitalize(singular) + " " + n;
                blocks.add(new ContextBlock(title, guidanceOf(section), section.annotations()));
            } else if (section.name().equals(plural)) {
                blocks.addAll(blocksFromCollection(section, plural));
            }
        }
        return blocks;
    }

    private static List<ContextBlock> blocksFromCollection(ParsedSection section, String plural) {
        List<ContextBlock> blocks = new ArrayList<>();
        Object body = section.body();
        if (body instanceof List<?> list) {
            list.forEach(item -> blocks.add(new ContextBlock(String.valueOf(item), String.valueOf(item), List.of())));
        } else if (body instanceof Map<?, ?> map) {
            map.forEach((k, v) -> blocks.add(new ContextBlock(String.valueOf(k), String.valueOf(v), List.of())));
        } else if (body instanceof String || !section.annotations().isEmpty()) {
            blocks.add(new ContextBlock(capitalize(plural), guidanceOf(section), section.annotations()));
        }
        return blocks;
    }

    private static String guidanceOf(ParsedSection section) {
        List<String> parts = new ArrayList<>(section.annotations());
        Object body = section.body();
        if (body instanceof String text && !text.isBlank()) {
            parts.add(text.strip());
        } else if (body instanceof List<?> list) {
            list.forEach(item -> parts.add("- " + item));
        } else if (body instanceof Map<?, ?> map) {
            map.forEach((k, v) -> parts.add(k + ": " + v));
        }
        return String.join("\n", parts);
    }

    private static Map<String, Object> stringKeyed(Object map) {
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<?, ?>) map).forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}

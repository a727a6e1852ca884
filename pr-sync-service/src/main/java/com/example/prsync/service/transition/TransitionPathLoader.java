package com.example.prsync.service.transition;

import com.example.prsync.dto.TransitionPathStep;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.config.YamlMapFactoryBean;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the operator transition path table from a JSON or YAML resource.
 *
 * <pre>
 * paths:
 *   needs-review:
 *     - from: To Do
 *       transitionName: Start Progress
 *   default:
 *     - from: Blocked
 *       transitionId: "31"
 *       label: Unblock
 * </pre>
 *
 * A blank location or a missing resource yields the built-in table only.
 * A resource that exists but cannot be parsed fails startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransitionPathLoader {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<TransitionPathStep>> STEPS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public TransitionPathTable load(String location) {
        if (location == null || location.isBlank()) {
            return TransitionPathTable.builtInOnly();
        }

        Resource resource = resourceLoader.getResource(location.contains(":") ? location : "file:" + location);
        if (!resource.exists()) {
            log.warn("Transition path file not found: {}. Using built-in paths only.", location);
            return TransitionPathTable.builtInOnly();
        }

        Map<String, Object> document = isYaml(location) ? readYaml(resource) : readJson(resource, location);
        Object paths = document.get("paths");
        if (!(paths instanceof Map<?, ?> pathMap)) {
            log.warn("Transition path file {} has no 'paths' section. Using built-in paths only.", location);
            return TransitionPathTable.builtInOnly();
        }

        Map<String, List<TransitionPathStep>> table = new LinkedHashMap<>();
        pathMap.forEach((group, steps) -> {
            try {
                table.put(String.valueOf(group).toLowerCase(Locale.ROOT), objectMapper.convertValue(steps, STEPS_TYPE));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid steps for group '" + group + "' in " + location, e);
            }
        });

        TransitionPathTable loaded = new TransitionPathTable(table);
        log.info("Loaded {} operator transition steps for groups {} from {}",
                loaded.operatorStepCount(), table.keySet(), location);
        return loaded;
    }

    private Map<String, Object> readYaml(Resource resource) {
        YamlMapFactoryBean factory = new YamlMapFactoryBean();
        factory.setResources(resource);
        Map<String, Object> document = factory.getObject();
        return document != null ? document : Map.of();
    }

    private Map<String, Object> readJson(Resource resource, String location) {
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, MAP_TYPE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read transition path file " + location, e);
        }
    }

    private static boolean isYaml(String location) {
        String lower = location.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yml") || lower.endsWith(".yaml");
    }
}

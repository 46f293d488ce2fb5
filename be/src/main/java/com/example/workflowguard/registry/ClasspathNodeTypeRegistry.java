package com.example.workflowguard.registry;

import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * {@link NodeTypeRegistry} loaded once from {@code node-types.json} on the classpath.
 */
@Component
@Slf4j
public class ClasspathNodeTypeRegistry implements NodeTypeRegistry {

    static final String RESOURCE = "node-types.json";

    private final List<NodeTypeEntry> entries;
    private final Set<String> types;

    @Autowired
    public ClasspathNodeTypeRegistry(JsonMapper jsonMapper) {
        this(jsonMapper, new ClassPathResource(RESOURCE));
    }

    ClasspathNodeTypeRegistry(JsonMapper jsonMapper, Resource resource) {
        this.entries = load(jsonMapper, resource);
        this.types = entries.stream().map(NodeTypeEntry::type).collect(Collectors.toUnmodifiableSet());
        log.info("Loaded {} node types from {}", entries.size(), resource.getDescription());
    }

    private static List<NodeTypeEntry> load(JsonMapper jsonMapper, Resource resource) {
        if (!resource.exists()) {
            throw new IllegalStateException("Node type catalogue not found: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            return List.copyOf(jsonMapper.readValue(in, new TypeReference<List<NodeTypeEntry>>() { }));
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to parse node type catalogue " + resource.getDescription(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read node type catalogue " + resource.getDescription(), e);
        }
    }

    @Override
    public List<NodeTypeEntry> search(String search, String category, Integer limit) {
        String needle = search != null ? search.trim().toLowerCase(Locale.ROOT) : "";
        String wantedCategory = category != null ? category.trim() : "";
        int max = limit != null && limit > 0 ? limit : DEFAULT_LIMIT;
        return entries.stream()
                .filter(e -> wantedCategory.isEmpty() || e.category().equalsIgnoreCase(wantedCategory))
                .filter(e -> needle.isEmpty()
                        || e.name().toLowerCase(Locale.ROOT).contains(needle)
                        || e.type().toLowerCase(Locale.ROOT).contains(needle))
                .limit(max)
                .toList();
    }

    @Override
    public List<String> categories() {
        return List.copyOf(entries.stream().map(NodeTypeEntry::category).collect(Collectors.toCollection(TreeSet::new)));
    }

    @Override
    public int count() {
        return entries.size();
    }

    @Override
    public boolean exists(String type) {
        return type != null && types.contains(type);
    }

    @Override
    public List<String> knownTypes() {
        return entries.stream().map(NodeTypeEntry::type).toList();
    }
}

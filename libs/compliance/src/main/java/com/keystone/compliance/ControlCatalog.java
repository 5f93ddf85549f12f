package com.keystone.compliance;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Controls per framework, loaded from a JSON classpath resource keyed by framework id.
 *
 * <p>Frameworks missing from the resource have an empty catalog.
 */
public final class ControlCatalog {

    private static final Logger log = LoggerFactory.getLogger(ControlCatalog.class);

    public static final String DEFAULT_RESOURCE = "compliance-controls.json";

    private final Map<ComplianceFramework, List<ControlCategory>> categories;

    public ControlCatalog(Map<ComplianceFramework, List<ControlCategory>> categories) {
        Map<ComplianceFramework, List<ControlCategory>> copy = new EnumMap<>(ComplianceFramework.class);
        categories.forEach((framework, list) -> copy.put(framework, List.copyOf(list)));
        this.categories = copy;
    }

    public static ControlCatalog loadDefault() {
        return load(DEFAULT_RESOURCE, new ObjectMapper());
    }

    public static ControlCatalog load(String resource, ObjectMapper mapper) {
        try (InputStream in = ControlCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Control catalog resource not found: " + resource);
            }
            Map<String, List<ControlCategory>> raw =
                    mapper.readValue(in, new TypeReference<Map<String, List<ControlCategory>>>() {});
            Map<ComplianceFramework, List<ControlCategory>> parsed = new EnumMap<>(ComplianceFramework.class);
            raw.forEach((id, list) -> parsed.put(ComplianceFramework.fromId(id), list));
            log.info("Loaded control catalog from {}: frameworks={}", resource, parsed.keySet());
            return new ControlCatalog(parsed);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read control catalog " + resource, e);
        }
    }

    public List<ControlCategory> categories(ComplianceFramework framework) {
        return categories.getOrDefault(framework, List.of());
    }

    public List<ControlDefinition> controls(ComplianceFramework framework) {
        return categories(framework).stream()
                .flatMap(category -> category.controls().stream())
                .toList();
    }
}

package com.keystone.compliance;

import java.util.List;

/** A named group of controls within a framework, e.g. SOC 2 {@code CC6}. */
public record ControlCategory(String id, String name, List<ControlDefinition> controls) {

    public ControlCategory {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        controls = controls == null ? List.of() : List.copyOf(controls);
    }
}

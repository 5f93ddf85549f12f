package com.keystone.compliance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Compliance frameworks reports can be generated for. */
public enum ComplianceFramework {
    SOC2("soc2"),
    HIPAA("hipaa"),
    GDPR("gdpr"),
    ISO27001("iso27001"),
    PCI_DSS("pci_dss"),
    NIST("nist");

    private final String id;

    ComplianceFramework(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String displayName() {
        return name().replace('_', ' ');
    }

    public String description() {
        return name() + " compliance framework";
    }

    @JsonCreator
    public static ComplianceFramework fromId(String id) {
        for (ComplianceFramework framework : values()) {
            if (framework.id.equalsIgnoreCase(id)) {
                return framework;
            }
        }
        throw new IllegalArgumentException("Unknown compliance framework: " + id);
    }
}

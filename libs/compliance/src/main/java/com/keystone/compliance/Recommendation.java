package com.keystone.compliance;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/** Remediation advice for a control that is not fully compliant. */
public record Recommendation(
        Priority priority, String controlId, String controlName, String recommendation, String impact) {

    /** Declaration order is sort order. */
    public enum Priority {
        HIGH,
        MEDIUM,
        LOW;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /** The recommendation for an assessed control, if its status calls for one. */
    public static Optional<Recommendation> forControl(ControlAssessment control) {
        return switch (control.status()) {
            case NON_COMPLIANT -> Optional.of(new Recommendation(Priority.HIGH, control.controlId(),
                    control.controlName(),
                    "Implement " + control.description() + " to achieve compliance",
                    "Critical for compliance certification"));
            case PARTIAL -> Optional.of(new Recommendation(Priority.MEDIUM, control.controlId(),
                    control.controlName(),
                    "Enhance " + control.description() + " coverage",
                    "Improve compliance posture"));
            case PENDING_REVIEW -> Optional.of(new Recommendation(Priority.LOW, control.controlId(),
                    control.controlName(),
                    "Review evidence for " + control.controlName(),
                    "Validate compliance status"));
            case COMPLIANT, NOT_APPLICABLE -> Optional.empty();
        };
    }
}

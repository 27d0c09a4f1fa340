package no.cantara.kcr.error;

import java.util.List;

/** Thrown when retrieval options fail boundary validation; no work has started. */
public class InvalidOptionsException extends IllegalArgumentException {

    private final List<String> violations;

    public InvalidOptionsException(List<String> violations) {
        super("Invalid retrieval options: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}

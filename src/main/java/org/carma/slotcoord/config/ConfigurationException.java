package org.carma.slotcoord.config;

import java.util.List;

/**
 * A run cannot start with the given parameters.
 *
 * This is the only error class that aborts instead of degrading; it is raised
 * before any round is played.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> errors;

    public ConfigurationException(String message) {
        this(List.of(message));
    }

    public ConfigurationException(List<String> errors) {
        super("Invalid coordination configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}

package com.e2eq.atlas.exceptions;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when a named traversal policy is requested that the registry does not define.
 * The message names the requested policy and lists every valid name.
 */
public class PolicyNotFoundException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String requestedName;
    private final List<String> availableNames;

    public PolicyNotFoundException(String requestedName, Collection<String> availableNames) {
        super(buildMessage(requestedName, availableNames));
        this.requestedName = requestedName;
        this.availableNames = availableNames == null ? List.of() : List.copyOf(availableNames);
    }

    private static String buildMessage(String requestedName, Collection<String> availableNames) {
        String available = availableNames == null ? "" : String.join(", ", availableNames);
        return String.format("Unknown query pattern: '%s'. Available patterns: %s", requestedName, available);
    }

    public String getRequestedName() {
        return requestedName;
    }

    public List<String> getAvailableNames() {
        return availableNames;
    }
}

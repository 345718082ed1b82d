package dev.pagegraph.exception;

import java.util.UUID;

public class NodeNotFoundException extends RuntimeException {
    public NodeNotFoundException(UUID nodeId) {
        super("Graph node not found: " + nodeId);
    }

    public NodeNotFoundException(String message) {
        super(message);
    }
}

package dev.pagegraph.exception;

import java.util.UUID;

public class VisitNotFoundException extends RuntimeException {
    public VisitNotFoundException(UUID visitId) {
        super("Visit not found: " + visitId);
    }

    public VisitNotFoundException(String message) {
        super(message);
    }
}

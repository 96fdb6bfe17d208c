package com.purchasingpower.proofengine.exception;

import lombok.Getter;

/**
 * Raised when a dependency references a statement id the graph does not contain.
 *
 * <p>This signals a caller bug, never bad proof input.
 */
@Getter
public class StatementNotFoundException extends RuntimeException {

    private final String statementId;
    private final String endpoint;

    public StatementNotFoundException(String endpoint, String statementId) {
        super(String.format("%s node '%s' not found in graph", endpoint, statementId));
        this.statementId = statementId;
        this.endpoint = endpoint;
    }
}

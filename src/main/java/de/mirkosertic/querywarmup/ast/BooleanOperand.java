package de.mirkosertic.querywarmup.ast;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How the clauses of a full text query or of juxtaposed user query clauses combine.
 */
public enum BooleanOperand {
    @JsonProperty("and")
    AND,
    @JsonProperty("or")
    OR
}

package de.mirkosertic.querywarmup.ast;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a full text clause matches when analysis leaves no token.
 */
public enum ZeroTermsQuery {
    @JsonProperty("match_all")
    MATCH_ALL,
    @JsonProperty("match_none")
    MATCH_NONE
}

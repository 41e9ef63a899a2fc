package com.splitttr.coedit.message;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MutationKind {
    @JsonProperty("insert") INSERT,
    @JsonProperty("delete") DELETE,
    @JsonProperty("replace") REPLACE
}

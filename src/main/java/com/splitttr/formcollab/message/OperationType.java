package com.splitttr.formcollab.message;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum OperationType {
    @JsonProperty("add") ADD,
    @JsonProperty("update") UPDATE,
    @JsonProperty("delete") DELETE,
    @JsonProperty("reorder") REORDER
}

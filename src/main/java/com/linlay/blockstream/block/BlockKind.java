package com.linlay.blockstream.block;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BlockKind {
    TEXT("text"),
    REASONING("reasoning"),
    TOOL_CALL("tool-call"),
    IMAGE("image"),
    ERROR("error");

    private final String wireName;

    BlockKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

package com.linlay.blockstream.stream.model;

public enum ChunkType {
    TEXT_DELTA,
    REASONING_DELTA,
    TOOL_CALL_START,
    TOOL_CALL_DELTA,
    TOOL_CALL_END,
    IMAGE,
    RAW,
    ERROR,
    FINISH
}

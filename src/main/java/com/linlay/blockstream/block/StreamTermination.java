package com.linlay.blockstream.block;

public enum StreamTermination {
    COMPLETED,
    TIMEOUT,
    ABORTED,
    FAILED
}

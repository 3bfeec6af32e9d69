package com.linlay.blockstream.block;

public enum BlockAction {

    /**
     * Append the chunk payload to the active block.
     */
    CONTINUE,

    /**
     * Finalize the active block (if any) and open a new block for the chunk.
     */
    CLOSE_AND_OPEN,

    /**
     * Append to the active block, then finalize it.
     */
    APPEND_AND_CLOSE,

    /**
     * Update an already closed block identified by the chunk, leaving the active block untouched.
     */
    UPDATE_DETACHED,

    /**
     * Merge into message-level metadata; no block is opened or closed.
     */
    METADATA_ONLY,

    /**
     * Record an error; terminal errors surface as an error block at finalize.
     */
    RECORD_FAILURE,

    FINALIZE
}

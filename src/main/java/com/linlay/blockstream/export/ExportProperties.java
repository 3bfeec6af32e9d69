package com.linlay.blockstream.export;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "stream.export")
public class ExportProperties {

    @Min(1)
    private int batchSize = 100;
    private boolean waitForDrain = true;
    /**
     * 0 waits indefinitely for a full sink to drain.
     */
    @PositiveOrZero
    private long drainTimeoutMs = 0;

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public boolean isWaitForDrain() {
        return waitForDrain;
    }

    public void setWaitForDrain(boolean waitForDrain) {
        this.waitForDrain = waitForDrain;
    }

    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
    }
}

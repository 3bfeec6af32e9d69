package com.linlay.blockstream.config;

import com.linlay.blockstream.stream.model.IdleTimeoutMessage;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "stream.engine")
public class StreamEngineProperties {

    /**
     * 0 disables the idle timeout.
     */
    @PositiveOrZero
    private long idleTimeoutMs = 300_000L;
    @PositiveOrZero
    private long throttleMs = 150L;
    @NotNull
    private Duration continuationTtl = Duration.ofMinutes(30);
    /**
     * {@code %s} is replaced with the timeout in minutes.
     */
    @NotBlank
    private String idleTimeoutMessage = IdleTimeoutMessage.DEFAULT_TEMPLATE;
    private boolean abortVisible;
    private String abortMessage = "Request aborted";

    public long getIdleTimeoutMs() {
        return idleTimeoutMs;
    }

    public void setIdleTimeoutMs(long idleTimeoutMs) {
        this.idleTimeoutMs = idleTimeoutMs;
    }

    public long getThrottleMs() {
        return throttleMs;
    }

    public void setThrottleMs(long throttleMs) {
        this.throttleMs = throttleMs;
    }

    public Duration getContinuationTtl() {
        return continuationTtl;
    }

    public void setContinuationTtl(Duration continuationTtl) {
        this.continuationTtl = continuationTtl;
    }

    public String getIdleTimeoutMessage() {
        return idleTimeoutMessage;
    }

    public void setIdleTimeoutMessage(String idleTimeoutMessage) {
        this.idleTimeoutMessage = idleTimeoutMessage;
    }

    public boolean isAbortVisible() {
        return abortVisible;
    }

    public void setAbortVisible(boolean abortVisible) {
        this.abortVisible = abortVisible;
    }

    public String getAbortMessage() {
        return abortMessage;
    }

    public void setAbortMessage(String abortMessage) {
        this.abortMessage = abortMessage;
    }
}

package com.linlay.blockstream.persistence;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "stream.store")
public class BlockStoreProperties {

    @NotBlank
    private String dir = "./messages";
    private boolean compactOnFinalize = true;

    public String getDir() {
        return dir;
    }

    public void setDir(String dir) {
        this.dir = dir;
    }

    public boolean isCompactOnFinalize() {
        return compactOnFinalize;
    }

    public void setCompactOnFinalize(boolean compactOnFinalize) {
        this.compactOnFinalize = compactOnFinalize;
    }
}

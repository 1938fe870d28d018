package de.bsommerfeld.xivpatch.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

@JsonIgnoreProperties(ignoreUnknown = true)
public class InstallConfig {

    @JsonProperty("verify-chunk-crc")
    @JsonPropertyDescription("Reject patch files whose chunk CRC32 does not match")
    private boolean verifyChunkCrc = true;

    @JsonProperty("ignore-missing")
    @JsonPropertyDescription("Tolerate missing delete targets unless a patch turns this off")
    private boolean ignoreMissing = true;

    public boolean isVerifyChunkCrc() {
        return verifyChunkCrc;
    }

    public void setVerifyChunkCrc(boolean verifyChunkCrc) {
        this.verifyChunkCrc = verifyChunkCrc;
    }

    public boolean isIgnoreMissing() {
        return ignoreMissing;
    }

    public void setIgnoreMissing(boolean ignoreMissing) {
        this.ignoreMissing = ignoreMissing;
    }
}

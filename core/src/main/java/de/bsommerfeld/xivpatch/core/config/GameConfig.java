package de.bsommerfeld.xivpatch.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class GameConfig {

    @JsonProperty("install-paths")
    @JsonPropertyDescription("Install paths probed below every filesystem root when no game path is given")
    private List<String> installPaths = List.of(
            "Program Files/USERJOY GAMES/FINAL FANTASY XIV TC",
            "Program Files (x86)/USERJOY GAMES/FINAL FANTASY XIV TC",
            "USERJOY GAMES/FINAL FANTASY XIV TC");

    public List<String> getInstallPaths() {
        return installPaths;
    }
}

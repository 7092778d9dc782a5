package com.tradepilot.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Collector drop files read at the start of each cycle.
 */
@ConfigurationProperties(prefix = "sources")
@Data
@Validated
public class SourceProperties {

    @Valid
    private Insider insider = new Insider();
    @Valid
    private List<FileSource> files = new ArrayList<>();

    @Data
    public static class Insider {
        private boolean enabled = true;
        private String eventsPath = "data/insider_buys.json";
    }

    @Data
    public static class FileSource {
        @NotBlank
        private String name;
        @NotBlank
        private String path;
        private boolean enabled = true;
    }
}

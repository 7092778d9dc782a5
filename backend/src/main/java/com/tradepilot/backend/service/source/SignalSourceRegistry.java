package com.tradepilot.backend.service.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradepilot.backend.config.SourceProperties;
import com.tradepilot.backend.trading.pipeline.SignalSource;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * All signal sources of a cycle: source beans plus one file source per
 * enabled {@code sources.files} entry.
 */
@Service
@RequiredArgsConstructor
public class SignalSourceRegistry {

    private final ObjectProvider<SignalSource> signalSourceBeans;
    private final SourceProperties sourceProperties;
    private final ObjectMapper objectMapper;

    public List<SignalSource> sources() {
        List<SignalSource> sources = new ArrayList<>();
        signalSourceBeans.orderedStream().forEach(sources::add);
        for (SourceProperties.FileSource file : sourceProperties.getFiles()) {
            if (file.isEnabled()) {
                sources.add(new JsonFileSignalSource(file.getName(), Path.of(file.getPath()), objectMapper));
            }
        }
        return sources;
    }
}

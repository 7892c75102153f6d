/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.io;

import ai.evacortex.tienvelope.core.stats.AnalysisRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Reads and writes batches of {@link AnalysisRequest}s as a JSON array.
 */
public final class AnalysisRequestCodec {

    private static final TypeReference<List<AnalysisRequest>> LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public AnalysisRequestCodec() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<AnalysisRequest> load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return List.copyOf(mapper.readValue(in, LIST_TYPE));
        } catch (IOException e) {
            throw new RuntimeException("Failed to load analysis requests from " + path, e);
        }
    }

    public void save(Path path, List<AnalysisRequest> requests) {
        try {
            if (path.getParent() != null) Files.createDirectories(path.getParent());
            try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, requests);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to save analysis requests to " + path, e);
        }
    }

    public AnalysisRequest parse(String json) {
        try {
            return mapper.readValue(json, AnalysisRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed analysis request: " + e.getOriginalMessage(), e);
        }
    }
}

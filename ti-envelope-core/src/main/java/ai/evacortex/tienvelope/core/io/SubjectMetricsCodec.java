/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.io;

import ai.evacortex.tienvelope.core.stats.SubjectMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.List;

public final class SubjectMetricsCodec {

    private static final TypeReference<List<SubjectMetrics>> LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper();

    public String toJson(SubjectMetrics metrics) {
        try {
            return mapper.writeValueAsString(metrics);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize metrics for " + metrics.subjectId(), e);
        }
    }

    public SubjectMetrics fromJson(String json) {
        try {
            return mapper.readValue(json, SubjectMetrics.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed metrics: " + e.getOriginalMessage(), e);
        }
    }

    public void write(Path path, Collection<SubjectMetrics> metrics) {
        try {
            if (path.getParent() != null) Files.createDirectories(path.getParent());
            try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, List.copyOf(metrics));
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write metrics to " + path, e);
        }
    }

    public List<SubjectMetrics> read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return mapper.readValue(in, LIST_TYPE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read metrics from " + path, e);
        }
    }
}

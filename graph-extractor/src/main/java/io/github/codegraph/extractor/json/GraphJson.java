package io.github.codegraph.extractor.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.codegraph.model.CodeGraph;
import io.github.codegraph.model.FileExtraction;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** JSON form of per-file record sets and merged graphs. */
public final class GraphJson {
    private static final Logger logger = LogManager.getLogger(GraphJson.class);

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .configure(SerializationFeature.CLOSE_CLOSEABLE, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Compact mapper for JSON lines, one record set per line. */
    private static final ObjectMapper lineMapper =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private GraphJson() {}

    public static String toJson(FileExtraction extraction) {
        try {
            return objectMapper.writeValueAsString(extraction);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJson(CodeGraph graph) {
        try {
            return objectMapper.writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static FileExtraction readExtraction(String json) throws IOException {
        return objectMapper.readValue(json, FileExtraction.class);
    }

    public static void write(CodeGraph graph, Path target) throws IOException {
        objectMapper.writeValue(target.toFile(), graph);
        logger.debug("Wrote {} entities to {}", graph.entities().size(), target);
    }

    public static CodeGraph readGraph(Path source) throws IOException {
        return objectMapper.readValue(source.toFile(), CodeGraph.class);
    }

    /** Writes each file's record set as one compact JSON line, in merge order. */
    public static void writeLines(CodeGraph graph, Path target) throws IOException {
        var lines = new ArrayList<String>(graph.files().size());
        for (var file : graph.files()) {
            lines.add(lineMapper.writeValueAsString(file));
        }
        Files.write(target, lines, StandardCharsets.UTF_8);
    }

    public static List<FileExtraction> readLines(Path source) throws IOException {
        var result = new ArrayList<FileExtraction>();
        for (var line : Files.readAllLines(source, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                result.add(lineMapper.readValue(line, FileExtraction.class));
            }
        }
        return result;
    }
}

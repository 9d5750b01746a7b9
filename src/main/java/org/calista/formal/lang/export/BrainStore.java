package org.calista.formal.lang.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.formal.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * BrainStore: persist/load exported brains.
 *
 * <p>Format: one pretty-printed JSON document per file, {@code <brain id>.json} under the
 * output directory. Written atomically through {@link FileIO}.</p>
 */
public final class BrainStore {

    private static final Logger log = LoggerFactory.getLogger(BrainStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path outputDir;

    public BrainStore(FileIO io, ObjectMapper mapper, Path outputDir) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
    }

    public Path outputDir() {
        return outputDir;
    }

    /** Default location for a brain: {@code <outputDir>/<id>.json}. */
    public Path pathFor(Brain brain) {
        Objects.requireNonNull(brain, "brain");
        if (brain.brain == null || brain.brain.id == null || brain.brain.id.isBlank()) {
            throw new IllegalArgumentException("brain has no id");
        }
        return outputDir.resolve(brain.brain.id + ".json");
    }

    /**
     * Saves to {@link #pathFor(Brain)}.
     *
     * @return the written file
     */
    public Path save(Brain brain) throws IOException {
        Path file = pathFor(brain);
        save(brain, file);
        return file;
    }

    public void save(Brain brain, Path file) throws IOException {
        Objects.requireNonNull(brain, "brain");
        Objects.requireNonNull(file, "file");

        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(brain);
        io.writeString(file, json + System.lineSeparator());
        log.info("Brain saved: id={} file={}", brain.brain.id, file);
    }

    public Brain load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Brain b = mapper.readValue(io.readString(file), Brain.class);
        if (b == null) throw new IOException("Empty brain file: " + file);
        return b;
    }

    /** Raw tree, for consumers that do not bind to {@link Brain}. */
    public JsonNode readTree(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return mapper.readTree(io.readString(file));
    }
}

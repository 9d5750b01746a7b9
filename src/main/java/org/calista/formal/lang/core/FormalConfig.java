package org.calista.formal.lang.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.formal.io.FileIO;
import org.calista.formal.lang.commit.Fingerprinter;
import org.calista.formal.lang.eval.AmbiguityPolicy;
import org.calista.formal.lang.lexer.UnknownCharacterPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * FormalConfig: простой POJO конфиг:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FormalConfig {

    private static final Logger log = LoggerFactory.getLogger(FormalConfig.class);

    public String baseDir = "data";
    public Lexer lexer = new Lexer();
    public Evaluation evaluation = new Evaluation();
    public Hashing hashing = new Hashing();
    public Export export = new Export();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Lexer {
        /** SKIP drops unknown characters with a warning; FAIL raises a lexical error. */
        public UnknownCharacterPolicy unknownCharacters = UnknownCharacterPolicy.SKIP;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Evaluation {
        public AmbiguityPolicy ambiguousReferences = AmbiguityPolicy.FIRST_MATCH;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Hashing {
        /** Hex characters kept from each SHA-256 digest. */
        public int fingerprintLength = Fingerprinter.DEFAULT_LENGTH;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Export {
        public String defaultDomain = "core";
        /** Relative to baseDir. */
        public String outputDir = "brains";
    }

    // -------------------- Load / Create --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой), создаёт дефолтный и пишет на диск.
     */
    public static FormalConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        Optional<String> existing = io.readStringIfExists(configFile);
        if (existing.isEmpty()) {
            FormalConfig created = new FormalConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        String json = existing.get();
        if (json.isBlank()) {
            FormalConfig created = new FormalConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        FormalConfig cfg = mapper.readValue(json, FormalConfig.class);
        if (cfg == null) cfg = new FormalConfig();

        cfg.validate();
        return cfg;
    }

    /**
     * Перезаписывает конфиг на диск (pretty JSON).
     */
    public static void save(FileIO io, Path configFile, ObjectMapper mapper, FormalConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, FormalConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (lexer == null) lexer = new Lexer();
        if (lexer.unknownCharacters == null) lexer.unknownCharacters = UnknownCharacterPolicy.SKIP;

        if (evaluation == null) evaluation = new Evaluation();
        if (evaluation.ambiguousReferences == null) evaluation.ambiguousReferences = AmbiguityPolicy.FIRST_MATCH;

        if (hashing == null) hashing = new Hashing();
        if (hashing.fingerprintLength < Fingerprinter.MIN_LENGTH || hashing.fingerprintLength > Fingerprinter.MAX_LENGTH) {
            log.warn("hashing.fingerprintLength={} out of range [{}, {}], using {}",
                    hashing.fingerprintLength, Fingerprinter.MIN_LENGTH, Fingerprinter.MAX_LENGTH, Fingerprinter.DEFAULT_LENGTH);
            hashing.fingerprintLength = Fingerprinter.DEFAULT_LENGTH;
        }

        if (export == null) export = new Export();
        if (export.defaultDomain == null || export.defaultDomain.isBlank()) export.defaultDomain = "core";
        export.defaultDomain = export.defaultDomain.trim();
        if (export.outputDir == null || export.outputDir.isBlank()) export.outputDir = "brains";
    }
}

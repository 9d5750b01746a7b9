package org.calista.formal.lang.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.formal.io.FileIO;
import org.calista.formal.lang.export.BrainStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * FormalKernel: instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(config) -> loadOrCreate config + init IO, language and brain store
 *   2) use           -> language().evaluate(...), brainStore().save(...)
 *
 * No static singletons: each kernel owns its own settings and stores.
 */
public final class FormalKernel {

    private static final Logger log = LoggerFactory.getLogger(FormalKernel.class);

    private final FileIO io;
    private final FileIO external;
    private final ObjectMapper mapper;
    private final FormalConfig cfg;
    private final FormalLanguage language;
    private final BrainStore brains;

    private FormalKernel(FileIO io,
                         FileIO external,
                         ObjectMapper mapper,
                         FormalConfig cfg,
                         FormalLanguage language,
                         BrainStore brains) {
        this.io = Objects.requireNonNull(io, "io");
        this.external = Objects.requireNonNull(external, "external");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.language = Objects.requireNonNull(language, "language");
        this.brains = Objects.requireNonNull(brains, "brains");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Root directory where config lives.
         * Config is read BEFORE baseDir is known (baseDir is inside config).
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private Clock clock = Clock.systemUTC();

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Loads or creates the config, then wires IO, language and brain store.
         */
        public FormalKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // Config IO (outside baseDir)
            FileIO external = new FileIO(configRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);

            FormalConfig cfg = FormalConfig.loadOrCreate(external, cfgPath, om);

            // Base IO bound to cfg.baseDir (runtime data dir)
            Path base = Path.of(cfg.baseDir);
            FileIO io = new FileIO(base.isAbsolute() ? base : configRoot.resolve(base), charset, true);
            io.ensureBaseDir();

            FormalLanguage language = FormalLanguage.fromConfig(cfg, clock);

            BrainStore brains = new BrainStore(io, om, io.resolve(cfg.export.outputDir));

            FormalKernel k = new FormalKernel(io, external, om, cfg, language, brains);
            k.logCreated(cfgPath);
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    /** IO rooted at the config root, for source files given on the command line. */
    public FileIO externalIo() { return external; }
    public ObjectMapper mapper() { return mapper; }
    public FormalConfig config() { return cfg; }
    public FormalLanguage language() { return language; }
    public BrainStore brainStore() { return brains; }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("FormalKernel created: config={}, baseDir={}, fingerprintLength={}, ambiguity={}",
                cfgPath, io.baseDir(), cfg.hashing.fingerprintLength, cfg.evaluation.ambiguousReferences);
    }
}

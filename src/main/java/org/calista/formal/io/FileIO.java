package org.calista.formal.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

/**
 * FileIO: единая точка I/O для исходников формального языка и артефактов экспорта.
 *
 * <ul>
 *   <li>чтение исходников (включая .gz) целиком в строку</li>
 *   <li>атомарная запись артефактов (tmp + move) с опциональным fsync</li>
 *   <li>пропуск перезаписи, если содержимое не изменилось</li>
 *   <li>безопасный resolve внутри baseDir (anti path traversal)</li>
 * </ul>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    // ----------------------------
    // Options / Builder
    // ----------------------------

    public static final class Options {
        public final Charset charset;
        public final boolean atomicWrites;
        public final boolean fsyncOnCommit;

        private Options(Builder b) {
            this.charset = b.charset;
            this.atomicWrites = b.atomicWrites;
            this.fsyncOnCommit = b.fsyncOnCommit;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private Charset charset = StandardCharsets.UTF_8;
            private boolean atomicWrites = true;
            private boolean fsyncOnCommit = false;

            public Builder charset(Charset v) {
                this.charset = Objects.requireNonNull(v);
                return this;
            }

            public Builder atomicWrites(boolean v) {
                this.atomicWrites = v;
                return this;
            }

            public Builder fsyncOnCommit(boolean v) {
                this.fsyncOnCommit = v;
                return this;
            }

            public Options build() {
                return new Options(this);
            }
        }
    }

    private final Path baseDir;
    private final Options opt;

    public FileIO(Path baseDir) {
        this(baseDir, Options.builder().build());
    }

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this(baseDir, Options.builder()
                .charset(Objects.requireNonNull(charset, "charset"))
                .atomicWrites(atomicWrites)
                .build());
    }

    public FileIO(Path baseDir, Options options) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.opt = Objects.requireNonNull(options, "options");
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}, fsyncOnCommit={}",
                this.baseDir, opt.charset, opt.atomicWrites, opt.fsyncOnCommit);
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists", e);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Резолвит относительный путь внутри baseDir. Абсолютные пути и выход через ".." запрещены.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    /** Для внешних путей (исходники вне sandbox): только нормализация. */
    public Path resolveExternal(Path anyPath) {
        Objects.requireNonNull(anyPath, "anyPath");
        return anyPath.toAbsolutePath().normalize();
    }

    public void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    // ----------------------------
    // Text
    // ----------------------------

    /**
     * Reads a whole file as a string; .gz / .gzip files are decompressed transparently.
     */
    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (isGzip(file)) {
            try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
                return new String(in.readAllBytes(), opt.charset);
            }
        }
        return Files.readString(file, opt.charset);
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!opt.atomicWrites) {
            writeStringDirect(file, content);
            return;
        }

        if (isSameContent(file, content)) {
            log.debug("writeString: skip unchanged content for {}", file);
            return;
        }
        Path tmp = file.resolveSibling(file.getFileName().toString() + ".tmp");
        writeStringDirect(tmp, content);
        atomicCommit(tmp, file);
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private void writeStringDirect(Path file, String content) throws IOException {
        if (isSameContent(file, content)) {
            log.debug("writeStringDirect: skip unchanged content for {}", file);
            return;
        }
        Files.writeString(file, content, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        // fsync tmp до move, иначе после падения можно получить пустой артефакт
        if (opt.fsyncOnCommit) fsync(tmp);

        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.debug("Leftover tmp file {}: {}", tmp, e.toString());
            }
        }
    }

    private void fsync(Path file) {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            log.debug("fsync ignored for {}: {}", file, e.toString());
        }
    }

    private static boolean isGzip(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".gz") || name.endsWith(".gzip");
    }

    private boolean isSameContent(Path file, String content) {
        if (!Files.exists(file)) return false;
        try {
            if (Files.size(file) != content.getBytes(opt.charset).length) return false;
            return Files.readString(file, opt.charset).equals(content);
        } catch (IOException e) {
            // не смогли прочитать, перепишем
            return false;
        }
    }
}

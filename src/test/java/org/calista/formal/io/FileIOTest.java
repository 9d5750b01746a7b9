package org.calista.formal.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class FileIOTest {

    @TempDir
    Path tempDir;

    private FileIO io;

    @BeforeEach
    void setUp() {
        io = new FileIO(tempDir.resolve("base"));
    }

    @Test
    void constructorCreatesBaseDir() {
        assertTrue(Files.isDirectory(tempDir.resolve("base")));
        assertTrue(io.baseDir().isAbsolute());
    }

    @Test
    void resolveStaysInsideBaseDir() {
        assertEquals(io.baseDir().resolve("brains/a.json"), io.resolve("brains/a.json"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve("../escape.json"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve(tempDir.toAbsolutePath().toString()));
    }

    @Test
    void atomicWriteLeavesNoTempFile() throws Exception {
        Path file = io.resolve("out/doc.json");
        io.writeString(file, "{\"a\":1}");

        assertEquals("{\"a\":1}", Files.readString(file));
        assertFalse(Files.exists(file.resolveSibling("doc.json.tmp")));

        io.writeString(file, "{\"a\":2}");
        assertEquals("{\"a\":2}", io.readString(file));
    }

    @Test
    void directWriteWhenAtomicDisabled() throws Exception {
        FileIO direct = new FileIO(tempDir.resolve("direct"), StandardCharsets.UTF_8, false);
        Path file = direct.resolve("x.txt");
        direct.writeString(file, "hello");
        assertEquals("hello", direct.readString(file));
    }

    @Test
    void fsyncOnCommitStillWritesAtomically() throws Exception {
        FileIO durable = new FileIO(tempDir.resolve("durable"), FileIO.Options.builder().fsyncOnCommit(true).build());
        Path file = durable.resolve("brain.json");
        durable.writeString(file, "{}");
        assertEquals("{}", Files.readString(file));
        assertFalse(Files.exists(file.resolveSibling("brain.json.tmp")));
    }

    @Test
    void readStringIfExists() throws Exception {
        Path file = io.resolve("maybe.txt");
        assertTrue(io.readStringIfExists(file).isEmpty());
        io.writeString(file, "here");
        assertEquals("here", io.readStringIfExists(file).orElseThrow());
    }

    @Test
    void gzipFilesAreDecompressed() throws Exception {
        Path file = io.resolve("program.formal.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write("state A { }".getBytes(StandardCharsets.UTF_8));
        }
        assertEquals("state A { }", io.readString(file));
    }
}

package com.williamcallahan.baptismdesk.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContentHasherTest {

    /** SHA-256 of the ASCII bytes "abc". */
    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @TempDir
    Path tempDir;

    private final ContentHasher hasher = new ContentHasher();

    @Test
    void sha256_agreesAcrossBytesStreamsAndFiles() throws Exception {
        byte[] content = "abc".getBytes(StandardCharsets.US_ASCII);
        Path file = Files.write(tempDir.resolve("abc.bin"), content);

        assertEquals(ABC_SHA256, hasher.sha256(content));
        assertEquals(ABC_SHA256, hasher.sha256(new ByteArrayInputStream(content)));
        assertEquals(ABC_SHA256, hasher.sha256(file));
    }

    @Test
    void sha256_wrapsMissingFile() {
        assertThrows(UncheckedIOException.class, () -> hasher.sha256(tempDir.resolve("missing")));
    }
}

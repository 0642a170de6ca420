package com.williamcallahan.baptismdesk.service;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

@Component
public class ContentHasher {

    private static final int BUFFER_SIZE = 2048;

    /**
     * Streams a file through SHA-256 without loading it into memory.
     *
     * @param file the file to hash
     * @return lowercase hexadecimal digest
     * @throws UncheckedIOException if the file cannot be read
     */
    public String sha256(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return sha256(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash " + file, e);
        }
    }

    /**
     * Digests a stream to its end. The caller closes the stream.
     */
    public String sha256(InputStream in) throws IOException {
        MessageDigest md = newDigest();
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer)) != -1) {
            md.update(buffer, 0, read);
        }
        return toHex(md.digest());
    }

    public String sha256(byte[] content) {
        return toHex(newDigest().digest(content));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private static String toHex(byte[] hash) {
        StringBuilder sb = new StringBuilder(hash.length * 2);
        for (byte b : hash) sb.append(String.format("%02x", b));
        return sb.toString();
    }
}

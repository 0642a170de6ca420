package com.williamcallahan.baptismdesk.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageCompressorTest {

    @TempDir
    Path tempDir;

    private final ImageCompressor compressor = new ImageCompressor();

    @Test
    void compress_shrinksLongSideToLimitAndWritesJpeg() throws Exception {
        Path source = writePng("large.png", 3200, 1200);

        byte[] jpeg = compressor.compress(source);

        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(jpeg));
        assertNotNull(decoded);
        assertEquals(ImageCompressor.MAX_DIMENSION, decoded.getWidth());
        assertEquals(600, decoded.getHeight());
        assertEquals((byte) 0xFF, jpeg[0]);
        assertEquals((byte) 0xD8, jpeg[1]);
    }

    @Test
    void compress_neverEnlargesSmallImages() throws Exception {
        Path source = writePng("small.png", 200, 100);

        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(compressor.compress(source)));

        assertEquals(200, decoded.getWidth());
        assertEquals(100, decoded.getHeight());
    }

    @Test
    void resizeToLimit_flattensTransparencyOntoWhite() {
        BufferedImage transparent = new BufferedImage(10, 10, BufferedImage.TYPE_INT_ARGB);

        BufferedImage flattened = compressor.resizeToLimit(transparent);

        assertEquals(BufferedImage.TYPE_INT_RGB, flattened.getType());
        assertEquals(Color.WHITE.getRGB(), flattened.getRGB(5, 5));
    }

    @Test
    void compress_rejectsNonImages() throws Exception {
        Path notAnImage = Files.write(tempDir.resolve("notes.jpg"), "hello".getBytes(StandardCharsets.UTF_8));

        assertThrows(IOException.class, () -> compressor.compress(notAnImage));
    }

    private Path writePng(String name, int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Path file = tempDir.resolve(name);
        ImageIO.write(image, "png", file.toFile());
        return file;
    }
}

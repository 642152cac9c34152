package com.nilsson.imagecropper;

import com.nilsson.imagecropper.model.ImageRecord;
import com.nilsson.imagecropper.model.LoadTimings;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 Shared fixtures for image tests.
 */
public final class TestImages {

    private TestImages() {
    }

    public static BufferedImage solid(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(color);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return image;
    }

    public static Path writePng(Path file, int width, int height, Color color) throws IOException {
        if (!ImageIO.write(solid(width, height, color), "png", file.toFile())) {
            throw new IOException("No PNG writer");
        }
        return file;
    }

    public static Path writeJpg(Path file, int width, int height, Color color) throws IOException {
        if (!ImageIO.write(solid(width, height, color), "jpg", file.toFile())) {
            throw new IOException("No JPEG writer");
        }
        return file;
    }

    public static ImageRecord record(Path path) {
        BufferedImage image = solid(4, 4, Color.GRAY);
        return new ImageRecord(path, image, image, LoadTimings.none());
    }

    /**
     Runs {@code step} until {@code condition} holds or {@code timeout} passes.

     @return Whether the condition was met.
     */
    public static boolean awaitUntil(BooleanSupplier condition, Duration timeout, Runnable step) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            step.run();
            if (condition.getAsBoolean()) return true;
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        step.run();
        return condition.getAsBoolean();
    }
}

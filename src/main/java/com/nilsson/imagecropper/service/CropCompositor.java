package com.nilsson.imagecropper.service;

import com.nilsson.imagecropper.model.CropRect;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 <h2>CropCompositor</h2>
 <p>
 Turns a set of selections on an image into a single output image. One selection is a plain crop;
 several are packed onto one transparent canvas with a shelf layout (tallest first, rows wrapped at
 twice the square root of the total area).
 </p>
 */
public final class CropCompositor {

    private CropCompositor() {
    }

    /**
     Intersects {@code rect} with the image bounds. Negative sizes are normalised first.

     @return Empty when nothing of the selection lies inside the image.
     */
    public static Optional<CropRect> clip(CropRect rect, int imageWidth, int imageHeight) {
        int x = rect.width() < 0 ? rect.x() + rect.width() : rect.x();
        int y = rect.height() < 0 ? rect.y() + rect.height() : rect.y();
        int w = Math.abs(rect.width());
        int h = Math.abs(rect.height());

        int x0 = Math.max(0, x);
        int y0 = Math.max(0, y);
        int x1 = Math.min(imageWidth, x + w);
        int y1 = Math.min(imageHeight, y + h);
        if (x1 <= x0 || y1 <= y0) {
            return Optional.empty();
        }
        return Optional.of(new CropRect(x0, y0, x1 - x0, y1 - y0));
    }

    /**
     Cuts each selection out as an independent image, skipping the ones that clip to nothing.
     */
    public static List<BufferedImage> crop(BufferedImage image, List<CropRect> rects) {
        List<BufferedImage> pieces = new ArrayList<>();
        for (CropRect rect : rects) {
            clip(rect, image.getWidth(), image.getHeight()).ifPresent(r ->
                    pieces.add(ImageResizer.copy(image.getSubimage(r.x(), r.y(), r.width(), r.height()))));
        }
        return pieces;
    }

    /**
     @return The composed output, or empty when every selection was outside the image.
     */
    public static Optional<BufferedImage> compose(BufferedImage image, List<CropRect> rects) {
        List<BufferedImage> pieces = crop(image, rects);
        if (pieces.isEmpty()) return Optional.empty();
        if (pieces.size() == 1) return Optional.of(pieces.get(0));
        return Optional.of(combine(pieces));
    }

    public static BufferedImage combine(List<BufferedImage> pieces) {
        if (pieces.isEmpty()) {
            throw new IllegalArgumentException("Nothing to combine");
        }
        List<int[]> sizes = new ArrayList<>();
        for (BufferedImage piece : pieces) {
            sizes.add(new int[]{piece.getWidth(), piece.getHeight()});
        }
        Layout layout = layout(sizes);

        BufferedImage canvas = new BufferedImage(layout.width(), layout.height(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = canvas.createGraphics();
        try {
            for (Placement p : layout.placements()) {
                g.drawImage(pieces.get(p.index()), p.x(), p.y(), null);
            }
        } finally {
            g.dispose();
        }
        return canvas;
    }

    /**
     Computes where each {@code {width, height}} goes on the canvas.
     */
    public static Layout layout(List<int[]> sizes) {
        List<Integer> order = new ArrayList<>();
        long totalArea = 0;
        for (int i = 0; i < sizes.size(); i++) {
            order.add(i);
            totalArea += (long) sizes.get(i)[0] * sizes.get(i)[1];
        }
        order.sort(Comparator.comparingInt((Integer i) -> sizes.get(i)[1]).reversed());

        long maxRowWidth = (long) Math.ceil(Math.sqrt((double) totalArea)) * 2;

        List<Placement> placements = new ArrayList<>();
        int x = 0;
        int y = 0;
        int rowHeight = 0;
        int canvasWidth = 0;
        int canvasHeight = 0;
        for (int index : order) {
            int w = sizes.get(index)[0];
            int h = sizes.get(index)[1];
            if (x > 0 && (long) x + w > maxRowWidth) {
                y += rowHeight;
                x = 0;
                rowHeight = 0;
            }
            placements.add(new Placement(index, x, y));
            x += w;
            rowHeight = Math.max(rowHeight, h);
            canvasWidth = Math.max(canvasWidth, x);
            canvasHeight = Math.max(canvasHeight, y + h);
        }
        return new Layout(placements, canvasWidth, canvasHeight);
    }

    public record Placement(int index, int x, int y) {
    }

    public record Layout(List<Placement> placements, int width, int height) {
    }
}

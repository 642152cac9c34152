package com.nilsson.imagecropper.service;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 Pixel-level helpers shared by the preloader and the saver: size ceilings, high-quality
 downscaling, display buffer preparation and format-driven flattening.
 */
public final class ImageResizer {

    private ImageResizer() {}

    /**
     Computes the size {@code width x height} must be scaled to so it fits inside
     {@code maxWidth x maxHeight} with its aspect ratio kept. Returns the original size when it
     already fits.
     */
    public static Dimension fitWithin(int width, int height, int maxWidth, int maxHeight) {
        if (width <= maxWidth && height <= maxHeight) {
            return new Dimension(width, height);
        }
        double ratio = (double) width / height;
        int newW;
        int newH;
        if (ratio > (double) maxWidth / maxHeight) {
            newW = maxWidth;
            newH = (int) (maxWidth / ratio);
        } else {
            newW = (int) (maxHeight * ratio);
            newH = maxHeight;
        }
        return new Dimension(Math.max(1, newW), Math.max(1, newH));
    }

    /**
     Downscales {@code img} to exactly {@code newW x newH}.
     <p>Large reductions are done in successive halving passes with bilinear filtering, followed by a
     final bicubic pass, which avoids the aliasing of a single-step bilinear shrink.</p>
     */
    public static BufferedImage resize(BufferedImage img, int newW, int newH) {
        int type = img.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage current = img;
        int w = img.getWidth();
        int h = img.getHeight();

        while (w / 2 >= newW && h / 2 >= newH) {
            w /= 2;
            h /= 2;
            current = draw(current, w, h, type, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        }
        if (w != newW || h != newH || current == img) {
            current = draw(current, newW, newH, type, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        }
        return current;
    }

    /**
     Returns a {@code TYPE_INT_ARGB} view of {@code img}: the same instance when it already has that
     layout, otherwise a converted copy.
     */
    public static BufferedImage toDisplayImage(BufferedImage img) {
        if (img.getType() == BufferedImage.TYPE_INT_ARGB) {
            return img;
        }
        return copy(img, BufferedImage.TYPE_INT_ARGB);
    }

    /**
     Deep copy into a new buffer of the given type.
     */
    public static BufferedImage copy(BufferedImage img, int type) {
        BufferedImage out = new BufferedImage(img.getWidth(), img.getHeight(), type);
        Graphics2D g = out.createGraphics();
        try {
            g.drawImage(img, 0, 0, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    /**
     Deep copy keeping the alpha channel when the source has one.
     */
    public static BufferedImage copy(BufferedImage img) {
        return copy(img, img.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
    }

    /**
     Composites {@code img} over white into an opaque RGB buffer, for containers without alpha.
     */
    public static BufferedImage flattenOnWhite(BufferedImage img) {
        BufferedImage out = new BufferedImage(img.getWidth(), img.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, out.getWidth(), out.getHeight());
            g.drawImage(img, 0, 0, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static BufferedImage draw(BufferedImage src, int w, int h, int type, Object interpolation) {
        BufferedImage dst = new BufferedImage(Math.max(1, w), Math.max(1, h), type);
        Graphics2D g2d = dst.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, interpolation);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.drawImage(src, 0, 0, dst.getWidth(), dst.getHeight(), null);
        } finally {
            g2d.dispose();
        }
        return dst;
    }
}

package com.nilsson.imagecropper.service;

import com.nilsson.imagecropper.TestImages;
import com.nilsson.imagecropper.model.CropRect;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CropCompositorTest {

    // --- Clipping ---

    @Test
    void testClip_intersectsWithBounds() {
        CropRect clipped = CropCompositor.clip(new CropRect(-10, 5, 30, 100), 50, 40).orElseThrow();
        assertEquals(new CropRect(0, 5, 20, 35), clipped);
    }

    @Test
    void testClip_outsideIsEmpty() {
        assertTrue(CropCompositor.clip(new CropRect(60, 0, 10, 10), 50, 40).isEmpty());
        assertTrue(CropCompositor.clip(new CropRect(5, 5, 0, 10), 50, 40).isEmpty());
    }

    @Test
    void testClip_normalisesNegativeSize() {
        assertEquals(new CropRect(10, 10, 20, 5),
                CropCompositor.clip(new CropRect(30, 15, -20, -5), 50, 40).orElseThrow());
    }

    // --- Composition ---

    @Test
    void testCompose_singleSelectionIsPlainCrop() {
        BufferedImage image = TestImages.solid(100, 80, Color.RED);

        BufferedImage out = CropCompositor.compose(image, List.of(new CropRect(10, 10, 30, 20))).orElseThrow();

        assertEquals(30, out.getWidth());
        assertEquals(20, out.getHeight());
        assertEquals(Color.RED.getRGB(), out.getRGB(0, 0));
    }

    @Test
    void testCompose_cropIsDetachedFromSource() {
        BufferedImage image = TestImages.solid(20, 20, Color.RED);
        BufferedImage out = CropCompositor.compose(image, List.of(new CropRect(0, 0, 10, 10))).orElseThrow();

        image.setRGB(0, 0, Color.BLUE.getRGB());

        assertEquals(Color.RED.getRGB(), out.getRGB(0, 0));
    }

    @Test
    void testCompose_allSelectionsOutsideIsEmpty() {
        BufferedImage image = TestImages.solid(10, 10, Color.RED);
        Optional<BufferedImage> out = CropCompositor.compose(image,
                List.of(new CropRect(20, 20, 5, 5), new CropRect(-9, -9, 4, 4)));
        assertTrue(out.isEmpty());
    }

    @Test
    void testCompose_dropsEmptySelectionsButKeepsOthers() {
        BufferedImage image = TestImages.solid(50, 50, Color.GREEN);

        BufferedImage out = CropCompositor.compose(image,
                List.of(new CropRect(100, 100, 5, 5), new CropRect(0, 0, 12, 7))).orElseThrow();

        assertEquals(12, out.getWidth());
        assertEquals(7, out.getHeight());
    }

    // --- Shelf packing ---

    @Test
    void testLayout_tallestFirstOnOneRowWhenItFits() {
        // total area 10*10 + 10*20 = 300, budget ceil(sqrt(300)) * 2 = 36
        CropCompositor.Layout layout = CropCompositor.layout(List.of(new int[]{10, 10}, new int[]{10, 20}));

        assertEquals(1, layout.placements().get(0).index(), "Tallest piece goes first");
        assertEquals(0, layout.placements().get(0).x());
        assertEquals(10, layout.placements().get(1).x());
        assertEquals(20, layout.width());
        assertEquals(20, layout.height());
    }

    @Test
    void testLayout_wrapsWhenRowBudgetExceeded() {
        // area 3 * 100*10 = 3000, budget ceil(54.77) * 2 = 110: second piece would end at 200
        CropCompositor.Layout layout = CropCompositor.layout(List.of(
                new int[]{100, 10}, new int[]{100, 10}, new int[]{100, 10}));

        assertEquals(0, layout.placements().get(1).x());
        assertEquals(10, layout.placements().get(1).y());
        assertEquals(100, layout.width());
        assertEquals(30, layout.height());
    }

    @Test
    void testCombine_transparentBackground() {
        BufferedImage tall = TestImages.solid(10, 20, Color.RED);
        BufferedImage small = TestImages.solid(10, 10, Color.BLUE);

        BufferedImage canvas = CropCompositor.combine(List.of(small, tall));

        assertEquals(BufferedImage.TYPE_INT_ARGB, canvas.getType());
        assertEquals(20, canvas.getWidth());
        assertEquals(20, canvas.getHeight());
        assertEquals(Color.RED.getRGB(), canvas.getRGB(0, 19));
        assertEquals(Color.BLUE.getRGB(), canvas.getRGB(10, 0));
        assertEquals(0, canvas.getRGB(15, 15) >>> 24, "Unused area stays transparent");
    }
}

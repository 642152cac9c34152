package com.nilsson.imagecropper.model;

/**
 A crop selection in image pixel coordinates. May extend past the image; it is clipped before use.
 */
public record CropRect(int x, int y, int width, int height) {
}

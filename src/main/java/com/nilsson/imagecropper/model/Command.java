package com.nilsson.imagecropper.model;

import java.util.List;

/**
 A discrete operator command decoded by the front end.
 */
public record Command(Type type, List<CropRect> rects) {

    public enum Type {
        ADVANCE, GO_BACK, DELETE, CROP, RESTART, REQUEST_SHUTDOWN
    }

    public Command {
        rects = rects == null ? List.of() : List.copyOf(rects);
    }

    public static Command of(Type type) {
        return new Command(type, List.of());
    }

    public static Command crop(List<CropRect> rects) {
        return new Command(Type.CROP, rects);
    }
}

package com.nilsson.imagecropper.main;

import com.nilsson.imagecropper.model.Command;

import java.util.List;

/**
 Where operator commands come from. Implementations must not block in {@link #drain()}.
 */
public interface CommandSource extends AutoCloseable {

    /**
     @return Commands received since the previous call, oldest first.
     */
    List<Command> drain();

    @Override
    default void close() {
    }
}

package com.nilsson.imagecropper.main;

import com.nilsson.imagecropper.model.Command;
import com.nilsson.imagecropper.model.CropRect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 <h2>ConsoleCommandSource</h2>
 <p>
 Reads one command per line from a stream on a background daemon thread:
 </p>
 <ul>
 <li>{@code n} advance, {@code b} back, {@code d} delete, {@code r} restart, {@code q} quit</li>
 <li>{@code c x,y,w,h [x,y,w,h ...]} crop to one or more rectangles</li>
 </ul>
 <p>
 End of input counts as a quit request.
 </p>
 */
public class ConsoleCommandSource implements CommandSource {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleCommandSource.class);

    private final Queue<Command> received = new ConcurrentLinkedQueue<>();
    private final Thread reader;
    private volatile boolean closed;

    public ConsoleCommandSource(InputStream input) {
        BufferedReader lines = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        this.reader = new Thread(() -> readLoop(lines), "Console-Reader");
        this.reader.setDaemon(true);
    }

    public ConsoleCommandSource start() {
        reader.start();
        return this;
    }

    @Override
    public List<Command> drain() {
        List<Command> drained = new ArrayList<>();
        Command command;
        while ((command = received.poll()) != null) {
            drained.add(command);
        }
        return drained;
    }

    @Override
    public void close() {
        closed = true;
        reader.interrupt();
    }

    private void readLoop(BufferedReader lines) {
        try {
            String line;
            while (!closed && (line = lines.readLine()) != null) {
                Optional<Command> command = parse(line);
                if (command.isPresent()) {
                    received.add(command.get());
                } else if (!line.isBlank()) {
                    logger.warn("Unknown command '{}'. Use n, b, d, r, q or c x,y,w,h ...", line.trim());
                }
            }
        } catch (IOException e) {
            logger.error("Console input failed", e);
        }
        if (!closed) {
            received.add(Command.of(Command.Type.REQUEST_SHUTDOWN));
        }
    }

    /**
     Parses a single console line. Blank or malformed lines yield empty.
     */
    public static Optional<Command> parse(String line) {
        if (line == null) return Optional.empty();
        String[] tokens = line.trim().split("\\s+");
        if (tokens.length == 0 || tokens[0].isEmpty()) return Optional.empty();

        String verb = tokens[0].toLowerCase(Locale.ROOT);
        switch (verb) {
            case "n":
                return Optional.of(Command.of(Command.Type.ADVANCE));
            case "b":
                return Optional.of(Command.of(Command.Type.GO_BACK));
            case "d":
                return Optional.of(Command.of(Command.Type.DELETE));
            case "r":
                return Optional.of(Command.of(Command.Type.RESTART));
            case "q":
                return Optional.of(Command.of(Command.Type.REQUEST_SHUTDOWN));
            case "c":
                return parseCrop(tokens);
            default:
                return Optional.empty();
        }
    }

    private static Optional<Command> parseCrop(String[] tokens) {
        List<CropRect> rects = new ArrayList<>();
        for (int i = 1; i < tokens.length; i++) {
            String[] parts = tokens[i].split(",");
            if (parts.length != 4) {
                return Optional.empty();
            }
            try {
                rects.add(new CropRect(
                        Integer.parseInt(parts[0].trim()),
                        Integer.parseInt(parts[1].trim()),
                        Integer.parseInt(parts[2].trim()),
                        Integer.parseInt(parts[3].trim())));
            } catch (NumberFormatException e) {
                logger.debug("Bad crop rectangle '{}'", tokens[i]);
                return Optional.empty();
            }
        }
        return Optional.of(Command.crop(rects));
    }
}

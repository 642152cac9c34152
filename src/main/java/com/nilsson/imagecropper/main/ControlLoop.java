package com.nilsson.imagecropper.main;

import com.nilsson.imagecropper.controller.NavigationController;
import com.nilsson.imagecropper.model.Command;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 Single-threaded driver: feed commands, tick, report status changes, repeat until the controller terminates.
 */
public class ControlLoop {

    private final NavigationController controller;
    private final CommandSource commands;
    private final Consumer<String> statusSink;
    private final Duration tickInterval;

    public ControlLoop(NavigationController controller, CommandSource commands,
                       Consumer<String> statusSink, Duration tickInterval) {
        this.controller = controller;
        this.commands = commands;
        this.statusSink = statusSink;
        this.tickInterval = tickInterval;
    }

    public void run() throws InterruptedException {
        String lastStatus = null;
        while (!controller.isTerminated()) {
            for (Command command : commands.drain()) {
                controller.handle(command);
            }
            controller.tick();

            String status = controller.getStatus();
            if (!Objects.equals(status, lastStatus)) {
                statusSink.accept(status);
                lastStatus = status;
            }
            if (!controller.isTerminated()) {
                Thread.sleep(tickInterval.toMillis());
            }
        }
    }
}

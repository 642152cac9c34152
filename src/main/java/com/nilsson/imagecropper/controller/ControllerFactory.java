package com.nilsson.imagecropper.controller;

import com.nilsson.imagecropper.data.CropperSettings;
import com.nilsson.imagecropper.service.ImagePreloader;
import com.nilsson.imagecropper.service.ImageSaver;

import javax.inject.Inject;
import java.nio.file.Path;
import java.util.List;

/**
 Builds a {@link NavigationController} for a scanned file list with the injected workers.
 */
public class ControllerFactory {

    private final ImagePreloader preloader;
    private final ImageSaver saver;
    private final CropperSettings settings;

    @Inject
    public ControllerFactory(ImagePreloader preloader, ImageSaver saver, CropperSettings settings) {
        this.preloader = preloader;
        this.saver = saver;
        this.settings = settings;
    }

    public NavigationController create(List<Path> files) {
        return new NavigationController(files, preloader, saver, settings,
                new ExitCoordinator(settings.getForceExitThreshold()));
    }
}

package com.nilsson.imagecropper.main;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.nilsson.imagecropper.controller.ControllerFactory;
import com.nilsson.imagecropper.data.CropperSettings;
import com.nilsson.imagecropper.service.DirectoryScanner;
import com.nilsson.imagecropper.service.ImageDecoder;
import com.nilsson.imagecropper.service.ImageEncoder;
import com.nilsson.imagecropper.service.ImagePreloader;
import com.nilsson.imagecropper.service.ImageSaver;
import com.nilsson.imagecropper.service.metadata.MetadataTransplanter;
import com.nilsson.imagecropper.service.metadata.SourceMetadataReader;

public class AppModule extends AbstractModule {

    private final CropperSettings settings;

    public AppModule(CropperSettings settings) {
        this.settings = settings;
    }

    @Override
    protected void configure() {
        bind(CropperSettings.class).toInstance(settings);
        bind(DirectoryScanner.class).in(Singleton.class);
        bind(ImageDecoder.class).in(Singleton.class);
        bind(ImageEncoder.class).in(Singleton.class);
        bind(SourceMetadataReader.class).in(Singleton.class);
        bind(MetadataTransplanter.class).in(Singleton.class);
        bind(ControllerFactory.class).in(Singleton.class);
    }

    /**
     Decode pool, sized by {@code loaderThreads}. Workers are daemon threads.
     */
    @Provides
    @Singleton
    public ImagePreloader providePreloader(ImageDecoder decoder) {
        return new ImagePreloader(decoder, settings.getLoaderThreads());
    }

    /**
     Encode pool, sized by {@code saverThreads}. Workers are daemon threads.
     */
    @Provides
    @Singleton
    public ImageSaver provideSaver(ImageEncoder encoder, MetadataTransplanter transplanter) {
        return new ImageSaver(encoder, transplanter, settings.getSaverThreads());
    }
}

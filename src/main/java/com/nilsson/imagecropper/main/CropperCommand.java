package com.nilsson.imagecropper.main;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.nilsson.imagecropper.controller.ControllerFactory;
import com.nilsson.imagecropper.controller.NavigationController;
import com.nilsson.imagecropper.data.CropperSettings;
import com.nilsson.imagecropper.data.SettingsRepository;
import com.nilsson.imagecropper.model.OutputFormat;
import com.nilsson.imagecropper.service.DirectoryScanner;
import com.nilsson.imagecropper.service.ImagePreloader;
import com.nilsson.imagecropper.service.ImageSaver;
import com.nilsson.imagecropper.service.ScanException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

/**
 <h2>CropperCommand</h2>
 <p>
 Command line entry: loads {@link CropperSettings}, applies flag overrides, scans the given
 directories and runs the console control loop until the operator quits.
 </p>
 <p>Exit codes: 0 normal, 1 startup failure (bad settings, nothing to process).</p>
 */
@Command(
        name = "imagecropper",
        description = "Keyboard-driven image triage: crop, convert and delete with background saving",
        mixinStandardHelpOptions = true,
        version = "imagecropper 1.0.0"
)
public class CropperCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(CropperCommand.class);

    static final Duration TICK_INTERVAL = Duration.ofMillis(16);
    static final Duration SAVER_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    @Parameters(arity = "1..*", paramLabel = "<directory>", description = "Directories or files to process")
    List<Path> roots = new ArrayList<>();

    @Option(names = {"-q", "--quality"}, description = "Output quality for lossy formats (1-100)")
    Integer quality;

    @Option(names = {"-f", "--format"}, description = "Output format: jpg, png or webp")
    String format;

    @Option(names = "--resave", description = "Convert images to the output format when navigating away")
    boolean resave;

    @Option(names = "--dry-run", description = "Skip destructive operations and just log what would happen")
    boolean dryRun;

    @Option(names = {"-r", "--recursive"}, description = "Descend into subdirectories")
    boolean recursive;

    @Option(names = "--no-shuffle", description = "Keep the scanned order instead of shuffling")
    boolean noShuffle;

    @Override
    public Integer call() throws Exception {
        CropperSettings settings;
        try {
            settings = applyTo(new SettingsRepository().load());
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Startup failed: {}", e.getMessage());
            return 1;
        }

        Injector injector = Guice.createInjector(new AppModule(settings));

        List<Path> files;
        try {
            files = new ArrayList<>(injector.getInstance(DirectoryScanner.class)
                    .requireImages(roots, settings.isRecursive()));
        } catch (ScanException e) {
            logger.error("Startup failed: {}", e.getMessage());
            return 1;
        }
        if (settings.isShuffle()) {
            Collections.shuffle(files);
        }
        logger.info("Found {} image(s), output {} at quality {}{}", files.size(),
                settings.getOutputFormat().extension(), settings.getQuality(),
                settings.isDryRun() ? " (dry run)" : "");

        ImagePreloader preloader = injector.getInstance(ImagePreloader.class);
        ImageSaver saver = injector.getInstance(ImageSaver.class);
        NavigationController controller = injector.getInstance(ControllerFactory.class).create(files);

        try (ConsoleCommandSource console = new ConsoleCommandSource(System.in).start()) {
            controller.start();
            new ControlLoop(controller, console, status -> logger.info("{}", status), TICK_INTERVAL).run();
        } finally {
            preloader.shutdown();
            if (!controller.isForcedExit() && !saver.shutdown(SAVER_DRAIN_TIMEOUT)) {
                logger.warn("Saver did not finish within {}s", SAVER_DRAIN_TIMEOUT.toSeconds());
            }
        }
        return 0;
    }

    /**
     Overlays the flags given on the command line onto {@code settings}.
     */
    CropperSettings applyTo(CropperSettings settings) {
        if (quality != null) settings.setQuality(quality);
        if (format != null) settings.setOutputFormat(OutputFormat.fromName(format));
        if (resave) settings.setResaveOnLeave(true);
        if (dryRun) settings.setDryRun(true);
        if (recursive) settings.setRecursive(true);
        if (noShuffle) settings.setShuffle(false);
        return settings.validated();
    }
}

package com.nilsson.imagecropper.main;

import picocli.CommandLine;

/**
 <h2>Launcher</h2>
 <p>
 Entry point for the <b>Image Cropper</b>. Hands the arguments to {@link CropperCommand} and exits
 with its status code.
 </p>
 */
public class Launcher {

    // ------------------------------------------------------------------------
    // Entry Point
    // ------------------------------------------------------------------------

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CropperCommand()).execute(args);
        System.exit(exitCode);
    }
}

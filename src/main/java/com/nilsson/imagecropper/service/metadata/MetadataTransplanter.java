package com.nilsson.imagecropper.service.metadata;

import com.nilsson.imagecropper.model.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 <h2>MetadataTransplanter</h2>
 <p>
 Copies the ICC profile and EXIF block of an original image into a freshly encoded file, in place.
 This is best-effort: any failure is logged and the encoded file is left exactly as the encoder wrote it.
 </p>
 <ul>
 <li><b>JPG:</b> {@code APP1 Exif} and {@code APP2 ICC_PROFILE} segments after SOI/APP0.</li>
 <li><b>PNG:</b> {@code iCCP} and {@code eXIf} chunks after IHDR.</li>
 <li><b>WEBP:</b> not supported, nothing is written.</li>
 </ul>
 */
public class MetadataTransplanter {

    private static final Logger logger = LoggerFactory.getLogger(MetadataTransplanter.class);

    private final SourceMetadataReader reader;

    @Inject
    public MetadataTransplanter(SourceMetadataReader reader) {
        this.reader = reader;
    }

    /**
     @param source  The original file, wherever it currently lives.
     @param encoded The new file to rewrite. Must not be visible at its final location yet.
     @return {@code true} if at least one block was embedded.
     */
    public boolean transplant(Path source, Path encoded, OutputFormat format) {
        if (!format.supportsIccProfile() && !format.supportsExif()) {
            return false;
        }
        try {
            SourceMetadata metadata = reader.read(source)
                    .restrictTo(format.supportsIccProfile(), format.supportsExif());
            if (metadata.isEmpty()) {
                return false;
            }

            byte[] bytes = Files.readAllBytes(encoded);
            byte[] spliced = switch (format) {
                case JPG -> JpegSegments.splice(bytes, metadata);
                case PNG -> PngChunks.splice(bytes, metadata);
                case WEBP -> bytes;
            };
            Files.write(encoded, spliced);
            logger.debug("Copied metadata from {} into {} (icc={}, exif={})", source.getFileName(),
                    encoded.getFileName(), metadata.hasIccProfile(), metadata.hasExif());
            return true;
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not copy metadata from {}: {}", source.getFileName(), e.getMessage());
            return false;
        }
    }
}

package com.nilsson.imagecropper.service.metadata;

import com.drew.imaging.FileType;
import com.drew.imaging.FileTypeDetector;
import com.drew.imaging.jpeg.JpegProcessingException;
import com.drew.imaging.jpeg.JpegSegmentData;
import com.drew.imaging.jpeg.JpegSegmentReader;
import com.drew.imaging.jpeg.JpegSegmentType;
import com.drew.imaging.png.PngChunk;
import com.drew.imaging.png.PngChunkReader;
import com.drew.imaging.png.PngProcessingException;
import com.drew.lang.StreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 <h2>SourceMetadataReader</h2>
 <p>
 Pulls the raw ICC profile and EXIF block out of an original image using metadata-extractor's
 segment and chunk readers. Only JPEG ({@code APP1} / {@code APP2}) and PNG ({@code iCCP} /
 {@code eXIf}) sources are inspected; anything else yields {@link SourceMetadata#empty()}.
 </p>
 */
public class SourceMetadataReader {

    private static final Logger logger = LoggerFactory.getLogger(SourceMetadataReader.class);

    static final byte[] EXIF_PREAMBLE = {'E', 'x', 'i', 'f', 0, 0};
    static final byte[] ICC_PREAMBLE = {'I', 'C', 'C', '_', 'P', 'R', 'O', 'F', 'I', 'L', 'E', 0};

    public SourceMetadata read(Path file) throws IOException {
        FileType type;
        try (BufferedInputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            type = FileTypeDetector.detectFileType(in);
        }

        try {
            switch (type) {
                case Jpeg:
                    return readJpeg(file);
                case Png:
                    return readPng(file);
                default:
                    logger.debug("No metadata transplant support for {} ({})", file.getFileName(), type);
                    return SourceMetadata.empty();
            }
        } catch (JpegProcessingException | PngProcessingException e) {
            throw new IOException("Unable to parse " + file + ": " + e.getMessage(), e);
        }
    }

    // --- JPEG ---

    private SourceMetadata readJpeg(Path file) throws IOException, JpegProcessingException {
        JpegSegmentData segments = JpegSegmentReader.readSegments(file.toFile(),
                List.of(JpegSegmentType.APP1, JpegSegmentType.APP2));

        byte[] exif = null;
        for (byte[] segment : segments.getSegments(JpegSegmentType.APP1)) {
            if (startsWith(segment, EXIF_PREAMBLE)) {
                exif = Arrays.copyOfRange(segment, EXIF_PREAMBLE.length, segment.length);
                break;
            }
        }

        // ICC profiles larger than one segment are split and carry a 1-based sequence number
        Map<Integer, byte[]> iccParts = new TreeMap<>();
        for (byte[] segment : segments.getSegments(JpegSegmentType.APP2)) {
            if (startsWith(segment, ICC_PREAMBLE) && segment.length > ICC_PREAMBLE.length + 2) {
                int sequence = segment[ICC_PREAMBLE.length] & 0xFF;
                iccParts.put(sequence, Arrays.copyOfRange(segment, ICC_PREAMBLE.length + 2, segment.length));
            }
        }
        byte[] icc = null;
        if (!iccParts.isEmpty()) {
            ByteArrayOutputStream joined = new ByteArrayOutputStream();
            for (byte[] part : iccParts.values()) {
                joined.write(part);
            }
            icc = joined.toByteArray();
        }
        return new SourceMetadata(icc, exif);
    }

    // --- PNG ---

    private SourceMetadata readPng(Path file) throws IOException, PngProcessingException {
        byte[] icc = null;
        byte[] exif = null;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            Iterable<PngChunk> chunks = new PngChunkReader().extract(new StreamReader(in), null);
            for (PngChunk chunk : chunks) {
                String id = chunk.getType().getIdentifier();
                if ("iCCP".equals(id)) {
                    icc = inflateIccp(chunk.getBytes());
                } else if ("eXIf".equals(id)) {
                    exif = chunk.getBytes();
                }
            }
        }
        return new SourceMetadata(icc, exif);
    }

    /**
     iCCP layout: profile name, NUL, compression method (always 0 = zlib), compressed profile.
     */
    static byte[] inflateIccp(byte[] chunk) throws IOException {
        int nul = 0;
        while (nul < chunk.length && chunk[nul] != 0) nul++;
        int dataStart = nul + 2;
        if (dataStart >= chunk.length) {
            throw new IOException("Truncated iCCP chunk");
        }

        Inflater inflater = new Inflater();
        try {
            inflater.setInput(chunk, dataStart, chunk.length - dataStart);
            ByteArrayOutputStream out = new ByteArrayOutputStream(chunk.length * 4);
            byte[] buffer = new byte[8192];
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new IOException("Corrupt iCCP profile data");
                }
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new IOException("Corrupt iCCP profile data", e);
        } finally {
            inflater.end();
        }
    }

    static boolean startsWith(byte[] data, byte[] prefix) {
        if (data == null || data.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) return false;
        }
        return true;
    }
}

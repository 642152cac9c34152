package com.nilsson.imagecropper.service.metadata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 Rewrites the marker segments at the head of an encoded JPEG so it carries a given EXIF block and ICC profile.
 Everything from the first SOS marker onward is copied untouched.
 */
final class JpegSegments {

    private static final Logger logger = LoggerFactory.getLogger(JpegSegments.class);

    private static final int SOI = 0xD8;
    private static final int EOI = 0xD9;
    private static final int SOS = 0xDA;
    private static final int APP0 = 0xE0;
    private static final int APP1 = 0xE1;
    private static final int APP2 = 0xE2;

    private static final int MAX_SEGMENT_PAYLOAD = 0xFFFF - 2;
    // 12 byte preamble + sequence number + chunk count
    static final int MAX_ICC_CHUNK = MAX_SEGMENT_PAYLOAD - SourceMetadataReader.ICC_PREAMBLE.length - 2;

    private JpegSegments() {
    }

    static byte[] splice(byte[] jpeg, SourceMetadata metadata) throws IOException {
        if (jpeg.length < 4 || (jpeg[0] & 0xFF) != 0xFF || (jpeg[1] & 0xFF) != SOI) {
            throw new IOException("Not a JPEG stream");
        }

        ByteArrayOutputStream head = new ByteArrayOutputStream();
        ByteArrayOutputStream rest = new ByteArrayOutputStream(jpeg.length);
        boolean inserted = false;

        int pos = 2;
        while (pos < jpeg.length) {
            if ((jpeg[pos] & 0xFF) != 0xFF) {
                throw new IOException("Malformed JPEG: expected marker at offset " + pos);
            }
            int markerStart = pos;
            // fill bytes
            while (pos < jpeg.length && (jpeg[pos] & 0xFF) == 0xFF) pos++;
            if (pos >= jpeg.length) break;
            int marker = jpeg[pos] & 0xFF;
            pos++;

            if (marker == SOS || marker == EOI) {
                if (!inserted) {
                    writeMetadata(head, metadata);
                    inserted = true;
                }
                rest.write(jpeg, markerStart, jpeg.length - markerStart);
                break;
            }
            if (isStandalone(marker)) {
                rest.write(jpeg, markerStart, pos - markerStart);
                continue;
            }

            if (pos + 2 > jpeg.length) {
                throw new IOException("Malformed JPEG: truncated segment length");
            }
            int length = ((jpeg[pos] & 0xFF) << 8) | (jpeg[pos + 1] & 0xFF);
            int end = pos + length;
            if (length < 2 || end > jpeg.length) {
                throw new IOException("Malformed JPEG: bad segment length " + length);
            }
            int payloadStart = pos + 2;

            if (isReplaced(marker, jpeg, payloadStart, end)) {
                pos = end;
                continue;
            }
            if (!inserted && marker != APP0) {
                writeMetadata(head, metadata);
                inserted = true;
            }
            (inserted ? rest : head).write(jpeg, markerStart, end - markerStart);
            pos = end;
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(jpeg.length + head.size() + 64);
        out.write(0xFF);
        out.write(SOI);
        head.writeTo(out);
        rest.writeTo(out);
        return out.toByteArray();
    }

    private static boolean isStandalone(int marker) {
        return marker == 0x01 || (marker >= 0xD0 && marker <= 0xD7);
    }

    private static boolean isReplaced(int marker, byte[] data, int from, int to) {
        if (marker == APP1) return regionStartsWith(data, from, to, SourceMetadataReader.EXIF_PREAMBLE);
        if (marker == APP2) return regionStartsWith(data, from, to, SourceMetadataReader.ICC_PREAMBLE);
        return false;
    }

    private static boolean regionStartsWith(byte[] data, int from, int to, byte[] prefix) {
        if (to - from < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (data[from + i] != prefix[i]) return false;
        }
        return true;
    }

    private static void writeMetadata(ByteArrayOutputStream out, SourceMetadata metadata) throws IOException {
        if (metadata.hasExif()) {
            byte[] exif = metadata.exif();
            int payload = SourceMetadataReader.EXIF_PREAMBLE.length + exif.length;
            if (payload > MAX_SEGMENT_PAYLOAD) {
                logger.debug("EXIF block of {} bytes does not fit a single APP1 segment, skipping", exif.length);
            } else {
                writeHeader(out, APP1, payload);
                out.write(SourceMetadataReader.EXIF_PREAMBLE);
                out.write(exif);
            }
        }

        if (metadata.hasIccProfile()) {
            byte[] icc = metadata.iccProfile();
            int count = (icc.length + MAX_ICC_CHUNK - 1) / MAX_ICC_CHUNK;
            if (count > 255) {
                logger.debug("ICC profile of {} bytes is too large to embed, skipping", icc.length);
                return;
            }
            for (int seq = 0; seq < count; seq++) {
                int from = seq * MAX_ICC_CHUNK;
                int len = Math.min(MAX_ICC_CHUNK, icc.length - from);
                writeHeader(out, APP2, SourceMetadataReader.ICC_PREAMBLE.length + 2 + len);
                out.write(SourceMetadataReader.ICC_PREAMBLE);
                out.write(seq + 1);
                out.write(count);
                out.write(icc, from, len);
            }
        }
    }

    private static void writeHeader(ByteArrayOutputStream out, int marker, int payloadLength) {
        int length = payloadLength + 2;
        out.write(0xFF);
        out.write(marker);
        out.write((length >>> 8) & 0xFF);
        out.write(length & 0xFF);
    }
}

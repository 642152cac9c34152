package com.nilsson.imagecropper.service.metadata;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.zip.CRC32;
import java.util.zip.Deflater;

/**
 Rewrites an encoded PNG so it carries an {@code iCCP} and/or {@code eXIf} chunk, placed right after {@code IHDR}.
 Existing colour-space and EXIF chunks that would conflict are dropped.
 */
final class PngChunks {

    static final byte[] SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};
    static final String PROFILE_NAME = "ICC Profile";

    private PngChunks() {
    }

    static byte[] splice(byte[] png, SourceMetadata metadata) throws IOException {
        if (png.length < SIGNATURE.length || !Arrays.equals(Arrays.copyOf(png, SIGNATURE.length), SIGNATURE)) {
            throw new IOException("Not a PNG stream");
        }

        Set<String> dropped = new HashSet<>();
        if (metadata.hasIccProfile()) {
            dropped.add("iCCP");
            dropped.add("sRGB");
        }
        if (metadata.hasExif()) {
            dropped.add("eXIf");
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(png.length + 1024);
        out.write(SIGNATURE);

        int pos = SIGNATURE.length;
        boolean inserted = false;
        while (pos + 12 <= png.length) {
            int length = readInt(png, pos);
            int end = pos + 12 + length;
            if (length < 0 || end > png.length) {
                throw new IOException("Malformed PNG: bad chunk length " + length);
            }
            String type = new String(png, pos + 4, 4, StandardCharsets.ISO_8859_1);

            if (!dropped.contains(type)) {
                out.write(png, pos, end - pos);
            }
            if (!inserted && "IHDR".equals(type)) {
                if (metadata.hasIccProfile()) {
                    writeChunk(out, "iCCP", iccpPayload(metadata.iccProfile()));
                }
                if (metadata.hasExif()) {
                    writeChunk(out, "eXIf", metadata.exif());
                }
                inserted = true;
            }
            pos = end;
        }
        if (!inserted) {
            throw new IOException("Malformed PNG: missing IHDR");
        }
        return out.toByteArray();
    }

    private static byte[] iccpPayload(byte[] profile) {
        ByteArrayOutputStream payload = new ByteArrayOutputStream(profile.length / 2 + 32);
        byte[] name = PROFILE_NAME.getBytes(StandardCharsets.ISO_8859_1);
        payload.write(name, 0, name.length);
        payload.write(0);
        payload.write(0); // zlib

        Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
        try {
            deflater.setInput(profile);
            deflater.finish();
            byte[] buffer = new byte[8192];
            while (!deflater.finished()) {
                int n = deflater.deflate(buffer);
                payload.write(buffer, 0, n);
            }
        } finally {
            deflater.end();
        }
        return payload.toByteArray();
    }

    private static void writeChunk(ByteArrayOutputStream out, String type, byte[] data) {
        byte[] typeBytes = type.getBytes(StandardCharsets.ISO_8859_1);
        writeInt(out, data.length);
        out.write(typeBytes, 0, 4);
        out.write(data, 0, data.length);

        CRC32 crc = new CRC32();
        crc.update(typeBytes);
        crc.update(data);
        writeInt(out, (int) crc.getValue());
    }

    private static int readInt(byte[] data, int pos) {
        return ((data[pos] & 0xFF) << 24) | ((data[pos + 1] & 0xFF) << 16)
                | ((data[pos + 2] & 0xFF) << 8) | (data[pos + 3] & 0xFF);
    }

    private static void writeInt(ByteArrayOutputStream out, int value) {
        out.write((value >>> 24) & 0xFF);
        out.write((value >>> 16) & 0xFF);
        out.write((value >>> 8) & 0xFF);
        out.write(value & 0xFF);
    }
}

package com.nilsson.imagecropper.service.metadata;

/**
 Embedded metadata worth carrying over from an original to its replacement.

 @param iccProfile Raw ICC profile bytes, or {@code null}.
 @param exif       A TIFF-structured EXIF block without the JPEG {@code "Exif\0\0"} preamble, or {@code null}.
 */
public record SourceMetadata(byte[] iccProfile, byte[] exif) {

    public static SourceMetadata empty() {
        return new SourceMetadata(null, null);
    }

    public boolean hasIccProfile() {
        return iccProfile != null && iccProfile.length > 0;
    }

    public boolean hasExif() {
        return exif != null && exif.length > 0;
    }

    public boolean isEmpty() {
        return !hasIccProfile() && !hasExif();
    }

    /**
     Drops the parts a target container cannot carry.
     */
    public SourceMetadata restrictTo(boolean keepIcc, boolean keepExif) {
        return new SourceMetadata(keepIcc ? iccProfile : null, keepExif ? exif : null);
    }
}

package com.flagship.bookkeeping.attachment;

import java.util.Locale;
import java.util.Optional;

/**
 * MIME types accepted for receipt attachments.
 */
public enum AttachmentMimeType {
    JPEG("image/jpeg", ".jpg", ".jpeg"),
    PNG("image/png", ".png"),
    PDF("application/pdf", ".pdf");

    private final String value;
    private final String[] extensions;

    AttachmentMimeType(String value, String... extensions) {
        this.value = value;
        this.extensions = extensions;
    }

    public String getValue() {
        return value;
    }

    public static Optional<AttachmentMimeType> fromValue(String mimeType) {
        if (mimeType == null) {
            return Optional.empty();
        }
        String normalized = mimeType.trim().toLowerCase(Locale.ROOT);
        for (AttachmentMimeType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Guesses the type from a file name extension.
     */
    public static Optional<AttachmentMimeType> guessFromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String lower = fileName.trim().toLowerCase(Locale.ROOT);
        for (AttachmentMimeType type : values()) {
            for (String extension : type.extensions) {
                if (lower.endsWith(extension)) {
                    return Optional.of(type);
                }
            }
        }
        return Optional.empty();
    }
}

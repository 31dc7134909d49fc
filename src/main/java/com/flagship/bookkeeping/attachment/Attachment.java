package com.flagship.bookkeeping.attachment;

import lombok.ToString;
import lombok.Value;

import java.util.UUID;

/**
 * Receipt image or PDF attached to an entry (at most one per entry).
 *
 * The content array is copied on the way in and out.
 */
@Value
public class Attachment {
    UUID entryUuid;
    String fileName;
    AttachmentMimeType mimeType;
    @ToString.Exclude
    byte[] content;

    public Attachment(UUID entryUuid, String fileName, AttachmentMimeType mimeType, byte[] content) {
        this.entryUuid = entryUuid;
        this.fileName = fileName;
        this.mimeType = mimeType;
        this.content = content.clone();
    }

    public byte[] getContent() {
        return content.clone();
    }

    @ToString.Include
    public int getSize() {
        return content.length;
    }
}

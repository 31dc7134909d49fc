package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.attachment.Attachment;
import lombok.Value;

import java.util.UUID;

@Value
public class AttachmentResponse {

    @JsonProperty("entry_uuid")
    UUID entryUuid;

    @JsonProperty("file_name")
    String fileName;

    @JsonProperty("mime_type")
    String mimeType;

    @JsonProperty("size")
    int size;

    public static AttachmentResponse from(Attachment attachment) {
        return new AttachmentResponse(attachment.getEntryUuid(), attachment.getFileName(),
            attachment.getMimeType().getValue(), attachment.getSize());
    }
}

package com.flagship.bookkeeping.attachment;

import com.flagship.bookkeeping.result.LedgerResult;

import java.util.Optional;
import java.util.UUID;

/**
 * Blob store for entry attachments, keyed by entry identity.
 *
 * The ledger only calls {@link #exists} and {@link #delete} when it deletes an entry;
 * everything else about an attachment's lifecycle belongs to the caller.
 */
public interface AttachmentStore {

    Optional<Attachment> get(UUID entryUuid);

    boolean exists(UUID entryUuid);

    /**
     * Stores or replaces the attachment of an existing entry.
     *
     * @param mimeType may be null, in which case it is guessed from {@code fileName}
     */
    LedgerResult<Attachment> put(UUID entryUuid, byte[] content, String mimeType, String fileName);

    /**
     * Removes the attachment if there is one.
     *
     * @return true if an attachment was removed
     */
    LedgerResult<Boolean> delete(UUID entryUuid);
}

package com.flagship.bookkeeping.attachment;

import com.flagship.bookkeeping.config.LedgerProperties;
import com.flagship.bookkeeping.result.ErrorKind;
import com.flagship.bookkeeping.result.LedgerError;
import com.flagship.bookkeeping.result.LedgerResult;
import com.flagship.bookkeeping.storage.LedgerWriteSerializer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Attachment store backed by {@code gl_entry_attachment} in the ledger database.
 * Writes go through the ledger write serializer; called from inside an entry delete they
 * join that transaction.
 */
@Repository
@Slf4j
public class JdbcAttachmentStore implements AttachmentStore {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerWriteSerializer writeSerializer;
    private final long maxBytes;

    public JdbcAttachmentStore(JdbcTemplate jdbcTemplate,
                               LedgerWriteSerializer writeSerializer,
                               LedgerProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.writeSerializer = writeSerializer;
        this.maxBytes = properties.getAttachment().getMaxBytes();
    }

    @Override
    public Optional<Attachment> get(UUID entryUuid) {
        List<Attachment> rows = jdbcTemplate.query(
            "SELECT entry_uuid, file_name, mime_type, file_blob FROM gl_entry_attachment WHERE entry_uuid = ?",
            attachmentRowMapper(),
            entryUuid.toString()
        );
        return rows.stream().findFirst();
    }

    @Override
    public boolean exists(UUID entryUuid) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM gl_entry_attachment WHERE entry_uuid = ?",
            Integer.class,
            entryUuid.toString()
        );
        return count != null && count > 0;
    }

    @Override
    public LedgerResult<Attachment> put(UUID entryUuid, byte[] content, String mimeType, String fileName) {
        if (content == null || content.length == 0) {
            return LedgerResult.failure(ErrorKind.VALIDATION, "file_blob", "Attachment content is empty");
        }
        if (content.length > maxBytes) {
            return LedgerResult.failure(LedgerError.validation("file_blob",
                "Attachment is too large: " + content.length + " bytes (limit " + maxBytes + ")")
                .with("entry_uuid", entryUuid));
        }
        Optional<AttachmentMimeType> type = mimeType != null
            ? AttachmentMimeType.fromValue(mimeType)
            : AttachmentMimeType.guessFromFileName(fileName);
        if (type.isEmpty()) {
            return LedgerResult.failure(LedgerError.validation("mime_type",
                "Unsupported attachment type: " + (mimeType != null ? mimeType : fileName)));
        }
        String cleanName = fileName == null || fileName.isBlank() ? null : fileName.trim();

        return writeSerializer.write("put-attachment", () -> {
            Integer entries = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM gl_entry WHERE entry_uuid = ?", Integer.class, entryUuid.toString());
            if (entries == null || entries == 0) {
                return LedgerResult.failure(LedgerError.notFound("entry_uuid",
                    "Entry not found: " + entryUuid).with("entry_uuid", entryUuid));
            }
            jdbcTemplate.update(
                "INSERT INTO gl_entry_attachment (entry_uuid, file_name, mime_type, file_blob) VALUES (?, ?, ?, ?) " +
                "ON CONFLICT(entry_uuid) DO UPDATE SET " +
                "file_name = excluded.file_name, mime_type = excluded.mime_type, file_blob = excluded.file_blob",
                entryUuid.toString(), cleanName, type.get().getValue(), content
            );
            log.info("Stored attachment: entryId={}, type={}, size={}", entryUuid, type.get().getValue(), content.length);
            return LedgerResult.success(new Attachment(entryUuid, cleanName, type.get(), content));
        });
    }

    @Override
    public LedgerResult<Boolean> delete(UUID entryUuid) {
        return writeSerializer.write("delete-attachment", () -> {
            int removed = jdbcTemplate.update(
                "DELETE FROM gl_entry_attachment WHERE entry_uuid = ?", entryUuid.toString());
            if (removed > 0) {
                log.debug("Deleted attachment: entryId={}", entryUuid);
            }
            return LedgerResult.success(removed > 0);
        });
    }

    private RowMapper<Attachment> attachmentRowMapper() {
        return (rs, rowNum) -> new Attachment(
            UUID.fromString(rs.getString("entry_uuid")),
            rs.getString("file_name"),
            AttachmentMimeType.fromValue(rs.getString("mime_type"))
                .orElseThrow(() -> new IllegalStateException("Unsupported stored mime_type")),
            rs.getBytes("file_blob")
        );
    }
}

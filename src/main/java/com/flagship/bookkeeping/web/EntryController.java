package com.flagship.bookkeeping.web;

import com.flagship.bookkeeping.attachment.Attachment;
import com.flagship.bookkeeping.attachment.AttachmentStore;
import com.flagship.bookkeeping.ledger.LedgerEntry;
import com.flagship.bookkeeping.ledger.LedgerService;
import com.flagship.bookkeeping.result.LedgerError;
import com.flagship.bookkeeping.web.dto.AttachmentResponse;
import com.flagship.bookkeeping.web.dto.EntryRequest;
import com.flagship.bookkeeping.web.dto.EntryResponse;
import com.flagship.bookkeeping.web.exception.LedgerOperationException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.UUID;

/**
 * REST controller for journal entries and their attachment.
 *
 * Create and update both go through the ledger's full-replace write path.
 */
@RestController
@RequestMapping("/api/entries")
@RequiredArgsConstructor
@Slf4j
public class EntryController {

    private final LedgerService ledgerService;
    private final AttachmentStore attachmentStore;

    @PostMapping
    public ResponseEntity<EntryResponse> createEntry(@Valid @RequestBody EntryRequest request) {
        UUID entryUuid = LedgerOperationException.valueOrThrow(ledgerService.saveEntryFullReplace(
            UUID.randomUUID(),
            request.getAccountingDate(),
            request.getEntryType(),
            request.getEntryTitle(),
            request.getEntryText(),
            request.getLineItems(),
            true
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(load(entryUuid));
    }

    @PutMapping("/{id}")
    public EntryResponse replaceEntry(@PathVariable("id") UUID id, @Valid @RequestBody EntryRequest request) {
        LedgerOperationException.valueOrThrow(ledgerService.saveEntryFullReplace(
            id,
            request.getAccountingDate(),
            request.getEntryType(),
            request.getEntryTitle(),
            request.getEntryText(),
            request.getLineItems(),
            false
        ));
        return load(id);
    }

    @GetMapping("/{id}")
    public ResponseEntity<EntryResponse> getEntry(@PathVariable("id") UUID id) {
        return ledgerService.getEntry(id)
            .map(entry -> ResponseEntity.ok(EntryResponse.from(entry, attachmentStore.exists(id))))
            .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteEntry(@PathVariable("id") UUID id) {
        LedgerOperationException.valueOrThrow(ledgerService.deleteEntry(id));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/attachment")
    public ResponseEntity<byte[]> getAttachment(@PathVariable("id") UUID id) {
        return attachmentStore.get(id)
            .map(EntryController::attachmentBody)
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Stores or replaces the attachment. The MIME type is taken from the upload, or guessed
     * from the file name when the client sent none.
     */
    @PutMapping(path = "/{id}/attachment", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AttachmentResponse putAttachment(@PathVariable("id") UUID id,
                                            @RequestParam("file") MultipartFile file) throws IOException {
        String contentType = file.getContentType();
        if (contentType == null || contentType.isBlank()
                || MediaType.APPLICATION_OCTET_STREAM_VALUE.equals(contentType)) {
            contentType = null;
        }
        Attachment stored = LedgerOperationException.valueOrThrow(
            attachmentStore.put(id, file.getBytes(), contentType, file.getOriginalFilename()));
        return AttachmentResponse.from(stored);
    }

    @DeleteMapping("/{id}/attachment")
    public ResponseEntity<Void> deleteAttachment(@PathVariable("id") UUID id) {
        boolean removed = LedgerOperationException.valueOrThrow(attachmentStore.delete(id));
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    private EntryResponse load(UUID entryUuid) {
        LedgerEntry entry = ledgerService.getEntry(entryUuid)
            .orElseThrow(() -> new LedgerOperationException(
                LedgerError.notFound("entry_uuid", "Entry not found: " + entryUuid)));
        return EntryResponse.from(entry, attachmentStore.exists(entryUuid));
    }

    private static ResponseEntity<byte[]> attachmentBody(Attachment attachment) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(attachment.getMimeType().getValue()));
        if (attachment.getFileName() != null) {
            headers.setContentDisposition(ContentDisposition.inline().filename(attachment.getFileName()).build());
        }
        return new ResponseEntity<>(attachment.getContent(), headers, HttpStatus.OK);
    }
}

package com.flagship.bookkeeping.config;

import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Typed {@code ledger.*} configuration.
 *
 * Values seed the {@code user_setting} table on first start; afterwards the stored settings win.
 */
@Value
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    String defaultDomesticCurrency;
    String defaultUserName;
    boolean seedSampleData;
    Importer importer;
    Attachment attachment;

    public LedgerProperties(@DefaultValue("GBP") String defaultDomesticCurrency,
                            @DefaultValue("") String defaultUserName,
                            @DefaultValue("false") boolean seedSampleData,
                            @DefaultValue Importer importer,
                            @DefaultValue Attachment attachment) {
        if (defaultDomesticCurrency == null || !defaultDomesticCurrency.matches("[A-Z]{3}")) {
            throw new IllegalArgumentException(
                "ledger.default-domestic-currency must be a 3-letter upper-case code: " + defaultDomesticCurrency);
        }
        this.defaultDomesticCurrency = defaultDomesticCurrency;
        this.defaultUserName = defaultUserName == null ? "" : defaultUserName;
        this.seedSampleData = seedSampleData;
        this.importer = importer;
        this.attachment = attachment;
    }

    @Value
    public static class Importer {
        int maxLines;
        int maxStoreLength;
        int maxNoteLength;
        int workerThreads;

        public Importer(@DefaultValue("500") int maxLines,
                        @DefaultValue("200") int maxStoreLength,
                        @DefaultValue("500") int maxNoteLength,
                        @DefaultValue("2") int workerThreads) {
            if (maxLines < 1) {
                throw new IllegalArgumentException("ledger.importer.max-lines must be at least 1");
            }
            if (maxStoreLength < 1 || maxNoteLength < 1) {
                throw new IllegalArgumentException("ledger.importer text limits must be positive");
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("ledger.importer.worker-threads must be at least 1");
            }
            this.maxLines = maxLines;
            this.maxStoreLength = maxStoreLength;
            this.maxNoteLength = maxNoteLength;
            this.workerThreads = workerThreads;
        }
    }

    @Value
    public static class Attachment {
        long maxBytes;

        public Attachment(@DefaultValue("10485760") long maxBytes) {
            if (maxBytes < 1) {
                throw new IllegalArgumentException("ledger.attachment.max-bytes must be positive");
            }
            this.maxBytes = maxBytes;
        }
    }
}

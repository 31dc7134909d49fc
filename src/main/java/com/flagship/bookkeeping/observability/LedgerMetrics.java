package com.flagship.bookkeeping.observability;

import com.flagship.bookkeeping.ledger.EntryType;
import com.flagship.bookkeeping.result.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.entries.saved: entries created or replaced, tagged by entry type and mode
 * - ledger.entries.rejected: refused writes, tagged by error kind
 * - ledger.entries.deleted: deleted entries
 * - ledger.accounts.created: user-managed accounts created
 * - ledger.import.result: JSON imports, tagged by outcome
 * - ledger.write.duration: time spent holding the write lock, tagged by operation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter entriesDeleted;
    private final Counter accountsCreated;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.entriesDeleted = Counter.builder("ledger.entries.deleted")
                .description("Number of entries deleted")
                .register(registry);

        this.accountsCreated = Counter.builder("ledger.accounts.created")
                .description("Number of user-managed accounts created")
                .register(registry);
    }

    public void recordEntrySaved(EntryType entryType, boolean created) {
        registry.counter("ledger.entries.saved",
                "entry_type", entryType.name(),
                "mode", created ? "create" : "replace"
        ).increment();
    }

    public void recordEntryRejected(ErrorKind kind) {
        registry.counter("ledger.entries.rejected", "kind", kind.name()).increment();
    }

    public void incrementEntriesDeleted() {
        entriesDeleted.increment();
    }

    public void incrementAccountsCreated() {
        accountsCreated.increment();
    }

    public void recordImport(String outcome) {
        registry.counter("ledger.import.result", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordWriteDuration(String operation, long durationMs) {
        registry.timer("ledger.write.duration",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

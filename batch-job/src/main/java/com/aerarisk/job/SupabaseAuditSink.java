package com.aerarisk.job;

import com.aerarisk.core.model.AuditRecord;
import com.aerarisk.core.pipeline.AuditSink;

import java.util.List;
import java.util.Objects;

/**
 * {@link AuditSink} appending to the {@value #TABLE} table.
 *
 * @since 1.0.0
 */
public class SupabaseAuditSink implements AuditSink {

    static final String TABLE = "model_audit_log";

    private final SupabaseClient client;

    public SupabaseAuditSink(SupabaseClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public void record(AuditRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        client.insert(TABLE, List.of(record));
    }
}

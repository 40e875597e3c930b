package com.aerarisk.core.pipeline;

import com.aerarisk.core.model.AuditRecord;

/**
 * Append-only destination of stage audit records.
 *
 * @since 1.0.0
 */
public interface AuditSink {

    /**
     * @param record the record to append
     * @throws UpstreamException if the record cannot be written
     */
    void record(AuditRecord record);
}

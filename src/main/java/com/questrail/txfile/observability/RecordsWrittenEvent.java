package com.questrail.txfile.observability;

import com.questrail.txfile.codec.TxFormat;

import java.time.Instant;

/**
 * A record set was written to {@code target}.
 */
public record RecordsWrittenEvent(
    Instant timestamp,
    String target,
    TxFormat format,
    int recordCount
) {
}

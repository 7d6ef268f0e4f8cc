package com.questrail.txfile.observability;

import com.questrail.txfile.codec.TxFormat;

import java.time.Instant;

/**
 * A record set was parsed from {@code source}.
 */
public record RecordsReadEvent(
    Instant timestamp,
    String source,
    TxFormat format,
    int recordCount
) {
}

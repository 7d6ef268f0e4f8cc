package com.questrail.txfile.observability;

import java.time.Instant;

/**
 * Record representing a failed conversion or comparison.
 */
public record TxErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

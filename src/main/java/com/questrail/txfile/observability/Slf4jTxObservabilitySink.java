package com.questrail.txfile.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TxObservabilitySink that emits logs via SLF4J.
 *
 * <p>Errors are logged at debug level with their stack trace. The tools print
 * the user-facing form of the error themselves.</p>
 */
public final class Slf4jTxObservabilitySink implements TxObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTxObservabilitySink.class);

    @Override
    public void onRecordsRead(RecordsReadEvent event) {
        log.info("{} records successfully ingested from '{}' ({})",
            event.recordCount(),
            event.source(),
            event.format());
    }

    @Override
    public void onRecordsWritten(RecordsWrittenEvent event) {
        log.info("{} records written to '{}' ({})",
            event.recordCount(),
            event.target(),
            event.format());
    }

    @Override
    public void onError(TxErrorEvent event) {
        log.debug("Transaction file error: {}", event.message(), event.cause());
    }
}

package com.questrail.txfile.observability;

/**
 * Receives observability events from the converter and comparer.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Codecs do not report here. They are silent on success and report
 * failures only by exception.</p>
 */
public interface TxObservabilitySink {
    /**
     * Called after a record set has been fully parsed.
     * @param event the source, format and record count
     */
    void onRecordsRead(RecordsReadEvent event);

    /**
     * Called after a record set has been fully written.
     * @param event the target, format and record count
     */
    void onRecordsWritten(RecordsWrittenEvent event);

    /**
     * Called when a conversion or comparison fails.
     * @param event the error event
     */
    void onError(TxErrorEvent event);
}

package com.questrail.txfile.observability;

/**
 * No-op implementation of TxObservabilitySink.
 */
public final class NullObservabilitySink implements TxObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRecordsRead(RecordsReadEvent event) {}

    @Override
    public void onRecordsWritten(RecordsWrittenEvent event) {}

    @Override
    public void onError(TxErrorEvent event) {}
}

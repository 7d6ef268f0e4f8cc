package com.questrail.txfile.compare;

import com.questrail.txfile.codec.TxFormat;
import com.questrail.txfile.error.TxCodecException;
import com.questrail.txfile.model.TxRecord;
import com.questrail.txfile.observability.RecordsReadEvent;
import com.questrail.txfile.observability.TxObservabilitySink;

import java.io.InputStream;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Reads two record sets, each with its own format, and compares them with
 * {@link TxRecordComparison}.
 */
public final class TxComparer
{
    private final TxObservabilitySink sink;
    private final Clock clock;

    public TxComparer(TxObservabilitySink sink, Clock clock)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ComparisonReport compare(String firstName, InputStream first, TxFormat firstFormat,
                                    String secondName, InputStream second, TxFormat secondFormat)
            throws TxCodecException
    {
        final List<TxRecord> firstRecords = read(firstName, first, firstFormat);
        final List<TxRecord> secondRecords = read(secondName, second, secondFormat);
        return TxRecordComparison.compare(firstRecords, secondRecords);
    }

    private List<TxRecord> read(String name, InputStream in, TxFormat format) throws TxCodecException
    {
        Objects.requireNonNull(format, "format");
        final List<TxRecord> records = format.parse(in);
        sink.onRecordsRead(new RecordsReadEvent(clock.instant(), name, format, records.size()));
        return records;
    }
}

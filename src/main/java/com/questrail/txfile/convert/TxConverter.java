package com.questrail.txfile.convert;

import com.questrail.txfile.codec.TxFormat;
import com.questrail.txfile.error.TxCodecException;
import com.questrail.txfile.model.TxRecord;
import com.questrail.txfile.observability.RecordsReadEvent;
import com.questrail.txfile.observability.RecordsWrittenEvent;
import com.questrail.txfile.observability.TxObservabilitySink;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * TxConverter
 * =============================================================================
 * Reads a record set with one format and writes it with another.
 *
 * <p>The whole record set is parsed before anything is written, so a parse
 * failure never leaves partial output behind. Callers that must not create
 * the destination before the input is known to be valid can use
 * {@link #read} and {@link #write} separately.</p>
 */
public final class TxConverter
{
    private final TxObservabilitySink sink;
    private final Clock clock;

    public TxConverter(TxObservabilitySink sink, Clock clock)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Converts every record of {@code in} to {@code outputFormat}.
     *
     * @param source label for {@code in} used in observability events
     * @param target label for {@code out} used in observability events
     * @return the number of records ingested
     * @throws TxCodecException on the first read, parse or write failure
     */
    public int convert(String source, InputStream in, TxFormat inputFormat,
                       String target, OutputStream out, TxFormat outputFormat)
            throws TxCodecException
    {
        final List<TxRecord> records = read(source, in, inputFormat);
        write(target, out, outputFormat, records);
        return records.size();
    }

    /**
     * First half of {@link #convert}: parses the complete record set.
     */
    public List<TxRecord> read(String source, InputStream in, TxFormat inputFormat)
            throws TxCodecException
    {
        Objects.requireNonNull(inputFormat, "inputFormat");

        final List<TxRecord> records = inputFormat.parse(in);
        sink.onRecordsRead(new RecordsReadEvent(clock.instant(), source, inputFormat, records.size()));
        return records;
    }

    /**
     * Second half of {@link #convert}: writes an already parsed record set.
     */
    public void write(String target, OutputStream out, TxFormat outputFormat, List<TxRecord> records)
            throws TxCodecException
    {
        Objects.requireNonNull(outputFormat, "outputFormat");

        outputFormat.write(out, records);
        sink.onRecordsWritten(new RecordsWrittenEvent(clock.instant(), target, outputFormat, records.size()));
    }
}

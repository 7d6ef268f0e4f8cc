package com.questrail.txfile.codec;

import com.questrail.txfile.error.TxCodecException;
import com.questrail.txfile.model.TxRecord;

import java.io.OutputStream;
import java.util.List;

/**
 * Outbound half of the codec contract: records to stream bytes.
 *
 * <p>This is the mechanical inverse of {@link TxRecordParser}. For any list of
 * records {@code r}, parsing the output of {@code write(out, r)} with the same
 * format yields a list equal to {@code r}.</p>
 */
@FunctionalInterface
public interface TxRecordWriter
{
    /**
     * Writes {@code records} to {@code out} and flushes it. The stream is not closed.
     *
     * @throws TxCodecException if the stream fails
     */
    void write(OutputStream out, List<TxRecord> records) throws TxCodecException;
}

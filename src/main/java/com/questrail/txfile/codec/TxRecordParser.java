package com.questrail.txfile.codec;

import com.questrail.txfile.error.TxCodecException;
import com.questrail.txfile.model.TxRecord;

import java.io.InputStream;
import java.util.List;

/**
 * TxRecordParser
 * -----------------------------------------------------------------------------
 * Inbound half of the codec contract: stream bytes to records.
 *
 * <p>The parser is responsible for:</p>
 * <ul>
 *   <li>Validating the format's framing or line grammar</li>
 *   <li>Validating every field value</li>
 *   <li>Locating every domain failure precisely</li>
 * </ul>
 *
 * <p>The parser is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Opening or closing the stream</li>
 *   <li>Incremental delivery. The whole record set is materialized before
 *       it is returned.</li>
 *   <li>Retrying after a failure</li>
 * </ul>
 */
@FunctionalInterface
public interface TxRecordParser
{
    /**
     * Reads every record from {@code in}.
     *
     * @param in input positioned at the start of the format's content; not closed
     * @return the records in input order; empty if the input holds none
     * @throws TxCodecException on the first transport or domain failure
     */
    List<TxRecord> parse(InputStream in) throws TxCodecException;
}

package com.questrail.txfile.model;

import com.questrail.txfile.error.ParserException;

/**
 * Transaction time as unsigned milliseconds since the Unix epoch.
 *
 * <p>There is no upper bound check. Every value of the unsigned 64-bit range
 * is accepted, including ones that do not fit a {@link java.time.Instant}.</p>
 *
 * @param millis milliseconds since the epoch, interpreted as unsigned
 */
public record TxTimestamp(long millis)
{
    public static TxTimestamp ofMillis(long millis)
    {
        return new TxTimestamp(millis);
    }

    public static TxTimestamp parse(String text) throws ParserException
    {
        return new TxTimestamp(UnsignedDecimal.parse(text));
    }

    @Override
    public String toString()
    {
        return UnsignedDecimal.format(millis);
    }
}

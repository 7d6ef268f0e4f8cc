package com.questrail.txfile.model;

import com.questrail.txfile.error.ParserError;
import com.questrail.txfile.error.ParserException;

/**
 * Decimal text form of the unsigned 64-bit quantities in a record.
 *
 * <p>Values are held in a {@code long} as their two's-complement bit pattern,
 * so {@code 2^64 - 1} is stored as {@code -1L} and printed as
 * {@code 18446744073709551615}.</p>
 */
final class UnsignedDecimal
{
    private UnsignedDecimal() {}

    static long parse(String text) throws ParserException
    {
        // parseUnsignedLong rejects a leading '-' and anything above 2^64 - 1
        try {
            return Long.parseUnsignedLong(text);
        }
        catch (NumberFormatException e) {
            throw new ParserException(new ParserError.UnparsableValue(text), e);
        }
    }

    static String format(long value)
    {
        return Long.toUnsignedString(value);
    }
}

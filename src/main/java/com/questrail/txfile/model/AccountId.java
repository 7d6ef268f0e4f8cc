package com.questrail.txfile.model;

import com.questrail.txfile.error.ParserException;

/**
 * Unsigned 64-bit account identifier, used for both the source and the
 * destination of a {@link TxRecord}. Zero is an ordinary value.
 *
 * @param value the account bits, interpreted as unsigned
 */
public record AccountId(long value)
{
    public static AccountId of(long value)
    {
        return new AccountId(value);
    }

    public static AccountId parse(String text) throws ParserException
    {
        return new AccountId(UnsignedDecimal.parse(text));
    }

    @Override
    public String toString()
    {
        return UnsignedDecimal.format(value);
    }
}

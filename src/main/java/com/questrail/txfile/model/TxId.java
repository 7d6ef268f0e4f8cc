package com.questrail.txfile.model;

import com.questrail.txfile.error.ParserException;

/**
 * Opaque unsigned 64-bit transaction identifier.
 *
 * <p>The identifier carries no meaning beyond equality. It is not required to
 * be unique within a file.</p>
 *
 * @param value the identifier bits, interpreted as unsigned
 */
public record TxId(long value)
{
    public static TxId of(long value)
    {
        return new TxId(value);
    }

    /**
     * Parses an unsigned decimal identifier.
     *
     * @throws ParserException if the text is not an unsigned 64-bit decimal
     */
    public static TxId parse(String text) throws ParserException
    {
        return new TxId(UnsignedDecimal.parse(text));
    }

    @Override
    public String toString()
    {
        return UnsignedDecimal.format(value);
    }
}

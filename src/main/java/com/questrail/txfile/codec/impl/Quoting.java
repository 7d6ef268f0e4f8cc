package com.questrail.txfile.codec.impl;

import com.questrail.txfile.error.ParserError;
import com.questrail.txfile.error.ParserException;

/**
 * Double-quote wrapping of the description field in the line formats.
 *
 * <p>No escaping is applied in either direction. A description containing a
 * double quote is written as-is, and one containing a comma still splits a
 * CSV row. Both are limitations of the file formats.</p>
 */
final class Quoting
{
    private static final char QUOTE = '"';

    private Quoting() {}

    /**
     * Strips one leading and one trailing double quote.
     *
     * @throws ParserException with {@link ParserError.ShellBeQuoted} if either quote is absent
     */
    static String unquote(String value) throws ParserException
    {
        if (value.length() >= 2
                && value.charAt(0) == QUOTE
                && value.charAt(value.length() - 1) == QUOTE) {
            return value.substring(1, value.length() - 1);
        }
        throw new ParserException(new ParserError.ShellBeQuoted(value));
    }

    static String quote(String value)
    {
        return QUOTE + value + QUOTE;
    }
}

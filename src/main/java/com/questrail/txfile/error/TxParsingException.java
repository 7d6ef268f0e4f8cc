package com.questrail.txfile.error;

import java.util.Objects;

/**
 * A located domain failure.
 *
 * <p>The message is the error description followed by the location on its
 * own line, e.g.:</p>
 * <pre>
 * field TX_ID has duplicate:
 * line #2, content: `TX_ID: 2`
 * </pre>
 */
public final class TxParsingException extends TxCodecException
{
    private final ParserContext context;
    private final ParserError error;

    public TxParsingException(ParserContext context, ParserError error) {
        this(context, error, null);
    }

    TxParsingException(ParserContext context, ParserError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error").message()
                + ":\n" + Objects.requireNonNull(context, "context").describe(), cause);
        this.context = context;
        this.error = error;
    }

    public ParserContext context() {
        return context;
    }

    public ParserError error() {
        return error;
    }
}

package com.questrail.txfile.error;

import java.util.Objects;

/**
 * A domain failure that has not yet been located.
 *
 * <p>Raised by value-level parsing (tokens, numbers, quoting) which has no
 * knowledge of where in the input the value came from. Codecs catch it and
 * rethrow it as a {@link TxParsingException} with the appropriate
 * {@link ParserContext} via {@link #at(ParserContext)}.</p>
 */
public final class ParserException extends Exception
{
    private final ParserError error;

    public ParserException(ParserError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public ParserException(ParserError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error").message(), cause);
        this.error = error;
    }

    public ParserError error() {
        return error;
    }

    /**
     * Attaches a location, producing the exception that crosses the codec
     * contract.
     */
    public TxParsingException at(ParserContext context) {
        return new TxParsingException(context, error, this);
    }
}

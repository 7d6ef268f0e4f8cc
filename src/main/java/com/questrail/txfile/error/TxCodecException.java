package com.questrail.txfile.error;

/**
 * TxCodecException
 * -----------------------------------------------------------------------------
 * The single failure type raised by a codec's {@code parse} or {@code write}.
 *
 * <h2>Two tiers</h2>
 * <ul>
 *   <li><b>Transport</b>: {@link TxReadException}, {@link TxWriteException}.
 *       The underlying stream failed. The cause is the original
 *       {@link java.io.IOException}; no location is attached.</li>
 *   <li><b>Domain</b>: {@link TxParsingException}. The input was read but is
 *       malformed. Always carries a {@link ParserError} and a
 *       {@link ParserContext}.</li>
 * </ul>
 *
 * <p>Propagation is fail-fast: the first failure aborts the whole call and no
 * partial result is returned.</p>
 */
public abstract sealed class TxCodecException extends Exception
        permits TxReadException, TxWriteException, TxParsingException
{
    protected TxCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}

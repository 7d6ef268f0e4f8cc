package com.questrail.txfile.error;

import java.io.IOException;
import java.util.Objects;

/**
 * The input stream failed, including ending in the middle of a binary frame.
 */
public final class TxReadException extends TxCodecException
{
    public TxReadException(IOException cause) {
        super("read error, " + Objects.requireNonNull(cause, "cause").getMessage(), cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}

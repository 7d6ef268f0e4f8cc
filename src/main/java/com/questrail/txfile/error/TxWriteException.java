package com.questrail.txfile.error;

import java.io.IOException;
import java.util.Objects;

/**
 * The output stream failed.
 */
public final class TxWriteException extends TxCodecException
{
    public TxWriteException(IOException cause) {
        super("write error, " + Objects.requireNonNull(cause, "cause").getMessage(), cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}

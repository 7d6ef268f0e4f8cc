package com.questrail.txfile.codec;

import com.questrail.txfile.codec.impl.BinaryTxCodec;
import com.questrail.txfile.codec.impl.CsvTxCodec;
import com.questrail.txfile.codec.impl.NoOpTxCodec;
import com.questrail.txfile.codec.impl.TextTxCodec;
import com.questrail.txfile.error.TxCodecException;
import com.questrail.txfile.model.TxRecord;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Locale;

/**
 * Format selector: maps a format identifier to its codec.
 *
 * <p>Pure dispatch. All behavior lives in the codecs.</p>
 */
public enum TxFormat
{
    BINARY(new BinaryTxCodec()),
    TEXT(new TextTxCodec()),
    CSV(new CsvTxCodec()),

    /** Reads nothing and writes nothing. Used for wiring and tests. */
    DUMMY(new NoOpTxCodec());

    private final TxRecordCodec codec;

    TxFormat(TxRecordCodec codec) {
        this.codec = codec;
    }

    public TxRecordCodec codec() {
        return codec;
    }

    public List<TxRecord> parse(InputStream in) throws TxCodecException {
        return codec.parse(in);
    }

    public void write(OutputStream out, List<TxRecord> records) throws TxCodecException {
        codec.write(out, records);
    }

    /**
     * Returns the lowercase name used on the command line.
     */
    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a command-line format name, ignoring case.
     *
     * @throws IllegalArgumentException if the name is not a known format
     */
    public static TxFormat fromName(String name) {
        for (TxFormat format : values()) {
            if (format.displayName().equalsIgnoreCase(name.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException(
                "Unknown format '" + name + "' (expected binary, text, csv or dummy)");
    }

    @Override
    public String toString() {
        return displayName();
    }
}

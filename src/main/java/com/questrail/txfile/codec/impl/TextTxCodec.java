package com.questrail.txfile.codec.impl;

import com.questrail.txfile.codec.TxRecordCodec;
import com.questrail.txfile.error.ParserContext;
import com.questrail.txfile.error.ParserException;
import com.questrail.txfile.error.TxCodecException;
import com.questrail.txfile.error.TxParsingException;
import com.questrail.txfile.error.TxReadException;
import com.questrail.txfile.error.TxWriteException;
import com.questrail.txfile.model.TxFieldKey;
import com.questrail.txfile.model.TxRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * TextTxCodec
 * -----------------------------------------------------------------------------
 * Reader and writer for the human-readable key/value format.
 *
 * <h2>Grammar</h2>
 * <pre>
 *   # comment lines start with '#' (after trimming) and are ignored
 *   TX_ID: 1
 *   TX_TYPE: DEPOSIT
 *   FROM_USER_ID: 0
 *   TO_USER_ID: 100
 *   AMOUNT: 500
 *   TIMESTAMP: 1700
 *   STATUS: SUCCESS
 *   DESCRIPTION: "Salary"
 *
 *   TX_ID: 2
 *   ...
 * </pre>
 *
 * <ul>
 *   <li>Records are separated by one or more blank lines.</li>
 *   <li>Fields may appear in any order within a record.</li>
 *   <li>A blank line, or the end of input, closes the current record only if
 *       at least one field was set.</li>
 *   <li>The description value is wrapped in double quotes.</li>
 * </ul>
 *
 * <p>The writer always emits fields in canonical order followed by one blank
 * line. Failures are located by 1-based line number and the raw line.</p>
 */
public final class TextTxCodec implements TxRecordCodec
{
    private static final String COMMENT_PREFIX = "#";

    @Override
    public List<TxRecord> parse(InputStream in) throws TxCodecException
    {
        Objects.requireNonNull(in, "in");

        final BufferedReader reader = LineIo.reader(in);
        final List<TxRecord> records = new ArrayList<>();
        TextRecordBuilder builder = new TextRecordBuilder();

        int lineNumber = 0;
        String lastLine = "";

        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                lastLine = line;

                final String trimmed = line.strip();
                if (trimmed.startsWith(COMMENT_PREFIX)) {
                    continue;
                }

                if (trimmed.isEmpty()) {
                    if (builder.isDirty()) {
                        records.add(close(builder, lineNumber, line));
                    }
                    builder = new TextRecordBuilder();
                    continue;
                }

                try {
                    builder.accept(trimmed);
                }
                catch (ParserException e) {
                    throw e.at(ParserContext.line(lineNumber, line));
                }
            }
        }
        catch (IOException e) {
            throw new TxReadException(e);
        }

        if (builder.isDirty()) {
            records.add(close(builder, lineNumber, lastLine));
        }
        return Collections.unmodifiableList(records);
    }

    @Override
    public void write(OutputStream out, List<TxRecord> records) throws TxCodecException
    {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(records, "records");

        final Writer writer = LineIo.writer(out);
        try {
            for (TxRecord record : records) {
                writeField(writer, TxFieldKey.ID, record.id().toString());
                writeField(writer, TxFieldKey.KIND, record.kind().token());
                writeField(writer, TxFieldKey.FROM, record.from().toString());
                writeField(writer, TxFieldKey.TO, record.to().toString());
                writeField(writer, TxFieldKey.AMOUNT, Long.toString(record.amount()));
                writeField(writer, TxFieldKey.TIMESTAMP, record.timestamp().toString());
                writeField(writer, TxFieldKey.STATUS, record.status().token());
                writeField(writer, TxFieldKey.DESCRIPTION, Quoting.quote(record.description()));
                writer.write(LineIo.LINE_END);
            }
            writer.flush();
        }
        catch (IOException e) {
            throw new TxWriteException(e);
        }
    }

    private static TxRecord close(TextRecordBuilder builder, int lineNumber, String line)
            throws TxParsingException
    {
        try {
            return builder.build();
        }
        catch (ParserException e) {
            throw e.at(ParserContext.line(lineNumber, line));
        }
    }

    private static void writeField(Writer writer, TxFieldKey key, String value) throws IOException
    {
        writer.write(key.token());
        writer.write(TextRecordBuilder.KEY_VALUE_DELIMITER);
        writer.write(' ');
        writer.write(value);
        writer.write(LineIo.LINE_END);
    }
}

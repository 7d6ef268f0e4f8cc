package com.questrail.txfile.codec.impl;

import com.questrail.txfile.codec.TxRecordCodec;
import com.questrail.txfile.error.ParserContext;
import com.questrail.txfile.error.ParserError;
import com.questrail.txfile.error.ParserException;
import com.questrail.txfile.error.TxCodecException;
import com.questrail.txfile.error.TxParsingException;
import com.questrail.txfile.error.TxReadException;
import com.questrail.txfile.error.TxWriteException;
import com.questrail.txfile.model.AccountId;
import com.questrail.txfile.model.TxFieldKey;
import com.questrail.txfile.model.TxId;
import com.questrail.txfile.model.TxKind;
import com.questrail.txfile.model.TxRecord;
import com.questrail.txfile.model.TxStatus;
import com.questrail.txfile.model.TxTimestamp;

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
 * CsvTxCodec
 * -----------------------------------------------------------------------------
 * Reader and writer for the fixed-column CSV format.
 *
 * <ul>
 *   <li>The first line must equal {@link #HEADER} exactly.</li>
 *   <li>Every following line is split on a literal comma into exactly eight
 *       tokens, each trimmed, in canonical field order.</li>
 *   <li>There is no quoting or escaping of the separator. A comma inside a
 *       description splits the row and yields a wrong token count.</li>
 *   <li>Only the description column is wrapped in double quotes.</li>
 * </ul>
 *
 * <p>Failures are located by 0-based line number (the header is line 0) and
 * the raw line.</p>
 */
public final class CsvTxCodec implements TxRecordCodec
{
    public static final String HEADER =
            "TX_ID,TX_TYPE,FROM_USER_ID,TO_USER_ID,AMOUNT,TIMESTAMP,STATUS,DESCRIPTION";

    private static final String DELIMITER = ",";

    private static final int COLUMN_COUNT = TxFieldKey.values().length;

    @Override
    public List<TxRecord> parse(InputStream in) throws TxCodecException
    {
        Objects.requireNonNull(in, "in");

        final BufferedReader reader = LineIo.reader(in);
        final List<TxRecord> records = new ArrayList<>();

        try {
            final String header = reader.readLine();
            if (header == null) {
                return List.of();
            }
            if (!HEADER.equals(header)) {
                throw new TxParsingException(
                        ParserContext.line(0, header),
                        new ParserError.InvalidFileHeader());
            }

            int lineNumber = 0;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                try {
                    records.add(parseRow(line.strip()));
                }
                catch (ParserException e) {
                    throw e.at(ParserContext.line(lineNumber, line));
                }
            }
        }
        catch (IOException e) {
            throw new TxReadException(e);
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
            writer.write(HEADER);
            writer.write(LineIo.LINE_END);
            for (TxRecord record : records) {
                writer.write(String.join(DELIMITER,
                        record.id().toString(),
                        record.kind().token(),
                        record.from().toString(),
                        record.to().toString(),
                        Long.toString(record.amount()),
                        record.timestamp().toString(),
                        record.status().token(),
                        Quoting.quote(record.description())));
                writer.write(LineIo.LINE_END);
            }
            writer.flush();
        }
        catch (IOException e) {
            throw new TxWriteException(e);
        }
    }

    private static TxRecord parseRow(String line) throws ParserException
    {
        // limit -1 keeps trailing empty tokens, so "a,b," counts three
        final String[] values = line.split(DELIMITER, -1);
        if (values.length != COLUMN_COUNT) {
            throw new ParserException(new ParserError.IncompleteRecord());
        }

        return new TxRecord(
                TxId.parse(column(values, TxFieldKey.ID)),
                TxKind.fromToken(column(values, TxFieldKey.KIND)),
                AccountId.parse(column(values, TxFieldKey.FROM)),
                AccountId.parse(column(values, TxFieldKey.TO)),
                TxRecord.parseAmount(column(values, TxFieldKey.AMOUNT)),
                TxTimestamp.parse(column(values, TxFieldKey.TIMESTAMP)),
                TxStatus.fromToken(column(values, TxFieldKey.STATUS)),
                Quoting.unquote(column(values, TxFieldKey.DESCRIPTION)));
    }

    /** Columns follow canonical field order. */
    private static String column(String[] values, TxFieldKey key)
    {
        return values[key.ordinal()].strip();
    }
}

package com.questrail.txfile.codec.impl;

import com.questrail.txfile.error.ParserError;
import com.questrail.txfile.error.ParserException;
import com.questrail.txfile.model.AccountId;
import com.questrail.txfile.model.TxFieldKey;
import com.questrail.txfile.model.TxId;
import com.questrail.txfile.model.TxKind;
import com.questrail.txfile.model.TxRecord;
import com.questrail.txfile.model.TxStatus;
import com.questrail.txfile.model.TxTimestamp;

/**
 * TextRecordBuilder
 * -----------------------------------------------------------------------------
 * Accumulates the fields of one text record in whatever order they appear.
 *
 * <h2>Design Notes</h2>
 * <ul>
 *   <li>One nullable slot per field; a slot is set at most once</li>
 *   <li>{@link #isDirty()} reports whether any field has been set, so blank
 *       lines and comments between records never open an empty record</li>
 *   <li>{@link #build()} is a single validation pass in canonical field order</li>
 * </ul>
 *
 * <p>A builder covers exactly one record. The codec starts a fresh builder
 * after every record separator.</p>
 */
final class TextRecordBuilder
{
    static final char KEY_VALUE_DELIMITER = ':';

    private boolean dirty;

    private TxId id;
    private TxKind kind;
    private AccountId from;
    private AccountId to;
    private Long amount;
    private TxTimestamp timestamp;
    private TxStatus status;
    private String description;

    boolean isDirty()
    {
        return dirty;
    }

    /**
     * Parses a trimmed, non-blank, non-comment {@code KEY: value} line into
     * this builder. The line is split at its first delimiter; key and value
     * are trimmed.
     */
    void accept(String line) throws ParserException
    {
        final int delimiter = line.indexOf(KEY_VALUE_DELIMITER);
        if (delimiter < 0) {
            throw new ParserException(new ParserError.NoFieldDelimiter());
        }

        final TxFieldKey key = TxFieldKey.fromToken(line.substring(0, delimiter).strip());
        set(key, line.substring(delimiter + 1).strip());
    }

    void set(TxFieldKey key, String value) throws ParserException
    {
        if (isPresent(key)) {
            throw new ParserException(new ParserError.Duplicate(key));
        }
        dirty = true;

        switch (key) {
            case ID -> id = TxId.parse(value);
            case KIND -> kind = TxKind.fromToken(value);
            case FROM -> from = AccountId.parse(value);
            case TO -> to = AccountId.parse(value);
            case AMOUNT -> amount = TxRecord.parseAmount(value);
            case TIMESTAMP -> timestamp = TxTimestamp.parse(value);
            case STATUS -> status = TxStatus.fromToken(value);
            case DESCRIPTION -> description = Quoting.unquote(value);
        }
    }

    /**
     * Assembles the record.
     *
     * @throws ParserException with {@link ParserError.MissingField} naming the
     *         first unset field in canonical order
     */
    TxRecord build() throws ParserException
    {
        // Arguments are evaluated left to right, which is the canonical order.
        return new TxRecord(
                require(id, TxFieldKey.ID),
                require(kind, TxFieldKey.KIND),
                require(from, TxFieldKey.FROM),
                require(to, TxFieldKey.TO),
                require(amount, TxFieldKey.AMOUNT),
                require(timestamp, TxFieldKey.TIMESTAMP),
                require(status, TxFieldKey.STATUS),
                require(description, TxFieldKey.DESCRIPTION));
    }

    private boolean isPresent(TxFieldKey key)
    {
        return switch (key) {
            case ID -> id != null;
            case KIND -> kind != null;
            case FROM -> from != null;
            case TO -> to != null;
            case AMOUNT -> amount != null;
            case TIMESTAMP -> timestamp != null;
            case STATUS -> status != null;
            case DESCRIPTION -> description != null;
        };
    }

    private static <T> T require(T value, TxFieldKey key) throws ParserException
    {
        if (value == null) {
            throw new ParserException(new ParserError.MissingField(key));
        }
        return value;
    }
}

package com.questrail.txfile.model;

import com.questrail.txfile.error.ParserError;
import com.questrail.txfile.error.ParserException;

/**
 * The eight named attributes of a {@link TxRecord}.
 *
 * <p>Declaration order is the canonical field order. It is used for:</p>
 * <ul>
 *   <li>the order in which fields are written by the text format</li>
 *   <li>the column order of the CSV format</li>
 *   <li>the order in which missing fields are reported</li>
 * </ul>
 *
 * <p>Field keys are also part of the error location reported by the binary
 * format.</p>
 */
public enum TxFieldKey
{
    ID,
    KIND,
    FROM,
    TO,
    AMOUNT,
    TIMESTAMP,
    STATUS,
    DESCRIPTION;

    /**
     * Returns the key as it appears in text keys and CSV column names.
     */
    public String token()
    {
        return switch (this) {
            case ID -> "TX_ID";
            case KIND -> "TX_TYPE";
            case FROM -> "FROM_USER_ID";
            case TO -> "TO_USER_ID";
            case AMOUNT -> "AMOUNT";
            case TIMESTAMP -> "TIMESTAMP";
            case STATUS -> "STATUS";
            case DESCRIPTION -> "DESCRIPTION";
        };
    }

    /**
     * Resolves a key token. Matching is case-sensitive; the caller trims.
     *
     * @throws ParserException with {@link ParserError.UnparsableKey} for an unknown key
     */
    public static TxFieldKey fromToken(String token) throws ParserException
    {
        return switch (token) {
            case "TX_ID" -> ID;
            case "TX_TYPE" -> KIND;
            case "FROM_USER_ID" -> FROM;
            case "TO_USER_ID" -> TO;
            case "AMOUNT" -> AMOUNT;
            case "TIMESTAMP" -> TIMESTAMP;
            case "STATUS" -> STATUS;
            case "DESCRIPTION" -> DESCRIPTION;
            default -> throw new ParserException(new ParserError.UnparsableKey(token));
        };
    }

    @Override
    public String toString()
    {
        return token();
    }
}

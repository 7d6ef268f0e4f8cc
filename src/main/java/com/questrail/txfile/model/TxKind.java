package com.questrail.txfile.model;

import com.questrail.txfile.error.ParserError;
import com.questrail.txfile.error.ParserException;

/**
 * TxKind
 * -----------------------------------------------------------------------------
 * Closed set of transaction kinds.
 *
 * <p>Each kind has two fixed encodings:</p>
 * <ul>
 *   <li>an uppercase token, used by the text and CSV formats</li>
 *   <li>a single-byte code, used by the binary format</li>
 * </ul>
 *
 * <p>Both mappings are exhaustive switch tables. An unknown token or code is
 * always rejected; there is no default or fallback kind.</p>
 *
 * <p>No relationship between the kind and the account or amount fields of a
 * record is enforced. A {@link #DEPOSIT} may carry a nonzero source account
 * and a {@link #WITHDRAWAL} may carry a positive amount.</p>
 */
public enum TxKind
{
    DEPOSIT,
    TRANSFER,
    WITHDRAWAL;

    /**
     * Returns the token used by the line-oriented formats.
     */
    public String token()
    {
        return switch (this) {
            case DEPOSIT -> "DEPOSIT";
            case TRANSFER -> "TRANSFER";
            case WITHDRAWAL -> "WITHDRAWAL";
        };
    }

    /**
     * Returns the single-byte code used by the binary format.
     */
    public int code()
    {
        return switch (this) {
            case DEPOSIT -> 0;
            case TRANSFER -> 1;
            case WITHDRAWAL -> 2;
        };
    }

    /**
     * Resolves a token (case-sensitive) to its kind.
     *
     * @throws ParserException with {@link ParserError.UnparsableValue} for any other token
     */
    public static TxKind fromToken(String token) throws ParserException
    {
        return switch (token) {
            case "DEPOSIT" -> DEPOSIT;
            case "TRANSFER" -> TRANSFER;
            case "WITHDRAWAL" -> WITHDRAWAL;
            default -> throw new ParserException(new ParserError.UnparsableValue(token));
        };
    }

    /**
     * Resolves an unsigned byte code to its kind.
     *
     * @throws ParserException with {@link ParserError.UnparsableValue} for any other code
     */
    public static TxKind fromCode(int code) throws ParserException
    {
        return switch (code) {
            case 0 -> DEPOSIT;
            case 1 -> TRANSFER;
            case 2 -> WITHDRAWAL;
            default -> throw new ParserException(new ParserError.UnparsableValue(Integer.toString(code)));
        };
    }

    @Override
    public String toString()
    {
        return token();
    }
}

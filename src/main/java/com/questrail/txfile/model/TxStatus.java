package com.questrail.txfile.model;

import com.questrail.txfile.error.ParserError;
import com.questrail.txfile.error.ParserException;

/**
 * TxStatus
 * -----------------------------------------------------------------------------
 * Closed set of transaction outcomes. Encoded exactly like {@link TxKind}:
 * an uppercase token for the line formats, a single-byte code for binary.
 */
public enum TxStatus
{
    SUCCESS,
    FAILURE,
    PENDING;

    public String token()
    {
        return switch (this) {
            case SUCCESS -> "SUCCESS";
            case FAILURE -> "FAILURE";
            case PENDING -> "PENDING";
        };
    }

    public int code()
    {
        return switch (this) {
            case SUCCESS -> 0;
            case FAILURE -> 1;
            case PENDING -> 2;
        };
    }

    public static TxStatus fromToken(String token) throws ParserException
    {
        return switch (token) {
            case "SUCCESS" -> SUCCESS;
            case "FAILURE" -> FAILURE;
            case "PENDING" -> PENDING;
            default -> throw new ParserException(new ParserError.UnparsableValue(token));
        };
    }

    public static TxStatus fromCode(int code) throws ParserException
    {
        return switch (code) {
            case 0 -> SUCCESS;
            case 1 -> FAILURE;
            case 2 -> PENDING;
            default -> throw new ParserException(new ParserError.UnparsableValue(Integer.toString(code)));
        };
    }

    @Override
    public String toString()
    {
        return token();
    }
}

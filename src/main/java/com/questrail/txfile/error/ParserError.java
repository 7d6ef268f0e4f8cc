package com.questrail.txfile.error;

import com.questrail.txfile.model.TxFieldKey;

import java.util.Objects;

/**
 * Closed taxonomy of domain (parsing) failures.
 *
 * <h2>Purpose</h2>
 * <p>
 * One taxonomy is shared by the binary, text and CSV formats. A
 * {@code ParserError} describes <em>what</em> went wrong; the matching
 * {@link ParserContext} describes <em>where</em>. The two are joined in a
 * {@link TxParsingException} at the point where the codec knows the location.
 * </p>
 *
 * <p>
 * Transport failures (the underlying stream failing to read or write) are
 * intentionally not part of this taxonomy. They are reported as
 * {@link TxReadException} / {@link TxWriteException} and never carry a
 * location.
 * </p>
 */
public sealed interface ParserError
        permits ParserError.MissingField,
                ParserError.UnparsableKey,
                ParserError.UnparsableValue,
                ParserError.Duplicate,
                ParserError.NoFieldDelimiter,
                ParserError.ShellBeQuoted,
                ParserError.InvalidFileHeader,
                ParserError.InvalidRecordHeader,
                ParserError.IncompleteRecord {

    /**
     * Returns the human-readable description of this failure.
     */
    String message();

    /** A record was closed before this field was given a value. */
    record MissingField(TxFieldKey key) implements ParserError {
        public MissingField {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public String message() {
            return "required field " + key + " is missing";
        }
    }

    /** A key outside the fixed field key table. */
    record UnparsableKey(String key) implements ParserError {
        public UnparsableKey {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public String message() {
            return "unknown key " + key;
        }
    }

    /** A value that cannot be converted to its field's type. */
    record UnparsableValue(String value) implements ParserError {
        public UnparsableValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String message() {
            return "value " + value + " can't be parsed";
        }
    }

    /** The same key was given twice within one open record. */
    record Duplicate(TxFieldKey key) implements ParserError {
        public Duplicate {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public String message() {
            return "field " + key + " has duplicate";
        }
    }

    /** A non-blank, non-comment text line without a {@code :} separator. */
    record NoFieldDelimiter() implements ParserError {
        @Override
        public String message() {
            return "key-value delimiter is expected";
        }
    }

    /** A description value not wrapped in a pair of double quotes. */
    record ShellBeQuoted(String value) implements ParserError {
        public ShellBeQuoted {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String message() {
            return "string ->" + value + "<- shall be double quoted";
        }
    }

    /** The first line of a CSV file is not the fixed header. */
    record InvalidFileHeader() implements ParserError {
        @Override
        public String message() {
            return "invalid file header";
        }
    }

    /**
     * A binary frame does not start with the record magic.
     *
     * @param found hex dump of the four bytes found instead
     */
    record InvalidRecordHeader(String found) implements ParserError {
        public InvalidRecordHeader {
            Objects.requireNonNull(found, "found");
        }

        @Override
        public String message() {
            return "invalid record header \"" + found + "\"";
        }
    }

    /** A binary frame or CSV row is too short to hold every field. */
    record IncompleteRecord() implements ParserError {
        @Override
        public String message() {
            return "incomplete record (doesn't have all required fields)";
        }
    }
}

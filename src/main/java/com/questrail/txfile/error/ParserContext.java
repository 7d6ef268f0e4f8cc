package com.questrail.txfile.error;

import com.questrail.txfile.model.TxFieldKey;

import java.util.Objects;

/**
 * Location of a domain failure within its input.
 *
 * <p>The shape depends on the format, and the shapes never mix within one
 * format:</p>
 * <ul>
 *   <li>{@link Line}: text and CSV, the line number plus the raw line</li>
 *   <li>{@link Position}: binary, a byte offset</li>
 *   <li>{@link FieldPosition}: binary, a byte offset plus the field being decoded</li>
 * </ul>
 */
public sealed interface ParserContext
        permits ParserContext.Line, ParserContext.Position, ParserContext.FieldPosition {

    /**
     * Returns the human-readable location.
     */
    String describe();

    static ParserContext line(int lineNumber, String line) {
        return new Line(lineNumber, line);
    }

    static ParserContext position(long offset) {
        return new Position(offset);
    }

    static ParserContext fieldPosition(long offset, TxFieldKey fieldKey) {
        return new FieldPosition(offset, fieldKey);
    }

    record Line(int lineNumber, String line) implements ParserContext {
        public Line {
            Objects.requireNonNull(line, "line");
        }

        @Override
        public String describe() {
            return "line #" + lineNumber + ", content: `" + line + "`";
        }
    }

    record Position(long offset) implements ParserContext {
        @Override
        public String describe() {
            return "position #" + offset;
        }
    }

    record FieldPosition(long offset, TxFieldKey fieldKey) implements ParserContext {
        public FieldPosition {
            Objects.requireNonNull(fieldKey, "fieldKey");
        }

        @Override
        public String describe() {
            return "position #" + offset + ", field being parsed: `" + fieldKey + "`";
        }
    }
}

package com.questrail.txfile.model;

import com.questrail.txfile.error.ParserError;
import com.questrail.txfile.error.ParserException;

import java.util.Objects;

/**
 * TxRecord
 * -----------------------------------------------------------------------------
 * Immutable financial transaction record shared by every file format.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Every field is present. A record can never be constructed with a
 *       missing (null) component.</li>
 *   <li>{@link TxKind} and {@link TxStatus} are closed sets.</li>
 *   <li>Equality and hashing are structural over all eight fields. Two records
 *       that differ only by timestamp are distinct.</li>
 * </ul>
 *
 * <h2>Deliberately not enforced</h2>
 * <p>No cross-field rule is checked. The kind is not validated against the
 * source/destination accounts being zero or nonzero, and the sign of
 * {@code amount} is not validated against the kind.</p>
 *
 * @param id          opaque transaction identifier
 * @param kind        transaction kind
 * @param from        source account
 * @param to          destination account
 * @param amount      signed amount in minor currency units
 * @param timestamp   milliseconds since the epoch
 * @param status      transaction outcome
 * @param description free text, possibly empty
 */
public record TxRecord(
        TxId id,
        TxKind kind,
        AccountId from,
        AccountId to,
        long amount,
        TxTimestamp timestamp,
        TxStatus status,
        String description
) {
    public TxRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(description, "description");
    }

    /**
     * Parses a signed decimal amount.
     *
     * @throws ParserException with {@link ParserError.UnparsableValue} if the
     *         text is not a signed 64-bit decimal
     */
    public static long parseAmount(String text) throws ParserException
    {
        try {
            return Long.parseLong(text);
        }
        catch (NumberFormatException e) {
            throw new ParserException(new ParserError.UnparsableValue(text), e);
        }
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Fluent builder for callers assembling records by hand.
     *
     * <p>{@link #build()} fails with {@link NullPointerException} naming the
     * first unset field. Codecs do not use this builder; they report missing
     * fields as {@link ParserError.MissingField}.</p>
     */
    public static final class Builder
    {
        private TxId id;
        private TxKind kind;
        private AccountId from;
        private AccountId to;
        private Long amount;
        private TxTimestamp timestamp;
        private TxStatus status;
        private String description;

        private Builder() {}

        public Builder id(long id) {
            this.id = TxId.of(id);
            return this;
        }

        public Builder kind(TxKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder from(long from) {
            this.from = AccountId.of(from);
            return this;
        }

        public Builder to(long to) {
            this.to = AccountId.of(to);
            return this;
        }

        public Builder amount(long amount) {
            this.amount = amount;
            return this;
        }

        public Builder timestamp(long millis) {
            this.timestamp = TxTimestamp.ofMillis(millis);
            return this;
        }

        public Builder status(TxStatus status) {
            this.status = status;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public TxRecord build() {
            // Checked in canonical order so the first unset field is the one named.
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            Objects.requireNonNull(amount, "amount");
            return new TxRecord(id, kind, from, to, amount, timestamp, status, description);
        }
    }
}

package com.questrail.txfile.model;

/**
 * Shared sample records for codec and comparison tests.
 */
public final class TxRecordFixtures
{
    private TxRecordFixtures() {}

    public static TxRecord payment()
    {
        return TxRecord.builder()
                .id(1)
                .kind(TxKind.TRANSFER)
                .from(11)
                .to(22)
                .amount(-500)
                .timestamp(1_700_000)
                .status(TxStatus.PENDING)
                .description("payment")
                .build();
    }

    public static TxRecord refund()
    {
        return TxRecord.builder()
                .id(2)
                .kind(TxKind.DEPOSIT)
                .from(0)
                .to(11)
                .amount(500)
                .timestamp(1_700_500)
                .status(TxStatus.SUCCESS)
                .description("refund")
                .build();
    }

    /**
     * Exercises the edges of every field: unsigned maxima, negative amount,
     * empty description and non-ASCII text.
     */
    public static TxRecord extremes()
    {
        return new TxRecord(
                TxId.of(-1L),
                TxKind.WITHDRAWAL,
                AccountId.of(Long.MIN_VALUE),
                AccountId.of(0),
                Long.MIN_VALUE,
                TxTimestamp.ofMillis(-1L),
                TxStatus.FAILURE,
                "");
    }

    public static TxRecord unicode()
    {
        return TxRecord.builder()
                .id(42)
                .kind(TxKind.TRANSFER)
                .from(7)
                .to(8)
                .amount(Long.MAX_VALUE)
                .timestamp(0)
                .status(TxStatus.SUCCESS)
                .description("café ☕ — 日本")
                .build();
    }
}

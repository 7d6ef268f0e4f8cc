package com.questrail.txfile.compare;

import com.questrail.txfile.model.TxRecord;
import com.questrail.txfile.model.TxRecordFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class TxRecordComparisonTest
{
    private final TxRecord tx1 = TxRecordFixtures.payment();
    private final TxRecord tx2 = TxRecordFixtures.refund();

    @Test
    void identicalSetsInAnyOrderMatch()
    {
        ComparisonReport report = TxRecordComparison.compare(List.of(tx1, tx2, tx1), List.of(tx1, tx1, tx2));

        assertTrue(report.isIdentical());
        assertTrue(report.unmatched().isEmpty());
    }

    @Test
    void emptySetsMatch()
    {
        assertTrue(TxRecordComparison.compare(List.of(), List.of()).isIdentical());
    }

    @Test
    void recordOnlyInFirstIsReported()
    {
        ComparisonReport report = TxRecordComparison.compare(List.of(tx1, tx2), List.of(tx2));

        assertEquals(List.of(new UnmatchedRecord(tx1, 1)), report.unmatched());
        UnmatchedRecord unmatched = report.unmatched().get(0);
        assertEquals(FileSide.FIRST, unmatched.foundIn());
        assertEquals(FileSide.SECOND, unmatched.missingFrom());
    }

    @Test
    void recordOnlyInSecondIsReported()
    {
        ComparisonReport report = TxRecordComparison.compare(List.of(), List.of(tx2));

        UnmatchedRecord unmatched = report.unmatched().get(0);
        assertEquals(-1, unmatched.netCount());
        assertEquals(FileSide.SECOND, unmatched.foundIn());
        assertEquals(FileSide.FIRST, unmatched.missingFrom());
    }

    @Test
    void multiplicityCounts()
    {
        ComparisonReport report = TxRecordComparison.compare(List.of(tx1, tx1, tx1), List.of(tx1));

        assertEquals(List.of(new UnmatchedRecord(tx1, 2)), report.unmatched());
    }

    @Test
    void anyFieldDifferenceMakesRecordsDistinct()
    {
        TxRecord sameIdOtherDescription = TxRecord.builder()
                .id(1)
                .kind(tx1.kind())
                .from(11)
                .to(22)
                .amount(-500)
                .timestamp(1_700_000)
                .status(tx1.status())
                .description("payment ")
                .build();

        ComparisonReport report = TxRecordComparison.compare(List.of(tx1), List.of(sameIdOtherDescription));

        assertEquals(2, report.unmatched().size());
        assertEquals(FileSide.FIRST, report.unmatched().get(0).foundIn());
        assertEquals(FileSide.SECOND, report.unmatched().get(1).foundIn());
    }

    @Test
    void reportOrderFollowsFirstAppearance()
    {
        TxRecord tx3 = TxRecordFixtures.unicode();

        ComparisonReport report = TxRecordComparison.compare(List.of(tx2, tx1), List.of(tx3));

        assertEquals(List.of(tx2, tx1, tx3),
                report.unmatched().stream().map(UnmatchedRecord::record).collect(Collectors.toList()));
    }

    @Test
    void zeroNetCountIsNotAnUnmatchedRecord()
    {
        assertThrows(IllegalArgumentException.class, () -> new UnmatchedRecord(tx1, 0));
    }
}

package com.questrail.txfile.compare;

import com.questrail.txfile.model.TxRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * TxRecordComparison
 * -----------------------------------------------------------------------------
 * Signed multiset difference of two record sets.
 *
 * <p>Each distinct record (by full structural equality) is counted +1 per
 * occurrence in the first set and -1 per occurrence in the second. Records
 * whose count ends at zero appear equally often in both and are matched.
 * Record order within either set does not matter.</p>
 */
public final class TxRecordComparison
{
    private TxRecordComparison() {}

    public static ComparisonReport compare(List<TxRecord> first, List<TxRecord> second)
    {
        final Map<TxRecord, Integer> counts = new LinkedHashMap<>();
        for (TxRecord record : first) {
            counts.merge(record, 1, Integer::sum);
        }
        for (TxRecord record : second) {
            counts.merge(record, -1, Integer::sum);
        }

        final List<UnmatchedRecord> unmatched = new ArrayList<>();
        counts.forEach((record, count) -> {
            if (count != 0) {
                unmatched.add(new UnmatchedRecord(record, count));
            }
        });
        return new ComparisonReport(unmatched);
    }
}

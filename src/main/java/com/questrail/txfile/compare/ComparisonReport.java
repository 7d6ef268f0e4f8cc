package com.questrail.txfile.compare;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of comparing two record sets.
 *
 * @param unmatched one entry per distinct record with a nonzero net count,
 *                  in order of first appearance
 */
public record ComparisonReport(List<UnmatchedRecord> unmatched)
{
    public ComparisonReport {
        unmatched = List.copyOf(Objects.requireNonNull(unmatched, "unmatched"));
    }

    public boolean isIdentical()
    {
        return unmatched.isEmpty();
    }
}

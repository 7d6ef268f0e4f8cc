package com.questrail.txfile.compare;

import com.questrail.txfile.model.TxRecord;

import java.util.Objects;

/**
 * A record whose occurrence counts differ between the two record sets.
 *
 * @param record   the record, compared by full structural equality
 * @param netCount occurrences in the first set minus occurrences in the
 *                 second; never zero
 */
public record UnmatchedRecord(TxRecord record, int netCount)
{
    public UnmatchedRecord {
        Objects.requireNonNull(record, "record");
        if (netCount == 0) {
            throw new IllegalArgumentException("netCount must be nonzero");
        }
    }

    /**
     * The set holding the surplus occurrences.
     */
    public FileSide foundIn()
    {
        return netCount > 0 ? FileSide.FIRST : FileSide.SECOND;
    }

    /**
     * The set lacking a matching occurrence.
     */
    public FileSide missingFrom()
    {
        return foundIn().other();
    }
}

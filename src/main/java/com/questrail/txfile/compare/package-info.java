/**
 * Comparison of two transaction record sets as multisets.
 *
 * <p>The comparison is keyed by full structural equality of
 * {@link com.questrail.txfile.model.TxRecord}: two records differing only by
 * timestamp are distinct, and a record present twice in one set and once in
 * the other is reported once with a net count of one.</p>
 */
package com.questrail.txfile.compare;

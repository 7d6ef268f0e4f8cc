/**
 * Concrete transaction file codecs.
 *
 * <pre>
 *   BinaryTxCodec   length-prefixed frames, located by byte offset (+ field)
 *   TextTxCodec     KEY: value blocks, located by 1-based line
 *   CsvTxCodec      fixed header + 8 columns, located by 0-based line
 *   NoOpTxCodec     reads and writes nothing
 * </pre>
 *
 * <p>All codecs are stateless and fail fast on the first error.</p>
 */
package com.questrail.txfile.codec.impl;

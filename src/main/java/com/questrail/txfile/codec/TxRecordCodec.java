package com.questrail.txfile.codec;

/**
 * A parser and writer pair for one file format.
 *
 * <p>Implementations are stateless. Each call owns only its own local
 * buffers, so a single instance may be used from several threads as long as
 * every call works on an independent stream.</p>
 */
public interface TxRecordCodec extends TxRecordParser, TxRecordWriter
{
}

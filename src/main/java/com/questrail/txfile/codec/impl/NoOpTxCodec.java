package com.questrail.txfile.codec.impl;

import com.questrail.txfile.codec.TxRecordCodec;
import com.questrail.txfile.model.TxRecord;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

/**
 * No-op codec. Parsing yields no records without touching the stream and
 * writing emits nothing.
 */
public final class NoOpTxCodec implements TxRecordCodec
{
    @Override
    public List<TxRecord> parse(InputStream in)
    {
        return List.of();
    }

    @Override
    public void write(OutputStream out, List<TxRecord> records)
    {
    }
}

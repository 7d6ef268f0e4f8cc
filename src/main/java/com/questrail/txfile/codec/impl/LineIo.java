package com.questrail.txfile.codec.impl;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Stream adapters for the line-oriented formats.
 *
 * <p>Input is decoded as strict UTF-8: malformed bytes raise a
 * {@link java.nio.charset.MalformedInputException} from {@code readLine()}
 * rather than being replaced. {@link BufferedReader#readLine()} accepts LF,
 * CRLF and CR terminators. Output always uses LF and is encoded just as
 * strictly: a string with no UTF-8 form, such as one holding a lone
 * surrogate, fails the write instead of being written as {@code ?}.</p>
 *
 * <p>The returned reader and writer wrap the caller's stream and must not be
 * closed by the codecs.</p>
 */
final class LineIo
{
    static final char LINE_END = '\n';

    private LineIo() {}

    static BufferedReader reader(InputStream in)
    {
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return new BufferedReader(new InputStreamReader(in, decoder));
    }

    static Writer writer(OutputStream out)
    {
        final CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return new BufferedWriter(new OutputStreamWriter(out, encoder));
    }
}

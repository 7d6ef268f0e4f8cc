package com.questrail.txfile.tool;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File-open plumbing shared by the tools.
 */
final class ToolStreams
{
    private ToolStreams() {}

    static InputStream openInput(Path path) throws IOException
    {
        try {
            return new BufferedInputStream(Files.newInputStream(path));
        }
        catch (IOException e) {
            throw new IOException("Error opening a file " + path + " " + e, e);
        }
    }

    static OutputStream openOutput(Path path) throws IOException
    {
        try {
            return new BufferedOutputStream(Files.newOutputStream(path));
        }
        catch (IOException e) {
            throw new IOException("Error opening a file " + path + " " + e, e);
        }
    }

    /**
     * Wraps a process-wide stream such as standard output so that closing the
     * wrapper only flushes it.
     */
    static OutputStream unclosable(OutputStream out)
    {
        return new FilterOutputStream(out) {
            @Override
            public void write(byte[] b, int off, int len) throws IOException
            {
                out.write(b, off, len);
            }

            @Override
            public void close() throws IOException
            {
                flush();
            }
        };
    }
}

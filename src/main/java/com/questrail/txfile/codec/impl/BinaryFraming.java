package com.questrail.txfile.codec.impl;

import io.netty.buffer.ByteBufUtil;

import java.util.Arrays;
import java.util.Locale;

/**
 * BinaryFraming
 * -----------------------------------------------------------------------------
 * Layout constants of the binary transaction frame.
 *
 * <p>A frame is self-delimiting. All integers are big-endian:</p>
 * <pre>
 *   offset  size  field
 *   ------  ----  ----------------------------------------------
 *        0     4  magic "YPBN" (59 50 42 4E)
 *        4     4  body length, unsigned, bytes following this field
 *   body:
 *        0     8  id, unsigned
 *        8     1  kind code
 *        9     8  from account, unsigned
 *       17     8  to account, unsigned
 *       25     8  amount, signed
 *       33     8  timestamp millis, unsigned
 *       41     1  status code
 *       42     4  description length, unsigned
 *       46     n  description, UTF-8
 * </pre>
 *
 * <p>This class only describes the layout; reading and writing happen in
 * {@link BinaryTxCodec}.</p>
 */
final class BinaryFraming
{
    /** Record magic, ASCII "YPBN". */
    static final byte[] MAGIC = { 0x59, 0x50, 0x42, 0x4E };

    static final int MAGIC_LENGTH = MAGIC.length;

    /** Size of the unsigned body length field. */
    static final int LENGTH_FIELD_SIZE = 4;

    /**
     * Size of the fixed part of the body: everything except the description
     * bytes themselves.
     */
    static final int FIXED_BODY_SIZE = 8 + 1 + 8 + 8 + 8 + 8 + 1 + 4;

    /** Largest body a single Java array can hold. */
    static final long MAX_BODY_SIZE = Integer.MAX_VALUE - 8;

    private BinaryFraming() {}

    static boolean isMagic(byte[] candidate)
    {
        return Arrays.equals(MAGIC, candidate);
    }

    /**
     * Uppercase hex dump of the bytes found where the magic was expected.
     */
    static String hex(byte[] bytes)
    {
        return ByteBufUtil.hexDump(bytes).toUpperCase(Locale.ROOT);
    }
}

package com.questrail.txfile.codec.impl;

import com.questrail.txfile.codec.TxRecordCodec;
import com.questrail.txfile.error.ParserContext;
import com.questrail.txfile.error.ParserError;
import com.questrail.txfile.error.ParserException;
import com.questrail.txfile.error.TxCodecException;
import com.questrail.txfile.error.TxParsingException;
import com.questrail.txfile.error.TxReadException;
import com.questrail.txfile.error.TxWriteException;
import com.questrail.txfile.model.AccountId;
import com.questrail.txfile.model.TxFieldKey;
import com.questrail.txfile.model.TxId;
import com.questrail.txfile.model.TxKind;
import com.questrail.txfile.model.TxRecord;
import com.questrail.txfile.model.TxStatus;
import com.questrail.txfile.model.TxTimestamp;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * BinaryTxCodec
 * -----------------------------------------------------------------------------
 * Reader and writer for the length-prefixed binary frame format described in
 * {@link BinaryFraming}.
 *
 * <p>The parser performs the following steps per frame, in order:</p>
 * <ol>
 *   <li>Read the magic. Zero bytes available here is a clean end of input;
 *       one to three bytes is a truncated stream.</li>
 *   <li>Validate the magic</li>
 *   <li>Read and validate the body length against the fixed body size</li>
 *   <li>Read the whole body in one shot</li>
 *   <li>Decode the body fields sequentially</li>
 * </ol>
 *
 * <p>A stream ending anywhere inside a frame is a {@link TxReadException},
 * never a domain error. Domain errors are located by byte offset from the
 * start of the input and, where a single field is at fault, by field key.</p>
 *
 * <h2>Netty containment rule</h2>
 * {@link ByteBuf} is used for big-endian field access only. Netty types do not
 * escape this class, and every buffer is released before returning.
 */
public final class BinaryTxCodec implements TxRecordCodec
{
    @Override
    public List<TxRecord> parse(InputStream in) throws TxCodecException
    {
        Objects.requireNonNull(in, "in");

        final List<TxRecord> records = new ArrayList<>();
        final byte[] magic = new byte[BinaryFraming.MAGIC_LENGTH];
        long position = 0;

        try {
            while (true) {
                final long frameStart = position;

                final int magicRead = in.readNBytes(magic, 0, magic.length);
                if (magicRead == 0) {
                    break;
                }
                if (magicRead < magic.length) {
                    throw new EOFException("stream ended inside record magic at position "
                            + (frameStart + magicRead));
                }
                position += magic.length;

                if (!BinaryFraming.isMagic(magic)) {
                    throw new TxParsingException(
                            ParserContext.position(frameStart),
                            new ParserError.InvalidRecordHeader(BinaryFraming.hex(magic)));
                }

                final long bodyLength = readBodyLength(in);
                position += BinaryFraming.LENGTH_FIELD_SIZE;

                if (bodyLength < BinaryFraming.FIXED_BODY_SIZE) {
                    throw new TxParsingException(
                            ParserContext.position(position),
                            new ParserError.IncompleteRecord());
                }
                if (bodyLength > BinaryFraming.MAX_BODY_SIZE) {
                    throw new IOException("record body of " + bodyLength
                            + " bytes at position " + position + " is too large to buffer");
                }

                final byte[] body = in.readNBytes((int) bodyLength);
                if (body.length < bodyLength) {
                    throw new EOFException("stream ended inside record body at position "
                            + (position + body.length));
                }

                records.add(decodeBody(body, position));
                position += bodyLength;
            }
        }
        catch (IOException e) {
            throw new TxReadException(e);
        }

        return Collections.unmodifiableList(records);
    }

    @Override
    public void write(OutputStream out, List<TxRecord> records) throws TxCodecException
    {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(records, "records");

        try {
            for (TxRecord record : records) {
                writeFrame(out, record);
            }
            out.flush();
        }
        catch (IOException e) {
            throw new TxWriteException(e);
        }
    }

    private static long readBodyLength(InputStream in) throws IOException
    {
        final byte[] field = in.readNBytes(BinaryFraming.LENGTH_FIELD_SIZE);
        if (field.length < BinaryFraming.LENGTH_FIELD_SIZE) {
            throw new EOFException("stream ended inside record length field");
        }
        final ByteBuf buf = Unpooled.wrappedBuffer(field);
        try {
            return buf.readUnsignedInt();
        }
        finally {
            buf.release();
        }
    }

    /**
     * Decodes one frame body.
     *
     * @param body          exactly the body bytes announced by the frame header
     * @param bodyPosition  input offset of the first body byte
     */
    private static TxRecord decodeBody(byte[] body, long bodyPosition)
            throws IOException, TxParsingException
    {
        final ByteBuf buf = Unpooled.wrappedBuffer(body);
        try {
            final TxId id = TxId.of(buf.readLong());

            final int kindCode = buf.readUnsignedByte();
            final TxKind kind;
            try {
                kind = TxKind.fromCode(kindCode);
            }
            catch (ParserException e) {
                throw e.at(ParserContext.fieldPosition(bodyPosition + buf.readerIndex(), TxFieldKey.KIND));
            }

            final AccountId from = AccountId.of(buf.readLong());
            final AccountId to = AccountId.of(buf.readLong());
            final long amount = buf.readLong();
            final TxTimestamp timestamp = TxTimestamp.ofMillis(buf.readLong());

            final int statusCode = buf.readUnsignedByte();
            final TxStatus status;
            try {
                status = TxStatus.fromCode(statusCode);
            }
            catch (ParserException e) {
                throw e.at(ParserContext.fieldPosition(bodyPosition + buf.readerIndex(), TxFieldKey.STATUS));
            }

            final long descriptionLength = buf.readUnsignedInt();
            if (descriptionLength > buf.readableBytes()) {
                // The body buffer runs dry before the description ends.
                throw new EOFException("description of " + descriptionLength
                        + " bytes overruns record body at position "
                        + (bodyPosition + buf.readerIndex()));
            }
            final byte[] descriptionBytes = new byte[(int) descriptionLength];
            buf.readBytes(descriptionBytes);

            final String description;
            try {
                description = decodeUtf8(descriptionBytes);
            }
            catch (ParserException e) {
                throw e.at(ParserContext.fieldPosition(bodyPosition + buf.readerIndex(), TxFieldKey.DESCRIPTION));
            }

            // Bytes past the description, if any, are ignored.
            return new TxRecord(id, kind, from, to, amount, timestamp, status, description);
        }
        finally {
            buf.release();
        }
    }

    private static String decodeUtf8(byte[] bytes) throws ParserException
    {
        try {
            // newDecoder() reports malformed input instead of substituting it
            return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
        }
        catch (CharacterCodingException e) {
            throw new ParserException(new ParserError.UnparsableValue("non utf-8 string"), e);
        }
    }

    /**
     * Strict counterpart of {@link #decodeUtf8}: a description that has no
     * UTF-8 form, such as one holding a lone surrogate, fails the write.
     */
    private static byte[] encodeUtf8(String value) throws CharacterCodingException
    {
        final ByteBuffer encoded = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .encode(CharBuffer.wrap(value));
        final byte[] bytes = new byte[encoded.remaining()];
        encoded.get(bytes);
        return bytes;
    }

    private static void writeFrame(OutputStream out, TxRecord record) throws IOException
    {
        final byte[] description = encodeUtf8(record.description());
        final int bodyLength = BinaryFraming.FIXED_BODY_SIZE + description.length;

        final ByteBuf frame = Unpooled.buffer(
                BinaryFraming.MAGIC_LENGTH + BinaryFraming.LENGTH_FIELD_SIZE + bodyLength);
        try {
            frame.writeBytes(BinaryFraming.MAGIC);
            frame.writeInt(bodyLength);

            frame.writeLong(record.id().value());
            frame.writeByte(record.kind().code());
            frame.writeLong(record.from().value());
            frame.writeLong(record.to().value());
            frame.writeLong(record.amount());
            frame.writeLong(record.timestamp().millis());
            frame.writeByte(record.status().code());
            frame.writeInt(description.length);
            frame.writeBytes(description);

            frame.readBytes(out, frame.readableBytes());
        }
        finally {
            frame.release();
        }
    }
}

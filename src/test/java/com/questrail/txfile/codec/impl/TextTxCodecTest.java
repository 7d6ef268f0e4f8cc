package com.questrail.txfile.codec.impl;

import com.questrail.txfile.error.ParserContext;
import com.questrail.txfile.error.ParserError;
import com.questrail.txfile.error.TxCodecException;
import com.questrail.txfile.error.TxParsingException;
import com.questrail.txfile.error.TxReadException;
import com.questrail.txfile.error.TxWriteException;
import com.questrail.txfile.model.TxFieldKey;
import com.questrail.txfile.model.TxKind;
import com.questrail.txfile.model.TxRecord;
import com.questrail.txfile.model.TxRecordFixtures;
import com.questrail.txfile.model.TxStatus;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TextTxCodecTest
{
    private static final String PAYMENT_TEXT = String.join("\n",
            "TX_ID: 1",
            "TX_TYPE: TRANSFER",
            "FROM_USER_ID: 11",
            "TO_USER_ID: 22",
            "AMOUNT: -500",
            "TIMESTAMP: 1700000",
            "STATUS: PENDING",
            "DESCRIPTION: \"payment\"",
            "");

    private final TextTxCodec codec = new TextTxCodec();

    @Test
    void writerEmitsCanonicalFieldsAndBlankLine() throws TxCodecException
    {
        assertEquals(PAYMENT_TEXT + "\n", write(List.of(TxRecordFixtures.payment())));
    }

    @Test
    void parsesWrittenRecords() throws TxCodecException
    {
        List<TxRecord> records = List.of(
                TxRecordFixtures.payment(),
                TxRecordFixtures.refund(),
                TxRecordFixtures.extremes(),
                TxRecordFixtures.unicode());

        assertEquals(records, parse(write(records)));
    }

    @Test
    void emptyAndCommentOnlyInputParsesToNoRecords() throws TxCodecException
    {
        assertTrue(parse("").isEmpty());
        assertTrue(parse("# header\n\n\n   # indented comment\n").isEmpty());
    }

    @Test
    void commentsAndExtraBlankLinesBetweenRecords() throws TxCodecException
    {
        String input = "# exported records\n\n\n"
                + PAYMENT_TEXT
                + "\n\n# second\n"
                + "TX_ID: 2\nTX_TYPE: DEPOSIT\nFROM_USER_ID: 0\nTO_USER_ID: 11\n"
                + "AMOUNT: 500\nTIMESTAMP: 1700500\nSTATUS: SUCCESS\nDESCRIPTION: \"refund\"";

        assertEquals(List.of(TxRecordFixtures.payment(), TxRecordFixtures.refund()), parse(input));
    }

    @Test
    void fieldsMayAppearInAnyOrder() throws TxCodecException
    {
        String input = String.join("\n",
                "DESCRIPTION: \"payment\"",
                "  STATUS :   PENDING  ",
                "TIMESTAMP: 1700000",
                "AMOUNT: -500",
                "TO_USER_ID: 22",
                "FROM_USER_ID: 11",
                "TX_TYPE: TRANSFER",
                "TX_ID: 1");

        assertEquals(List.of(TxRecordFixtures.payment()), parse(input));
    }

    @Test
    void descriptionMayContainColonsAndCommas() throws TxCodecException
    {
        String input = PAYMENT_TEXT.replace("\"payment\"", "\"re: invoice, march\"");

        assertEquals("re: invoice, march", parse(input).get(0).description());
    }

    @Test
    void crlfLineEndingsAreAccepted() throws TxCodecException
    {
        assertEquals(List.of(TxRecordFixtures.payment()), parse(PAYMENT_TEXT.replace("\n", "\r\n")));
    }

    @Test
    void duplicateFieldIsReportedOnSecondOccurrence()
    {
        TxParsingException e = assertThrows(TxParsingException.class, () -> parse("TX_ID: 1\nTX_ID: 2\n"));

        assertEquals(new ParserError.Duplicate(TxFieldKey.ID), e.error());
        assertEquals(new ParserContext.Line(2, "TX_ID: 2"), e.context());
    }

    @Test
    void missingFieldIsReportedAtRecordEnd()
    {
        String input = PAYMENT_TEXT.replace("DESCRIPTION: \"payment\"\n", "") + "\nTX_ID: 2\n";

        TxParsingException e = assertThrows(TxParsingException.class, () -> parse(input));

        assertEquals(new ParserError.MissingField(TxFieldKey.DESCRIPTION), e.error());
        assertEquals(new ParserContext.Line(8, ""), e.context());
    }

    @Test
    void missingFieldAtEndOfInputUsesLastLine()
    {
        TxParsingException e = assertThrows(TxParsingException.class,
                () -> parse("TX_TYPE: DEPOSIT\nSTATUS: SUCCESS"));

        assertEquals(new ParserError.MissingField(TxFieldKey.ID), e.error());
        assertEquals(new ParserContext.Line(2, "STATUS: SUCCESS"), e.context());
    }

    @Test
    void lineWithoutDelimiterIsRejected()
    {
        TxParsingException e = assertThrows(TxParsingException.class, () -> parse("TX_ID 1\n"));

        assertEquals(new ParserError.NoFieldDelimiter(), e.error());
        assertEquals(new ParserContext.Line(1, "TX_ID 1"), e.context());
    }

    @Test
    void unknownKeyIsRejected()
    {
        TxParsingException e = assertThrows(TxParsingException.class, () -> parse("# c\nCURRENCY: EUR\n"));

        assertEquals(new ParserError.UnparsableKey("CURRENCY"), e.error());
        assertEquals(new ParserContext.Line(2, "CURRENCY: EUR"), e.context());
    }

    @Test
    void unquotedDescriptionIsRejected()
    {
        TxParsingException e = assertThrows(TxParsingException.class,
                () -> parse("DESCRIPTION: payment\n"));

        assertEquals(new ParserError.ShellBeQuoted("payment"), e.error());
    }

    @Test
    void singleQuoteCharacterIsNotAQuotedEmptyString()
    {
        TxParsingException e = assertThrows(TxParsingException.class,
                () -> parse("DESCRIPTION: \"\n"));

        assertEquals(new ParserError.ShellBeQuoted("\""), e.error());
    }

    @Test
    void badValuesAreUnparsable()
    {
        assertEquals(new ParserError.UnparsableValue("deposit"),
                assertThrows(TxParsingException.class, () -> parse("TX_TYPE: deposit")).error());
        assertEquals(new ParserError.UnparsableValue("-1"),
                assertThrows(TxParsingException.class, () -> parse("TX_ID: -1")).error());
        assertEquals(new ParserError.UnparsableValue("DONE"),
                assertThrows(TxParsingException.class, () -> parse("STATUS: DONE")).error());
    }

    @Test
    void emptyQuotedDescriptionIsAccepted() throws TxCodecException
    {
        TxRecord record = parse(PAYMENT_TEXT.replace("\"payment\"", "\"\"")).get(0);

        assertEquals("", record.description());
        assertEquals(TxKind.TRANSFER, record.kind());
        assertEquals(TxStatus.PENDING, record.status());
    }

    @Test
    void malformedUtf8IsReadError()
    {
        byte[] input = { 'T', 'X', '_', 'I', 'D', ':', ' ', (byte) 0xC3, (byte) 0x28, '\n' };

        assertThrows(TxReadException.class, () -> codec.parse(new ByteArrayInputStream(input)));
    }

    @Test
    void descriptionWithoutUtf8FormIsWriteError()
    {
        TxRecord loneSurrogate = TxRecord.builder()
                .id(5)
                .kind(TxKind.DEPOSIT)
                .from(0)
                .to(1)
                .amount(10)
                .timestamp(5)
                .status(TxStatus.SUCCESS)
                .description("a\uD800b")
                .build();

        TxWriteException e = assertThrows(TxWriteException.class,
                () -> codec.write(new ByteArrayOutputStream(), List.of(loneSurrogate)));
        assertInstanceOf(CharacterCodingException.class, e.getCause());
    }

    // -------------------------------------------------------------------------

    private List<TxRecord> parse(String text) throws TxCodecException
    {
        return codec.parse(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    }

    private String write(List<TxRecord> records) throws TxCodecException
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        codec.write(out, records);
        return out.toString(StandardCharsets.UTF_8);
    }
}

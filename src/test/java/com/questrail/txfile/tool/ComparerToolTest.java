package com.questrail.txfile.tool;

import com.questrail.txfile.codec.TxFormat;
import com.questrail.txfile.compare.ComparisonReport;
import com.questrail.txfile.compare.UnmatchedRecord;
import com.questrail.txfile.config.ComparerConfig;
import com.questrail.txfile.model.TxRecordFixtures;
import com.questrail.txfile.observability.NullObservabilitySink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ComparerToolTest
{
    @TempDir
    Path dir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    @Test
    void identicalFilesInDifferentFormats() throws Exception
    {
        Path first = dir.resolve("a.bin");
        Path second = dir.resolve("b.txt");
        ConverterToolTest.write(first, TxFormat.BINARY, List.of(TxRecordFixtures.payment(), TxRecordFixtures.refund()));
        ConverterToolTest.write(second, TxFormat.TEXT, List.of(TxRecordFixtures.refund(), TxRecordFixtures.payment()));

        ExitCode exit = run("--file1", first.toString(), "--format1", "binary",
                "--file2", second.toString(), "--format2", "text");

        assertEquals(ExitCode.SUCCESS, exit);
        assertEquals("All transaction records are identical.\n", output());
    }

    @Test
    void differencesAreListed() throws Exception
    {
        Path first = dir.resolve("a.csv");
        Path second = dir.resolve("b.csv");
        ConverterToolTest.write(first, TxFormat.CSV, List.of(TxRecordFixtures.payment(), TxRecordFixtures.refund()));
        ConverterToolTest.write(second, TxFormat.CSV, List.of(TxRecordFixtures.refund()));

        ExitCode exit = run("--file1", first.toString(), "--format1", "csv",
                "--file2", second.toString(), "--format2", "csv");

        assertEquals(ExitCode.SUCCESS, exit);
        assertEquals("There are 1 unique transactions that don't match between the files\n"
                + "There is no equivalent for transaction 1 from file '#1' in the file '#2'\n", output());
    }

    @Test
    void printShowsSecondSideAndOccurrences()
    {
        ComparisonReport report = new ComparisonReport(List.of(
                new UnmatchedRecord(TxRecordFixtures.refund(), -3)));

        ComparerTool.print(report, new PrintStream(stdout, true, StandardCharsets.UTF_8));

        assertEquals("There are 1 unique transactions that don't match between the files\n"
                + "There is no equivalent for transaction 2 from file '#2' in the file '#1' (3 occurrences)\n",
                output());
    }

    @Test
    void unreadableSecondFileFails() throws Exception
    {
        Path first = dir.resolve("a.txt");
        Path second = dir.resolve("b.bin");
        ConverterToolTest.write(first, TxFormat.TEXT, List.of(TxRecordFixtures.payment()));
        Files.write(second, new byte[] { 'N', 'O', 'P', 'E', 0, 0, 0, 46 });

        ExitCode exit = run("--file1", first.toString(), "--format1", "text",
                "--file2", second.toString(), "--format2", "binary");

        assertEquals(ExitCode.FAILURE, exit);
        assertEquals("Error occurred during application execution: invalid record header \"4E4F5045\":\n"
                + "position #0\n", stderr.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"));
        assertEquals(0, stdout.size());
    }

    @Test
    void missingOptionPrintsUsage()
    {
        assertEquals(ExitCode.INVALID_ARGS, run("--file1", "a", "--format1", "csv", "--file2", "b"));
        assertTrue(stderr.toString(StandardCharsets.UTF_8).contains(ComparerTool.USAGE));
    }

    @Test
    void optionsMapOntoConfig()
    {
        ComparerConfig config = ComparerTool.configFrom(ToolArguments.parse(new String[] {
                "--file1=a.bin", "--format1=binary", "--file2=b.txt", "--format2=text"
        }));

        assertEquals(new ComparerConfig(Path.of("a.bin"), TxFormat.BINARY, Path.of("b.txt"), TxFormat.TEXT),
                config);
    }

    @Test
    void everyOptionIsRequired()
    {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ComparerTool.configFrom(ToolArguments.parse(new String[] {
                        "--file1", "a", "--format1", "csv", "--file2", "b"
                })));
        assertEquals("missing required option --format2", e.getMessage());
    }

    private ExitCode run(String... args)
    {
        return ComparerTool.run(args,
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8),
                NullObservabilitySink.INSTANCE, Clock.systemUTC());
    }

    private String output()
    {
        return stdout.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }
}

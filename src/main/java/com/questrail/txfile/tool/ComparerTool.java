package com.questrail.txfile.tool;

import com.questrail.txfile.codec.TxFormat;
import com.questrail.txfile.compare.ComparisonReport;
import com.questrail.txfile.compare.TxComparer;
import com.questrail.txfile.compare.UnmatchedRecord;
import com.questrail.txfile.config.ComparerConfig;
import com.questrail.txfile.error.TxCodecException;
import com.questrail.txfile.observability.Slf4jTxObservabilitySink;
import com.questrail.txfile.observability.TxErrorEvent;
import com.questrail.txfile.observability.TxObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Set;

/**
 * ComparerTool
 * =============================================================================
 * Command-line entry point that compares two transaction files, possibly in
 * different formats, as multisets of records.
 *
 * <pre>
 *   comparer --file1 PATH --format1 FORMAT --file2 PATH --format2 FORMAT
 * </pre>
 *
 * <p>The report is printed to standard output, one line per distinct record
 * that has no matching occurrence in the other file.</p>
 */
public final class ComparerTool
{
    private static final Logger log = LoggerFactory.getLogger(ComparerTool.class);

    static final String USAGE =
            "usage: comparer --file1 PATH --format1 binary|text|csv"
                    + " --file2 PATH --format2 binary|text|csv";

    static final String FILE1 = "file1";
    static final String FORMAT1 = "format1";
    static final String FILE2 = "file2";
    static final String FORMAT2 = "format2";

    private ComparerTool() {}

    public static void main(String[] args)
    {
        final ExitCode exit = run(args, System.out, System.err,
                new Slf4jTxObservabilitySink(), Clock.systemUTC());
        System.exit(exit.code());
    }

    static ExitCode run(String[] args, PrintStream out, PrintStream err,
                        TxObservabilitySink sink, Clock clock)
    {
        final ComparerConfig config;
        try {
            config = configFrom(ToolArguments.parse(args));
        }
        catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return ExitCode.INVALID_ARGS;
        }

        log.info("Comparing 2 files: 1:'{}':{} 2:'{}':{}",
                config.file1(), config.format1(), config.file2(), config.format2());

        final TxComparer comparer = new TxComparer(sink, clock);
        final ComparisonReport report;
        try (InputStream first = ToolStreams.openInput(config.file1());
             InputStream second = ToolStreams.openInput(config.file2())) {
            report = comparer.compare(
                    config.file1().toString(), first, config.format1(),
                    config.file2().toString(), second, config.format2());
        }
        catch (TxCodecException | IOException e) {
            sink.onError(new TxErrorEvent(clock.instant(), e.getMessage(), e));
            err.println("Error occurred during application execution: " + e.getMessage());
            return ExitCode.FAILURE;
        }

        print(report, out);
        return ExitCode.SUCCESS;
    }

    static void print(ComparisonReport report, PrintStream out)
    {
        if (report.isIdentical()) {
            out.println("All transaction records are identical.");
            return;
        }

        out.println("There are " + report.unmatched().size()
                + " unique transactions that don't match between the files");
        for (UnmatchedRecord unmatched : report.unmatched()) {
            final int surplus = Math.abs(unmatched.netCount());
            out.println("There is no equivalent for transaction " + unmatched.record().id()
                    + " from file '" + unmatched.foundIn().label() + "'"
                    + " in the file '" + unmatched.missingFrom().label() + "'"
                    + (surplus > 1 ? " (" + surplus + " occurrences)" : ""));
        }
    }

    static ComparerConfig configFrom(ToolArguments args)
    {
        args.requireOnly(Set.of(FILE1, FORMAT1, FILE2, FORMAT2));
        return ComparerConfig.builder()
                .withFile1(Path.of(args.require(FILE1)))
                .withFormat1(TxFormat.fromName(args.require(FORMAT1)))
                .withFile2(Path.of(args.require(FILE2)))
                .withFormat2(TxFormat.fromName(args.require(FORMAT2)))
                .build();
    }
}

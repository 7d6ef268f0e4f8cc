package com.questrail.txfile.tool;

import com.questrail.txfile.codec.TxFormat;
import com.questrail.txfile.config.ConverterConfig;
import com.questrail.txfile.convert.TxConverter;
import com.questrail.txfile.error.TxCodecException;
import com.questrail.txfile.model.TxRecord;
import com.questrail.txfile.observability.Slf4jTxObservabilitySink;
import com.questrail.txfile.observability.TxErrorEvent;
import com.questrail.txfile.observability.TxObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * ConverterTool
 * =============================================================================
 * Command-line entry point that converts one transaction file to another
 * format.
 *
 * <pre>
 *   converter --input PATH --input-format FORMAT --output-format FORMAT [--output PATH]
 * </pre>
 *
 * <p>Converted data goes to {@code --output}, or to standard output when it
 * is absent. Progress is logged; with the bundled logging configuration logs
 * go to standard error so that standard output carries data only.</p>
 *
 * <p>The destination file is created only after the input has been parsed
 * successfully.</p>
 */
public final class ConverterTool
{
    private static final Logger log = LoggerFactory.getLogger(ConverterTool.class);

    static final String USAGE =
            "usage: converter --input PATH --input-format binary|text|csv"
                    + " --output-format binary|text|csv [--output PATH]";

    static final String INPUT = "input";
    static final String INPUT_FORMAT = "input-format";
    static final String OUTPUT_FORMAT = "output-format";
    static final String OUTPUT = "output";

    private ConverterTool() {}

    public static void main(String[] args)
    {
        final ExitCode exit = run(args, System.out, System.err,
                new Slf4jTxObservabilitySink(), Clock.systemUTC());
        System.exit(exit.code());
    }

    static ExitCode run(String[] args, PrintStream out, PrintStream err,
                        TxObservabilitySink sink, Clock clock)
    {
        final ConverterConfig config;
        try {
            config = configFrom(ToolArguments.parse(args));
        }
        catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return ExitCode.INVALID_ARGS;
        }

        log.info("Converting from '{}':{} to :{}",
                config.input(), config.inputFormat(), config.outputFormat());

        final TxConverter converter = new TxConverter(sink, clock);
        try {
            final List<TxRecord> records;
            try (InputStream in = ToolStreams.openInput(config.input())) {
                records = converter.read(config.input().toString(), in, config.inputFormat());
            }

            final String target = config.outputFile().map(Object::toString).orElse("stdout");
            try (OutputStream destination = config.outputFile().isPresent()
                    ? ToolStreams.openOutput(config.output())
                    : ToolStreams.unclosable(out)) {
                converter.write(target, destination, config.outputFormat(), records);
            }
            return ExitCode.SUCCESS;
        }
        catch (TxCodecException | IOException e) {
            sink.onError(new TxErrorEvent(clock.instant(), e.getMessage(), e));
            err.println("Error occurred during application execution: " + e.getMessage());
            return ExitCode.FAILURE;
        }
    }

    /**
     * Maps parsed options onto a {@link ConverterConfig}.
     *
     * @throws IllegalArgumentException for an unknown, missing or malformed option
     */
    static ConverterConfig configFrom(ToolArguments args)
    {
        args.requireOnly(Set.of(INPUT, INPUT_FORMAT, OUTPUT_FORMAT, OUTPUT));
        return ConverterConfig.builder()
                .withInput(Path.of(args.require(INPUT)))
                .withInputFormat(TxFormat.fromName(args.require(INPUT_FORMAT)))
                .withOutputFormat(TxFormat.fromName(args.require(OUTPUT_FORMAT)))
                .withOutput(args.optional(OUTPUT).map(Path::of).orElse(null))
                .build();
    }
}

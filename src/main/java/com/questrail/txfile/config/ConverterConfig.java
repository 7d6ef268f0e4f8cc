package com.questrail.txfile.config;

import com.questrail.txfile.codec.TxFormat;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration of one conversion run.
 *
 * @param output destination file; {@code null} writes to standard output
 */
public record ConverterConfig(
    Path input,
    TxFormat inputFormat,
    TxFormat outputFormat,
    Path output
) {
    public ConverterConfig {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(inputFormat, "inputFormat");
        Objects.requireNonNull(outputFormat, "outputFormat");
    }

    public Optional<Path> outputFile() {
        return Optional.ofNullable(output);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path input;
        private TxFormat inputFormat;
        private TxFormat outputFormat;
        private Path output;

        public Builder withInput(Path input) {
            this.input = input;
            return this;
        }

        public Builder withInputFormat(TxFormat inputFormat) {
            this.inputFormat = inputFormat;
            return this;
        }

        public Builder withOutputFormat(TxFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder withOutput(Path output) {
            this.output = output;
            return this;
        }

        public ConverterConfig build() {
            return new ConverterConfig(input, inputFormat, outputFormat, output);
        }
    }
}

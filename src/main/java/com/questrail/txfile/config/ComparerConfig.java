package com.questrail.txfile.config;

import com.questrail.txfile.codec.TxFormat;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration of one comparison run: two files, each with its own format.
 */
public record ComparerConfig(
    Path file1,
    TxFormat format1,
    Path file2,
    TxFormat format2
) {
    public ComparerConfig {
        Objects.requireNonNull(file1, "file1");
        Objects.requireNonNull(format1, "format1");
        Objects.requireNonNull(file2, "file2");
        Objects.requireNonNull(format2, "format2");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path file1;
        private TxFormat format1;
        private Path file2;
        private TxFormat format2;

        public Builder withFile1(Path file1) {
            this.file1 = file1;
            return this;
        }

        public Builder withFormat1(TxFormat format1) {
            this.format1 = format1;
            return this;
        }

        public Builder withFile2(Path file2) {
            this.file2 = file2;
            return this;
        }

        public Builder withFormat2(TxFormat format2) {
            this.format2 = format2;
            return this;
        }

        public ComparerConfig build() {
            return new ComparerConfig(file1, format1, file2, format2);
        }
    }
}

package org.zepto8.fixer;

import org.zepto8.peg.parser.ParserConfig;

/**
 * Code fixer configuration.
 *
 * @param bootShimEnabled patch the {@code if(_update60)} idiom some exporters append
 * @param verifyOutput    re-parse corrected code as standard Lua 5.3
 * @param parserConfig    configuration of the analysis parse
 */
public record FixerConfig(boolean bootShimEnabled, boolean verifyOutput, ParserConfig parserConfig) {
    public static final FixerConfig DEFAULT = new FixerConfig(true, false, ParserConfig.DEFAULT);

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean bootShimEnabled = true;
        private boolean verifyOutput = false;
        private boolean packratEnabled = true;

        private Builder() {}

        public Builder bootShim(boolean enabled) {
            this.bootShimEnabled = enabled;
            return this;
        }

        public Builder verifyOutput(boolean enabled) {
            this.verifyOutput = enabled;
            return this;
        }

        public Builder packrat(boolean enabled) {
            this.packratEnabled = enabled;
            return this;
        }

        public FixerConfig build() {
            return new FixerConfig(bootShimEnabled, verifyOutput, new ParserConfig(packratEnabled));
        }
    }
}

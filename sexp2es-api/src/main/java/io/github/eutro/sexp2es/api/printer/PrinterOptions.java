package io.github.eutro.sexp2es.api.printer;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

/**
 * Options for a {@link Printer}, named after the options of escodegen.
 * <p>
 * Printers may ignore options they do not support.
 */
public final class PrinterOptions {
    private final String indentStyle;
    private final int base;
    private final String quotes;
    private final boolean compact;
    private final boolean parentheses;
    private final boolean semicolons;
    private final boolean comment;
    @Nullable
    private final String file;
    @Nullable
    private final String sourceMap;
    @Nullable
    private final String sourceMapRoot;
    private final boolean sourceMapWithCode;
    @Nullable
    private final String sourceContent;

    private PrinterOptions(Builder builder) {
        indentStyle = builder.indentStyle;
        base = builder.base;
        quotes = builder.quotes;
        compact = builder.compact;
        parentheses = builder.parentheses;
        semicolons = builder.semicolons;
        comment = builder.comment;
        file = builder.file;
        sourceMap = builder.sourceMap;
        sourceMapRoot = builder.sourceMapRoot;
        sourceMapWithCode = builder.sourceMapWithCode;
        sourceContent = builder.sourceContent;
    }

    public String getIndentStyle() {
        return indentStyle;
    }

    public int getBase() {
        return base;
    }

    public String getQuotes() {
        return quotes;
    }

    public boolean isCompact() {
        return compact;
    }

    public boolean isParentheses() {
        return parentheses;
    }

    public boolean isSemicolons() {
        return semicolons;
    }

    public boolean isComment() {
        return comment;
    }

    @Nullable
    public String getFile() {
        return file;
    }

    @Nullable
    public String getSourceMap() {
        return sourceMap;
    }

    @Nullable
    public String getSourceMapRoot() {
        return sourceMapRoot;
    }

    public boolean isSourceMapWithCode() {
        return sourceMapWithCode;
    }

    @Nullable
    public String getSourceContent() {
        return sourceContent;
    }

    /**
     * Create a builder that starts with these options.
     *
     * @return The builder.
     */
    @Contract(pure = true)
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.indentStyle = indentStyle;
        builder.base = base;
        builder.quotes = quotes;
        builder.compact = compact;
        builder.parentheses = parentheses;
        builder.semicolons = semicolons;
        builder.comment = comment;
        builder.file = file;
        builder.sourceMap = sourceMap;
        builder.sourceMapRoot = sourceMapRoot;
        builder.sourceMapWithCode = sourceMapWithCode;
        builder.sourceContent = sourceContent;
        return builder;
    }

    @Contract(pure = true)
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder for {@link PrinterOptions}. The defaults match escodegen's.
     */
    public static class Builder {
        private String indentStyle = "    ";
        private int base = 0;
        private String quotes = "single";
        private boolean compact = false;
        private boolean parentheses = true;
        private boolean semicolons = true;
        private boolean comment = false;
        @Nullable
        private String file = null;
        @Nullable
        private String sourceMap = null;
        @Nullable
        private String sourceMapRoot = null;
        private boolean sourceMapWithCode = false;
        @Nullable
        private String sourceContent = null;

        /**
         * Set the string each level of indentation is made of.
         *
         * @param indentStyle The indentation.
         * @return This builder, for convenience.
         */
        public Builder setIndentStyle(String indentStyle) {
            this.indentStyle = indentStyle;
            return this;
        }

        /**
         * Set the indentation level the whole program starts at.
         *
         * @param base The base indentation level.
         * @return This builder, for convenience.
         */
        public Builder setBase(int base) {
            if (base < 0) throw new IllegalArgumentException("negative base indent: " + base);
            this.base = base;
            return this;
        }

        /**
         * Set the quotes string literals are printed with: {@code "single"}, {@code "double"} or {@code "auto"}.
         *
         * @param quotes The quote style.
         * @return This builder, for convenience.
         */
        public Builder setQuotes(String quotes) {
            switch (quotes) {
                case "single":
                case "double":
                case "auto":
                    break;
                default:
                    throw new IllegalArgumentException("unknown quote style: " + quotes);
            }
            this.quotes = quotes;
            return this;
        }

        public Builder setCompact(boolean compact) {
            this.compact = compact;
            return this;
        }

        public Builder setParentheses(boolean parentheses) {
            this.parentheses = parentheses;
            return this;
        }

        public Builder setSemicolons(boolean semicolons) {
            this.semicolons = semicolons;
            return this;
        }

        public Builder setComment(boolean comment) {
            this.comment = comment;
            return this;
        }

        /**
         * Set the name of the source file, recorded in the source map.
         *
         * @param file The file name, or null.
         * @return This builder, for convenience.
         */
        public Builder setFile(@Nullable String file) {
            this.file = file;
            return this;
        }

        /**
         * Set the source name a source map should be generated for. No source map is generated if this is null.
         *
         * @param sourceMap The source name, or null.
         * @return This builder, for convenience.
         */
        public Builder setSourceMap(@Nullable String sourceMap) {
            this.sourceMap = sourceMap;
            return this;
        }

        public Builder setSourceMapRoot(@Nullable String sourceMapRoot) {
            this.sourceMapRoot = sourceMapRoot;
            return this;
        }

        /**
         * Set whether the printer should return both the code and the source map, rather than just the source map.
         *
         * @param sourceMapWithCode Whether to return both.
         * @return This builder, for convenience.
         */
        public Builder setSourceMapWithCode(boolean sourceMapWithCode) {
            this.sourceMapWithCode = sourceMapWithCode;
            return this;
        }

        /**
         * Set the original source text, to embed in the source map.
         *
         * @param sourceContent The source text, or null.
         * @return This builder, for convenience.
         */
        public Builder setSourceContent(@Nullable String sourceContent) {
            this.sourceContent = sourceContent;
            return this;
        }

        public PrinterOptions build() {
            return new PrinterOptions(this);
        }
    }
}

package io.github.eutro.sexp2es.core.support;

import java.util.regex.Pattern;

/**
 * A style of joining words into a token.
 * <p>
 * This class can be used to convert between different case styles.
 */
public interface CaseStyle {
    /**
     * kebab-case-words, with the case of each word left alone.
     */
    CaseStyle KEBAB = new SnakeLike("-", Capitalisation.UNCHANGED);
    /**
     * camelCaseWords: the first word is left alone, every later word gets an upper-case first letter.
     */
    CaseStyle CAMEL = new CamelLike(Capitalisation.UNCHANGED);

    /**
     * Split the token into words according to this case style.
     *
     * @param token The token to split.
     * @return The words in the token.
     */
    String[] splitToWords(String token);

    /**
     * Normalise the {@code index}th word of a token to how it should appear in this case style.
     *
     * @param word  The word.
     * @param index The index of the word.
     * @return The normalised word.
     */
    String normaliseWord(String word, int index);

    /**
     * Concatenate words into a token according to the rules of this case style.
     *
     * @param words The words to concatenate.
     * @return The token.
     */
    String concatenate(String[] words);

    /**
     * Convert a token from this case style to another.
     *
     * @param other The other case style.
     * @param token The token to convert.
     * @return The converted token.
     */
    default String convertTo(CaseStyle other, String token) {
        if (this == other) return token;
        String[] words = splitToWords(token);
        for (int i = 0; i < words.length; i++) {
            words[i] = other.normaliseWord(words[i], i);
        }
        return other.concatenate(words);
    }

    /**
     * A capitalisation style for a single word.
     */
    enum Capitalisation {
        /**
         * The word as it was.
         */
        UNCHANGED,
        /**
         * The first letter upper case, the rest as it was.
         */
        CAPITALISED,
        ;

        /**
         * Convert the word to this capitalisation.
         *
         * @param word The word.
         * @return The capitalised word.
         */
        public String normalise(String word) {
            switch (this) {
                case UNCHANGED:
                    return word;
                case CAPITALISED:
                    if (word.isEmpty()) return word;
                    return Character.toUpperCase(word.charAt(0)) + word.substring(1);
            }
            throw new IllegalStateException();
        }
    }

    /**
     * A case style like snake_case, where words are joined by a separator.
     */
    class SnakeLike implements CaseStyle {
        private final String separator;
        private final Pattern sepPat;
        private final Capitalisation caps;

        /**
         * Construct a {@link SnakeLike} case with the given separator and word capitalisation rule.
         *
         * @param separator The separator.
         * @param caps      The per-word capitalisation rule.
         */
        public SnakeLike(String separator, Capitalisation caps) {
            this.separator = separator;
            this.sepPat = Pattern.compile(Pattern.quote(separator));
            this.caps = caps;
        }

        @Override
        public String[] splitToWords(String token) {
            // keep trailing empty words, "a-" has two
            return sepPat.split(token, -1);
        }

        @Override
        public String normaliseWord(String word, int index) {
            return caps.normalise(word);
        }

        @Override
        public String concatenate(String[] words) {
            return String.join(separator, words);
        }
    }

    /**
     * A case style like camelCase.
     */
    class CamelLike implements CaseStyle {
        private final Capitalisation firstWordCase;

        /**
         * Construct a {@link CamelLike} case style with the given case for the first word.
         *
         * @param firstWordCase The case of the first word.
         */
        public CamelLike(Capitalisation firstWordCase) {
            this.firstWordCase = firstWordCase;
        }

        @Override
        public String[] splitToWords(String token) {
            throw new UnsupportedOperationException("camel case tokens are only produced, never split");
        }

        @Override
        public String normaliseWord(String word, int index) {
            Capitalisation caps = Capitalisation.CAPITALISED;
            if (index == 0) caps = firstWordCase;
            return caps.normalise(word);
        }

        @Override
        public String concatenate(String[] words) {
            return String.join("", words);
        }
    }
}

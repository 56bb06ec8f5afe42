package io.github.eutro.sexp2es.core.support;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A class for mangling names, converting source-language symbols to
 * tokens that are valid target identifiers, according to a set of rules.
 */
public interface NameMangler {
    /**
     * The mangler for identifiers in the target language.
     * <p>
     * {@code list->vector} becomes {@code listToVector}, {@code number?} becomes {@code isNumber},
     * {@code set!} becomes {@code set} and {@code **macros**} becomes {@code __macros__}.
     */
    NameMangler ES_IDENT = new EsIdent();

    /**
     * Mangle a string, so it becomes a valid name according to the rules of this mangler.
     *
     * @param name The name to mangle
     * @return The mangled string.
     */
    String mangle(String name);

    /**
     * A mangler that rewrites lisp naming conventions into target identifier conventions.
     * <p>
     * The stages run in order, each on the output of the previous one:
     * <ol>
     *     <li>operator symbols are replaced by names as a whole;</li>
     *     <li>punctuation is replaced by splitting and rejoining on it;</li>
     *     <li>a trailing {@code ?} becomes an {@code is-} prefix;</li>
     *     <li>kebab-case becomes camelCase.</li>
     * </ol>
     */
    class EsIdent implements NameMangler {
        private static final Map<String, String> OPERATOR_NAMES = new HashMap<>();

        static {
            OPERATOR_NAMES.put("*", "multiply");
            OPERATOR_NAMES.put("/", "divide");
            OPERATOR_NAMES.put("+", "sum");
            OPERATOR_NAMES.put("-", "subtract");
            OPERATOR_NAMES.put("=", "equal?");
            OPERATOR_NAMES.put("==", "strict-equal?");
            OPERATOR_NAMES.put("<=", "not-greater-than");
            OPERATOR_NAMES.put(">=", "not-less-than");
            OPERATOR_NAMES.put(">", "greater-than");
            OPERATOR_NAMES.put("<", "less-than");
        }

        // applied in order, after operator names are substituted
        private static final Rejoin[] PUNCTUATION = {
                new Rejoin("*", "_"),
                new Rejoin("->", "-to-"),
                new Rejoin("!", ""),
                new Rejoin("%", "$"),
                new Rejoin("=", "-equal-"),
                new Rejoin("+", "-plus-"),
                new Rejoin("&", "-and-"),
        };

        @Override
        public String mangle(String name) {
            String id = OPERATOR_NAMES.getOrDefault(name, name);
            for (Rejoin rejoin : PUNCTUATION) {
                id = rejoin.apply(id);
            }
            if (id.endsWith("?")) {
                id = "is-" + id.substring(0, id.length() - 1);
            }
            return CaseStyle.KEBAB.convertTo(CaseStyle.CAMEL, id);
        }

        private static final class Rejoin {
            private final String literal;
            private final Pattern pattern;
            private final String replacement;

            Rejoin(String literal, String replacement) {
                this.literal = literal;
                this.pattern = Pattern.compile(Pattern.quote(literal));
                this.replacement = replacement;
            }

            String apply(String id) {
                if (!id.contains(literal)) return id;
                return String.join(replacement, pattern.split(id, -1));
            }
        }
    }
}

package io.github.eutro.sexp2es.core.ops;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An immutable table of {@link SpecialForm}s, keyed by the source name they are applied by.
 * <p>
 * Tables are built once with a {@link Builder} and may then be shared freely, including
 * between lowerings running on different threads.
 */
public final class SpecialForms {
    private static SpecialForms defaults;

    private final Map<String, SpecialForm> forms;

    private SpecialForms(Map<String, SpecialForm> forms) {
        this.forms = forms;
    }

    /**
     * Get the form installed under {@code name}.
     *
     * @param name The source name.
     * @return The form, or null if there is none.
     */
    @Nullable
    public SpecialForm get(String name) {
        return forms.get(name);
    }

    public boolean contains(String name) {
        return forms.containsKey(name);
    }

    /**
     * Get every name that has a form, in installation order.
     *
     * @return The names.
     */
    public Set<String> names() {
        return forms.keySet();
    }

    /**
     * Create a builder that starts with every form in this table.
     *
     * @return The builder.
     */
    @Contract(pure = true)
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.forms.putAll(forms);
        return builder;
    }

    /**
     * Get the table with every operator from {@link Operators} installed.
     *
     * @return The default table.
     */
    @NotNull
    public static synchronized SpecialForms defaults() {
        if (defaults == null) {
            defaults = Operators.installAll(builder()).build();
        }
        return defaults;
    }

    @Contract(pure = true)
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder for {@link SpecialForms}.
     */
    public static class Builder {
        private final Map<String, SpecialForm> forms = new LinkedHashMap<>();

        /**
         * Install a form under a name, replacing any form already installed under it.
         *
         * @param name The source name the form is applied by.
         * @param form The form.
         * @return This builder, for chaining.
         */
        public Builder install(String name, SpecialForm form) {
            forms.put(name, form);
            return this;
        }

        /**
         * Remove the form installed under a name, so applications of it lower to plain calls.
         *
         * @param name The source name.
         * @return This builder, for chaining.
         */
        public Builder remove(String name) {
            forms.remove(name);
            return this;
        }

        public SpecialForms build() {
            return new SpecialForms(Collections.unmodifiableMap(new LinkedHashMap<>(forms)));
        }
    }
}

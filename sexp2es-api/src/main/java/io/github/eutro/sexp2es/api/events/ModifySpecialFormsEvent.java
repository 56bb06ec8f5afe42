package io.github.eutro.sexp2es.api.events;

import io.github.eutro.sexp2es.api.ProgramCompilation;
import io.github.eutro.sexp2es.core.ops.SpecialForms;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired when constructing the {@link SpecialForms special form table} of a
 * program compilation, before anything is lowered.
 * <p>
 * The builder starts with {@link SpecialForms#defaults() the default operators}.
 * Installing a form under a name that already has one replaces it.
 *
 * @see ProgramCompilation
 * @see SpecialForms.Builder
 */
public class ModifySpecialFormsEvent implements ProgramCompileEvent {
    /**
     * The special form table builder.
     */
    @NotNull
    public SpecialForms.Builder forms;

    /**
     * Construct a new modify-special-forms event with the given builder.
     *
     * @param forms The builder.
     */
    public ModifySpecialFormsEvent(@NotNull SpecialForms.Builder forms) {
        this.forms = forms;
    }
}

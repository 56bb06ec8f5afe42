package io.github.eutro.sexp2es.api.events;

import io.github.eutro.sexp2es.api.printer.PrinterOptions;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired when constructing the {@link PrinterOptions} the program will be emitted with.
 */
public class ModifyPrinterOptionsEvent implements ProgramCompileEvent {
    @NotNull
    public PrinterOptions.Builder options;

    public ModifyPrinterOptionsEvent(@NotNull PrinterOptions.Builder options) {
        this.options = options;
    }
}

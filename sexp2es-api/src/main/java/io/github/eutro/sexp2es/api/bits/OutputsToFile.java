package io.github.eutro.sexp2es.api.bits;

import io.github.eutro.sexp2es.api.events.EmitProgramEvent;
import io.github.eutro.sexp2es.api.events.EventDispatcher;
import io.github.eutro.sexp2es.api.printer.Printer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A bit which prints emitted programs and writes them to a file.
 * <p>
 * Each emitted program replaces the contents of the file.
 *
 * @param <T> The type on which this listens to events.
 */
public class OutputsToFile<T extends EventDispatcher<? super EmitProgramEvent>> implements Bit<T, Void> {
    private final Path file;
    private final Printer printer;

    /**
     * Construct a {@link OutputsToFile} for outputting to the given file.
     *
     * @param file    The file to write source to.
     * @param printer The printer to render programs with.
     */
    public OutputsToFile(Path file, Printer printer) {
        this.file = file;
        this.printer = printer;
    }

    @Override
    public Void attachTo(T cc) {
        cc.listen(EmitProgramEvent.class, evt -> {
            String source = printer.print(evt.program, evt.options);
            try {
                Path dir = file.toAbsolutePath().getParent();
                if (dir != null) Files.createDirectories(dir);
                Files.write(file, source.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        return null;
    }
}

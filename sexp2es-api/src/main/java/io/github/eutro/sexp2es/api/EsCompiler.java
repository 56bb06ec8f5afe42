package io.github.eutro.sexp2es.api;

import io.github.eutro.sexp2es.api.bits.Bit;
import io.github.eutro.sexp2es.api.events.*;
import io.github.eutro.sexp2es.core.estree.Program;
import io.github.eutro.sexp2es.core.ir.Node;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * A compiler, to which analyzed programs can be submitted for lowering.
 * <p>
 * Listeners added to the compiler, directly or through {@link #lift()}, apply to every
 * compilation submitted to it.
 */
public class EsCompiler extends EventSupplier<CompilerEvent> {
    /**
     * Submit a program for compilation. Nothing is lowered until {@link ProgramCompilation#run()} is called.
     *
     * @param forms The top-level forms of the program, in order.
     * @return The compilation.
     */
    @Contract(pure = true)
    public ProgramCompilation submit(List<Node> forms) {
        return newCompilation(new ArrayList<>(forms));
    }

    @Contract(pure = true)
    public ProgramCompilation submit(Node... forms) {
        return submit(Arrays.asList(forms));
    }

    // it's not, but show a warning if the result is unused
    @Contract(pure = true)
    @NotNull
    private ProgramCompilation newCompilation(List<Node> forms) {
        return new ProgramCompilation(this, forms);
    }

    /**
     * Get a dispatcher that listens to events on every compilation of this compiler.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<ProgramCompileEvent> lift() {
        return new EventDispatcher<ProgramCompileEvent>() {
            @Override
            public <T extends ProgramCompileEvent> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                EsCompiler.this.listen(RunProgramCompilationEvent.class, evt ->
                        evt.compilation.listen(eventClass, listener));
            }
        };
    }

    /**
     * Collect every program this compiler emits.
     *
     * @return A queue the programs are added to as they are emitted.
     */
    public BlockingQueue<Program> outputsAsQueue() {
        BlockingQueue<Program> queue = new LinkedBlockingQueue<>();
        lift().listen(EmitProgramEvent.class, evt -> queue.add(evt.program));
        return queue;
    }

    public <T> T add(Bit<? super EsCompiler, T> bit) {
        return bit.attachTo(this);
    }
}

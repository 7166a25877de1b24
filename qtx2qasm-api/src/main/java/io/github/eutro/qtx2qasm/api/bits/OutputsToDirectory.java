package io.github.eutro.qtx2qasm.api.bits;

import io.github.eutro.qtx2qasm.api.events.EmitQasmEvent;
import io.github.eutro.qtx2qasm.api.events.EventDispatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A bit which writes emitted OpenQASM source to {@code <name>.qasm} in the given directory.
 * <p>
 * Modules that fail to compile emit nothing, so their files are left as they were.
 *
 * @param <T> The type on which this listens to events.
 */
public class OutputsToDirectory<T extends EventDispatcher<? super EmitQasmEvent>>
        implements Bit<T, Void> {
    private static final Logger LOGGER = LogManager.getLogger();

    private final Path directory;

    /**
     * Construct a {@link OutputsToDirectory} for outputting to the given directory.
     *
     * @param directory The directory to output source files to.
     */
    public OutputsToDirectory(Path directory) {
        this.directory = directory;
    }

    @Override
    public Void addTo(T cc) {
        cc.listen(EmitQasmEvent.class, evt -> {
            try {
                Files.createDirectories(directory);
                Path file = directory.resolve(evt.name + ".qasm");
                Files.write(file, evt.source.getBytes(StandardCharsets.UTF_8));
                LOGGER.debug("wrote {}", file);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        return null;
    }
}

package logpipe.destination;

import logpipe.Destination;
import logpipe.LogBatch;
import logpipe.LogEntry;
import logpipe.util.JsonCodec;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Appends each entry as one JSON object per line to a file.
 *
 * <p>The file and its parent directories are created on first write. Each batch is written
 * and flushed in one open/append/close cycle, so an {@link IOException} fails the whole
 * batch and lets the slot retry it.
 */
public final class JsonLinesFileDestination implements Destination {
    private final Path file;
    private final JsonCodec codec;

    public JsonLinesFileDestination(Path file) {
        this(file, JsonCodec.getDefault());
    }

    public JsonLinesFileDestination(Path file, JsonCodec codec) {
        this.file = Objects.requireNonNull(file, "file");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public CompletionStage<Void> write(LogBatch batch) {
        try {
            appendBatch(batch);
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void appendBatch(LogBatch batch) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
            for (LogEntry entry : batch) {
                out.write(codec.encode(entry));
                out.newLine();
            }
        }
    }

    public Path file() {
        return file;
    }
}

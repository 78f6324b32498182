package logpipe.util;

import logpipe.LogEntry;

/**
 * Encodes log entries as single-line JSON objects.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no external dependencies.
 * Users who already have Jackson, Gson, or another JSON library on the classpath can
 * implement this interface to delegate to their preferred library.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes an entry as one JSON object without line breaks. Metadata is nested under
     * {@code "meta"} so caller keys never shadow the entry's own fields.
     *
     * @param entry the entry
     * @return JSON text
     */
    String encode(LogEntry entry);
}

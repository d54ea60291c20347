package io.jobqueue.util;

/**
 * Codec between job arguments (or handler output) and their stored JSON text.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) uses a shared Jackson
 * {@code ObjectMapper} with {@code java.time} support.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Encodes a value as JSON.
     *
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    String toJson(Object value);

    /**
     * Decodes JSON into an instance of {@code type}.
     *
     * @throws IllegalArgumentException if the input is malformed or does not fit the type
     */
    <T> T fromJson(String json, Class<T> type);
}

package io.github.yok.csvseeder.parser;

import java.io.IOException;
import java.nio.charset.Charset;

/**
 * Locates and opens seed sources.
 *
 * @author Yasuharu.Okawauchi
 */
public interface RowSourceProvider {

    /**
     * Returns whether the source exists and can be read.
     *
     * @param identifier source identifier
     * @return {@code true} if {@link #open} is expected to succeed
     */
    boolean isReadable(String identifier);

    /**
     * Opens the source for reading.
     *
     * @param identifier source identifier
     * @param delimiter field delimiter
     * @param charset character encoding of the source
     * @return row source; the caller closes it
     * @throws IOException if the source cannot be opened
     */
    RowSource open(String identifier, char delimiter, Charset charset) throws IOException;
}

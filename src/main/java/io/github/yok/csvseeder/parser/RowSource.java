package io.github.yok.csvseeder.parser;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * One-shot, forward-only reader of the rows of an opened source. Reading again requires opening
 * the source again.
 *
 * @author Yasuharu.Okawauchi
 */
public interface RowSource extends Closeable {

    /**
     * Reads the next row.
     *
     * @return fields of the next row, or {@code null} at the end of the source
     * @throws IOException if the source cannot be read or is malformed
     */
    List<String> readRow() throws IOException;
}

package io.github.yok.csvseeder.core;

/**
 * Thrown when a data row does not have one field per header column.
 *
 * @author Yasuharu.Okawauchi
 */
public class RowShapeException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int expected;
    private final int actual;

    /**
     * Creates the exception.
     *
     * @param expected number of header columns
     * @param actual number of fields in the row
     */
    public RowShapeException(int expected, int actual) {
        super("Row has " + actual + " field(s) but the header has " + expected + " column(s)");
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}

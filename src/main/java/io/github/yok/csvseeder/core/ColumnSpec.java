package io.github.yok.csvseeder.core;

import lombok.Value;

/**
 * Target of one CSV column position.
 *
 * <p>
 * {@code targetName} is the table column that receives the field. Skipped columns carry an empty
 * target name and are never inserted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ColumnSpec {

    int sourceIndex;
    String targetName;
    boolean skip;

    /**
     * Creates a spec that inserts the field into {@code targetName}.
     *
     * @param sourceIndex zero-based position in the row
     * @param targetName table column name
     * @return spec
     */
    public static ColumnSpec of(int sourceIndex, String targetName) {
        return new ColumnSpec(sourceIndex, targetName, false);
    }

    /**
     * Creates a spec that drops the field.
     *
     * @param sourceIndex zero-based position in the row
     * @return spec
     */
    public static ColumnSpec skipped(int sourceIndex) {
        return new ColumnSpec(sourceIndex, "", true);
    }
}

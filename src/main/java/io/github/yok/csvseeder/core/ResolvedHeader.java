package io.github.yok.csvseeder.core;

import java.util.List;
import lombok.Value;

/**
 * Result of {@link HeaderResolver#resolve}: the column specs in file order and the warnings found
 * while resolving them.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ResolvedHeader {

    List<ColumnSpec> columns;
    List<String> warnings;
}

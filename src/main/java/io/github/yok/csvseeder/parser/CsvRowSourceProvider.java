package io.github.yok.csvseeder.parser;

import io.github.yok.csvseeder.config.PathsConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;

/**
 * {@link RowSourceProvider} for delimited text files, parsed with Apache Commons CSV.
 *
 * <ul>
 * <li>Identifiers are resolved through {@link PathsConfig#resolve(String)}.</li>
 * <li>A leading UTF-8 byte order mark is dropped, so it never ends up in the first header
 * name.</li>
 * <li>Fields may be enclosed in double quotes; a quoted field may contain the delimiter, line
 * breaks and doubled quotes.</li>
 * <li>Lines with no characters at all are not returned.</li>
 * <li>Bytes that are not valid in the charset make the read fail with an
 * {@link IOException}.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvRowSourceProvider implements RowSourceProvider {

    private final PathsConfig pathsConfig;

    /**
     * Creates a provider resolving files against the configured data path.
     *
     * @param pathsConfig path settings
     */
    public CsvRowSourceProvider(PathsConfig pathsConfig) {
        this.pathsConfig = pathsConfig;
    }

    @Override
    public boolean isReadable(String identifier) {
        Path path;
        try {
            path = pathsConfig.resolve(identifier);
        } catch (RuntimeException e) {
            log.debug("Source [{}] cannot be resolved: {}", identifier, e.getMessage());
            return false;
        }
        return Files.isRegularFile(path) && Files.isReadable(path);
    }

    @Override
    public RowSource open(String identifier, char delimiter, Charset charset) throws IOException {
        Path path = pathsConfig.resolve(identifier);
        log.debug("Opening [{}] (delimiter='{}', charset={})", path, delimiter, charset);

        InputStream in =
                BOMInputStream.builder().setInputStream(Files.newInputStream(path)).get();
        // undecodable bytes fail the read instead of becoming U+FFFD
        Reader reader = new InputStreamReader(in, charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT));
        CSVFormat fmt =
                CSVFormat.DEFAULT.builder().setDelimiter(delimiter).setIgnoreEmptyLines(true).get();
        try {
            return new CsvRowSource(fmt.parse(reader));
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }
    }

    /**
     * Row source over one open {@link CSVParser}.
     */
    private static final class CsvRowSource implements RowSource {

        private final CSVParser parser;
        private final Iterator<CSVRecord> records;

        private CsvRowSource(CSVParser parser) {
            this.parser = parser;
            this.records = parser.iterator();
        }

        @Override
        public List<String> readRow() throws IOException {
            try {
                if (!records.hasNext()) {
                    return null;
                }
                return records.next().toList();
            } catch (UncheckedIOException e) {
                // parse errors surface from the iterator wrapped
                throw e.getCause();
            }
        }

        @Override
        public void close() throws IOException {
            parser.close();
        }
    }
}

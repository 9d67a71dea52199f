package com.reelmatch.recommender.catalog;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.reelmatch.recommender.exception.CatalogDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PushbackReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a headed CSV file into a {@link RawTable}. No type conversion happens here.
 */
@Slf4j
public class CsvCatalogReader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final CsvMapper csvMapper;

    public CsvCatalogReader() {
        this.csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .enable(CsvParser.Feature.ALLOW_TRAILING_COMMA)
            .build();
    }

    public RawTable read(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new CatalogDataException("Movies file not found: " + resource);
        }

        log.info("Reading movies from {}", resource.getDescription());
        try (InputStream in = resource.getInputStream()) {
            return read(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CatalogDataException("Failed to read movies file: " + resource.getDescription(), e);
        }
    }

    /**
     * Reads CSV text. A leading byte order mark is dropped so it does not end up in the
     * first column name.
     */
    public RawTable read(Reader reader) throws IOException {
        return toTable(rowReader().readValues(skipByteOrderMark(reader)));
    }

    private ObjectReader rowReader() {
        return csvMapper.readerForMapOf(String.class).with(CsvSchema.emptySchema().withHeader());
    }

    private static Reader skipByteOrderMark(Reader reader) throws IOException {
        PushbackReader pushback = new PushbackReader(reader, 1);
        int first = pushback.read();
        if (first != -1 && first != BYTE_ORDER_MARK) {
            pushback.unread(first);
        }
        return pushback;
    }

    private RawTable toTable(MappingIterator<Map<String, String>> rowIterator) throws IOException {
        try (MappingIterator<Map<String, String>> iterator = rowIterator) {

            List<Map<String, String>> rows = new ArrayList<>();
            while (iterator.hasNextValue()) {
                rows.add(iterator.nextValue());
            }

            List<String> columns = new ArrayList<>();
            if (iterator.getParserSchema() instanceof CsvSchema) {
                for (CsvSchema.Column column : (CsvSchema) iterator.getParserSchema()) {
                    columns.add(column.getName());
                }
            }

            log.debug("Read {} rows with columns {}", rows.size(), columns);
            return new RawTable(columns, rows);
        } catch (RuntimeException e) {
            throw new CatalogDataException("Malformed movies file: " + e.getMessage(), e);
        }
    }
}

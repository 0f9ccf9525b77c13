package com.flagship.settlement_ledger.transaction;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Streams a transaction CSV and hands each row to a {@link RowHandler}
 * in file order.
 *
 * The header row decides column positions, so columns may appear in any
 * order and unknown columns are ignored. A row that fails validation is
 * reported through {@link RowHandler#onMalformed} and reading continues.
 * I/O failures, broken CSV quoting and an unusable header end the read
 * with an {@link IOException}.
 */
@Component
@Slf4j
public class TransactionCsvReader {

    static final String TYPE_COLUMN = "type";
    static final String CLIENT_COLUMN = "client";
    static final String TX_COLUMN = "tx";
    static final String AMOUNT_COLUMN = "amount";

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private static final List<String> REQUIRED_COLUMNS = List.of(TYPE_COLUMN, CLIENT_COLUMN, TX_COLUMN);

    private final ObjectReader rowReader;
    private final TransactionRecordParser parser;

    public TransactionCsvReader(CsvMapper csvMapper, TransactionRecordParser parser) {
        this.rowReader = csvMapper.readerForArrayOf(String.class)
            .with(CsvParser.Feature.WRAP_AS_ARRAY)
            .with(CsvParser.Feature.TRIM_SPACES)
            .with(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.parser = parser;
    }

    /**
     * Receives the rows of a transaction CSV.
     */
    public interface RowHandler {

        void onRecord(long rowNumber, TransactionRecord record);

        void onMalformed(long rowNumber, RecordParseException error);
    }

    /**
     * Reads every data row of {@code input}.
     *
     * @return number of data rows seen, malformed ones included
     * @throws IOException if the stream cannot be read or is not a transaction CSV
     */
    public long read(Reader input, RowHandler handler) throws IOException {
        try (MappingIterator<String[]> rows = rowReader.readValues(input)) {
            if (!rows.hasNextValue()) {
                throw new CsvFormatException("Input is empty: expected a header row");
            }
            Map<String, Integer> columns = indexHeader(rows.nextValue());
            log.debug("CSV header columns: {}", columns);

            long rowNumber = 0;
            while (rows.hasNextValue()) {
                String[] fields = rows.nextValue();
                if (isBlank(fields)) {
                    continue;
                }
                rowNumber++;
                RawTransactionRow raw = new RawTransactionRow(
                    rowNumber,
                    field(fields, columns.get(TYPE_COLUMN)),
                    field(fields, columns.get(CLIENT_COLUMN)),
                    field(fields, columns.get(TX_COLUMN)),
                    field(fields, columns.get(AMOUNT_COLUMN))
                );

                TransactionRecord record;
                try {
                    record = parser.parse(raw);
                } catch (RecordParseException e) {
                    handler.onMalformed(rowNumber, e);
                    continue;
                }
                handler.onRecord(rowNumber, record);
            }
            return rowNumber;
        }
    }

    private Map<String, Integer> indexHeader(String[] header) throws CsvFormatException {
        Map<String, Integer> columns = new HashMap<>();
        if (header.length > 0 && header[0] != null && !header[0].isEmpty()
            && header[0].charAt(0) == BYTE_ORDER_MARK) {
            header[0] = header[0].substring(1);
        }
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].trim().toLowerCase(Locale.ROOT);
            if (!name.isEmpty()) {
                columns.putIfAbsent(name, i);
            }
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!columns.containsKey(required)) {
                throw new CsvFormatException("Header is missing required column '" + required + "'");
            }
        }
        return columns;
    }

    private static String field(String[] fields, Integer index) {
        if (index == null || index >= fields.length) {
            return null;
        }
        return fields[index];
    }

    private static boolean isBlank(String[] fields) {
        for (String field : fields) {
            if (field != null && !field.isBlank()) {
                return false;
            }
        }
        return true;
    }
}

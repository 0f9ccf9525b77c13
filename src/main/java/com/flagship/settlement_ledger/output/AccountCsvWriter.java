package com.flagship.settlement_ledger.output;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.settlement_ledger.ledger.ClientAccount;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.Collection;

/**
 * Writes final account balances as CSV:
 * <pre>
 * client,available,held,total,locked
 * 1,1.5,0,1.5,false
 * </pre>
 * Rows follow the iteration order of the given accounts.
 * The target writer is flushed but left open.
 */
@Component
public class AccountCsvWriter {

    private final ObjectWriter rowWriter;

    public AccountCsvWriter(CsvMapper csvMapper) {
        CsvSchema schema = csvMapper.schemaFor(AccountRow.class).withHeader();
        this.rowWriter = csvMapper.writer(schema)
            .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    public void write(Collection<ClientAccount> accounts, Writer out) throws IOException {
        try (SequenceWriter rows = rowWriter.writeValues(out)) {
            for (ClientAccount account : accounts) {
                rows.write(AccountRow.from(account));
            }
        }
        out.flush();
    }
}

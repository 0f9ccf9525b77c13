package com.flagship.settlement_ledger.replay;

import com.flagship.settlement_ledger.output.AccountCsvWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry: {@code settlement-ledger <transactions.csv>}.
 *
 * Replays the given file and prints the final accounts as CSV on stdout.
 * Diagnostics go to the log (stderr), so stdout holds nothing but the result.
 */
@Component
@ConditionalOnProperty(name = "replay.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReplayRunner implements ApplicationRunner {

    static final String USAGE = "Usage: settlement-ledger <transactions.csv>";

    private final ReplayService replayService;
    private final AccountCsvWriter accountWriter;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> inputs = args.getNonOptionArgs();
        if (inputs.size() != 1) {
            throw new IllegalArgumentException(USAGE);
        }

        Path input = Path.of(inputs.get(0));
        log.info("Reading transactions from {}", input.toAbsolutePath());

        ReplayReport report;
        try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            report = replayService.replay(reader);
        }

        Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
        accountWriter.write(report.getLedger().accounts(), out);
    }
}

package com.kreasipositif.baiprocessor.batch;

import com.kreasipositif.baiprocessor.domain.CashApplicationRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.ItemStreamWriter;
import org.springframework.batch.item.file.FlatFileItemWriter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Appends {@link CashApplicationRow}s to the cash-application CSV.
 *
 * <p>The header is written only when the file is new or empty; existing rows are never rewritten.
 *
 * <p>Not a {@code @Component}: created as a {@code @StepScope} bean in
 * {@link com.kreasipositif.baiprocessor.config.BatchConfig} so every step execution targets the
 * {@code outputFile} of its own job parameters.
 */
@Slf4j
public class CashApplicationItemWriter implements ItemStreamWriter<CashApplicationRow> {

    static final String MATCHED_COUNT_KEY = "cashApplication.matched";
    static final String UNMATCHED_COUNT_KEY = "cashApplication.unmatched";

    private final Path outputFile;
    private FlatFileItemWriter<CashApplicationRow> delegate;

    private final AtomicLong matchedCount = new AtomicLong();
    private final AtomicLong unmatchedCount = new AtomicLong();

    public CashApplicationItemWriter(Path outputFile) {
        this.outputFile = outputFile;
    }

    @Override
    public void open(ExecutionContext executionContext) throws ItemStreamException {
        Path parent = outputFile.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new ItemStreamException("Cannot create output directory " + parent, e);
        }

        delegate = CsvFileWriters.build("cashApplicationWriter", outputFile,
                CashApplicationRow.FIELDS, CashApplicationRow.HEADERS, true, true);
        delegate.open(executionContext);

        log.info("Cash-application output — {}", outputFile.toAbsolutePath());
    }

    @Override
    public void write(Chunk<? extends CashApplicationRow> chunk) throws Exception {
        delegate.write(chunk);
        for (CashApplicationRow row : chunk) {
            if (row.isMatched()) {
                matchedCount.incrementAndGet();
            } else {
                unmatchedCount.incrementAndGet();
            }
        }
    }

    @Override
    public void update(ExecutionContext executionContext) throws ItemStreamException {
        if (delegate != null) {
            delegate.update(executionContext);
        }
        executionContext.putLong(MATCHED_COUNT_KEY, matchedCount.get());
        executionContext.putLong(UNMATCHED_COUNT_KEY, unmatchedCount.get());
    }

    @Override
    public void close() throws ItemStreamException {
        if (delegate != null) {
            delegate.close();
        }
        log.info("Cash application complete — {} matched, {} unmatched row(s) appended",
                matchedCount.get(), unmatchedCount.get());
    }
}

package com.kreasipositif.baiprocessor.batch;

import com.kreasipositif.baiprocessor.domain.TransactionRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.batch.item.file.separator.DefaultRecordSeparatorPolicy;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Factory that creates a {@link FlatFileItemReader} over a transactions CSV produced by the
 * ingest job (or any file with the same columns).
 *
 * <p>The header line is skipped; quoted values may contain commas, doubled quotes and line breaks.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionRowReaderFactory {

    private final TransactionRowFieldSetMapper fieldSetMapper;

    /**
     * @param resource the transactions CSV
     * @param name     unique reader name (used by Spring Batch for restart tracking)
     */
    public FlatFileItemReader<TransactionRow> create(Resource resource, String name) {
        log.debug("Creating FlatFileItemReader '{}' for {}", name, resource);

        return new FlatFileItemReaderBuilder<TransactionRow>()
                .name(name)
                .resource(resource)
                .encoding("UTF-8")
                .linesToSkip(1)
                .recordSeparatorPolicy(new DefaultRecordSeparatorPolicy())
                .lineTokenizer(tokenizer())
                .fieldSetMapper(fieldSetMapper)
                .build();
    }

    static DelimitedLineTokenizer tokenizer() {
        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer(CsvLineAggregator.DELIMITER);
        tokenizer.setStrict(false);
        return tokenizer;
    }
}

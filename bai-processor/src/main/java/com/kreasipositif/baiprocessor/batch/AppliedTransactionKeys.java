package com.kreasipositif.baiprocessor.batch;

import com.kreasipositif.baiprocessor.domain.AppliedTransactionKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.batch.item.file.separator.DefaultRecordSeparatorPolicy;
import org.springframework.batch.item.file.transform.FieldSet;
import org.springframework.core.io.FileSystemResource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Reads the de-duplication keys of every row already present in a cash-application CSV.
 *
 * <p>Columns are taken by position (Date 0, Credit Amount 8, Bank Ref # 10, Description 13) so
 * that extra trailing columns added by hand do not shift the key.
 */
@Slf4j
public final class AppliedTransactionKeys {

    static final int COL_DATE = 0;
    static final int COL_CREDIT_AMOUNT = 8;
    static final int COL_BANK_REFERENCE = 10;
    static final int COL_DESCRIPTION = 13;

    private AppliedTransactionKeys() {
    }

    /**
     * @return the keys found, or an empty set when {@code path} does not exist or holds only a header
     * @throws ItemStreamException when the file exists but cannot be read or parsed
     */
    public static Set<AppliedTransactionKey> load(Path path) {
        Set<AppliedTransactionKey> keys = new HashSet<>();
        try {
            if (!Files.isRegularFile(path) || Files.size(path) == 0) {
                return keys;
            }
        } catch (IOException e) {
            throw new ItemStreamException("Cannot inspect cash-application file " + path, e);
        }

        FlatFileItemReader<AppliedTransactionKey> reader = new FlatFileItemReaderBuilder<AppliedTransactionKey>()
                .name("appliedTransactionKeyReader")
                .resource(new FileSystemResource(path))
                .encoding("UTF-8")
                .linesToSkip(1)
                .saveState(false)
                .recordSeparatorPolicy(new DefaultRecordSeparatorPolicy())
                .lineTokenizer(TransactionRowReaderFactory.tokenizer())
                .fieldSetMapper(AppliedTransactionKeys::toKey)
                .build();

        reader.open(new ExecutionContext());
        try {
            AppliedTransactionKey key;
            while ((key = reader.read()) != null) {
                keys.add(key);
            }
        } catch (Exception e) {
            throw new ItemStreamException("Cannot read applied transactions from " + path, e);
        } finally {
            reader.close();
        }

        log.info("Loaded {} already-applied transaction key(s) from {}", keys.size(), path);
        return keys;
    }

    private static AppliedTransactionKey toKey(FieldSet fieldSet) {
        return new AppliedTransactionKey(
                read(fieldSet, COL_DATE),
                read(fieldSet, COL_CREDIT_AMOUNT),
                fieldSet.getFieldCount() > COL_DESCRIPTION ? fieldSet.readRawString(COL_DESCRIPTION) : "",
                read(fieldSet, COL_BANK_REFERENCE));
    }

    private static String read(FieldSet fieldSet, int index) {
        return index < fieldSet.getFieldCount() ? fieldSet.readString(index) : "";
    }
}

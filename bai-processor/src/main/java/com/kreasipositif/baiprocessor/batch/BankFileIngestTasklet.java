package com.kreasipositif.baiprocessor.batch;

import com.kreasipositif.baiprocessor.bai2.Bai2Decoder;
import com.kreasipositif.baiprocessor.bai2.Bai2RowProjector;
import com.kreasipositif.baiprocessor.bai2.model.FileRecord;
import com.kreasipositif.baiprocessor.domain.BalanceRow;
import com.kreasipositif.baiprocessor.domain.TransactionRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.core.io.Resource;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Decodes one BAI2 file and writes its balances and transactions as two CSV files.
 *
 * <p>For an input named {@code <base>.bai} the outputs are {@code <base>_balances.csv} and
 * {@code <base>_transactions.csv} in the output directory. A file without transactions still yields
 * a header-only transactions CSV.
 *
 * <p>Not a {@code @Component}: created as a {@code @StepScope} bean in
 * {@link com.kreasipositif.baiprocessor.config.BatchConfig} from the job parameters.
 */
@Slf4j
public class BankFileIngestTasklet implements Tasklet {

    public static final String TRANSACTIONS_FILE_KEY = "transactionsFile";
    public static final String BALANCES_FILE_KEY = "balancesFile";
    static final String BALANCE_ROWS_KEY = "balanceRows";
    static final String TRANSACTION_ROWS_KEY = "transactionRows";

    private final Resource inputFile;
    private final Path outputDir;
    private final Bai2Decoder decoder;
    private final Bai2RowProjector projector;

    public BankFileIngestTasklet(Resource inputFile, Path outputDir, Bai2Decoder decoder, Bai2RowProjector projector) {
        this.inputFile = inputFile;
        this.outputDir = outputDir;
        this.decoder = decoder;
        this.projector = projector;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        // malformed UTF-8 sequences are replaced rather than rejected
        String content = inputFile.getContentAsString(StandardCharsets.UTF_8);
        log.info("Read bank file {} ({} chars)", inputFile.getDescription(), content.length());

        FileRecord file = decoder.decode(content);
        List<BalanceRow> balances = projector.balanceRows(file);
        List<TransactionRow> transactions = projector.transactionRows(file);

        Files.createDirectories(outputDir);
        String base = baseName(inputFile);
        Path balancesFile = outputDir.resolve(base + "_balances.csv");
        Path transactionsFile = outputDir.resolve(base + "_transactions.csv");

        write("balanceWriter", balancesFile, BalanceRow.FIELDS, BalanceRow.HEADERS, balances);
        write("transactionWriter", transactionsFile, TransactionRow.FIELDS, TransactionRow.HEADERS, transactions);

        log.info("Bank file '{}' ingested — {} balance row(s) → {}, {} transaction row(s) → {}",
                base, balances.size(), balancesFile, transactions.size(), transactionsFile);

        ExecutionContext stepContext = chunkContext.getStepContext().getStepExecution().getExecutionContext();
        stepContext.putInt(BALANCE_ROWS_KEY, balances.size());
        stepContext.putInt(TRANSACTION_ROWS_KEY, transactions.size());

        ExecutionContext jobContext = chunkContext.getStepContext().getStepExecution()
                .getJobExecution().getExecutionContext();
        jobContext.putString(BALANCES_FILE_KEY, balancesFile.toString());
        jobContext.putString(TRANSACTIONS_FILE_KEY, transactionsFile.toString());

        contribution.incrementReadCount();
        contribution.incrementWriteCount(balances.size() + transactions.size());
        return RepeatStatus.FINISHED;
    }

    private static <T> void write(String name, Path path, String[] fields, String[] headers, List<T> rows)
            throws Exception {
        FlatFileItemWriter<T> writer = CsvFileWriters.build(name, path, fields, headers, false, false);
        writer.open(new ExecutionContext());
        try {
            writer.write(new Chunk<>(rows));
        } finally {
            writer.close();
        }
    }

    static String baseName(Resource resource) {
        String filename = resource.getFilename();
        if (!StringUtils.hasText(filename)) {
            return "bank_file";
        }
        String stripped = StringUtils.stripFilenameExtension(filename);
        return stripped.isEmpty() ? filename : stripped;
    }
}

package com.kreasipositif.baiprocessor.config;

import com.kreasipositif.baiprocessor.bai2.Bai2Decoder;
import com.kreasipositif.baiprocessor.bai2.Bai2RowProjector;
import com.kreasipositif.baiprocessor.batch.AppliedTransactionKeys;
import com.kreasipositif.baiprocessor.batch.BankFileIngestTasklet;
import com.kreasipositif.baiprocessor.batch.CashApplicationItemProcessor;
import com.kreasipositif.baiprocessor.batch.CashApplicationItemWriter;
import com.kreasipositif.baiprocessor.batch.TransactionRowReaderFactory;
import com.kreasipositif.baiprocessor.client.InvoiceClient;
import com.kreasipositif.baiprocessor.domain.CashApplicationRow;
import com.kreasipositif.baiprocessor.domain.TransactionRow;
import com.kreasipositif.baiprocessor.matching.InvoiceMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.launch.support.TaskExecutorJobLauncher;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.util.ResourceUtils;

import java.nio.file.Path;

/**
 * Central Spring Batch configuration.
 *
 * <h3>Architecture</h3>
 * <pre>
 *  bankFileIngestJob ─► bankFileIngestStep (tasklet)
 *                            └── BankFileIngestTasklet  (BAI2 → balances CSV + transactions CSV)
 *
 *  cashApplicationJob ─► cashApplicationStep (chunk-oriented)
 *                            ├── FlatFileItemReader            (transactions CSV)
 *                            ├── CashApplicationItemProcessor  (de-duplicate, match to open invoices)
 *                            └── CashApplicationItemWriter     (append to cash-application CSV)
 * </pre>
 *
 * <p>The cash-application step is single-threaded: output rows are appended in input order.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class BatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final ResourceLoader resourceLoader;

    @Value("${bai.cash-application.chunk-size:100}")
    private int chunkSize;

    // ─── Domain services ─────────────────────────────────────────────────────

    @Bean
    public Bai2Decoder bai2Decoder() {
        return new Bai2Decoder();
    }

    @Bean
    public Bai2RowProjector bai2RowProjector(ExportProperties exportProperties) {
        return new Bai2RowProjector(exportProperties.getAccountTitle(), exportProperties.getEntityName());
    }

    @Bean
    public InvoiceMatcher invoiceMatcher(
            @Value("${bai.cash-application.invoice-link-label:Open Invoice}") String linkLabel) {
        return new InvoiceMatcher(linkLabel);
    }

    // ─── Async JobLauncher ────────────────────────────────────────────────────

    /**
     * An async {@link JobLauncher}: {@code jobLauncher.run(...)} returns immediately with
     * {@code BatchStatus.STARTING} and callers poll {@code GET /api/v1/batch/status/{id}}.
     */
    @Bean("asyncJobLauncher")
    @Primary
    public JobLauncher asyncJobLauncher() throws Exception {
        TaskExecutorJobLauncher launcher = new TaskExecutorJobLauncher();
        launcher.setJobRepository(jobRepository);
        launcher.setTaskExecutor(new SimpleAsyncTaskExecutor("job-launcher-"));
        launcher.afterPropertiesSet();
        return launcher;
    }

    // ─── Bank-file ingest ────────────────────────────────────────────────────

    @Bean
    public Job bankFileIngestJob() {
        return new JobBuilder("bankFileIngestJob", jobRepository)
                .start(bankFileIngestStep())
                .build();
    }

    @Bean
    public Step bankFileIngestStep() {
        return new StepBuilder("bankFileIngestStep", jobRepository)
                .tasklet(bankFileIngestTasklet(null, null, null, null), transactionManager)
                .build();
    }

    /**
     * Step-scoped tasklet; at context-load time the parameters fall back to {@code bai.input-file}
     * and {@code bai.output-dir}.
     */
    @Bean
    @StepScope
    public BankFileIngestTasklet bankFileIngestTasklet(
            @Value("#{jobParameters['inputFile'] ?: '${bai.input-file}'}") String inputFile,
            @Value("#{jobParameters['outputDir'] ?: '${bai.output-dir}'}") String outputDir,
            Bai2Decoder decoder,
            Bai2RowProjector projector) {
        log.debug("bankFileIngestTasklet — inputFile={}, outputDir={}", inputFile, outputDir);
        return new BankFileIngestTasklet(resolve(inputFile), Path.of(outputDir), decoder, projector);
    }

    // ─── Cash application ────────────────────────────────────────────────────

    @Bean
    public Job cashApplicationJob() {
        return new JobBuilder("cashApplicationJob", jobRepository)
                .start(cashApplicationStep())
                .build();
    }

    @Bean
    public Step cashApplicationStep() {
        return new StepBuilder("cashApplicationStep", jobRepository)
                .<TransactionRow, CashApplicationRow>chunk(chunkSize, transactionManager)
                .reader(transactionRowReader(null, null))               // placeholders, resolved by @StepScope
                .processor(cashApplicationItemProcessor(null, null, null))
                .writer(cashApplicationItemWriter(null))
                .build();
    }

    @Bean
    @StepScope
    public FlatFileItemReader<TransactionRow> transactionRowReader(
            @Value("#{jobParameters['transactionsFile']}") String transactionsFile,
            TransactionRowReaderFactory readerFactory) {
        return readerFactory.create(resolve(transactionsFile), "transactionRowReader");
    }

    /**
     * Fetches the open invoices and the keys of already-applied rows once per step execution.
     */
    @Bean
    @StepScope
    public CashApplicationItemProcessor cashApplicationItemProcessor(
            @Value("#{jobParameters['outputFile'] ?: '${bai.cash-application.output-file}'}") String outputFile,
            InvoiceClient invoiceClient,
            InvoiceMatcher invoiceMatcher) {
        return new CashApplicationItemProcessor(
                invoiceMatcher,
                invoiceClient.fetchOpenInvoices(),
                AppliedTransactionKeys.load(Path.of(outputFile)));
    }

    @Bean
    @StepScope
    public CashApplicationItemWriter cashApplicationItemWriter(
            @Value("#{jobParameters['outputFile'] ?: '${bai.cash-application.output-file}'}") String outputFile) {
        return new CashApplicationItemWriter(Path.of(outputFile));
    }

    // ─── helper ──────────────────────────────────────────────────────────────

    /**
     * {@code classpath:}, {@code file:} and URL locations go through the {@link ResourceLoader};
     * anything else is a filesystem path.
     */
    private Resource resolve(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("No input location given");
        }
        return ResourceUtils.isUrl(location)
                ? resourceLoader.getResource(location)
                : new FileSystemResource(location);
    }
}

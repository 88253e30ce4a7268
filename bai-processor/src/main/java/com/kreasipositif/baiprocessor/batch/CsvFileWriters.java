package com.kreasipositif.baiprocessor.batch;

import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.batch.item.file.builder.FlatFileItemWriterBuilder;
import org.springframework.batch.item.file.transform.BeanWrapperFieldExtractor;
import org.springframework.core.io.FileSystemResource;

import java.nio.file.Path;

/**
 * Builds the {@link FlatFileItemWriter}s behind every CSV this service produces: a header line
 * followed by one {@link CsvLineAggregator} line per bean.
 */
final class CsvFileWriters {

    private CsvFileWriters() {
    }

    /**
     * @param fields  bean property paths in column order; nested paths such as
     *                {@code transaction.date} are allowed
     * @param headers header line values, same length as {@code fields}
     * @param append  when true an existing non-empty file keeps its content and header
     */
    static <T> FlatFileItemWriter<T> build(String name, Path path, String[] fields, String[] headers,
                                           boolean append, boolean transactional) {
        BeanWrapperFieldExtractor<T> extractor = new BeanWrapperFieldExtractor<>();
        extractor.setNames(fields);

        CsvLineAggregator<T> aggregator = new CsvLineAggregator<>();
        aggregator.setFieldExtractor(extractor);

        return new FlatFileItemWriterBuilder<T>()
                .name(name)
                .resource(new FileSystemResource(path))
                .lineAggregator(aggregator)
                .headerCallback(writer -> writer.write(CsvLineAggregator.headerLine(headers)))
                .encoding("UTF-8")
                .append(append)
                .transactional(transactional)
                .build();
    }
}

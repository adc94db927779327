package com.eainde.productresearch.batch;

import com.eainde.productresearch.model.BatchResult;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes batch rows as CSV with the header {@code barcode,sku,title,result}.
 */
@Log4j2
public class BatchResultCsvWriter {

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = csvMapper.schemaFor(BatchResult.class).withHeader();

    public Path write(List<BatchResult> results, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             SequenceWriter rows = csvMapper.writer(schema).writeValues(writer)) {
            rows.writeAll(results);
        }
        log.info("Wrote {} batch rows to {}", results.size(), target.toAbsolutePath());
        return target.toAbsolutePath();
    }
}

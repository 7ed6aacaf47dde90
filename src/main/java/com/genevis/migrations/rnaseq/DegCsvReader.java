package com.genevis.migrations.rnaseq;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a {@code <comparison>.DEG.all.csv} file whose first line is the header row.
 */
@Component
public class DegCsvReader {

    private static final CSVFormat DEG_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setAllowMissingColumnNames(true)
            .setIgnoreEmptyLines(true)
            .build();

    public DegTable read(Path csvPath) {
        if (!Files.isRegularFile(csvPath)) {
            throw new IllegalArgumentException(RnaSeqConstants.MSG_CSV_NOT_FOUND.formatted(csvPath));
        }

        try (BufferedReader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
             CSVParser parser = DEG_FORMAT.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            if (headers.isEmpty()) {
                throw new IllegalArgumentException(RnaSeqConstants.MSG_CSV_EMPTY.formatted(csvPath));
            }

            List<List<String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                List<String> cells = new ArrayList<>(headers.size());
                for (int i = 0; i < headers.size(); i++) {
                    cells.add(record.isSet(i) ? record.get(i) : null);
                }
                rows.add(cells);
            }
            return new DegTable(headers, rows);
        } catch (IOException ex) {
            throw new IllegalStateException(RnaSeqConstants.MSG_CSV_READ_FAILED.formatted(csvPath), ex);
        }
    }
}

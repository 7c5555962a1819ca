package com.lynx.anomaly.export;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.lynx.anomaly.model.FeatureMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the preprocessed feature matrix as {@code preprocessed_data.csv} for
 * debugging. Best effort: failures are logged, never thrown.
 */
@Component
public class DebugCsvWriter {

    private static final Logger log = LoggerFactory.getLogger(DebugCsvWriter.class);

    public static final String FILE_NAME = "preprocessed_data.csv";

    private final CsvMapper csvMapper = new CsvMapper();

    public boolean write(FeatureMatrix matrix, Path outputDir) {
        Path target = outputDir.resolve(FILE_NAME);
        List<String> names = matrix.featureNames();
        CsvSchema.Builder schema = CsvSchema.builder();
        names.forEach(name -> schema.addColumn(name, CsvSchema.ColumnType.NUMBER));

        try {
            Files.createDirectories(outputDir);
            try (SequenceWriter writer = csvMapper.writer(schema.build().withHeader()).writeValues(target.toFile())) {
                for (int r = 0; r < matrix.rowCount(); r++) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int c = 0; c < names.size(); c++) {
                        row.put(names.get(c), matrix.get(r, c));
                    }
                    writer.write(row);
                }
            }
            log.info("Saved preprocessed data to {}", target);
            return true;
        } catch (IOException e) {
            log.warn("Could not write preprocessed data to {}: {}", target, e.getMessage());
            return false;
        }
    }
}

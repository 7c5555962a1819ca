package com.lynx.anomaly.data;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.lynx.anomaly.exception.EmptyInputException;
import com.lynx.anomaly.exception.PipelineStage;
import com.lynx.anomaly.exception.TrainingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a headered telemetry CSV into a {@link RawTable}. Every column is parsed as
 * a number; blanks and unparseable cells become NaN.
 */
@Component
public class TelemetryCsvReader {

    private static final Logger log = LoggerFactory.getLogger(TelemetryCsvReader.class);

    private static final Map<String, Double> SPECIAL_VALUES = Map.of(
            "inf", Double.POSITIVE_INFINITY,
            "+inf", Double.POSITIVE_INFINITY,
            "infinity", Double.POSITIVE_INFINITY,
            "-inf", Double.NEGATIVE_INFINITY,
            "-infinity", Double.NEGATIVE_INFINITY,
            "true", 1.0,
            "false", 0.0);

    private final CsvMapper csvMapper;

    public TelemetryCsvReader() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public RawTable read(Path file) {
        if (!Files.exists(file)) {
            throw new TrainingException(PipelineStage.LOAD, "Input file not found: " + file);
        }

        List<String[]> records = new ArrayList<>();
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class).readValues(file.toFile())) {
            while (it.hasNextValue()) {
                records.add(it.nextValue());
            }
        } catch (IOException e) {
            throw new TrainingException(PipelineStage.LOAD, "Failed to load CSV " + file + ": " + e.getMessage(), e);
        }

        if (records.isEmpty()) {
            throw new EmptyInputException(file.toString());
        }

        String[] header = records.get(0);
        int rowCount = records.size() - 1;
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (String name : header) {
            columns.put(name.trim(), new double[rowCount]);
        }
        List<double[]> ordered = new ArrayList<>(columns.values());

        int shortRows = 0;
        for (int r = 0; r < rowCount; r++) {
            String[] record = records.get(r + 1);
            if (record.length < header.length) shortRows++;
            for (int c = 0; c < ordered.size(); c++) {
                ordered.get(c)[r] = c < record.length ? parseCell(record[c]) : Double.NaN;
            }
        }
        if (shortRows > 0) {
            log.warn("{} rows had fewer cells than the header; missing cells treated as NaN", shortRows);
        }

        log.info("Loaded {} rows, {} columns from {}", rowCount, columns.size(), file);
        return new RawTable(columns, rowCount);
    }

    static double parseCell(String cell) {
        if (cell == null) return Double.NaN;
        String value = cell.trim();
        if (value.isEmpty()) return Double.NaN;
        Double special = SPECIAL_VALUES.get(value.toLowerCase(Locale.ROOT));
        if (special != null) return special;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}

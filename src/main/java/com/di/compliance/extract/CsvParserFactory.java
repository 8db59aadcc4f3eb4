package com.di.compliance.extract;

import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates univocity parsers for tabular documents. Headers are read as the first record so
 * that the extractor controls field-name normalization.
 */
@Slf4j
@Component
public class CsvParserFactory {

    static final int MAX_CHARS_PER_COLUMN = 100_000;

    public CsvParser newParser(char delimiter) {
        CsvParserSettings settings = new CsvParserSettings();
        settings.setHeaderExtractionEnabled(false);
        settings.setSkipEmptyLines(true);
        settings.setIgnoreLeadingWhitespaces(true);
        settings.setIgnoreTrailingWhitespaces(true);
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setColumnReorderingEnabled(false);
        settings.setMaxCharsPerColumn(MAX_CHARS_PER_COLUMN);
        settings.setReadInputOnSeparateThread(false);
        settings.getFormat().setDelimiter(delimiter);
        log.debug("Created CsvParser delimiter='{}' maxCharsPerColumn={}", delimiter, MAX_CHARS_PER_COLUMN);
        return new CsvParser(settings);
    }
}

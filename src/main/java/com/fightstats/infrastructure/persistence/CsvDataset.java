package com.fightstats.infrastructure.persistence;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fightstats.domain.exception.DatasetException;
import com.fightstats.domain.model.PersistedIds;
import com.fightstats.domain.ports.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Append-only CSV file holding one record type.
 * <p>
 * Column names and order come from the record's Jackson annotations. The header is
 * written only when the file is absent or empty; later appends add data rows only.
 */
public class CsvDataset<T> implements Dataset<T> {

    private static final Logger logger = LoggerFactory.getLogger(CsvDataset.class);
    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    private final String name;
    private final Path file;
    private final Class<T> recordType;
    private final String idColumn;
    private final CsvSchema schema;

    public CsvDataset(String name, Path file, Class<T> recordType, String idColumn) {
        this.name = name;
        this.file = file;
        this.recordType = recordType;
        this.idColumn = idColumn;
        this.schema = CSV_MAPPER.schemaFor(recordType);
    }

    @Override
    public String name() {
        return name;
    }

    public Path file() {
        return file;
    }

    @Override
    public PersistedIds loadIds() {
        if (isFresh()) {
            return PersistedIds.empty();
        }

        Set<String> ids = new HashSet<>();
        CsvSchema headerSchema = CsvSchema.emptySchema().withHeader();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<Map<String, String>> rows = CSV_MAPPER
                 .readerForMapOf(String.class)
                 .with(headerSchema)
                 .readValues(reader)) {
            while (rows.hasNextValue()) {
                String id = rows.nextValue().get(idColumn);
                if (id != null && !id.isEmpty()) {
                    ids.add(id);
                }
            }
        } catch (IOException e) {
            throw new DatasetException("Failed to read ids from " + file, e);
        }

        logger.debug("Loaded {} existing ids from {}", ids.size(), file);
        return PersistedIds.of(ids);
    }

    @Override
    public int append(List<T> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }

        boolean fresh = isFresh();
        CsvSchema rowSchema = fresh ? schema.withHeader() : schema.withoutHeader();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                     StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                 SequenceWriter writer = CSV_MAPPER.writerFor(recordType).with(rowSchema).writeValues(out)) {
                writer.writeAll(records);
            }
        } catch (IOException e) {
            throw new DatasetException("Failed to append " + records.size() + " rows to " + file, e);
        }

        logger.info("Appended {} rows to {}{}", records.size(), file, fresh ? " (new file)" : "");
        return records.size();
    }

    private boolean isFresh() {
        try {
            return !Files.exists(file) || Files.size(file) == 0;
        } catch (IOException e) {
            throw new DatasetException("Failed to inspect " + file, e);
        }
    }
}

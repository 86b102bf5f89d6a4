/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.core.output;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.pathways.typing.api.IFormWriter;
import com.pathways.typing.api.form.FormDocument;
import com.pathways.typing.api.form.RowSet;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Writes each sheet of a form as a tab separated file {@code <base>_<sheet>.tsv}, and the flow
 * diagram as {@code <base>.txt}, into one directory.
 *
 * <p>Cells holding a tab, a line break or a double quote are quoted; every other cell is written
 * as is. A sheet without rows still gets its header line; one without columns is left empty.
 */
public class TsvFormWriter implements IFormWriter {

    private static final Logger logger = Logger.getLogger(TsvFormWriter.class.getName());

    private final Path directory;
    private final String baseName;
    private final CsvMapper mapper;

    public TsvFormWriter(Path directory, String baseName) {
        this.directory = directory;
        this.baseName = baseName;
        this.mapper = CsvMapper.builder()
                .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .build();
    }

    @Override
    public void write(FormDocument document) throws IOException {
        Files.createDirectories(directory);
        for (RowSet sheet : List.of(document.survey(), document.choices(), document.settings())) {
            Path path = sheetPath(sheet.name());
            writeSheet(sheet, path);
            logger.info(String.format("Wrote %d %s rows to %s", sheet.size(), sheet.name(), path));
        }
    }

    public void writeDiagram(String diagram) throws IOException {
        Files.createDirectories(directory);
        Path path = directory.resolve(baseName + ".txt");
        Files.writeString(path, diagram);
        logger.info("Wrote flow diagram to " + path);
    }

    public Path sheetPath(String sheet) {
        return directory.resolve(baseName + "_" + sheet + ".tsv");
    }

    static CsvSchema schema(RowSet sheet) {
        CsvSchema.Builder builder = CsvSchema.builder()
                .setColumnSeparator('\t')
                .setLineSeparator("\n")
                .setUseHeader(!sheet.columns().isEmpty());
        for (String column : sheet.columns()) {
            builder.addColumn(column);
        }
        return builder.build();
    }

    private void writeSheet(RowSet sheet, Path path) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             SequenceWriter rows = mapper.writer(schema(sheet)).writeValues(out)) {
            for (Map<String, String> row : sheet.rows()) {
                Map<String, String> cells = new LinkedHashMap<>();
                for (String column : sheet.columns()) {
                    cells.put(column, row.getOrDefault(column, ""));
                }
                rows.write(cells);
            }
        }
    }
}

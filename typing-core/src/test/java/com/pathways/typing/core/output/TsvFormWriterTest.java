package com.pathways.typing.core.output;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.pathways.typing.api.form.FormDocument;
import com.pathways.typing.api.form.RowSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TsvFormWriterTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should write one tab separated file per sheet")
    void testWriteSheets() throws IOException {
        RowSet survey = RowSet.builder(FormDocument.SURVEY)
                .row(Map.of("type", "integer"))
                .build();
        RowSet choices = RowSet.builder(FormDocument.CHOICES).columns("list_name", "name").build();
        RowSet settings = RowSet.builder(FormDocument.SETTINGS).row(Map.of("form_title", "Typing")).build();
        Path output = tempDir.resolve("out");
        TsvFormWriter writer = new TsvFormWriter(output, "typing");

        writer.write(new FormDocument(survey, choices, settings));

        assertThat(writer.sheetPath(FormDocument.SURVEY)).isEqualTo(output.resolve("typing_survey.tsv"));
        assertThat(Files.readString(writer.sheetPath(FormDocument.SURVEY))).isEqualTo("type\ninteger\n");
        assertThat(Files.readString(writer.sheetPath(FormDocument.CHOICES))).isEqualTo("list_name\tname\n");
        assertThat(Files.readString(writer.sheetPath(FormDocument.SETTINGS))).isEqualTo("form_title\nTyping\n");
    }

    @Test
    @DisplayName("Should quote labels holding line breaks and tabs so each row stays one record")
    void testQuotedLabel() throws IOException {
        RowSet survey = RowSet.builder(FormDocument.SURVEY)
                .row(Map.of("type", "note", "label", "Line one\nLine two\twith tab"))
                .build();
        RowSet choices = RowSet.builder(FormDocument.CHOICES).columns("list_name", "name").build();
        RowSet settings = RowSet.builder(FormDocument.SETTINGS).row(Map.of("form_title", "Typing")).build();
        TsvFormWriter writer = new TsvFormWriter(tempDir, "typing");

        writer.write(new FormDocument(survey, choices, settings));

        CsvSchema schema = CsvSchema.emptySchema().withHeader().withColumnSeparator('\t');
        try (MappingIterator<Map<String, String>> rows = new CsvMapper().readerForMapOf(String.class)
                .with(schema)
                .readValues(writer.sheetPath(FormDocument.SURVEY).toFile())) {
            List<Map<String, String>> read = rows.readAll();
            assertThat(read).hasSize(1);
            assertThat(read.get(0)).containsEntry("label", "Line one\nLine two\twith tab")
                    .containsEntry("type", "note");
        }
    }

    @Test
    @DisplayName("Should write a row missing a column as an empty cell")
    void testMissingCell() throws IOException {
        RowSet survey = RowSet.builder(FormDocument.SURVEY)
                .row(Map.of("type", "integer"))
                .row(Map.of("type", "note", "name", "segment_note"))
                .build();
        TsvFormWriter writer = new TsvFormWriter(tempDir, "typing");

        writer.write(new FormDocument(survey, RowSet.builder(FormDocument.CHOICES).build(),
                RowSet.builder(FormDocument.SETTINGS).build()));

        assertThat(Files.readString(writer.sheetPath(FormDocument.SURVEY)))
                .isEqualTo("type\tname\ninteger\t\nnote\tsegment_note\n");
    }

    @Test
    @DisplayName("Should write the diagram next to the sheets")
    void testWriteDiagram() throws IOException {
        TsvFormWriter writer = new TsvFormWriter(tempDir, "typing");

        writer.writeDiagram("flowchart TD\n");

        assertThat(Files.readString(tempDir.resolve("typing.txt"))).isEqualTo("flowchart TD\n");
    }
}

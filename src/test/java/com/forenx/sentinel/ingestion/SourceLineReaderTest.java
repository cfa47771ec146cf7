package com.forenx.sentinel.ingestion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SourceLineReader Tests")
class SourceLineReaderTest {

    private static List<SourceLineReader.Line> readAll(byte[] content) throws IOException {
        List<SourceLineReader.Line> lines = new ArrayList<>();
        try (SourceLineReader reader = new SourceLineReader(new ByteArrayInputStream(content))) {
            SourceLineReader.Line line;
            while ((line = reader.next()) != null) {
                lines.add(line);
            }
        }
        return lines;
    }

    @Test
    @DisplayName("Should strip LF and CRLF from the text but keep them in the raw bytes")
    void shouldKeepTerminatorsInRawBytes() throws IOException {
        List<SourceLineReader.Line> lines = readAll("one\r\ntwo\nthree".getBytes(StandardCharsets.UTF_8));

        assertThat(lines).extracting(SourceLineReader.Line::getText).containsExactly("one", "two", "three");
        assertThat(new String(lines.get(0).getRaw(), StandardCharsets.UTF_8)).isEqualTo("one\r\n");
        assertThat(new String(lines.get(2).getRaw(), StandardCharsets.UTF_8)).isEqualTo("three");
    }

    @Test
    @DisplayName("Should reproduce the stream byte for byte, including invalid UTF-8 and long lines")
    void shouldReproduceStream() throws IOException {
        ByteArrayOutputStream content = new ByteArrayOutputStream();
        content.write(new byte[]{'a', (byte) 0xFF, 'b', '\n'});
        content.write("x".repeat(20_000).getBytes(StandardCharsets.UTF_8));
        content.write('\n');
        content.write('\n');

        ByteArrayOutputStream rebuilt = new ByteArrayOutputStream();
        List<SourceLineReader.Line> lines = readAll(content.toByteArray());
        for (SourceLineReader.Line line : lines) {
            rebuilt.write(line.getRaw());
        }

        assertThat(lines).hasSize(3);
        assertThat(lines.get(1).getText()).hasSize(20_000);
        assertThat(lines.get(2).getText()).isEmpty();
        assertThat(rebuilt.toByteArray()).isEqualTo(content.toByteArray());
    }
}

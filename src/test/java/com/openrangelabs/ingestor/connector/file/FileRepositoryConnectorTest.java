package com.openrangelabs.ingestor.connector.file;

import com.openrangelabs.ingestor.connector.CancellationSignal;
import com.openrangelabs.ingestor.connector.DataStructureInfo;
import com.openrangelabs.ingestor.extraction.ExtractionParameters;
import com.openrangelabs.ingestor.extraction.ExtractionResult;
import com.openrangelabs.ingestor.model.DataRow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class FileRepositoryConnectorTest {

    @TempDir
    Path root;

    private FileRepositoryConnector connector;

    @BeforeEach
    void setUp() throws IOException {
        write("readme.txt", "hello world", "2024-01-01T00:00:00Z");
        write("notes.md", "# notes", "2024-01-02T00:00:00Z");
        Files.createDirectories(root.resolve("archive"));
        write("archive/old.txt", "archived", "2024-01-03T00:00:00Z");
        write("config.json", "{\"a\":1}", "2024-01-04T00:00:00Z");
        write("logo.png", "not really a png", "2024-01-05T00:00:00Z");

        connector = new FileRepositoryConnector();
    }

    @AfterEach
    void tearDown() {
        connector.close();
    }

    @Test
    void validateConnection_MissingDirectory_IsInvalid() {
        StepVerifier.create(connector.validateConnection(Map.of("rootPath", root.resolve("missing").toString())))
            .assertNext(result -> {
                assertThat(result.isValid()).isFalse();
                assertThat(result.describeErrors()).contains("Directory does not exist");
            })
            .verifyComplete();
    }

    @Test
    void validateConnection_ExtensionWithoutDot_IsWarning() {
        StepVerifier.create(connector.validateConnection(Map.of("rootPath", root.toString(), "fileExtensions", "txt,.md")))
            .assertNext(result -> {
                assertThat(result.isValid()).isTrue();
                assertThat(result.getWarnings()).hasSize(1);
                assertThat(result.getWarnings().get(0)).contains("'txt'");
            })
            .verifyComplete();
    }

    @Test
    void discoverDataStructures_GroupsFilesByType() {
        connect(Map.of("rootPath", root.toString()));

        StepVerifier.create(connector.discoverDataStructures(Map.of()))
            .assertNext(structures -> {
                Map<String, Long> counts = structures.stream()
                    .collect(Collectors.toMap(DataStructureInfo::getName, DataStructureInfo::getEstimatedRecordCount));
                assertThat(counts).containsEntry("text_files", 3L)
                    .containsEntry("data_files", 1L)
                    .containsEntry("image_files", 1L);
            })
            .verifyComplete();
    }

    @Test
    void discoverDataStructures_WithoutSubDirectories_SkipsNestedFiles() {
        connect(Map.of("rootPath", root.toString(), "includeSubDirectories", "false"));

        StepVerifier.create(connector.discoverDataStructures(Map.of("name", "text")))
            .assertNext(structures -> {
                assertThat(structures).hasSize(1);
                assertThat(structures.get(0).getEstimatedRecordCount()).isEqualTo(2L);
            })
            .verifyComplete();
    }

    @Test
    void extractData_ReadsTextContentWhenRequested() {
        connect(Map.of("rootPath", root.toString()));
        ExtractionParameters parameters = ExtractionParameters.builder()
            .targetStructures(List.of("text_files"))
            .options(Map.of("includeContent", true))
            .build();

        ExtractionResult result = connector.extractData(parameters, CancellationSignal.none()).block();

        assertThat(result.isSuccess()).isTrue();
        assertThat(paths(result)).containsExactly("archive/old.txt", "notes.md", "readme.txt");
        DataRow readme = result.getRows().get(2);
        assertThat(readme.get("content").asString()).isEqualTo("hello world");
        assertThat(readme.get("extension").asString()).isEqualTo(".txt");
    }

    @Test
    void extractData_ReadsContentOnlyForReturnedFiles() {
        List<Path> read = new ArrayList<>();
        connector.close();
        connector = new FileRepositoryConnector() {
            @Override
            String readText(Path file) throws IOException {
                read.add(file);
                return super.readText(file);
            }
        };
        connect(Map.of("rootPath", root.toString()));
        ExtractionParameters parameters = ExtractionParameters.builder()
            .targetStructures(List.of("text_files"))
            .filterCriteria(Map.of("filename", "e"))
            .maxRecords(1)
            .options(Map.of("includeContent", true))
            .build();

        ExtractionResult result = connector.extractData(parameters, CancellationSignal.none()).block();

        assertThat(paths(result)).containsExactly("notes.md");
        assertThat(result.getRows().get(0).get("content").asString()).isEqualTo("# notes");
        assertThat(read).containsExactly(root.resolve("notes.md"));
    }

    @Test
    void extractData_AppliesFileFilters() {
        connect(Map.of("rootPath", root.toString()));
        ExtractionParameters parameters = ExtractionParameters.builder()
            .targetStructures(List.of("text_files"))
            .filterCriteria(Map.of("extension", "txt", "modifiedAfter", "2024-01-02T12:00:00Z"))
            .build();

        ExtractionResult result = connector.extractData(parameters, CancellationSignal.none()).block();

        assertThat(paths(result)).containsExactly("archive/old.txt");
    }

    @Test
    void extractData_ExtensionAllowListLimitsRepository() {
        connect(Map.of("rootPath", root.toString(), "fileExtensions", ".md"));

        ExtractionResult result = connector.extractData(ExtractionParameters.builder().build(), CancellationSignal.none()).block();

        assertThat(paths(result)).containsExactly("notes.md");
    }

    @Test
    void extractData_IncrementalTracksModifiedTime() throws IOException {
        connect(Map.of("rootPath", root.toString()));
        ExtractionParameters parameters = ExtractionParameters.builder()
            .targetStructures(List.of("text_files"))
            .incrementalExtraction(true)
            .changesFrom("2024-01-01T12:00:00Z")
            .build();

        ExtractionResult first = connector.extractData(parameters, CancellationSignal.none()).block();
        assertThat(paths(first)).containsExactly("notes.md", "archive/old.txt");
        assertThat(first.getContinuationToken()).isEqualTo("text_files|modified|2024-01-03T00:00:00Z");

        write("fresh.txt", "new", "2024-02-01T00:00:00Z");
        parameters.setContinuationToken(first.getContinuationToken());
        ExtractionResult second = connector.extractData(parameters, CancellationSignal.none()).block();

        assertThat(paths(second)).containsExactly("fresh.txt");
        assertThat(second.getContinuationToken()).isEqualTo("text_files|modified|2024-02-01T00:00:00Z");
    }

    @Test
    void testConnection_ReportsUnreadableRoot() {
        StepVerifier.create(connector.testConnection(Map.of("rootPath", root.resolve("nope").toString())))
            .expectNext(false)
            .verifyComplete();
    }

    private void connect(Map<String, String> parameters) {
        assertThat(connector.connect(parameters, CancellationSignal.none()).block().isSuccess()).isTrue();
    }

    private void write(String relative, String content, String modified) throws IOException {
        Path file = root.resolve(relative);
        Files.writeString(file, content);
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse(modified)));
    }

    private static List<String> paths(ExtractionResult result) {
        return result.getRows().stream().map(row -> row.get("path").asString()).collect(Collectors.toList());
    }
}

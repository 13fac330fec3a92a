package com.openrangelabs.ingestor.connector.file;

import com.openrangelabs.ingestor.connector.AbstractDataSourceConnector;
import com.openrangelabs.ingestor.connector.CancellationSignal;
import com.openrangelabs.ingestor.connector.ConnectionParameter;
import com.openrangelabs.ingestor.connector.ConnectionResult;
import com.openrangelabs.ingestor.connector.ConnectorCapabilities;
import com.openrangelabs.ingestor.connector.ConnectorMetadata;
import com.openrangelabs.ingestor.connector.DataStructureInfo;
import com.openrangelabs.ingestor.connector.FieldInfo;
import com.openrangelabs.ingestor.connector.ValidationResult;
import com.openrangelabs.ingestor.exception.ExtractionException;
import com.openrangelabs.ingestor.extraction.ExtractionParameters;
import com.openrangelabs.ingestor.extraction.StructureQuery;
import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.model.FieldValue;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File repository connector
 * Exposes files under a root directory as one structure per file type
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
public class FileRepositoryConnector extends AbstractDataSourceConnector {

    public static final String CONNECTOR_ID = "file-repository-connector";

    private static final int DEFAULT_MAX_FILE_SIZE_MB = 10;
    private static final int FILE_PROGRESS_INTERVAL = 10;
    private static final Set<String> FILE_FILTERS =
            Set.of("extension", "path", "filename", "modifiedAfter", "modifiedBefore", "minSize", "maxSize");

    private static final ConnectorMetadata METADATA = ConnectorMetadata.builder()
            .id(CONNECTOR_ID)
            .name("File Repository Connector")
            .sourceType("file-repository")
            .description("Reads file metadata and text content from a local or mounted directory tree")
            .capability("incremental")
            .capability("filtering")
            .category("files")
            .build();

    private static final ConnectorCapabilities CAPABILITIES = ConnectorCapabilities.builder()
            .supportsIncremental(true)
            .supportsSchemaDiscovery(true)
            .supportsAdvancedFiltering(true)
            .supportsPreview(true)
            .supportsResume(true)
            .maxConcurrentExtractions(4)
            .authenticationMode("none")
            .supportedSourceType("file-repository")
            .supportedSourceType("filesystem")
            .supportedSourceType("files")
            .build();

    private volatile RepositorySettings repository;

    @Override
    public ConnectorMetadata describeMetadata() {
        return METADATA;
    }

    @Override
    public List<ConnectionParameter> describeParameters() {
        return List.of(
                ConnectionParameter.builder().name("rootPath").displayName("Root path").required(true)
                        .description("Directory to read files from").order(1).build(),
                ConnectionParameter.builder().name("includeSubDirectories").displayName("Include sub-directories")
                        .type("boolean").defaultValue("true").order(2).build(),
                ConnectionParameter.builder().name("fileExtensions").displayName("File extensions")
                        .description("Comma separated list, e.g. .txt,.md").order(3).build(),
                ConnectionParameter.builder().name("maxFileSizeMB").displayName("Maximum file size (MB)")
                        .type("integer").defaultValue(String.valueOf(DEFAULT_MAX_FILE_SIZE_MB)).order(4).build());
    }

    @Override
    public ConnectorCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    protected ValidationResult validateParameters(Map<String, String> parameters) {
        ValidationResult result = ValidationResult.success();
        String rootPath = text(parameters, "rootPath");
        if (rootPath == null) {
            result.addError("rootPath", "Root path is required");
        } else if (!Files.isDirectory(Paths.get(rootPath))) {
            result.addError("rootPath", "Directory does not exist: " + rootPath);
        }
        String extensions = text(parameters, "fileExtensions");
        if (extensions != null) {
            for (String extension : extensions.split(",")) {
                String trimmed = extension.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith(".")) {
                    result.addWarning("File extension '" + trimmed + "' does not start with a dot");
                }
            }
        }
        Integer maxSize = integer(parameters, "maxFileSizeMB", 1, Integer.MAX_VALUE, result);
        if (maxSize != null && maxSize > 100) {
            result.addWarning("Files up to " + maxSize + " MB will be read; large files slow extraction down");
        }
        return result;
    }

    @Override
    protected ConnectionResult openSession(Map<String, String> parameters, CancellationSignal signal) {
        RepositorySettings settings = RepositorySettings.from(parameters);
        this.repository = settings;
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("rootPath", settings.root.toString());
        info.put("includeSubDirectories", settings.recursive);
        info.put("fileExtensions", settings.extensions);
        return ConnectionResult.success(newConnectionId("file-repo"), "Connected to file repository",
                "filesystem", info);
    }

    @Override
    protected void closeSession() {
        this.repository = null;
    }

    @Override
    protected boolean checkReachable(Map<String, String> parameters, CancellationSignal signal) {
        Path root = Paths.get(text(parameters, "rootPath"));
        return Files.isDirectory(root) && Files.isReadable(root);
    }

    @Override
    protected int progressInterval() {
        return FILE_PROGRESS_INTERVAL;
    }

    @Override
    protected String defaultTrackingField(DataStructureInfo structure) {
        return "modified";
    }

    @Override
    protected Mono<List<DataStructureInfo>> doDiscover(Map<String, String> filter) {
        return Mono.fromCallable(() -> {
            Map<FileType, Long> counts = new EnumMap<>(FileType.class);
            for (Path file : listFiles(currentRepository())) {
                counts.merge(FileType.ofExtension(extensionOf(file)), 1L, Long::sum);
            }
            return counts.entrySet().stream()
                    .map(entry -> structureFor(entry.getKey(), entry.getValue()))
                    .filter(structure -> !filter.containsKey("name")
                            || structure.getName().contains(filter.get("name").toLowerCase(Locale.ROOT)))
                    .collect(Collectors.toList());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    protected Mono<List<DataStructureInfo>> resolveTargets(ExtractionParameters parameters) {
        if (parameters.targetsAllStructures()) {
            return doDiscover(Map.of());
        }
        return Mono.fromCallable(() -> {
            List<DataStructureInfo> targets = new ArrayList<>();
            for (String name : parameters.getTargetStructures()) {
                FileType type = FileType.ofStructureName(name)
                        .orElseThrow(() -> new ExtractionException("Structure '" + name + "' not found"));
                targets.add(structureFor(type, null));
            }
            return targets;
        });
    }

    @Override
    protected Flux<DataRow> read(StructureQuery query) {
        FileType type = FileType.ofStructureName(query.getStructure().getName())
                .orElseThrow(() -> new ExtractionException("Unknown file structure " + query.getStructure().getName()));
        Map<String, Object> criteria = query.getFilters();
        boolean includeContent = query.booleanOption("includeContent");
        RepositorySettings settings = currentRepository();

        StructureQuery remaining = query.withoutFilters(FILE_FILTERS);
        // Content is read only for rows that survive filtering and the limit, unless the query inspects it
        boolean contentFirst = includeContent && readsContent(remaining);

        Flux<DataRow> rows = Flux.defer(() -> Flux.fromIterable(listFiles(settings)))
                .filter(file -> FileType.ofExtension(extensionOf(file)) == type)
                .map(file -> toRow(file, settings, contentFirst))
                .filter(row -> matchesFileFilters(row, criteria));
        Flux<DataRow> selected = remaining.applyTo(rows);
        if (includeContent && !contentFirst) {
            selected = selected.map(row -> withContent(row, settings));
        }
        return selected.subscribeOn(Schedulers.boundedElastic());
    }

    private static boolean readsContent(StructureQuery query) {
        return query.getFilters().containsKey("content")
                || query.getOrderBy().contains("content")
                || "content".equals(query.getTrackingField());
    }

    private DataRow withContent(DataRow row, RepositorySettings settings) {
        Path file = settings.root.resolve(row.get("path").asString());
        row.put("content", contentOf(file, row.get("extension").asString()));
        return row;
    }

    private RepositorySettings currentRepository() {
        RepositorySettings settings = repository;
        if (settings == null) {
            throw new IllegalStateException("File repository connector " + getId() + " is not connected");
        }
        return settings;
    }

    private List<Path> listFiles(RepositorySettings settings) {
        long maxBytes = settings.maxFileSizeMb * 1024L * 1024L;
        try (Stream<Path> paths = settings.recursive ? Files.walk(settings.root) : Files.list(settings.root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(file -> settings.extensions.isEmpty() || settings.extensions.contains(extensionOf(file)))
                    .filter(file -> sizeOf(file) <= maxBytes)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list files under " + settings.root, e);
        }
    }

    private DataRow toRow(Path file, RepositorySettings settings, boolean includeContent) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            String extension = extensionOf(file);
            DataRow row = new DataRow()
                    .set("path", settings.root.relativize(file).toString().replace('\\', '/'))
                    .set("filename", file.getFileName().toString())
                    .set("size", attributes.size())
                    .set("created", attributes.creationTime().toInstant())
                    .set("modified", attributes.lastModifiedTime().toInstant())
                    .set("extension", extension);
            if (includeContent) {
                row.put("content", contentOf(file, extension));
            }
            return row;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read attributes of " + file, e);
        }
    }

    private FieldValue contentOf(Path file, String extension) {
        if (!FileType.ofExtension(extension).isTextual()) {
            return FieldValue.ofNull();
        }
        try {
            return FieldValue.of(readText(file));
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Error extracting content from file {}: {}", file, e.getMessage());
            return FieldValue.of("Error extracting content: " + e.getMessage());
        }
    }

    String readText(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    static boolean matchesFileFilters(DataRow row, Map<String, Object> criteria) {
        for (Map.Entry<String, Object> entry : criteria.entrySet()) {
            if (entry.getValue() == null || !FILE_FILTERS.contains(entry.getKey())) {
                continue;
            }
            String value = entry.getValue().toString();
            boolean matches = switch (entry.getKey()) {
                case "extension" -> (value.startsWith(".") ? value : "." + value)
                        .equalsIgnoreCase(row.get("extension").asString());
                case "path" -> containsIgnoreCase(row.get("path").asString(), value);
                case "filename" -> containsIgnoreCase(row.get("filename").asString(), value);
                case "modifiedAfter" -> compareInstant(row.get("modified"), value) >= 0;
                case "modifiedBefore" -> compareInstant(row.get("modified"), value) <= 0;
                case "minSize" -> row.get("size").asNumber().map(size -> size.longValue() >= Long.parseLong(value)).orElse(false);
                case "maxSize" -> row.get("size").asNumber().map(size -> size.longValue() <= Long.parseLong(value)).orElse(false);
                default -> true;
            };
            if (!matches) {
                return false;
            }
        }
        return true;
    }

    private static int compareInstant(FieldValue modified, String bound) {
        Instant boundary = FieldValue.of(bound).asTimestamp()
                .orElseThrow(() -> new ExtractionException("Not a timestamp: " + bound));
        return modified.asTimestamp().map(value -> value.compareTo(boundary)).orElse(-1);
    }

    private static boolean containsIgnoreCase(String text, String part) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(part.toLowerCase(Locale.ROOT));
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read size of " + file, e);
        }
    }

    private static DataStructureInfo structureFor(FileType type, Long count) {
        List<FieldInfo> fields = List.of(
                FieldInfo.builder().name("path").dataType("string").nullable(false).primaryKey(true).build(),
                FieldInfo.builder().name("filename").dataType("string").nullable(false).build(),
                FieldInfo.builder().name("size").dataType("long").nullable(false).build(),
                FieldInfo.builder().name("created").dataType("datetime").build(),
                FieldInfo.builder().name("modified").dataType("datetime").nullable(false).build(),
                FieldInfo.builder().name("content").dataType("string").build(),
                FieldInfo.builder().name("extension").dataType("string").build());
        return new DataStructureInfo(type.structureName(), null, "file-group",
                type.name().charAt(0) + type.name().substring(1).toLowerCase(Locale.ROOT) + " files", fields, count, null);
    }

    private static final class RepositorySettings {
        private final Path root;
        private final boolean recursive;
        private final Set<String> extensions;
        private final int maxFileSizeMb;

        private RepositorySettings(Path root, boolean recursive, Set<String> extensions, int maxFileSizeMb) {
            this.root = root;
            this.recursive = recursive;
            this.extensions = extensions;
            this.maxFileSizeMb = maxFileSizeMb;
        }

        static RepositorySettings from(Map<String, String> parameters) {
            Path root = Paths.get(text(parameters, "rootPath")).toAbsolutePath().normalize();
            Set<String> extensions = Optional.ofNullable(text(parameters, "fileExtensions"))
                    .map(list -> Arrays.stream(list.split(","))
                            .map(String::trim)
                            .filter(extension -> !extension.isEmpty())
                            .map(extension -> (extension.startsWith(".") ? extension : "." + extension).toLowerCase(Locale.ROOT))
                            .collect(Collectors.toSet()))
                    .orElse(Set.of());
            int maxSize = Optional.ofNullable(text(parameters, "maxFileSizeMB")).map(Integer::parseInt).orElse(DEFAULT_MAX_FILE_SIZE_MB);
            return new RepositorySettings(root, flag(parameters, "includeSubDirectories", true), extensions, maxSize);
        }
    }
}

package com.openrangelabs.ingestor.connector.file;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * File groups exposed as {@code <type>_files} structures, keyed by extension.
 */
public enum FileType {
    PDF(false, ".pdf"),
    DOCUMENT(false, ".docx", ".doc", ".rtf"),
    TEXT(true, ".txt", ".md", ".csv"),
    HTML(true, ".html", ".htm"),
    IMAGE(false, ".jpg", ".jpeg", ".png", ".gif", ".bmp"),
    SPREADSHEET(false, ".xlsx", ".xls"),
    PRESENTATION(false, ".pptx", ".ppt"),
    DATA(true, ".xml", ".json"),
    OTHER(false);

    private static final String SUFFIX = "_files";

    private final boolean textual;
    private final Set<String> extensions;

    FileType(boolean textual, String... extensions) {
        this.textual = textual;
        this.extensions = Set.of(extensions);
    }

    public boolean isTextual() {
        return textual;
    }

    public String structureName() {
        return name().toLowerCase(Locale.ROOT) + SUFFIX;
    }

    public static FileType ofExtension(String extension) {
        String normalized = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.extensions.contains(normalized))
                .findFirst()
                .orElse(OTHER);
    }

    public static Optional<FileType> ofStructureName(String structureName) {
        return Arrays.stream(values())
                .filter(type -> type.structureName().equalsIgnoreCase(structureName))
                .findFirst();
    }
}

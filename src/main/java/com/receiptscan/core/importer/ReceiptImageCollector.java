package com.receiptscan.core.importer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Обходит папку и собирает файлы изображений чеков по glob-маскам. */
public final class ReceiptImageCollector {
    private static final Logger log = LoggerFactory.getLogger(ReceiptImageCollector.class);

    static final List<String> DEFAULT_PATTERNS =
            List.of("**/*.jpg", "**/*.jpeg", "**/*.png", "**/*.tif", "**/*.tiff", "**/*.bmp");

    private final List<PathMatcher> matchers;

    public ReceiptImageCollector(List<String> patterns) {
        var pats = (patterns == null || patterns.isEmpty()) ? DEFAULT_PATTERNS : patterns;
        // маски без учёта регистра расширения: IMG_001.JPG
        this.matchers = pats.stream()
                .map(p -> FileSystems.getDefault().getPathMatcher("glob:" + p.toLowerCase()))
                .collect(Collectors.toList());
    }

    /** Отсортированный список подходящих файлов. */
    public List<Path> collect(Path root) {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("not a directory: " + root);
        }
        try (Stream<Path> s = Files.walk(root)) {
            List<Path> found = s.filter(Files::isRegularFile)
                    .filter(this::matchesAny)
                    .sorted()
                    .collect(Collectors.toList());
            log.info("collected {} receipt images under {}", found.size(), root);
            return found;
        } catch (IOException e) {
            throw new UncheckedIOException("Receipt folder scan failed: " + root, e);
        }
    }

    private boolean matchesAny(Path path) {
        Path lower = Path.of(path.toAbsolutePath().toString().toLowerCase());
        Path name = lower.getFileName();
        for (var m : matchers) {
            if (m.matches(lower) || (name != null && m.matches(name))) {
                return true;
            }
        }
        return false;
    }
}

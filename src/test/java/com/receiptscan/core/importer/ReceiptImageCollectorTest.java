package com.receiptscan.core.importer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReceiptImageCollectorTest {

    @TempDir
    Path root;

    @Test
    void collects_images_recursively_case_insensitive() throws Exception {
        Files.createDirectories(root.resolve("sub"));
        Path a = Files.writeString(root.resolve("a.png"), "x");
        Path b = Files.writeString(root.resolve("B.JPG"), "x");
        Path c = Files.writeString(root.resolve("sub/c.tiff"), "x");
        Files.writeString(root.resolve("notes.txt"), "x");
        Files.writeString(root.resolve("sub/data.csv"), "x");

        List<Path> found = new ReceiptImageCollector(null).collect(root);
        assertEquals(3, found.size());
        assertTrue(found.containsAll(List.of(a, b, c)));
        assertEquals(found.stream().sorted().toList(), found);
    }

    @Test
    void custom_patterns() throws Exception {
        Files.writeString(root.resolve("a.png"), "x");
        Path heic = Files.writeString(root.resolve("scan.heic"), "x");
        assertEquals(List.of(heic), new ReceiptImageCollector(List.of("*.heic")).collect(root));
    }

    @Test
    void not_a_directory() throws Exception {
        Path f = Files.writeString(root.resolve("a.png"), "x");
        assertThrows(IllegalArgumentException.class, () -> new ReceiptImageCollector(List.of()).collect(f));
    }
}

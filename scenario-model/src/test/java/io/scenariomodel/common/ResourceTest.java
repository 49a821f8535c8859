package io.scenariomodel.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResourceTest {

    @Test
    void testMemoryResource() {
        Resource resource = Resource.text("line one\r\nline two\n");
        assertFalse(resource.isFile());
        assertFalse(resource.isClassPath());
        assertNull(resource.getPath());
        assertEquals("(inline)", resource.getPathForLog());
        assertEquals("line two", resource.getLine(1));
        assertEquals("", resource.getLine(5));
        Resource named = Resource.text("Feature:", "features/inline.feature");
        assertEquals("inline", named.getFileNameWithoutExtension());
        assertEquals("features/inline.feature", named.getPathForLog());
    }

    @Test
    void testClassPathResource() {
        Resource resource = Resource.path("classpath:features/login.feature");
        assertTrue(resource.isClassPath());
        assertEquals("features/login.feature", resource.getRelativePath());
        assertEquals("classpath:features/login.feature", resource.getPrefixedPath());
        assertEquals("Feature: User Login", resource.getLine(0));
        assertTrue(resource.getText().contains("Scenario Outline:"));
    }

    @Test
    void testMissingResource() {
        assertThrows(ResourceNotFoundException.class, () -> Resource.path("classpath:features/missing.feature"));
        assertThrows(ResourceNotFoundException.class, () -> Resource.path("does/not/exist.feature"));
    }

    @Test
    void testPathResource(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("cart/view.feature");
        FileUtils.writeToFile(file, "Feature: view\n");
        Resource resource = Resource.from(file, dir);
        assertTrue(resource.isFile());
        assertEquals("cart/view.feature", resource.getRelativePath());
        assertEquals("view", resource.getFileNameWithoutExtension());
        assertEquals("Feature: view\n", resource.getText());
        assertEquals(file.toUri(), resource.getUri());
        Resource prefixed = Resource.path("file:" + file);
        assertEquals("Feature: view\n", FileUtils.toString(Files.readAllBytes(prefixed.getPath())));
    }

    @Test
    void testFindFeatureFiles(@TempDir Path dir) {
        FileUtils.writeToFile(dir.resolve("b.feature"), "Feature: b\n");
        FileUtils.writeToFile(dir.resolve("sub/a.feature"), "Feature: a\n");
        FileUtils.writeToFile(dir.resolve("sub/notes.txt"), "ignored");
        List<Path> found = FileUtils.findFeatureFiles(dir);
        assertEquals(List.of(dir.resolve("b.feature"), dir.resolve("sub/a.feature")), found);
        assertEquals(List.of(dir.resolve("b.feature")), FileUtils.findFeatureFiles(dir.resolve("b.feature")));
        assertThrows(ResourceNotFoundException.class, () -> FileUtils.findFeatureFiles(dir.resolve("nope")));
    }

}

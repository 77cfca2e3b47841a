package co.fanki.servicecatalog.registry.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link FileConfigurationStore}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FileConfigurationStoreTest {

    @TempDir
    Path directory;

    private FileConfigurationStore store;

    @BeforeEach
    void setUp() {
        store = new FileConfigurationStore(directory.resolve("config"));
    }

    @Test
    void whenCreating_givenMissingDirectory_shouldCreateIt() {
        assertTrue(Files.isDirectory(directory.resolve("config")));
    }

    @Test
    void whenSaving_givenJsonText_shouldWriteJsonFile() {
        store.save("orders", "{\"name\": \"orders\"}");

        assertTrue(Files.exists(store.baseDirectory().resolve("orders.json")));
        assertEquals("{\"name\": \"orders\"}", store.load("orders"));
    }

    @Test
    void whenSaving_givenYamlText_shouldWriteYamlFile() {
        store.save("orders", "name: orders\n");

        assertTrue(Files.exists(store.baseDirectory().resolve("orders.yaml")));
        assertEquals("name: orders\n", store.load("orders"));
    }

    @Test
    void whenSaving_givenFormatChange_shouldKeepSingleFile() {
        store.save("orders", "name: orders\n");
        store.save("orders", "{\"name\": \"orders\"}");

        assertFalse(Files.exists(store.baseDirectory().resolve("orders.yaml")));
        assertEquals(List.of("orders"), store.list());
    }

    @Test
    void whenListing_givenMixedFiles_shouldReturnSortedServiceNames()
            throws Exception {
        store.save("zeta", "{}");
        store.save("alpha", "a: 1\n");
        Files.writeString(store.baseDirectory().resolve("legacy.yml"), "a: 2\n");
        Files.writeString(store.baseDirectory().resolve("README.md"), "docs");

        assertEquals(List.of("alpha", "legacy", "zeta"), store.list());
        assertEquals("a: 2\n", store.load("legacy"));
    }

    @Test
    void whenDeleting_givenStoredService_shouldRemoveFile() {
        store.save("orders", "{}");

        store.delete("orders");

        assertTrue(store.list().isEmpty());
    }

    @Test
    void whenDeleting_givenUnknownService_shouldDoNothing() {
        store.delete("ghost");

        assertTrue(store.list().isEmpty());
    }

    @Test
    void whenLoading_givenUnknownService_shouldThrowStoreException() {
        assertThrows(ConfigurationStoreException.class,
                () -> store.load("ghost"));
    }

    @Test
    void whenSaving_givenPathLikeName_shouldRejectIt() {
        assertThrows(ConfigurationStoreException.class,
                () -> store.save("../escape", "{}"));
        assertThrows(ConfigurationStoreException.class,
                () -> store.save("orders/v2", "{}"));
    }

    @Test
    void whenLoading_givenFileWithUnsupportedName_shouldThrowStoreException()
            throws Exception {
        Files.writeString(store.baseDirectory().resolve("my notes.yaml"),
                "version: 1.0.0");

        assertTrue(store.list().contains("my notes"));
        assertThrows(ConfigurationStoreException.class,
                () -> store.load("my notes"));
    }

}

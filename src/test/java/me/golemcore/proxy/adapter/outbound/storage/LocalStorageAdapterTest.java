package me.golemcore.proxy.adapter.outbound.storage;

import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStorageAdapterTest {

    private static final String SCHEDULES = "schedules";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        ProxyProperties properties = new ProxyProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateStorageDirectoriesOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve("schedules")));
        assertTrue(Files.isDirectory(tempDir.resolve("leases")));
    }

    @Test
    void shouldWriteAtomicallyAndReadBack() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SCHEDULES, "a.json", "{\"v\":1}").get();
        storageAdapter.putTextAtomic(SCHEDULES, "a.json", "{\"v\":2}").get();

        assertEquals("{\"v\":2}", storageAdapter.getText(SCHEDULES, "a.json").get());
        assertFalse(Files.exists(tempDir.resolve(SCHEDULES).resolve("a.json.tmp")));
    }

    @Test
    void shouldReturnNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(SCHEDULES, "missing.json").get());
    }

    @Test
    void shouldListFilesBySuffixInNameOrder() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SCHEDULES, "b.json", "{}").get();
        storageAdapter.putTextAtomic(SCHEDULES, "a.json", "{}").get();
        storageAdapter.putTextAtomic(SCHEDULES, "notes.txt", "x").get();

        List<String> files = storageAdapter.listObjects(SCHEDULES, ".json").get();

        assertEquals(List.of("a.json", "b.json"), files);
    }

    @Test
    void shouldListNothingForMissingDirectory() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("unknown", ".json").get().isEmpty());
    }

    @Test
    void shouldDeleteFile() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SCHEDULES, "gone.json", "{}").get();

        assertTrue(storageAdapter.deleteObject(SCHEDULES, "gone.json").get());
        assertFalse(storageAdapter.deleteObject(SCHEDULES, "gone.json").get());
    }

    @Test
    void shouldEnsureDirectory() throws ExecutionException, InterruptedException {
        storageAdapter.ensureDirectory("extra").get();

        assertTrue(Files.isDirectory(tempDir.resolve("extra")));
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> storageAdapter.getText(SCHEDULES, "../../etc/passwd").join());

        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }
}

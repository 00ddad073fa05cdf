package me.golemcore.workbridge.adapter.outbound.storage;

import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "test-dir";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        WorkbridgeProperties properties = new WorkbridgeProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateStandardDirectoriesOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve("notifications")));
        assertTrue(Files.isDirectory(tempDir.resolve("audit")));
    }

    @Test
    void shouldReturnNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.txt").get());
    }

    @Test
    void shouldAppendText() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(TEST_DIR, "append.jsonl", "{\"a\":1}\n").get();
        storageAdapter.appendText(TEST_DIR, "append.jsonl", "{\"a\":2}\n").get();

        assertEquals("{\"a\":1}\n{\"a\":2}\n", storageAdapter.getText(TEST_DIR, "append.jsonl").get());
    }

    @Test
    void shouldReplaceFileAtomically() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "first", false).get();
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "second", false).get();

        assertEquals("second", storageAdapter.getText(TEST_DIR, "state.json").get());
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("state.json.tmp")));
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("state.json.bak")));
    }

    @Test
    void shouldKeepBackupWhenRequested() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "first", true).get();
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "second", true).get();

        assertEquals("first", Files.readString(tempDir.resolve(TEST_DIR).resolve("state.json.bak")));
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> storageAdapter.getText(TEST_DIR, "../../etc/passwd").join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}

package me.golemcore.crew.adapter.outbound.storage;

import me.golemcore.crew.infrastructure.config.CrewProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    @TempDir
    Path tempDir;

    private LocalStorageAdapter adapter;

    @BeforeEach
    void setUp() {
        CrewProperties properties = new CrewProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        adapter = new LocalStorageAdapter(properties);
        adapter.init();
    }

    @Test
    void initCreatesKnownDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("conversations")));
        assertTrue(Files.isDirectory(tempDir.resolve("lessons")));
    }

    @Test
    void putTextAtomicWritesAndReplaces() throws IOException {
        adapter.putTextAtomic("conversations", "dev/conv-1.json", "{\"v\":1}").join();
        adapter.putTextAtomic("conversations", "dev/conv-1.json", "{\"v\":2}").join();

        assertEquals("{\"v\":2}", adapter.getText("conversations", "dev/conv-1.json").join());
        try (Stream<Path> files = Files.list(tempDir.resolve("conversations/dev"))) {
            assertEquals(List.of("conv-1.json"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void concurrentAtomicWritesLeaveOneCompleteSnapshot() {
        List<CompletableFuture<Void>> writes = IntStream.range(0, 20)
                .mapToObj(i -> adapter.putTextAtomic("conversations", "dev/conv-1.json", "{\"v\":" + i + "}"))
                .toList();
        CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).join();

        String content = adapter.getText("conversations", "dev/conv-1.json").join();
        assertTrue(content.matches("\\{\"v\":\\d+}"));
    }

    @Test
    void getTextReturnsNullForMissingFile() {
        assertNull(adapter.getText("conversations", "missing.json").join());
        assertFalse(adapter.exists("conversations", "missing.json").join());
    }

    @Test
    void appendTextAccumulatesLines() {
        adapter.appendText("lessons", "dev.jsonl", "a\n").join();
        adapter.appendText("lessons", "dev.jsonl", "b\n").join();

        assertEquals("a\nb\n", adapter.getText("lessons", "dev.jsonl").join());
        assertTrue(adapter.exists("lessons", "dev.jsonl").join());
    }

    @Test
    void listObjectsReturnsSortedRelativePaths() {
        adapter.putTextAtomic("conversations", "qa/c2.json", "{}").join();
        adapter.putTextAtomic("conversations", "dev/c1.json", "{}").join();

        List<String> all = adapter.listObjects("conversations", "").join();
        List<String> dev = adapter.listObjects("conversations", "dev").join();

        assertEquals(List.of(Path.of("dev", "c1.json").toString(), Path.of("qa", "c2.json").toString()), all);
        assertEquals(List.of(Path.of("dev", "c1.json").toString()), dev);
        assertTrue(adapter.listObjects("conversations", "nobody").join().isEmpty());
    }

    @Test
    void pathTraversalIsRejected() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.getText("conversations", "../../outside.txt").join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}

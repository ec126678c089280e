package com.kingpin.pins;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PinRepositoryTest {
    @TempDir
    Path tempDir;

    @Test
    void testStartsEmpty() {
        PinRepository repository = new PinRepository(new LoadService());
        assertEquals(0, repository.snapshot().version());
        assertTrue(repository.query().getAllPins().isEmpty());
    }

    @Test
    void testReloadPublishesNewVersionWithoutDisturbingEarlierQueries() throws IOException {
        Path file = Files.writeString(tempDir.resolve("Places.json"), "[{\"name\": \"First\"}]");
        PinRepository repository = new PinRepository(new LoadService());

        PinCollection first = repository.reload(List.of(file));
        assertEquals(1, first.version());
        QueryService before = repository.query();

        Files.writeString(file, "[{\"name\": \"First\"}, {\"name\": \"Second\"}]");
        PinCollection second = repository.reload(List.of(file));
        assertEquals(2, second.version());
        assertSame(second, repository.snapshot());

        assertEquals(1, before.getAllPins().size());
        assertEquals(2, repository.query().getAllPins().size());
        assertEquals(1, first.pins().size());
    }

    @Test
    void testFailedReloadStillPublishesEmptySnapshot() throws IOException {
        Path file = Files.writeString(tempDir.resolve("bad.json"), "not json");
        PinRepository repository = new PinRepository(new LoadService());

        PinCollection loaded = repository.reload(List.of(file));
        assertTrue(loaded.isEmpty());
        assertEquals(List.of(new PinList("bad")), loaded.lists());
        assertEquals(1, loaded.warnings().size());
    }
}

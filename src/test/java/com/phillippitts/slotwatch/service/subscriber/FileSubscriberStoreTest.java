package com.phillippitts.slotwatch.service.subscriber;

import com.phillippitts.slotwatch.exception.SlotWatchException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSubscriberStoreTest {

    @TempDir
    Path dir;

    @Test
    void createsEmptyFileWithParentDirectories() throws IOException {
        Path file = dir.resolve("nested/data/subscribers.json");

        FileSubscriberStore store = new FileSubscriberStore(file);

        assertThat(file).exists();
        assertThat(Files.readString(file)).isEqualTo("[]");
        assertThat(store.count()).isZero();
        assertThat(store.file()).isEqualTo(file);
    }

    @Test
    void addAndRemoveReportWhetherAnythingChanged() {
        FileSubscriberStore store = new FileSubscriberStore(dir.resolve("subscribers.json"));

        assertThat(store.add(1002L)).isTrue();
        assertThat(store.add(1001L)).isTrue();
        assertThat(store.add(1002L)).isFalse();
        assertThat(store.exists(1001L)).isTrue();

        assertThat(store.remove(1001L)).isTrue();
        assertThat(store.remove(1001L)).isFalse();
        assertThat(store.all()).containsExactly(1002L);
    }

    @Test
    void writesSortedJsonArrayWithoutLeftoverTempFile() throws IOException {
        Path file = dir.resolve("subscribers.json");
        FileSubscriberStore store = new FileSubscriberStore(file);

        store.add(30L);
        store.add(10L);
        store.add(20L);

        assertThat(Files.readString(file)).isEqualTo("[10,20,30]");
        assertThat(dir.resolve("subscribers.json.tmp")).doesNotExist();
    }

    @Test
    void picksUpExternalEditsAndSurvivesRestart() throws IOException {
        Path file = dir.resolve("subscribers.json");
        Files.writeString(file, "[5, 6]", StandardCharsets.UTF_8);

        FileSubscriberStore store = new FileSubscriberStore(file);
        assertThat(store.all()).containsExactly(5L, 6L);

        Files.writeString(file, "[7]", StandardCharsets.UTF_8);
        assertThat(store.all()).containsExactly(7L);

        store.add(8L);
        assertThat(new FileSubscriberStore(file).all()).containsExactly(7L, 8L);
    }

    @Test
    void unparsableFileFailsReadsAndIsNeverOverwritten() throws IOException {
        Path file = dir.resolve("subscribers.json");
        String original = "[1001, \"oops\", 1002]";
        Files.writeString(file, original, StandardCharsets.UTF_8);

        FileSubscriberStore store = new FileSubscriberStore(file);

        assertThatThrownBy(store::all).isInstanceOf(SlotWatchException.class);
        assertThatThrownBy(() -> store.add(5L)).isInstanceOf(SlotWatchException.class);
        assertThatThrownBy(() -> store.remove(1001L)).isInstanceOf(SlotWatchException.class);
        assertThat(Files.readString(file)).isEqualTo(original);
    }

    @Test
    void repairedFileIsUsableAgain() throws IOException {
        Path file = dir.resolve("subscribers.json");
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);
        FileSubscriberStore store = new FileSubscriberStore(file);
        assertThatThrownBy(store::count).isInstanceOf(SlotWatchException.class);

        Files.writeString(file, "[1001, 1002]", StandardCharsets.UTF_8);

        assertThat(store.add(5L)).isTrue();
        assertThat(Files.readString(file)).isEqualTo("[5,1001,1002]");
    }

    @Test
    void concurrentAddsAreNotLost() throws Exception {
        FileSubscriberStore store = new FileSubscriberStore(dir.resolve("subscribers.json"));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (long id = 1; id <= 40; id++) {
                long recipient = id;
                results.add(pool.submit(() -> store.add(recipient)));
            }
            for (Future<Boolean> result : results) {
                assertThat(result.get()).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.count()).isEqualTo(40);
    }
}

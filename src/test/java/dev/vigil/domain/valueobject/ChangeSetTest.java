package dev.vigil.domain.valueobject;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChangeSetTest {

    private static final Path A = Path.of("a");
    private static final Path B = Path.of("b");

    private static FileSnapshot snapshot(Map<Path, Long> mtimes) {
        Map<Path, FileTime> entries = new HashMap<>();
        mtimes.forEach((path, millis) -> entries.put(path, FileTime.fromMillis(millis)));
        return new FileSnapshot(entries);
    }

    @Test
    @DisplayName("new file is reported as added")
    void added() {
        ChangeSet changes = ChangeSet.between(snapshot(Map.of(A, 1L)), snapshot(Map.of(A, 1L, B, 2L)));

        assertThat(changes.changed()).isTrue();
        assertThat(changes.added()).containsExactly(B);
        assertThat(changes.modified()).isEmpty();
        assertThat(changes.deleted()).isEmpty();
    }

    @Test
    @DisplayName("changed mtime is reported as modified")
    void modified() {
        ChangeSet changes = ChangeSet.between(snapshot(Map.of(A, 1L)), snapshot(Map.of(A, 2L)));

        assertThat(changes.changed()).isTrue();
        assertThat(changes.modified()).containsExactly(A);
        assertThat(changes.added()).isEmpty();
        assertThat(changes.deleted()).isEmpty();
    }

    @Test
    @DisplayName("missing file is reported as deleted")
    void deleted() {
        ChangeSet changes = ChangeSet.between(snapshot(Map.of(A, 1L, B, 2L)), snapshot(Map.of(B, 2L)));

        assertThat(changes.deleted()).containsExactly(A);
        assertThat(changes.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("identical snapshots are unchanged")
    void unchanged() {
        ChangeSet changes = ChangeSet.between(snapshot(Map.of(A, 1L)), snapshot(Map.of(A, 1L)));

        assertThat(changes.changed()).isFalse();
        assertThat(changes).isEqualTo(ChangeSet.none());
    }
}

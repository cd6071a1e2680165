package dev.vigil.domain.valueobject;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Difference between two {@link FileSnapshot}s. Path sets are sorted for stable logging.
 */
public record ChangeSet(boolean changed, Set<Path> added, Set<Path> modified, Set<Path> deleted) {

    public ChangeSet {
        added = Collections.unmodifiableSet(new TreeSet<>(added));
        modified = Collections.unmodifiableSet(new TreeSet<>(modified));
        deleted = Collections.unmodifiableSet(new TreeSet<>(deleted));
    }

    public static ChangeSet none() {
        return new ChangeSet(false, Set.of(), Set.of(), Set.of());
    }

    public static ChangeSet between(FileSnapshot previous, FileSnapshot current) {
        Map<Path, FileTime> before = previous.entries();
        Map<Path, FileTime> after = current.entries();

        Set<Path> added = new TreeSet<>(after.keySet());
        added.removeAll(before.keySet());

        Set<Path> deleted = new TreeSet<>(before.keySet());
        deleted.removeAll(after.keySet());

        Set<Path> modified = new TreeSet<>();
        for (Map.Entry<Path, FileTime> entry : after.entrySet()) {
            FileTime old = before.get(entry.getKey());
            if (old != null && !old.equals(entry.getValue())) modified.add(entry.getKey());
        }

        boolean changed = !added.isEmpty() || !modified.isEmpty() || !deleted.isEmpty();
        return new ChangeSet(changed, added, modified, deleted);
    }

    public int size() {
        return added.size() + modified.size() + deleted.size();
    }
}

package dev.vigil.domain.valueobject;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Map;

/**
 * Modification times of the watched files, keyed by path relative to the watched root.
 */
public record FileSnapshot(Map<Path, FileTime> entries) {

    public FileSnapshot {
        entries = entries == null ? Map.of() : Map.copyOf(entries);
    }

    public static FileSnapshot empty() {
        return new FileSnapshot(Map.of());
    }

    public int size() {
        return entries.size();
    }
}

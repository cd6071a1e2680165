package dev.vigil.infrastructure.fs;

import dev.vigil.config.ReviewProperties;
import dev.vigil.domain.valueobject.ChangeSet;
import dev.vigil.domain.valueobject.FileSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Polling change detector over a directory tree.
 *
 * <p>TRADEOFF: polling vs. {@code WatchService}. A full mtime walk costs more per tick, but it
 * behaves the same on every file system (including network mounts and editors that
 * replace files by rename), and a missed event can never leave the state wrong for longer
 * than one poll.
 *
 * <p>Files under any {@code .git} directory are excluded, so git's own bookkeeping never
 * counts as a change.
 */
@Component
public class ChangeDetector {
    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);
    private static final String VCS_DIR = ".git";

    private final Path root;
    private FileSnapshot snapshot;

    @Autowired
    public ChangeDetector(ReviewProperties properties) {
        this(properties.root());
    }

    public ChangeDetector(Path root) {
        this.root = root.toAbsolutePath().normalize();
        this.snapshot = scan();
        log.info("Watching {} ({} files)", this.root, snapshot.size());
    }

    /** Rescans the tree, replaces the stored snapshot and reports what differs from the previous one. */
    public synchronized ChangeSet checkForChanges() {
        FileSnapshot current = scan();
        ChangeSet changes = ChangeSet.between(snapshot, current);
        snapshot = current;
        if (changes.changed()) {
            log.debug("Detected changes: {} added, {} modified, {} deleted",
                    changes.added().size(), changes.modified().size(), changes.deleted().size());
        }
        return changes;
    }

    public synchronized FileSnapshot snapshot() {
        return snapshot;
    }

    public Path root() {
        return root;
    }

    FileSnapshot scan() {
        if (!Files.isDirectory(root)) {
            log.warn("Watched root {} is not a directory", root);
            return FileSnapshot.empty();
        }
        SnapshotVisitor visitor = new SnapshotVisitor(root);
        try {
            Files.walkFileTree(root, visitor);
        } catch (IOException e) {
            log.warn("Scan of {} incomplete: {}", root, e.getMessage());
        }
        return new FileSnapshot(visitor.entries());
    }

    /**
     * Collects regular files outside {@code .git}. Unreadable files and directories are
     * skipped so one bad entry never truncates the snapshot.
     */
    static class SnapshotVisitor extends SimpleFileVisitor<Path> {
        private final Path root;
        private final Map<Path, FileTime> entries = new HashMap<>();

        SnapshotVisitor(Path root) {
            this.root = root;
        }

        Map<Path, FileTime> entries() {
            return entries;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            return isVcsPath(dir) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && !isVcsPath(file)) {
                entries.put(root.relativize(file), attrs.lastModifiedTime());
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException e) {
            log.trace("Skipping unreadable {}: {}", file, e.getMessage());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException e) {
            if (e != null) {
                log.debug("Listing of {} incomplete: {}", dir, e.getMessage());
            }
            return FileVisitResult.CONTINUE;
        }

        private boolean isVcsPath(Path path) {
            for (Path segment : root.relativize(path)) {
                if (VCS_DIR.equals(segment.toString())) return true;
            }
            return false;
        }
    }
}

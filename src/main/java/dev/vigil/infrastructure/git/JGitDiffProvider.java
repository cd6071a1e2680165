package dev.vigil.infrastructure.git;

import dev.vigil.config.ReviewProperties;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.errors.RepositoryNotFoundException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * {@link DiffProvider} over the git repository that contains the watched root.
 * The repository is located from the root upwards and reopened per call, so switching
 * branches or re-initialising the repository needs no restart.
 */
@Component
public class JGitDiffProvider implements DiffProvider {
    private static final Logger log = LoggerFactory.getLogger(JGitDiffProvider.class);

    private final Path root;

    @Autowired
    public JGitDiffProvider(ReviewProperties properties) {
        this(properties.root());
    }

    public JGitDiffProvider(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public String unstagedDiff() {
        return diff(false, NO_UNSTAGED_CHANGES);
    }

    @Override
    public String stagedDiff() {
        return diff(true, NOTHING_STAGED);
    }

    private String diff(boolean cached, String emptySentinel) {
        try (Repository repository = openRepository(); Git git = new Git(repository)) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            var command = git.diff().setOutputStream(out).setCached(cached);
            if (cached) command.setOldTree(headTree(repository));
            command.call();
            String text = out.toString(StandardCharsets.UTF_8).strip();
            return text.isEmpty() ? emptySentinel : text;
        } catch (Exception e) {
            log.debug("git diff (cached={}) failed in {}: {}", cached, root, e.getMessage());
            return ERROR_PREFIX + e.getMessage();
        }
    }

    private Repository openRepository() throws IOException {
        FileRepositoryBuilder builder = new FileRepositoryBuilder().findGitDir(root.toFile());
        if (builder.getGitDir() == null) {
            throw new RepositoryNotFoundException(root.toFile());
        }
        return builder.build();
    }

    private static AbstractTreeIterator headTree(Repository repository) throws IOException {
        ObjectId head = repository.resolve("HEAD^{tree}");
        if (head == null) return new EmptyTreeIterator();
        CanonicalTreeParser parser = new CanonicalTreeParser();
        try (ObjectReader reader = repository.newObjectReader()) {
            parser.reset(reader, head);
        }
        return parser;
    }
}

package com.changeguard.core.indexer;

import com.changeguard.core.exception.FileAccessException;
import com.changeguard.core.model.SourceFileIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Walks a source tree and builds a {@link SourceFileIndex} snapshot for every included file.
 * <p>
 * Each {@link #indexCodebase} run replaces the previous snapshot wholesale; lookups and
 * searches always see one complete snapshot. A file that cannot be read is logged and skipped,
 * it never aborts the run.
 */
@Service
public class CodebaseIndexer {

    private static final Logger log = LoggerFactory.getLogger(CodebaseIndexer.class);

    private final IndexerProperties properties;
    private final SourceExtractor extractor;

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);

    public CodebaseIndexer(IndexerProperties properties, SourceExtractor extractor) {
        this.properties = properties;
        this.extractor = extractor;
    }

    /**
     * Indexes the tree under {@code rootPath} and stores the result as the current snapshot.
     *
     * @param rootPath directory to index
     * @return unmodifiable map of root-relative path to index entry, sorted by path
     */
    public Map<String, SourceFileIndex> indexCodebase(Path rootPath) {
        Path root = rootPath.toAbsolutePath().normalize();
        Map<String, SourceFileIndex> entries = buildIndex(root);
        snapshot.set(new Snapshot(root, entries));
        log.info("Indexed {} files under {}", entries.size(), root);
        return entries;
    }

    /**
     * Builds an index of the tree without replacing the stored snapshot.
     */
    public Map<String, SourceFileIndex> buildIndex(Path rootPath) {
        Path root = rootPath.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new FileAccessException(root, "Index root is not a directory", null);
        }
        var entries = new TreeMap<String, SourceFileIndex>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    return !dir.equals(root) && isExcludedDir(root, dir)
                            ? FileVisitResult.SKIP_SUBTREE
                            : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isIncluded(file, attrs.size())) {
                        indexFile(root, file).ifPresent(entry -> entries.put(entry.path(), entry));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Skipping unreadable path {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new FileAccessException(root, "Failed to walk source tree", e);
        }
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Indexes a single file. Returns empty (after logging a warning) when the file cannot be read
     * as UTF-8 text.
     *
     * @param root the root the entry's relative path is computed against
     * @param file the file to index
     */
    public Optional<SourceFileIndex> indexFile(Path root, Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        try {
            byte[] bytes = Files.readAllBytes(absolute);
            String content = StandardCharsets.UTF_8.newDecoder()
                    .decode(java.nio.ByteBuffer.wrap(bytes))
                    .toString();
            List<String> lines = content.lines().toList();
            String language = SourceLanguages.detect(absolute.getFileName().toString());
            String relative = relativeKey(root.toAbsolutePath().normalize(), absolute);
            return Optional.of(new SourceFileIndex(
                    relative,
                    absolute.toString(),
                    language,
                    extractor.imports(language, lines),
                    extractor.functions(language, lines),
                    lines.size(),
                    bytes.length,
                    sha256(bytes),
                    Files.getLastModifiedTime(absolute).toInstant()
            ));
        } catch (MalformedInputException e) {
            log.warn("Skipping non-UTF-8 file {}", absolute);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Skipping unreadable file {}: {}", absolute, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Skipping file {} after extraction error: {}", absolute, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Looks up an entry in the last snapshot by root-relative or absolute path.
     */
    public Optional<SourceFileIndex> getFileIndex(String path) {
        Snapshot current = snapshot.get();
        SourceFileIndex direct = current.entries().get(path.replace('\\', '/'));
        if (direct != null || current.root() == null) {
            return Optional.ofNullable(direct);
        }
        Path candidate = Path.of(path).toAbsolutePath().normalize();
        if (!candidate.startsWith(current.root())) {
            return Optional.empty();
        }
        return Optional.ofNullable(current.entries().get(relativeKey(current.root(), candidate)));
    }

    /**
     * Lazily streams entries of the last snapshot whose relative path matches {@code regex}
     * (using {@link java.util.regex.Matcher#find()}).
     *
     * @throws java.util.regex.PatternSyntaxException if the expression is invalid
     */
    public Stream<SourceFileIndex> searchFiles(String regex) {
        Pattern pattern = Pattern.compile(regex);
        return snapshot.get().entries().values().stream()
                .filter(entry -> pattern.matcher(entry.path()).find());
    }

    /** Entries of the last snapshot, empty before the first run. */
    public Map<String, SourceFileIndex> currentSnapshot() {
        return snapshot.get().entries();
    }

    boolean isExcludedDir(Path root, Path dir) {
        String name = dir.getFileName().toString();
        String relative = relativeKey(root, dir);
        for (String excluded : properties.getExcludedDirs()) {
            if (excluded.equals(name) || excluded.equals(relative)) {
                return true;
            }
        }
        return false;
    }

    boolean isIncluded(Path file, long size) {
        String name = file.getFileName().toString();
        if (properties.getExcludedFiles().contains(name)) {
            return false;
        }
        if (size > properties.getMaxFileSizeBytes()) {
            log.debug("Skipping large file {} ({} bytes)", file, size);
            return false;
        }
        return properties.getIncludedExtensions().contains(SourceLanguages.extension(name));
    }

    private static String relativeKey(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record Snapshot(Path root, Map<String, SourceFileIndex> entries) {
        static final Snapshot EMPTY = new Snapshot(null, Map.of());
    }
}

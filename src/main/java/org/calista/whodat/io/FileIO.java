package org.calista.whodat.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileIO — single entry point for file access in the project.
 *
 * <p>
 * Sandboxed under a base directory (relative paths only, no ".." escapes),
 * atomic replace-on-commit writes for catalog/config/session blobs,
 * JSONL helpers for the event journal.
 * </p>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Path baseDir;
    private final Charset charset;

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8);
    }

    public FileIO(Path baseDir, Charset charset) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        log.debug("FileIO init: baseDir={}, charset={}", this.baseDir, this.charset);
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists: " + this.baseDir, e);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    private void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Resolves a relative path inside baseDir. Absolute paths and ".." escapes are rejected.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        String sanitized = relative.replace('\\', '/');
        Path rel = Paths.get(sanitized);
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    private void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    // ----------------------------
    // Existence / Stat
    // ----------------------------

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    public FileTime lastModified(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.getLastModifiedTime(file);
    }

    public void setLastModified(Path file, long epochMs) throws IOException {
        Objects.requireNonNull(file, "file");
        Files.setLastModifiedTime(file, FileTime.fromMillis(epochMs));
    }

    public boolean deleteIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        boolean deleted = Files.deleteIfExists(file);
        log.debug("deleteIfExists: {} -> {}", file, deleted);
        return deleted;
    }

    public List<Path> glob(Path dir, String pattern) throws IOException {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(pattern, "pattern");
        if (!Files.isDirectory(dir)) return List.of();

        PathMatcher matcher = dir.getFileSystem().getPathMatcher("glob:" + pattern);
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(p -> matcher.matches(p.getFileName()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    // ----------------------------
    // Text / bytes
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, charset);
    }

    public byte[] readBytes(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readAllBytes(file);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(content, "content");
        writeBytes(file, content.getBytes(charset));
    }

    /**
     * Writes a ".tmp" sibling, then moves it over the target.
     * Readers never observe a half-written file.
     */
    public void writeBytes(Path file, byte[] bytes) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(bytes, "bytes");
        ensureParentDir(file);

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.write(tmp, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        atomicCommit(tmp, file);
    }

    // ----------------------------
    // JSONL helpers
    // ----------------------------

    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(jsonLine, "jsonLine");
        String s = jsonLine.trim();
        if (s.isEmpty()) return;
        ensureParentDir(file);
        Files.writeString(file, s + System.lineSeparator(), charset,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    /** Small JSONL files only (trim + skip empty lines). */
    public List<String> readJsonl(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (Stream<String> s = Files.lines(file, charset)) {
            return s.map(String::trim)
                    .filter(x -> !x.isEmpty())
                    .collect(Collectors.toList());
        }
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private void atomicCommit(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("atomicCommit: failed to delete tmp {}: {}", tmp, e.toString());
            }
        }
    }
}

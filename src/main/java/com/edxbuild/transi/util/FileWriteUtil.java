package com.edxbuild.transi.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility for safe file operations with automatic directory creation.
 *
 * Every write lands in a temporary sibling first and is then moved onto the target name,
 * so a failure part way through never leaves a truncated file under the final name.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes through a callback that receives the temporary path to fill.
     */
    @FunctionalInterface
    public interface PathWriter {
        void writeTo(Path tempFile) throws IOException;
    }

    /**
     * Writes a file atomically, creating parent directories if needed.
     */
    public static void writeAtomically(Path target, PathWriter writer) throws IOException {
        Path dir = parentOf(target);
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, "." + target.getFileName().toString(), ".tmp");
        try {
            writer.writeTo(temp);
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Writes string content atomically as UTF-8.
     */
    public static void safeWriteString(Path target, String content) throws IOException {
        writeAtomically(target, temp -> Files.writeString(temp, content, StandardCharsets.UTF_8));
    }

    /**
     * Replaces {@code target} with a copy of {@code source}.
     */
    public static void copyAtomically(Path source, Path target) throws IOException {
        writeAtomically(target, temp -> Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING));
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Path parentOf(Path target) {
        Path parent = target.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of(".").toAbsolutePath();
    }
}

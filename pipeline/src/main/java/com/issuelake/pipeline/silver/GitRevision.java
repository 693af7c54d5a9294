package com.issuelake.pipeline.silver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Looks up the checked-out commit of the repository containing the lake.
 */
public final class GitRevision {

    private static final Logger logger = LoggerFactory.getLogger(GitRevision.class);

    private GitRevision() {}

    /**
     * @return the {@code HEAD} commit hash, or {@code null} if the directory is not a git checkout
     */
    public static String resolve(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return null;
        }
        ProcessBuilder builder = new ProcessBuilder("git", "rev-parse", "HEAD")
                .directory(directory.toFile())
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        try {
            Process process = builder.start();
            String output;
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            }
            if (!process.waitFor(10, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return null;
            }
            return process.exitValue() == 0 && !output.isEmpty() ? output : null;
        } catch (IOException e) {
            logger.debug("git revision unavailable for {}: {}", directory, e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }
}

package com.handelsregister.scraper.cache;

import com.handelsregister.scraper.config.PortalProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * {@link ResultCache} backed by a directory with one file per keyword string.
 *
 * <p>The file name is the URL-encoded key, so {@code "Gasag AG"} lands in
 * {@code Gasag+AG}. The encoding keeps separators out of the path and is
 * injective, so keys differing only in case still get distinct files.</p>
 *
 * <p>I/O problems never fail a search: an unreadable entry counts as a miss
 * and a failed write is only logged.</p>
 */
@Slf4j
@Getter
@Component
public class FileResultCache implements ResultCache {

    private final Path directory;

    @Autowired
    public FileResultCache(final PortalProperties props) {
        this(props.getCacheDir());
    }

    public FileResultCache(final Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot create cache directory " + directory, ex);
        }
        log.info("Result cache directory: {}", directory);
    }

    @Override
    public Optional<String> get(final String key) {
        Path file = fileFor(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            log.warn("Cache entry {} unreadable, treating as miss: {}", file, ex.toString());
            return Optional.empty();
        }
    }

    @Override
    public void put(final String key, final String document) {
        Path file = fileFor(key);
        try {
            Files.writeString(file, document, StandardCharsets.UTF_8);
            log.debug("Cached {} chars for '{}'", document.length(), key);
        } catch (IOException ex) {
            log.warn("Could not write cache entry {}: {}", file, ex.toString());
        }
    }

    Path fileFor(final String key) {
        String name = URLEncoder.encode(key, StandardCharsets.UTF_8);
        // "." and ".." survive URL encoding but must not name the directory or its parent
        if (name.chars().allMatch(c -> c == '.')) {
            name = name.replace(".", "%2E");
        }
        return directory.resolve(name);
    }
}

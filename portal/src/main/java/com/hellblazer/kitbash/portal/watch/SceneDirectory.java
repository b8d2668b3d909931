/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Kitbash Viewer.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.kitbash.portal.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The watched directory: which names belong to the scene, and how their metadata and content are read.
 * <p>
 * The directory is flat. Only regular files directly inside it whose extension is in the accepted set are part of
 * the scene; hidden files are ignored. Every name handed in from outside is validated so that it cannot resolve
 * outside the directory.
 *
 * @author hal.hildebrand
 */
public class SceneDirectory {
    private static final Logger log = LoggerFactory.getLogger(SceneDirectory.class);

    private final Path        root;
    private final Set<String> extensions;

    /**
     * @param root       the watched directory
     * @param extensions accepted extensions, with or without the leading dot, case insensitive
     */
    public SceneDirectory(Path root, Set<String> extensions) {
        if (extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one file extension is required");
        }
        this.root = root.toAbsolutePath().normalize();
        this.extensions = extensions.stream()
                                    .map(ext -> ext.startsWith(".") ? ext : "." + ext)
                                    .map(ext -> ext.toLowerCase(Locale.ROOT))
                                    .collect(Collectors.toUnmodifiableSet());
    }

    public Path root() {
        return root;
    }

    public Set<String> extensions() {
        return extensions;
    }

    /**
     * @param name a file name relative to the directory
     * @return true if files with this name take part in the scene
     */
    public boolean accepts(String name) {
        if (name == null || name.isEmpty() || name.startsWith(".")) {
            return false;
        }
        var lower = name.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(lower::endsWith);
    }

    /**
     * Resolve a scene file name to its path.
     *
     * @throws IllegalArgumentException if the name is not a plain accepted file name inside the directory
     */
    public Path resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("File name is required");
        }
        var resolved = root.resolve(name).normalize();
        if (!resolved.startsWith(root) || !root.equals(resolved.getParent())) {
            throw new IllegalArgumentException("Invalid scene file name: " + name);
        }
        if (!accepts(name)) {
            throw new IllegalArgumentException("Not a scene file: " + name);
        }
        return resolved;
    }

    /**
     * Read current metadata of a scene file.
     *
     * @return metadata, or empty if the file does not exist or is not a regular file
     * @throws IOException for any other failure to read the attributes
     */
    public Optional<FileMetadata> stat(String name) throws IOException {
        var path = resolve(name);
        try {
            var attributes = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            if (!attributes.isRegularFile()) {
                return Optional.empty();
            }
            return Optional.of(new FileMetadata(name, attributes.lastModifiedTime().toMillis(), attributes.size()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    /**
     * List every scene file currently present.
     *
     * @throws IOException if the directory itself cannot be listed
     */
    public List<FileMetadata> scan() throws IOException {
        var found = new ArrayList<FileMetadata>();
        try (var stream = Files.list(root)) {
            for (var path : (Iterable<Path>) stream::iterator) {
                var name = path.getFileName().toString();
                if (!accepts(name)) {
                    continue;
                }
                try {
                    stat(name).ifPresent(found::add);
                } catch (IOException e) {
                    // transient: the next watch event for this name retries
                    log.warn("Unable to stat {} during scan: {}", path, e.getMessage());
                }
            }
        }
        log.debug("Scanned {}: {} scene files", root, found.size());
        return found;
    }

    /**
     * Read the full content of a scene file.
     *
     * @throws NoSuchFileException if the file is gone
     */
    public byte[] read(String name) throws IOException {
        return Files.readAllBytes(resolve(name));
    }

    /**
     * Compute a SHA-256 digest of a scene file's content.
     *
     * @return lowercase hex digest
     */
    public String digest(String name) throws IOException {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(read(name)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

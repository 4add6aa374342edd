package com.amphitheatre.composer.resolver;

import java.util.Set;

/**
 * Read-only listing of a repository at one commit.
 *
 * @param commit   full commit sha the listing was taken at
 * @param paths    every file and directory path in the tree, relative to the root
 * @param manifest raw {@code .amp.toml} text at the requested path, or null if there is none
 */
public record SourceTree(String commit, Set<String> paths, String manifest) {

    /** True if {@code path} names the root, a file or a directory in this tree. */
    public boolean contains(String path) {
        if (path.isEmpty()) {
            return true;
        }
        return paths.contains(path) || paths.stream().anyMatch(p -> p.startsWith(path + "/"));
    }
}

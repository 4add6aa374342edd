package com.amphitheatre.composer.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Where an Actor's source lives: repository, path within it and a reference.
 *
 * {@code commit} is optional; when set it pins the reference to an exact
 * revision and the resolver does not look the branch/tag up.
 */
@Embeddable
public class SourceLocator {

    // Owner and repository names as GitHub allows them; nothing a shell would expand.
    private static final Pattern GITHUB_REPOSITORY =
            Pattern.compile("https://github\\.com/([A-Za-z0-9][A-Za-z0-9-]*)/([A-Za-z0-9._-]+?)(?:\\.git)?/?");
    private static final Pattern COMMIT = Pattern.compile("[0-9a-f]{7,40}");

    @Column(name = "repository", nullable = false)
    private String repository;

    // Empty string means the repository root.
    @Column(name = "source_path", nullable = false)
    private String path = "";

    @Column(name = "reference", nullable = false)
    private String reference = "main";

    @Column(name = "pinned_commit")
    private String commit;

    protected SourceLocator() {}   // required by JPA

    public SourceLocator(String repository, String path, String reference, String commit) {
        this.repository = repository;
        this.path       = path == null ? "" : path;
        this.reference  = reference == null || reference.isBlank() ? "main" : reference;
        this.commit     = commit;
    }

    public static SourceLocator of(String repository, String path, String reference) {
        return new SourceLocator(repository, path, reference, null);
    }

    /** True for {@code https://github.com/<owner>/<repo>} with an optional {@code .git}. */
    public static boolean isValidRepository(String repository) {
        return repository != null && GITHUB_REPOSITORY.matcher(repository).matches();
    }

    /** True for an abbreviated or full lowercase hex commit sha. */
    public static boolean isValidCommit(String commit) {
        return commit != null && COMMIT.matcher(commit).matches();
    }

    /**
     * {@code owner/repo} of a valid repository URL.
     *
     * @throws IllegalArgumentException if the URL is not a GitHub repository URL
     */
    public static String ownerAndName(String repository) {
        Matcher m = repository == null ? null : GITHUB_REPOSITORY.matcher(repository);
        if (m == null || !m.matches()) {
            throw new IllegalArgumentException("not a GitHub repository URL: " + repository);
        }
        return m.group(1) + "/" + m.group(2);
    }

    public String getRepository() { return repository; }
    public String getPath()       { return path; }
    public String getReference()  { return reference; }
    public String getCommit()     { return commit; }

    /** The revision to fetch: the pinned commit when present, otherwise the reference. */
    public String revision() {
        return commit != null && !commit.isBlank() ? commit : reference;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocator other)) return false;
        return Objects.equals(repository, other.repository)
            && Objects.equals(path, other.path)
            && Objects.equals(reference, other.reference)
            && Objects.equals(commit, other.commit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(repository, path, reference, commit);
    }

    @Override
    public String toString() {
        return repository + (path.isEmpty() ? "" : "//" + path) + "@" + revision();
    }
}

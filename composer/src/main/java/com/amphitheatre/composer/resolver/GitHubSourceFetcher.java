package com.amphitheatre.composer.resolver;

import com.amphitheatre.composer.model.SourceLocator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * {@link SourceFetcher} backed by the GitHub REST API.
 *
 * Three calls per uncached source: resolve the reference to a sha, list the
 * tree at that sha, read {@code <path>/.amp.toml} raw. A 404 on the manifest
 * means the Actor declares no partners.
 */
public class GitHubSourceFetcher implements SourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(GitHubSourceFetcher.class);

    static final String MANIFEST_FILE = ".amp.toml";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiBaseUrl;
    private final String       token;

    public GitHubSourceFetcher(String apiBaseUrl, String token, ObjectMapper objectMapper) {
        this.apiBaseUrl = apiBaseUrl.endsWith("/")
                ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.token      = token;
        this.json       = objectMapper;
        this.http       = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String resolveCommit(SourceLocator source) {
        String repo = repoPath(source);
        String sha = get("/repos/" + repo + "/commits/" + encode(source.getReference()),
                "application/vnd.github.sha",
                "resolve " + source.getReference() + " in " + repo).trim();
        if (!SourceLocator.isValidCommit(sha)) {
            throw new FetchException(FetchException.Kind.UNAVAILABLE,
                    "unexpected commit sha for " + source.getReference() + " in " + repo);
        }
        log.debug("Resolved {}@{} to {}", repo, source.getReference(), sha);
        return sha;
    }

    @Override
    public SourceTree fetch(SourceLocator source, String commit) {
        String repo = repoPath(source);

        String treeBody = get("/repos/" + repo + "/git/trees/" + commit + "?recursive=1",
                "application/vnd.github+json", "list tree of " + repo + " at " + commit);
        Set<String> paths = new LinkedHashSet<>();
        try {
            JsonNode tree = json.readTree(treeBody);
            if (tree.path("truncated").asBoolean(false)) {
                log.warn("Tree listing of {} at {} was truncated by the API", repo, commit);
            }
            for (JsonNode entry : tree.path("tree")) {
                paths.add(entry.path("path").asText());
            }
        } catch (IOException e) {
            throw new FetchException(FetchException.Kind.UNAVAILABLE,
                    "unreadable tree listing for " + repo, e);
        }

        String manifestPath = source.getPath().isEmpty()
                ? MANIFEST_FILE : source.getPath() + "/" + MANIFEST_FILE;
        String manifest = null;
        if (paths.contains(manifestPath)) {
            manifest = get("/repos/" + repo + "/contents/" + manifestPath + "?ref=" + commit,
                    "application/vnd.github.raw", "read " + manifestPath + " of " + repo);
        }
        return new SourceTree(commit, paths, manifest);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    static String repoPath(SourceLocator source) {
        if (!SourceLocator.isValidRepository(source.getRepository())) {
            throw new FetchException(FetchException.Kind.INVALID_LOCATOR,
                    "not a GitHub repository: " + source.getRepository());
        }
        return SourceLocator.ownerAndName(source.getRepository());
    }

    private String get(String path, String accept, String opName) {
        HttpResponse<String> resp;
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(URI.create(apiBaseUrl + path))
                    .timeout(Duration.ofSeconds(30))
                    .header("Accept", accept)
                    .header("X-GitHub-Api-Version", "2022-11-28")
                    .GET();
            if (token != null && !token.isBlank()) {
                req.header("Authorization", "Bearer " + token);
            }
            resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new FetchException(FetchException.Kind.UNAVAILABLE, opName + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchException.Kind.UNAVAILABLE, opName + " interrupted", e);
        }

        int status = resp.statusCode();
        if (status == 404 || status == 422) {
            throw new FetchException(FetchException.Kind.NOT_FOUND,
                    opName + " failed: HTTP " + status);
        }
        if (status < 200 || status >= 300) {
            throw new FetchException(FetchException.Kind.UNAVAILABLE,
                    opName + " failed: HTTP " + status + ": " + resp.body());
        }
        return resp.body();
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}

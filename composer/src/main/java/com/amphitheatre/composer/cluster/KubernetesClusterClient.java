package com.amphitheatre.composer.cluster;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link ClusterClient} speaking the Kubernetes REST API directly.
 *
 * Uses java.net.http.HttpClient and Jackson, the same way the source fetcher
 * does. Writes are server-side apply patches under a fixed field manager, so
 * applying the same manifest twice is a no-op on the server.
 *
 * The bearer token is re-read from disk on every call because projected
 * service-account tokens rotate.
 */
public class KubernetesClusterClient implements ClusterClient {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClusterClient.class);

    private static final String APPLY_PATCH = "application/apply-patch+yaml";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Path         tokenPath;
    private final String       fieldManager;
    private final Duration     timeout;

    public KubernetesClusterClient(String baseUrl, Path tokenPath, SSLContext sslContext,
                                   String fieldManager, Duration timeout, ObjectMapper objectMapper) {
        this.baseUrl      = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.tokenPath    = tokenPath;
        this.fieldManager = fieldManager;
        this.timeout      = timeout;
        this.json         = objectMapper;

        HttpClient.Builder builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10));
        if (sslContext != null) {
            builder.sslContext(sslContext);
        }
        this.http = builder.build();
    }

    // ------------------------------------------------------------------
    // ClusterClient
    // ------------------------------------------------------------------

    @Override
    public Optional<ClusterObject> get(ObjectKind kind, String namespace, String name) {
        HttpResponse<String> resp = send(request(kind.objectPath(namespace, name)).GET(),
                "get " + kind.kind() + " " + name);
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(resp, "get " + kind.kind() + " " + name);
        return Optional.of(new ClusterObject(kind, namespace, name, parseObject(resp.body())));
    }

    @Override
    public ClusterObject apply(ClusterObject object) {
        String op = "apply " + object.key();
        String path = object.kind().objectPath(object.namespace(), object.name())
                + "?fieldManager=" + encode(fieldManager) + "&force=true";
        String body = toJson(object.manifest());

        HttpResponse<String> resp = send(request(path)
                .header("Content-Type", APPLY_PATCH)
                .method("PATCH", HttpRequest.BodyPublishers.ofString(body)), op);
        requireSuccess(resp, op);
        log.debug("Applied {}", object.key());
        return new ClusterObject(object.kind(), object.namespace(), object.name(),
                                 parseObject(resp.body()));
    }

    @Override
    public void delete(ObjectKind kind, String namespace, String name) {
        String op = "delete " + kind.kind() + " " + name;
        String body = "{\"kind\":\"DeleteOptions\",\"apiVersion\":\"v1\","
                    + "\"propagationPolicy\":\"Background\"}";
        HttpResponse<String> resp = send(request(kind.objectPath(namespace, name))
                .header("Content-Type", "application/json")
                .method("DELETE", HttpRequest.BodyPublishers.ofString(body)), op);
        if (resp.statusCode() == 404) {
            return;
        }
        requireSuccess(resp, op);
        log.debug("Deleted {} {}/{}", kind.kind(), namespace, name);
    }

    @Override
    public List<ClusterObject> list(ObjectKind kind, String namespace, Map<String, String> labels) {
        String selector = labels.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
        String path = kind.collectionPath(namespace)
                + (selector.isEmpty() ? "" : "?labelSelector=" + encode(selector));
        String op = "list " + kind.kind() + " in " + namespace;

        HttpResponse<String> resp = send(request(path).GET(), op);
        if (resp.statusCode() == 404) {
            return List.of();
        }
        requireSuccess(resp, op);

        List<ClusterObject> out = new ArrayList<>();
        for (JsonNode item : parseObject(resp.body()).path("items")) {
            if (item instanceof ObjectNode obj) {
                String ns = item.path("metadata").path("namespace").asText(null);
                out.add(new ClusterObject(kind, ns, item.path("metadata").path("name").asText(), obj));
            }
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json");
        readToken().ifPresent(token -> req.header("Authorization", "Bearer " + token));
        return req;
    }

    private HttpResponse<String> send(HttpRequest.Builder req, String opName) {
        try {
            return http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ClusterException(ClusterException.Kind.TRANSIENT, opName + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusterException(ClusterException.Kind.TRANSIENT, opName + " interrupted", e);
        }
    }

    private static void requireSuccess(HttpResponse<String> resp, String opName) {
        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new ClusterException(ClusterException.classify(status), status,
                    opName + " failed — HTTP " + status + ": " + resp.body());
        }
    }

    private Optional<String> readToken() {
        if (tokenPath == null || !Files.isReadable(tokenPath)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(tokenPath).trim());
        } catch (IOException e) {
            log.warn("Cannot read service-account token at {}: {}", tokenPath, e.getMessage());
            return Optional.empty();
        }
    }

    private ObjectNode parseObject(String body) {
        try {
            JsonNode node = json.readTree(body);
            if (node instanceof ObjectNode obj) {
                return obj;
            }
            throw new ClusterException(ClusterException.Kind.TRANSIENT, 0,
                    "unexpected response body: " + body);
        } catch (JsonProcessingException e) {
            throw new ClusterException(ClusterException.Kind.TRANSIENT, "unparsable response body", e);
        }
    }

    private String toJson(ObjectNode node) {
        try {
            return json.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ClusterException(ClusterException.Kind.PERMANENT, "JSON serialization failed", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * SSL context trusting the cluster CA bundle at {@code caPath}; null when
     * the file does not exist, leaving the JDK default trust store in place.
     */
    public static SSLContext trustingCa(Path caPath) {
        if (caPath == null || !Files.isReadable(caPath)) {
            return null;
        }
        try (InputStream in = Files.newInputStream(caPath)) {
            KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
            store.load(null, null);
            int i = 0;
            for (Certificate cert : CertificateFactory.getInstance("X.509").generateCertificates(in)) {
                store.setCertificateEntry("cluster-ca-" + i++, cert);
            }
            TrustManagerFactory tmf =
                    TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(store);
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, tmf.getTrustManagers(), null);
            return ctx;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Cannot load cluster CA from " + caPath, e);
        }
    }
}

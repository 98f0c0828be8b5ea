package io.kubestate.exporter.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.PodListBuilder;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.kubestate.exporter.model.ListResult;
import io.kubestate.exporter.model.WatchEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.kubestate.exporter.testutil.TestFactory.pod;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the adapter with a real fabric8 client against a local API server stub that answers
 * every watch with one event and then ends the response.
 */
public class KubernetesListWatcherServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> watchedVersions = new CopyOnWriteArrayList<>();
    private HttpServer server;
    private KubernetesClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/v1/namespaces/default/pods", this::handle);
        server.start();

        Config config = KubernetesListWatcher.withoutWatchReconnect(new ConfigBuilder(Config.empty())
                .withMasterUrl("http://127.0.0.1:" + server.getAddress().getPort())
                .withNamespace("default")
                .withRequestRetryBackoffLimit(0)
                .build());
        client = new KubernetesClientBuilder().withConfig(config).build();
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        Map<String, String> query = query(exchange.getRequestURI().getRawQuery());
        byte[] body;
        if ("true".equals(query.get("watch"))) {
            watchedVersions.add(query.getOrDefault("resourceVersion", ""));
            Pod changed = new PodBuilder(pod("default", "web-0", "Running"))
                    .editMetadata().withResourceVersion(String.valueOf(watchedVersions.size() + 1)).endMetadata()
                    .build();
            body = (mapper.writeValueAsString(Map.of("type", "ADDED", "object", changed)) + "\n")
                    .getBytes(StandardCharsets.UTF_8);
        } else {
            body = mapper.writeValueAsBytes(new PodListBuilder()
                    .withNewMetadata().withResourceVersion("1").endMetadata()
                    .build());
        }
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private static Map<String, String> query(String raw) {
        Map<String, String> params = new HashMap<>();
        if (raw == null) {
            return params;
        }
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                params.put(pair.substring(0, eq), pair.substring(eq + 1));
            }
        }
        return params;
    }

    @Test
    void testListAgainstServer() {
        ListResult<Pod> result = KubernetesListWatcher.pods(client, "default").list(Duration.ofSeconds(5));

        assertThat(result.resourceVersion()).isEqualTo("1");
        assertThat(result.items()).isEmpty();
    }

    @Test
    void testEndedWatchIsReportedInsteadOfResumed() throws InterruptedException {
        WatchStream stream = KubernetesListWatcher.pods(client, "default").watch("1", Duration.ofMinutes(5));

        List<WatchEvent<?>> events = new ArrayList<>();
        ResourceSyncException ended = null;
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        try {
            while (ended == null && System.nanoTime() < deadline) {
                try {
                    stream.next(Duration.ofMillis(200)).ifPresent(events::add);
                } catch (ResourceSyncException e) {
                    ended = e;
                }
            }
        } finally {
            stream.close();
        }

        assertThat(ended).as("end of the watch reported to the caller").isNotNull();
        assertThat(ended.isRelistImmediately()).isTrue();
        assertThat(events).isNotEmpty()
                .allSatisfy(e -> assertThat(e.object().getMetadata().getName()).isEqualTo("web-0"));
        // every watch request started from the listed version, none resumed from a later one
        assertThat(watchedVersions).isNotEmpty().containsOnly("1");
    }
}

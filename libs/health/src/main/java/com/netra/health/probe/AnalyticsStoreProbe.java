package com.netra.health.probe;

import com.netra.health.DependencyKind;
import com.netra.health.ServiceHealthRecord;
import com.netra.health.config.DependencySettings;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongSupplier;

/**
 * Probes the analytics store over its HTTP interface by asking for the server version.
 * <p>
 * An unconfigured store is {@code not_configured} unless it is required, in which case it is
 * failed. HTTP 200 within {@link #SLOW_RESPONSE_THRESHOLD_MS} is healthy, slower is degraded,
 * any other status is failed with the (truncated) response body as the error.
 * <p>
 * Credentials are sent as a basic authorization header and never appear in the request URI.
 */
public final class AnalyticsStoreProbe extends AbstractHealthProbe<HttpResponse<String>> {

    /** Default bound for the version request (10 seconds). */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    /** Response times above this are classified as degraded. */
    public static final double SLOW_RESPONSE_THRESHOLD_MS = 5000.0;

    /** Default port of the plain HTTP interface. */
    public static final int DEFAULT_HTTP_PORT = 8123;

    /** Default port of the TLS HTTP interface. */
    public static final int DEFAULT_HTTPS_PORT = 8443;

    /** Path and query of the version endpoint. */
    public static final String VERSION_PATH = "/?query=SELECT%20version()";

    /** Maximum number of response-body characters included in an error. */
    public static final int MAX_BODY_LENGTH = 200;

    private final DependencySettings settings;
    private final HttpClient httpClient;

    public AnalyticsStoreProbe(DependencySettings settings, HttpClient httpClient) {
        this(settings, httpClient, Clock.systemUTC(), System::nanoTime);
    }

    public AnalyticsStoreProbe(DependencySettings settings, HttpClient httpClient,
                               Clock clock, LongSupplier nanoTicker) {
        super(clock, nanoTicker);
        if (settings == null || httpClient == null) {
            throw new IllegalArgumentException("settings and httpClient must not be null");
        }
        this.settings = settings;
        this.httpClient = httpClient;
    }

    @Override
    public DependencyKind kind() {
        return DependencyKind.ANALYTICS;
    }

    /**
     * Returns the base URI of the HTTP interface: {@code URL} when set, otherwise
     * {@code http(s)://HOST:PORT} with the scheme chosen by the secure flag.
     */
    public URI baseUri() {
        if (settings.url() != null) {
            String url = settings.url();
            return URI.create(url.endsWith("/") ? url.substring(0, url.length() - 1) : url);
        }
        String scheme = settings.secure() ? "https" : "http";
        int port = settings.port() != null
                ? settings.port()
                : settings.secure() ? DEFAULT_HTTPS_PORT : DEFAULT_HTTP_PORT;
        return URI.create(scheme + "://" + settings.host() + ":" + port);
    }

    @Override
    protected Optional<ServiceHealthRecord> precheck() {
        if (settings.isConfigured()) {
            return Optional.empty();
        }
        if (settings.required()) {
            return Optional.of(failed(serviceName() + " is required but not configured",
                    ProbeErrorKind.CONFIGURATION_MISSING_REQUIRED, Map.of()));
        }
        String reason = settings.isDisabled()
                ? settings.prefix() + "_MODE is " + settings.mode()
                : "No " + settings.prefix() + "_HOST or " + settings.prefix() + "_URL configured";
        return Optional.of(ServiceHealthRecord.notConfigured(serviceName(), reason, clock.instant()));
    }

    @Override
    protected CompletableFuture<HttpResponse<String>> execute(Duration timeout) {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(baseUri() + VERSION_PATH))
                .timeout(timeout)
                .GET();
        if (settings.user() != null) {
            String credentials = settings.user() + ":" + (settings.password() == null ? "" : settings.password());
            request.header("Authorization", "Basic "
                    + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        }
        return httpClient.sendAsync(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Override
    protected ServiceHealthRecord classify(HttpResponse<String> response, double responseTimeMs) {
        String body = response.body() == null ? "" : response.body().strip();
        if (response.statusCode() != 200) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("http_status", response.statusCode());
            details.put(DETAIL_EXCEPTION_TYPE, "UnexpectedHttpStatus");
            return failed(sanitizer.sanitize("HTTP " + response.statusCode() + ": " + body),
                    ProbeErrorKind.CONNECTIVITY_FAILURE, details);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        if (!body.isEmpty()) {
            details.put("version", ErrorSanitizer.truncate(body, MAX_BODY_LENGTH));
        }
        if (responseTimeMs > SLOW_RESPONSE_THRESHOLD_MS) {
            details.put(DETAIL_WARNING, String.format(Locale.ROOT,
                    "Slow response time: %.2fms (threshold %.0fms)", responseTimeMs, SLOW_RESPONSE_THRESHOLD_MS));
            return ServiceHealthRecord.degraded(serviceName(), responseTimeMs, details, clock.instant());
        }
        return ServiceHealthRecord.healthy(serviceName(), responseTimeMs, details, clock.instant());
    }
}

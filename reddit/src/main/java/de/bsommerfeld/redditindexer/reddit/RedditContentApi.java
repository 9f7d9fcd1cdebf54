package de.bsommerfeld.redditindexer.reddit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.redditindexer.core.config.RedditConfig;
import de.bsommerfeld.redditindexer.core.domain.Item;
import de.bsommerfeld.redditindexer.core.domain.ItemKind;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Properties;

/**
 * Reads subreddit listings from Reddit over HTTP.
 *
 * <h3>Endpoints</h3>
 * Submissions come from {@code /r/{subreddit}/new}, comments from
 * {@code /r/{subreddit}/comments}. Both listings are ordered newest first
 * and return at most {@value #PAGE_SIZE} children per request, so larger
 * limits are read page by page through the {@code after} cursor until the
 * limit is reached or the listing ends.
 *
 * <h3>Authentication</h3>
 * With a {@code client-id} and {@code client-secret} configured, an
 * application-only OAuth token is requested via the client-credentials grant
 * and requests go to {@code oauth.reddit.com}. The token is cached until
 * shortly before it expires. Without credentials the public {@code .json}
 * endpoints on {@code www.reddit.com} are used; they work, but Reddit
 * throttles them harder.
 *
 * <h3>Rate limiting</h3>
 * Reddit returns {@code x-ratelimit-remaining} and {@code x-ratelimit-reset}
 * headers on every response. When remaining requests drop below 2, the
 * calling worker blocks for the reset window.
 *
 * <h3>User-Agent convention</h3>
 * Reddit requires a descriptive User-Agent of the form
 * {@code <platform>:<app-id>:<version> (by /u/<username>)}. A configured
 * {@code user-agent} wins; otherwise one is built from the version in
 * {@code reddit-indexer-version.properties}, filled in at build time via
 * Maven resource filtering.
 *
 * <p>
 * One instance is shared by all workers. {@link HttpClient} and
 * {@link ObjectMapper} are thread-safe; the token cache is guarded by the
 * instance monitor.
 *
 * @see TestContentApi
 */
@Singleton
public class RedditContentApi implements ContentApi {

    private static final Logger LOG = LoggerFactory.getLogger(RedditContentApi.class);

    static final String PUBLIC_BASE = "https://www.reddit.com";
    static final String OAUTH_BASE = "https://oauth.reddit.com";
    static final String TOKEN_URL = "https://www.reddit.com/api/v1/access_token";
    private static final String JSON_SUFFIX = ".json";

    /** Reddit's hard cap for {@code ?limit=N} on listings. */
    static final int PAGE_SIZE = 100;

    /** Tokens are renewed this long before Reddit says they expire. */
    private static final Duration TOKEN_MARGIN = Duration.ofSeconds(60);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final RedditConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String userAgent;

    private String accessToken;
    private Instant tokenExpiry = Instant.EPOCH;

    @Inject
    public RedditContentApi(RedditConfig config) {
        this(config, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .connectTimeout(CONNECT_TIMEOUT)
                .build());
    }

    RedditContentApi(RedditConfig config, HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.userAgent = config.getUserAgent() == null || config.getUserAgent().isBlank()
                ? buildUserAgent()
                : config.getUserAgent();
        LOG.info("Reddit access: {}", config.hasCredentials() ? "OAuth (client credentials)" : "public endpoints");
    }

    // =====================================================================
    // Listings
    // =====================================================================

    @Override
    public List<Item> newest(String channel, ItemKind kind, int limit) throws ContentApiException {
        List<Item> items = new ArrayList<>(Math.min(limit, PAGE_SIZE));
        String after = null;

        while (items.size() < limit) {
            int pageLimit = Math.min(PAGE_SIZE, limit - items.size());
            String url = listingUrl(channel, kind, pageLimit, after);
            LOG.debug("GET {}", url);

            JsonNode root = readJson(get(url), url);
            Page page = parseListing(root, channel, kind);
            items.addAll(page.items());

            if (page.items().isEmpty() || page.after() == null)
                break;
            after = page.after();
        }

        if (items.size() > limit) {
            return new ArrayList<>(items.subList(0, limit));
        }
        return items;
    }

    String listingUrl(String channel, ItemKind kind, int pageLimit, String after) {
        StringBuilder url = new StringBuilder();
        url.append(config.hasCredentials() ? OAUTH_BASE : PUBLIC_BASE)
                .append("/r/").append(URLEncoder.encode(channel, StandardCharsets.UTF_8))
                .append('/').append(kind == ItemKind.SUBMISSIONS ? "new" : "comments");
        if (!config.hasCredentials()) {
            url.append(JSON_SUFFIX);
        }
        url.append("?limit=").append(pageLimit).append("&raw_json=1");
        if (after != null) {
            url.append("&after=").append(URLEncoder.encode(after, StandardCharsets.UTF_8));
        }
        return url.toString();
    }

    /**
     * Maps a listing response ({@code data.children[].data}) to items.
     *
     * <p>
     * Submissions carry their text in {@code title}, comments in
     * {@code body}. Children without that field (e.g. {@code more} stubs)
     * are skipped; a {@code null} body (removed comment) is kept as empty
     * text.
     */
    static Page parseListing(JsonNode root, String channel, ItemKind kind) throws ContentApiException {
        JsonNode data = root.path("data");
        JsonNode children = data.path("children");
        if (!children.isArray())
            throw new ContentApiException("Response for r/" + channel + " is not a listing");

        String textField = kind == ItemKind.SUBMISSIONS ? "title" : "body";
        List<Item> items = new ArrayList<>(children.size());
        for (JsonNode child : children) {
            JsonNode node = child.path("data");
            if (!node.has(textField))
                continue;

            String id = node.has("name")
                    ? node.get("name").asText()
                    : (kind == ItemKind.SUBMISSIONS ? "t3_" : "t1_") + node.path("id").asText();
            String text = node.get(textField).isNull() ? "" : node.get(textField).asText();
            // created_utc is a float on the wire (e.g. 1700000000.0)
            long created = (long) node.path("created_utc").asDouble(0);

            items.add(new Item(id, channel, kind, text, created));
        }

        JsonNode after = data.path("after");
        return new Page(items, after.isTextual() && !after.asText().isEmpty() ? after.asText() : null);
    }

    // =====================================================================
    // HTTP
    // =====================================================================

    /**
     * Executes a GET request with the User-Agent and, if configured, the
     * bearer token. A 401 invalidates the cached token so the next request
     * fetches a fresh one.
     */
    private HttpResponse<String> get(String url) throws ContentApiException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", userAgent)
                .GET();
        if (config.hasCredentials()) {
            builder.header("Authorization", "bearer " + accessToken());
        }

        HttpResponse<String> response = send(builder.build());
        checkRateLimit(response);

        if (response.statusCode() == 401 && config.hasCredentials()) {
            invalidateToken();
        }
        if (response.statusCode() != 200) {
            throw new ContentApiException("HTTP " + response.statusCode() + " for " + url);
        }
        return response;
    }

    private HttpResponse<String> send(HttpRequest request) throws ContentApiException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ContentApiException("Request to " + request.uri() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContentApiException("Interrupted while requesting " + request.uri(), e);
        }
    }

    private JsonNode readJson(HttpResponse<String> response, String url) throws ContentApiException {
        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new ContentApiException("Malformed JSON from " + url, e);
        }
    }

    /**
     * Inspects Reddit's rate-limit response headers. If fewer than 2
     * requests remain in the current window, the thread blocks for the
     * {@code x-ratelimit-reset} duration plus 1 second.
     */
    private void checkRateLimit(HttpResponse<?> response) {
        response.headers().firstValue("x-ratelimit-remaining").ifPresent(remaining -> {
            try {
                double rem = Double.parseDouble(remaining);
                if (rem < 2.0) {
                    response.headers().firstValue("x-ratelimit-reset").ifPresent(reset -> {
                        int waitSecs = (int) Double.parseDouble(reset) + 1;
                        LOG.warn("Reddit rate limit near. Sleeping for {}s", waitSecs);
                        try {
                            Thread.sleep(waitSecs * 1000L);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    });
                }
            } catch (NumberFormatException e) {
                LOG.debug("Ignoring malformed rate-limit header '{}'", remaining);
            }
        });
    }

    // =====================================================================
    // OAuth
    // =====================================================================

    private synchronized String accessToken() throws ContentApiException {
        if (accessToken != null && Instant.now().isBefore(tokenExpiry))
            return accessToken;

        String credentials = config.getClientId() + ":" + config.getClientSecret();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(TOKEN_URL))
                .header("User-Agent", userAgent)
                .header("Authorization", "Basic "
                        + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString("grant_type=client_credentials"))
                .build();

        HttpResponse<String> response = send(request);
        if (response.statusCode() != 200) {
            throw new ContentApiException("Token request rejected: HTTP " + response.statusCode());
        }

        JsonNode root = readJson(response, TOKEN_URL);
        String token = root.path("access_token").asText(null);
        if (token == null || token.isEmpty()) {
            throw new ContentApiException("Token response carries no access_token");
        }
        long expiresIn = root.path("expires_in").asLong(3600);

        accessToken = token;
        tokenExpiry = Instant.now().plusSeconds(expiresIn).minus(TOKEN_MARGIN);
        LOG.info("Obtained Reddit access token (valid for {}s)", expiresIn);
        return accessToken;
    }

    private synchronized void invalidateToken() {
        accessToken = null;
        tokenExpiry = Instant.EPOCH;
    }

    // =====================================================================
    // User-Agent
    // =====================================================================

    /**
     * Builds the User-Agent from the Maven-filtered version property. Falls
     * back to "unknown" if the properties file is missing (e.g. IDE-only
     * runs without a Maven build).
     */
    static String buildUserAgent() {
        String version = "unknown";
        try (InputStream in = RedditContentApi.class.getResourceAsStream("/reddit-indexer-version.properties")) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                version = props.getProperty("app.version", "unknown");
            }
        } catch (IOException e) {
            LOG.debug("Version properties unreadable, using 'unknown'", e);
        }
        return "java:de.bsommerfeld.redditindexer:v" + version + " (by /u/RedditIndexer)";
    }

    String userAgent() {
        return userAgent;
    }

    /** One listing page: the items and the cursor of the next page. */
    record Page(List<Item> items, String after) {
    }
}

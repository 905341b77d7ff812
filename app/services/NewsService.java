package services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import models.Article;
import models.FetchError;
import models.ServiceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import play.libs.Json;
import play.libs.ws.WSClient;
import play.libs.ws.WSRequest;
import play.libs.ws.WSResponse;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Service responsible for interacting with the external News API.
 *
 * <p>This class turns headline and search requests into normalized {@link Article}
 * lists. Every failure (transport, timeout, non-2xx status, unreadable body) is
 * caught here and returned as a classified {@link FetchError}; the returned
 * stage never completes exceptionally.</p>
 *
 * <p>Core functions:</p>
 * <ul>
 *     <li>{@link #fetchHeadlines(String)}: Top headlines for the configured country</li>
 *     <li>{@link #search(String)}: Keyword search over all articles</li>
 * </ul>
 *
 * <p>Supports both live and mock modes as defined in <code>application.conf</code>.
 * The instance is stateless and shared for the lifetime of the application.</p>
 */
@Singleton
public class NewsService {

    private static final Logger log = LoggerFactory.getLogger(NewsService.class);

    /** The asynchronous HTTP client used to make API calls. */
    private final WSClient ws;

    /** The base URL for the News API (e.g., https://newsapi.org/v2). */
    private final String baseUrl;

    /** The API key sent as the {@code apiKey} query parameter. */
    private final String apiKey;

    /** Country whose top headlines are requested. */
    private final String country;

    /** Receive timeout for requests, in milliseconds. */
    private final int timeoutMs;

    /** Mock mode flag and directory path for static JSON files. */
    private final boolean mock;
    private final String mockDir;

    /** JSON parser. */
    private final ObjectMapper mapper = Json.mapper();

    /**
     * Constructs a {@code NewsService} instance by injecting configuration and HTTP client dependencies.
     * <p>
     * Reads the base URL, API key, country and timeout from {@code application.conf}.
     * Logs a warning if the API key is missing, as it is required for successful API calls.
     * </p>
     *
     * @param config the application configuration containing News API parameters
     * @param ws     the Play WSClient for performing asynchronous HTTP requests
     */
    @Inject
    public NewsService(Config config, WSClient ws) {
        this.ws        = ws;
        this.baseUrl   = config.getString("newsapi.baseUrl");
        this.apiKey    = config.hasPath("newsapi.key") ? config.getString("newsapi.key") : "";
        this.country   = config.hasPath("newsapi.country") ? config.getString("newsapi.country") : "us";
        this.timeoutMs = config.getInt("newsapi.timeoutMs");

        this.mock      = config.hasPath("newsapi.mock") && config.getBoolean("newsapi.mock");
        this.mockDir   = config.hasPath("newsapi.mockDir") ? config.getString("newsapi.mockDir") : "conf/mock";

        if (!mock && this.apiKey.isBlank()) {
            log.warn("NEWS_API_KEY not configured, News API calls will be rejected upstream");
        }
        if (mock) {
            log.info("NewsService running in MOCK MODE, reading fixtures from {}", mockDir);
        }
    }

    // -----------------------------------------------------------
    // Core public API methods
    // -----------------------------------------------------------

    /**
     * Fetches top headlines from {@code /top-headlines}.
     *
     * @param category optional category filter (e.g. {@code "business"}); {@code null} or blank for all
     * @return a stage completing with the articles in upstream order, or a classified failure
     */
    public CompletionStage<ServiceResult<List<Article>>> fetchHeadlines(String category) {
        boolean hasCategory = category != null && !category.isBlank();
        if (mock) {
            return mockResponse("top-headlines_" + safe(category) + ".json");
        }
        return execute("/top-headlines", req -> {
            WSRequest r = req.addQueryParameter("country", country);
            return hasCategory ? r.addQueryParameter("category", category) : r;
        });
    }

    /**
     * Searches all articles via {@code /everything}.
     *
     * @param query the user-entered keyword or phrase
     * @return a stage completing with the articles in upstream order, or a classified failure
     */
    public CompletionStage<ServiceResult<List<Article>>> search(String query) {
        String q = query == null ? "" : query;
        if (mock) {
            return mockResponse("everything_" + safe(q) + ".json");
        }
        return execute("/everything", req -> req.addQueryParameter("q", q));
    }

    // -----------------------------------------------------------
    // Request execution and classification
    // -----------------------------------------------------------

    private interface RequestCustomizer {
        WSRequest apply(WSRequest request);
    }

    private CompletionStage<ServiceResult<List<Article>>> execute(String path, RequestCustomizer customizer) {
        final CompletionStage<WSResponse> pending;
        try {
            WSRequest req = ws.url(baseUrl + path)
                    .addQueryParameter("apiKey", apiKey)
                    .setRequestTimeout(Duration.ofMillis(timeoutMs));
            pending = customizer.apply(req).get();
        } catch (RuntimeException e) {
            log.warn("Could not issue request to {}: {}", path, e.toString());
            return CompletableFuture.completedFuture(ServiceResult.failure(classify(e)));
        }

        return pending.handle((res, error) -> {
            if (error != null) {
                FetchError fe = classify(error);
                log.warn("Request to {} failed: {}", path, fe);
                return ServiceResult.<List<Article>>failure(fe);
            }
            try {
                ServiceResult<List<Article>> result = toResult(res.getStatus(), res.getBody());
                result.getError().ifPresent(fe -> log.warn("Request to {} failed: {}", path, fe));
                return result;
            } catch (RuntimeException e) {
                FetchError fe = classify(e);
                log.warn("Reading response from {} failed: {}", path, fe);
                return ServiceResult.<List<Article>>failure(fe);
            }
        });
    }

    /**
     * Maps a raw status and body to a result.
     *
     * <ul>
     *     <li>401 or 403 → "Invalid API key or unauthorized"</li>
     *     <li>429 → "Rate limit exceeded"</li>
     *     <li>5xx → "Upstream service unavailable"</li>
     *     <li>other non-2xx → "Upstream request failed"</li>
     * </ul>
     *
     * @param status HTTP status
     * @param body   response body
     * @return parsed articles for 2xx, an {@link FetchError.Kind#UPSTREAM} failure otherwise
     */
    ServiceResult<List<Article>> toResult(int status, String body) {
        if (status < 200 || status >= 300) {
            return ServiceResult.failure(FetchError.upstream(status, upstreamMessage(status), safeParse(body)));
        }
        return parseArticles(body);
    }

    /**
     * Parses an {@code {"articles": [...]}} body.
     * <p>Array elements that are not objects or carry no {@code url} are skipped.</p>
     *
     * @param body response body
     * @return the articles, or a {@link FetchError.Kind#DECODE} failure
     */
    ServiceResult<List<Article>> parseArticles(String body) {
        if (body == null) {
            return ServiceResult.failure(FetchError.decode("Empty response body"));
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            return ServiceResult.failure(FetchError.decode("Malformed response body: " + e.getMessage()));
        }
        if (root == null || !root.isObject()) {
            return ServiceResult.failure(FetchError.decode("Response body is not a JSON object"));
        }
        JsonNode arr = root.path("articles");
        if (!arr.isArray()) {
            return ServiceResult.failure(FetchError.decode("Response has no articles array"));
        }
        List<Article> articles = StreamSupport.stream(arr.spliterator(), false)
                .filter(JsonNode::isObject)
                .map(Article::fromJson)
                .filter(a -> !a.url.isBlank())
                .collect(Collectors.toList());
        return ServiceResult.success(articles);
    }

    /**
     * Classifies a transport-level failure as {@link FetchError.Kind#TIMEOUT} or
     * {@link FetchError.Kind#NETWORK}.
     *
     * @param error the failure, possibly wrapped in a {@link CompletionException}
     * @return the classified error
     */
    public static FetchError classify(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException
                    || t instanceof SocketTimeoutException
                    || t.getClass().getSimpleName().contains("Timeout")) {
                return FetchError.timeout("Request timed out: " + t.getMessage());
            }
        }
        return FetchError.network("Request failed: " + cause.getMessage());
    }

    private static String upstreamMessage(int status) {
        if (status == 401 || status == 403) {
            return "Invalid API key or unauthorized";
        } else if (status == 429) {
            return "Rate limit exceeded";
        } else if (status >= 500) {
            return "Upstream service unavailable";
        }
        return "Upstream request failed";
    }

    /**
     * Parses an error body for diagnostics.
     *
     * @return the parsed JSON, or {@code null} when the body is absent or not JSON
     */
    private JsonNode safeParse(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
            return null;
        }
    }

    // -----------------------------------------------------------
    // Mock mode
    // -----------------------------------------------------------

    /**
     * Sanitizes input strings for use in fixture file names.
     *
     * @param s the input string (e.g., user query or category)
     * @return lowercase safe string with non-alphanumeric characters replaced by dashes; {@code "all"} if blank/null
     */
    static String safe(String s) {
        return (s == null || s.isBlank()) ? "all" : s.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
    }

    /**
     * Reads a fixture from the mock directory and runs it through the normal mapping.
     *
     * @param filename name of the fixture (e.g., {@code "top-headlines_business.json"})
     * @return the mapped result; a {@link FetchError.Kind#NETWORK} failure when the file cannot be read
     */
    private CompletionStage<ServiceResult<List<Article>>> mockResponse(String filename) {
        try {
            String body = Files.readString(Paths.get(mockDir, filename), StandardCharsets.UTF_8);
            return CompletableFuture.completedFuture(toResult(200, body));
        } catch (IOException e) {
            log.warn("Mock fixture {} missing or unreadable", filename);
            return CompletableFuture.completedFuture(
                    ServiceResult.failure(FetchError.network("mock file missing or invalid: " + filename)));
        }
    }
}

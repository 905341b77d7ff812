package models;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of the feed as the reader should render it: idle, loading, loaded or failed.
 * <p>
 * Instances are immutable. {@link #getRequestId()} identifies the request that
 * produced the state ({@code 0} for the initial idle state).
 * </p>
 */
public final class FeedState {

    public enum Status { IDLE, LOADING, LOADED, ERROR }

    private static final FeedState INITIAL = new FeedState(Status.IDLE, 0L, List.of(), null, null);

    private final Status status;
    private final long requestId;
    private final List<Article> articles;
    private final String message;
    private final FetchError.Kind errorKind;

    private FeedState(Status status, long requestId, List<Article> articles,
                      String message, FetchError.Kind errorKind) {
        this.status = status;
        this.requestId = requestId;
        this.articles = articles;
        this.message = message;
        this.errorKind = errorKind;
    }

    public static FeedState idle() {
        return INITIAL;
    }

    public static FeedState loading(long requestId) {
        return new FeedState(Status.LOADING, requestId, List.of(), null, null);
    }

    public static FeedState loaded(long requestId, List<Article> articles) {
        return new FeedState(Status.LOADED, requestId, List.copyOf(articles), null, null);
    }

    public static FeedState error(long requestId, String message, FetchError.Kind kind) {
        return new FeedState(Status.ERROR, requestId, List.of(), message, kind);
    }

    public Status getStatus() {
        return status;
    }

    public long getRequestId() {
        return requestId;
    }

    /**
     * @return the loaded articles in upstream order; empty for every status but {@link Status#LOADED}
     */
    public List<Article> getArticles() {
        return articles;
    }

    /**
     * @return the user-facing failure message when {@link Status#ERROR}
     */
    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    /**
     * @return the failure class behind an {@link Status#ERROR} state, for diagnostics
     */
    public Optional<FetchError.Kind> getErrorKind() {
        return Optional.ofNullable(errorKind);
    }

    @Override
    public String toString() {
        switch (status) {
            case LOADED:
                return "Loaded#" + requestId + "(" + articles.size() + " articles)";
            case ERROR:
                return "Error#" + requestId + "(" + message + ")";
            case LOADING:
                return "Loading#" + requestId;
            default:
                return "Idle";
        }
    }
}

package actors;

import models.Article;
import models.FeedState;
import models.FetchError;
import models.ServiceResult;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import services.NewsService;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * ------------------------------------------------------------
 * Owner of the current feed: idle, loading, loaded or error.
 * Each headline or search request moves the feed to LOADING and asks
 * {@link NewsService}; the answer becomes LOADED or ERROR unless a newer
 * request was issued meanwhile, in which case it is dropped.
 * Subscribers receive the current state on subscription and every
 * transition after that.
 * ------------------------------------------------------------
 */
public final class FeedActor extends AbstractBehavior<FeedActor.Command> {

    public static final String HEADLINES_FAILED = "Failed to fetch news";
    public static final String SEARCH_FAILED = "Failed to search news";

    public interface Command {}

    public static final class RequestHeadlines implements Command {
        public final String category;

        public RequestHeadlines(String category) {
            this.category = category;
        }
    }

    public static final class RequestSearch implements Command {
        public final String query;

        public RequestSearch(String query) {
            this.query = query;
        }
    }

    public static final class GetState implements Command {
        public final ActorRef<FeedState> replyTo;

        public GetState(ActorRef<FeedState> replyTo) {
            this.replyTo = replyTo;
        }
    }

    public static final class Subscribe implements Command {
        public final ActorRef<FeedState> subscriber;

        public Subscribe(ActorRef<FeedState> subscriber) {
            this.subscriber = subscriber;
        }
    }

    public static final class Unsubscribe implements Command {
        public final ActorRef<FeedState> subscriber;

        public Unsubscribe(ActorRef<FeedState> subscriber) {
            this.subscriber = subscriber;
        }
    }

    private static final class FetchCompleted implements Command {
        final long requestId;
        final String failureMessage;
        final ServiceResult<List<Article>> result;
        final Throwable failure;

        FetchCompleted(long requestId, String failureMessage,
                       ServiceResult<List<Article>> result, Throwable failure) {
            this.requestId = requestId;
            this.failureMessage = failureMessage;
            this.result = result;
            this.failure = failure;
        }
    }

    private static final class SubscriberTerminated implements Command {
        final ActorRef<FeedState> subscriber;

        SubscriberTerminated(ActorRef<FeedState> subscriber) {
            this.subscriber = subscriber;
        }
    }

    private final NewsService newsService;
    private final Set<ActorRef<FeedState>> subscribers = new LinkedHashSet<>();
    private FeedState current = FeedState.idle();
    private long latestRequestId = 0L;

    public static Behavior<Command> create(NewsService newsService) {
        return Behaviors.setup(ctx -> new FeedActor(ctx, newsService));
    }

    private FeedActor(ActorContext<Command> context, NewsService newsService) {
        super(context);
        this.newsService = newsService;
    }

    @Override
    public Receive<Command> createReceive() {
        return newReceiveBuilder()
                .onMessage(RequestHeadlines.class, this::onRequestHeadlines)
                .onMessage(RequestSearch.class, this::onRequestSearch)
                .onMessage(FetchCompleted.class, this::onFetchCompleted)
                .onMessage(GetState.class, this::onGetState)
                .onMessage(Subscribe.class, this::onSubscribe)
                .onMessage(Unsubscribe.class, this::onUnsubscribe)
                .onMessage(SubscriberTerminated.class, this::onSubscriberTerminated)
                .build();
    }

    private Behavior<Command> onRequestHeadlines(RequestHeadlines cmd) {
        long id = startRequest();
        getContext().getLog().debug("Request #{}: headlines category={}", id, cmd.category);
        CompletionStage<ServiceResult<List<Article>>> stage;
        try {
            stage = newsService.fetchHeadlines(cmd.category);
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        pipeResult(id, HEADLINES_FAILED, stage);
        return this;
    }

    private Behavior<Command> onRequestSearch(RequestSearch cmd) {
        long id = startRequest();
        getContext().getLog().debug("Request #{}: search query={}", id, cmd.query);
        CompletionStage<ServiceResult<List<Article>>> stage;
        try {
            stage = newsService.search(cmd.query);
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        pipeResult(id, SEARCH_FAILED, stage);
        return this;
    }

    private Behavior<Command> onFetchCompleted(FetchCompleted msg) {
        if (msg.requestId != latestRequestId) {
            getContext().getLog().debug("Discarding stale response #{} (latest is #{})",
                    msg.requestId, latestRequestId);
            return this;
        }

        if (msg.failure != null) {
            FetchError error = NewsService.classify(msg.failure);
            getContext().getLog().error("FeedActor request #{} failed", msg.requestId, msg.failure);
            transition(FeedState.error(msg.requestId, msg.failureMessage, error.getKind()));
        } else if (msg.result != null && msg.result.isSuccess()) {
            transition(FeedState.loaded(msg.requestId, msg.result.getData().orElse(List.of())));
        } else {
            FetchError error = msg.result == null
                    ? FetchError.network("Empty feed response")
                    : msg.result.getError().orElse(FetchError.network("Unknown feed failure"));
            getContext().getLog().warn("Request #{} failed: {}", msg.requestId, error);
            transition(FeedState.error(msg.requestId, msg.failureMessage, error.getKind()));
        }
        return this;
    }

    private Behavior<Command> onGetState(GetState cmd) {
        cmd.replyTo.tell(current);
        return this;
    }

    private Behavior<Command> onSubscribe(Subscribe cmd) {
        if (subscribers.add(cmd.subscriber)) {
            getContext().watchWith(cmd.subscriber, new SubscriberTerminated(cmd.subscriber));
        }
        cmd.subscriber.tell(current);
        return this;
    }

    private Behavior<Command> onUnsubscribe(Unsubscribe cmd) {
        if (subscribers.remove(cmd.subscriber)) {
            getContext().unwatch(cmd.subscriber);
        }
        return this;
    }

    private Behavior<Command> onSubscriberTerminated(SubscriberTerminated msg) {
        subscribers.remove(msg.subscriber);
        return this;
    }

    private long startRequest() {
        latestRequestId++;
        transition(FeedState.loading(latestRequestId));
        return latestRequestId;
    }

    private void pipeResult(long id, String failureMessage,
                            CompletionStage<ServiceResult<List<Article>>> stage) {
        if (stage == null) {
            stage = CompletableFuture.failedFuture(new IllegalStateException("News service returned no result"));
        }
        getContext().pipeToSelf(stage,
                (result, failure) -> new FetchCompleted(id, failureMessage, result, failure));
    }

    private void transition(FeedState next) {
        current = next;
        subscribers.forEach(s -> s.tell(next));
    }
}

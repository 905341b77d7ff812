package services;

import actors.FeedActor;
import models.FeedState;
import models.NewsCategory;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.ActorSystem;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.Props;
import org.apache.pekko.actor.typed.SupervisorStrategy;
import org.apache.pekko.actor.typed.javadsl.Adapter;
import org.apache.pekko.actor.typed.javadsl.AskPattern;
import org.apache.pekko.actor.typed.javadsl.Behaviors;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Entry point for presentation code into the feed.
 *
 * <p>Wraps the {@link FeedActor} that owns the current {@link FeedState}:
 * triggers are fire-and-forget, the state is read with an ask, and listeners
 * are called on every transition.</p>
 */
@Singleton
public class FeedStateMachine {

    private static final Duration ASK_TIMEOUT = Duration.ofSeconds(5);
    private static final AtomicLong SEQ = new AtomicLong();

    /** Handle returned by {@link #subscribe(Consumer)}. */
    public interface Subscription {
        void cancel();
    }

    private static final class StopListener {}

    private final ActorSystem<?> system;
    private final ActorRef<FeedActor.Command> feed;

    @Inject
    public FeedStateMachine(org.apache.pekko.actor.ActorSystem classicSystem, NewsService newsService) {
        this(Adapter.toTyped(classicSystem), newsService);
    }

    public FeedStateMachine(ActorSystem<?> system, NewsService newsService) {
        this.system = system;
        this.feed = system.systemActorOf(
                FeedActor.create(newsService), "feed-" + SEQ.incrementAndGet(), Props.empty());
    }

    /**
     * Load top headlines; {@code null} or blank category means all categories.
     */
    public void requestHeadlines(String category) {
        feed.tell(new FeedActor.RequestHeadlines(category));
    }

    public void requestHeadlines(NewsCategory category) {
        requestHeadlines(category.apiValue());
    }

    public void requestSearch(String query) {
        feed.tell(new FeedActor.RequestSearch(query));
    }

    public CompletionStage<FeedState> currentState() {
        return AskPattern.ask(feed, FeedActor.GetState::new, ASK_TIMEOUT, system.scheduler());
    }

    /**
     * Register a listener. It is called with the current state right away and
     * then once per transition, always from one thread at a time. A listener
     * that throws keeps its subscription.
     */
    public Subscription subscribe(Consumer<FeedState> listener) {
        ActorRef<Object> ref = system.systemActorOf(
                listenerBehavior(listener), "feed-listener-" + SEQ.incrementAndGet(), Props.empty());
        ActorRef<FeedState> subscriber = ref.narrow();
        feed.tell(new FeedActor.Subscribe(subscriber));
        return () -> {
            feed.tell(new FeedActor.Unsubscribe(subscriber));
            ref.tell(new StopListener());
        };
    }

    ActorRef<FeedActor.Command> feedActor() {
        return feed;
    }

    private static Behavior<Object> listenerBehavior(Consumer<FeedState> listener) {
        Behavior<Object> receive = Behaviors.receive(Object.class)
                .onMessage(FeedState.class, state -> {
                    listener.accept(state);
                    return Behaviors.same();
                })
                .onMessage(StopListener.class, msg -> Behaviors.stopped())
                .build();
        return Behaviors.supervise(receive).onFailure(SupervisorStrategy.resume());
    }
}

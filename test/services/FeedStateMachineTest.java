package services;

import models.Article;
import models.FeedState;
import models.NewsCategory;
import models.ServiceResult;
import org.apache.pekko.actor.testkit.typed.javadsl.ActorTestKit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class FeedStateMachineTest {

    private static final ActorTestKit testKit = ActorTestKit.create();

    private NewsService news;
    private FeedStateMachine machine;

    @AfterAll
    static void shutdown() {
        testKit.shutdownTestKit();
    }

    @BeforeEach
    void setUp() {
        news = mock(NewsService.class);
        machine = new FeedStateMachine(testKit.system(), news);
    }

    private static CompletableFuture<ServiceResult<List<Article>>> ok(Article... articles) {
        return CompletableFuture.completedFuture(ServiceResult.success(List.of(articles)));
    }

    private static Article article(String url) {
        return new Article("t", "d", url, "", "2024-01-01T00:00:00Z", "s");
    }

    private static FeedState next(BlockingQueue<FeedState> queue) throws InterruptedException {
        FeedState state = queue.poll(3, TimeUnit.SECONDS);
        assertNotNull(state, "expected a state change");
        return state;
    }

    @Test
    void currentState_isIdleBeforeAnyRequest() throws Exception {
        FeedState state = machine.currentState().toCompletableFuture().get(3, TimeUnit.SECONDS);
        assertEquals(FeedState.Status.IDLE, state.getStatus());
    }

    @Test
    void requestHeadlines_byCategory_usesApiValue() throws Exception {
        when(news.fetchHeadlines("sports")).thenReturn(ok(article("https://a")));
        BlockingQueue<FeedState> states = new LinkedBlockingQueue<>();
        machine.subscribe(states::add);
        assertEquals(FeedState.Status.IDLE, next(states).getStatus());

        machine.requestHeadlines(NewsCategory.SPORTS);

        assertEquals(FeedState.Status.LOADING, next(states).getStatus());
        FeedState loaded = next(states);
        assertEquals(FeedState.Status.LOADED, loaded.getStatus());
        assertEquals("https://a", loaded.getArticles().get(0).url);
        verify(news).fetchHeadlines("sports");
    }

    @Test
    void requestSearch_failure_isVisibleThroughCurrentState() throws Exception {
        when(news.search("q")).thenReturn(CompletableFuture.failedFuture(new RuntimeException("down")));
        BlockingQueue<FeedState> states = new LinkedBlockingQueue<>();
        machine.subscribe(states::add);
        next(states);

        machine.requestSearch("q");
        next(states);
        next(states);

        FeedState state = machine.currentState().toCompletableFuture().get(3, TimeUnit.SECONDS);
        assertEquals(FeedState.Status.ERROR, state.getStatus());
        assertEquals("Failed to search news", state.getMessage().orElseThrow());
    }

    @Test
    void cancelledSubscription_receivesNothingMore() throws Exception {
        when(news.fetchHeadlines("health")).thenReturn(ok(article("https://h")));
        BlockingQueue<FeedState> states = new LinkedBlockingQueue<>();
        FeedStateMachine.Subscription subscription = machine.subscribe(states::add);
        next(states);

        subscription.cancel();
        machine.requestHeadlines("health");

        assertNull(states.poll(300, TimeUnit.MILLISECONDS));
    }

    @Test
    void throwingListener_keepsReceiving() throws Exception {
        when(news.search("a")).thenReturn(ok(article("https://a")));
        BlockingQueue<FeedState> states = new LinkedBlockingQueue<>();
        AtomicBoolean thrown = new AtomicBoolean();
        machine.subscribe(state -> {
            states.add(state);
            if (thrown.compareAndSet(false, true)) {
                throw new IllegalStateException("listener bug");
            }
        });
        next(states);

        machine.requestSearch("a");

        assertEquals(FeedState.Status.LOADING, next(states).getStatus());
        assertEquals(FeedState.Status.LOADED, next(states).getStatus());
    }
}

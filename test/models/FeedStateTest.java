package models;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FeedStateTest {

    @Test
    void idle_isInitialState() {
        FeedState s = FeedState.idle();

        assertEquals(FeedState.Status.IDLE, s.getStatus());
        assertEquals(0L, s.getRequestId());
        assertTrue(s.getArticles().isEmpty());
        assertFalse(s.getMessage().isPresent());
        assertSame(s, FeedState.idle());
    }

    @Test
    void loaded_keepsOrderAndCopiesList() {
        Article a = new Article("A", "", "https://a", "", "", "");
        Article b = new Article("B", "", "https://b", "", "", "");
        List<Article> source = new ArrayList<>(List.of(b, a));

        FeedState s = FeedState.loaded(3L, source);
        source.clear();

        assertEquals(FeedState.Status.LOADED, s.getStatus());
        assertEquals(3L, s.getRequestId());
        assertEquals(List.of(b, a), s.getArticles());
        assertThrows(UnsupportedOperationException.class, () -> s.getArticles().add(a));
    }

    @Test
    void error_carriesMessageAndKind() {
        FeedState s = FeedState.error(7L, "Failed to search news", FetchError.Kind.NETWORK);

        assertEquals(FeedState.Status.ERROR, s.getStatus());
        assertEquals("Failed to search news", s.getMessage().orElseThrow());
        assertEquals(FetchError.Kind.NETWORK, s.getErrorKind().orElseThrow());
        assertTrue(s.getArticles().isEmpty());
    }

    @Test
    void loading_hasNoPayload() {
        FeedState s = FeedState.loading(2L);

        assertEquals(FeedState.Status.LOADING, s.getStatus());
        assertTrue(s.getArticles().isEmpty());
        assertFalse(s.getErrorKind().isPresent());
        assertEquals("Loading#2", s.toString());
    }
}

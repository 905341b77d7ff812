import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import play.inject.ApplicationLifecycle;
import storage.BookmarkStore;
import util.AppDataDirectory;

import javax.inject.Singleton;
import java.util.concurrent.CompletableFuture;

/**
 * Guice bindings for the NewsDesk core.
 * <p>
 * {@link services.NewsService} and {@link services.FeedStateMachine} are
 * {@code @Singleton} and bound just-in-time; the bookmark store is built here
 * because its location comes from configuration. Its connection is closed when
 * the application stops.
 * </p>
 */
public class Module extends AbstractModule {

    private static final Logger log = LoggerFactory.getLogger(Module.class);

    @Provides
    @Singleton
    BookmarkStore bookmarkStore(Config config, ApplicationLifecycle lifecycle) {
        BookmarkStore store = new BookmarkStore(AppDataDirectory.resolve(config));
        log.info("Bookmarks stored in {}", store.getDbFile().getAbsolutePath());
        lifecycle.addStopHook(() -> {
            store.close();
            return CompletableFuture.completedFuture(null);
        });
        return store;
    }
}

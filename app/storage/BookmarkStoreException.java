package storage;

/**
 * Failure of a {@link BookmarkStore} operation.
 */
public class BookmarkStoreException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** The database file could not be opened or created, or its schema could not be set up. */
        INIT_FAILURE,
        /** A read or write failed after the store was initialized. */
        IO_FAILURE
    }

    private final Kind kind;

    public BookmarkStoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}

package models;

import java.util.Optional;

/**
 * Generic wrapper capturing either a successful payload or a classified fetch failure.
 */
public class ServiceResult<T> {
    private final boolean success;
    private final T data;
    private final FetchError error;

    private ServiceResult(boolean success, T data, FetchError error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static <T> ServiceResult<T> success(T data) {
        return new ServiceResult<>(true, data, null);
    }

    public static <T> ServiceResult<T> failure(FetchError error) {
        return new ServiceResult<>(false, null, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public Optional<T> getData() {
        return Optional.ofNullable(data);
    }

    public Optional<FetchError> getError() {
        return Optional.ofNullable(error);
    }
}

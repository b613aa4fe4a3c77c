package com.streamfirst.sheetgrid.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a failure reason. Used where a check reports its outcome instead of throwing.
 *
 * @param <T> the type of data returned on success
 */
@Value
@EqualsAndHashCode
public class Result<T> {

    boolean success;
    T data;
    String errorMessage;
    Optional<String> errorCode;

    private Result(boolean success, T data, String errorMessage, Optional<String> errorCode) {
        this.success = success;
        this.data = data;
        this.errorMessage = errorMessage;
        this.errorCode = errorCode;
    }

    public static <T> Result<T> success(@NonNull T data) {
        return new Result<>(true, data, null, Optional.empty());
    }

    /** Successful outcome of a check that produces no data. */
    public static Result<Void> ok() {
        return new Result<>(true, null, null, Optional.empty());
    }

    public static <T> Result<T> failure(String errorMessage) {
        return new Result<>(false, null, errorMessage, Optional.empty());
    }

    public static <T> Result<T> failure(String errorMessage, String errorCode) {
        return new Result<>(false, null, errorMessage, Optional.of(errorCode));
    }

    /** Returns the data, or throws the exception built from the failure message. */
    public <X extends RuntimeException> T orElseThrow(Function<String, X> exceptionFactory) {
        if (success) {
            return data;
        }
        throw exceptionFactory.apply(
                errorMessage + errorCode.map(code -> " (code: " + code + ")").orElse(""));
    }

    public <U> Result<U> map(Function<T, U> mapper) {
        if (success) {
            return Result.success(mapper.apply(data));
        }
        return new Result<>(false, null, errorMessage, errorCode);
    }

    public boolean isFailure() {
        return !success;
    }

    public Optional<T> getData() {
        return success ? Optional.ofNullable(data) : Optional.empty();
    }

    public Optional<String> getErrorMessage() {
        return success ? Optional.empty() : Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        if (success) {
            return "Result.success(" + data + ")";
        }
        return "Result.failure(" + errorMessage + errorCode.map(code -> ", code=" + code).orElse("") + ")";
    }
}

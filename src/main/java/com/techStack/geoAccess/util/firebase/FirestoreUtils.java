package com.techStack.geoAccess.util.firebase;

import com.google.api.core.ApiFuture;
import com.google.api.core.ApiFutureCallback;
import com.google.api.core.ApiFutures;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.techStack.geoAccess.exception.service.CustomException;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

public final class FirestoreUtils {

    private FirestoreUtils() {}

    public static <T> Mono<T> apiFutureToMono(ApiFuture<T> apiFuture) {
        CompletableFuture<T> completableFuture = new CompletableFuture<>();
        ApiFutures.addCallback(apiFuture, new ApiFutureCallback<>() {
            @Override
            public void onSuccess(T result) {
                completableFuture.complete(result);
            }

            @Override
            public void onFailure(Throwable t) {
                completableFuture.completeExceptionally(t);
            }
        }, Runnable::run);
        return Mono.fromFuture(completableFuture);
    }

    /**
     * Errors raised inside a transaction function surface wrapped by the client; this digs the
     * application exception back out so callers see a typed error.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof CustomException) {
                return current;
            }
            current = current.getCause();
        }
        return error;
    }

    /**
     * True when a {@code create()} failed because the document is already there.
     */
    public static boolean isAlreadyExists(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ApiException apiException
                    && apiException.getStatusCode().getCode() == StatusCode.Code.ALREADY_EXISTS) {
                return true;
            }
            if (current instanceof StatusRuntimeException statusException
                    && statusException.getStatus().getCode() == Status.Code.ALREADY_EXISTS) {
                return true;
            }
            if (current.getMessage() != null && current.getMessage().contains("ALREADY_EXISTS")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}

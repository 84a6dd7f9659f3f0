package com.insightreel.pipeline.client;

import com.insightreel.pipeline.exception.PermanentExternalException;
import com.insightreel.pipeline.exception.PipelineException;
import com.insightreel.pipeline.exception.TransientExternalException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Translates WebClient failures into the pipeline's transient/permanent split.
 */
public final class ExternalCallErrors {

    // retryable statuses below 500; every 5xx is retryable as well
    private static final Set<Integer> TRANSIENT_STATUS_CODES = Set.of(
            408, // Request Timeout
            429  // Too Many Requests
    );

    private ExternalCallErrors() {
    }

    public static boolean isTransientStatus(int statusCode) {
        return TRANSIENT_STATUS_CODES.contains(statusCode) || statusCode >= 500;
    }

    public static PipelineException translate(String provider, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof PipelineException pipelineException) {
            return pipelineException;
        }
        if (cause instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            String message = provider + " returned HTTP " + status + bodySnippet(responseException);
            return isTransientStatus(status)
                    ? new TransientExternalException(message, status, responseException)
                    : new PermanentExternalException(message, status, responseException);
        }
        if (cause instanceof WebClientRequestException || cause instanceof TimeoutException) {
            return new TransientExternalException(provider + " unreachable: " + cause.getMessage(), null, cause);
        }
        return new PermanentExternalException(provider + " call failed: " + cause.getMessage(), null, cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        // Mono.block() wraps checked exceptions in ReactiveException
        while (current.getCause() != null && !(current instanceof PipelineException)
                && !(current instanceof WebClientResponseException)
                && !(current instanceof WebClientRequestException)
                && !(current instanceof TimeoutException)) {
            current = current.getCause();
        }
        return current;
    }

    private static String bodySnippet(WebClientResponseException e) {
        String body = e.getResponseBodyAsString();
        if (body == null || body.isBlank()) {
            return "";
        }
        return ": " + (body.length() > 200 ? body.substring(0, 200) + "..." : body);
    }
}

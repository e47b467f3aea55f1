package fr.lapetina.thoughts.ai.domain.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import fr.lapetina.thoughts.ai.domain.model.ErrorKind;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw backend failures to an {@link ErrorKind} and each kind to a {@link Recovery}.
 *
 * <p>Stateless and thread-safe. Whether a {@link Recovery#TRY_NEXT_ONCE} has already been
 * used is tracked by the caller for the lifetime of one request.
 */
public final class ErrorClassifier {

    public Recovery recoveryFor(ErrorKind kind) {
        return switch (kind) {
            case RATE_LIMITED -> Recovery.RETRY_SAME_AFTER_BACKOFF;
            case TIMEOUT, UNAVAILABLE -> Recovery.TRY_NEXT;
            case INTERNAL_ERROR, MALFORMED_RESPONSE -> Recovery.TRY_NEXT_ONCE;
            case INVALID_INPUT, CONTEXT_OVERFLOW -> Recovery.ABORT;
        };
    }

    /**
     * Classifies a non-2xx HTTP answer.
     *
     * @param status HTTP status code
     * @param body   response body, may be null
     */
    public static ErrorKind fromHttpStatus(int status, String body) {
        return switch (status) {
            case 408, 504 -> ErrorKind.TIMEOUT;
            case 429 -> ErrorKind.RATE_LIMITED;
            case 413 -> ErrorKind.CONTEXT_OVERFLOW;
            case 400, 422 -> mentionsContextLimit(body) ? ErrorKind.CONTEXT_OVERFLOW : ErrorKind.INVALID_INPUT;
            case 401, 403, 404 -> ErrorKind.UNAVAILABLE;
            case 500 -> ErrorKind.INTERNAL_ERROR;
            default -> status > 500 ? ErrorKind.UNAVAILABLE : ErrorKind.INTERNAL_ERROR;
        };
    }

    /**
     * Classifies a transport or parsing exception, unwrapping async wrappers first.
     */
    public static ErrorKind fromThrowable(Throwable ex) {
        Throwable cause = unwrap(ex);

        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (cause instanceof JsonProcessingException) {
            return ErrorKind.MALFORMED_RESPONSE;
        }
        if (cause instanceof ConnectException || cause instanceof IOException) {
            return ErrorKind.UNAVAILABLE;
        }
        return ErrorKind.INTERNAL_ERROR;
    }

    static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean mentionsContextLimit(String body) {
        if (body == null) {
            return false;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        return lower.contains("context")
                || lower.contains("too long")
                || lower.contains("too many tokens")
                || lower.contains("maximum tokens")
                || lower.contains("prompt is too");
    }
}

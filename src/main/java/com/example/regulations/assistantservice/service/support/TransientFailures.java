package com.example.regulations.assistantservice.service.support;

import com.example.regulations.assistantservice.error.EmbeddingException;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failure from an external service is worth retrying.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class TransientFailures {

    public static boolean isTransient(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof EmbeddingException e) {
                return e.isTransientFailure();
            }
            if (t instanceof TimeoutException
                    || t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException
                    || t instanceof ConnectException
                    || t instanceof ResourceAccessException) {
                return true;
            }
            if (t instanceof RestClientResponseException r) {
                int status = r.getStatusCode().value();
                return status == 429 || status >= 500;
            }
            if (mentionsTransientCondition(t.getMessage())) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static boolean mentionsTransientCondition(String message) {
        if (message == null) {
            return false;
        }
        String m = message.toLowerCase(Locale.ROOT);
        return m.contains("429")
                || m.contains("rate limit")
                || m.contains("too many requests")
                || m.contains("timed out")
                || m.contains("timeout")
                || m.contains("503")
                || m.contains("temporarily unavailable");
    }
}

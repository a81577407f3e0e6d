package br.edu.ifba.socialgraph.source;

import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;

import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;

/**
 * Classifies error responses of the source REST clients.
 *
 * <ul>
 *   <li>408, 429 and 5xx are transient</li>
 *   <li>403 with {@code X-RateLimit-Remaining: 0} is GitHub's primary rate limit, also transient</li>
 *   <li>everything else is permanent</li>
 * </ul>
 */
public class SourceResponseExceptionMapper implements ResponseExceptionMapper<SourceHttpException> {

    @Override
    public SourceHttpException toThrowable(Response response) {
        int status = response.getStatus();
        boolean transientFailure = isTransient(status, response.getHeaderString("X-RateLimit-Remaining"));
        String reason = response.getStatusInfo() != null ? response.getStatusInfo().getReasonPhrase() : null;
        String message = "HTTP " + status + (reason != null && !reason.isBlank() ? " " + reason : "");
        return new SourceHttpException(status, message, transientFailure);
    }

    @Override
    public boolean handles(int status, MultivaluedMap<String, Object> headers) {
        return status >= 400;
    }

    static boolean isTransient(int status, String rateLimitRemaining) {
        if (status == 408 || status == 429 || status >= 500) {
            return true;
        }
        return status == 403 && "0".equals(rateLimitRemaining);
    }
}

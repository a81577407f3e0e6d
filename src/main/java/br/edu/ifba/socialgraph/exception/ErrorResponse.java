package br.edu.ifba.socialgraph.exception;

import jakarta.ws.rs.core.Response;

/**
 * RFC 7807 problem details body, served as {@code application/problem+json}.
 */
public record ErrorResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance
) {

    public static final String PROBLEM_JSON = "application/problem+json";

    public static Response toResponse(final Response.Status status, final String detail, final String path) {
        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            status.getReasonPhrase(),
            status.getStatusCode(),
            detail,
            path
        );
        return Response.status(status)
                .entity(error)
                .type(PROBLEM_JSON)
                .build();
    }
}

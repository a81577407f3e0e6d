package br.edu.ifba.socialgraph.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;

import jakarta.ws.rs.core.Response;

class SourceResponseExceptionMapperTest {

    private final SourceResponseExceptionMapper mapper = new SourceResponseExceptionMapper();

    @Test
    void testClassifiesStatuses() {
        assertTrue(SourceResponseExceptionMapper.isTransient(500, null));
        assertTrue(SourceResponseExceptionMapper.isTransient(503, null));
        assertTrue(SourceResponseExceptionMapper.isTransient(429, null));
        assertTrue(SourceResponseExceptionMapper.isTransient(408, null));
        assertFalse(SourceResponseExceptionMapper.isTransient(404, null));
        assertFalse(SourceResponseExceptionMapper.isTransient(400, null));
    }

    @Test
    void testGitHubPrimaryRateLimitIsTransient() {
        assertTrue(SourceResponseExceptionMapper.isTransient(403, "0"));
        assertFalse(SourceResponseExceptionMapper.isTransient(403, "42"));
        assertFalse(SourceResponseExceptionMapper.isTransient(403, null));
    }

    @Test
    void testHandlesOnlyErrors() {
        assertTrue(mapper.handles(404, null));
        assertTrue(mapper.handles(500, null));
        assertFalse(mapper.handles(200, null));
        assertFalse(mapper.handles(304, null));
    }

    @Test
    void testBuildsHttpException() {
        Response response = mock(Response.class);
        when(response.getStatus()).thenReturn(403);
        when(response.getHeaderString("X-RateLimit-Remaining")).thenReturn("0");

        SourceHttpException ex = mapper.toThrowable(response);

        assertEquals(403, ex.getStatus());
        assertTrue(ex.isTransient());
        assertFalse(ex.isNotFound());
        assertEquals("HTTP 403", ex.getMessage());
    }
}

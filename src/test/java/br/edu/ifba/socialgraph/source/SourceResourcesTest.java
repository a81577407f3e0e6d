package br.edu.ifba.socialgraph.source;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.exception.ErrorResponse;
import br.edu.ifba.socialgraph.ratelimit.RateLimitExceededException;
import br.edu.ifba.socialgraph.ratelimit.RateLimiterRegistry;
import br.edu.ifba.socialgraph.source.github.GitHubApiClient;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;

@QuarkusTest
class SourceResourcesTest {

    @InjectMock
    @RestClient
    GitHubApiClient gitHubClient;

    @InjectMock
    RateLimiterRegistry rateLimiters;

    @Test
    void testResolvesWithoutStoring() throws Exception {
        when(gitHubClient.getUser(eq("octocat"), any()))
            .thenReturn(new ObjectMapper().readTree("{\"login\":\"octocat\",\"name\":\"The Octocat\"}"));

        given()
            .queryParam("reference", "octocat")
            .when()
            .get("/api/v1/sources/github/resolve")
            .then()
            .statusCode(200)
            .body("entity_id", equalTo("octocat"))
            .body("display_name", equalTo("The Octocat"))
            .body("entity_type", equalTo("user"));
    }

    @Test
    void testUnknownEntityIsNotFound() {
        when(gitHubClient.getUser(eq("ghost"), any())).thenThrow(new SourceHttpException(404, "HTTP 404", false));

        given()
            .queryParam("reference", "ghost")
            .when()
            .get("/api/v1/sources/github/resolve")
            .then()
            .statusCode(404)
            .contentType(ErrorResponse.PROBLEM_JSON)
            .body("detail", containsString("ghost"));
    }

    @Test
    void testFailingSourceIsBadGateway() {
        when(gitHubClient.getUser(eq("down"), any())).thenThrow(new SourceHttpException(503, "HTTP 503", true));

        given()
            .queryParam("reference", "down")
            .when()
            .get("/api/v1/sources/github/resolve")
            .then()
            .statusCode(502)
            .contentType(ErrorResponse.PROBLEM_JSON);

        verify(gitHubClient, times(SourceGateway.MAX_ATTEMPTS)).getUser(eq("down"), any());
    }

    @Test
    void testRejectsBadInput() {
        given()
            .when()
            .get("/api/v1/sources/github/resolve")
            .then()
            .statusCode(400);

        given()
            .queryParam("reference", "x")
            .when()
            .get("/api/v1/sources/myspace/resolve")
            .then()
            .statusCode(400);
    }

    @Test
    void testExhaustedRateLimitIsTooManyRequests() {
        doThrow(new RateLimitExceededException(SourceType.GITHUB, Duration.ofSeconds(30)))
            .when(rateLimiters).acquire(SourceType.GITHUB);

        given()
            .queryParam("reference", "octocat")
            .when()
            .get("/api/v1/sources/github/resolve")
            .then()
            .statusCode(429)
            .header("Retry-After", equalTo("30"))
            .contentType(ErrorResponse.PROBLEM_JSON);

        verify(gitHubClient, times(0)).getUser(any(), any());
    }
}

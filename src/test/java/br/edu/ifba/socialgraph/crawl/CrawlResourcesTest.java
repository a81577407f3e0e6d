package br.edu.ifba.socialgraph.crawl;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.util.UUID;

import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import br.edu.ifba.socialgraph.exception.ErrorResponse;
import br.edu.ifba.socialgraph.source.github.GitHubApiClient;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;

@QuarkusTest
class CrawlResourcesTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @InjectMock
    @RestClient
    GitHubApiClient gitHubClient;

    private void stubUserWithFollower(String login, String follower) throws Exception {
        when(gitHubClient.getUser(eq(login), any())).thenReturn(MAPPER.readTree("{\"login\":\"" + login + "\"}"));
        when(gitHubClient.getUserRepositories(eq(login), anyInt(), any(), any())).thenReturn(MAPPER.readTree("[]"));
        when(gitHubClient.getFollowers(eq(login), anyInt(), any()))
            .thenReturn(MAPPER.readTree("[{\"login\":\"" + follower + "\"}]"));
    }

    private String startCrawl(String login) {
        return given()
            .contentType(ContentType.JSON)
            .body("{\"source\":\"github\",\"start_entity\":\"" + login + "\",\"depth\":1,\"max_entities\":10}")
            .when()
            .post("/api/v1/crawl/jobs")
            .then()
            .statusCode(202)
            .extract()
            .path("id");
    }

    @Test
    void testStartAndPollUntilCompleted() throws Exception {
        String login = "crawl-" + UUID.randomUUID().toString().substring(0, 8);
        stubUserWithFollower(login, login + "-fan");

        String id = given()
            .contentType(ContentType.JSON)
            .body("{\"source\":\"github\",\"start_entity\":\"" + login + "\",\"depth\":1,\"max_entities\":10}")
            .when()
            .post("/api/v1/crawl/jobs")
            .then()
            .statusCode(202)
            .header("Location", containsString("/api/v1/crawl/jobs/"))
            .body("source", equalTo("github"))
            .body("start_entity", equalTo(login))
            .body("depth", equalTo(1))
            .body("created_at", notNullValue())
            .extract()
            .path("id");

        given()
            .queryParam("wait", 10)
            .when()
            .get("/api/v1/crawl/jobs/" + id)
            .then()
            .statusCode(200)
            .body("status", equalTo("completed"))
            .body("entity_count", equalTo(2))
            .body("edge_count", equalTo(1));

        given()
            .queryParam("status", "completed")
            .queryParam("source", "github")
            .when()
            .get("/api/v1/crawl/jobs")
            .then()
            .statusCode(200)
            .body("total", greaterThanOrEqualTo(1))
            .body("page", equalTo(1))
            .body("page_size", equalTo(20));
    }

    @Test
    void testCancelFinishedJobConflicts() throws Exception {
        String login = "done-" + UUID.randomUUID().toString().substring(0, 8);
        stubUserWithFollower(login, login + "-fan");
        String id = startCrawl(login);

        given().queryParam("wait", 10).when().get("/api/v1/crawl/jobs/" + id).then()
            .body("status", equalTo("completed"));

        given()
            .when()
            .delete("/api/v1/crawl/jobs/" + id)
            .then()
            .statusCode(409)
            .contentType(ErrorResponse.PROBLEM_JSON)
            .body("status", equalTo(409));
    }

    @Test
    void testUnresolvableSeedFailsJob() {
        String id = startCrawl("nobody-" + UUID.randomUUID().toString().substring(0, 8));

        given()
            .queryParam("wait", 10)
            .when()
            .get("/api/v1/crawl/jobs/" + id)
            .then()
            .statusCode(200)
            .body("status", equalTo("failed"))
            .body("error_message", containsString("Could not resolve start entity"));
    }

    @Test
    void testRejectsInvalidRequests() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"source\":\"github\",\"start_entity\":\"octocat\",\"depth\":9}")
            .when()
            .post("/api/v1/crawl/jobs")
            .then()
            .statusCode(400);

        given()
            .contentType(ContentType.JSON)
            .body("{\"source\":\"github\",\"start_entity\":\"  \"}")
            .when()
            .post("/api/v1/crawl/jobs")
            .then()
            .statusCode(400);

        given()
            .contentType(ContentType.JSON)
            .body("{\"start_entity\":\"octocat\"}")
            .when()
            .post("/api/v1/crawl/jobs")
            .then()
            .statusCode(400);

        given()
            .queryParam("page_size", 0)
            .when()
            .get("/api/v1/crawl/jobs")
            .then()
            .statusCode(400)
            .contentType(ErrorResponse.PROBLEM_JSON);
    }

    @Test
    void testUnknownAndMalformedIds() {
        given()
            .when()
            .get("/api/v1/crawl/jobs/" + UUID.randomUUID())
            .then()
            .statusCode(404)
            .contentType(ErrorResponse.PROBLEM_JSON)
            .body("title", equalTo("Not Found"));

        given()
            .when()
            .get("/api/v1/crawl/jobs/not-a-uuid")
            .then()
            .statusCode(400);

        given()
            .when()
            .delete("/api/v1/crawl/jobs/" + UUID.randomUUID())
            .then()
            .statusCode(404);

        given()
            .queryParam("wait", 61)
            .when()
            .get("/api/v1/crawl/jobs/" + UUID.randomUUID())
            .then()
            .statusCode(400);
    }
}

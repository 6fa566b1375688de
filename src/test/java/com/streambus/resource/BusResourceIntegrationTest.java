package com.streambus.resource;

import com.streambus.store.LogStore;
import com.streambus.store.LogStoreFacade;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;

@QuarkusTest
class BusResourceIntegrationTest {

    @Inject
    LogStoreFacade logStore;

    @Test
    void testPublish_ReturnsCreatedWithEntryId() {
        given()
            .contentType(ContentType.JSON)
            .body(message("m1"))
        .when()
            .post("/v1/bus/streams/it-publish/messages")
        .then()
            .statusCode(201)
            .body("stream", equalTo("it-publish"))
            .body("entryId", notNullValue());
    }

    @Test
    void testPublish_InvalidMessageReturnsBadRequest() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"id\":\"m1\",\"source\":\"svc-a\"}")
        .when()
            .post("/v1/bus/streams/it-invalid/messages")
        .then()
            .statusCode(400);
    }

    @Test
    void testListStreams_IncludesPublishedStream() {
        publish("it-list", "m1");

        given()
        .when()
            .get("/v1/bus/streams")
        .then()
            .statusCode(200)
            .body("$", hasItem("it-list"));
    }

    @Test
    void testStreamInfo_ReturnsLength() {
        publish("it-info", "m1");
        publish("it-info", "m2");

        given()
        .when()
            .get("/v1/bus/streams/it-info")
        .then()
            .statusCode(200)
            .body("stream", equalTo("it-info"))
            .body("length", equalTo(2));
    }

    @Test
    void testStreamInfo_UnknownStreamReturnsNotFound() {
        given()
        .when()
            .get("/v1/bus/streams/it-missing")
        .then()
            .statusCode(404)
            .body("code", equalTo("STREAM_NOT_FOUND"));
    }

    @Test
    void testTrim_KeepsAtMostMaxLen() {
        for (int i = 0; i < 5; i++) {
            publish("it-trim", "m" + i);
        }

        given()
            .queryParam("maxLen", 2)
        .when()
            .post("/v1/bus/streams/it-trim/trim")
        .then()
            .statusCode(200)
            .body("maxLen", equalTo(2))
            .body("trimmed", greaterThanOrEqualTo(0));

        given()
        .when()
            .get("/v1/bus/streams/it-trim")
        .then()
            .statusCode(200)
            .body("length", lessThanOrEqualTo(2));
    }

    @Test
    void testTrim_NegativeMaxLenReturnsBadRequest() {
        given()
            .queryParam("maxLen", -1)
        .when()
            .post("/v1/bus/streams/it-trim-bad/trim")
        .then()
            .statusCode(400)
            .body("code", equalTo("INVALID_MAX_LEN"));
    }

    @Test
    void testPending_ListsUnacknowledgedEntries() {
        logStore.createGroup("it-pending", "g1", "0");
        publish("it-pending", "m1");
        logStore.readGroup("it-pending", "g1", "c1", 10, 0, LogStore.NEW_ENTRIES);

        given()
        .when()
            .get("/v1/bus/streams/it-pending/groups/g1/pending")
        .then()
            .statusCode(200)
            .body("size()", equalTo(1))
            .body("[0].consumer", equalTo("c1"));
    }

    @Test
    void testPending_UnknownGroupReturnsNotFound() {
        given()
        .when()
            .get("/v1/bus/streams/it-nogroup/groups/missing/pending")
        .then()
            .statusCode(404)
            .body("code", equalTo("GROUP_NOT_FOUND"))
            .body("stream", equalTo("it-nogroup"));
    }

    @Test
    void testMetrics_CountsPublishedMessages() {
        publish("it-metrics", "m1");

        given()
        .when()
            .get("/v1/bus/metrics")
        .then()
            .statusCode(200)
            .body("messagesSent", greaterThanOrEqualTo(1))
            .body("activeConsumers", notNullValue());
    }

    @Test
    void testHealthEndpoint_ReturnsOk() {
        given()
        .when()
            .get("/v1/bus/health")
        .then()
            .statusCode(200)
            .body("status", equalTo("UP"))
            .body("details.store.healthy", equalTo(true));
    }

    @Test
    void testReadinessEndpoint() {
        given()
        .when()
            .get("/health/ready")
        .then()
            .statusCode(200)
            .body("checks.name", hasItem("message-bus"));
    }

    private static void publish(String stream, String id) {
        given()
            .contentType(ContentType.JSON)
            .body(message(id))
        .when()
            .post("/v1/bus/streams/" + stream + "/messages")
        .then()
            .statusCode(201);
    }

    private static String message(String id) {
        return "{\"id\":\"" + id + "\",\"type\":\"order\",\"source\":\"svc-a\",\"data\":{\"amount\":42}}";
    }
}

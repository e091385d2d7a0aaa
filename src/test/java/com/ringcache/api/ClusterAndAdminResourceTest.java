package com.ringcache.api;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.notNullValue;

@QuarkusTest
class ClusterAndAdminResourceTest
{
    @Nested
    class ClusterEndpoints
    {
        // Bu test üyelik görünümünün yerel düğümü canlı olarak listelediğini doğrular.
        @Test
        void membersListsLocalNode()
        {
            given()
                    .when()
                    .get("/cluster/members")
                    .then()
                    .statusCode(200)
                    .body("localNodeId", equalTo("test-node"))
                    .body("ringNodes", equalTo(1))
                    .body("members.id", hasItem("test-node"))
                    .body("members[0].state", equalTo("ALIVE"));
        }

        // Bu test bir anahtarın sahibinin yerel düğüm olarak raporlandığını gösterir.
        @Test
        void routeReportsOwner()
        {
            given()
                    .when()
                    .get("/cluster/route/some-key")
                    .then()
                    .statusCode(200)
                    .body("key", equalTo("some-key"))
                    .body("ownerId", equalTo("test-node"))
                    .body("local", equalTo(true));
        }
    }

    @Nested
    class AdminEndpoints
    {
        // Bu test doğrulama raporunun JSON olarak döndüğünü doğrular.
        @Test
        void verifyReturnsReport()
        {
            given().when().post("/set/admin-key/admin-value").then().statusCode(200);

            given()
                    .when()
                    .get("/admin/verify")
                    .then()
                    .statusCode(200)
                    .body("indexedEntries", greaterThanOrEqualTo(1))
                    .body("missingBacking", equalTo(0));
        }

        // Bu test yazılan anahtarın meta verisinin boyutu içerdiğini gösterir.
        @Test
        void metadataOfWrittenKey()
        {
            given().when().post("/set/meta-key/12345").then().statusCode(200);

            given()
                    .when()
                    .get("/admin/metadata/meta-key")
                    .then()
                    .statusCode(200)
                    .body("sizeBytes", equalTo(5))
                    .body("createdAt", notNullValue());

            given().when().get("/admin/metadata/no-such-meta-key").then().statusCode(404);
        }

        // Bu test istatistiklerin sayaç değerlerini içerdiğini doğrular.
        @Test
        void statsExposeCounters()
        {
            given().when().post("/set/stats-key/v").then().statusCode(200);

            given()
                    .when()
                    .get("/admin/stats")
                    .then()
                    .statusCode(200)
                    .body("entries", greaterThanOrEqualTo(1))
                    .body("counters.cache_writes", greaterThanOrEqualTo(1));
        }
    }
}

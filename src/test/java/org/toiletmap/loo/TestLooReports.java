package org.toiletmap.loo;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.toiletmap.test.AbstractTest;
import org.toiletmap.test.TestUtils;

import io.restassured.RestAssured;

class TestLooReports extends AbstractTest {

	@Test
	void testReportsListEveryContribution() {
		var creator = test.contributor();
		var editor = test.contributor();
		var body = TestLooMutations.looBody("Bus station", 51.45, -2.58);
		var response = creator.post("/api/loos", body);
		assertThat(response.statusCode()).isEqualTo(201);
		String id = response.jsonPath().getString("id");

		body.remove("notes");
		body.put("name", "Bus station (east)");
		assertThat(editor.put("/api/loos/" + id, body).statusCode()).isEqualTo(200);

		response = RestAssured.given().get("/api/loos/" + id + "/reports");
		assertThat(response.statusCode()).isEqualTo(200);
		var json = response.jsonPath();
		assertThat(json.getInt("count")).isEqualTo(2);

		assertThat(json.getString("data[0].contributor")).isEqualTo(creator.getNickname());
		assertThat(json.getMap("data[0].diff")).containsKeys("name", "location", "active", "noPayment", "notes")
		.doesNotContainKeys("id", "men", "contributors", "updatedAt", "openingTimes");
		assertThat(json.getString("data[0].diff.name.previous")).isNull();
		assertThat(json.getString("data[0].diff.name.current")).isEqualTo("Bus station");
		assertThat(json.getDouble("data[0].diff.location.current.lat")).isEqualTo(51.45);

		assertThat(json.getString("data[1].contributor")).isEqualTo(editor.getNickname());
		assertThat(json.getMap("data[1].diff")).containsOnlyKeys("name", "notes");
		assertThat(json.getString("data[1].diff.name.previous")).isEqualTo("Bus station");
		assertThat(json.getString("data[1].diff.name.current")).isEqualTo("Bus station (east)");
		assertThat(json.getString("data[1].diff.notes.previous")).isEqualTo("Behind the station");
		assertThat(json.getString("data[1].diff.notes.current")).isNull();
		assertThat(json.getLong("data[1].createdAt")).isGreaterThanOrEqualTo(json.getLong("data[0].createdAt"));
		assertThat(json.getLong("data[1].id")).isGreaterThan(json.getLong("data[0].id"));
	}

	@Test
	void testRejectedContributionsAreNotReported() {
		var contributor = test.contributor();
		String id = test.looId();
		assertThat(contributor.put("/api/loos/" + id, TestLooMutations.looBody("Pier", 50.8, -0.14)).statusCode()).isEqualTo(201);
		var body = TestLooMutations.looBody("Pier again", 50.8, -0.14);
		body.put("id", id);
		TestUtils.expectError(test.contributor().post("/api/loos", body), 409, "loo-exists");

		var json = RestAssured.given().get("/api/loos/" + id + "/reports").jsonPath();
		assertThat(json.getInt("count")).isEqualTo(1);
		assertThat(json.getString("data[0].contributor")).isEqualTo(contributor.getNickname());
	}

	@Test
	void testReportsOfUnknownLoo() {
		TestUtils.expectError(RestAssured.given().get("/api/loos/" + test.looId() + "/reports"), 404, "loo-not-found");
		TestUtils.expectError(RestAssured.given().get("/api/loos/short/reports"), 400, "invalid-id");
	}

}

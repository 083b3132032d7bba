package org.toiletmap.health;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.toiletmap.global.ToiletMapUtils;
import org.toiletmap.test.AbstractTest;

import io.restassured.RestAssured;

class TestHealth extends AbstractTest {

	@Test
	void testLive() {
		var response = RestAssured.given().get("/api/health/live");
		assertThat(response.statusCode()).isEqualTo(200);
		var health = response.getBody().as(HealthController.HealthResponse.class);
		assertThat(health.getStatus()).isEqualTo("ok");
		assertThat(health.getService()).isEqualTo(ToiletMapUtils.SERVICE_NAME);
		assertThat(Instant.parse(health.getTimestamp())).isBeforeOrEqualTo(Instant.now());
	}

	@Test
	void testReady() {
		var response = RestAssured.given().get("/api/health/ready");
		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.getBody().jsonPath().getString("status")).isEqualTo("ok");
	}

	@Test
	void testUnknownRoute() {
		var response = RestAssured.given().get("/api/health/unknown");
		assertThat(response.statusCode()).isEqualTo(404);
	}

}

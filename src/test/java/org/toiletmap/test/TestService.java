package org.toiletmap.test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import org.apache.commons.lang3.RandomStringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.toiletmap.global.ToiletMapUtils;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;

import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import io.restassured.specification.RequestSpecification;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Service
public class TestService {

	public static final String JWT_SECRET = "test-secret";
	public static final String PROFILE_CLAIM = "https://toiletmap.org.uk/profile";

	@Value("${toiletmap.jwt.validity:60m}")
	private Duration validity;

	/** 24 random hexadecimal characters. */
	public String looId() {
		return RandomStringUtils.random(ToiletMapUtils.LOO_ID_LENGTH, "0123456789abcdef");
	}

	/** A contributor identified by the nickname claim. */
	public TestContributor contributor() {
		String nickname = "contributor-" + RandomStringUtils.randomAlphanumeric(8);
		return new TestContributor(nickname, token(nickname, Map.of("nickname", nickname)));
	}

	public String token(String subject, Map<String, Object> claims) {
		var builder = JWT.create()
		.withSubject(subject)
		.withIssuedAt(Instant.now())
		.withExpiresAt(Instant.now().plus(validity));
		for (var claim : claims.entrySet()) {
			if (claim.getValue() instanceof Map<?, ?> map) {
				Map<String, Object> values = new HashMap<>();
				map.forEach((k, v) -> values.put(k.toString(), v));
				builder = builder.withClaim(claim.getKey(), values);
			} else {
				builder = builder.withClaim(claim.getKey(), claim.getValue().toString());
			}
		}
		return builder.sign(Algorithm.HMAC512(JWT_SECRET));
	}

	@Getter
	@AllArgsConstructor
	public static class TestContributor {
		private final String nickname;
		private final String token;

		public RequestSpecification request() {
			return RestAssured.given().header("Authorization", "Bearer " + token);
		}

		public Response post(String path, Object body) {
			return request().contentType(ContentType.JSON).body(body).post(path);
		}

		public Response put(String path, Object body) {
			return request().contentType(ContentType.JSON).body(body).put(path);
		}

		public Response get(String path) {
			return request().get(path);
		}
	}

}

package org.toiletmap.health;

import java.time.Instant;

import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.toiletmap.global.ToiletMapUtils;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

	public static final String STATUS_OK = "ok";
	public static final String STATUS_ERROR = "error";

	private final R2dbcEntityTemplate r2dbc;

	@GetMapping("/live")
	public Mono<HealthResponse> live() {
		return Mono.fromSupplier(() -> new HealthResponse(STATUS_OK, ToiletMapUtils.SERVICE_NAME, Instant.now().toString()));
	}

	/** Ready when the database answers. */
	@GetMapping("/ready")
	public Mono<ResponseEntity<HealthResponse>> ready() {
		return r2dbc.getDatabaseClient().sql("SELECT 1").map((row, meta) -> row.get(0, Integer.class)).first()
		.map(r -> ResponseEntity.ok(new HealthResponse(STATUS_OK, ToiletMapUtils.SERVICE_NAME, Instant.now().toString())))
		.onErrorResume(error -> {
			log.warn("Database not ready: {}", error.getMessage());
			return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new HealthResponse(STATUS_ERROR, ToiletMapUtils.SERVICE_NAME, Instant.now().toString())));
		});
	}

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	public static class HealthResponse {
		private String status;
		private String service;
		private String timestamp;
	}

}

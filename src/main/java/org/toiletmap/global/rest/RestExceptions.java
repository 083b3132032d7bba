package org.toiletmap.global.rest;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.core.MethodParameter;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.MissingRequestValueException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import org.toiletmap.global.exceptions.ToiletMapException;
import org.toiletmap.global.exceptions.ValidationUtils;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@RestControllerAdvice
@Slf4j
public class RestExceptions {

	public static final String INVALID_BODY = "invalid-body";
	public static final String INVALID_BODY_MESSAGE = "Invalid request body";

	@ExceptionHandler(ToiletMapException.class)
	public Mono<ResponseEntity<ApiError>> handleToiletMapError(ToiletMapException error, ServerWebExchange exchange) {
		log.warn("Error returned by {} {}: {} - {} - {}", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getClass().getSimpleName(), error.getErrorCode(), error.getMessage());
		return Mono.fromSupplier(() -> ResponseEntity.status(error.getStatus()).body(error.toApiError()));
	}

	@ExceptionHandler(WebExchangeBindException.class)
	public Mono<ResponseEntity<ApiError>> handleBindError(WebExchangeBindException error, ServerWebExchange exchange) {
		Map<String, String> details = new LinkedHashMap<>();
		error.getFieldErrors().forEach(fe -> details.putIfAbsent(fe.getField(), fe.getDefaultMessage()));
		ApiError result = new ApiError(400, INVALID_BODY, INVALID_BODY_MESSAGE, details.isEmpty() ? null : details);
		log.warn("Invalid body sent to {} {}: {}", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), details);
		return Mono.fromSupplier(() -> ResponseEntity.status(400).body(result));
	}

	@ExceptionHandler(MissingRequestValueException.class)
	public Mono<ResponseEntity<ApiError>> handleMissingValue(MissingRequestValueException error, ServerWebExchange exchange) {
		ApiError result = new ApiError(400, ValidationUtils.MISSING_PREFIX + error.getName(), error.getName() + " is required");
		log.warn("Missing input for {} {}: {}", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getName());
		return Mono.fromSupplier(() -> ResponseEntity.status(400).body(result));
	}

	@ExceptionHandler(ServerWebInputException.class)
	public Mono<ResponseEntity<ApiError>> handleInputError(ServerWebInputException error, ServerWebExchange exchange) {
		ApiError result;
		MethodParameter parameter = error.getMethodParameter();
		if (parameter == null || parameter.hasParameterAnnotation(RequestBody.class)) {
			result = new ApiError(400, INVALID_BODY, INVALID_BODY_MESSAGE);
		} else {
			String parameterName = getParameterName(parameter);
			result = new ApiError(400, ValidationUtils.INVALID_PREFIX + parameterName, "Invalid " + parameterName);
		}
		log.warn("Input error returned by {} {}: 400 - {} => {}", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getMessage(), result);
		return Mono.fromSupplier(() -> ResponseEntity.status(400).body(result));
	}

	private String getParameterName(MethodParameter p) {
		PathVariable pv = p.getParameterAnnotation(PathVariable.class);
		if (pv != null && !pv.name().isBlank()) return pv.name();
		RequestParam rp = p.getParameterAnnotation(RequestParam.class);
		if (rp != null && !rp.name().isBlank()) return rp.name();
		return p.getParameterName() != null ? p.getParameterName() : "input";
	}

	@ExceptionHandler(ErrorResponseException.class)
	public Mono<ResponseEntity<ApiError>> handleFrameworkError(ErrorResponseException error, ServerWebExchange exchange) {
		int status = error.getStatusCode().value();
		var body = error.getBody();
		var result = new ApiError(status, body.getTitle(), body.getDetail());
		log.warn("Framework error returned by {} {}: {} - {} => {}", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getClass().getSimpleName(), status, result);
		return Mono.fromSupplier(() -> ResponseEntity.status(status).body(result));
	}

	@ExceptionHandler(DuplicateKeyException.class)
	public Mono<ResponseEntity<ApiError>> handleDuplicateKey(DuplicateKeyException error, ServerWebExchange exchange) {
		log.warn("Duplicate key on {} {}: {}", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getMessage());
		return Mono.fromSupplier(() -> ResponseEntity.status(409).body(new ApiError(409, "conflict", "Resource already exists")));
	}

	@ExceptionHandler(Exception.class)
	public Mono<ResponseEntity<ApiError>> handleOtherError(Exception error, ServerWebExchange exchange) {
		log.error("Unexpected error returned by {} {}: {} - {}", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getClass().getSimpleName(), error.getMessage(), error);
		return Mono.fromSupplier(() -> ResponseEntity.status(500).body(new ApiError(500, "internal-error", "Internal server error")));
	}

}

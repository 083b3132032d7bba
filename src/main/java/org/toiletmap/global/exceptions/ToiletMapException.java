package org.toiletmap.global.exceptions;

import org.springframework.http.HttpStatus;
import org.toiletmap.global.rest.ApiError;

import lombok.Getter;

/** Base of the errors answered to the client with a stable error code. */
@Getter
public abstract class ToiletMapException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final HttpStatus status;
	private final String errorCode;

	protected ToiletMapException(HttpStatus status, String errorCode, String message) {
		super(message);
		this.status = status;
		this.errorCode = errorCode;
	}

	public ApiError toApiError() {
		return new ApiError(status.value(), errorCode, getMessage());
	}

}

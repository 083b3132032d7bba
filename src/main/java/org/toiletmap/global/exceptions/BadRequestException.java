package org.toiletmap.global.exceptions;

import org.springframework.http.HttpStatus;

public class BadRequestException extends ToiletMapException {

	private static final long serialVersionUID = 1L;

	public BadRequestException(String errorCode, String message) {
		super(HttpStatus.BAD_REQUEST, errorCode, message);
	}

}

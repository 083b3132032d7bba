package org.toiletmap.global.exceptions;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends ToiletMapException {

	private static final long serialVersionUID = 1L;

	public UnauthorizedException() {
		super(HttpStatus.UNAUTHORIZED, "unauthorized", "You must authenticate");
	}

}

package org.toiletmap.global.exceptions;

import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;

public class ConflictException extends ToiletMapException {

	private static final long serialVersionUID = 1L;

	public ConflictException(String type, String item) {
		super(HttpStatus.CONFLICT, type + "-exists", StringUtils.capitalize(type) + " with id " + item + " already exists");
	}

}

package org.toiletmap.global.rest;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

	private int httpCode;
	private String errorCode;
	private String errorMessage;
	/** Field name to validation message, only for invalid request bodies. */
	private Map<String, String> details;

	public ApiError(int httpCode, String errorCode, String errorMessage) {
		this(httpCode, errorCode, errorMessage, null);
	}

}

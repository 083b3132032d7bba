package org.toiletmap.global.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;
import lombok.NoArgsConstructor;

/** A complete list, with its size first so clients can allocate before reading the data. */
@Data
@NoArgsConstructor
@JsonPropertyOrder({"count", "data"})
public class ListResponse<T> {

	private int count;
	private List<T> data;

	public ListResponse(List<T> data) {
		this.data = data;
		this.count = data.size();
	}

}

package org.toiletmap.loo.dto;

import org.toiletmap.loo.SearchFlag;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LooSearchCriteria {

	public static final int MAX_SEARCH_LENGTH = 200;

	private String search;
	private SearchFlag active;
	private SearchFlag accessible;
	private SearchFlag allGender;
	private SearchFlag radar;
	private SearchFlag babyChange;
	private SearchFlag noPayment;
	/** TRUE for loos having a verification date. */
	private SearchFlag verified;
	/** TRUE for loos having a location. */
	private SearchFlag hasLocation;

}

package org.toiletmap.loo.dto;

import java.util.List;

import org.toiletmap.loo.Amenities;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Loo implements Amenities {

	private String id;
	private String name;
	private Coordinates location;
	private String geohash;
	private boolean active;

	private Boolean accessible;
	private Boolean noPayment;
	private Boolean allGender;
	private Boolean babyChange;
	private Boolean men;
	private Boolean women;
	private Boolean children;
	private Boolean automatic;
	private Boolean attended;
	private Boolean radar;
	private Boolean urinalOnly;

	private String notes;
	private String paymentDetails;
	private String removalReason;
	private List<List<String>> openingTimes;

	private Long verifiedAt;
	private long createdAt;
	private long updatedAt;

	/** Oldest first, the last one made the latest change. */
	private List<String> contributors;

}

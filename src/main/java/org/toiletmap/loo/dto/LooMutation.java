package org.toiletmap.loo.dto;

import java.util.List;

import org.toiletmap.loo.Amenities;
import org.toiletmap.loo.OpeningTimes;

import com.fasterxml.jackson.annotation.JsonIgnore;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Complete content of a loo sent by a contributor.
 * Every attribute replaces the stored one, an absent attribute clears it, except <code>active</code> which defaults to true.
 */
@Data
@NoArgsConstructor
public class LooMutation implements Amenities {

	public static final int MAX_NAME_LENGTH = 200;
	public static final int MAX_TEXT_LENGTH = 2000;

	@Size(max = MAX_NAME_LENGTH)
	private String name;
	@Valid
	private Coordinates location;
	private Boolean active;

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

	@Size(max = MAX_TEXT_LENGTH)
	private String notes;
	@Size(max = MAX_TEXT_LENGTH)
	private String paymentDetails;
	@Size(max = MAX_TEXT_LENGTH)
	private String removalReason;

	/** Null when unknown. */
	private List<List<String>> openingTimes;

	private Boolean verified;

	@JsonIgnore
	@AssertTrue(message = "openingTimes must have 7 days, each [] when closed or [\"HH:mm\", \"HH:mm\"] opening before closing")
	public boolean isOpeningTimesValid() {
		return OpeningTimes.isValid(openingTimes);
	}

}

package org.toiletmap.loo;

/** The amenity flags of a loo, null meaning unknown. */
public interface Amenities {

	Boolean getAccessible();

	Boolean getNoPayment();

	Boolean getAllGender();

	Boolean getBabyChange();

	Boolean getMen();

	Boolean getWomen();

	Boolean getChildren();

	Boolean getAutomatic();

	Boolean getAttended();

	Boolean getRadar();

	Boolean getUrinalOnly();

}

package org.toiletmap.loo.db;

import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;
import org.springframework.data.relational.core.sql.Column;
import org.toiletmap.loo.Amenities;

import io.r2dbc.postgresql.codec.Json;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Table("loos")
@Data
@AllArgsConstructor
@NoArgsConstructor
public class LooEntity implements Amenities {

	@Id
	private String id;

	private String name;
	private Double latitude;
	private Double longitude;
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
	/** Seven days from Monday, each <code>[]</code> when closed or <code>["HH:mm", "HH:mm"]</code>. Null when unknown. */
	private Json openingTimes;

	private Long verifiedAt;
	private long createdAt;
	private long updatedAt;

	private List<String> contributors;

	public static final org.springframework.data.relational.core.sql.Table TABLE = org.springframework.data.relational.core.sql.Table.create("loos");
	public static final Column COL_ID = Column.create("id", TABLE);
	public static final Column COL_NAME = Column.create("name", TABLE);
	public static final Column COL_GEOHASH = Column.create("geohash", TABLE);
	public static final Column COL_ACTIVE = Column.create("active", TABLE);
	public static final Column COL_ACCESSIBLE = Column.create("accessible", TABLE);
	public static final Column COL_NO_PAYMENT = Column.create("no_payment", TABLE);
	public static final Column COL_ALL_GENDER = Column.create("all_gender", TABLE);
	public static final Column COL_BABY_CHANGE = Column.create("baby_change", TABLE);
	public static final Column COL_RADAR = Column.create("radar", TABLE);
	public static final Column COL_NOTES = Column.create("notes", TABLE);
	public static final Column COL_VERIFIED_AT = Column.create("verified_at", TABLE);
	public static final Column COL_CREATED_AT = Column.create("created_at", TABLE);
	public static final Column COL_UPDATED_AT = Column.create("updated_at", TABLE);
	public static final Column COL_CONTRIBUTORS = Column.create("contributors", TABLE);

}

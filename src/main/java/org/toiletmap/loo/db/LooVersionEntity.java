package org.toiletmap.loo.db;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import io.r2dbc.postgresql.codec.Json;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** State of a loo right after a contributor created or replaced it. */
@Table("loo_versions")
@Data
@AllArgsConstructor
@NoArgsConstructor
public class LooVersionEntity {

	@Id
	private Long id;

	private String looId;
	private String contributor;
	private long createdAt;
	private Json snapshot;

}

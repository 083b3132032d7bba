package org.toiletmap.loo.dto;

import org.toiletmap.global.ToiletMapUtils;

import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CreateLooRequest extends LooMutation {

	/** Optional, generated when absent. */
	@Size(min = ToiletMapUtils.LOO_ID_LENGTH, max = ToiletMapUtils.LOO_ID_LENGTH)
	private String id;

}

package org.toiletmap.loo.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LooUpdates {

	private long since;
	/** Latest update time among the returned loos, to be sent back as the next <code>since</code>. */
	private long until;
	private List<DumpRow> upserted;
	private List<String> deleted;

}

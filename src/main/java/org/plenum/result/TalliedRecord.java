package org.plenum.result;

import lombok.Value;
import org.plenum.tally.TallyResult;

/** A tally together with its public record and the rendered JSON */
@Value
public class TalliedRecord {
	TallyResult tally;
	BallotResultRecord record;
	String json;

	public String getSha256() {
		return ResultRecordService.sha256(json);
	}
}

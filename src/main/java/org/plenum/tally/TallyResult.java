package org.plenum.tally;

import lombok.Value;

import java.util.List;

/**
 * Everything that was calculated when a ballot was tallied.
 */
@Value
public class TallyResult {
	BallotSpec ballot;
	Matrix duelMatrix;
	PreferencePartition result;
	ResultStatistics statistics;

	public String getResultString() {
		return result.toVoteString();
	}

	public List<String> getWinners() {
		return result.getLevels().get(0);
	}
}

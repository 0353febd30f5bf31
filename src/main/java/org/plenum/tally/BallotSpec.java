package org.plenum.tally;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything the tallying engine needs to know about a ballot:
 * its candidates, whether the bar is used, the vote mode and for classical ballots the number of votes per voter.
 * Classical ballots always have a bar. When the ballot does not use it, the bar is hidden.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BallotSpec {
	@NonNull
	CandidateSet candidateSet;

	@NonNull
	VoteMode mode;

	/** Number of candidates a voter may select in CLASSICAL mode. Null for PREFERENTIAL ballots. */
	Integer numVotes;

	public static BallotSpec preferential(CandidateSet candidateSet) {
		return new BallotSpec(candidateSet, VoteMode.PREFERENTIAL, null);
	}

	public static BallotSpec classical(CandidateSet candidateSet, int numVotes) {
		if (numVotes < 1) throw new IllegalArgumentException("Classical ballots need at least one vote per voter");
		return new BallotSpec(candidateSet.withHiddenBar(), VoteMode.CLASSICAL, numVotes);
	}

	public boolean isClassical() {
		return VoteMode.CLASSICAL.equals(mode);
	}

	public boolean isUseBar() {
		return candidateSet.isUseBar();
	}
}

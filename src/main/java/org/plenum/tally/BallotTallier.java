package org.plenum.tally;

import lombok.extern.slf4j.Slf4j;
import org.plenum.util.PlenumException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Tally a ballot: pairwise aggregation, Schulze method and result statistics in one go.
 * The same votes always lead to the same {@link TallyResult}, independent of their order.
 */
@Slf4j
public class BallotTallier {

	private BallotTallier() {}

	public static TallyResult tally(BallotSpec ballot, Collection<PreferencePartition> votes) {
		CandidateSet candidateSet = ballot.getCandidateSet();
		Matrix duelMatrix = PairwiseAggregator.calcDuelMatrix(candidateSet, votes);
		// a hidden bar takes part in the ranking, but is not part of the result
		PreferencePartition result = SchulzeSolver.solve(candidateSet, duelMatrix).withoutHiddenBar();
		ResultStatistics statistics = ResultStatistics.calc(ballot, result, duelMatrix, votes);
		log.debug("Tallied {} votes for {}: {}", votes.size(), candidateSet, result.toVoteString());
		return new TallyResult(ballot, duelMatrix, result, statistics);
	}

	/**
	 * Tally stored vote strings. Every string is decoded again, so that a malformed stored vote is detected.
	 * @param ballot the ballot
	 * @param voteStrings canonical vote strings
	 * @return the tally
	 * @throws PlenumException when a stored vote is not a valid vote for this ballot
	 */
	public static TallyResult tallyVoteStrings(BallotSpec ballot, Collection<String> voteStrings) throws PlenumException {
		VoteCodec codec = new VoteCodec(ballot);
		List<PreferencePartition> votes = new ArrayList<>();
		for (String voteString : voteStrings) votes.add(codec.decode(voteString));
		return tally(ballot, votes);
	}
}

package org.plenum.tally;

import lombok.Value;

import java.util.*;

/**
 * Statistics that are published together with the result of a ballot.
 */
@Value
public class ResultStatistics {

	/** one entry per boundary between two adjacent levels of the result */
	List<BoundaryStatistic> boundaries;

	/**
	 * CLASSICAL ballots only: number of votes that selected each candidate, in display order.
	 * The bar counts the votes that rejected all candidates. A hidden bar is not counted. Empty for PREFERENTIAL ballots.
	 */
	Map<String, Long> counts;

	/** number of votes without any preference */
	long abstentions;

	long numVotes;

	/**
	 * Calculate statistics for a result.
	 * @param ballot the ballot
	 * @param result the aggregate result of the ballot
	 * @param duelMatrix pairwise preferences that the result was calculated from
	 * @param votes all votes of the ballot
	 * @return boundaries, classical counts and abstentions
	 */
	public static ResultStatistics calc(BallotSpec ballot, PreferencePartition result, Matrix duelMatrix, Collection<PreferencePartition> votes) {
		CandidateSet candidateSet = ballot.getCandidateSet();
		List<BoundaryStatistic> boundaries = new ArrayList<>();
		List<List<String>> levels = result.getLevels();
		for (int l = 0; l < levels.size() - 1; l++) {
			String upper = levels.get(l).get(0);
			String lower = levels.get(l + 1).get(0);
			int u = candidateSet.indexOf(upper);
			int w = candidateSet.indexOf(lower);
			boundaries.add(new BoundaryStatistic(upper, lower, duelMatrix.get(u, w), duelMatrix.get(w, u)));
		}

		long abstentions = votes.stream().filter(PreferencePartition::isAbstention).count();

		Map<String, Long> counts = new LinkedHashMap<>();
		if (ballot.isClassical()) {
			candidateSet.getAll().stream()
					.filter(c -> candidateSet.isUseBar() || !c.isBar())
					.forEach(c -> counts.put(c.getShortname(), 0L));
			for (PreferencePartition vote : votes) {
				if (vote.isAbstention()) continue;
				vote.getLevels().get(0).forEach(s -> counts.computeIfPresent(s, (k, n) -> n + 1));
			}
		}
		return new ResultStatistics(
				Collections.unmodifiableList(boundaries),
				Collections.unmodifiableMap(counts),
				abstentions,
				votes.size());
	}
}

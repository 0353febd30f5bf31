package org.plenum.tally;

import java.util.Collection;

/**
 * Pairwise comparison of all candidates (including the bar) over all votes of a ballot.
 */
public class PairwiseAggregator {

	private PairwiseAggregator() {}

	/**
	 * Calculate the duel matrix.
	 * d[A][B] counts the votes where A is in a strictly higher level than B.
	 * Candidates in the same level of one vote are tied and are not counted in either direction.
	 * Row and column indexes are the indexes of {@link CandidateSet#getAll()}.
	 *
	 * @param candidateSet the candidates of the ballot
	 * @param votes all votes of the ballot. Each one must have been encoded for the same candidate set.
	 * @return the pairwise duel matrix. Its diagonal is always zero.
	 */
	public static Matrix calcDuelMatrix(CandidateSet candidateSet, Collection<PreferencePartition> votes) {
		int n = candidateSet.size();
		Matrix duelMatrix = new Matrix(n, n);
		for (PreferencePartition vote : votes) {
			if (vote.getCandidateSet().size() != n)
				throw new IllegalArgumentException("Vote " + vote + " does not belong to " + candidateSet);
			if (vote.isAbstention()) continue;
			for (int a = 0; a < n; a++) {
				int levelA = vote.levelOf(a);
				for (int b = 0; b < n; b++) {
					if (levelA < vote.levelOf(b)) duelMatrix.inc(a, b);
				}
			}
		}
		return duelMatrix;
	}
}

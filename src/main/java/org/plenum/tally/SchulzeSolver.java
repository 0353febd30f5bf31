package org.plenum.tally;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The Schulze method: a Condorcet consistent ranking of all candidates by the strength of their strongest paths.
 *
 * <ol>
 *   <li>A beats B directly when d[A][B] &gt; d[B][A]. The strength of this link is d[A][B].</li>
 *   <li>The strength of a path is the strength of its weakest link.
 *       p[A][B] is the strength of the strongest path from A to B (Floyd-Warshall).</li>
 *   <li>A beats B when p[A][B] &gt; p[B][A].</li>
 * </ol>
 *
 * The result is built level by level: all remaining candidates that are not beaten by any other remaining candidate
 * form the next level. There is no further tie breaking.
 *
 * See <a href="https://en.wikipedia.org/wiki/Schulze_method">Schulze method</a>
 */
@Slf4j
public class SchulzeSolver {

	private SchulzeSolver() {}

	/**
	 * Calculate the strengths of the strongest paths.
	 * @param duelMatrix pairwise preferences d[A][B]
	 * @return p[A][B] the strength of the strongest path from A to B. Zero when there is no path.
	 */
	public static Matrix calcStrongestPaths(Matrix duelMatrix) {
		if (!duelMatrix.isSquare()) throw new IllegalArgumentException("Duel matrix must be square");
		int n = duelMatrix.getRows();
		Matrix p = new Matrix(n, n);
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				if (i != j && duelMatrix.get(i, j) > duelMatrix.get(j, i)) {
					p.set(i, j, duelMatrix.get(i, j));
				}
			}
		}
		for (int k = 0; k < n; k++) {
			for (int i = 0; i < n; i++) {
				if (i == k) continue;
				for (int j = 0; j < n; j++) {
					if (j == i || j == k) continue;
					long viaK = Math.min(p.get(i, k), p.get(k, j));
					if (viaK > p.get(i, j)) p.set(i, j, viaK);
				}
			}
		}
		return p;
	}

	/**
	 * Rank all candidates of a ballot.
	 * @param candidateSet candidates in matrix order
	 * @param duelMatrix pairwise preferences of all votes
	 * @return the aggregate result as levels. With no votes at all, or a complete tie, this is a single level.
	 */
	public static PreferencePartition solve(CandidateSet candidateSet, Matrix duelMatrix) {
		int n = candidateSet.size();
		if (duelMatrix.getRows() != n || duelMatrix.getCols() != n)
			throw new IllegalArgumentException("Duel matrix does not fit " + candidateSet);
		Matrix p = calcStrongestPaths(duelMatrix);

		Set<Integer> remaining = new LinkedHashSet<>();
		for (int i = 0; i < n; i++) remaining.add(i);

		List<List<Integer>> levels = new ArrayList<>();
		while (!remaining.isEmpty()) {
			List<Integer> level = new ArrayList<>();
			for (int candidate : remaining) {
				boolean beaten = false;
				for (int other : remaining) {
					if (other != candidate && p.get(other, candidate) > p.get(candidate, other)) {
						beaten = true;
						break;
					}
				}
				if (!beaten) level.add(candidate);
			}
			// The beats relation of strongest paths is transitive and irreflexive. So there always is an unbeaten candidate.
			if (level.isEmpty()) throw new IllegalStateException("No unbeaten candidate left in " + remaining);
			level.forEach(remaining::remove);
			levels.add(level);
		}
		PreferencePartition result = PreferencePartition.ofIndexes(candidateSet, levels);
		log.debug("Schulze result: {}", result.toVoteString());
		return result;
	}

	/** Who wins? The first level of the result. */
	public static List<String> calcWinners(CandidateSet candidateSet, Matrix duelMatrix) {
		return solve(candidateSet, duelMatrix).getLevels().get(0);
	}
}

package org.plenum.result;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * The public result record of a tallied ballot.
 *
 * It contains everything that anyone needs to recompute the result on their own:
 * the candidates, all votes (without any reference to the voters) and the calculated result with its statistics.
 * A voter can find their own vote in the list of votes with their receipt secret.
 *
 * The JSON rendering of this record must be deterministic. Properties have a fixed order, votes are sorted
 * and there are no timestamps. Tallying the same votes again always yields the same bytes.
 */
@Data
@NoArgsConstructor
@JsonPropertyOrder({"assembly", "ballot", "candidates", "useBar", "mode", "numVotes", "candidateOrder", "pairwise", "votes", "result", "boundaries", "counts", "abstentions", "numberOfVotes"})
public class BallotResultRecord {

	/** title of the assembly */
	String assembly;

	/** title of the ballot */
	String ballot;

	/** shortname -&gt; title in display order. Without the bar. */
	LinkedHashMap<String, String> candidates;

	boolean useBar;

	/** PREFERENTIAL or CLASSICAL */
	String mode;

	/** CLASSICAL only: number of candidates a voter may select */
	Integer numVotes;

	/** row and column order of the pairwise matrix. Includes the bar when used. */
	List<String> candidateOrder;

	/** pairwise[a][b] = number of votes that prefer a over b */
	long[][] pairwise;

	/** all votes, sorted */
	List<RecordedVote> votes;

	/** the aggregate result, e.g. "A=B&gt;_bar_&gt;C" */
	String result;

	List<Boundary> boundaries;

	/** CLASSICAL only: how often each candidate was selected. The bar counts rejections of all candidates. */
	LinkedHashMap<String, Long> counts;

	long abstentions;

	long numberOfVotes;

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	@JsonPropertyOrder({"vote", "salt", "hash"})
	public static class RecordedVote {
		String vote;
		String salt;
		String hash;
	}

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	@JsonPropertyOrder({"upper", "lower", "pro", "contra"})
	public static class Boundary {
		String upper;
		String lower;
		long pro;
		long contra;
	}
}

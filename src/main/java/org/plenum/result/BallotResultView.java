package org.plenum.result;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.plenum.tally.Candidate;
import org.plenum.tally.PreferencePartition;

import java.util.ArrayList;
import java.util.List;

/**
 * The result of a tallied ballot as shown to clients.
 * With the bar, the result is split into preferred and rejected candidates.
 */
@Data
@NoArgsConstructor
public class BallotResultView {

	Long ballotId;

	/** the aggregate result, e.g. "A=B&gt;_bar_&gt;C" */
	String result;

	/** first preferred level. Empty when the bar alone beats every candidate. */
	List<String> winners;

	/** levels above the bar, or all levels without a bar. Candidates tied with the bar are preferred. */
	List<List<String>> preferred = new ArrayList<>();

	/** levels below the bar */
	List<List<String>> rejected = new ArrayList<>();

	List<BallotResultRecord.Boundary> boundaries;

	/** CLASSICAL only: how often each candidate was selected */
	List<CandidateCount> counts = new ArrayList<>();

	long abstentions;

	long numberOfVotes;

	/** SHA-256 of the published result record */
	String sha256;

	@Data
	@NoArgsConstructor
	public static class CandidateCount {
		String shortname;
		long count;

		public CandidateCount(String shortname, long count) {
			this.shortname = shortname;
			this.count = count;
		}
	}

	/**
	 * Build the view of a published record.
	 * @param ballotId ID of the ballot
	 * @param record the parsed record
	 * @param sha256 digest of the record's JSON
	 * @return the view
	 */
	public static BallotResultView of(Long ballotId, BallotResultRecord record, String sha256) {
		BallotResultView view = new BallotResultView();
		view.ballotId = ballotId;
		view.result = record.getResult();
		view.boundaries = record.getBoundaries();
		view.abstentions = record.getAbstentions();
		view.numberOfVotes = record.getNumberOfVotes();
		view.sha256 = sha256;
		if (record.getCounts() != null) {
			record.getCounts().forEach((shortname, count) -> view.counts.add(new CandidateCount(shortname, count)));
		}

		List<List<String>> current = view.preferred;
		for (String levelStr : record.getResult().split(PreferencePartition.PREFERRED)) {
			List<String> level = new ArrayList<>();
			boolean containsBar = false;
			for (String shortname : levelStr.split(PreferencePartition.TIED)) {
				if (Candidate.BAR_SHORTNAME.equals(shortname)) containsBar = true;
				else level.add(shortname);
			}
			if (!level.isEmpty()) current.add(level);
			if (containsBar) current = view.rejected;
		}
		view.winners = view.preferred.isEmpty() ? List.of() : view.preferred.get(0);
		return view;
	}
}

package org.plenum.tally;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.plenum.util.PlenumException;

import java.util.*;
import java.util.regex.Pattern;

import static org.plenum.util.PlenumException.Errors.*;

/**
 * Encodes the raw input of voters into the canonical {@link PreferencePartition} of one ballot.
 *
 * <h3>Preferential ballots</h3>
 * A vote is a relation string of candidate shortnames, e.g. <pre>C=D&gt;A&gt;B=E&gt;J</pre>
 * '&gt;' starts a new, strictly lower level. '=' ties candidates within one level.
 * Every candidate (and the bar, if used) must appear exactly once.
 *
 * <h3>Classical ballots</h3>
 * A voter selects up to N candidates. This is mapped to at most two levels:
 * <ul>
 *   <li>reject all:            _bar_ &gt; all candidates</li>
 *   <li>all candidates chosen: all candidates &gt; _bar_</li>
 *   <li>nothing chosen:        all candidates = _bar_   (abstention)</li>
 *   <li>otherwise:             selected &gt; not selected (and _bar_)</li>
 * </ul>
 * Without the bar "everyone selected" could not be told apart from "nobody selected".
 * So classical ballots that do not use the bar still get a hidden one, see {@link BallotSpec#classical(CandidateSet, int)}.
 *
 * Malformed input is always rejected with a specific error. It is never silently fixed.
 * The codec is stateless apart from its ballot and can be used concurrently.
 */
@Slf4j
public class VoteCodec {

	private static final Pattern LEVEL_SEPARATOR = Pattern.compile(Pattern.quote(PreferencePartition.PREFERRED));
	private static final Pattern TIE_SEPARATOR = Pattern.compile(Pattern.quote(PreferencePartition.TIED));

	@Getter
	private final BallotSpec ballot;

	public VoteCodec(BallotSpec ballot) {
		this.ballot = ballot;
	}

	/**
	 * Encode a voter's payload. The kind of payload must match the ballot's vote mode.
	 * @param payload raw vote
	 * @return the validated canonical vote
	 * @throws PlenumException when the vote is malformed
	 */
	public PreferencePartition encode(VotePayload payload) throws PlenumException {
		if (payload == null)
			throw new PlenumException(MALFORMED_VOTE, "Need a vote.");
		if (!ballot.getMode().equals(payload.getMode()))
			throw new PlenumException(MALFORMED_VOTE, "This ballot expects a " + ballot.getMode() + " vote, but got a " + payload.getMode() + " vote.");
		if (payload instanceof PreferentialVote pv) return parsePreferential(pv.getRanking());
		if (payload instanceof ClassicalSelection cs) return encodeClassical(cs);
		throw new PlenumException(MALFORMED_VOTE, "Unknown kind of vote: " + payload.getClass().getSimpleName());
	}

	/**
	 * Parse a preferential relation string. A blank string is an abstention.
	 * @param ranking e.g. "A&gt;B=_bar_&gt;C"
	 * @return the vote
	 * @throws PlenumException when the ranking is malformed or does not contain every candidate exactly once
	 */
	public PreferencePartition parsePreferential(String ranking) throws PlenumException {
		CandidateSet candidateSet = ballot.getCandidateSet();
		if (ranking == null || ranking.isBlank()) return PreferencePartition.abstention(candidateSet);

		List<List<String>> levels = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		for (String levelStr : LEVEL_SEPARATOR.split(ranking, -1)) {
			List<String> level = new ArrayList<>();
			for (String token : TIE_SEPARATOR.split(levelStr, -1)) {
				token = token.trim();
				if (token.isEmpty())
					throw new PlenumException(MALFORMED_VOTE, "Vote contains an empty candidate between relation signs.");
				if (!candidateSet.contains(token))
					throw new PlenumException(UNKNOWN_CANDIDATE, "Candidate '" + token + "' is not on this ballot.");
				if (!seen.add(token))
					throw new PlenumException(DUPLICATE_CANDIDATE, "Candidate '" + token + "' appears more than once in the vote.");
				level.add(token);
			}
			levels.add(level);
		}
		if (seen.size() != candidateSet.size()) {
			List<String> missing = candidateSet.getAllShortnames().stream().filter(s -> !seen.contains(s)).toList();
			throw new PlenumException(INCOMPLETE_RANKING, "Vote must rank every candidate. Missing: " + String.join(", ", missing));
		}
		return PreferencePartition.of(candidateSet, levels);
	}

	/**
	 * Map a classical selection to its canonical two level form.
	 * @param selection the selected candidates and the reject all flag
	 * @return the vote
	 * @throws PlenumException when too many candidates are selected, or a rejection is combined with a selection
	 */
	public PreferencePartition encodeClassical(ClassicalSelection selection) throws PlenumException {
		CandidateSet candidateSet = ballot.getCandidateSet();
		List<String> selected = selection.getSelected() == null ? List.of() : selection.getSelected();

		Set<String> chosen = new LinkedHashSet<>();
		for (String shortname : selected) {
			if (Candidate.BAR_SHORTNAME.equals(shortname) || !candidateSet.contains(shortname))
				throw new PlenumException(UNKNOWN_CANDIDATE, "Candidate '" + shortname + "' is not on this ballot.");
			if (!chosen.add(shortname))
				throw new PlenumException(DUPLICATE_CANDIDATE, "Candidate '" + shortname + "' is selected more than once.");
		}
		if (chosen.size() > ballot.getNumVotes())
			throw new PlenumException(TOO_MANY_VOTES, "You may select at most " + ballot.getNumVotes() + " candidates, but selected " + chosen.size() + ".");

		List<String> realCandidates = candidateSet.getCandidates().stream().map(Candidate::getShortname).toList();

		if (selection.isRejectAll()) {
			if (!candidateSet.isUseBar())
				throw new PlenumException(BAR_NOT_AVAILABLE, "This ballot has no option to reject all candidates.");
			if (!chosen.isEmpty())
				throw new PlenumException(REJECTION_IS_EXCLUSIVE, "Cannot select candidates and reject all candidates simultaneously.");
			return PreferencePartition.of(candidateSet, List.of(List.of(Candidate.BAR_SHORTNAME), realCandidates));
		}

		if (chosen.isEmpty()) return PreferencePartition.abstention(candidateSet);

		if (chosen.size() == realCandidates.size())
			return PreferencePartition.of(candidateSet, List.of(realCandidates, List.of(Candidate.BAR_SHORTNAME)));

		// the bar goes into the lower level together with everybody who was not selected
		List<String> rest = candidateSet.getAllShortnames().stream().filter(s -> !chosen.contains(s)).toList();
		return PreferencePartition.of(candidateSet, List.of(chosen, rest));
	}

	/**
	 * Decode a stored vote string, e.g. from a published result record.
	 * For classical ballots the string must additionally have one of the shapes that {@link #encodeClassical(ClassicalSelection)} produces.
	 *
	 * @param voteString a canonical or at least valid vote string
	 * @return the vote
	 * @throws PlenumException when the string is not a valid vote for this ballot
	 */
	public PreferencePartition decode(String voteString) throws PlenumException {
		if (voteString == null || voteString.isBlank())
			throw new PlenumException(MALFORMED_VOTE, "Stored vote must not be empty.");
		PreferencePartition vote = parsePreferential(voteString);
		if (ballot.isClassical()) checkClassicalShape(vote);
		return vote;
	}

	/**
	 * Classical votes have at most two levels. The upper level holds at most N candidates,
	 * or only the bar when the voter rejected all candidates.
	 */
	void checkClassicalShape(PreferencePartition vote) throws PlenumException {
		if (vote.isAbstention()) return;
		if (vote.numLevels() > 2)
			throw new PlenumException(TOO_MANY_LEVELS, "A classical vote has at most two levels, but got " + vote.toVoteString());
		List<String> upper = vote.getLevels().get(0);
		boolean barOnTop = upper.contains(Candidate.BAR_SHORTNAME);
		if (barOnTop && !ballot.isUseBar())
			throw new PlenumException(BAR_NOT_AVAILABLE, "Nobody can reject all candidates on this ballot: " + vote.toVoteString());
		if (barOnTop && upper.size() > 1)
			throw new PlenumException(MISPLACED_BAR, "The bar must either be rejected alone or be in the lower level: " + vote.toVoteString());
		if (!barOnTop && upper.size() > ballot.getNumVotes())
			throw new PlenumException(TOO_MANY_VOTES, "Vote selects " + upper.size() + " candidates, but only " + ballot.getNumVotes() + " are allowed.");
	}
}

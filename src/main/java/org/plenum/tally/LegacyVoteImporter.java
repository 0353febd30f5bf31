package org.plenum.tally;

import lombok.extern.slf4j.Slf4j;
import org.plenum.util.PlenumException;

import java.util.ArrayList;
import java.util.List;

import static org.plenum.util.PlenumException.Errors.*;

/**
 * Imports classical vote strings that were recorded without the bar, into a ballot that uses the bar.
 *
 * A split "S&gt;rest" is unambiguous: the bar joins the lower level.
 * But a vote where all candidates are tied can mean "I abstain" or "I approve of everybody".
 * What to do with such a vote must be chosen explicitly with a {@link LegacyTiePolicy}. By default such votes are rejected.
 */
@Slf4j
public class LegacyVoteImporter {

	/** How to interpret a legacy classical vote where all candidates are tied. */
	public enum LegacyTiePolicy {
		/** Refuse to import. The operator must decide. */
		REJECT,
		/** All candidates tied with the bar */
		ABSTENTION,
		/** All candidates above the bar */
		APPROVAL
	}

	private final VoteCodec codec;
	private final LegacyTiePolicy policy;

	public LegacyVoteImporter(BallotSpec ballot, LegacyTiePolicy policy) {
		if (!ballot.isClassical() || !ballot.isUseBar())
			throw new IllegalArgumentException("Legacy votes can only be imported into classical ballots with a bar");
		this.codec = new VoteCodec(ballot);
		this.policy = policy == null ? LegacyTiePolicy.REJECT : policy;
	}

	/**
	 * Import one legacy vote string.
	 * Strings that already contain the bar are decoded as they are.
	 *
	 * @param legacyVote e.g. "A=B&gt;C=D"
	 * @return the vote including the bar
	 * @throws PlenumException LEGACY_VOTE_AMBIGUOUS for an all-tied vote under policy REJECT, or the codec's error when the vote is malformed
	 */
	public PreferencePartition importVote(String legacyVote) throws PlenumException {
		if (legacyVote == null || legacyVote.isBlank())
			throw new PlenumException(MALFORMED_VOTE, "Legacy vote must not be empty.");

		List<List<String>> levels = new ArrayList<>();
		boolean containsBar = false;
		for (String level : legacyVote.split(PreferencePartition.PREFERRED, -1)) {
			List<String> tokens = new ArrayList<>();
			for (String token : level.split(PreferencePartition.TIED, -1)) {
				token = token.trim();
				if (Candidate.BAR_SHORTNAME.equals(token)) containsBar = true;
				tokens.add(token);
			}
			levels.add(tokens);
		}
		if (containsBar) return codec.decode(legacyVote);
		if (levels.size() > 2)
			throw new PlenumException(TOO_MANY_LEVELS, "A legacy classical vote has at most two levels: " + legacyVote);

		if (levels.size() == 1) {
			switch (policy) {
				case ABSTENTION -> levels.get(0).add(Candidate.BAR_SHORTNAME);
				case APPROVAL -> levels.add(new ArrayList<>(List.of(Candidate.BAR_SHORTNAME)));
				default -> throw new PlenumException(LEGACY_VOTE_AMBIGUOUS,
						"Cannot tell whether the legacy vote '" + legacyVote + "' is an abstention or approves of all candidates.");
			}
			log.debug("Imported all-tied legacy vote with policy {}", policy);
		} else {
			levels.get(1).add(Candidate.BAR_SHORTNAME);
		}
		String withBar = levels.stream()
				.map(level -> String.join(PreferencePartition.TIED, level))
				.reduce((a, b) -> a + PreferencePartition.PREFERRED + b)
				.orElseThrow();
		return codec.decode(withBar);
	}
}

package org.plenum.tally;

import org.junit.jupiter.api.Test;
import org.plenum.util.PlenumException;

import static org.junit.jupiter.api.Assertions.*;
import static org.plenum.tally.VoteCodecTests.assertError;

public class LegacyVoteImporterTests {

	static final BallotSpec BALLOT = BallotSpec.classical(CandidateSet.of(true, "A", "B", "C", "D"), 2);

	@Test
	public void splitVoteGetsBarInLowerLevel() throws PlenumException {
		LegacyVoteImporter importer = new LegacyVoteImporter(BALLOT, LegacyVoteImporter.LegacyTiePolicy.REJECT);
		assertEquals("A=B>C=D=_bar_", importer.importVote("B=A>D=C").toVoteString());
	}

	@Test
	public void votesWithBarAreDecodedAsTheyAre() throws PlenumException {
		LegacyVoteImporter importer = new LegacyVoteImporter(BALLOT, LegacyVoteImporter.LegacyTiePolicy.REJECT);
		assertEquals("_bar_>A=B=C=D", importer.importVote("_bar_>A=B=C=D").toVoteString());
	}

	@Test
	public void shortnameContainingBarIsNotTheBar() throws PlenumException {
		BallotSpec ballot = BallotSpec.classical(CandidateSet.of(true, "x_bar_y", "B"), 1);
		LegacyVoteImporter importer = new LegacyVoteImporter(ballot, LegacyVoteImporter.LegacyTiePolicy.REJECT);
		assertEquals("x_bar_y>B=_bar_", importer.importVote("x_bar_y>B").toVoteString());
	}

	@Test
	public void allTiedIsRejectedByDefault() {
		LegacyVoteImporter importer = new LegacyVoteImporter(BALLOT, null);
		assertError(PlenumException.Errors.LEGACY_VOTE_AMBIGUOUS, () -> importer.importVote("A=B=C=D"));
	}

	@Test
	public void allTiedWithExplicitPolicy() throws PlenumException {
		LegacyVoteImporter abstention = new LegacyVoteImporter(BALLOT, LegacyVoteImporter.LegacyTiePolicy.ABSTENTION);
		assertEquals("A=B=C=D=_bar_", abstention.importVote("A=B=C=D").toVoteString());

		// approving everybody still has to respect the number of votes of the ballot
		BallotSpec fourVotes = BallotSpec.classical(CandidateSet.of(true, "A", "B", "C", "D"), 4);
		LegacyVoteImporter approval = new LegacyVoteImporter(fourVotes, LegacyVoteImporter.LegacyTiePolicy.APPROVAL);
		assertEquals("A=B=C=D>_bar_", approval.importVote("A=B=C=D").toVoteString());
		LegacyVoteImporter approvalOfTwo = new LegacyVoteImporter(BALLOT, LegacyVoteImporter.LegacyTiePolicy.APPROVAL);
		assertError(PlenumException.Errors.TOO_MANY_VOTES, () -> approvalOfTwo.importVote("A=B=C=D"));
	}

	@Test
	public void malformedLegacyVotes() {
		LegacyVoteImporter importer = new LegacyVoteImporter(BALLOT, LegacyVoteImporter.LegacyTiePolicy.ABSTENTION);
		assertError(PlenumException.Errors.TOO_MANY_LEVELS, () -> importer.importVote("A>B>C=D"));
		assertError(PlenumException.Errors.INCOMPLETE_RANKING, () -> importer.importVote("A>B"));
		assertError(PlenumException.Errors.MALFORMED_VOTE, () -> importer.importVote(""));
	}

	@Test
	public void onlyForClassicalBallotsWithBar() {
		assertThrows(IllegalArgumentException.class, () -> new LegacyVoteImporter(BallotSpec.preferential(CandidateSet.of(true, "A", "B")), null));
		assertThrows(IllegalArgumentException.class, () -> new LegacyVoteImporter(BallotSpec.classical(CandidateSet.of(false, "A", "B"), 1), null));
	}
}

package org.plenum.tally;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.plenum.util.PlenumException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class VoteCodecTests {

	static final CandidateSet ABCDEJ = CandidateSet.of(false, "A", "B", "C", "D", "E", "J");
	static final CandidateSet ABCD_BAR = CandidateSet.of(true, "A", "B", "C", "D");

	VoteCodec preferential = new VoteCodec(BallotSpec.preferential(ABCDEJ));
	VoteCodec preferentialWithBar = new VoteCodec(BallotSpec.preferential(ABCD_BAR));
	VoteCodec classical3 = new VoteCodec(BallotSpec.classical(ABCD_BAR, 3));

	// ========== preferential votes ==========

	@Test
	public void parsePreferentialVote() throws PlenumException {
		PreferencePartition vote = preferential.parsePreferential("C=D>A>B=E>J");
		assertEquals(4, vote.numLevels(), "Vote should have four levels");
		assertEquals(List.of("C", "D"), vote.getLevels().get(0));
		assertEquals(List.of("A"), vote.getLevels().get(1));
		assertTrue(vote.prefers("A", "J"), "A should be preferred over J");
		assertFalse(vote.prefers("B", "E"), "B and E are tied");
		assertFalse(vote.prefers("E", "B"), "B and E are tied");
	}

	@Test
	public void parsedVoteIsCanonical() throws PlenumException {
		PreferencePartition vote = preferential.parsePreferential("D=C>A>E=B>J");
		assertEquals("C=D>A>B=E>J", vote.toVoteString(), "Members of a level must be in display order");
		assertEquals(vote, preferential.parsePreferential(vote.toVoteString()), "Parsing the serialized vote again must give the same vote");
	}

	@Test
	public void barCanBeAnywhere() throws PlenumException {
		assertEquals("A>_bar_>B=C=D", preferentialWithBar.parsePreferential("A>_bar_>B=C=D").toVoteString());
		assertEquals("_bar_>A=B=C=D", preferentialWithBar.parsePreferential("_bar_>A=B=C=D").toVoteString());
		assertEquals("A=_bar_>B>C=D", preferentialWithBar.parsePreferential("_bar_=A>B>C=D").toVoteString(), "Bar is always last within its level");
	}

	@Test
	public void blankRankingIsAbstention() throws PlenumException {
		PreferencePartition vote = preferentialWithBar.parsePreferential("  ");
		assertTrue(vote.isAbstention(), "A blank ranking is an abstention");
		assertEquals("A=B=C=D=_bar_", vote.toVoteString());
		assertEquals(vote, preferentialWithBar.parsePreferential("A=B=C=D=_bar_"), "Explicit abstention should equal the blank one");
	}

	@Test
	public void rejectMalformedPreferentialVotes() {
		assertError(PlenumException.Errors.INCOMPLETE_RANKING, () -> preferential.parsePreferential("A>B>C"));
		assertError(PlenumException.Errors.DUPLICATE_CANDIDATE, () -> preferential.parsePreferential("A>B>C>D>E>J>A"));
		assertError(PlenumException.Errors.UNKNOWN_CANDIDATE, () -> preferential.parsePreferential("A>B>C>D>E>J>X"));
		assertError(PlenumException.Errors.UNKNOWN_CANDIDATE, () -> preferential.parsePreferential("A>B>C>D>E>J>_bar_"));
		assertError(PlenumException.Errors.MALFORMED_VOTE, () -> preferential.parsePreferential("A>>B>C>D>E>J"));
		assertError(PlenumException.Errors.MALFORMED_VOTE, () -> preferential.parsePreferential("A=B>C>D>E>J="));
		assertError(PlenumException.Errors.INCOMPLETE_RANKING, () -> preferentialWithBar.parsePreferential("A>B>C>D"));
	}

	@Test
	public void payloadMustMatchBallotMode() {
		assertError(PlenumException.Errors.MALFORMED_VOTE, () -> preferential.encode(ClassicalSelection.of("A")));
		assertError(PlenumException.Errors.MALFORMED_VOTE, () -> classical3.encode(new PreferentialVote("A>B>C>D>_bar_")));
		assertError(PlenumException.Errors.MALFORMED_VOTE, () -> classical3.encode(null));
	}

	// ========== classical votes ==========

	@Test
	public void classicalSelectionOfThree() throws PlenumException {
		PreferencePartition vote = classical3.encode(ClassicalSelection.of("A", "B", "D"));
		assertEquals("A=B=D>C=_bar_", vote.toVoteString(), "The bar goes into the lower level together with the unselected candidate");
	}

	@Test
	public void classicalNothingSelectedIsAbstention() throws PlenumException {
		PreferencePartition vote = classical3.encode(ClassicalSelection.of());
		assertEquals("A=B=C=D=_bar_", vote.toVoteString());
		assertTrue(vote.isAbstention());
	}

	@Test
	public void classicalAllSelectedIsNotAbstention() throws PlenumException {
		VoteCodec classical4 = new VoteCodec(BallotSpec.classical(ABCD_BAR, 4));
		PreferencePartition all = classical4.encode(ClassicalSelection.of("A", "B", "C", "D"));
		PreferencePartition none = classical4.encode(ClassicalSelection.of());
		assertEquals("A=B=C=D>_bar_", all.toVoteString());
		assertNotEquals(all, none, "Selecting everybody must be different from selecting nobody");
	}

	@Test
	public void classicalRejectAll() throws PlenumException {
		assertEquals("_bar_>A=B=C=D", classical3.encode(ClassicalSelection.rejectAll()).toVoteString());
	}

	@Test
	public void classicalWithoutBarHasHiddenBar() throws PlenumException {
		VoteCodec noBar = new VoteCodec(BallotSpec.classical(CandidateSet.of(false, "A", "B", "C"), 3));
		assertEquals("A>B=C=_bar_", noBar.encode(ClassicalSelection.of("A")).toVoteString());
		assertEquals("A=B=C=_bar_", noBar.encode(ClassicalSelection.of()).toVoteString());
		PreferencePartition all = noBar.encode(ClassicalSelection.of("A", "B", "C"));
		assertEquals("A=B=C>_bar_", all.toVoteString());
		assertFalse(all.isAbstention(), "Selecting everybody must not be an abstention, even without a visible bar");
		assertError(PlenumException.Errors.BAR_NOT_AVAILABLE, () -> noBar.encode(ClassicalSelection.rejectAll()));
		assertError(PlenumException.Errors.UNKNOWN_CANDIDATE, () -> noBar.encode(ClassicalSelection.of("_bar_")));
		assertError(PlenumException.Errors.BAR_NOT_AVAILABLE, () -> noBar.decode("_bar_>A=B=C"));
	}

	@Test
	public void rejectMalformedClassicalVotes() {
		assertError(PlenumException.Errors.TOO_MANY_VOTES, () -> classical3.encode(ClassicalSelection.of("A", "B", "C", "D")));
		assertError(PlenumException.Errors.REJECTION_IS_EXCLUSIVE, () -> classical3.encode(new ClassicalSelection(List.of("A"), true)));
		assertError(PlenumException.Errors.DUPLICATE_CANDIDATE, () -> classical3.encode(ClassicalSelection.of("A", "A")));
		assertError(PlenumException.Errors.UNKNOWN_CANDIDATE, () -> classical3.encode(ClassicalSelection.of("X")));
		assertError(PlenumException.Errors.UNKNOWN_CANDIDATE, () -> classical3.encode(ClassicalSelection.of("_bar_")));
	}

	// ========== decoding stored votes ==========

	@Test
	public void decodeStoredClassicalVotes() throws PlenumException {
		assertEquals("A=B>C=D=_bar_", classical3.decode("A=B>C=D=_bar_").toVoteString());
		assertEquals("_bar_>A=B=C=D", classical3.decode("_bar_>A=B=C=D").toVoteString());
		assertError(PlenumException.Errors.TOO_MANY_LEVELS, () -> classical3.decode("A>B>C=D=_bar_"));
		assertError(PlenumException.Errors.MISPLACED_BAR, () -> classical3.decode("A=_bar_>B=C=D"));
		assertError(PlenumException.Errors.TOO_MANY_VOTES, () -> classical3.decode("A=B=C=D>_bar_"));
		assertError(PlenumException.Errors.MALFORMED_VOTE, () -> classical3.decode(""));
	}

	interface CodecCall {
		Object call() throws PlenumException;
	}

	static void assertError(PlenumException.Errors expected, CodecCall call) {
		PlenumException ex = assertThrows(PlenumException.class, call::call, "Expected " + expected);
		assertEquals(expected, ex.getError(), "Wrong error: " + ex.getMessage());
	}
}

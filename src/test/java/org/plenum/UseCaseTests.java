package org.plenum;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.plenum.assembly.AssemblyEntity;
import org.plenum.ballot.BallotCheckJob;
import org.plenum.ballot.BallotEntity;
import org.plenum.result.BallotResultView;
import org.plenum.result.TallyService;
import org.plenum.tally.ClassicalSelection;
import org.plenum.tally.PreferentialVote;
import org.plenum.tally.VoteMode;
import org.plenum.util.PlenumException;
import org.plenum.vote.CastVoteService;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the most important use cases.
 * These call the services directly.
 */
@QuarkusTest
public class UseCaseTests {

	@Inject
	PlenumTestUtils testUtils;

	@Inject
	CastVoteService castVoteService;

	@Inject
	TallyService tallyService;

	@Inject
	BallotCheckJob ballotCheckJob;

	/**
	 * A ballot that does not reach its quorum is extended once. Votes can still be cast during the extension.
	 * After the extension it is closed and tallied, whether the quorum was reached or not.
	 */
	@Test
	public void ballotIsExtendedWhenQuorumIsNotReached() throws PlenumException {
		// GIVEN a ballot with a quorum of 3 that ends in one hour
		AssemblyEntity assembly = testUtils.createAssembly(3);
		LocalDateTime start = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
		BallotEntity ballot = testUtils.createBallot(assembly.id, VoteMode.PREFERENTIAL, null, true, 3,
				start.plusHours(1), start.plusHours(2), "A", "B");
		testUtils.startVotingPhase(ballot.id);
		castVoteService.submitVote(ballot.id, PlenumTestUtils.voterId(assembly, 0), new PreferentialVote("A>_bar_>B"));

		// WHEN the regular voting period has ended with only one vote
		ballotCheckJob.checkBallots(start.plusMinutes(90));

		// THEN the ballot is extended and still open
		BallotEntity extended = testUtils.loadBallot(ballot.id);
		assertEquals(BallotEntity.BallotStatus.VOTING, extended.getStatus(), "Ballot should still be open during its extension");
		assertTrue(extended.getExtended(), "Ballot should be extended, because its quorum was not reached");
		assertTrue(extended.isOpenForVotes(start.plusMinutes(90)));

		// AND when the extension ends, the ballot is closed and tallied
		ballotCheckJob.checkBallots(start.plusHours(3));
		BallotEntity tallied = testUtils.loadBallot(ballot.id);
		assertEquals(BallotEntity.BallotStatus.TALLIED, tallied.getStatus(), "Ballot should be tallied after its extension");
		assertEquals("A>_bar_>B", tallied.getResult());
	}

	@Test
	public void ballotThatReachedQuorumIsClosedOnTime() throws PlenumException {
		AssemblyEntity assembly = testUtils.createAssembly(2);
		LocalDateTime start = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
		BallotEntity ballot = testUtils.createBallot(assembly.id, VoteMode.CLASSICAL, 1, true, 2,
				start.plusHours(1), start.plusHours(2), "A", "B");
		testUtils.startVotingPhase(ballot.id);
		castVoteService.submitVote(ballot.id, PlenumTestUtils.voterId(assembly, 0), ClassicalSelection.of("B"));
		castVoteService.submitVote(ballot.id, PlenumTestUtils.voterId(assembly, 1), ClassicalSelection.of("B"));

		// still open before its end
		ballotCheckJob.checkBallots(start.plusMinutes(30));
		assertEquals(BallotEntity.BallotStatus.VOTING, testUtils.loadBallot(ballot.id).getStatus());

		ballotCheckJob.checkBallots(start.plusMinutes(61));
		BallotEntity tallied = testUtils.loadBallot(ballot.id);
		assertFalse(tallied.getExtended(), "Ballot reached its quorum and must not be extended");
		assertEquals(BallotEntity.BallotStatus.TALLIED, tallied.getStatus());
		assertEquals("B>A=_bar_", tallied.getResult());
	}

	/**
	 * The ballot check tallies every closed ballot, also ones that were closed by hand.
	 * When tallying fails, the ballot stays CLOSED and is tried again in the next run.
	 */
	@Test
	public void failedTallyIsRetriedByNextBallotCheck() throws PlenumException {
		// GIVEN a ballot that was closed by hand and has a broken vote in the database
		AssemblyEntity assembly = testUtils.createAssembly(1);
		BallotEntity ballot = testUtils.createOpenBallot(assembly.id, VoteMode.PREFERENTIAL, null, false, "A", "B");
		castVoteService.submitVote(ballot.id, PlenumTestUtils.voterId(assembly, 0), new PreferentialVote("B>A"));
		testUtils.finishVotingPhase(ballot.id);
		testUtils.overwriteVotes(ballot.id, "X>Y");

		// WHEN the ballot check runs
		ballotCheckJob.checkBallots(LocalDateTime.now());

		// THEN the ballot cannot be tallied and stays CLOSED
		assertEquals(BallotEntity.BallotStatus.CLOSED, testUtils.loadBallot(ballot.id).getStatus(), "Ballot with a broken vote must not be tallied");

		// AND once the vote is repaired, the next run tallies it
		testUtils.overwriteVotes(ballot.id, "B>A");
		ballotCheckJob.checkBallots(LocalDateTime.now());
		BallotEntity tallied = testUtils.loadBallot(ballot.id);
		assertEquals(BallotEntity.BallotStatus.TALLIED, tallied.getStatus(), "Ballot should be tallied in the next run");
		assertEquals("B>A", tallied.getResult());
	}

	@Test
	public void concludeAssemblyOnlyWhenAllBallotsAreTallied() throws PlenumException {
		// GIVEN an assembly with two ballots, one of them still open
		AssemblyEntity assembly = testUtils.createAssembly(1);
		BallotEntity ballot1 = testUtils.createOpenBallot(assembly.id, VoteMode.PREFERENTIAL, null, false, "A", "B");
		BallotEntity ballot2 = testUtils.createOpenBallot(assembly.id, VoteMode.PREFERENTIAL, null, false, "X", "Y");
		castVoteService.submitVote(ballot1.id, PlenumTestUtils.voterId(assembly, 0), new PreferentialVote("B>A"));
		testUtils.finishVotingPhase(ballot1.id);
		BallotResultView result1 = tallyService.tally(ballot1.id);
		assertEquals(java.util.List.of("B"), result1.getWinners());

		// WHEN trying to conclude the assembly
		PlenumException ex = assertThrows(PlenumException.class, () -> testUtils.concludeAssembly(assembly.id));

		// THEN this fails until the second ballot is also tallied
		assertEquals(PlenumException.Errors.CANNOT_CONCLUDE_ASSEMBLY, ex.getError());
		testUtils.finishVotingPhase(ballot2.id);
		tallyService.tally(ballot2.id);
		AssemblyEntity concluded = testUtils.concludeAssembly(assembly.id);
		assertTrue(concluded.isConcluded());

		// AND nothing can be added to a concluded assembly
		PlenumException noBallot = assertThrows(PlenumException.class,
				() -> testUtils.createOpenBallot(assembly.id, VoteMode.PREFERENTIAL, null, false, "A", "B"));
		assertEquals(PlenumException.Errors.CANNOT_CREATE_BALLOT, noBallot.getError());
	}

	@Test
	public void ballotConfigurationIsValidated() throws PlenumException {
		AssemblyEntity assembly = testUtils.createAssembly(0);
		PlenumException noNumVotes = assertThrows(PlenumException.class,
				() -> testUtils.createBallot(assembly.id, VoteMode.CLASSICAL, null, true, 0, null, null, "A", "B"));
		assertEquals(PlenumException.Errors.CANNOT_CREATE_BALLOT, noNumVotes.getError());

		PlenumException duplicate = assertThrows(PlenumException.class,
				() -> testUtils.createBallot(assembly.id, VoteMode.PREFERENTIAL, null, true, 0, null, null, "A", "A"));
		assertEquals(PlenumException.Errors.CANNOT_ADD_CANDIDATE, duplicate.getError());

		PlenumException barName = assertThrows(PlenumException.class,
				() -> testUtils.createBallot(assembly.id, VoteMode.PREFERENTIAL, null, true, 0, null, null, "A", "_bar_"));
		assertEquals(PlenumException.Errors.CANNOT_ADD_CANDIDATE, barName.getError(), "The bar is not a candidate");

		PlenumException oneCandidate = assertThrows(PlenumException.class,
				() -> testUtils.createOpenBallot(assembly.id, VoteMode.PREFERENTIAL, null, true, "A"));
		assertEquals(PlenumException.Errors.CANNOT_START_VOTING_PHASE, oneCandidate.getError());
	}
}

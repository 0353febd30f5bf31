package org.plenum;

import io.quarkus.test.junit.QuarkusTest;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.plenum.util.Lson;

import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.plenum.TestFixtures.*;

/**
 * Run through a complete ballot via the GraphQL API:
 * create assembly and ballot, vote, close, tally, verify receipt and conclude the assembly.
 */
@Slf4j
@QuarkusTest
public class GraphQLTests {

	static final String CREATE_ASSEMBLY = "mutation createAssembly($title: String!, $description: String) { " +
			"createAssembly(title: $title, description: $description) " + JQL_ASSEMBLY + "}";
	static final String SIGNUP = "mutation signup($assemblyId: BigInteger!, $voterId: String!) { " +
			"signup(assemblyId: $assemblyId, voterId: $voterId) " + JQL_ASSEMBLY + "}";
	static final String CREATE_BALLOT = "mutation createBallot($assemblyId: BigInteger!, $title: String!, $mode: VoteMode!, $numVotes: Int, $useBar: Boolean!) { " +
			"createBallot(assemblyId: $assemblyId, title: $title, mode: $mode, numVotes: $numVotes, useBar: $useBar) " + JQL_BALLOT + "}";
	static final String ADD_CANDIDATE = "mutation addCandidate($ballotId: BigInteger!, $shortname: String!, $title: String) { " +
			"addCandidate(ballotId: $ballotId, shortname: $shortname, title: $title) " + JQL_BALLOT + "}";
	static final String START_VOTING = "mutation startVotingPhase($ballotId: BigInteger!) { " +
			"startVotingPhase(ballotId: $ballotId) " + JQL_BALLOT + "}";
	static final String FINISH_VOTING = "mutation finishVotingPhase($ballotId: BigInteger!) { " +
			"finishVotingPhase(ballotId: $ballotId) " + JQL_BALLOT + "}";
	static final String CAST_PREFERENTIAL = "mutation castPreferentialVote($ballotId: BigInteger!, $voterId: String!, $ranking: String) { " +
			"castPreferentialVote(ballotId: $ballotId, voterId: $voterId, ranking: $ranking) " + JQL_CAST_VOTE_RESPONSE + "}";
	static final String CAST_CLASSICAL = "mutation castClassicalVote($ballotId: BigInteger!, $voterId: String!, $selected: [String], $rejectAll: Boolean) { " +
			"castClassicalVote(ballotId: $ballotId, voterId: $voterId, selected: $selected, rejectAll: $rejectAll) " + JQL_CAST_VOTE_RESPONSE + "}";
	static final String TALLY = "mutation tallyBallot($ballotId: BigInteger!) { " +
			"tallyBallot(ballotId: $ballotId) " + JQL_RESULT + "}";
	static final String BALLOT_RESULT = "query ballotResult($ballotId: BigInteger!) { " +
			"ballotResult(ballotId: $ballotId) " + JQL_RESULT + "}";
	static final String VERIFY_VOTE = "query verifyVote($receiptSecret: String!) { verifyVote(receiptSecret: $receiptSecret) }";
	static final String CONCLUDE = "mutation concludeAssembly($assemblyId: BigInteger!) { " +
			"concludeAssembly(assemblyId: $assemblyId) " + JQL_ASSEMBLY + "}";

	Long createAssemblyWithVoters(List<String> voterIds) {
		String title = PlenumTestUtils.uniqueName("GraphQL assembly");
		Long assemblyId = sendGraphQL(CREATE_ASSEMBLY, Lson.builder("title", title).put("description", "created by GraphQLTests"))
				.body("data.createAssembly.title", is(title))
				.body("data.createAssembly.concluded", is(false))
				.extract().jsonPath().getLong("data.createAssembly.id");
		for (String voterId : voterIds) {
			sendGraphQL(SIGNUP, Lson.builder("assemblyId", assemblyId).put("voterId", voterId));
		}
		return assemblyId;
	}

	Long createOpenBallot(Long assemblyId, String mode, Integer numVotes, boolean useBar, String... shortnames) {
		Lson vars = Lson.builder("assemblyId", assemblyId)
				.put("title", PlenumTestUtils.uniqueName("GraphQL ballot"))
				.put("mode", mode)
				.put("numVotes", numVotes)
				.put("useBar", useBar);
		Long ballotId = sendGraphQL(CREATE_BALLOT, vars)
				.body("data.createBallot.status", is("CONFIGURATION"))
				.extract().jsonPath().getLong("data.createBallot.id");
		for (String shortname : shortnames) {
			sendGraphQL(ADD_CANDIDATE, Lson.builder("ballotId", ballotId).put("shortname", shortname).put("title", "Candidate " + shortname));
		}
		sendGraphQL(START_VOTING, Lson.builder("ballotId", ballotId))
				.body("data.startVotingPhase.status", is("VOTING"))
				.body("data.startVotingPhase.candidates", hasSize(shortnames.length));
		return ballotId;
	}

	@Test
	public void preferentialBallotLifecycle() {
		// GIVEN an assembly with four voters and an open ballot
		List<String> voters = List.of(VOTER_PREFIX + "gql1", VOTER_PREFIX + "gql2", VOTER_PREFIX + "gql3", VOTER_PREFIX + "gql4");
		Long assemblyId = createAssemblyWithVoters(voters);
		Long ballotId = createOpenBallot(assemblyId, "PREFERENTIAL", null, false, "A", "B", "C", "D", "E", "J");

		// WHEN the voters cast their votes
		String receiptSecret = null;
		for (int i = 0; i < 3; i++) {
			String secret = sendGraphQL(CAST_PREFERENTIAL, Lson.builder("ballotId", ballotId).put("voterId", voters.get(i)).put("ranking", "D=C>A>E=B>J"))
					.body("data.castPreferentialVote.vote", is("C=D>A>B=E>J"))
					.body("data.castPreferentialVote.replaced", is(false))
					.extract().jsonPath().getString("data.castPreferentialVote.receiptSecret");
			if (receiptSecret == null) receiptSecret = secret;
		}
		sendGraphQL(CAST_PREFERENTIAL, Lson.builder("ballotId", ballotId).put("voterId", voters.get(3)).put("ranking", "J>A>B=C=D=E"));

		// AND the ballot is closed and tallied
		sendGraphQL(FINISH_VOTING, Lson.builder("ballotId", ballotId))
				.body("data.finishVotingPhase.status", is("CLOSED"))
				.body("data.finishVotingPhase.numCastVotes", is(4));
		String sha256 = sendGraphQL(TALLY, Lson.builder("ballotId", ballotId))
				.body("data.tallyBallot.result", is("C=D>A>B=E>J"))
				.body("data.tallyBallot.winners", contains("C", "D"))
				.body("data.tallyBallot.boundaries[0].upper", is("C"))
				.body("data.tallyBallot.boundaries[0].pro", is(3))
				.body("data.tallyBallot.boundaries[0].contra", is(1))
				.body("data.tallyBallot.numberOfVotes", is(4))
				.extract().jsonPath().getString("data.tallyBallot.sha256");

		// THEN the published result can be queried
		String publishedSha256 = sendGraphQL(BALLOT_RESULT, Lson.builder("ballotId", ballotId))
				.body("data.ballotResult.result", is("C=D>A>B=E>J"))
				.extract().jsonPath().getString("data.ballotResult.sha256");
		assertEquals(sha256, publishedSha256, "Queried result must be the published one");

		// AND a voter can verify their vote until the assembly is concluded
		sendGraphQL(VERIFY_VOTE, Lson.builder("receiptSecret", receiptSecret))
				.body("data.verifyVote", is("C=D>A>B=E>J"));
		sendGraphQL(CONCLUDE, Lson.builder("assemblyId", assemblyId))
				.body("data.concludeAssembly.concluded", is(true));
		sendGraphQLExpectError(VERIFY_VOTE, Lson.builder("receiptSecret", receiptSecret), "VOTE_NOT_FOUND");
	}

	@Test
	public void classicalBallotWithBar() {
		List<String> voters = List.of(VOTER_PREFIX + "cls1", VOTER_PREFIX + "cls2", VOTER_PREFIX + "cls3");
		Long assemblyId = createAssemblyWithVoters(voters);
		Long ballotId = createOpenBallot(assemblyId, "CLASSICAL", 2, true, "A", "B", "C");

		sendGraphQL(CAST_CLASSICAL, Lson.builder("ballotId", ballotId).put("voterId", voters.get(0)).put("selected", List.of("B", "A")))
				.body("data.castClassicalVote.vote", is("A=B>C=_bar_"));
		sendGraphQL(CAST_CLASSICAL, Lson.builder("ballotId", ballotId).put("voterId", voters.get(1)).put("selected", List.of("A")))
				.body("data.castClassicalVote.vote", is("A>B=C=_bar_"));
		sendGraphQL(CAST_CLASSICAL, Lson.builder("ballotId", ballotId).put("voterId", voters.get(2)).put("rejectAll", true))
				.body("data.castClassicalVote.vote", is("_bar_>A=B=C"));

		sendGraphQL(FINISH_VOTING, Lson.builder("ballotId", ballotId));
		sendGraphQL(TALLY, Lson.builder("ballotId", ballotId))
				.body("data.tallyBallot.result", is("A>B=_bar_>C"))
				.body("data.tallyBallot.preferred", hasSize(2))
				.body("data.tallyBallot.rejected[0]", contains("C"))
				.body("data.tallyBallot.counts.find { it.shortname == 'A' }.count", is(2))
				.body("data.tallyBallot.counts.find { it.shortname == '_bar_' }.count", is(1));
	}

	@Test
	public void malformedVotesAreRejected() {
		List<String> voters = List.of(VOTER_PREFIX + "bad1");
		Long assemblyId = createAssemblyWithVoters(voters);
		Long preferential = createOpenBallot(assemblyId, "PREFERENTIAL", null, true, "A", "B");
		Long classical = createOpenBallot(assemblyId, "CLASSICAL", 1, true, "A", "B");

		sendGraphQLExpectError(CAST_PREFERENTIAL, Lson.builder("ballotId", preferential).put("voterId", voters.get(0)).put("ranking", "A>B"), "INCOMPLETE_RANKING")
				.body("errors[0].extensions.plenumException.plenumErrorCode", is(101))
				.body("errors[0].extensions.plenumException.plenumHttpStatus", is(400));
		sendGraphQLExpectError(CAST_PREFERENTIAL, Lson.builder("ballotId", preferential).put("voterId", voters.get(0)).put("ranking", "A>B>X>_bar_"), "UNKNOWN_CANDIDATE");
		sendGraphQLExpectError(CAST_CLASSICAL, Lson.builder("ballotId", classical).put("voterId", voters.get(0)).put("selected", List.of("A", "B")), "TOO_MANY_VOTES");
		sendGraphQLExpectError(CAST_CLASSICAL, Lson.builder("ballotId", classical).put("voterId", voters.get(0)).put("selected", List.of("A")).put("rejectAll", true), "REJECTION_IS_EXCLUSIVE");
		sendGraphQLExpectError(CAST_PREFERENTIAL, Lson.builder("ballotId", preferential).put("voterId", "notSignedUp").put("ranking", "A>B>_bar_"), "NOT_ATTENDING");
		sendGraphQLExpectError(TALLY, Lson.builder("ballotId", preferential), "BALLOT_NOT_CLOSED");
		sendGraphQLExpectError(CONCLUDE, Lson.builder("assemblyId", assemblyId), "CANNOT_CONCLUDE_ASSEMBLY");
	}
}

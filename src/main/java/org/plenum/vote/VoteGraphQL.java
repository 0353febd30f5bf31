package org.plenum.vote;

import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.graphql.*;
import org.plenum.tally.ClassicalSelection;
import org.plenum.tally.PreferentialVote;
import org.plenum.util.PlenumException;

import java.util.List;

/**
 * Cast votes and verify them with their receipt.
 * Each vote is stored in its own transaction by the CastVoteService. So these methods are not @Transactional.
 */
@Slf4j
@GraphQLApi
public class VoteGraphQL {

	@Inject
	CastVoteService castVoteService;

	/**
	 * Cast a vote in a preferential ballot.
	 * A voter may replace their vote as long as the ballot is open.
	 *
	 * @param ballotId ballot to vote in
	 * @param voterId the voter
	 * @param ranking e.g. "A&gt;B=_bar_&gt;C". Empty to abstain.
	 * @return the canonical vote and the receipt secret
	 * @throws PlenumException when the vote is malformed or the ballot is not open
	 */
	@Mutation
	@Description("Cast a vote in a preferential ballot")
	public CastVoteResponse castPreferentialVote(
			@NonNull Long ballotId,
			@NonNull String voterId,
			@Description("Candidates ordered with '>' and tied with '='") String ranking
	) throws PlenumException {
		CastVoteResponse res = castVoteService.submitVote(ballotId, voterId, new PreferentialVote(ranking));
		log.info("castPreferentialVote: ballot.id=" + ballotId);
		return res;
	}

	@Mutation
	@Description("Cast a vote in a classical ballot")
	public CastVoteResponse castClassicalVote(
			@NonNull Long ballotId,
			@NonNull String voterId,
			List<String> selected,
			@DefaultValue("false") boolean rejectAll
	) throws PlenumException {
		CastVoteResponse res = castVoteService.submitVote(ballotId, voterId, new ClassicalSelection(selected == null ? List.of() : selected, rejectAll));
		log.info("castClassicalVote: ballot.id=" + ballotId);
		return res;
	}

	@Mutation
	@Description("Cast a classical vote that was recorded without the bar, e.g. 'A=B>C=D'")
	public CastVoteResponse castLegacyClassicalVote(@NonNull Long ballotId, @NonNull String voterId, @NonNull String vote) throws PlenumException {
		CastVoteResponse res = castVoteService.submitLegacyVote(ballotId, voterId, vote);
		log.info("castLegacyClassicalVote: ballot.id=" + ballotId);
		return res;
	}

	@Query
	@Description("Verify your vote with the receipt secret you got when you voted")
	public String verifyVote(@NonNull String receiptSecret) throws PlenumException {
		return castVoteService.verify(receiptSecret);
	}
}

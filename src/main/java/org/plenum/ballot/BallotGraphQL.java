package org.plenum.ballot;

import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.graphql.*;
import org.plenum.assembly.AssemblyEntity;
import org.plenum.assembly.AssemblyService;
import org.plenum.result.BallotResultView;
import org.plenum.result.TallyService;
import org.plenum.tally.VoteMode;
import org.plenum.util.PlenumException;
import org.plenum.vote.VoteEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * This adapter only handles the GraphQL API specifics.
 * All the business logic is in BallotService and TallyService.
 */
@Slf4j
@GraphQLApi
public class BallotGraphQL {

	@Inject
	BallotService ballotService;

	@Inject
	AssemblyService assemblyService;

	@Inject
	TallyService tallyService;

	/**
	 * Get one ballot by its ID
	 * @param ballotId ballotId (mandatory)
	 * @return the BallotEntity
	 */
	@Query
	public BallotEntity ballot(@NonNull Long ballotId) throws PlenumException {
		return ballotService.getBallot(ballotId);
	}

	@Query
	@Description("Get all ballots of an assembly")
	public List<BallotEntity> ballots(@NonNull Long assemblyId) throws PlenumException {
		return BallotEntity.listByAssembly(assemblyService.getAssembly(assemblyId));
	}

	@Query
	@Description("Number of votes cast in this ballot so far")
	public long numCastVotes(@Source BallotEntity ballot) {
		return VoteEntity.countByBallot(ballot);
	}

	@Mutation
	@Description("Create a new ballot in an assembly")
	@Transactional
	public BallotEntity createBallot(
			@NonNull Long assemblyId,
			@NonNull String title,
			String description,
			@NonNull VoteMode mode,
			@Description("CLASSICAL only: number of candidates a voter may select") Integer numVotes,
			@DefaultValue("false") boolean useBar,
			@DefaultValue("0") int quorum,
			LocalDateTime votingEndAt,
			LocalDateTime extensionEndAt
	) throws PlenumException {
		AssemblyEntity assembly = AssemblyEntity.<AssemblyEntity>findByIdOptional(assemblyId)
				.orElseThrow(PlenumException.supply(PlenumException.Errors.CANNOT_CREATE_BALLOT, "Cannot createBallot: There is no assembly with id=" + assemblyId));
		return ballotService.createBallot(assembly, title, description, mode, numVotes, useBar, quorum, votingEndAt, extensionEndAt);
	}

	@Mutation
	@Description("Add a candidate to a ballot in CONFIGURATION")
	@Transactional
	public BallotEntity addCandidate(@NonNull Long ballotId, @NonNull String shortname, String title) throws PlenumException {
		BallotEntity ballot = BallotEntity.<BallotEntity>findByIdOptional(ballotId)
				.orElseThrow(PlenumException.supply(PlenumException.Errors.CANNOT_ADD_CANDIDATE, "Cannot addCandidate: There is no ballot with id=" + ballotId));
		return ballotService.addCandidate(ballot, shortname, title);
	}

	@Mutation
	@Description("Start voting phase of a ballot")
	@Transactional
	public BallotEntity startVotingPhase(@NonNull Long ballotId) throws PlenumException {
		BallotEntity ballot = BallotEntity.<BallotEntity>findByIdOptional(ballotId)
				.orElseThrow(PlenumException.notFound("Cannot start voting phase. Ballot(id=" + ballotId + ") not found!"));
		return ballotService.startVotingPhase(ballot);
	}

	@Mutation
	@Description("Close a ballot before its voting period has ended")
	@Transactional
	public BallotEntity finishVotingPhase(@NonNull Long ballotId) throws PlenumException {
		BallotEntity ballot = BallotEntity.<BallotEntity>findByIdOptional(ballotId)
				.orElseThrow(PlenumException.notFound("Cannot finish voting phase. Ballot(id=" + ballotId + ") not found!"));
		return ballotService.finishVotingPhase(ballot);
	}

	/**
	 * Tally a closed ballot and publish its result. Tallying an already tallied ballot again audits its published result.
	 * @param ballotId ballot.id
	 * @return the published result
	 * @throws PlenumException when the ballot is not closed yet
	 */
	@Mutation
	@Description("Tally a closed ballot")
	public BallotResultView tallyBallot(@NonNull Long ballotId) throws PlenumException {
		return tallyService.tally(ballotId);
	}

	@Mutation
	@Description("Recompute the result of a tallied ballot and compare it with the published one")
	public BallotResultView auditTally(@NonNull Long ballotId) throws PlenumException {
		return tallyService.auditTally(ballotId);
	}

	@Query
	@Description("Get the published result of a tallied ballot")
	public BallotResultView ballotResult(@NonNull Long ballotId) throws PlenumException {
		return tallyService.getResult(ballotId);
	}
}

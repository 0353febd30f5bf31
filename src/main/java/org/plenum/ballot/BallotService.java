package org.plenum.ballot;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.graphql.NonNull;
import org.plenum.assembly.AssemblyEntity;
import org.plenum.tally.BallotSpec;
import org.plenum.tally.Candidate;
import org.plenum.tally.VoteMode;
import org.plenum.util.PlenumConfig;
import org.plenum.util.PlenumException;
import org.plenum.vote.VoteEntity;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * This service class contains the business logic around ballots:
 * create a ballot, add candidates, start the voting phase and close it when the voting period has ended.
 */
@Slf4j
@ApplicationScoped
public class BallotService {

	@Inject
	PlenumConfig config;

	/**
	 * Create a new ballot in an assembly. The ballot starts in status CONFIGURATION.
	 *
	 * @param assembly an assembly that is not concluded
	 * @param title title of the ballot
	 * @param mode PREFERENTIAL or CLASSICAL
	 * @param numVotes CLASSICAL only: how many candidates a voter may select. Must be null for PREFERENTIAL ballots.
	 * @param useBar may voters reject candidates?
	 * @param quorum minimum number of votes. Zero for none.
	 * @param votingEndAt (optional) end of the voting period
	 * @param extensionEndAt (optional) end of the extended voting period, if the quorum is not reached
	 * @return the new ballot
	 * @throws PlenumException when any of these parameters is invalid
	 */
	@Transactional
	public BallotEntity createBallot(@NonNull AssemblyEntity assembly, @NonNull String title, String description, @NonNull VoteMode mode,
	                                 Integer numVotes, boolean useBar, int quorum,
	                                 LocalDateTime votingEndAt, LocalDateTime extensionEndAt) throws PlenumException {
		if (assembly.isConcluded())
			throw new PlenumException(PlenumException.Errors.CANNOT_CREATE_BALLOT, "Assembly(id=" + assembly.id + ") is already concluded.");
		if (title == null || title.isBlank())
			throw new PlenumException(PlenumException.Errors.CANNOT_CREATE_BALLOT, "Ballot needs a title.");
		if (VoteMode.CLASSICAL.equals(mode) && (numVotes == null || numVotes < 1))
			throw new PlenumException(PlenumException.Errors.CANNOT_CREATE_BALLOT, "A classical ballot needs at least one vote per voter.");
		if (VoteMode.PREFERENTIAL.equals(mode) && numVotes != null)
			throw new PlenumException(PlenumException.Errors.CANNOT_CREATE_BALLOT, "A preferential ballot has no number of votes.");
		if (quorum < 0)
			throw new PlenumException(PlenumException.Errors.CANNOT_CREATE_BALLOT, "Quorum must not be negative.");
		if (votingEndAt != null && extensionEndAt != null && !extensionEndAt.isAfter(votingEndAt))
			throw new PlenumException(PlenumException.Errors.CANNOT_CREATE_BALLOT, "Extension must end after the regular voting period.");

		BallotEntity ballot = new BallotEntity(title, assembly);
		ballot.setDescription(description);
		ballot.setMode(mode);
		ballot.setNumVotes(numVotes);
		ballot.setUseBar(useBar);
		ballot.setQuorum(quorum);
		ballot.setVotingEndAt(votingEndAt);
		ballot.setExtensionEndAt(extensionEndAt);
		ballot.persist();
		log.info("Created " + ballot + " in " + assembly);
		return ballot;
	}

	/**
	 * Add a candidate to a ballot. The ballot must still be in CONFIGURATION.
	 * @param ballot ballot in CONFIGURATION
	 * @param shortname unique short token of the candidate within the ballot
	 * @param title human-readable title
	 * @return the updated ballot
	 * @throws PlenumException when the ballot is not in CONFIGURATION or the shortname is invalid or already used
	 */
	@Transactional
	public BallotEntity addCandidate(@NonNull BallotEntity ballot, @NonNull String shortname, String title) throws PlenumException {
		if (!BallotEntity.BallotStatus.CONFIGURATION.equals(ballot.getStatus()))
			throw new PlenumException(PlenumException.Errors.CANNOT_ADD_CANDIDATE, "Candidates can only be added while ballot(id=" + ballot.id + ") is in CONFIGURATION.");
		if (!Candidate.isValidShortname(shortname))
			throw new PlenumException(PlenumException.Errors.CANNOT_ADD_CANDIDATE, "Invalid shortname '" + shortname + "'.");
		if (ballot.getCandidates().stream().anyMatch(c -> c.getShortname().equals(shortname)))
			throw new PlenumException(PlenumException.Errors.CANNOT_ADD_CANDIDATE, "Ballot(id=" + ballot.id + ") already has a candidate '" + shortname + "'.");
		CandidateEntity candidate = new CandidateEntity(ballot, shortname, title == null ? shortname : title, ballot.getCandidates().size());
		ballot.getCandidates().add(candidate);
		ballot.persist();
		log.debug("Added " + candidate + " to " + ballot);
		return ballot;
	}

	/**
	 * Start the voting phase of a ballot.
	 * The ballot must be in CONFIGURATION and must have at least two candidates.
	 * If no end was given, then voting ends in {@link PlenumConfig#durationOfVotingPhase()} days at midnight.
	 * A ballot with a quorum but without an explicit extension end is extended by the same duration.
	 *
	 * @param ballot a ballot in CONFIGURATION
	 * @return the ballot that is now in status VOTING
	 * @throws PlenumException when the voting phase cannot be started
	 */
	@Transactional
	public BallotEntity startVotingPhase(@NonNull BallotEntity ballot) throws PlenumException {
		log.info("startVotingPhase of " + ballot);
		if (!BallotEntity.BallotStatus.CONFIGURATION.equals(ballot.getStatus()))
			throw new PlenumException(PlenumException.Errors.CANNOT_START_VOTING_PHASE, "Ballot(id=" + ballot.id + ") must be in status CONFIGURATION");
		if (ballot.getCandidates().size() < 2)
			throw new PlenumException(PlenumException.Errors.CANNOT_START_VOTING_PHASE, "Ballot(id=" + ballot.id + ") must have at least two candidates");
		if (ballot.getAssembly().isConcluded())
			throw new PlenumException(PlenumException.Errors.CANNOT_START_VOTING_PHASE, "Assembly of ballot(id=" + ballot.id + ") is already concluded");

		LocalDateTime votingStart = LocalDateTime.now();
		if (ballot.getVotingEndAt() == null) {
			ballot.setVotingEndAt(votingStart.truncatedTo(ChronoUnit.DAYS).plusDays(config.durationOfVotingPhase()));    // voting ends in n days at midnight
		}
		if (!ballot.getVotingEndAt().isAfter(votingStart))
			throw new PlenumException(PlenumException.Errors.CANNOT_START_VOTING_PHASE, "Voting period of ballot(id=" + ballot.id + ") would already be over.");
		if (ballot.getQuorum() > 0 && ballot.getExtensionEndAt() == null) {
			ballot.setExtensionEndAt(ballot.getVotingEndAt().plusDays(config.durationOfVotingPhase()));
		}
		ballot.setVotingStartAt(votingStart);
		ballot.setStatus(BallotEntity.BallotStatus.VOTING);
		ballot.persist();
		return ballot;
	}

	/**
	 * Manually close a ballot before its voting period has ended.
	 * @param ballot a ballot in VOTING
	 * @return the CLOSED ballot. It must still be tallied.
	 * @throws PlenumException when the ballot is not in VOTING
	 */
	@Transactional
	public BallotEntity finishVotingPhase(@NonNull BallotEntity ballot) throws PlenumException {
		log.info("finishVotingPhase of " + ballot);
		if (!BallotEntity.BallotStatus.VOTING.equals(ballot.getStatus()))
			throw new PlenumException(PlenumException.Errors.CANNOT_FINISH_VOTING_PHASE, "Cannot finishVotingPhase: Ballot(id=" + ballot.id + ") must be in status VOTING.");
		if (ballot.getExtended() == null) ballot.setExtended(false);
		ballot.setVotingEndAt(LocalDateTime.now());
		ballot.setStatus(BallotEntity.BallotStatus.CLOSED);
		ballot.persist();
		return ballot;
	}

	/**
	 * Close all ballots whose voting period has ended.
	 *
	 * When the regular voting period of a ballot ends, then it is decided once whether it is extended:
	 * A ballot is extended when less votes than its quorum have been cast. An extended ballot stays open until its extensionEndAt.
	 *
	 * @param now the current time
	 * @return IDs of the ballots that were closed
	 */
	@Transactional
	public List<Long> closeEndedBallots(LocalDateTime now) {
		List<Long> closed = new ArrayList<>();
		for (BallotEntity ballot : BallotEntity.listByStatus(BallotEntity.BallotStatus.VOTING)) {
			if (ballot.getVotingEndAt() == null || now.isBefore(ballot.getVotingEndAt())) continue;
			if (ballot.getExtended() == null) {
				long numVotes = VoteEntity.countByBallot(ballot);
				boolean extended = ballot.getQuorum() > 0 && numVotes < ballot.getQuorum();
				ballot.setExtended(extended);
				if (extended) log.info("Quorum of " + ballot.getQuorum() + " not reached (" + numVotes + " votes). Extend voting of " + ballot + " until " + ballot.getExtensionEndAt());
			}
			if (ballot.isOpenForVotes(now)) continue;
			ballot.setStatus(BallotEntity.BallotStatus.CLOSED);
			ballot.persist();
			log.info("Voting period has ended. Closed " + ballot);
			closed.add(ballot.id);
		}
		return closed;
	}

	/** IDs of all ballots that are closed, but not tallied yet */
	@Transactional
	public List<Long> listClosedBallotIds() {
		return BallotEntity.listByStatus(BallotEntity.BallotStatus.CLOSED).stream().map(b -> b.id).toList();
	}

	/** Load a ballot by its ID */
	public BallotEntity getBallot(Long ballotId) throws PlenumException {
		return BallotEntity.<BallotEntity>findByIdOptional(ballotId)
				.orElseThrow(PlenumException.notFound("Ballot(id=" + ballotId + ") not found."));
	}

	/**
	 * Candidates, vote mode and number of votes of a ballot, as needed by the tallying engine.
	 * @param ballotId ID of an existing ballot
	 * @return the rules of the ballot
	 * @throws PlenumException when the ballot does not exist
	 */
	public BallotSpec getBallotSpec(Long ballotId) throws PlenumException {
		return getBallot(ballotId).getBallotSpec();
	}
}

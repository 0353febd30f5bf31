package org.plenum.result;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.plenum.ballot.BallotEntity;
import org.plenum.util.PlenumException;
import org.plenum.vote.VoteEntity;

import java.util.List;

/**
 * Tally ballots and publish their result records.
 *
 * A result is published exactly once. Tallying an already tallied ballot again is an audit:
 * the record is recomputed from the stored votes and must be byte-identical to the published one.
 */
@Slf4j
@ApplicationScoped
public class TallyService {

	@Inject
	ResultRecordService resultRecordService;

	/**
	 * Tally a ballot.
	 *
	 * A CLOSED ballot is tallied, its result record is published and the ballot becomes TALLIED.
	 * A TALLIED ballot is audited and nothing is published again.
	 * The ballot row is locked while tallying. So concurrent calls cannot publish twice.
	 *
	 * @param ballotId ID of a CLOSED or TALLIED ballot
	 * @return the published result
	 * @throws PlenumException BALLOT_NOT_CLOSED when the ballot is still open,
	 *         TALLY_INTEGRITY_VIOLATION when an audit does not reproduce the published record
	 */
	@Transactional
	public BallotResultView tally(Long ballotId) throws PlenumException {
		BallotEntity ballot = BallotEntity.<BallotEntity>findByIdOptional(ballotId, LockModeType.PESSIMISTIC_WRITE)
				.orElseThrow(PlenumException.notFound("Cannot tally. Ballot(id=" + ballotId + ") not found."));

		if (BallotEntity.BallotStatus.TALLIED.equals(ballot.getStatus())) {
			return audit(ballot);
		}
		if (!BallotEntity.BallotStatus.CLOSED.equals(ballot.getStatus()))
			throw new PlenumException(PlenumException.Errors.BALLOT_NOT_CLOSED, "Cannot tally ballot(id=" + ballotId + "). It must be CLOSED, but is " + ballot.getStatus());

		List<VoteEntity> votes = VoteEntity.listByBallot(ballot);
		TalliedRecord tallied = resultRecordService.buildRecord(ballot, votes);
		ResultEntity published = ResultEntity.publish(ballot, tallied.getJson(), tallied.getSha256());

		ballot.setDuelMatrix(tallied.getTally().getDuelMatrix());
		ballot.setResult(tallied.getTally().getResultString());
		ballot.setStatus(BallotEntity.BallotStatus.TALLIED);
		ballot.persist();
		log.info("Tallied " + ballot + " with " + votes.size() + " votes: " + ballot.getResult() + " sha256=" + published.getSha256());
		return BallotResultView.of(ballot.id, tallied.getRecord(), published.getSha256());
	}

	/**
	 * Recompute the result of a tallied ballot and compare it with the published record.
	 * @param ballotId ID of a TALLIED ballot
	 * @return the published result
	 * @throws PlenumException TALLY_INTEGRITY_VIOLATION when the recomputed record differs in any byte
	 */
	@Transactional
	public BallotResultView auditTally(Long ballotId) throws PlenumException {
		BallotEntity ballot = BallotEntity.<BallotEntity>findByIdOptional(ballotId)
				.orElseThrow(PlenumException.notFound("Cannot audit. Ballot(id=" + ballotId + ") not found."));
		if (!BallotEntity.BallotStatus.TALLIED.equals(ballot.getStatus()))
			throw new PlenumException(PlenumException.Errors.BALLOT_NOT_CLOSED, "Cannot audit ballot(id=" + ballotId + "). It is not tallied yet.");
		return audit(ballot);
	}

	private BallotResultView audit(BallotEntity ballot) throws PlenumException {
		ResultEntity published = ResultEntity.findByBallot(ballot)
				.orElseThrow(PlenumException.supplyAndLog(PlenumException.Errors.TALLY_INTEGRITY_VIOLATION, ballot + " is TALLIED, but has no published result!"));
		TalliedRecord recomputed = resultRecordService.buildRecord(ballot, VoteEntity.listByBallot(ballot));
		if (!recomputed.getJson().equals(published.getJson())) {
			String msg = "Recomputed result of " + ballot + " differs from the published one! published sha256=" + published.getSha256() + " recomputed sha256=" + recomputed.getSha256();
			log.error(msg);
			throw new PlenumException(PlenumException.Errors.TALLY_INTEGRITY_VIOLATION, msg);
		}
		log.debug("Audit of " + ballot + " OK");
		return BallotResultView.of(ballot.id, ResultRecordService.parse(published.getJson()), published.getSha256());
	}

	/**
	 * Get the published result of a ballot.
	 * @param ballotId ID of a tallied ballot
	 * @return the published result
	 * @throws PlenumException when the ballot does not exist or is not tallied yet
	 */
	@Transactional
	public BallotResultView getResult(Long ballotId) throws PlenumException {
		ResultEntity published = getPublishedRecord(ballotId);
		return BallotResultView.of(ballotId, ResultRecordService.parse(published.getJson()), published.getSha256());
	}

	/** The stored result record of a ballot. */
	@Transactional
	public ResultEntity getPublishedRecord(Long ballotId) throws PlenumException {
		BallotEntity ballot = BallotEntity.<BallotEntity>findByIdOptional(ballotId)
				.orElseThrow(PlenumException.notFound("Ballot(id=" + ballotId + ") not found."));
		return ResultEntity.findByBallot(ballot)
				.orElseThrow(PlenumException.notFound("Ballot(id=" + ballotId + ") has no published result yet."));
	}
}

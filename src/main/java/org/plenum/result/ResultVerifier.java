package org.plenum.result;

import lombok.extern.slf4j.Slf4j;
import org.plenum.tally.*;
import org.plenum.util.PlenumException;
import org.plenum.vote.VoteEntity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Independent verification of a published result record.
 * This needs nothing but the public record. So anybody can do it, also after the receipts were deleted.
 */
@Slf4j
public class ResultVerifier {

	private ResultVerifier() {}

	/**
	 * Recompute the result of a published record from its votes.
	 * Every vote is decoded again with the ballot's rules. Then pairwise matrix, result and statistics must all match.
	 *
	 * @param json the published record
	 * @return the recomputed tally
	 * @throws PlenumException CANNOT_READ_RESULT when the record cannot be parsed,
	 *         a malformed vote error when a published vote is invalid,
	 *         TALLY_INTEGRITY_VIOLATION when the published result does not match the votes
	 */
	public static TallyResult verifyRecord(String json) throws PlenumException {
		BallotResultRecord record = ResultRecordService.parse(json);
		if (record.getVotes() == null)
			throw new PlenumException(PlenumException.Errors.CANNOT_READ_RESULT, "Result record of ballot '" + record.getBallot() + "' has no votes.");
		BallotSpec spec = toBallotSpec(record);
		List<String> voteStrings = record.getVotes().stream().map(BallotResultRecord.RecordedVote::getVote).toList();
		TallyResult tally = BallotTallier.tallyVoteStrings(spec, voteStrings);

		BallotResultRecord recomputed = ResultRecordService.toRecord(record.getAssembly(), record.getBallot(), tally, record.getVotes());
		if (!Arrays.deepEquals(record.getPairwise(), recomputed.getPairwise()))
			throw new PlenumException(PlenumException.Errors.TALLY_INTEGRITY_VIOLATION, "Published pairwise matrix does not match the votes.");
		if (!recomputed.getResult().equals(record.getResult()))
			throw new PlenumException(PlenumException.Errors.TALLY_INTEGRITY_VIOLATION, "Published result " + record.getResult() + " does not match the votes. Expected " + recomputed.getResult());
		if (!recomputed.getBoundaries().equals(record.getBoundaries()) ||
				recomputed.getAbstentions() != record.getAbstentions() ||
				recomputed.getNumberOfVotes() != record.getNumberOfVotes() ||
				!Objects.equals(recomputed.getCounts(), record.getCounts()))
			throw new PlenumException(PlenumException.Errors.TALLY_INTEGRITY_VIOLATION, "Published statistics do not match the votes.");
		log.debug("Verified result record of ballot '{}'", record.getBallot());
		return tally;
	}

	/**
	 * Find one's own vote in a published record.
	 * @param record the published record
	 * @param receiptSecret the secret that the voter got when they voted
	 * @return the vote whose hash matches the secret
	 */
	public static Optional<String> findOwnVote(BallotResultRecord record, String receiptSecret) {
		if (receiptSecret == null || record.getVotes() == null) return Optional.empty();
		return record.getVotes().stream()
				.filter(v -> VoteEntity.calcHash(v.getSalt(), receiptSecret, v.getVote()).equals(v.getHash()))
				.map(BallotResultRecord.RecordedVote::getVote)
				.findFirst();
	}

	/** Rebuild the ballot's rules from a record */
	static BallotSpec toBallotSpec(BallotResultRecord record) throws PlenumException {
		try {
			List<Candidate> candidates = new ArrayList<>();
			record.getCandidates().forEach((shortname, title) -> candidates.add(new Candidate(shortname, title)));
			CandidateSet candidateSet = new CandidateSet(candidates, record.isUseBar());
			BallotSpec spec = VoteMode.CLASSICAL.name().equals(record.getMode())
					? BallotSpec.classical(candidateSet, record.getNumVotes())
					: BallotSpec.preferential(candidateSet);
			if (!spec.getCandidateSet().getAllShortnames().equals(record.getCandidateOrder()))
				throw new PlenumException(PlenumException.Errors.CANNOT_READ_RESULT, "Candidate order of record does not match its candidates.");
			return spec;
		} catch (IllegalArgumentException | NullPointerException e) {
			throw new PlenumException(PlenumException.Errors.CANNOT_READ_RESULT, "Invalid ballot in result record: " + e.getMessage(), e);
		}
	}
}

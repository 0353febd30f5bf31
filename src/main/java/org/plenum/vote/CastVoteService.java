package org.plenum.vote;

import com.google.common.util.concurrent.Striped;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.narayana.jta.QuarkusTransactionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.plenum.assembly.AssemblyEntity;
import org.plenum.assembly.AttendeeEntity;
import org.plenum.ballot.BallotEntity;
import org.plenum.tally.BallotSpec;
import org.plenum.tally.LegacyVoteImporter;
import org.plenum.tally.PreferencePartition;
import org.plenum.tally.VoteCodec;
import org.plenum.tally.VotePayload;
import org.plenum.util.PlenumConfig;
import org.plenum.util.PlenumException;

import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;

/**
 * This service handles everything related to casting a vote and verifying it with a receipt.
 *
 * Votes of the same voter in the same ballot are serialized by a lock on their voteKey.
 * Each submission runs in its own transaction that is committed while the lock is still held. So the last submission wins
 * and there is always exactly one vote per voter and ballot. Votes of different voters never wait for each other,
 * except when their keys happen to share a lock stripe.
 */
@Slf4j
@ApplicationScoped
public class CastVoteService {

	/** This message is the same for unknown and for already deleted receipts. */
	public static final String VOTE_NOT_FOUND_MSG = "No vote found for this receipt.";

	private static final int SALT_BYTES = 16;

	@Inject
	PlenumConfig config;

	final Striped<Lock> voteKeyLocks = Striped.lazyWeakLock(256);

	final SecureRandom random = new SecureRandom();

	/**
	 * Cast a vote in a ballot or replace the voter's previous vote.
	 *
	 * The ballot must be open for votes and the voter must be an attendee of the ballot's assembly.
	 * The payload is encoded into its canonical form. Malformed votes are rejected, never fixed.
	 * A new receipt secret is created for every accepted vote. The receipt of a replaced vote is deleted.
	 *
	 * @param ballotId ballot to vote in
	 * @param voterId identity of the voter
	 * @param payload the voter's raw vote
	 * @return the canonical vote and the receipt secret
	 * @throws PlenumException when the ballot is not open, the voter is not attending or the vote is malformed
	 */
	public CastVoteResponse submitVote(Long ballotId, String voterId, VotePayload payload) throws PlenumException {
		return lockAndStore(ballotId, voterId, ballot -> new VoteCodec(ballot).encode(payload));
	}

	/**
	 * Cast a classical vote that was recorded without the bar, e.g. by an older voting client.
	 * All-tied votes are interpreted with the configured {@link PlenumConfig#legacyTiePolicy()}.
	 *
	 * @param ballotId a classical ballot with bar
	 * @param voterId identity of the voter
	 * @param legacyVote e.g. "A=B&gt;C=D"
	 * @return the canonical vote and the receipt secret
	 * @throws PlenumException LEGACY_VOTE_AMBIGUOUS when the policy does not allow to import an all-tied vote
	 */
	public CastVoteResponse submitLegacyVote(Long ballotId, String voterId, String legacyVote) throws PlenumException {
		return lockAndStore(ballotId, voterId, ballot -> {
			if (!ballot.isClassical() || !ballot.isUseBar())
				throw new PlenumException(PlenumException.Errors.MALFORMED_VOTE, "Legacy votes can only be cast in classical ballots with a bar.");
			return new LegacyVoteImporter(ballot, config.legacyTiePolicy()).importVote(legacyVote);
		});
	}

	/**
	 * Votes of one voter in one ballot are stored one after the other. Each one in its own transaction.
	 */
	private CastVoteResponse lockAndStore(Long ballotId, String voterId, VoteEncoder encoder) throws PlenumException {
		if (ballotId == null)
			throw new PlenumException(PlenumException.Errors.CANNOT_CAST_VOTE, "Need a ballot to cast a vote.");
		if (voterId == null || voterId.isBlank())
			throw new PlenumException(PlenumException.Errors.NOT_ATTENDING, "Need a voter to cast a vote.");
		String voteKey = calcVoteKey(voterId, ballotId);
		Lock lock = voteKeyLocks.get(voteKey);
		lock.lock();
		try {
			return QuarkusTransaction.requiringNew().call(() -> storeVote(ballotId, voterId, voteKey, encoder));
		} catch (QuarkusTransactionException e) {
			if (e.getCause() instanceof PlenumException pe) throw pe;
			throw new PlenumException(PlenumException.Errors.INTERNAL_ERROR, "Cannot store vote in ballot(id=" + ballotId + ")", e);
		} finally {
			lock.unlock();
		}
	}

	/** Turns the raw input of a voter into the canonical vote of a ballot */
	interface VoteEncoder {
		PreferencePartition encode(BallotSpec ballot) throws PlenumException;
	}

	/**
	 * Upsert the vote. Must be called inside a transaction and while holding the lock of the voteKey.
	 */
	CastVoteResponse storeVote(Long ballotId, String voterId, String voteKey, VoteEncoder encoder) throws PlenumException {
		BallotEntity ballot = BallotEntity.<BallotEntity>findByIdOptional(ballotId)
				.orElseThrow(PlenumException.notFound("Cannot cast vote. Ballot(id=" + ballotId + ") not found."));
		if (!ballot.isOpenForVotes(LocalDateTime.now()))
			throw new PlenumException(PlenumException.Errors.CANNOT_CAST_VOTE, "Ballot(id=" + ballotId + ") is not open for votes.");
		AssemblyEntity assembly = ballot.getAssembly();
		if (AttendeeEntity.findByAssemblyAndVoterId(assembly, voterId).isEmpty())
			throw new PlenumException(PlenumException.Errors.NOT_ATTENDING, "You must attend the assembly to vote in its ballots.");

		PreferencePartition partition = encoder.encode(ballot.getBallotSpec());
		String voteString = partition.toVoteString();

		String receiptSecret = UUID.randomUUID().toString();
		String salt = createSalt();
		String hash = VoteEntity.calcHash(salt, receiptSecret, voteString);

		VoteEntity vote;
		Optional<VoteEntity> existingVote = VoteEntity.findByBallotAndVoteKey(ballot, voteKey);
		if (existingVote.isPresent()) {
			vote = existingVote.get();
			long deleted = ReceiptEntity.deleteByVote(vote);
			log.debug("Replace existing vote.id={} in ballot.id={} (deleted {} old receipt)", vote.id, ballotId, deleted);
			vote.setVote(voteString);
			vote.setSalt(salt);
			vote.setHash(hash);
		} else {
			vote = new VoteEntity(ballot, voteKey, voteString, salt, hash);
			log.debug("Store new vote in ballot.id={}", ballotId);
		}
		vote.persist();
		ReceiptEntity.buildAndPersist(hashSecret(receiptSecret), vote, assembly);

		CastVoteResponse res = new CastVoteResponse(ballotId, voteString, receiptSecret);
		res.setReplaced(existingVote.isPresent());
		return res;
	}

	/**
	 * Verify a receipt: find the vote that was stored for this receipt secret.
	 * There is no way to tell an unknown secret apart from a secret whose receipt was already deleted.
	 *
	 * @param receiptSecret the secret that the voter got when they voted
	 * @return the canonical vote string
	 * @throws PlenumException VOTE_NOT_FOUND when there is no receipt for this secret
	 */
	@Transactional
	public String verify(String receiptSecret) throws PlenumException {
		if (receiptSecret == null || receiptSecret.isBlank())
			throw new PlenumException(PlenumException.Errors.VOTE_NOT_FOUND, VOTE_NOT_FOUND_MSG);
		return ReceiptEntity.findByHashedSecret(hashSecret(receiptSecret))
				.map(receipt -> receipt.vote.getVote())
				.orElseThrow(PlenumException.supply(PlenumException.Errors.VOTE_NOT_FOUND, VOTE_NOT_FOUND_MSG));
	}

	/**
	 * The voteKey is stable for one voter in one ballot. But it cannot be traced back to the voter without the hashSecret.
	 * @param voterId identity of the voter
	 * @param ballotId ballot
	 * @return SHA3-256 as hex
	 */
	String calcVoteKey(String voterId, Long ballotId) {
		return DigestUtils.sha3_256Hex(voterId + ":" + ballotId + config.hashSecret());
	}

	private String hashSecret(String receiptSecret) {
		return DigestUtils.sha3_256Hex(receiptSecret + config.hashSecret());
	}

	private String createSalt() {
		byte[] bytes = new byte[SALT_BYTES];
		random.nextBytes(bytes);
		return Hex.encodeHexString(bytes);
	}
}

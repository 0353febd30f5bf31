package org.plenum.vote;

import com.fasterxml.jackson.annotation.JsonBackReference;
import com.fasterxml.jackson.annotation.JsonIgnore;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.eclipse.microprofile.graphql.Ignore;
import org.plenum.ballot.BallotEntity;

import java.util.List;
import java.util.Optional;

/**
 * The anonymous vote of one voter in one ballot.
 *
 * A vote does *NOT* contain any reference to the voter. Instead it contains a voteKey, which is the hashed value
 * of voterId, ballot and a server secret. When the voter votes again, then the existing vote with the same voteKey is replaced.
 *
 * Each vote also contains a random salt and a hash = HMAC-SHA512(salt, secret + vote).
 * Only the voter knows the secret from their receipt. So only they can find their own vote in the published result.
 */
@Data
@Entity(name = "votes")
@NoArgsConstructor(force = true)
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = true)
@Table(uniqueConstraints = {
		@UniqueConstraint(columnNames = {"ballot_id", "voteKey"})   // one vote per voter and ballot
})
public class VoteEntity extends PanacheEntity {
	//VoteEntity deliberately does NOT extend BaseEntity!
	//No createdAt or updatedAt. This could be used to find out who voted when.

	@NotNull
	@NonNull
	@ManyToOne(fetch = FetchType.LAZY)
	@JsonBackReference
	@Ignore
	public BallotEntity ballot;

	/** SHA3-256(voterId ":" ballotId hashSecret). Never expose this. */
	@NotNull
	@NonNull
	@JsonIgnore
	@Ignore
	public String voteKey;

	/** the canonical vote string, e.g. "A=B&gt;_bar_&gt;C" */
	@NotNull
	@NonNull
	public String vote;

	@NotNull
	@NonNull
	public String salt;

	/** HMAC-SHA512 of the voter's receipt secret and the vote, keyed with the salt */
	@NotNull
	@NonNull
	public String hash;

	/**
	 * Calculate the hash that a voter can use to find their vote in the published result.
	 * @param salt random salt of this vote
	 * @param secret the voter's receipt secret
	 * @param vote canonical vote string
	 * @return HMAC-SHA512 as hex
	 */
	public static String calcHash(String salt, String secret, String vote) {
		return new HmacUtils(HmacAlgorithms.HMAC_SHA_512, salt).hmacHex(secret + vote);
	}

	public static Optional<VoteEntity> findByBallotAndVoteKey(BallotEntity ballot, String voteKey) {
		return VoteEntity.find("ballot = ?1 and voteKey = ?2", ballot, voteKey).firstResultOptional();
	}

	/** All votes of a ballot. Order is not meaningful. */
	public static List<VoteEntity> listByBallot(BallotEntity ballot) {
		return VoteEntity.list("ballot", ballot);
	}

	public static long countByBallot(BallotEntity ballot) {
		return VoteEntity.count("ballot", ballot);
	}

	@Override
	public String toString() {
		//Do not expose voteKey or vote!
		return "Vote[id=" + id + ", ballot.id=" + (ballot != null ? ballot.id : null) + "]";
	}
}

package org.plenum.result;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import org.plenum.ballot.BallotEntity;
import org.plenum.model.BaseEntity;

import java.util.Optional;

/**
 * The published result record of a ballot. There is at most one per ballot and it never changes.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(of = {}, callSuper = true)
@Entity(name = "results")
public class ResultEntity extends BaseEntity {

	@NotNull
	@OneToOne(fetch = FetchType.LAZY)
	@JoinColumn(unique = true, updatable = false)
	BallotEntity ballot;

	/** the result record as JSON, exactly as it was rendered */
	@NotNull
	@Column(length = 1000000, updatable = false)
	String json;

	/** SHA-256 of json as hex */
	@NotNull
	@Column(updatable = false)
	String sha256;

	/**
	 * Store the result record of a ballot.
	 * @param ballot the tallied ballot
	 * @param json the rendered record
	 * @param sha256 digest of json
	 * @return the persisted result
	 */
	public static ResultEntity publish(BallotEntity ballot, String json, String sha256) {
		if (findByBallot(ballot).isPresent())
			throw new IllegalStateException("Result of " + ballot + " is already published");
		ResultEntity result = new ResultEntity();
		result.ballot = ballot;
		result.json = json;
		result.sha256 = sha256;
		result.persist();
		return result;
	}

	public static Optional<ResultEntity> findByBallot(BallotEntity ballot) {
		return ResultEntity.find("ballot", ballot).firstResultOptional();
	}

	@Override
	public String toString() {
		return "Result[id=" + id + ", ballot.id=" + (ballot != null ? ballot.id : null) + ", sha256=" + sha256 + "]";
	}
}

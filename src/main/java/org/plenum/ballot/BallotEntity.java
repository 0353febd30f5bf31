package org.plenum.ballot;

import com.fasterxml.jackson.annotation.JsonManagedReference;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import org.eclipse.microprofile.graphql.Ignore;
import org.plenum.assembly.AssemblyEntity;
import org.plenum.ballot.converter.MatrixConverter;
import org.plenum.model.BaseEntity;
import org.plenum.tally.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One matter that the attendees of an assembly vote on. A ballot has a fixed set of candidates once its voting phase has started.
 */
@Data
@NoArgsConstructor(force = true)
@RequiredArgsConstructor
@EqualsAndHashCode(of = {}, callSuper = true)
@Entity(name = "ballots")
public class BallotEntity extends BaseEntity {

	@NotNull
	@lombok.NonNull
	String title;

	String description;

	@NotNull
	@lombok.NonNull
	@ManyToOne(fetch = FetchType.EAGER)
	AssemblyEntity assembly;

	/**
	 * Candidates in display order.
	 * Do not simply add to this list. Use BallotService.addCandidate instead.
	 */
	@OneToMany(cascade = CascadeType.ALL, mappedBy = "ballot", fetch = FetchType.EAGER)
	@OrderBy("position")
	@JsonManagedReference
	List<CandidateEntity> candidates = new ArrayList<>();

	@NotNull
	@Enumerated(EnumType.STRING)
	VoteMode mode = VoteMode.PREFERENTIAL;

	/** Number of candidates a voter may select in a CLASSICAL ballot. Null for PREFERENTIAL ballots. */
	Integer numVotes;

	/** Does this ballot have the option to reject candidates with the bar? */
	boolean useBar = false;

	/** When less votes than this were cast at votingEndAt, then voting is extended until extensionEndAt. Zero means no quorum. */
	int quorum = 0;

	public enum BallotStatus {
		CONFIGURATION(0),   // candidates can be added. Voters cannot vote yet.
		VOTING(1),          // voters can cast their votes. Candidates are fixed.
		CLOSED(2),          // no more votes. Waiting to be tallied.
		TALLIED(3);         // result is published and cannot change anymore
		final int statusId;
		BallotStatus(int id) { this.statusId = id; }
	}

	@NotNull
	@Enumerated(EnumType.STRING)
	BallotStatus status = BallotStatus.CONFIGURATION;

	/** Date and time when the voting phase started. */
	LocalDateTime votingStartAt;

	/** Date and time when the regular voting phase ends. */
	LocalDateTime votingEndAt;

	/** End of the extended voting phase. Only used when the ballot has a quorum. */
	LocalDateTime extensionEndAt;

	/**
	 * Was the voting phase extended because the quorum was not reached?
	 * Null as long as this has not been decided. It is decided exactly once, at votingEndAt.
	 */
	Boolean extended;

	/** Pairwise comparison of all candidates (including the bar) over all votes. Set when the ballot is tallied. */
	@Convert(converter = MatrixConverter.class)
	@Column(length = 100000)
	@Ignore
	Matrix duelMatrix;

	/** Aggregate result as canonical string, e.g. "A=B&gt;_bar_&gt;C". Set when the ballot is tallied. */
	String result;

	/** The candidates of this ballot as used by the tallying engine */
	@Ignore
	public CandidateSet getCandidateSet() {
		return new CandidateSet(candidates.stream().map(CandidateEntity::toCandidate).toList(), useBar);
	}

	/** Candidate set, vote mode and number of votes */
	@Ignore
	public BallotSpec getBallotSpec() {
		CandidateSet candidateSet = getCandidateSet();
		return VoteMode.CLASSICAL.equals(mode)
				? BallotSpec.classical(candidateSet, numVotes)
				: BallotSpec.preferential(candidateSet);
	}

	/**
	 * Can votes be cast at this moment?
	 * @param now the current time
	 * @return true when in status VOTING and the regular or extended voting period has not ended yet.
	 */
	public boolean isOpenForVotes(LocalDateTime now) {
		if (!BallotStatus.VOTING.equals(status)) return false;
		if (votingStartAt != null && now.isBefore(votingStartAt)) return false;
		if (votingEndAt == null || now.isBefore(votingEndAt)) return true;
		return Boolean.TRUE.equals(extended) && extensionEndAt != null && now.isBefore(extensionEndAt);
	}

	public static List<BallotEntity> listByAssembly(AssemblyEntity assembly) {
		return BallotEntity.list("assembly", assembly);
	}

	public static List<BallotEntity> listByStatus(BallotStatus status) {
		return BallotEntity.list("status", status);
	}

	@Override
	public String toString() {
		return "Ballot[id=" + id +
				", title='" + title + "'" +
				", status=" + status +
				", mode=" + mode +
				", useBar=" + useBar +
				", numCandidates=" + (candidates != null ? candidates.size() : 0) +
				"]";
	}
}

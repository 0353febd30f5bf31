package org.plenum.ballot;

import com.fasterxml.jackson.annotation.JsonBackReference;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import org.eclipse.microprofile.graphql.Ignore;
import org.plenum.model.BaseEntity;
import org.plenum.tally.Candidate;

/**
 * One candidate of a ballot. Candidates are displayed in the order of their position.
 */
@Data
@NoArgsConstructor(force = true)
@EqualsAndHashCode(of = {}, callSuper = true)
@Entity(name = "candidates")
@Table(uniqueConstraints = {
		@UniqueConstraint(columnNames = {"ballot_id", "shortname"})   // shortnames are unique within a ballot
})
public class CandidateEntity extends BaseEntity {

	@ManyToOne(fetch = FetchType.LAZY)
	@JsonBackReference
	@Ignore
	BallotEntity ballot;

	/** short token that voters use in their votes, e.g. "Anton" */
	@NotNull
	String shortname;

	/** human-readable title */
	String title;

	/** display position within the ballot */
	int position;

	public CandidateEntity(BallotEntity ballot, String shortname, String title, int position) {
		this.ballot = ballot;
		this.shortname = shortname;
		this.title = title;
		this.position = position;
	}

	public Candidate toCandidate() {
		return new Candidate(shortname, title);
	}

	@Override
	public String toString() {
		return "Candidate[id=" + id + ", shortname=" + shortname + "]";
	}
}

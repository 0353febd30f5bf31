package org.plenum.assembly;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import org.plenum.model.BaseEntity;

import java.util.Optional;

/**
 * An assembly of members that vote on one or more ballots.
 * When an assembly is concluded, then all receipts of its voters are deleted. Votes and results are kept.
 */
@Data
@NoArgsConstructor(force = true)
@RequiredArgsConstructor
@EqualsAndHashCode(of = {}, callSuper = true)    	// Compare assemblies by their ID only.
@Entity(name = "assemblies")
public class AssemblyEntity extends BaseEntity {

	/** Title of the assembly. Must be unique. */
	@NotNull
	@lombok.NonNull
	@Column(unique = true)
	String title;

	String description;

	/** A concluded assembly cannot be changed anymore. Receipts of its voters are gone. */
	boolean concluded = false;

	public static Optional<AssemblyEntity> findByTitle(String title) {
		return AssemblyEntity.find("title", title).firstResultOptional();
	}

	@Override
	public String toString() {
		return "Assembly[id=" + id + ", title='" + title + "', concluded=" + concluded + "]";
	}
}

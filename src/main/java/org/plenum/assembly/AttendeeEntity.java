package org.plenum.assembly;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import org.plenum.model.BaseEntity;

import java.util.Optional;

/**
 * A voter that signed up for an assembly. Only attendees may vote in the ballots of an assembly.
 * The voterId is the identity of the member as given by the surrounding member registry.
 */
@Data
@NoArgsConstructor(force = true)
@RequiredArgsConstructor
@EqualsAndHashCode(of = {}, callSuper = true)
@Entity(name = "attendees")
@Table(uniqueConstraints = {
		@UniqueConstraint(columnNames = {"assembly_id", "voterId"})   // a voter signs up only once per assembly
})
public class AttendeeEntity extends BaseEntity {

	@NotNull
	@lombok.NonNull
	@ManyToOne(fetch = FetchType.EAGER)
	AssemblyEntity assembly;

	@NotNull
	@lombok.NonNull
	String voterId;

	public static Optional<AttendeeEntity> findByAssemblyAndVoterId(AssemblyEntity assembly, String voterId) {
		return AttendeeEntity.find("assembly = ?1 and voterId = ?2", assembly, voterId).firstResultOptional();
	}

	public static long countByAssembly(AssemblyEntity assembly) {
		return AttendeeEntity.count("assembly", assembly);
	}

	@Override
	public String toString() {
		return "Attendee[id=" + id + ", assembly.id=" + (assembly != null ? assembly.id : null) + ", voterId=" + voterId + "]";
	}
}

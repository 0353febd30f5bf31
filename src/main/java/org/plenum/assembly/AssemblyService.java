package org.plenum.assembly;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.graphql.NonNull;
import org.plenum.ballot.BallotEntity;
import org.plenum.util.PlenumException;
import org.plenum.vote.ReceiptEntity;

import java.util.List;

/**
 * Business logic around assemblies: create an assembly, sign up attendees and finally conclude the assembly.
 */
@Slf4j
@ApplicationScoped
public class AssemblyService {

	@Transactional
	public AssemblyEntity createAssembly(@NonNull String title, String description) throws PlenumException {
		if (title == null || title.isBlank())
			throw new PlenumException(PlenumException.Errors.CANNOT_CREATE_ASSEMBLY, "Assembly needs a title.");
		if (AssemblyEntity.findByTitle(title).isPresent())
			throw new PlenumException(PlenumException.Errors.CANNOT_CREATE_ASSEMBLY, "Assembly with title '" + title + "' already exists.");
		AssemblyEntity assembly = new AssemblyEntity(title);
		assembly.setDescription(description);
		assembly.persist();
		log.info("Created " + assembly);
		return assembly;
	}

	/**
	 * Sign up a voter for an assembly. Only attendees may vote.
	 * @param assembly an assembly that is not yet concluded
	 * @param voterId identity of the voter
	 * @return the new attendee
	 * @throws PlenumException when the assembly is concluded or the voter already signed up
	 */
	@Transactional
	public AttendeeEntity signup(@NonNull AssemblyEntity assembly, @NonNull String voterId) throws PlenumException {
		if (voterId == null || voterId.isBlank())
			throw new PlenumException(PlenumException.Errors.CANNOT_SIGNUP, "Need a voterId to sign up.");
		if (assembly.isConcluded())
			throw new PlenumException(PlenumException.Errors.CANNOT_SIGNUP, "Assembly(id=" + assembly.id + ") is already concluded.");
		if (AttendeeEntity.findByAssemblyAndVoterId(assembly, voterId).isPresent())
			throw new PlenumException(PlenumException.Errors.CANNOT_SIGNUP, "Voter already attends assembly(id=" + assembly.id + ").");
		AttendeeEntity attendee = new AttendeeEntity(assembly, voterId);
		attendee.persist();
		log.debug("Signed up voter for " + assembly);
		return attendee;
	}

	/**
	 * Conclude an assembly. All ballots of the assembly must be tallied.
	 * This deletes the receipts of all voters. Votes and results remain, so every tally can still be audited.
	 * This cannot be undone.
	 *
	 * @param assembly an assembly with only tallied ballots
	 * @return the concluded assembly
	 * @throws PlenumException when the assembly is already concluded or there still is a ballot that is not tallied
	 */
	@Transactional
	public AssemblyEntity concludeAssembly(@NonNull AssemblyEntity assembly) throws PlenumException {
		if (assembly.isConcluded())
			throw new PlenumException(PlenumException.Errors.CANNOT_CONCLUDE_ASSEMBLY, "Assembly(id=" + assembly.id + ") is already concluded.");
		List<BallotEntity> openBallots = BallotEntity.listByAssembly(assembly).stream()
				.filter(b -> !BallotEntity.BallotStatus.TALLIED.equals(b.getStatus()))
				.toList();
		if (!openBallots.isEmpty())
			throw new PlenumException(PlenumException.Errors.CANNOT_CONCLUDE_ASSEMBLY, "Cannot conclude assembly(id=" + assembly.id + "). There still are " + openBallots.size() + " ballots that are not tallied.");

		long purged = ReceiptEntity.deleteByAssembly(assembly);
		assembly.setConcluded(true);
		assembly.persist();
		log.info("Concluded " + assembly + ". Deleted " + purged + " receipts.");
		return assembly;
	}

	/** Load an assembly by its ID */
	public AssemblyEntity getAssembly(Long assemblyId) throws PlenumException {
		return AssemblyEntity.<AssemblyEntity>findByIdOptional(assemblyId)
				.orElseThrow(PlenumException.notFound("Assembly(id=" + assemblyId + ") not found."));
	}
}

package org.plenum.assembly;

import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.graphql.*;
import org.plenum.util.PlenumException;

import java.util.List;

/**
 * This adapter only handles the GraphQL API specifics.
 * All the business logic is in AssemblyService.
 */
@Slf4j
@GraphQLApi
public class AssemblyGraphQL {

	@Inject
	AssemblyService assemblyService;

	@Query
	@Description("Get one assembly by its ID")
	public AssemblyEntity assembly(@NonNull Long assemblyId) throws PlenumException {
		return assemblyService.getAssembly(assemblyId);
	}

	@Query
	@Description("Get all assemblies")
	public List<AssemblyEntity> assemblies() {
		return AssemblyEntity.listAll();
	}

	@Mutation
	@Description("Create a new assembly")
	@Transactional
	public AssemblyEntity createAssembly(@NonNull String title, String description) throws PlenumException {
		return assemblyService.createAssembly(title, description);
	}

	@Mutation
	@Description("Sign up a voter for an assembly. Only attendees may vote.")
	@Transactional
	public AssemblyEntity signup(@NonNull Long assemblyId, @NonNull String voterId) throws PlenumException {
		AssemblyEntity assembly = AssemblyEntity.<AssemblyEntity>findByIdOptional(assemblyId)
				.orElseThrow(PlenumException.supply(PlenumException.Errors.CANNOT_SIGNUP, "Cannot signup: There is no assembly with id=" + assemblyId));
		assemblyService.signup(assembly, voterId);
		return assembly;
	}

	@Query
	@Description("Number of attendees of an assembly")
	public long numAttendees(@Source AssemblyEntity assembly) {
		return AttendeeEntity.countByAssembly(assembly);
	}

	/**
	 * Conclude an assembly. All ballots must be tallied. This deletes all receipts and cannot be undone.
	 * @param assemblyId assembly.id
	 * @return the concluded assembly
	 * @throws PlenumException when there still are ballots that are not tallied
	 */
	@Mutation
	@Description("Conclude an assembly and delete all receipts of its voters")
	@Transactional
	public AssemblyEntity concludeAssembly(@NonNull Long assemblyId) throws PlenumException {
		AssemblyEntity assembly = assemblyService.getAssembly(assemblyId);
		return assemblyService.concludeAssembly(assembly);
	}
}

package org.plenum;

import io.quarkus.test.TestTransaction;
import io.quarkus.test.junit.QuarkusTest;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.plenum.assembly.AssemblyEntity;
import org.plenum.ballot.BallotEntity;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@QuarkusTest
public class EqualityTests {

	@Test
	public void twoNotYetPersistedAssemblies_ShouldNotBeEqual() {
		AssemblyEntity a1 = new AssemblyEntity("Same title");
		AssemblyEntity a2 = new AssemblyEntity("Same title");
		assertNotEquals(a1, a2, "Not yet persisted assemblies (even with the same title) should NOT be equal!");
	}

	@Test
	@TestTransaction
	public void twoInstancesOfSamePersistedAssembly_ShouldBeEqual() {
		AssemblyEntity a1 = new AssemblyEntity(PlenumTestUtils.uniqueName("EqualityTest"));
		a1.persist();
		assertNotNull(a1.id, "Persisted AssemblyEntity MUST have an ID!");

		AssemblyEntity a2 = AssemblyEntity.findById(a1.id);
		assertEquals(a1, a2, "Two instances of same persisted assembly should equal!");
		assertEquals(a1.hashCode(), a2.hashCode());
	}

	@Test
	@TestTransaction
	public void ballotsWithSameDataButDifferentIds_ShouldNotBeEqual() {
		AssemblyEntity assembly = new AssemblyEntity(PlenumTestUtils.uniqueName("EqualityTest"));
		assembly.persist();
		BallotEntity b1 = new BallotEntity("Same ballot", assembly);
		BallotEntity b2 = new BallotEntity("Same ballot", assembly);
		b1.persist();
		b2.persist();
		assertNotEquals(b1, b2, "Two persisted ballots with different IDs should not be equal");
	}
}

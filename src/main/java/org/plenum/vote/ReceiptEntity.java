package org.plenum.vote;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import org.plenum.assembly.AssemblyEntity;

import java.util.Optional;

/**
 * A receipt links the hash of a voter's secret to their vote.
 * The plain secret is only known to the voter. Receipts are deleted when the assembly concludes.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true, callSuper = false)
@Entity(name = "receipts")
public class ReceiptEntity extends PanacheEntityBase {
	// No BaseEntity. No timestamps. Our own ID.

	/** SHA3-256(secret hashSecret) */
	@Id
	@NonNull
	@EqualsAndHashCode.Include
	public String hashedSecret;

	@NotNull
	@OneToOne(fetch = FetchType.EAGER)
	@JoinColumn(unique = true)
	public VoteEntity vote;

	/** needed to delete all receipts when the assembly concludes */
	@NotNull
	@ManyToOne(fetch = FetchType.LAZY)
	public AssemblyEntity assembly;

	public static ReceiptEntity buildAndPersist(@NonNull String hashedSecret, @NonNull VoteEntity vote, @NonNull AssemblyEntity assembly) {
		ReceiptEntity receipt = new ReceiptEntity();
		receipt.hashedSecret = hashedSecret;
		receipt.vote = vote;
		receipt.assembly = assembly;
		receipt.persist();
		return receipt;
	}

	public static Optional<ReceiptEntity> findByHashedSecret(String hashedSecret) {
		return ReceiptEntity.findByIdOptional(hashedSecret);
	}

	public static long deleteByVote(VoteEntity vote) {
		return ReceiptEntity.delete("vote", vote);
	}

	public static long deleteByAssembly(AssemblyEntity assembly) {
		return ReceiptEntity.delete("assembly", assembly);
	}

	@Override
	public String toString() {
		return "Receipt[vote.id=" + (vote != null ? vote.id : null) + "]";
	}
}

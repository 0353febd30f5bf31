package org.plenum.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import org.hibernate.Hibernate;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Common superclass of assemblies, attendees, ballots, candidates and published results.
 * Hibernate fills createdAt and updatedAt on every flush.
 *
 * Votes and receipts must not extend this class. A timestamp on a vote could link it back to its voter.
 *
 * Identity is the database ID. A transient entity is only equal to itself.
 * Lazy proxies compare equal to their loaded entity.
 */
@MappedSuperclass
public class BaseEntity extends PanacheEntity {

	@CreationTimestamp
	@Column(nullable = false, updatable = false)
	public LocalDateTime createdAt;

	@UpdateTimestamp
	@Column(nullable = false)
	public LocalDateTime updatedAt;

	public Long getId() {
		return this.id;
	}

	/** @return true once this entity has been flushed and got its ID */
	public boolean isPersisted() {
		return this.id != null;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof BaseEntity other)) return false;
		if (!isPersisted() || !other.isPersisted()) return false;
		return Hibernate.getClass(this).equals(Hibernate.getClass(other)) && id.equals(other.id);
	}

	// Stable across persist. Entities do not change their hash when they get an ID.
	@Override
	public int hashCode() {
		return Hibernate.getClass(this).hashCode();
	}
}

package com.churnmetrics.api.platform;

import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.Serializable;
import java.time.OffsetDateTime;

/**
 * <p>
 * {@link BasicEntity} is a {@link MappedSuperclass mapped superclass} that contains the following
 * common fields for merchant-owned catalogue tables.
 * </p>
 * <ol>
 *     <li>{@link BasicEntity#id} - an incrementing (sequence) primary key of the table</li>
 *     <li>{@link BasicEntity#createdAt} - the creation timestamp of the row</li>
 *     <li>{@link BasicEntity#deletedAt} - the deletion timestamp of the row</li>
 *     <li>{@link BasicEntity#version} - optimistic lock used by the JPA during update queries</li>
 * </ol>
 *
 * <p>
 * A row is considered <i>alive</i> while its {@link BasicEntity#deletedAt} is {@literal null}.
 * Clients must use {@link BasicEntityRepository} for database interactions to respect soft
 * deletes.
 * </p>
 *
 * @param <ID> a serializable type representing the primary key the table, typically {@link Long}.
 */
@MappedSuperclass
@Data
@NoArgsConstructor
public class BasicEntity<ID extends Serializable> {

    static final String SOFT_DELETE_FIELD = "deletedAt";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private ID id;

    @Column(updatable = false)
    @Setter(AccessLevel.NONE)
    private OffsetDateTime createdAt;

    @Setter(AccessLevel.PACKAGE)
    private OffsetDateTime deletedAt;

    @Version
    @Setter(AccessLevel.NONE)
    private long version;

    /**
     * @return whether this row hasn't been soft-deleted.
     */
    public boolean isAlive() {
        return deletedAt == null;
    }

    @PrePersist
    void setCreatedAt() {
        this.createdAt = OffsetDateTime.now();
    }
}

package com.churnmetrics.api.platform;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.transaction.annotation.Transactional;

import java.io.Serializable;
import java.util.Optional;

/**
 * <p>
 * {@link BasicEntityRepository} is a direct descendant of Spring's {@link CrudRepository}. It
 * implements soft-deletes for the descendants of {@link BasicEntity}. Internally, undeleted and
 * soft-deleted entities are referred to as alive and deleted respectively.</p>
 * <p>
 * Lookups from the {@link CrudRepository} are overridden to skip deleted entities. For example,
 * {@link BasicEntityRepository#findAll()} will not return entities whose {@link
 * BasicEntity#getDeletedAt()} timestamp is not {@literal null}.</p>
 *
 * @param <T>  type of the {@link BasicEntity}.
 * @param <ID> type of the ID for {@link BasicEntity}.
 */
@NoRepositoryBean
public interface BasicEntityRepository<T extends BasicEntity<ID>, ID extends Serializable>
    extends CrudRepository<T, ID> {

    String WHERE_ALIVE_CLAUSE = " e." + BasicEntity.SOFT_DELETE_FIELD + " is null ";

    String SET_DELETED_CLAUSE = " e." + BasicEntity.SOFT_DELETE_FIELD + " = now() ";

    /**
     * Retrieves an undeleted entity by its id.
     *
     * @param id must not be {@literal null}.
     * @return the entity with the given id or {@literal Optional#empty()} if none found.
     */
    @Override
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from #{#entityName} e where e.id = ?1 and" + WHERE_ALIVE_CLAUSE)
    Optional<T> findById(@NonNull ID id);

    @Override
    @Transactional(readOnly = true)
    default boolean existsById(@NonNull ID id) {
        return findById(id).isPresent();
    }

    /**
     * Returns all undeleted instances of the type.
     *
     * @return all alive entities
     */
    @Override
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from #{#entityName} e where" + WHERE_ALIVE_CLAUSE)
    Iterable<T> findAll();

    @Override
    @Transactional(readOnly = true)
    @Query("select count(e) from #{#entityName} e where" + WHERE_ALIVE_CLAUSE)
    long count();

    /**
     * Marks the entity with the given id as deleted.
     *
     * @param id must not be {@literal null}.
     */
    @Override
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("update #{#entityName} e set" + SET_DELETED_CLAUSE + "where e.id = ?1 and" + WHERE_ALIVE_CLAUSE)
    void deleteById(@NonNull ID id);

    @Override
    default void deleteAll() {
        throw new UnsupportedOperationException("deleting all entities is not supported");
    }
}

package com.churnmetrics.api.churn.cache;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link ComputedChurnDay}
 * entity.
 */
@Repository
public interface ComputedChurnDayRepository extends CrudRepository<ComputedChurnDay, String> {

    /**
     * @param keys cache keys to look up.
     * @return a guaranteed to be not {@literal null} list of all existing entries with the given
     * keys, in no particular order.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from ComputedChurnDay e where e.cacheKey in ?1")
    List<ComputedChurnDay> findAllByCacheKeyIn(@NonNull Collection<String> keys);

    /**
     * Inserts an entry or replaces the data of an existing entry with the same key.
     *
     * @return the number of affected rows.
     */
    @Modifying
    @Transactional
    @Query(nativeQuery = true, value = "insert into computed_churn_day (cache_key, data, updated_at) " +
        "values (:key, :data, :updatedAt) " +
        "on conflict (cache_key) do update set data = excluded.data, updated_at = excluded.updated_at")
    int upsert(
        @NonNull @Param("key") String key,
        @NonNull @Param("data") String data,
        @NonNull @Param("updatedAt") OffsetDateTime updatedAt);
}

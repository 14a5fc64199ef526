package com.graysky.api.repository;

import com.graysky.api.model.visitor.VisitorEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the {@code visitors} table.
 */
@Repository
public interface VisitorRepository extends JpaRepository<VisitorEntity, String> {

    Optional<VisitorEntity> findByIdentityKey(String identityKey);

    /**
     * Rate-limit probe: any visit under this name after the given instant, whatever the agent type.
     */
    boolean existsByNameAndVisitTimeAfter(String name, LocalDateTime since);

    List<VisitorEntity> findAllByOrderByVisitTimeDescIdAsc(Pageable pageable);

    /**
     * Ids of the oldest visitors first, for retention trimming.
     */
    @Query("SELECT v.id FROM VisitorEntity v ORDER BY v.visitTime ASC, v.id ASC")
    List<String> findIdsOldestFirst(Pageable pageable);

    /**
     * Bulk delete. Answer rows are removed by the foreign key cascade.
     */
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM VisitorEntity v WHERE v.id IN :ids")
    int deleteByIdIn(@Param("ids") Collection<String> ids);
}

package com.graysky.api.repository;

import com.graysky.api.model.visitor.AnswerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for the {@code answers} table.
 */
@Repository
public interface AnswerRepository extends JpaRepository<AnswerEntity, Long> {

    List<AnswerEntity> findByVisitor_IdOrderByIdAsc(String visitorId);

    List<AnswerEntity> findByVisitor_IdInOrderByIdAsc(Collection<String> visitorIds);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM AnswerEntity a WHERE a.visitor.id = :visitorId")
    int deleteByVisitorId(@Param("visitorId") String visitorId);

    long countByVisitor_Id(String visitorId);
}

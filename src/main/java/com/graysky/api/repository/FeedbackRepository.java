package com.graysky.api.repository;

import com.graysky.api.model.feedback.FeedbackEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface FeedbackRepository extends JpaRepository<FeedbackEntity, String> {

    List<FeedbackEntity> findAllByOrderBySubmissionTimeDescIdAsc(Pageable pageable);

    @Query("SELECT f.id FROM FeedbackEntity f ORDER BY f.submissionTime ASC, f.id ASC")
    List<String> findIdsOldestFirst(Pageable pageable);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM FeedbackEntity f WHERE f.id IN :ids")
    int deleteByIdIn(@Param("ids") Collection<String> ids);
}

package com.collabnote.backend.modules.collaboration.infrastructure.persistence;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.collabnote.backend.modules.collaboration.domain.AnnotationMention;

public interface AnnotationMentionRepository extends JpaRepository<AnnotationMention, Long> {

    List<AnnotationMention> findByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    @Modifying(flushAutomatically = true)
    @Query("delete from AnnotationMention m where m.annotationId = :annotationId")
    int deleteByAnnotationId(@Param("annotationId") Long annotationId);

    @Modifying(flushAutomatically = true)
    @Query("delete from AnnotationMention m where m.replyId in :replyIds")
    int deleteByReplyIdIn(@Param("replyIds") Collection<Long> replyIds);
}

package com.collabnote.backend.modules.collaboration.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.collabnote.backend.modules.collaboration.domain.AnnotationReply;

public interface AnnotationReplyRepository extends JpaRepository<AnnotationReply, Long> {

    List<AnnotationReply> findByAnnotationIdOrderByCreatedAtAscIdAsc(Long annotationId);

    @Query("select r.id from AnnotationReply r where r.annotationId = :annotationId")
    List<Long> findIdsByAnnotationId(@Param("annotationId") Long annotationId);

    @Modifying(flushAutomatically = true)
    @Query("delete from AnnotationReply r where r.annotationId = :annotationId")
    int deleteByAnnotationId(@Param("annotationId") Long annotationId);
}

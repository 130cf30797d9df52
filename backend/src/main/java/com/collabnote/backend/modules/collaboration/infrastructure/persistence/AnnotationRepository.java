package com.collabnote.backend.modules.collaboration.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.collabnote.backend.modules.collaboration.domain.Annotation;

public interface AnnotationRepository extends JpaRepository<Annotation, Long> {

    /**
     * Annotations on a target that the user may see, optionally narrowed to one workspace, in creation order.
     */
    @Query("""
            select a
              from Annotation a
             where a.targetType = :targetType
               and a.targetId = :targetId
               and (a.privateAnnotation = false or a.creatorId = :userId)
               and (:workspaceId is null or a.workspaceId = :workspaceId)
             order by a.createdAt asc, a.id asc
            """)
    List<Annotation> findVisibleByTarget(
            @Param("targetType") String targetType,
            @Param("targetId") String targetId,
            @Param("userId") Long userId,
            @Param("workspaceId") Long workspaceId
    );
}

package com.coursetrack.domain.course;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface LessonRepository extends JpaRepository<Lesson, Long> {

    @Query("SELECT l FROM Lesson l JOIN FETCH l.module m JOIN FETCH m.course "
            + "WHERE l.id = :id AND l.tenantId = :tenantId")
    Optional<Lesson> findWithCourseByIdAndTenantId(@Param("id") Long id, @Param("tenantId") Long tenantId);

    @Query("SELECT l FROM Lesson l JOIN FETCH l.module m "
            + "WHERE m.course.id = :courseId AND l.tenantId = :tenantId "
            + "ORDER BY m.orderIndex, l.orderIndex")
    List<Lesson> findByCourseOrdered(@Param("tenantId") Long tenantId, @Param("courseId") Long courseId);

    @Query("SELECT COUNT(l) FROM Lesson l WHERE l.module.course.id = :courseId AND l.tenantId = :tenantId AND l.mandatory = true")
    long countMandatoryByCourse(@Param("tenantId") Long tenantId, @Param("courseId") Long courseId);

    @Query("SELECT COALESCE(MAX(l.orderIndex), 0) FROM Lesson l "
            + "WHERE l.module.id = :moduleId AND l.tenantId = :tenantId")
    int findMaxOrderIndex(@Param("tenantId") Long tenantId, @Param("moduleId") Long moduleId);

    boolean existsByTenantIdAndModuleIdAndOrderIndex(Long tenantId, Long moduleId, Integer orderIndex);
}

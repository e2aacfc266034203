package com.coursetrack.domain.course;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface CourseModuleRepository extends JpaRepository<CourseModule, Long> {

    @Query("SELECT m FROM CourseModule m JOIN FETCH m.course WHERE m.id = :id AND m.tenantId = :tenantId")
    Optional<CourseModule> findWithCourseByIdAndTenantId(@Param("id") Long id, @Param("tenantId") Long tenantId);

    @Query("SELECT m FROM CourseModule m WHERE m.course.id = :courseId AND m.tenantId = :tenantId ORDER BY m.orderIndex")
    List<CourseModule> findByCourse(@Param("tenantId") Long tenantId, @Param("courseId") Long courseId);

    @Query("SELECT COALESCE(MAX(m.orderIndex), 0) FROM CourseModule m "
            + "WHERE m.course.id = :courseId AND m.tenantId = :tenantId")
    int findMaxOrderIndex(@Param("tenantId") Long tenantId, @Param("courseId") Long courseId);

    boolean existsByTenantIdAndCourseIdAndOrderIndex(Long tenantId, Long courseId, Integer orderIndex);
}

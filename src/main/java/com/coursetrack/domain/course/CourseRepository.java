package com.coursetrack.domain.course;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface CourseRepository extends JpaRepository<Course, Long> {

    Optional<Course> findByIdAndTenantId(Long id, Long tenantId);

    List<Course> findByTenantIdOrderByIdDesc(Long tenantId);

    List<Course> findByTenantIdAndStatusOrderByIdDesc(Long tenantId, CourseStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Course c WHERE c.id = :id AND c.tenantId = :tenantId")
    Optional<Course> findByIdAndTenantIdWithLock(@Param("id") Long id, @Param("tenantId") Long tenantId);
}

package com.coursetrack.domain.enrollment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface EnrollmentRepository extends JpaRepository<Enrollment, Long> {

    Optional<Enrollment> findByIdAndTenantId(Long id, Long tenantId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Enrollment e WHERE e.id = :id AND e.tenantId = :tenantId")
    Optional<Enrollment> findByIdAndTenantIdWithLock(@Param("id") Long id, @Param("tenantId") Long tenantId);

    @Query("SELECT e FROM Enrollment e JOIN FETCH e.course "
            + "WHERE e.tenantId = :tenantId AND e.learner.id = :learnerId ORDER BY e.id DESC")
    List<Enrollment> findByLearner(@Param("tenantId") Long tenantId, @Param("learnerId") Long learnerId);

    @Query("SELECT e FROM Enrollment e "
            + "WHERE e.tenantId = :tenantId AND e.learner.id = :learnerId AND e.course.id = :courseId "
            + "AND e.status IN :statuses ORDER BY e.id DESC")
    List<Enrollment> findByLearnerAndCourse(@Param("tenantId") Long tenantId,
                                            @Param("learnerId") Long learnerId,
                                            @Param("courseId") Long courseId,
                                            @Param("statuses") Collection<EnrollmentStatus> statuses);

    @Query("SELECT COUNT(e) FROM Enrollment e "
            + "WHERE e.tenantId = :tenantId AND e.learner.id = :learnerId AND e.course.id = :courseId "
            + "AND e.status IN :statuses")
    long countByLearnerAndCourse(@Param("tenantId") Long tenantId,
                                 @Param("learnerId") Long learnerId,
                                 @Param("courseId") Long courseId,
                                 @Param("statuses") Collection<EnrollmentStatus> statuses);

    @Query("SELECT COUNT(e) FROM Enrollment e "
            + "WHERE e.tenantId = :tenantId AND e.course.id = :courseId AND e.status IN :statuses")
    long countByCourse(@Param("tenantId") Long tenantId,
                       @Param("courseId") Long courseId,
                       @Param("statuses") Collection<EnrollmentStatus> statuses);
}

package com.coursetrack.domain.progress;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface LessonProgressRepository extends JpaRepository<LessonProgress, Long> {

    @Query("SELECT p FROM LessonProgress p "
            + "WHERE p.tenantId = :tenantId AND p.enrollment.id = :enrollmentId AND p.lesson.id = :lessonId")
    Optional<LessonProgress> findByEnrollmentAndLesson(@Param("tenantId") Long tenantId,
                                                       @Param("enrollmentId") Long enrollmentId,
                                                       @Param("lessonId") Long lessonId);

    @Query("SELECT p FROM LessonProgress p JOIN FETCH p.lesson WHERE p.id = :id AND p.tenantId = :tenantId")
    Optional<LessonProgress> findWithLessonByIdAndTenantId(@Param("id") Long id, @Param("tenantId") Long tenantId);

    @Query("SELECT p FROM LessonProgress p WHERE p.enrollment.id = :enrollmentId AND p.tenantId = :tenantId")
    List<LessonProgress> findByEnrollment(@Param("tenantId") Long tenantId, @Param("enrollmentId") Long enrollmentId);

    /**
     * 저장된 값보다 클 때만 진도율을 올린다. 늦게 도착한 작은 값은 무시된다.
     *
     * @return 갱신된 행 수 (0 또는 1)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE LessonProgress p SET p.completionPercentage = :percentage, p.updatedAt = :now "
            + "WHERE p.id = :id AND p.completionPercentage < :percentage")
    int raiseCompletion(@Param("id") Long id, @Param("percentage") int percentage, @Param("now") LocalDateTime now);

    /**
     * 기준치에 도달한 진도에 완료 표시를 한다. 이미 완료된 행은 건드리지 않는다.
     *
     * @return 이번에 새로 완료된 행 수 (0 또는 1)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE LessonProgress p SET p.completed = true, p.completedAt = :now, p.updatedAt = :now "
            + "WHERE p.id = :id AND p.completed = false AND p.completionPercentage >= :threshold")
    int markCompleted(@Param("id") Long id, @Param("threshold") int threshold, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE LessonProgress p SET p.watchTimeSeconds = :watchTime, p.updatedAt = :now "
            + "WHERE p.id = :id AND p.watchTimeSeconds < :watchTime")
    int raiseWatchTime(@Param("id") Long id, @Param("watchTime") int watchTime, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE LessonProgress p SET p.lastPositionSeconds = :position, p.updatedAt = :now WHERE p.id = :id")
    int updateLastPosition(@Param("id") Long id, @Param("position") int position, @Param("now") LocalDateTime now);

    @Query("SELECT COUNT(p) FROM LessonProgress p "
            + "WHERE p.enrollment.id = :enrollmentId AND p.tenantId = :tenantId "
            + "AND p.completed = true AND p.lesson.mandatory = true")
    long countCompletedMandatory(@Param("tenantId") Long tenantId, @Param("enrollmentId") Long enrollmentId);
}

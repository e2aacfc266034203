package com.coursetrack.domain.learner;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface LearnerRepository extends JpaRepository<Learner, Long> {

    Optional<Learner> findByIdAndTenantId(Long id, Long tenantId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM Learner l WHERE l.id = :id AND l.tenantId = :tenantId")
    Optional<Learner> findByIdAndTenantIdWithLock(@Param("id") Long id, @Param("tenantId") Long tenantId);
}

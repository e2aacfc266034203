package com.coursetrack.domain.tenant;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TenantRepository extends JpaRepository<Tenant, Long> {

    boolean existsByIdAndActiveTrue(Long id);

    boolean existsBySubdomain(String subdomain);
}

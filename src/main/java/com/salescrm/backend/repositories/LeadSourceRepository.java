package com.salescrm.backend.repositories;

import com.salescrm.backend.models.LeadSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface LeadSourceRepository extends JpaRepository<LeadSource, Long> {

    List<LeadSource> findByOrganizationIdOrderByNameAsc(Long organizationId);

    List<LeadSource> findByOrganizationIdAndIsActiveTrueOrderByNameAsc(Long organizationId);

    Optional<LeadSource> findByIdAndOrganizationId(Long id, Long organizationId);

    List<LeadSource> findByIdInAndOrganizationId(Collection<Long> ids, Long organizationId);

    boolean existsByOrganizationIdAndNameIgnoreCase(Long organizationId, String name);
}

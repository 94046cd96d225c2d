package com.salescrm.backend.repositories;

import com.salescrm.backend.models.Lead;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Lead filters are composed with {@link com.salescrm.backend.repositories.LeadSpecifications}
 * so that role scoping and search criteria can be combined freely.
 */
@Repository
public interface LeadRepository extends JpaRepository<Lead, Long>, JpaSpecificationExecutor<Lead> {

    Optional<Lead> findByIdAndOrganizationId(Long id, Long organizationId);

    List<Lead> findByIdInAndOrganizationId(Collection<Long> ids, Long organizationId);

    long countByOrganizationId(Long organizationId);
}

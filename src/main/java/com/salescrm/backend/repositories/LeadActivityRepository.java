package com.salescrm.backend.repositories;

import com.salescrm.backend.models.LeadActivity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface LeadActivityRepository extends JpaRepository<LeadActivity, Long> {

    List<LeadActivity> findByLeadIdOrderByCreatedAtDesc(Long leadId);

    @Query("SELECT a FROM LeadActivity a WHERE a.lead.id IN :leadIds ORDER BY a.createdAt DESC")
    List<LeadActivity> findRecentForLeads(@Param("leadIds") Collection<Long> leadIds, Pageable pageable);

    long countByUserIdAndActivityTypeInAndCreatedAtBetween(Long userId,
                                                           Collection<LeadActivity.ActivityType> types,
                                                           OffsetDateTime start,
                                                           OffsetDateTime end);
}

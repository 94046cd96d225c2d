package com.salescrm.backend.repositories.email;

import com.salescrm.backend.enums.EmailStatus;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.Email;
import com.salescrm.backend.models.email.EmailCampaign;
import com.salescrm.backend.models.email.EmailTemplate;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Repository
public interface EmailRepository extends JpaRepository<Email, Long> {

    Optional<Email> findByTrackingId(UUID trackingId);

    List<Email> findByLeadIdOrderByCreatedAtDesc(Long leadId);

    List<Email> findByUserOrderByCreatedAtDesc(User user, Pageable pageable);

    Optional<Email> findByIdAndUser(Long id, User user);

    @Query("SELECT e.lead.id FROM Email e WHERE e.campaign = :campaign")
    Set<Long> findLeadIdsByCampaign(@Param("campaign") EmailCampaign campaign);

    /**
     * Rows of a campaign in the given status, oldest first. The page size is the batch size.
     */
    List<Email> findByCampaignAndStatusOrderByCreatedAtAscIdAsc(EmailCampaign campaign, EmailStatus status, Pageable pageable);

    long countByCampaignAndStatus(EmailCampaign campaign, EmailStatus status);

    long countByCampaignAndStatusIn(EmailCampaign campaign, Collection<EmailStatus> statuses);

    long countByCampaign(EmailCampaign campaign);

    @Query("SELECT e FROM Email e WHERE e.status = :status AND e.retryCount < e.maxRetries ORDER BY e.id ASC")
    List<Email> findRetryable(@Param("status") EmailStatus status);

    // ----- Analytics -----
    long countByUserAndCreatedAtGreaterThanEqual(User user, OffsetDateTime since);

    long countByUserAndStatusInAndCreatedAtGreaterThanEqual(User user,
                                                           Collection<EmailStatus> statuses,
                                                           OffsetDateTime since);

    long countByUserAndStatusInAndCreatedAtBetween(User user,
                                                   Collection<EmailStatus> statuses,
                                                   OffsetDateTime from,
                                                   OffsetDateTime to);

    long countByUserAndStatusAndCreatedAtBetween(User user, EmailStatus status, OffsetDateTime from, OffsetDateTime to);

    long countByTemplateAndStatusIn(EmailTemplate template, Collection<EmailStatus> statuses);

    long countByTemplate(EmailTemplate template);
}

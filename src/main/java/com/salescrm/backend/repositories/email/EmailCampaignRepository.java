package com.salescrm.backend.repositories.email;

import com.salescrm.backend.enums.CampaignStatus;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.EmailCampaign;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface EmailCampaignRepository extends JpaRepository<EmailCampaign, Long> {

    List<EmailCampaign> findByUserOrderByCreatedAtDesc(User user);

    Optional<EmailCampaign> findByIdAndUser(Long id, User user);

    @Query("SELECT c FROM EmailCampaign c WHERE c.status = :status AND c.scheduledAt <= :now ORDER BY c.scheduledAt ASC")
    List<EmailCampaign> findDue(@Param("status") CampaignStatus status, @Param("now") OffsetDateTime now);

    List<EmailCampaign> findByStatusOrderByStartedAtAsc(CampaignStatus status);

    long countByUserAndStatus(User user, CampaignStatus status);
}

package com.salescrm.backend.repositories.email;

import com.salescrm.backend.models.email.EmailTracking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EmailTrackingRepository extends JpaRepository<EmailTracking, Long> {

    List<EmailTracking> findByEmailIdOrderByTimestampAsc(Long emailId);

    long countByEmailIdAndEventType(Long emailId, EmailTracking.EventType eventType);
}

package com.salescrm.backend.repositories.email;

import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.EmailTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EmailTemplateRepository extends JpaRepository<EmailTemplate, Long> {

    List<EmailTemplate> findByUserOrderByCreatedAtDesc(User user);

    Optional<EmailTemplate> findByIdAndUser(Long id, User user);

    /**
     * Own templates plus those shared inside the organization.
     */
    @Query("SELECT t FROM EmailTemplate t WHERE t.isActive = true AND " +
            "(t.user = :user OR (t.isShared = true AND t.user.organization.id = :orgId)) " +
            "ORDER BY t.name ASC")
    List<EmailTemplate> findVisibleTo(@Param("user") User user, @Param("orgId") Long organizationId);

    @Query("SELECT t FROM EmailTemplate t WHERE t.id = :id AND " +
            "(t.user = :user OR (t.isShared = true AND t.user.organization.id = :orgId))")
    Optional<EmailTemplate> findVisibleById(@Param("id") Long id,
                                            @Param("user") User user,
                                            @Param("orgId") Long organizationId);

    boolean existsByUserAndName(User user, String name);
}

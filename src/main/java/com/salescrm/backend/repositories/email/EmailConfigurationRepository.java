package com.salescrm.backend.repositories.email;

import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.EmailConfiguration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EmailConfigurationRepository extends JpaRepository<EmailConfiguration, Long> {

    List<EmailConfiguration> findByUserOrderByCreatedAtDesc(User user);

    Optional<EmailConfiguration> findByIdAndUser(Long id, User user);

    Optional<EmailConfiguration> findFirstByUserAndIsDefaultTrueAndIsActiveTrue(User user);

    Optional<EmailConfiguration> findFirstByUserAndIsActiveTrueOrderByIdAsc(User user);

    boolean existsByUserAndNameIgnoreCase(User user, String name);

    /**
     * Clear the default flag on every other configuration of the user.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE EmailConfiguration c SET c.isDefault = false " +
            "WHERE c.user = :user AND c.isDefault = true AND c.id <> :keepId")
    int clearDefaultExcept(@Param("user") User user, @Param("keepId") Long keepId);

    long countByUserAndIsDefaultTrue(User user);
}

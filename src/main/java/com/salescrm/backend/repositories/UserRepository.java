package com.salescrm.backend.repositories;

import com.salescrm.backend.models.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByEmail(String email);

    Optional<User> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    List<User> findByOrganizationIdOrderByFirstNameAsc(Long organizationId);

    Optional<User> findByIdAndOrganizationId(Long id, Long organizationId);

    List<User> findByOrganizationIdAndRoleAndIsActiveTrue(Long organizationId, User.UserRole role);

    /**
     * Active sales reps a manager oversees: same organization and department.
     */
    @Query("SELECT u FROM User u WHERE u.organization.id = :orgId AND u.role = :role " +
            "AND u.isActive = true AND u.department = :department")
    List<User> findTeamMembers(@Param("orgId") Long organizationId,
                               @Param("department") String department,
                               @Param("role") User.UserRole role);
}

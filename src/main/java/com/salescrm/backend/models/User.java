package com.salescrm.backend.models;

import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;

@Entity
@Table(name = "users", uniqueConstraints = @UniqueConstraint(columnNames = "email"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"organization", "password"})
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank(message = "First name is required")
    @Column(name = "first_name", nullable = false)
    private String firstName;

    @Column(name = "last_name")
    private String lastName;

    @Email(message = "Invalid email format")
    @NotBlank(message = "Email is required")
    @Column(nullable = false, unique = true)
    private String email;

    @Column(name = "phone")
    private String phone;

    @NotBlank(message = "Password is required")
    @Column(nullable = false)
    private String password;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "organization_id", nullable = false)
    private Organization organization;

    @Column(name = "role", nullable = false)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private UserRole role = UserRole.SALES_REP;

    @Column(name = "department")
    private String department;

    @Column(name = "is_active")
    @Builder.Default
    private Boolean isActive = true;

    @CreationTimestamp
    @Column(name = "date_joined", updatable = false)
    private OffsetDateTime dateJoined;

    public enum UserRole {
        SUPERADMIN("Super Admin"),
        ADMIN("Admin"),
        SALES_MANAGER("Sales Manager"),
        SALES_REP("Sales Rep"),
        MARKETING("Marketing");

        private final String displayName;

        UserRole(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    public String getFullName() {
        return ((firstName != null ? firstName : "") + " " + (lastName != null ? lastName : "")).trim();
    }

    public boolean isSalesRep() {
        return UserRole.SALES_REP.equals(role);
    }

    public boolean isSalesManager() {
        return UserRole.SALES_MANAGER.equals(role);
    }

    /**
     * Admins and super admins see and modify every lead of their organization.
     */
    public boolean isAdmin() {
        return UserRole.ADMIN.equals(role) || UserRole.SUPERADMIN.equals(role);
    }

    public boolean canManageTeam() {
        return isAdmin() || isSalesManager();
    }

    public boolean belongsToOrganization(Long organizationId) {
        return organization != null && organization.getId().equals(organizationId);
    }
}

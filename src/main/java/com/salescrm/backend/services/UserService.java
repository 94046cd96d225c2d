package com.salescrm.backend.services;

import com.salescrm.backend.dto.user.RegisterUserRequest;
import com.salescrm.backend.dto.user.UserDto;
import com.salescrm.backend.exceptions.CrmValidationException;
import com.salescrm.backend.models.Organization;
import com.salescrm.backend.models.User;
import com.salescrm.backend.repositories.OrganizationRepository;
import com.salescrm.backend.repositories.UserRepository;
import com.salescrm.backend.services.email.EmailTemplateService;
import com.salescrm.backend.util.UserMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final OrganizationRepository organizationRepository;
    private final LeadAccessService leadAccessService;
    private final EmailTemplateService emailTemplateService;
    private final PasswordEncoder passwordEncoder;

    /**
     * Self-service sign up: creates the organization with its first admin.
     */
    public UserDto register(RegisterUserRequest request) {
        if (request.getOrganizationName() == null || request.getOrganizationName().isBlank()) {
            throw new CrmValidationException("Organization name is required");
        }
        requireUnusedEmail(request.getEmail());

        Organization organization = organizationRepository.save(Organization.builder()
                .name(request.getOrganizationName().trim())
                .build());

        User admin = newUser(request, organization, User.UserRole.ADMIN);
        log.info("Registered organization {} '{}' with admin {}", organization.getId(), organization.getName(), admin.getId());
        return UserMapper.toDto(admin);
    }

    /**
     * Admins add users to their own organization. Only a super admin can create another super admin.
     */
    public UserDto createUser(User actor, RegisterUserRequest request) {
        if (!actor.isAdmin()) {
            throw new AccessDeniedException("Only admins can create users");
        }
        User.UserRole role = request.getRole() != null ? request.getRole() : User.UserRole.SALES_REP;
        if (role == User.UserRole.SUPERADMIN && actor.getRole() != User.UserRole.SUPERADMIN) {
            throw new AccessDeniedException("Only a super admin can create super admins");
        }
        requireUnusedEmail(request.getEmail());

        User user = newUser(request, actor.getOrganization(), role);
        log.info("User {} created {} {} in organization {}", actor.getId(), role, user.getId(),
                actor.getOrganization().getId());
        return UserMapper.toDto(user);
    }

    @Transactional(readOnly = true)
    public List<UserDto> getUsers(User actor) {
        return userRepository.findByOrganizationIdOrderByFirstNameAsc(actor.getOrganization().getId()).stream()
                .map(UserMapper::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<UserDto> getTeam(User actor) {
        return leadAccessService.teamMembers(actor).stream()
                .map(UserMapper::toDto)
                .collect(Collectors.toList());
    }

    public UserDto setActive(User actor, Long userId, boolean active) {
        if (!actor.isAdmin()) {
            throw new AccessDeniedException("Only admins can activate or deactivate users");
        }
        if (actor.getId().equals(userId) && !active) {
            throw new CrmValidationException("You cannot deactivate yourself");
        }
        User user = userRepository.findByIdAndOrganizationId(userId, actor.getOrganization().getId())
                .orElseThrow(() -> new EntityNotFoundException("User not found: " + userId));
        user.setIsActive(active);
        return UserMapper.toDto(userRepository.save(user));
    }

    @Transactional(readOnly = true)
    public User getByEmail(String email) {
        return userRepository.findByEmailIgnoreCase(email)
                .orElseThrow(() -> new EntityNotFoundException("User not found: " + email));
    }

    private User newUser(RegisterUserRequest request, Organization organization, User.UserRole role) {
        User user = userRepository.save(User.builder()
                .firstName(request.getFirstName().trim())
                .lastName(request.getLastName())
                .email(request.getEmail().trim().toLowerCase())
                .phone(request.getPhone())
                .password(passwordEncoder.encode(request.getPassword()))
                .department(request.getDepartment())
                .organization(organization)
                .role(role)
                .isActive(true)
                .build());
        emailTemplateService.createDefaultTemplates(user);
        return user;
    }

    private void requireUnusedEmail(String email) {
        if (userRepository.existsByEmailIgnoreCase(email.trim())) {
            throw new CrmValidationException("A user with email " + email + " already exists");
        }
    }
}

package com.salescrm.backend.services;

import com.salescrm.backend.dto.lead.LeadSourceDto;
import com.salescrm.backend.dto.lead.request.LeadSourceRequest;
import com.salescrm.backend.exceptions.CrmValidationException;
import com.salescrm.backend.models.LeadSource;
import com.salescrm.backend.models.User;
import com.salescrm.backend.repositories.LeadSourceRepository;
import com.salescrm.backend.util.LeadMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Organization-wide lookup of where leads come from. Everyone reads,
 * managers and admins write.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class LeadSourceService {

    private final LeadSourceRepository leadSourceRepository;

    @Transactional(readOnly = true)
    public List<LeadSourceDto> getSources(User actor, boolean activeOnly) {
        Long orgId = actor.getOrganization().getId();
        List<LeadSource> sources = activeOnly
                ? leadSourceRepository.findByOrganizationIdAndIsActiveTrueOrderByNameAsc(orgId)
                : leadSourceRepository.findByOrganizationIdOrderByNameAsc(orgId);
        return sources.stream().map(LeadMapper::toDto).collect(Collectors.toList());
    }

    public LeadSourceDto createSource(User actor, LeadSourceRequest request) {
        requireManager(actor);
        Long orgId = actor.getOrganization().getId();
        String name = request.getName().trim();
        if (leadSourceRepository.existsByOrganizationIdAndNameIgnoreCase(orgId, name)) {
            throw new CrmValidationException("A lead source named '" + name + "' already exists");
        }

        LeadSource source = leadSourceRepository.save(LeadSource.builder()
                .organization(actor.getOrganization())
                .name(name)
                .description(request.getDescription())
                .isActive(!Boolean.FALSE.equals(request.getIsActive()))
                .build());
        log.info("Lead source {} '{}' created in organization {}", source.getId(), name, orgId);
        return LeadMapper.toDto(source);
    }

    public LeadSourceDto updateSource(User actor, Long sourceId, LeadSourceRequest request) {
        requireManager(actor);
        LeadSource source = getSource(actor, sourceId);
        String name = request.getName().trim();
        if (!name.equalsIgnoreCase(source.getName())
                && leadSourceRepository.existsByOrganizationIdAndNameIgnoreCase(actor.getOrganization().getId(), name)) {
            throw new CrmValidationException("A lead source named '" + name + "' already exists");
        }

        source.setName(name);
        source.setDescription(request.getDescription());
        source.setIsActive(!Boolean.FALSE.equals(request.getIsActive()));
        return LeadMapper.toDto(leadSourceRepository.save(source));
    }

    /**
     * Sources stay referenced by existing leads, so removing one only deactivates it.
     */
    public void deactivateSource(User actor, Long sourceId) {
        requireManager(actor);
        LeadSource source = getSource(actor, sourceId);
        source.setIsActive(false);
        leadSourceRepository.save(source);
        log.info("Lead source {} deactivated by user {}", sourceId, actor.getId());
    }

    private LeadSource getSource(User actor, Long sourceId) {
        return leadSourceRepository.findByIdAndOrganizationId(sourceId, actor.getOrganization().getId())
                .orElseThrow(() -> new EntityNotFoundException("Lead source not found: " + sourceId));
    }

    private static void requireManager(User actor) {
        if (!actor.canManageTeam()) {
            throw new AccessDeniedException("Only managers and admins can manage lead sources");
        }
    }
}

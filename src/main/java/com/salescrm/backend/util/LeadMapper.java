package com.salescrm.backend.util;

import com.salescrm.backend.dto.lead.LeadActivityDto;
import com.salescrm.backend.dto.lead.LeadDto;
import com.salescrm.backend.dto.lead.LeadSourceDto;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.LeadActivity;
import com.salescrm.backend.models.LeadSource;

import java.time.OffsetDateTime;

public class LeadMapper {

    public static LeadDto toDto(Lead lead, OffsetDateTime now) {
        if (lead == null) {
            return null;
        }

        return LeadDto.builder()
                .id(lead.getId())
                .firstName(lead.getFirstName())
                .lastName(lead.getLastName())
                .fullName(lead.getFullName())
                .email(lead.getEmail())
                .phone(lead.getPhone())
                .company(lead.getCompany())
                .jobTitle(lead.getJobTitle())
                .sourceId(lead.getSource() != null ? lead.getSource().getId() : null)
                .sourceName(lead.getSource() != null ? lead.getSource().getName() : null)
                .status(lead.getStatus())
                .statusDisplay(lead.getStatus() != null ? lead.getStatus().getDisplayName() : null)
                .priority(lead.getPriority())
                .assignedToId(lead.getAssignedTo() != null ? lead.getAssignedTo().getId() : null)
                .assignedToName(lead.getAssignedTo() != null ? lead.getAssignedTo().getFullName() : null)
                .createdById(lead.getCreatedBy() != null ? lead.getCreatedBy().getId() : null)

                // Address
                .address(lead.getAddress())
                .city(lead.getCity())
                .state(lead.getState())
                .country(lead.getCountry())
                .postalCode(lead.getPostalCode())

                .budget(lead.getBudget())
                .requirements(lead.getRequirements())
                .notes(lead.getNotes())

                // Derived
                .hot(lead.isHot())
                .overdue(lead.isOverdue(now))

                .createdAt(lead.getCreatedAt())
                .updatedAt(lead.getUpdatedAt())
                .lastContacted(lead.getLastContacted())
                .build();
    }

    public static LeadActivityDto toDto(LeadActivity activity) {
        if (activity == null) {
            return null;
        }

        return LeadActivityDto.builder()
                .id(activity.getId())
                .leadId(activity.getLead().getId())
                .leadName(activity.getLead().getFullName())
                .userId(activity.getUser().getId())
                .userName(activity.getUser().getFullName())
                .activityType(activity.getActivityType())
                .subject(activity.getSubject())
                .description(activity.getDescription())
                .createdAt(activity.getCreatedAt())
                .build();
    }

    public static LeadSourceDto toDto(LeadSource source) {
        if (source == null) {
            return null;
        }

        return LeadSourceDto.builder()
                .id(source.getId())
                .name(source.getName())
                .description(source.getDescription())
                .isActive(source.getIsActive())
                .createdAt(source.getCreatedAt())
                .build();
    }
}

package com.salescrm.backend.services.email;

import java.util.List;

/**
 * A lead matched the trigger conditions of one or more sequences.
 */
public record LeadTriggeredEvent(Long leadId, List<Long> sequenceIds, String trigger) {
}

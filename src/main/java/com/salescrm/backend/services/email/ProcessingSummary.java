package com.salescrm.backend.services.email;

/**
 * Outcome of one pass of a background job.
 *
 * @param processed units picked up
 * @param succeeded units that did their work
 * @param failed    units that raised or could not send
 */
public record ProcessingSummary(int processed, int succeeded, int failed) {
}

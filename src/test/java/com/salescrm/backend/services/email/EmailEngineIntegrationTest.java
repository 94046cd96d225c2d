package com.salescrm.backend.services.email;

import com.salescrm.backend.dto.email.request.CreateCampaignRequest;
import com.salescrm.backend.dto.lead.LeadDto;
import com.salescrm.backend.dto.lead.request.LeadRequest;
import com.salescrm.backend.enums.CampaignStatus;
import com.salescrm.backend.enums.EmailStatus;
import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.LeadSource;
import com.salescrm.backend.models.Organization;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.Email;
import com.salescrm.backend.models.email.EmailCampaign;
import com.salescrm.backend.models.email.EmailConfiguration;
import com.salescrm.backend.models.email.EmailSequence;
import com.salescrm.backend.models.email.EmailSequenceEnrollment;
import com.salescrm.backend.models.email.EmailSequenceStep;
import com.salescrm.backend.models.email.EmailTemplate;
import com.salescrm.backend.repositories.LeadRepository;
import com.salescrm.backend.repositories.LeadSourceRepository;
import com.salescrm.backend.repositories.OrganizationRepository;
import com.salescrm.backend.repositories.UserRepository;
import com.salescrm.backend.repositories.email.EmailCampaignRepository;
import com.salescrm.backend.repositories.email.EmailConfigurationRepository;
import com.salescrm.backend.repositories.email.EmailRepository;
import com.salescrm.backend.repositories.email.EmailSequenceEnrollmentRepository;
import com.salescrm.backend.repositories.email.EmailSequenceRepository;
import com.salescrm.backend.repositories.email.EmailTemplateRepository;
import com.salescrm.backend.services.LeadService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.mail.MailSendException;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Runs the campaign and sequence engines against the database and the real
 * transaction manager, with only the SMTP transport replaced.
 */
@SpringBootTest
class EmailEngineIntegrationTest {

    @MockBean
    private EmailTransport emailTransport;

    @SpyBean
    private EmailDeliveryService deliveryService;

    @Autowired
    private EmailCampaignService campaignService;

    @Autowired
    private LeadService leadService;

    @Autowired
    private OrganizationRepository organizationRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private LeadRepository leadRepository;

    @Autowired
    private LeadSourceRepository leadSourceRepository;

    @Autowired
    private EmailTemplateRepository templateRepository;

    @Autowired
    private EmailConfigurationRepository configurationRepository;

    @Autowired
    private EmailCampaignRepository campaignRepository;

    @Autowired
    private EmailRepository emailRepository;

    @Autowired
    private EmailSequenceRepository sequenceRepository;

    @Autowired
    private EmailSequenceEnrollmentRepository enrollmentRepository;

    private Organization organization;
    private User owner;
    private EmailTemplate template;
    private EmailConfiguration config;

    @BeforeEach
    void setUp() {
        String tag = UUID.randomUUID().toString().substring(0, 8);
        organization = organizationRepository.save(Organization.builder().name("Acme " + tag).build());
        owner = userRepository.save(User.builder()
                .firstName("Rita")
                .lastName("Rao")
                .email("rita-" + tag + "@acme.test")
                .password("secret")
                .organization(organization)
                .build());
        template = templateRepository.save(EmailTemplate.builder()
                .user(owner)
                .name("Welcome")
                .subject("Hi {{first_name}}")
                .bodyHtml("<p>Hello {{first_name}}</p>")
                .build());
        config = configurationRepository.save(EmailConfiguration.builder()
                .user(owner)
                .name("Primary")
                .smtpHost("smtp.acme.test")
                .fromEmail("rita@acme.test")
                .fromName("Rita")
                .isDefault(true)
                .build());
    }

    // ================================
    // CAMPAIGNS
    // ================================

    @Test
    void processCampaigns_ShouldKeepDeliveredEmailWhenAnotherRecipientFails() {
        // Given
        EmailCampaign campaign = sendingCampaign();
        queue(campaign, lead("Asha", "asha@leads.test"));
        queue(campaign, lead("Vikram", "vikram@leads.test"));
        when(emailTransport.send(any(OutgoingEmail.class), any(EmailConfiguration.class)))
                .thenThrow(new MailSendException("Connection dropped"))
                .thenReturn(SendResult.sent("<ok@mail.test>"));

        // When
        campaignService.processCampaigns();

        // Then
        assertThat(emailRepository.countByCampaignAndStatus(campaign, EmailStatus.SENT)).isEqualTo(1);
        assertThat(emailRepository.countByCampaignAndStatus(campaign, EmailStatus.FAILED)).isEqualTo(1);
        assertThat(emailRepository.countByCampaignAndStatus(campaign, EmailStatus.QUEUED)).isZero();

        EmailCampaign reloaded = campaignRepository.findById(campaign.getId()).orElseThrow();
        assertThat(reloaded.getEmailsSent()).isEqualTo(1);
        assertThat(reloaded.getEmailsFailed()).isEqualTo(1);
        assertThat(reloaded.getStatus()).isEqualTo(CampaignStatus.SENT);
        verify(emailTransport, times(2)).send(any(OutgoingEmail.class), any(EmailConfiguration.class));
    }

    @Test
    void sendBatch_ShouldCommitEachEmailWhenDeliveryBreaksUnexpectedly() {
        // Given
        EmailCampaign campaign = sendingCampaign();
        Email first = queue(campaign, lead("Asha", "asha@leads.test"));
        queue(campaign, lead("Vikram", "vikram@leads.test"));
        doThrow(new IllegalStateException("Tracking store unavailable"))
                .doCallRealMethod()
                .when(deliveryService).deliver(any(Email.class), any(EmailConfiguration.class));
        when(emailTransport.send(any(OutgoingEmail.class), any(EmailConfiguration.class)))
                .thenReturn(SendResult.sent("<ok@mail.test>"));

        // When
        BatchResult result = campaignService.sendBatch(campaign.getId(), null);

        // Then
        assertThat(result).isEqualTo(new BatchResult(1, 1));
        Email failed = emailRepository.findById(first.getId()).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(EmailStatus.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("Tracking store unavailable");
        assertThat(emailRepository.countByCampaignAndStatus(campaign, EmailStatus.SENT)).isEqualTo(1);

        EmailCampaign reloaded = campaignRepository.findById(campaign.getId()).orElseThrow();
        assertThat(reloaded.getEmailsSent()).isEqualTo(1);
        assertThat(reloaded.getEmailsFailed()).isEqualTo(1);
    }

    @Test
    void sendBatch_ShouldFinishCampaignWithNothingQueued() {
        // Given
        EmailCampaign campaign = sendingCampaign();

        // When
        BatchResult result = campaignService.sendBatch(campaign.getId(), null);

        // Then
        assertThat(result).isEqualTo(BatchResult.EMPTY);
        EmailCampaign reloaded = campaignRepository.findById(campaign.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(CampaignStatus.SENT);
        assertThat(reloaded.getCompletedAt()).isNotNull();
        assertThat(reloaded.getEmailsSent()).isZero();
        assertThat(reloaded.getEmailsFailed()).isZero();
        verifyNoInteractions(emailTransport);
    }

    @Test
    void resolveTargets_ShouldIgnoreOtherFiltersWhenTargetingAllLeads() {
        // Given
        Lead asha = lead("Asha", "asha@leads.test");
        Lead vikram = lead("Vikram", "vikram@leads.test");
        lead("Noor", null);
        lead("Blank", "  ");
        otherTenantLead();

        EmailCampaign campaign = draftCampaign();
        campaign.setTargetAllLeads(true);
        campaign.setTargetStatuses(Set.of(LeadStatus.WON));
        campaign.setTargetPriorities(Set.of(LeadPriority.HOT));

        // When
        List<Lead> targets = campaignService.resolveTargets(campaign);

        // Then
        assertThat(targets).extracting(Lead::getId).containsExactly(asha.getId(), vikram.getId());
    }

    @Test
    void resolveTargets_ShouldMatchAnyOfStatusPrioritySourceOrExplicitLeads() {
        // Given
        LeadSource webinar = leadSourceRepository.save(LeadSource.builder()
                .organization(organization)
                .name("Webinar")
                .build());
        Lead qualified = lead("Qualified", "q@leads.test", LeadStatus.QUALIFIED, LeadPriority.WARM, null);
        Lead hot = lead("Hot", "h@leads.test", LeadStatus.NEW, LeadPriority.HOT, null);
        Lead fromWebinar = lead("Webinar", "w@leads.test", LeadStatus.NEW, LeadPriority.COLD, webinar);
        Lead picked = lead("Picked", "p@leads.test", LeadStatus.NEW, LeadPriority.COLD, null);
        lead("Unmatched", "u@leads.test", LeadStatus.NEW, LeadPriority.COLD, null);
        lead("NoEmail", null, LeadStatus.QUALIFIED, LeadPriority.HOT, null);

        EmailCampaign campaign = draftCampaign();
        campaign.setTargetStatuses(Set.of(LeadStatus.QUALIFIED));
        campaign.setTargetPriorities(Set.of(LeadPriority.HOT));
        campaign.setTargetSources(Set.of(webinar));
        campaign.setSpecificLeads(Set.of(picked));

        // When
        List<Lead> targets = campaignService.resolveTargets(campaign);

        // Then
        assertThat(targets).extracting(Lead::getId)
                .containsExactly(qualified.getId(), hot.getId(), fromWebinar.getId(), picked.getId());
    }

    @Test
    void materialize_ShouldQueueOneEmailPerLeadAcrossRepeatedCalls() {
        // Given
        Lead asha = lead("Asha", "asha@leads.test");
        lead("Vikram", "vikram@leads.test");
        lead("Noor", null);
        CreateCampaignRequest request = new CreateCampaignRequest();
        request.setName("Webinar invite");
        request.setTemplateId(template.getId());
        request.setTargetAllLeads(true);
        request.setScheduledAt(OffsetDateTime.now().plusDays(1));
        EmailCampaign campaign = campaignService.createCampaign(owner, request);

        // When
        int createdAgain = campaignService.materialize(campaign);

        // Then
        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.SCHEDULED);
        assertThat(createdAgain).isZero();
        assertThat(emailRepository.countByCampaign(campaign)).isEqualTo(2);
        assertThatThrownBy(() -> emailRepository.saveAndFlush(email(campaign, asha)))
                .isInstanceOf(DataIntegrityViolationException.class);
        verifyNoInteractions(emailTransport);
    }

    // ================================
    // SEQUENCE TRIGGERS
    // ================================

    @Test
    void createLead_ShouldSaveLeadWhenTriggeredSequenceCannotSend() {
        // Given
        EmailSequence sequence = creationTriggeredSequence();
        when(emailTransport.send(any(OutgoingEmail.class), any(EmailConfiguration.class)))
                .thenThrow(new MailSendException("Connection refused"));

        // When
        LeadDto created = leadService.createLead(owner, leadRequest("Meera", "meera@leads.test"));

        // Then
        assertThat(leadRepository.findById(created.getId())).isPresent();
        List<EmailSequenceEnrollment> enrollments = enrollmentRepository.findBySequenceOrderByEnrolledAtDesc(sequence);
        assertThat(enrollments).hasSize(1);
        assertThat(enrollments.get(0).getCurrentStep()).isEqualTo(1);
        assertThat(emailRepository.findByLeadIdOrderByCreatedAtDesc(created.getId()))
                .extracting(Email::getStatus)
                .containsExactly(EmailStatus.FAILED);
    }

    @Test
    void createLead_ShouldSaveLeadWhenTriggeredEnrollmentBreaks() {
        // Given
        EmailSequence sequence = creationTriggeredSequence();
        doThrow(new IllegalStateException("Tracking store unavailable"))
                .when(deliveryService).deliver(any(Email.class), any(EmailConfiguration.class));

        // When
        LeadDto created = leadService.createLead(owner, leadRequest("Meera", "meera@leads.test"));

        // Then
        assertThat(leadRepository.findById(created.getId())).isPresent();
        assertThat(enrollmentRepository.findBySequenceOrderByEnrolledAtDesc(sequence)).isEmpty();
        assertThat(emailRepository.findByLeadIdOrderByCreatedAtDesc(created.getId())).isEmpty();
    }

    private EmailSequence creationTriggeredSequence() {
        EmailSequence sequence = EmailSequence.builder()
                .name("Onboarding")
                .user(owner)
                .triggerOnLeadCreation(true)
                .delayStartDays(0)
                .build();
        sequence.addStep(new EmailSequenceStep(1, template, 0));
        return sequenceRepository.save(sequence);
    }

    private LeadRequest leadRequest(String firstName, String email) {
        LeadRequest request = new LeadRequest();
        request.setFirstName(firstName);
        request.setEmail(email);
        return request;
    }

    private EmailCampaign draftCampaign() {
        return EmailCampaign.builder()
                .name("Targeting")
                .user(owner)
                .template(template)
                .emailConfig(config)
                .build();
    }

    private EmailCampaign sendingCampaign() {
        EmailCampaign campaign = draftCampaign();
        campaign.setBatchSize(10);
        campaign.markStarted(OffsetDateTime.now());
        return campaignRepository.save(campaign);
    }

    private Email queue(EmailCampaign campaign, Lead lead) {
        return emailRepository.save(email(campaign, lead));
    }

    private Email email(EmailCampaign campaign, Lead lead) {
        return Email.builder()
                .campaign(campaign)
                .lead(lead)
                .template(template)
                .user(owner)
                .fromEmail(config.getFromEmail())
                .fromName(config.getFromName())
                .toEmail(lead.getEmail())
                .toName(lead.getFullName())
                .subject("Hi " + lead.getFirstName())
                .bodyHtml("<p>Hello</p>")
                .build();
    }

    private Lead lead(String firstName, String email) {
        return lead(firstName, email, LeadStatus.NEW, LeadPriority.WARM, null);
    }

    private Lead lead(String firstName, String email, LeadStatus status, LeadPriority priority, LeadSource source) {
        return leadRepository.save(Lead.builder()
                .organization(organization)
                .createdBy(owner)
                .firstName(firstName)
                .email(email)
                .status(status)
                .priority(priority)
                .source(source)
                .build());
    }

    private void otherTenantLead() {
        Organization globex = organizationRepository.save(Organization.builder().name("Globex").build());
        User greg = userRepository.save(User.builder()
                .firstName("Greg")
                .email("greg-" + UUID.randomUUID() + "@globex.test")
                .password("secret")
                .organization(globex)
                .build());
        leadRepository.save(Lead.builder()
                .organization(globex)
                .createdBy(greg)
                .firstName("Greg")
                .email("greg@globex.test")
                .build());
    }
}

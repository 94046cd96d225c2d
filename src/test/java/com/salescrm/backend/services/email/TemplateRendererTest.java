package com.salescrm.backend.services.email;

import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.EmailTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRendererTest {

    private TemplateRenderer renderer;
    private Lead lead;
    private User user;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-05T14:30:00Z"), ZoneOffset.UTC);
        renderer = new TemplateRenderer(clock);

        lead = Lead.builder()
                .firstName("Priya")
                .lastName("Sharma")
                .company("Acme Corp")
                .email("priya@acme.test")
                .build();

        user = User.builder()
                .firstName("Ravi")
                .lastName("Kumar")
                .email("ravi@crm.test")
                .build();
    }

    @Test
    void render_ShouldSubstituteLeadAndUserVariables() {
        // Given
        EmailTemplate template = EmailTemplate.builder()
                .subject("Hello {{first_name}} from {{company}}")
                .bodyHtml("<p>Hi {{lead_name}},</p><p>Regards, {{user_name}} on {{current_date}}</p>")
                .build();

        // When
        RenderedEmail rendered = renderer.render(template, lead, user);

        // Then
        assertThat(rendered.subject()).isEqualTo("Hello Priya from Acme Corp");
        assertThat(rendered.htmlBody()).contains("Hi Priya Sharma,").contains("Ravi Kumar").contains("March 05, 2024");
        assertThat(rendered.textBody()).startsWith("Hi Priya Sharma,").doesNotContain("<p>");
    }

    @Test
    void render_ShouldCutSubjectToStorableLength() {
        // Given
        lead.setCompany("Acme ".repeat(100));
        EmailTemplate template = EmailTemplate.builder()
                .subject("Proposal for {{company}}")
                .bodyHtml("<p>Hi</p>")
                .build();

        // When
        RenderedEmail rendered = renderer.render(template, lead, user);

        // Then
        assertThat(rendered.subject()).hasSize(TemplateRenderer.MAX_SUBJECT_LENGTH).startsWith("Proposal for Acme Acme");
    }

    @Test
    void render_ShouldPreferExplicitTextBody() {
        // Given
        EmailTemplate template = EmailTemplate.builder()
                .subject("Hi")
                .bodyHtml("<p>html {{first_name}}</p>")
                .bodyText("text {{first_name}}")
                .build();

        // When
        RenderedEmail rendered = renderer.render(template, lead, user);

        // Then
        assertThat(rendered.textBody()).isEqualTo("text Priya");
    }

    @Test
    void replaceVariables_ShouldLeaveUnknownPlaceholdersAndBlankMissingValues() {
        // Given
        Map<String, String> context = renderer.buildContext(Lead.builder().firstName("Sam").build(), user);

        // When
        String result = renderer.replaceVariables("{{ first_name }} / {{company}} / {{favourite_color}}", context);

        // Then
        assertThat(result).isEqualTo("Sam /  / {{favourite_color}}");
    }

    @Test
    void replaceVariables_ShouldNotInterpretReplacementCharacters() {
        // Given
        Lead pricey = Lead.builder().firstName("$1 \\ Deal").build();

        // When
        String result = renderer.replaceVariables("Hi {{first_name}}", renderer.buildContext(pricey, user));

        // Then
        assertThat(result).isEqualTo("Hi $1 \\ Deal");
    }

    @Test
    void htmlToText_ShouldDropScriptsAndKeepParagraphBreaks() {
        // When
        String text = renderer.htmlToText(
                "<style>p{color:red}</style><p>First&nbsp;line</p><p>Second<br>line &amp; more</p><script>alert(1)</script>");

        // Then
        assertThat(text).doesNotContain("alert").doesNotContain("color:red");
        assertThat(text).contains("Second\nline & more");
        assertThat(text.split("\n\n")).hasSize(2);
    }

    @Test
    void htmlToText_ShouldReturnEmptyForBlankInput() {
        assertThat(renderer.htmlToText(null)).isEmpty();
        assertThat(renderer.htmlToText("   ")).isEmpty();
    }

    @Test
    void validate_ShouldReportMissingPartsAndUnknownVariables() {
        // When
        List<String> errors = renderer.validate(" ", "Hello {{nickname}} and {{first_name}}");

        // Then
        assertThat(errors).containsExactly("Subject is required", "Invalid variables: nickname");
    }

    @Test
    void validate_ShouldAcceptWellFormedTemplate() {
        assertThat(renderer.validate("Hi {{first_name}}", "<p>{{company}}</p>")).isEmpty();
    }

    @Test
    void validate_ShouldRejectOverlongSubject() {
        // When
        List<String> errors = renderer.validate("x".repeat(TemplateRenderer.MAX_SUBJECT_LENGTH + 1), "<p>body</p>");

        // Then
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0)).startsWith("Subject is too long");
    }
}

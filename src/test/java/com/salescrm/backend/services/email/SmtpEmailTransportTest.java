package com.salescrm.backend.services.email;

import com.icegreen.greenmail.junit5.GreenMailExtension;
import com.icegreen.greenmail.util.GreenMailUtil;
import com.icegreen.greenmail.util.ServerSetupTest;
import com.salescrm.backend.config.CrmProperties;
import com.salescrm.backend.models.email.EmailConfiguration;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import static org.assertj.core.api.Assertions.assertThat;

class SmtpEmailTransportTest {

    @RegisterExtension
    static GreenMailExtension greenMail = new GreenMailExtension(ServerSetupTest.SMTP);

    private SmtpEmailTransport transport;
    private EmailConfiguration config;

    @BeforeEach
    void setUp() {
        transport = new SmtpEmailTransport(new MailSenderFactory(CrmProperties.defaults()));
        config = EmailConfiguration.builder()
                .id(1L)
                .name("Local")
                .smtpHost(greenMail.getSmtp().getBindTo())
                .smtpPort(greenMail.getSmtp().getPort())
                .useTls(false)
                .fromEmail("sales@example.com")
                .fromName("Sales Team")
                .replyTo("replies@example.com")
                .build();
    }

    @Test
    void send_ShouldDeliverMultipartMessage() throws Exception {
        // Given
        OutgoingEmail email = new OutgoingEmail("lead@example.com", "Lead Person", "Quarterly offer",
                "<p>Hello <b>there</b></p>", "Hello there", null);

        // When
        SendResult result = transport.send(email, config);

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.messageId()).isNotBlank();

        MimeMessage[] received = greenMail.getReceivedMessages();
        assertThat(received).hasSize(1);
        assertThat(received[0].getSubject()).isEqualTo("Quarterly offer");
        assertThat(((InternetAddress) received[0].getFrom()[0]).getAddress()).isEqualTo("sales@example.com");
        assertThat(((InternetAddress) received[0].getFrom()[0]).getPersonal()).isEqualTo("Sales Team");
        assertThat(((InternetAddress) received[0].getReplyTo()[0]).getAddress()).isEqualTo("replies@example.com");
        assertThat(GreenMailUtil.getBody(received[0])).contains("Hello there");
    }

    @Test
    void send_ShouldReportFailureInsteadOfThrowing() {
        // Given
        config.setSmtpPort(1);
        OutgoingEmail email = new OutgoingEmail("lead@example.com", null, "Hi", "<p>Hi</p>", null, null);

        // When
        SendResult result = transport.send(email, config);

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.message()).isNotBlank();
        assertThat(greenMail.getReceivedMessages()).isEmpty();
    }

    @Test
    void testConnection_ShouldSucceedAgainstRunningServer() {
        // When
        ConnectionTestResult result = transport.testConnection(config);

        // Then
        assertThat(result.success()).isTrue();
    }
}

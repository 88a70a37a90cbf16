package com.shecares.notification.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MailNotificationSenderTest {

    @Mock
    private JavaMailSender mailSender;

    @Test
    @DisplayName("발신자와 수신자, 제목, 본문을 채워 발송")
    void sendEmail_BuildsMessage() {
        MailNotificationSender sender = new MailNotificationSender(mailSender, "no-reply@shecares.ng");

        sender.sendEmail(new EmailMessage("ada@example.com", "Hello", "Body"));

        ArgumentCaptor<SimpleMailMessage> mail = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(mail.capture());
        assertThat(mail.getValue().getFrom()).isEqualTo("no-reply@shecares.ng");
        assertThat(mail.getValue().getTo()).containsExactly("ada@example.com");
        assertThat(mail.getValue().getSubject()).isEqualTo("Hello");
        assertThat(mail.getValue().getText()).isEqualTo("Body");
    }

    @Test
    @DisplayName("SMTP 오류는 호출자에게 전파")
    void sendEmail_PropagatesFailure() {
        MailNotificationSender sender = new MailNotificationSender(mailSender, "no-reply@shecares.ng");
        willThrow(new MailSendException("down")).given(mailSender).send(any(SimpleMailMessage.class));

        assertThatThrownBy(() -> sender.sendEmail(new EmailMessage("ada@example.com", "Hello", "Body")))
                .isInstanceOf(MailSendException.class);
    }
}

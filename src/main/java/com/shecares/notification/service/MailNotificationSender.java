package com.shecares.notification.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class MailNotificationSender implements NotificationSender {

    private final JavaMailSender mailSender;
    private final String from;

    public MailNotificationSender(JavaMailSender mailSender,
                                  @Value("${shecares.mail.from:no-reply@shecares.ng}") String from) {
        this.mailSender = mailSender;
        this.from = from;
    }

    @Override
    public void sendEmail(EmailMessage message) {
        SimpleMailMessage mail = new SimpleMailMessage();
        mail.setFrom(from);
        mail.setTo(message.to());
        mail.setSubject(message.subject());
        mail.setText(message.text());

        mailSender.send(mail);
        log.info("Email sent: to={}, subject={}", message.to(), message.subject());
    }
}

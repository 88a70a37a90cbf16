package com.shecares.notification.service;

public interface NotificationSender {

    /**
     * 텍스트 이메일 발송.
     *
     * @throws org.springframework.mail.MailException 메일 서버가 거부하거나 연결할 수 없을 때
     */
    void sendEmail(EmailMessage message);
}

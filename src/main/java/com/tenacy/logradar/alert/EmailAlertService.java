package com.tenacy.logradar.alert;

import com.tenacy.logradar.config.AlertProperties;
import com.tenacy.logradar.exception.TransientIOException;
import com.tenacy.logradar.support.BoundedRetry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class EmailAlertService implements AlertService {

    private final JavaMailSender mailSender;
    private final AlertProperties.Email email;
    private final BoundedRetry retry;

    private final Counter sentCounter;
    private final Counter failedCounter;

    public EmailAlertService(JavaMailSender mailSender, AlertProperties properties, MeterRegistry meterRegistry) {
        this.mailSender = mailSender;
        this.email = properties.getEmail();

        AlertProperties.Notification notification = properties.getNotification();
        this.retry = new BoundedRetry("알림 이메일 전송", notification.getMaxRetries(),
                notification.getInitialBackoff(), notification.getMaxBackoff());

        this.sentCounter = Counter.builder("logradar.notifications.sent")
                .description("전송에 성공한 알림 수")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("logradar.notifications.failed")
                .description("재시도 끝에 전송하지 못한 알림 수")
                .register(meterRegistry);
    }

    @Async("notificationTaskExecutor")
    @Override
    public void sendAlert(String subject, String message) {
        log.info("알림 - 제목: {}, 메시지: {}", subject, message);

        if (!isEmailConfigValid()) {
            return;
        }

        SimpleMailMessage mailMessage = new SimpleMailMessage();
        mailMessage.setFrom(email.getSender());
        mailMessage.setTo(email.getRecipients().split(","));
        mailMessage.setSubject("[LogRadar 알림] " + subject);
        mailMessage.setText(message);

        try {
            retry.run(() -> deliver(mailMessage));
            sentCounter.increment();
            log.info("알림 이메일이 성공적으로 전송되었습니다: {}", subject);
        } catch (TransientIOException e) {
            failedCounter.increment();
            log.error("알림 이메일 전송 실패 (재시도 {}회 소진): {}", retry.getMaxRetries(), e.getMessage(), e);
        }
    }

    private void deliver(SimpleMailMessage mailMessage) {
        try {
            mailSender.send(mailMessage);
        } catch (MailException e) {
            throw new TransientIOException("메일 서버 전송 실패: " + e.getMessage(), e);
        }
    }

    private boolean isEmailConfigValid() {
        return email.isEnabled() &&
                StringUtils.hasText(email.getSender()) &&
                StringUtils.hasText(email.getRecipients());
    }
}

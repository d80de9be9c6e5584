package com.skynet.service;

import com.skynet.service.event.AccountVerifiedEvent;
import com.skynet.service.event.OtpIssuedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Delivers account emails once the state change that triggered them has committed.
 *
 * A delivery failure is logged and does not undo the committed state; the user can
 * recover through resend-otp.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationListener {

    private final MailService mailService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onOtpIssued(OtpIssuedEvent event) {
        if (!mailService.sendOtpEmail(event.getEmail(), event.getOtpCode(), event.getFullName())) {
            log.warn("OTP email could not be delivered to {}", event.getEmail());
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onAccountVerified(AccountVerifiedEvent event) {
        if (!mailService.sendWelcomeEmail(event.getEmail(), event.getFullName())) {
            log.warn("Welcome email could not be delivered to {}", event.getEmail());
        }
    }
}

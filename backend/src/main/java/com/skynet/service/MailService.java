package com.skynet.service;

import com.skynet.config.AuthProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;

/**
 * Sends account emails as HTML built from classpath templates.
 *
 * Templates live under {@code templates/} and use {@code {{name}}} placeholders.
 * Both send methods report failure through their return value and never throw:
 * callers log and carry on.
 */
@Service
@Slf4j
public class MailService {

    static final String OTP_SUBJECT = "Your OTP Code - Skynet";
    static final String WELCOME_SUBJECT = "Welcome to Skynet! 🚀";

    private static final String OTP_TEMPLATE = "templates/otp-email.html";
    private static final String WELCOME_TEMPLATE = "templates/welcome-email.html";

    private final JavaMailSender mailSender;
    private final String fromEmail;
    private final String fromName;
    private final long otpExpiryMinutes;

    public MailService(
            JavaMailSender mailSender,
            AuthProperties authProperties,
            @Value("${app.mail.from-email}") String fromEmail,
            @Value("${app.mail.from-name:Skynet}") String fromName
    ) {
        this.mailSender = mailSender;
        this.fromEmail = fromEmail;
        this.fromName = fromName;
        this.otpExpiryMinutes = authProperties.otpTtl().toMinutes();
    }

    /**
     * Send an OTP verification email.
     *
     * @return true if the message was handed to the mail server
     */
    public boolean sendOtpEmail(String toEmail, String otp, String userName) {
        try {
            String html = loadTemplate(OTP_TEMPLATE)
                    .replace("{{userName}}", escape(userName))
                    .replace("{{otp}}", otp)
                    .replace("{{expiryMinutes}}", String.valueOf(otpExpiryMinutes));
            return send(toEmail, OTP_SUBJECT, html);
        } catch (IOException ex) {
            log.warn("Could not load OTP email template: {}", ex.getMessage());
            return false;
        }
    }

    /**
     * Send the welcome email after a successful verification.
     *
     * @return true if the message was handed to the mail server
     */
    public boolean sendWelcomeEmail(String toEmail, String userName) {
        try {
            String html = loadTemplate(WELCOME_TEMPLATE)
                    .replace("{{userName}}", escape(userName));
            return send(toEmail, WELCOME_SUBJECT, html);
        } catch (IOException ex) {
            log.warn("Could not load welcome email template: {}", ex.getMessage());
            return false;
        }
    }

    private boolean send(String toEmail, String subject, String html) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(fromEmail, fromName);
            helper.setTo(toEmail);
            helper.setSubject(subject);
            helper.setText(html, true);

            mailSender.send(message);
            log.info("Email '{}' sent to {}", subject, toEmail);
            return true;
        } catch (MailException | MessagingException | UnsupportedEncodingException ex) {
            log.warn("Failed to send email '{}' to {}: {}", subject, toEmail, ex.getMessage());
            return false;
        }
    }

    private String loadTemplate(String path) throws IOException {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        }
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}

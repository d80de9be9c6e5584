package com.skynet.service.event;

import lombok.ToString;
import lombok.Value;

/**
 * Published when a fresh OTP has been attached to an account.
 */
@Value
@ToString(exclude = "otpCode")
public class OtpIssuedEvent {
    String email;
    String fullName;
    String otpCode;
}

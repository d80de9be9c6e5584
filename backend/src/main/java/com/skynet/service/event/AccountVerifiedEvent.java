package com.skynet.service.event;

import lombok.Value;

/**
 * Published when an account passes OTP verification.
 */
@Value
public class AccountVerifiedEvent {
    String email;
    String fullName;
}

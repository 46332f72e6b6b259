package com.safeher.sosdispatch.config;

import com.twilio.http.TwilioRestClient;
import com.safeher.sosdispatch.service.notification.NotificationGateway;
import com.safeher.sosdispatch.service.notification.TwilioNotificationGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the SMS/voice gateway once at startup.
 *
 * With blank credentials the gateway runs in stub mode: sends are logged and reported as SENT,
 * so local and test environments exercise the full dispatch flow without a Twilio account.
 */
@Configuration
@Slf4j
public class TwilioConfig {

    @Value("${twilio.account-sid:}")
    private String accountSid;

    @Value("${twilio.auth-token:}")
    private String authToken;

    @Value("${twilio.from-number:}")
    private String fromNumber;

    @Bean
    public NotificationGateway notificationGateway() {
        if (accountSid.isBlank() || authToken.isBlank() || fromNumber.isBlank()) {
            log.warn("[GATEWAY] Twilio credentials not configured — SMS/calls will be logged only");
            return new TwilioNotificationGateway(null, fromNumber);
        }
        TwilioRestClient client = new TwilioRestClient.Builder(accountSid, authToken).build();
        log.info("[GATEWAY] Twilio client initialised for account {}…", accountSid.substring(0, Math.min(6, accountSid.length())));
        return new TwilioNotificationGateway(client, fromNumber);
    }
}

package com.safeher.sosdispatch.service.notification;

import com.safeher.sosdispatch.entity.DeliveryStatus;

/**
 * Outbound SMS/voice channel. Implementations never throw for a delivery failure;
 * they report {@link DeliveryStatus#FAILED} instead.
 *
 * Phone numbers passed in are already normalized to E.164.
 */
public interface NotificationGateway {

    DeliveryStatus sendSms(String phone, String text);

    DeliveryStatus call(String phone, String script);
}

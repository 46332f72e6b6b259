package com.safeher.sosdispatch.service.notification;

import com.safeher.sosdispatch.entity.DeliveryStatus;
import com.twilio.exception.TwilioException;
import com.twilio.http.TwilioRestClient;
import com.twilio.rest.api.v2010.account.Call;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import com.twilio.type.Twiml;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.HtmlUtils;

/**
 * Twilio-backed SMS/voice gateway.
 *
 * Constructed once by TwilioConfig. A null client means no credentials were configured;
 * every send is then logged and reported as SENT.
 */
@Slf4j
public class TwilioNotificationGateway implements NotificationGateway {

    private final TwilioRestClient client;
    private final String fromNumber;

    public TwilioNotificationGateway(TwilioRestClient client, String fromNumber) {
        this.client = client;
        this.fromNumber = fromNumber;
    }

    public boolean isStubMode() {
        return client == null;
    }

    @Override
    public DeliveryStatus sendSms(String phone, String text) {
        if (isStubMode()) {
            log.info("[SMS STUB] to {}: {}", phone, text);
            return DeliveryStatus.SENT;
        }
        try {
            Message message = Message.creator(new PhoneNumber(phone), new PhoneNumber(fromNumber), text)
                    .create(client);
            log.info("[SMS] Sent to {} — sid={}", phone, message.getSid());
            return DeliveryStatus.SENT;
        } catch (TwilioException e) {
            log.warn("[SMS] Send to {} failed: {}", phone, e.getMessage());
            return DeliveryStatus.FAILED;
        }
    }

    @Override
    public DeliveryStatus call(String phone, String script) {
        if (isStubMode()) {
            log.info("[CALL STUB] to {}: {}", phone, script);
            return DeliveryStatus.SENT;
        }
        try {
            Twiml twiml = new Twiml("<Response><Say voice=\"alice\" loop=\"2\">"
                    + HtmlUtils.htmlEscape(script) + "</Say></Response>");
            Call call = Call.creator(new PhoneNumber(phone), new PhoneNumber(fromNumber), twiml)
                    .create(client);
            log.info("[CALL] Placed to {} — sid={}", phone, call.getSid());
            return DeliveryStatus.SENT;
        } catch (TwilioException e) {
            log.warn("[CALL] Call to {} failed: {}", phone, e.getMessage());
            return DeliveryStatus.FAILED;
        }
    }
}

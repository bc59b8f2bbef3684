package com.visitor.kiosk.service;

import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

@Component
public class TwilioSmsSender {

    private static final Logger log = LoggerFactory.getLogger(TwilioSmsSender.class);

    @Value("${twilio.enabled:false}")
    private boolean enabled;

    @Value("${twilio.account-sid:}")
    private String accountSid;

    @Value("${twilio.auth-token:}")
    private String authToken;

    @Value("${twilio.from-number:}")
    private String fromNumber;

    @PostConstruct
    void init() {
        if (!enabled) {
            return;
        }
        if (StringUtils.isAnyBlank(accountSid, authToken, fromNumber)) {
            log.warn("twilio.enabled=true but account-sid, auth-token or from-number is missing; SMS disabled");
            enabled = false;
            return;
        }
        Twilio.init(accountSid, authToken);
        log.info("Twilio SMS enabled from {}", fromNumber);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return the Twilio message SID
     */
    public String send(String to, String body) {
        if (!enabled) {
            throw new IllegalStateException("Twilio SMS is disabled");
        }
        Message message = Message.creator(new PhoneNumber(to), new PhoneNumber(fromNumber), body).create();
        log.debug("SMS {} queued to {}", message.getSid(), to);
        return message.getSid();
    }
}

package com.visitor.kiosk.service;

import com.visitor.kiosk.entity.Host;
import com.visitor.kiosk.repository.HostRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Tells a host their visitor has arrived: by SMS when the host has a phone
 * number on file and Twilio is enabled, otherwise by a log entry.
 */
@Service
public class HostNotificationService {

    private static final Logger log = LoggerFactory.getLogger(HostNotificationService.class);

    public static final String CHANNEL_SMS = "sms";
    public static final String CHANNEL_LOG = "log";

    private final HostRepository hostRepository;
    private final TwilioSmsSender smsSender;

    public HostNotificationService(HostRepository hostRepository, TwilioSmsSender smsSender) {
        this.hostRepository = hostRepository;
        this.smsSender = smsSender;
    }

    /**
     * @return the channel the notification went out on
     */
    public String notifyHost(String hostEmail, String visitorName) {
        String message = visitorName + " has arrived at reception and is waiting for you.";

        Optional<String> phone = hostRepository.findByEmail(hostEmail)
                .map(Host::getPhone)
                .filter(StringUtils::isNotBlank);

        if (phone.isPresent() && smsSender.isEnabled()) {
            try {
                smsSender.send(phone.get(), message);
                log.info("Notified host {} by SMS about {}", hostEmail, visitorName);
                return CHANNEL_SMS;
            } catch (Exception e) {
                log.warn("SMS to host {} failed, falling back to log: {}", hostEmail, e.getMessage());
            }
        }

        log.info("Host notification -> {}: {}", hostEmail, message);
        return CHANNEL_LOG;
    }
}

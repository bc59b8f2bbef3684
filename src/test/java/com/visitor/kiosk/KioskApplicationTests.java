package com.visitor.kiosk;

import com.visitor.kiosk.provider.DisabledProviders;
import com.visitor.kiosk.provider.OcrProvider;
import com.visitor.kiosk.repository.AdminUserRepository;
import com.visitor.kiosk.repository.HostRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class KioskApplicationTests {

    @Autowired
    private OcrProvider ocrProvider;

    @Autowired
    private HostRepository hostRepository;

    @Autowired
    private AdminUserRepository adminUserRepository;

    @Test
    void contextLoadsWithDisabledProvidersAndSeedData() {
        assertThat(ocrProvider).isInstanceOf(DisabledProviders.Ocr.class);
        assertThat(hostRepository.findByEmail("alice.johnson@example.com")).isPresent();
        assertThat(adminUserRepository.findByUsername("admin")).isPresent();
    }
}

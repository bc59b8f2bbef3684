package com.visitor.kiosk.repository;

import com.visitor.kiosk.entity.AdminUser;
import com.visitor.kiosk.entity.Host;
import com.visitor.kiosk.entity.VisitLog;
import com.visitor.kiosk.entity.Visitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(AdminListingRepositoryImpl.class)
class AdminListingRepositoryImplTest {

    @Autowired
    private TestEntityManager em;

    @Autowired
    private AdminListingRepository listingRepository;

    private Visitor alice;
    private Host carol;

    @BeforeEach
    void setUp() {
        alice = em.persist(Visitor.builder().fullName("Alice Smith").email("alice@example.com").build());
        em.persist(Visitor.builder().fullName("Dan Brown").email("dan@example.com").build());
        em.persist(Visitor.builder().fullName("Erin Wu").build());
        carol = em.persist(Host.builder().fullName("Carol Nguyen").email("carol@example.com").build());
        em.persist(AdminUser.builder().username("admin").hashedPassword("x").build());
        em.flush();
    }

    @Test
    void visitorsArePagedByOffset() {
        List<Visitor> page = listingRepository.findVisitors(1, 1);

        assertThat(page).extracting(Visitor::getFullName).containsExactly("Dan Brown");
        assertThat(listingRepository.findVisitors(0, 25)).hasSize(3);
        assertThat(listingRepository.findVisitors(3, 25)).isEmpty();
    }

    @Test
    void visitLogsAreMostRecentFirst() {
        Instant now = Instant.now();
        em.persist(visit("older", now.minus(2, ChronoUnit.HOURS)));
        em.persist(visit("newest", now));
        em.persist(visit("middle", now.minus(1, ChronoUnit.HOURS)));
        em.flush();
        em.clear();

        List<VisitLog> logs = listingRepository.findVisitLogs(0, 25);

        assertThat(logs).extracting(VisitLog::getPurpose).containsExactly("newest", "middle", "older");
        assertThat(logs.get(0).getVisitor().getFullName()).isEqualTo("Alice Smith");
        assertThat(logs.get(0).getHost().getEmail()).isEqualTo("carol@example.com");
        assertThat(listingRepository.findVisitLogs(1, 1)).extracting(VisitLog::getPurpose).containsExactly("middle");
    }

    @Test
    void hostsAndAdminUsersAreListed() {
        assertThat(listingRepository.findHosts(0, 25)).extracting(Host::getEmail).containsExactly("carol@example.com");
        assertThat(listingRepository.findAdminUsers(0, 25)).extracting(AdminUser::getUsername).containsExactly("admin");
    }

    private VisitLog visit(String purpose, Instant checkInTime) {
        return VisitLog.builder()
                .visitor(alice)
                .host(carol)
                .purpose(purpose)
                .checkInTime(checkInTime)
                .build();
    }
}

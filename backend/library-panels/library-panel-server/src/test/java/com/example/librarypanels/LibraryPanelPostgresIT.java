package com.example.librarypanels;

import com.example.librarypanels.api.dto.CreateLibraryPanelRequest;
import com.example.librarypanels.api.dto.PatchLibraryPanelRequest;
import com.example.librarypanels.api.model.LibraryPanel;
import com.example.librarypanels.context.RequestContext;
import com.example.librarypanels.error.exception.LibraryPanelAlreadyExistsException;
import com.example.librarypanels.error.exception.LibraryPanelConnectionNotFoundException;
import com.example.librarypanels.repository.LibraryPanelDao;
import com.example.librarypanels.repository.jdbc.LibraryPanelDashboardRepository;
import com.example.librarypanels.repository.jdbc.LibraryPanelRepository;
import com.example.librarypanels.service.LibraryPanelService;
import com.example.librarypanels.transaction.TransactionScope;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.postgresql.PostgreSQLContainer;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = "spring.profiles.active=it")
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Library Panels on PostgreSQL Integration Tests")
class LibraryPanelPostgresIT {

    private static final RequestContext ACTOR = RequestContext.of(1L, 42L);

    @Container
    static PostgreSQLContainer postgres = new PostgreSQLContainer("postgres:15-alpine")
            .withDatabaseName("testdb")
            .withUsername("testuser")
            .withPassword("testpass")
            .withInitScript("init-test-db.sql");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private LibraryPanelService libraryPanelService;

    @Autowired
    private LibraryPanelRepository libraryPanelRepository;

    @Autowired
    private LibraryPanelDashboardRepository libraryPanelDashboardRepository;

    @Autowired
    private TransactionScope transactionScope;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private Clock clock;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM library_panel_dashboard");
        jdbcTemplate.update("DELETE FROM library_panel");
    }

    @Test
    @DisplayName("Should run the panel and connection lifecycle against PostgreSQL")
    void shouldRunLifecycle() throws Exception {
        LibraryPanel panel = libraryPanelService.createLibraryPanel(ACTOR,
                new CreateLibraryPanelRequest(0L, "CPU", objectMapper.readTree("{\"type\":\"graph\"}")));

        libraryPanelService.connectDashboard(ACTOR, panel.uid(), 100L);
        assertThat(libraryPanelService.getConnectedDashboards(ACTOR, panel.uid())).containsExactly(100L);

        libraryPanelService.disconnectDashboard(ACTOR, panel.uid(), 100L);
        assertThatThrownBy(() -> libraryPanelService.disconnectDashboard(ACTOR, panel.uid(), 100L))
                .isInstanceOf(LibraryPanelConnectionNotFoundException.class);

        LibraryPanel patched = libraryPanelService.patchLibraryPanel(ACTOR, panel.uid(),
                new PatchLibraryPanelRequest(3L, "", null));
        assertThat(patched.name()).isEqualTo("CPU");
        assertThat(patched.folderId()).isEqualTo(3L);
        assertThat(libraryPanelService.getLibraryPanel(ACTOR, panel.uid())).isEqualTo(patched);
    }

    @Test
    @DisplayName("Should keep the transaction usable after a duplicate connect on PostgreSQL")
    void shouldConnectIdempotently() throws Exception {
        LibraryPanel panel = libraryPanelService.createLibraryPanel(ACTOR,
                new CreateLibraryPanelRequest(0L, "CPU", null));

        libraryPanelService.connectDashboard(ACTOR, panel.uid(), 100L);
        libraryPanelService.connectDashboard(ACTOR, panel.uid(), 100L);
        libraryPanelService.connectDashboard(ACTOR, panel.uid(), 200L);

        assertThat(libraryPanelDashboardRepository.count()).isEqualTo(2L);
        assertThat(libraryPanelService.getConnectedDashboards(ACTOR, panel.uid())).containsExactlyInAnyOrder(100L, 200L);
    }

    @Test
    @DisplayName("Should report a uid collision on PostgreSQL as AlreadyExists")
    void shouldRejectUidCollision() {
        LibraryPanelDao collidingDao = new LibraryPanelDao(libraryPanelRepository, () -> "collide01", clock);
        transactionScope.execute(ACTOR, status -> collidingDao.create(ACTOR, 0L, "first", null));

        assertThatThrownBy(() -> transactionScope.execute(ACTOR, status -> collidingDao.create(ACTOR, 0L, "second", null)))
                .isInstanceOf(LibraryPanelAlreadyExistsException.class);
    }
}

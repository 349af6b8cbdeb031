package com.agenthums.backend.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.agenthums.backend.integration.domain.IntegrationConnection;
import com.agenthums.backend.integration.persistence.DatabaseIntegrationTokenStore;
import com.agenthums.backend.profile.domain.ProfileRecord;
import com.agenthums.backend.profile.persistence.DatabaseProfileStore;
import com.agenthums.backend.support.PostgresTestContainer;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.test.StepVerifier;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
@Import({DatabaseProfileStore.class, DatabaseIntegrationTokenStore.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
class DatabaseStoresIntegrationTest extends PostgresTestContainer {

  @Autowired private DatabaseProfileStore profileStore;
  @Autowired private DatabaseIntegrationTokenStore tokenStore;

  @Test
  void duplicateProfileInsertSignalsDuplicateKey() {
    UUID id = UUID.randomUUID();
    ProfileRecord record = new ProfileRecord(id, "Lena");
    record.setEmail("lena@example.com");

    profileStore.insert(record).block();

    StepVerifier.create(profileStore.insert(record.copy()))
        .expectError(DuplicateKeyException.class)
        .verify();
    ProfileRecord stored = profileStore.selectById(id).block();
    assertThat(stored.getDisplayName()).isEqualTo("Lena");
    assertThat(stored.getPreferences().isObject()).isTrue();
  }

  @Test
  void profileUpdateAndActiveListing() {
    UUID id = UUID.randomUUID();
    profileStore.insert(new ProfileRecord(id, "Mira")).block();
    ProfileRecord loaded = profileStore.selectById(id).block();
    loaded.setNickname("mi");
    loaded.setActive(false);

    profileStore.update(loaded).block();

    assertThat(profileStore.selectById(id).block().getNickname()).isEqualTo("mi");
    List<ProfileRecord> active = profileStore.selectActive(0, 100).block();
    assertThat(active).extracting(ProfileRecord::getId).doesNotContain(id);
  }

  @Test
  void upsertKeepsOneRowPerIdentityAndService() {
    UUID identityId = UUID.randomUUID();
    Instant expiresAt = Instant.now().plusSeconds(3600).truncatedTo(ChronoUnit.SECONDS);
    IntegrationConnection first = new IntegrationConnection(identityId, "calendar");
    first.setAccessToken("at-1");
    first.setRefreshToken("rt-1");
    first.setExpiresAt(expiresAt);
    first.setScopes(List.of("https://www.googleapis.com/auth/calendar"));
    first.setConnected(true);
    tokenStore.upsert(first).block();

    IntegrationConnection second = new IntegrationConnection(identityId, "calendar");
    second.setAccessToken("at-2");
    second.setConnected(true);
    IntegrationConnection stored = tokenStore.upsert(second).block();

    assertThat(stored.getId()).isEqualTo(first.getId());
    assertThat(stored.getAccessToken()).isEqualTo("at-2");
    assertThat(stored.getExpiresAt()).isNull();
    assertThat(tokenStore.selectByIdentity(identityId).block()).hasSize(1);
    StepVerifier.create(tokenStore.selectByIdentityAndService(identityId, "drive"))
        .verifyComplete();
  }
}

package org.relaychat.repo;

import org.junit.jupiter.api.Test;
import org.relaychat.model.UserProfile;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class UserProfileRepositoryTest {

    @Autowired
    private TestEntityManager em;

    @Autowired
    private UserProfileRepository profileRepo;

    private void stored(Long userId, String displayName, long version, boolean deleted) {
        em.persistAndFlush(UserProfile.builder().userId(userId).username("user" + userId)
                .displayName(displayName).sourceVersion(version).deleted(deleted).build());
        em.clear();
    }

    private int write(Long userId, String displayName, long version) {
        return profileRepo.applySnapshot(userId, "user" + userId, displayName, null, null, false, null, version, Instant.now());
    }

    @Test
    void applySnapshot_shouldRefuseOlderVersion() {
        stored(1L, "v3", 3, false);

        assertThat(write(1L, "v2", 2)).isZero();

        assertThat(profileRepo.findById(1L)).get().satisfies(p -> {
            assertThat(p.getDisplayName()).isEqualTo("v3");
            assertThat(p.getSourceVersion()).isEqualTo(3);
        });
    }

    @Test
    void applySnapshot_shouldWriteSameOrNewerVersion() {
        stored(1L, "v3", 3, false);

        assertThat(write(1L, "v3 again", 3)).isEqualTo(1);
        assertThat(write(1L, "v5", 5)).isEqualTo(1);

        assertThat(profileRepo.findById(1L)).get().satisfies(p -> {
            assertThat(p.getDisplayName()).isEqualTo("v5");
            assertThat(p.getSourceVersion()).isEqualTo(5);
        });
    }

    @Test
    void applySnapshot_shouldNotTouchTombstoneOrMissingRow() {
        stored(1L, "gone", 2, true);

        assertThat(write(1L, "back", 9)).isZero();
        assertThat(write(2L, "nobody", 1)).isZero();

        assertThat(profileRepo.findById(1L)).get().extracting(UserProfile::getDisplayName).isEqualTo("gone");
        assertThat(profileRepo.existsById(2L)).isFalse();
    }

    @Test
    void markDeleted_shouldKeepHighestVersionAndOnlyApplyOnce() {
        stored(1L, "alice", 7, false);

        assertThat(profileRepo.markDeleted(1L, 4, Instant.now())).isEqualTo(1);
        assertThat(profileRepo.markDeleted(1L, 8, Instant.now())).isZero();

        assertThat(profileRepo.findById(1L)).get().satisfies(p -> {
            assertThat(p.isDeleted()).isTrue();
            assertThat(p.getSourceVersion()).isEqualTo(7);
        });
    }

    @Test
    void freshProfile_shouldNotOverwriteExistingRow() {
        stored(1L, "first", 4, false);

        UserProfile late = UserProfile.builder().userId(1L).username("user1").displayName("second")
                .sourceVersion(2).fresh(true).build();

        assertThatThrownBy(() -> profileRepo.saveAndFlush(late)).isInstanceOf(DataIntegrityViolationException.class);
    }
}

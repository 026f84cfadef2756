package com.example.secureshare.service;

import com.example.secureshare.entity.FileEntity;
import com.example.secureshare.entity.SharedLinkEntity;
import com.example.secureshare.entity.UserEntity;
import com.example.secureshare.repository.FileRepository;
import com.example.secureshare.repository.SharedLinkRepository;
import com.example.secureshare.repository.UserRepository;
import com.example.secureshare.test.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.example.secureshare.test.TestDatabase.bytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class PersistenceGatewayTest {

    @Autowired
    private PersistenceGateway gateway;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private FileRepository fileRepository;

    @Autowired
    private SharedLinkRepository sharedLinkRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @BeforeEach
    void setUp() {
        TestDatabase.clear(sharedLinkRepository, fileRepository, userRepository);
    }

    @Test
    void testCreateUser_LookupsByIdNameAndEmail() {
        UserEntity created = gateway.createUser("alice", "alice@x.com", "hash");

        assertNotNull(created.getId());
        assertNull(created.getPublicKey());
        assertEquals(created.getId(), gateway.findUserById(created.getId()).orElseThrow().getId());
        assertEquals(created.getId(), gateway.findUserByName("alice").orElseThrow().getId());
        assertEquals(created.getId(), gateway.findUserByEmail("alice@x.com").orElseThrow().getId());

        assertTrue(gateway.findUserById(UUID.randomUUID()).isEmpty());
        assertTrue(gateway.findUserByName("nobody").isEmpty());
        assertTrue(gateway.findUserByEmail("nobody@x.com").isEmpty());
    }

    @Test
    void testCreateUser_DuplicateEmailConflicts() {
        gateway.createUser("alice", "alice@x.com", "hash");

        EmailAlreadyExistsException e = assertThrows(EmailAlreadyExistsException.class,
                () -> gateway.createUser("other alice", "alice@x.com", "hash2"));
        assertEquals("alice@x.com", e.getEmail());
        assertEquals(1, userRepository.count());
    }

    @Test
    void testCreateUser_LostRaceOnInsertConflicts() {
        gateway.createUser("alice", "alice@x.com", "hash");

        // the email check passes as if a concurrent registration had not committed yet
        UserRepository racingUsers = mock(UserRepository.class);
        when(racingUsers.existsByEmail(anyString())).thenReturn(false);
        when(racingUsers.saveAndFlush(any(UserEntity.class)))
                .thenAnswer(inv -> userRepository.saveAndFlush(inv.getArgument(0)));
        PersistenceGateway racingGateway = new PersistenceGateway(
                racingUsers, fileRepository, sharedLinkRepository, transactionManager, Clock.systemUTC());

        EmailAlreadyExistsException e = assertThrows(EmailAlreadyExistsException.class,
                () -> racingGateway.createUser("other alice", "alice@x.com", "hash2"));

        assertEquals("alice@x.com", e.getEmail());
        assertInstanceOf(DataIntegrityViolationException.class, e.getCause());
        assertEquals(1, userRepository.count());
    }

    @Test
    void testUpdates_ChangeRowAndUpdatedAt() {
        UserEntity user = gateway.createUser("alice", "alice@x.com", "hash");

        UserEntity renamed = gateway.updateUserName(user.getId(), "alice smith");
        assertEquals("alice smith", renamed.getName());
        assertFalse(renamed.getUpdatedAt().isBefore(user.getUpdatedAt()));

        UserEntity rehashed = gateway.updateUserPassword(user.getId(), "new-hash");
        assertEquals("new-hash", rehashed.getPassword());

        gateway.setUserPublicKey(user.getId(), "-----BEGIN PUBLIC KEY-----");
        assertEquals("-----BEGIN PUBLIC KEY-----", gateway.findUserById(user.getId()).orElseThrow().getPublicKey());
    }

    @Test
    void testUpdates_UnknownUserNotFound() {
        UUID unknown = UUID.randomUUID();

        assertThrows(UserNotFoundException.class, () -> gateway.updateUserName(unknown, "x"));
        assertThrows(UserNotFoundException.class, () -> gateway.updateUserPassword(unknown, "x"));
        UserNotFoundException e = assertThrows(UserNotFoundException.class,
                () -> gateway.setUserPublicKey(unknown, "key"));
        assertEquals(unknown, e.getUserId());
    }

    @Test
    void testSearchUsers_ExcludesRequesterAndUsersWithoutKey() {
        UserEntity requester = TestDatabase.user(userRepository, "a", "a@x.com", "key-a");
        UserEntity enrolled = TestDatabase.user(userRepository, "b", "b@x.com", "key-b");
        TestDatabase.user(userRepository, "c", "c@x.com", null);
        UserEntity other = TestDatabase.user(userRepository, "d", "d@y.com", "key-d");

        for (String pattern : List.of("%", "%x.com%", "%@%", "a%", "%.com")) {
            List<UserEntity> found = gateway.searchUsersByEmailPrefix(requester.getId(), pattern);
            assertThat(found).extracting(UserEntity::getId).doesNotContain(requester.getId());
            assertThat(found).allMatch(UserEntity::hasPublicKey);
        }

        assertThat(gateway.searchUsersByEmailPrefix(requester.getId(), "%x.com%"))
                .extracting(UserEntity::getId)
                .containsExactly(enrolled.getId());
        assertThat(gateway.searchUsersByEmailPrefix(requester.getId(), "%"))
                .extracting(UserEntity::getId)
                .containsExactly(enrolled.getId(), other.getId());
        assertThat(gateway.searchUsersByEmailPrefix(requester.getId(), "zzz%")).isEmpty();
    }

    @Test
    void testStoreEncryptedFile_ThenFetchSharedLinkReturnsInput() {
        UserEntity owner = TestDatabase.user(userRepository, "a", "a@x.com", null);
        UserEntity recipient = TestDatabase.user(userRepository, "b", "b@x.com", "key-b");
        Instant expires = Instant.now().plus(1, ChronoUnit.HOURS).truncatedTo(ChronoUnit.MILLIS);

        SharedLinkEntity stored = gateway.storeEncryptedFile(owner.getId(), "report.pdf", 1024L,
                recipient.getId(), "access-hash", expires,
                bytes("aes-key"), bytes("ciphertext"), bytes("iv-bytes"));

        SharedLinkEntity fetched = gateway.fetchSharedLink(stored.getId(), recipient.getId()).orElseThrow();
        assertEquals(stored.getId(), fetched.getId());
        assertEquals(recipient.getId(), fetched.getRecipientUserId());
        assertEquals("access-hash", fetched.getPassword());
        assertEquals(expires, fetched.getExpirationDate());

        FileEntity file = gateway.fetchFile(fetched.getFileId()).orElseThrow();
        assertEquals(owner.getId(), file.getUserId());
        assertEquals("report.pdf", file.getFileName());
        assertEquals(1024L, file.getFileSize());
        assertArrayEquals(bytes("aes-key"), file.getEncryptedKey());
        assertArrayEquals(bytes("ciphertext"), file.getEncryptedPayload());
        assertArrayEquals(bytes("iv-bytes"), file.getIv());

        assertEquals(1, fileRepository.count());
        assertEquals(1, sharedLinkRepository.count());
    }

    @Test
    void testFetchSharedLink_AbsentForUnknownForeignAndExpired() {
        UserEntity owner = TestDatabase.user(userRepository, "a", "a@x.com", null);
        UserEntity recipient = TestDatabase.user(userRepository, "b", "b@x.com", "key-b");
        UserEntity stranger = TestDatabase.user(userRepository, "c", "c@x.com", "key-c");

        FileEntity liveFile = TestDatabase.file(fileRepository, owner.getId(), "live.txt");
        SharedLinkEntity live = TestDatabase.link(sharedLinkRepository, liveFile.getId(), recipient.getId(),
                Instant.now().plus(1, ChronoUnit.HOURS), Instant.now());
        FileEntity deadFile = TestDatabase.file(fileRepository, owner.getId(), "dead.txt");
        SharedLinkEntity expired = TestDatabase.link(sharedLinkRepository, deadFile.getId(), recipient.getId(),
                Instant.now().minus(1, ChronoUnit.MINUTES), Instant.now().minus(2, ChronoUnit.HOURS));

        Optional<SharedLinkEntity> unknown = gateway.fetchSharedLink(UUID.randomUUID(), recipient.getId());
        Optional<SharedLinkEntity> foreign = gateway.fetchSharedLink(live.getId(), stranger.getId());
        Optional<SharedLinkEntity> ownerAttempt = gateway.fetchSharedLink(live.getId(), owner.getId());
        Optional<SharedLinkEntity> stale = gateway.fetchSharedLink(expired.getId(), recipient.getId());

        assertEquals(Optional.empty(), unknown);
        assertEquals(Optional.empty(), foreign);
        assertEquals(Optional.empty(), ownerAttempt);
        assertEquals(Optional.empty(), stale);
        assertTrue(gateway.fetchSharedLink(live.getId(), recipient.getId()).isPresent());
    }

    @Test
    void testFetchFile_Unknown() {
        assertTrue(gateway.fetchFile(UUID.randomUUID()).isEmpty());
    }
}

/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.moodvault.api.DateRange;
import dev.moodvault.api.EntryFields;
import dev.moodvault.api.ErrorCode;
import dev.moodvault.api.PersistenceException;
import dev.moodvault.api.ReadResult;
import dev.moodvault.api.User;
import dev.moodvault.api.ValidationException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Integration tests for {@link EntryStore} on a real SQLite file. */
final class EntryStoreTest {
  private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
  private static final LocalDate JAN_2 = LocalDate.of(2024, 1, 2);
  private static final LocalDate JAN_3 = LocalDate.of(2024, 1, 3);

  @TempDir Path tempDir;

  private VaultTestSupport vault;
  private Metrics metrics;
  private EntryStore store;

  @BeforeEach
  void setUp() {
    metrics = new Metrics();
    vault = VaultTestSupport.open(tempDir, metrics);
    store = vault.store;
  }

  @AfterEach
  void tearDown() {
    vault.close();
    metrics.close();
  }

  @Test
  void storedEntryReadsBackIdentical() {
    EntryFields fields = EntryFields.builder().mood("5").sleep("7").comment("ok").build();
    store.upsertEntry(42L, JAN_1, fields);

    ReadResult read = store.readEntries(42L, DateRange.all());
    assertEquals(1, read.size());
    assertEquals(0, read.skipped());
    assertEquals(fields, read.entries().get(0).fields());
    assertEquals(JAN_1, read.entries().get(0).date());
    assertEquals(1, metrics.view().getEntryWriteSuccess());
  }

  @Test
  void payloadIsNotStoredInPlaintext() throws Exception {
    store.upsertEntry(42L, JAN_1, EntryFields.builder().comment("very private words").build());
    try (Connection c = vault.pool.getConnection();
        PreparedStatement ps = c.prepareStatement("SELECT payload FROM entries");
        ResultSet rs = ps.executeQuery()) {
      assertTrue(rs.next());
      String raw = new String(rs.getBytes(1), StandardCharsets.ISO_8859_1);
      assertFalse(raw.contains("very private words"));
    }
  }

  @Test
  void secondWriteForSameDayReplacesTheFirst() {
    store.upsertEntry(42L, JAN_1, EntryFields.builder().mood("3").build());
    store.upsertEntry(42L, JAN_1, EntryFields.builder().mood("6").build());

    ReadResult read = store.readEntries(42L, null);
    assertEquals(1, read.size());
    assertEquals("6", read.entries().get(0).fields().mood());
    assertEquals(1, store.countEntries(42L));
  }

  @Test
  void readsAreNewestFirstAndHonourRange() {
    store.upsertEntry(42L, JAN_1, EntryFields.builder().mood("1").build());
    store.upsertEntry(42L, JAN_3, EntryFields.builder().mood("3").build());
    store.upsertEntry(42L, JAN_2, EntryFields.builder().mood("2").build());
    store.upsertEntry(7L, JAN_2, EntryFields.builder().mood("9").build());

    List<LocalDate> dates =
        store.readEntries(42L, DateRange.all()).entries().stream().map(e -> e.date()).toList();
    assertEquals(List.of(JAN_3, JAN_2, JAN_1), dates);

    ReadResult window = store.readEntries(42L, DateRange.between(JAN_2, JAN_3));
    assertEquals(2, window.size());
    assertEquals(List.of(JAN_3, JAN_2), store.entryDates(42L).subList(0, 2));
    assertEquals(1, store.readEntries(42L, DateRange.since(JAN_3)).size());
  }

  @Test
  void undecryptableRowIsSkippedAndCounted() throws Exception {
    store.upsertEntry(42L, JAN_1, EntryFields.builder().mood("4").build());
    store.upsertEntry(42L, JAN_2, EntryFields.builder().mood("5").build());
    try (Connection c = vault.pool.getConnection();
        PreparedStatement ps =
            c.prepareStatement("UPDATE entries SET payload=? WHERE owner=? AND entry_date=?")) {
      ps.setBytes(1, new byte[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17, 18,
          19, 20, 21, 22, 23, 24, 25, 26, 27, 28, 29, 30});
      ps.setLong(2, 42L);
      ps.setString(3, JAN_1.toString());
      assertEquals(1, ps.executeUpdate());
    }

    ReadResult read = store.readEntries(42L, DateRange.all());
    assertEquals(1, read.size());
    assertEquals(1, read.skipped());
    assertTrue(read.hasSkipped());
    assertEquals(1, metrics.view().getSkippedRows());
    assertEquals(1, metrics.view().getDecryptFailures());
  }

  @Test
  void rowWrittenForAnotherOwnerFailsClosed() throws Exception {
    store.upsertEntry(1L, JAN_1, EntryFields.builder().mood("4").build());
    store.upsertUser(2L, null, null);
    try (Connection c = vault.pool.getConnection();
        PreparedStatement ps = c.prepareStatement("UPDATE entries SET owner=2 WHERE owner=1")) {
      ps.executeUpdate();
    }
    ReadResult read = store.readEntries(2L, DateRange.all());
    assertTrue(read.isEmpty());
    assertEquals(1, read.skipped());
  }

  @Test
  void hasEntryAndDeletesWithoutDecrypting() {
    store.upsertEntry(42L, JAN_1, EntryFields.EMPTY);
    store.upsertEntry(42L, JAN_2, EntryFields.EMPTY);

    assertTrue(store.hasEntry(42L, JAN_1));
    assertFalse(store.hasEntry(42L, JAN_3));
    assertTrue(store.deleteEntry(42L, JAN_1));
    assertFalse(store.deleteEntry(42L, JAN_1));
    assertFalse(store.hasEntry(42L, JAN_1));

    assertEquals(1, store.deleteAllEntries(42L));
    assertEquals(0, store.countEntries(42L));
    assertTrue(store.ownerExists(42L), "deleting entries keeps the user row");
  }

  @Test
  void writingAnEntryCreatesTheUserRow() {
    assertFalse(store.ownerExists(99L));
    store.upsertEntry(99L, JAN_1, EntryFields.EMPTY);
    assertTrue(store.ownerExists(99L));
    User user = store.findUser(99L).orElseThrow();
    assertNull(user.displayName());
    assertNull(user.notificationTime());
  }

  @Test
  void nullNotificationTimeIsWrittenAsNull() {
    store.upsertUser(42L, "Ann", "21:00");
    assertEquals(List.of(42L), store.usersDueForNotification("21:00"));

    store.upsertUser(42L, "Ann", null);
    assertNull(store.findUser(42L).orElseThrow().notificationTime());
    assertTrue(store.usersDueForNotification("21:00").isEmpty());
  }

  @Test
  void notificationTimesAreNormalized() {
    store.upsertUser(1L, "A", "9:05");
    store.upsertUser(2L, "B", "09:05");
    store.upsertUser(3L, "C", "10:00");

    assertEquals("09:05", store.findUser(1L).orElseThrow().notificationTime());
    assertEquals(List.of(1L, 2L), store.usersDueForNotification("9:05"));
  }

  @Test
  void invalidClockTimesAreRejected() {
    ValidationException e =
        assertThrows(ValidationException.class, () -> store.upsertUser(1L, "A", "25:00"));
    assertEquals(ErrorCode.INVALID_CLOCK, e.errorCode());
    assertThrows(ValidationException.class, () -> store.usersDueForNotification(" "));
    assertThrows(ValidationException.class, () -> store.usersDueForNotification("noon"));
  }

  @Test
  void closedPoolSurfacesPersistenceException() {
    vault.pool.close();
    PersistenceException e =
        assertThrows(
            PersistenceException.class,
            () -> store.upsertEntry(42L, JAN_1, EntryFields.builder().mood("1").build()));
    assertEquals(1, metrics.view().getEntryWriteFailure());
    assertTrue(e.getMessage().startsWith("store.upsertEntry failed"));
  }
}

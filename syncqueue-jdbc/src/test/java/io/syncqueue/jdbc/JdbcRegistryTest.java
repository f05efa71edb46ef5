package io.syncqueue.jdbc;

import io.syncqueue.jdbc.checkpoint.H2CheckpointStore;
import io.syncqueue.jdbc.checkpoint.JdbcCheckpointStores;
import io.syncqueue.jdbc.checkpoint.MySqlCheckpointStore;
import io.syncqueue.jdbc.checkpoint.PostgresCheckpointStore;
import io.syncqueue.jdbc.purge.H2ItemPurger;
import io.syncqueue.jdbc.purge.JdbcItemPurgers;
import io.syncqueue.jdbc.purge.MySqlItemPurger;
import io.syncqueue.jdbc.purge.PostgresItemPurger;
import io.syncqueue.jdbc.store.H2QueueStore;
import io.syncqueue.jdbc.store.JdbcQueueStores;
import io.syncqueue.jdbc.store.MySqlQueueStore;
import io.syncqueue.jdbc.store.PostgresQueueStore;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcRegistryTest {

  // ── queue stores ───────────────────────────────────────────────

  @Test
  void queueStoresAreRegistered() {
    assertEquals(3, JdbcQueueStores.all().size());
  }

  @Test
  void queueStoreByName() {
    assertInstanceOf(H2QueueStore.class, JdbcQueueStores.get("h2"));
    assertInstanceOf(PostgresQueueStore.class, JdbcQueueStores.get("PostgreSQL"));
    assertInstanceOf(MySqlQueueStore.class, JdbcQueueStores.get("mysql"));
  }

  @Test
  void queueStoreByUrl() {
    assertInstanceOf(H2QueueStore.class, JdbcQueueStores.detect("jdbc:h2:mem:test"));
    assertInstanceOf(PostgresQueueStore.class, JdbcQueueStores.detect("jdbc:postgresql://localhost/sync"));
    assertInstanceOf(MySqlQueueStore.class, JdbcQueueStores.detect("jdbc:mysql://localhost/sync"));
    assertInstanceOf(MySqlQueueStore.class, JdbcQueueStores.detect("jdbc:tidb://localhost/sync"));
  }

  @Test
  void queueStoreFromDataSource() throws SQLException {
    assertInstanceOf(H2QueueStore.class, JdbcQueueStores.detect(TestDatabases.h2()));
  }

  @Test
  void unknownQueueStoreFails() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> JdbcQueueStores.get("oracle"));
    assertTrue(e.getMessage().startsWith("Unknown queue store: oracle"));
    assertThrows(IllegalArgumentException.class, () -> JdbcQueueStores.detect("jdbc:oracle:thin:@localhost"));
    assertThrows(IllegalArgumentException.class, () -> JdbcQueueStores.detect(""));
  }

  // ── checkpoint stores ──────────────────────────────────────────

  @Test
  void checkpointStoresAreRegistered() {
    assertEquals(3, JdbcCheckpointStores.all().size());
    assertInstanceOf(H2CheckpointStore.class, JdbcCheckpointStores.detect("jdbc:h2:mem:test"));
    assertInstanceOf(PostgresCheckpointStore.class, JdbcCheckpointStores.get("postgresql"));
    assertInstanceOf(MySqlCheckpointStore.class, JdbcCheckpointStores.detect("jdbc:mysql://db/sync"));
  }

  @Test
  void unknownCheckpointStoreFails() {
    assertThrows(IllegalArgumentException.class, () -> JdbcCheckpointStores.get("sqlite"));
  }

  // ── purgers ────────────────────────────────────────────────────

  @Test
  void purgersAreRegistered() {
    assertEquals(3, JdbcItemPurgers.all().size());
    assertInstanceOf(H2ItemPurger.class, JdbcItemPurgers.get("h2"));
    assertInstanceOf(PostgresItemPurger.class, JdbcItemPurgers.detect("jdbc:postgresql://db/sync"));
    assertInstanceOf(MySqlItemPurger.class, JdbcItemPurgers.detect("jdbc:tidb://db/sync"));
  }

  @Test
  void unknownPurgerFails() {
    assertThrows(IllegalArgumentException.class, () -> JdbcItemPurgers.detect("jdbc:sqlserver://db"));
  }
}

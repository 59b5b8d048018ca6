package ddd.outbox.spring.boot;

import ddd.outbox.factory.OutboxMessageFactory;
import ddd.outbox.jdbc.JdbcOutboxRepository;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.core.io.ClassPathResource;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SpringTxContextTest {

  private JdbcDataSource dataSource;
  private SpringTxContext txContext;
  private JdbcOutboxRepository repository;
  private TransactionTemplate tx;

  @BeforeEach
  void setUp() {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:tx_" + UUID.randomUUID().toString().replace("-", "")
        + ";DB_CLOSE_DELAY=-1");
    new ResourceDatabasePopulator(new ClassPathResource("ddd/outbox/jdbc/schema/h2.sql"))
        .execute(dataSource);
    txContext = new SpringTxContext(dataSource);
    repository = JdbcOutboxRepository.builder()
        .dataSource(dataSource)
        .txContext(txContext)
        .build();
    tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
  }

  @Test
  void noTransactionOutsideTemplate() {
    assertFalse(txContext.isTransactionActive());
    assertThrows(IllegalStateException.class, txContext::currentConnection);
  }

  @Test
  void exposesSpringManagedConnection() {
    tx.executeWithoutResult(status -> {
      assertTrue(txContext.isTransactionActive());
      assertSame(txContext.currentConnection(), txContext.currentConnection());
    });
  }

  @Test
  void saveJoinsCommittedTransaction() {
    String id = tx.execute(status ->
        repository.saveMessage(OutboxMessageFactory.createMessage("OrderPlaced", "o-1")));

    assertTrue(repository.getById(id).isPresent());
  }

  @Test
  void saveRolledBackWithTransaction() {
    String[] id = new String[1];
    tx.executeWithoutResult(status -> {
      id[0] = repository.saveMessage(OutboxMessageFactory.createMessage("OrderPlaced", "o-1"));
      assertTrue(repository.getById(id[0]).isPresent());
      status.setRollbackOnly();
    });

    assertFalse(repository.getById(id[0]).isPresent());
  }

  @Test
  void rejectsNullDataSource() {
    assertThrows(NullPointerException.class, () -> new SpringTxContext(null));
  }
}

package io.docstore.tx;

import io.docstore.codec.CustomTypeHandler;
import io.docstore.codec.DocumentId;
import io.docstore.database.SimpleDatabase;
import io.docstore.resolver.NameResolver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StandaloneTransactionContextTest {

  private SimpleDatabase database;

  @BeforeEach
  void setUp() {
    database = new SimpleDatabase(7, "shop");
    database.createCollection("orders");
  }

  @Test
  void constructorRejectsNullDatabase() {
    assertThrows(NullPointerException.class, () -> new StandaloneTransactionContext(null));
  }

  @Test
  void notEmbeddableByDefault() {
    assertFalse(new StandaloneTransactionContext(database).isEmbeddable());
    assertTrue(new StandaloneTransactionContext(database, true).isEmbeddable());
  }

  @Test
  void registerMakesTransactionTheParent() {
    StandaloneTransactionContext context = new StandaloneTransactionContext(database);
    StubTransactionState trx = new StubTransactionState("trx-1");

    assertTrue(context.getParentTransaction().isEmpty());
    context.registerTransaction(trx);

    assertSame(trx, context.getParentTransaction().orElseThrow());
  }

  @Test
  void secondRegisterFailsAndKeepsFirstTransaction() {
    StandaloneTransactionContext context = new StandaloneTransactionContext(database);
    StubTransactionState first = new StubTransactionState("trx-1");
    StubTransactionState second = new StubTransactionState("trx-2");

    context.registerTransaction(first);
    ContextStateException ex = assertThrows(ContextStateException.class,
        () -> context.registerTransaction(second));

    assertTrue(ex.getMessage().contains("trx-1"));
    assertSame(first, context.getParentTransaction().orElseThrow());
  }

  @Test
  void registerRejectsNull() {
    StandaloneTransactionContext context = new StandaloneTransactionContext(database);
    assertThrows(NullPointerException.class, () -> context.registerTransaction(null));
  }

  @Test
  void unregisterClearsParentAndAllowsNewRegistration() {
    StandaloneTransactionContext context = new StandaloneTransactionContext(database);
    context.registerTransaction(new StubTransactionState("trx-1"));

    context.unregisterTransaction();
    assertTrue(context.getParentTransaction().isEmpty());

    StubTransactionState next = new StubTransactionState("trx-2");
    context.registerTransaction(next);
    assertSame(next, context.getParentTransaction().orElseThrow());
  }

  @Test
  void unregisterOnEmptyContextIsNoOp() {
    StandaloneTransactionContext context = new StandaloneTransactionContext(database);

    assertDoesNotThrow(context::unregisterTransaction);
    assertDoesNotThrow(context::unregisterTransaction);
    assertTrue(context.getParentTransaction().isEmpty());
  }

  @Test
  void unregisterDoesNotFinishTransaction() {
    StandaloneTransactionContext context = new StandaloneTransactionContext(database);
    StubTransactionState trx = new StubTransactionState("trx-1");
    context.registerTransaction(trx);

    context.unregisterTransaction();

    assertTrue(trx.isActive());
  }

  @Test
  void customTypeHandlerIsBuiltOnce() {
    StandaloneTransactionContext context = new StandaloneTransactionContext(database);

    CustomTypeHandler first = context.orderCustomTypeHandler();
    CustomTypeHandler second = context.orderCustomTypeHandler();

    assertSame(first, second);
  }

  @Test
  void resolverIsBuiltOnce() {
    StandaloneTransactionContext context = new StandaloneTransactionContext(database);

    NameResolver first = context.getResolver();
    NameResolver second = context.getResolver();

    assertSame(first, second);
  }

  @Test
  void customTypeHandlerUsesContextDatabase() {
    StandaloneTransactionContext context = new StandaloneTransactionContext(database);
    long ordersId = database.collection("orders").orElseThrow().id();

    String handle = context.orderCustomTypeHandler().toHandle(new DocumentId(ordersId, "42"));

    assertEquals("orders/42", handle);
    assertSame(database, context.database());
  }

  @Test
  void separateContextsBuildSeparateHandlers() {
    StandaloneTransactionContext a = new StandaloneTransactionContext(database);
    StandaloneTransactionContext b = new StandaloneTransactionContext(database);

    assertNotSame(a.orderCustomTypeHandler(), b.orderCustomTypeHandler());
    assertNotSame(a.getResolver(), b.getResolver());
  }
}

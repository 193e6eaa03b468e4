package chatfeed.spring.boot;

import chatfeed.ChangeEvent;
import chatfeed.ChangeHandler;
import chatfeed.ChangeTopics;
import chatfeed.Operation;
import chatfeed.jdbc.PostgresChangeChannel;
import chatfeed.listener.MessageChangeListener;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageChangeHandlerRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(ListenerConfig.class);

  @Test
  void registersHandlerForAllChanges() {
    runner.withUserConfiguration(AllChangesConfig.class).run(ctx -> {
      var listener = ctx.getBean(MessageChangeListener.class);
      assertEquals(1, listener.eventBus().subscriberCount(ChangeTopics.MESSAGE_CHANGE));
      assertEquals(0, listener.eventBus().subscriberCount(ChangeTopics.MESSAGE_INSERT));

      listener.eventBus().publish(ChangeTopics.MESSAGE_CHANGE, ChangeEvent.test("ping"));

      var handler = ctx.getBean(AllChangesHandler.class);
      assertEquals(1, handler.received.size());
      assertEquals("ping", handler.received.get(0).message());
    });
  }

  @Test
  void registersHandlerPerOperation() {
    runner.withUserConfiguration(DeletesAndUpdatesConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageChangeListener.class).eventBus();
      assertEquals(0, bus.subscriberCount(ChangeTopics.MESSAGE_CHANGE));
      assertEquals(1, bus.subscriberCount(ChangeTopics.MESSAGE_UPDATE));
      assertEquals(1, bus.subscriberCount(ChangeTopics.MESSAGE_DELETE));
      assertEquals(0, bus.subscriberCount(ChangeTopics.MESSAGE_INSERT));
    });
  }

  @Test
  void duplicateOperationsSubscribeOnce() {
    runner.withUserConfiguration(DuplicateOperationConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageChangeListener.class).eventBus();
      assertEquals(1, bus.subscriberCount(ChangeTopics.MESSAGE_INSERT));
    });
  }

  @Test
  void rejectsBeanNotImplementingChangeHandler() {
    runner.withUserConfiguration(InvalidHandlerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  // ── Test configurations ──────────────────────────────────────

  @Configuration
  static class ListenerConfig {
    @Bean(destroyMethod = "close")
    MessageChangeListener messageChangeListener() {
      return MessageChangeListener.builder()
          .connectionProvider(() -> {
            throw new SQLException("not used");
          })
          .changeChannel(new PostgresChangeChannel())
          .build();
    }

    @Bean
    MessageChangeHandlerRegistrar registrar(ListableBeanFactory beanFactory, MessageChangeListener listener) {
      return new MessageChangeHandlerRegistrar(beanFactory, listener);
    }
  }

  @MessageChangeHandler
  static class AllChangesHandler implements ChangeHandler {
    final List<ChangeEvent> received = new ArrayList<>();

    @Override
    public void onChange(ChangeEvent event) {
      received.add(event);
    }
  }

  @Configuration
  static class AllChangesConfig {
    @Bean
    AllChangesHandler allChangesHandler() {
      return new AllChangesHandler();
    }
  }

  @MessageChangeHandler(operations = {Operation.UPDATE, Operation.DELETE})
  static class DeletesAndUpdatesHandler implements ChangeHandler {
    @Override
    public void onChange(ChangeEvent event) {}
  }

  @Configuration
  static class DeletesAndUpdatesConfig {
    @Bean
    DeletesAndUpdatesHandler deletesAndUpdatesHandler() {
      return new DeletesAndUpdatesHandler();
    }
  }

  @MessageChangeHandler(operations = {Operation.INSERT, Operation.INSERT})
  static class DuplicateOperationHandler implements ChangeHandler {
    @Override
    public void onChange(ChangeEvent event) {}
  }

  @Configuration
  static class DuplicateOperationConfig {
    @Bean
    DuplicateOperationHandler duplicateOperationHandler() {
      return new DuplicateOperationHandler();
    }
  }

  @MessageChangeHandler
  static class NotAHandler {}

  @Configuration
  static class InvalidHandlerConfig {
    @Bean
    NotAHandler notAHandler() {
      return new NotAHandler();
    }
  }
}

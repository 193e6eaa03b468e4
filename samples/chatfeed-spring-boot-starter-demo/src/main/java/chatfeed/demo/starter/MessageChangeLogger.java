package chatfeed.demo.starter;

import chatfeed.ChangeEvent;
import chatfeed.ChangeHandler;
import chatfeed.spring.boot.MessageChangeHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@MessageChangeHandler
public class MessageChangeLogger implements ChangeHandler {

  private static final Logger log = LoggerFactory.getLogger(MessageChangeLogger.class);

  @Override
  public void onChange(ChangeEvent event) {
    switch (event.operation()) {
      case INSERT -> log.info("[Feed] new message id={} group={} sender={}",
          event.id(), event.groupId(), event.senderId());
      case UPDATE -> log.info("[Feed] message updated id={} softDelete={} restore={} contentEdit={}",
          event.id(), event.isSoftDelete(), event.isRestore(), event.isContentEdit());
      case DELETE -> log.info("[Feed] message removed id={} group={}", event.id(), event.groupId());
      case TEST -> log.info("[Feed] test notification: {}", event.message());
    }
  }
}

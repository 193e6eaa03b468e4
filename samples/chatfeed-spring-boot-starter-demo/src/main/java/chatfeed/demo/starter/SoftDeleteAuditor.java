package chatfeed.demo.starter;

import chatfeed.ChangeEvent;
import chatfeed.ChangeHandler;
import chatfeed.Operation;
import chatfeed.spring.boot.MessageChangeHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Only receives updates; soft deletes arrive as updates flipping {@code is_deleted}.
 */
@Component
@MessageChangeHandler(operations = Operation.UPDATE)
public class SoftDeleteAuditor implements ChangeHandler {

  private static final Logger log = LoggerFactory.getLogger(SoftDeleteAuditor.class);

  @Override
  public void onChange(ChangeEvent event) {
    if (event.isSoftDelete()) {
      log.info("[Audit] message {} hidden in group {} (eventId={})",
          event.id(), event.groupId(), event.eventId());
    } else if (event.isRestore()) {
      log.info("[Audit] message {} restored in group {} (eventId={})",
          event.id(), event.groupId(), event.eventId());
    }
  }
}

package chatfeed.spring.boot;

import chatfeed.Operation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a subscriber of the message change feed.
 *
 * <p>The annotated bean must implement {@link chatfeed.ChangeHandler}.
 *
 * <pre>{@code
 * @Component
 * @MessageChangeHandler(operations = Operation.INSERT)
 * public class NewMessageBroadcaster implements ChangeHandler {
 *   public void onChange(ChangeEvent event) { ... }
 * }
 * }</pre>
 *
 * <p>With no {@code operations} the bean receives every change, including test
 * notifications. Otherwise it is subscribed once per listed operation.
 *
 * @see MessageChangeHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MessageChangeHandler {

    /**
     * Operations to receive. Empty means all.
     */
    Operation[] operations() default {};
}

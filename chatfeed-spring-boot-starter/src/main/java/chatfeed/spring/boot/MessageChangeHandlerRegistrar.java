package chatfeed.spring.boot;

import chatfeed.ChangeHandler;
import chatfeed.ChangeTopics;
import chatfeed.Operation;
import chatfeed.listener.MessageChangeListener;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.EnumSet;
import java.util.Map;

/**
 * Scans for beans annotated with {@link MessageChangeHandler} and subscribes them on
 * the {@link MessageChangeListener}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * before the listener is connected.
 *
 * @see MessageChangeHandler
 */
public class MessageChangeHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final MessageChangeListener listener;

    public MessageChangeHandlerRegistrar(ListableBeanFactory beanFactory, MessageChangeListener listener) {
        this.beanFactory = beanFactory;
        this.listener = listener;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(MessageChangeHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof ChangeHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @MessageChangeHandler must implement ChangeHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Proxy may hide annotation; search the class hierarchy
            MessageChangeHandler annotation = AnnotationUtils.findAnnotation(
                    bean.getClass(), MessageChangeHandler.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @MessageChangeHandler annotation on " + bean.getClass().getName());
            }

            Operation[] operations = annotation.operations();
            if (operations.length == 0) {
                listener.subscribe(ChangeTopics.MESSAGE_CHANGE, handler);
                continue;
            }
            for (Operation operation : EnumSet.of(operations[0], operations)) {
                listener.subscribe(ChangeTopics.forOperation(operation), handler);
            }
        }
    }
}

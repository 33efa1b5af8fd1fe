package io.triggers.spring.boot;

import io.triggers.EventHandler;
import io.triggers.Trigger;
import io.triggers.TriggerException;
import io.triggers.registry.DefaultTriggerRegistry;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Creates the configured trigger instances, attaches beans annotated with
 * {@link TriggerHandler}, and starts the instances marked for auto-start.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see TriggerHandler
 * @see TriggerProperties
 */
public class TriggerHandlerRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(TriggerHandlerRegistrar.class.getName());

    private static final String BEAN_NAME = "triggerHandlerRegistrar";

    private final ListableBeanFactory beanFactory;
    private final DefaultTriggerRegistry registry;
    private final TriggerProperties props;

    public TriggerHandlerRegistrar(ListableBeanFactory beanFactory, DefaultTriggerRegistry registry,
            TriggerProperties props) {
        this.beanFactory = beanFactory;
        this.registry = registry;
        this.props = props;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Set<String> toStart = new LinkedHashSet<>();
        for (Map.Entry<String, TriggerProperties.Instance> entry : props.getInstances().entrySet()) {
            TriggerProperties.Instance instance = entry.getValue();
            if (!instance.isEnabled()) {
                continue;
            }
            create(entry.getKey(), instance.getOptions());
            if (instance.isAutoStart()) {
                toStart.add(entry.getKey());
            }
        }

        for (Map.Entry<String, List<EventHandler>> entry : collectHandlers().entrySet()) {
            String triggerName = entry.getKey();
            Trigger trigger = registry.getInstance(triggerName).orElse(null);
            if (trigger == null) {
                if (isDisabled(triggerName)) {
                    throw new BeanCreationException(BEAN_NAME,
                            "@TriggerHandler targets disabled trigger '" + triggerName + "'");
                }
                trigger = create(triggerName, Map.of());
                toStart.add(triggerName);
            }
            entry.getValue().forEach(trigger::addHandler);
        }

        for (String name : toStart) {
            Trigger trigger = registry.getInstance(name).orElseThrow();
            try {
                trigger.start();
            } catch (TriggerException e) {
                throw new BeanCreationException(BEAN_NAME, "Failed to start trigger '" + name + "'", e);
            }
        }
    }

    private Trigger create(String name, Map<String, ?> options) {
        return registry.create(name, options).orElseThrow(() -> new BeanCreationException(BEAN_NAME,
                "Unknown trigger type '" + name + "'; registered types: " + registry.listTriggers()));
    }

    private boolean isDisabled(String triggerName) {
        TriggerProperties.Instance instance = props.getInstances().get(triggerName);
        return instance != null && !instance.isEnabled();
    }

    private Map<String, List<EventHandler>> collectHandlers() {
        List<Object> beans = new ArrayList<>();
        Map<Object, String> beanNames = new IdentityHashMap<>();
        for (Map.Entry<String, Object> entry : beanFactory.getBeansWithAnnotation(TriggerHandler.class).entrySet()) {
            beans.add(entry.getValue());
            beanNames.put(entry.getValue(), entry.getKey());
        }
        AnnotationAwareOrderComparator.sort(beans);

        Map<String, List<EventHandler>> byTrigger = new LinkedHashMap<>();
        for (Object bean : beans) {
            String beanName = beanNames.get(bean);
            if (!(bean instanceof EventHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @TriggerHandler must implement EventHandler, "
                                + "but " + bean.getClass().getName() + " does not");
            }
            TriggerHandler annotation = AnnotationUtils.findAnnotation(bean.getClass(), TriggerHandler.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @TriggerHandler annotation on " + bean.getClass().getName());
            }
            if (annotation.trigger().isEmpty()) {
                throw new BeanCreationException(beanName, "@TriggerHandler trigger must not be empty");
            }
            byTrigger.computeIfAbsent(annotation.trigger(), ignored -> new ArrayList<>()).add(handler);
            logger.fine("Attaching handler bean " + beanName + " to trigger " + annotation.trigger());
        }
        return byTrigger;
    }
}

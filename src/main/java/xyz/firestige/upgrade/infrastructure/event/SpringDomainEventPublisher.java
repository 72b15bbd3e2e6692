package xyz.firestige.upgrade.infrastructure.event;

import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.upgrade.domain.shared.event.DomainEventPublisher;

/**
 * Spring 本地事件总线实现
 * <p>
 * 同步发布，监听器在编排线程内执行。
 */
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(Object event) {
        applicationEventPublisher.publishEvent(event);
    }
}

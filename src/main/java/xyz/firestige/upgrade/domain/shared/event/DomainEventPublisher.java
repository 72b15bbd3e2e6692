package xyz.firestige.upgrade.domain.shared.event;

import java.util.List;

/**
 * 领域事件发布器接口
 * <p>
 * 领域层只依赖该接口；会话持久化成功后由应用层调用。
 */
public interface DomainEventPublisher {

    void publish(Object event);

    default void publishAll(List<?> events) {
        if (events != null) {
            events.forEach(this::publish);
        }
    }
}

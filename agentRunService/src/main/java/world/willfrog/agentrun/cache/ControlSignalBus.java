package world.willfrog.agentrun.cache;

/**
 * 控制信号的发布 / 订阅通道，消息不持久化，订阅之前发出的消息收不到。
 */
public interface ControlSignalBus {

    ControlSubscription subscribe(String... channels);

    void publish(String channel, String payload);
}

package world.willfrog.agentrun.model.event;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * producer 产出的一条响应事件。
 * <p>
 * 事件以 type 字段区分；每个变体都保留 producer 给出的完整 JSON 对象，
 * coordinator 只读取 type/status/message，其余字段原样写入流与持久化记录。
 */
public sealed interface ResponseEvent permits StatusEvent, AssistantEvent, ToolEvent, OtherEvent {

    String TYPE_FIELD = "type";

    ResponseEventType type();

    /**
     * 完整事件对象（含 type 字段）。返回的是内部节点，调用方不得修改。
     */
    ObjectNode payload();

    default String typeName() {
        return payload().path(TYPE_FIELD).asText("");
    }
}

package world.willfrog.agentrun.model.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 响应事件与 JSON 文本之间的转换。
 * <p>
 * 写入共享缓存和 agent_runs.responses 的都是 producer 原始对象，不做字段裁剪。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResponseEventCodec {

    private final ObjectMapper objectMapper;

    public String encode(ResponseEvent event) {
        try {
            return objectMapper.writeValueAsString(event.payload());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Encode response event failed: type=" + event.typeName(), e);
        }
    }

    public ResponseEvent decode(String json) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Response event is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Response event must be a JSON object");
        }
        return fromNode((ObjectNode) node);
    }

    /**
     * 批量解码，无法解析的条目跳过并记录告警。
     */
    public List<ResponseEvent> decodeAll(List<String> jsonList) {
        if (jsonList == null || jsonList.isEmpty()) {
            return List.of();
        }
        List<ResponseEvent> events = new ArrayList<>(jsonList.size());
        for (String json : jsonList) {
            try {
                events.add(decode(json));
            } catch (IllegalArgumentException e) {
                log.warn("Skip malformed response event: {}", StringUtils.abbreviate(json, 300), e);
            }
        }
        return events;
    }

    public ResponseEvent fromNode(ObjectNode node) {
        ObjectNode copy = node.deepCopy();
        return switch (ResponseEventType.fromWire(copy.path(ResponseEvent.TYPE_FIELD).asText(null))) {
            case STATUS -> new StatusEvent(copy);
            case ASSISTANT -> new AssistantEvent(copy);
            case TOOL -> new ToolEvent(copy);
            case OTHER -> new OtherEvent(copy);
        };
    }

    public String toJsonArray(List<ResponseEvent> events) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ResponseEvent event : events == null ? List.<ResponseEvent>of() : events) {
            array.add(event.payload());
        }
        try {
            return objectMapper.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Encode response list failed", e);
        }
    }

    public List<ResponseEvent> fromJsonArray(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Response list is not valid JSON", e);
        }
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<ResponseEvent> events = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (item.isObject()) {
                events.add(fromNode((ObjectNode) item));
            }
        }
        return events;
    }
}

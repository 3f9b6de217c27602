package world.willfrog.agentrun.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.agentrun.common.pojo.credit.CreditUsage;
import world.willfrog.agentrun.model.CreditInfo;
import world.willfrog.agentrun.model.event.ResponseEvent;
import world.willfrog.agentrun.model.event.ToolEvent;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * 从工具结果事件里找出计费注解。
 * <p>
 * 查找顺序：
 * <ol>
 *   <li>事件本身的 _credit_info</li>
 *   <li>metadata 里的 _credit_info（metadata 可能是 JSON 字符串）</li>
 *   <li>content 是 user/assistant 消息、其内容里的 tool_execution 为 execute_data_provider_call 时，按 service_name 现算</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CreditInfoExtractor {

    static final String CREDIT_INFO_FIELD = "_credit_info";
    static final String DATA_PROVIDER_CALL = "execute_data_provider_call";

    private final ObjectMapper objectMapper;
    private final CreditCalculator creditCalculator;

    /**
     * 只有工具结果事件会带计费注解，其它事件直接返回 empty。
     */
    public Optional<CreditInfo> extract(ResponseEvent event) {
        if (!(event instanceof ToolEvent tool)) {
            return Optional.empty();
        }
        try {
            JsonNode direct = tool.payload().get(CREDIT_INFO_FIELD);
            if (direct != null && direct.isObject()) {
                return Optional.of(toCreditInfo(direct));
            }

            JsonNode metadata = readObject(tool.metadata());
            if (metadata != null && metadata.get(CREDIT_INFO_FIELD) != null
                    && metadata.get(CREDIT_INFO_FIELD).isObject()) {
                return Optional.of(toCreditInfo(metadata.get(CREDIT_INFO_FIELD)));
            }

            return fromDataProviderCall(tool.content());
        } catch (Exception e) {
            log.warn("Extract credit info failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<CreditInfo> fromDataProviderCall(JsonNode rawContent) {
        JsonNode content = readObject(rawContent);
        if (content == null) {
            return Optional.empty();
        }
        String role = content.path("role").asText("");
        if (!"user".equals(role) && !"assistant".equals(role)) {
            return Optional.empty();
        }
        JsonNode message = readObject(content.get("content"));
        if (message == null) {
            return Optional.empty();
        }
        JsonNode execution = message.get("tool_execution");
        if (execution == null || !execution.isObject()
                || !DATA_PROVIDER_CALL.equals(execution.path("function_name").asText(null))) {
            return Optional.empty();
        }
        JsonNode arguments = readObject(execution.get("arguments"));
        String serviceName = arguments == null ? null : textOrNull(arguments.get("service_name"));
        if (serviceName == null || serviceName.isBlank()) {
            return Optional.empty();
        }
        String route = textOrNull(arguments.get("route"));
        CreditCalculator.CreditCharge charge = creditCalculator.dataProviderCredits(serviceName, route);
        log.debug("Priced data provider call without credit info: service={}, route={}", serviceName, route);
        return Optional.of(new CreditInfo(charge.toolName(), charge.credits(), charge.details(), serviceName,
                CreditUsage.USAGE_TYPE_TOOL));
    }

    private CreditInfo toCreditInfo(JsonNode node) {
        Map<String, Object> details = Map.of();
        JsonNode detailNode = readObject(node.get("calculation_details"));
        if (detailNode != null) {
            details = objectMapper.convertValue(detailNode, new TypeReference<Map<String, Object>>() {
            });
        }
        return new CreditInfo(
                textOrNull(node.get("tool_name")),
                toDecimal(node.get("credits")),
                details,
                textOrNull(node.get("data_provider_name")),
                textOrNull(node.get("usage_type"))
        );
    }

    /**
     * 对象原样返回，JSON 字符串尝试解析，其它情况返回 null。
     */
    private JsonNode readObject(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            return node;
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (!text.startsWith("{")) {
                return null;
            }
            try {
                JsonNode parsed = objectMapper.readTree(text);
                return parsed != null && parsed.isObject() ? parsed : null;
            } catch (Exception e) {
                return null;
            }
        }
        return null;
    }

    private BigDecimal toDecimal(JsonNode node) {
        if (node == null || node.isNull()) {
            return BigDecimal.ZERO;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    private String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}

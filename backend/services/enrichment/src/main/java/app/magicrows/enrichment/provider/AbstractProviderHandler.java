package app.magicrows.enrichment.provider;

import app.magicrows.enrichment.contract.ContractValidator;
import app.magicrows.enrichment.contract.OutputContract;
import app.magicrows.enrichment.domain.OutputSpecification;
import app.magicrows.enrichment.domain.OutputType;
import app.magicrows.enrichment.error.ProviderResponseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Shared request bookkeeping and response decoding. Subclasses only translate a prompt and
 * contract into their provider's wire format.
 */
public abstract class AbstractProviderHandler implements ProviderHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractProviderHandler.class);
    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[^a-zA-Z0-9_-]");
    private static final int MAX_SCHEMA_NAME_LENGTH = 64;

    protected final ProviderProfile profile;
    protected final ObjectMapper objectMapper;
    private final boolean logPayloads;

    protected AbstractProviderHandler(ProviderProfile profile, ObjectMapper objectMapper, boolean logPayloads) {
        this.profile = profile;
        this.objectMapper = objectMapper;
        this.logPayloads = logPayloads;
    }

    @Override
    public ProviderType type() {
        return profile.type();
    }

    @Override
    public final RawResponse complete(String model, String prompt, double temperature, OutputContract contract) {
        OutputContract effective = profile.structuredOutput() ? contract : null;
        logPayload("request provider={} model={} structured={} prompt={}",
                profile.name(), model, effective != null, prompt);
        RawResponse response;
        try {
            response = send(model, prompt, temperature, effective);
        } catch (RestClientException ex) {
            throw ProviderErrors.translate(type(), ex);
        }
        logPayload("response provider={} model={} finishReason={} text={}",
                profile.name(), response.model(), response.finishReason(), response.text());
        return response;
    }

    protected abstract RawResponse send(String model, String prompt, double temperature, OutputContract contract);

    @Override
    public ParsedOutput parse(RawResponse response, OutputSpecification output, OutputContract contract) {
        String text = response == null ? null : response.text();
        if (text == null || text.isBlank()) {
            throw new ProviderResponseException(
                    type().value() + " returned no textual content for output '" + output.name() + "'", text);
        }
        if (response.truncated()) {
            log.warn("Provider response truncated provider={} output={} finishReason={}",
                    profile.name(), output.name(), response.finishReason());
        }
        if (response.structured()) {
            JsonNode payload = readJson(text);
            if (payload != null && payload.isObject()) {
                return decodeStructured((ObjectNode) payload, text, output, contract);
            }
            if (output.type() == OutputType.JSON) {
                throw new ProviderResponseException(
                        "Structured response for output '" + output.name() + "' is not a JSON object", text);
            }
            log.warn("Structured response is not JSON, falling back to free text provider={} output={}",
                    profile.name(), output.name());
        }
        return decodeFreeText(text, output, contract);
    }

    @Override
    public Optional<TokenUsage> usage(RawResponse response) {
        if (response == null
                || (response.promptTokens() == null
                && response.completionTokens() == null
                && response.totalTokens() == null)) {
            return Optional.empty();
        }
        return Optional.of(TokenUsage.of(response.promptTokens(), response.completionTokens(), response.totalTokens()));
    }

    protected static String schemaName(OutputContract contract) {
        String name = UNSAFE_NAME_CHARS.matcher(contract.name()).replaceAll("_");
        if (name.isEmpty()) {
            name = "output";
        }
        return name.length() > MAX_SCHEMA_NAME_LENGTH ? name.substring(0, MAX_SCHEMA_NAME_LENGTH) : name;
    }

    private ParsedOutput decodeStructured(ObjectNode payload,
                                          String rawText,
                                          OutputSpecification output,
                                          OutputContract contract) {
        JsonNode field = payload.get(output.name());
        if (field == null || field.isNull()) {
            throw new ProviderResponseException(
                    "Response is missing field '" + output.name() + "'", rawText);
        }

        JsonNode valueNode = field;
        String reasoning = null;
        if (contract.withReasoning()) {
            JsonNode value = field.get(OutputContract.VALUE_FIELD);
            JsonNode explanation = field.get(OutputContract.REASONING_FIELD);
            if (!field.isObject() || value == null || explanation == null || !explanation.isTextual()) {
                log.warn("Reasoning requested but not returned in the expected shape provider={} output={}",
                        profile.name(), output.name());
                return ParsedOutput.missingReasoning(rawText);
            }
            valueNode = value;
            reasoning = explanation.asText();
        }

        valueNode = normalizeValue(valueNode, output);
        ObjectNode normalized = payload.deepCopy();
        if (contract.withReasoning()) {
            ObjectNode wrapper = objectMapper.createObjectNode();
            wrapper.set(OutputContract.VALUE_FIELD, valueNode);
            wrapper.put(OutputContract.REASONING_FIELD, reasoning);
            normalized.set(output.name(), wrapper);
        } else {
            normalized.set(output.name(), valueNode);
        }
        ContractValidator.validate(contract, normalized, rawText);

        Object value = decodeValue(valueNode, output, rawText);
        return contract.withReasoning()
                ? ParsedOutput.withReasoning(value, reasoning, rawText)
                : ParsedOutput.of(value, rawText);
    }

    private JsonNode normalizeValue(JsonNode valueNode, OutputSpecification output) {
        JsonNode normalized = valueNode;
        if (output.multiple() && !normalized.isArray()) {
            log.warn("Expected a list but received a single value provider={} output={}",
                    profile.name(), output.name());
            ArrayNode wrapped = objectMapper.createArrayNode();
            wrapped.add(normalized);
            normalized = wrapped;
        }
        if (output.type() != OutputType.JSON) {
            return normalized;
        }
        if (normalized.isArray()) {
            ArrayNode items = objectMapper.createArrayNode();
            normalized.forEach(item -> items.add(jsonAsText(item)));
            return items;
        }
        return jsonAsText(normalized);
    }

    private JsonNode jsonAsText(JsonNode node) {
        if (node.isTextual()) {
            return node;
        }
        return objectMapper.getNodeFactory().textNode(node.toString());
    }

    private Object decodeValue(JsonNode node, OutputSpecification output, String rawText) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<Object> items = new ArrayList<>();
            for (JsonNode item : node) {
                items.add(decodeScalar(item, output, rawText));
            }
            return List.copyOf(items);
        }
        return decodeScalar(node, output, rawText);
    }

    private Object decodeScalar(JsonNode node, OutputSpecification output, String rawText) {
        return switch (output.type()) {
            case NUMBER -> node.decimalValue();
            case JSON -> {
                JsonNode decoded = readJson(node.asText());
                if (decoded == null) {
                    throw new ProviderResponseException(
                            "Output '" + output.name() + "' is not valid JSON: " + node.asText(), rawText);
                }
                yield decoded;
            }
            default -> node.asText();
        };
    }

    private ParsedOutput decodeFreeText(String text, OutputSpecification output, OutputContract contract) {
        if (contract.withReasoning()) {
            JsonNode payload = readJson(text);
            if (payload != null && payload.isObject() && payload.has(output.name())) {
                return decodeStructured((ObjectNode) payload, text, output, contract);
            }
            log.warn("Reasoning requested but free-text response has no structured explanation provider={} output={}",
                    profile.name(), output.name());
            return ParsedOutput.missingReasoning(text);
        }
        return switch (output.type()) {
            case TEXT -> ParsedOutput.of(FreeTextExtractor.extractText(text, output.multiple()), text);
            case CATEGORY -> {
                List<String> matches = FreeTextExtractor.matchCategories(text, output.categoryNames(), output.multiple());
                if (matches.isEmpty()) {
                    log.warn("No allowed category found in free-text response provider={} output={}",
                            profile.name(), output.name());
                    yield ParsedOutput.notExtracted(text);
                }
                yield ParsedOutput.of(output.multiple() ? matches : matches.get(0), text);
            }
            case NUMBER -> {
                Optional<BigDecimal> number = FreeTextExtractor.extractNumber(text);
                if (number.isEmpty()) {
                    log.warn("No number found in free-text response provider={} output={}",
                            profile.name(), output.name());
                    yield ParsedOutput.notExtracted(text);
                }
                yield ParsedOutput.of(output.multiple() ? List.of(number.get()) : number.get(), text);
            }
            case JSON -> {
                JsonNode decoded = readJson(text);
                if (decoded == null) {
                    throw new ProviderResponseException(
                            "Output '" + output.name() + "' is not valid JSON", text);
                }
                if (output.multiple() && !decoded.isArray()) {
                    log.warn("Expected a list but received a single value provider={} output={}",
                            profile.name(), output.name());
                    yield ParsedOutput.of(List.of(decoded), text);
                }
                if (output.multiple()) {
                    List<Object> items = new ArrayList<>();
                    decoded.forEach(items::add);
                    yield ParsedOutput.of(List.copyOf(items), text);
                }
                yield ParsedOutput.of(decoded, text);
            }
        };
    }

    private JsonNode readJson(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(FreeTextExtractor.stripCodeFence(text));
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private void logPayload(String format, Object... args) {
        if (logPayloads) {
            log.info(format, args);
        } else if (log.isDebugEnabled()) {
            log.debug(format, args);
        }
    }
}

package app.magicrows.enrichment.contract;

import app.magicrows.enrichment.error.ProviderResponseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.util.Set;
import java.util.stream.Collectors;

public final class ContractValidator {

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private ContractValidator() {
    }

    public static void validate(OutputContract contract, JsonNode payload, String rawContent) {
        JsonSchema schema = SCHEMA_FACTORY.getSchema(contract.schema());
        Set<ValidationMessage> errors = schema.validate(payload);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ProviderResponseException(
                    "Response violates contract for output '" + contract.name() + "': " + detail,
                    rawContent
            );
        }
    }
}
